package com.example.pdfrewrite.util.align;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 字符序列匹配块计算（最长公共子串递归分解）
 *
 * <h3>算法</h3>
 * 在 a[alo:ahi] 与 b[blo:bhi] 中找最长公共子串，然后对其左右两侧递归，得到一组
 * 不交叉、单调递增的匹配块 (i, j, size)。
 *
 * autojunk 开启且 b 长度不少于 200 时，出现次数超过 1% 的高频字符（通常是空格）不参与起点查找，
 * 只在匹配块两端延伸时被吸收。整页文本对齐时关闭。
 *
 * 用于字形文本与内容流文本的对齐，以及 span 文本的相似度评分。
 */
public class SequenceMatcher {

    private final String a;
    private final String b;
    private final Map<Character, List<Integer>> b2j = new HashMap<>();
    private final boolean autojunk;
    private List<int[]> matchingBlocks;

    public SequenceMatcher(String a, String b) {
        this(a, b, true);
    }

    /**
     * @param autojunk 是否剪除 b 中的高频字符
     */
    public SequenceMatcher(String a, String b, boolean autojunk) {
        this.a = a == null ? "" : a;
        this.b = b == null ? "" : b;
        this.autojunk = autojunk;
        indexB();
    }

    private void indexB() {
        for (int j = 0; j < b.length(); j++) {
            b2j.computeIfAbsent(b.charAt(j), k -> new ArrayList<>()).add(j);
        }
        int n = b.length();
        if (autojunk && n >= 200) {
            int threshold = n / 100 + 1;
            b2j.values().removeIf(list -> list.size() > threshold);
        }
    }

    /**
     * 在指定区间内查找最长匹配
     *
     * @return {i, j, size}
     */
    int[] findLongestMatch(int alo, int ahi, int blo, int bhi) {
        int besti = alo;
        int bestj = blo;
        int bestsize = 0;
        Map<Integer, Integer> j2len = new HashMap<>();
        for (int i = alo; i < ahi; i++) {
            Map<Integer, Integer> newj2len = new HashMap<>();
            List<Integer> positions = b2j.get(a.charAt(i));
            if (positions != null) {
                int from = Collections.binarySearch(positions, blo);
                for (int p = from < 0 ? -from - 1 : from; p < positions.size(); p++) {
                    int j = positions.get(p);
                    if (j >= bhi) {
                        break;
                    }
                    int k = j2len.getOrDefault(j - 1, 0) + 1;
                    newj2len.put(j, k);
                    if (k > bestsize) {
                        besti = i - k + 1;
                        bestj = j - k + 1;
                        bestsize = k;
                    }
                }
            }
            j2len = newj2len;
        }

        // 向两端延伸，吸收被忽略的高频字符
        while (besti > alo && bestj > blo && a.charAt(besti - 1) == b.charAt(bestj - 1)) {
            besti--;
            bestj--;
            bestsize++;
        }
        while (besti + bestsize < ahi && bestj + bestsize < bhi
                && a.charAt(besti + bestsize) == b.charAt(bestj + bestsize)) {
            bestsize++;
        }
        return new int[]{besti, bestj, bestsize};
    }

    /**
     * 获取全部匹配块，按 i 递增，相邻块已合并
     */
    public List<int[]> getMatchingBlocks() {
        if (matchingBlocks != null) {
            return matchingBlocks;
        }
        List<int[]> blocks = new ArrayList<>();
        Deque<int[]> queue = new ArrayDeque<>();
        queue.push(new int[]{0, a.length(), 0, b.length()});
        while (!queue.isEmpty()) {
            int[] q = queue.pop();
            int alo = q[0];
            int ahi = q[1];
            int blo = q[2];
            int bhi = q[3];
            int[] m = findLongestMatch(alo, ahi, blo, bhi);
            int i = m[0];
            int j = m[1];
            int k = m[2];
            if (k > 0) {
                blocks.add(m);
                if (alo < i && blo < j) {
                    queue.push(new int[]{alo, i, blo, j});
                }
                if (i + k < ahi && j + k < bhi) {
                    queue.push(new int[]{i + k, ahi, j + k, bhi});
                }
            }
        }
        blocks.sort((x, y) -> x[0] != y[0] ? Integer.compare(x[0], y[0]) : Integer.compare(x[1], y[1]));

        List<int[]> merged = new ArrayList<>();
        for (int[] block : blocks) {
            if (!merged.isEmpty()) {
                int[] last = merged.get(merged.size() - 1);
                if (last[0] + last[2] == block[0] && last[1] + last[2] == block[1]) {
                    last[2] += block[2];
                    continue;
                }
            }
            merged.add(new int[]{block[0], block[1], block[2]});
        }
        matchingBlocks = merged;
        return merged;
    }

    /**
     * a 中每个下标在 b 中的对应下标，未匹配为 -1
     */
    public int[] mapAtoB() {
        int[] mapping = new int[a.length()];
        Arrays.fill(mapping, -1);
        for (int[] block : getMatchingBlocks()) {
            for (int k = 0; k < block[2]; k++) {
                mapping[block[0] + k] = block[1] + k;
            }
        }
        return mapping;
    }

    /**
     * 相似度：2 * 匹配字符数 / 总长度，范围 [0, 1]
     */
    public double ratio() {
        int total = a.length() + b.length();
        if (total == 0) {
            return 1.0;
        }
        int matches = 0;
        for (int[] block : getMatchingBlocks()) {
            matches += block[2];
        }
        return 2.0 * matches / total;
    }
}
