package com.example.pdfrewrite.util.text;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 紧凑比对文本及其到原始下标的映射
 *
 * 用于空白、重音、标点漂移时的兜底查找：在紧凑文本中命中后，用 {@link #rawRange(int, int)} 换回原始区间。
 */
public class CompactText {

    public final String text;
    private final List<Integer> rawIndex;

    private CompactText(String text, List<Integer> rawIndex) {
        this.text = text;
        this.rawIndex = rawIndex;
    }

    /**
     * 去重音、去空白、转小写（连字经 NFKD 展开）
     *
     * 示例："caf\u00E9 index i" → "cafeindexi"
     */
    public static CompactText folded(String raw) {
        StringBuilder sb = new StringBuilder();
        List<Integer> map = new ArrayList<>();
        if (raw == null) {
            return new CompactText("", map);
        }
        for (int i = 0; i < raw.length(); i++) {
            char ch = raw.charAt(i);
            if (TextNormalizer.isZeroWidth(ch)) {
                continue;
            }
            String folded = TextNormalizer.foldAccents(String.valueOf(ch)).toLowerCase(Locale.ROOT);
            for (int k = 0; k < folded.length(); k++) {
                char c = folded.charAt(k);
                if (!TextNormalizer.isWhitespace(c)) {
                    sb.append(c);
                    map.add(i);
                }
            }
        }
        return new CompactText(sb.toString(), map);
    }

    /**
     * 在 {@link #folded(String)} 基础上只保留小写字母和数字
     */
    public static CompactText alphanumeric(String raw) {
        CompactText folded = folded(raw);
        StringBuilder sb = new StringBuilder();
        List<Integer> map = new ArrayList<>();
        for (int i = 0; i < folded.text.length(); i++) {
            char c = folded.text.charAt(i);
            if ((c >= '0' && c <= '9') || (c >= 'a' && c <= 'z')) {
                sb.append(c);
                map.add(folded.rawIndex.get(i));
            }
        }
        return new CompactText(sb.toString(), map);
    }

    /**
     * 紧凑区间 [start, end) 对应的原始区间，无效时返回 null
     */
    public int[] rawRange(int start, int end) {
        if (end <= start || start < 0 || end > rawIndex.size()) {
            return null;
        }
        return new int[]{rawIndex.get(start), rawIndex.get(end - 1) + 1};
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }
}
