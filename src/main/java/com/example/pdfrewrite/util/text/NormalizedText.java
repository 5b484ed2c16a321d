package com.example.pdfrewrite.util.text;

/**
 * 归一化文本及其到原始文本下标的映射
 *
 * indexMap[i] 为归一化字符 i 在原始文本中的来源下标，长度与 text 相同。
 */
public class NormalizedText {

    public static final NormalizedText EMPTY = new NormalizedText("", new int[0]);

    private final String text;
    private final int[] indexMap;

    public NormalizedText(String text, int[] indexMap) {
        if (text.length() != indexMap.length) {
            throw new IllegalArgumentException("归一化文本与下标映射长度不一致: "
                    + text.length() + " vs " + indexMap.length);
        }
        this.text = text;
        this.indexMap = indexMap;
    }

    public String getText() {
        return text;
    }

    public int length() {
        return text.length();
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }

    /**
     * 归一化下标 → 原始下标
     */
    public int rawIndex(int normalizedIndex) {
        return indexMap[normalizedIndex];
    }

    /**
     * 将归一化区间 [start, end) 转换为原始区间 [rawStart, rawEnd)
     *
     * @return 长度为 2 的数组；区间为空时返回 null
     */
    public int[] rawRange(int start, int end) {
        int s = Math.max(0, start);
        int e = Math.min(indexMap.length, end);
        if (e <= s) {
            return null;
        }
        return new int[]{indexMap[s], indexMap[e - 1] + 1};
    }

    @Override
    public String toString() {
        return "NormalizedText{text='" + text + "', length=" + indexMap.length + "}";
    }
}
