package com.example.pdfrewrite.util.rewrite;

/**
 * 等宽替代字体的字号计算
 *
 * 宽度按 字符数 × 字号 × 等宽比例 估算（Courier 的字宽恰为 0.6em）。
 * <ul>
 *   <li>替换文本不长于原文：字号限制在 [6, 12]</li>
 *   <li>替换文本更长：字号限制在 [4, 16]</li>
 *   <li>理论字号低于最小可读字号时按最小字号截断，末尾加 "..."；可容纳不超过 3 个字符时只保留首字符或空串</li>
 *   <li>剩余宽度差超过 0.1pt 时用一个字距值补齐（千分之一 em）</li>
 * </ul>
 */
public class SubstituteFontSizing {

    public static final String ELLIPSIS = "...";

    private static final float SAME_LENGTH_MIN = 6f;
    private static final float SAME_LENGTH_MAX = 12f;
    private static final float LONGER_MIN = 4f;
    private static final float LONGER_MAX = 16f;
    private static final float SPACING_TOLERANCE = 0.1f;

    private final float charWidthRatio;
    private final float minReadableSize;

    public SubstituteFontSizing() {
        this(0.6f, 4f);
    }

    public SubstituteFontSizing(float charWidthRatio, float minReadableSize) {
        this.charWidthRatio = charWidthRatio;
        this.minReadableSize = minReadableSize;
    }

    /**
     * 计算替换文本在原宽度内的排布
     *
     * @param text           替换文本（非空）
     * @param originalWidth  原文宽度（pt）
     * @param originalLength 原文字符数
     */
    public Fit fit(String text, float originalWidth, int originalLength) {
        if (text == null || text.isEmpty() || originalWidth <= 0f) {
            return new Fit("", 0f, 0f, 0f);
        }

        String fitted = text;
        float required = requiredSize(fitted, originalWidth);
        if (required < minReadableSize) {
            fitted = abbreviate(fitted, originalWidth);
            if (fitted.isEmpty()) {
                return new Fit("", 0f, 0f, 0f);
            }
            required = requiredSize(fitted, originalWidth);
        }

        float size;
        if (fitted.length() <= originalLength) {
            size = Math.max(SAME_LENGTH_MIN, Math.min(required, SAME_LENGTH_MAX));
        } else {
            size = Math.max(LONGER_MIN, Math.min(required, LONGER_MAX));
        }

        float width = fitted.length() * size * charWidthRatio;
        float diff = originalWidth - width;
        float spacing = Math.abs(diff) > SPACING_TOLERANCE ? -(diff * 1000f) / size : 0f;
        return new Fit(fitted, size, width, spacing);
    }

    /**
     * 按最小可读字号截断
     *
     * 示例：宽 20pt、最小字号 4 → 最多 8 个字符 → "abcde..."
     */
    public String abbreviate(String text, float originalWidth) {
        int maxChars = (int) (originalWidth / (minReadableSize * charWidthRatio));
        if (maxChars >= text.length()) {
            return text;
        }
        if (maxChars <= 3) {
            return maxChars >= 1 ? text.substring(0, 1) : "";
        }
        return text.substring(0, maxChars - 3) + ELLIPSIS;
    }

    /**
     * 空替换文本：用一个字距值吃掉原宽度
     */
    public float spacingForRemoval(float originalWidth, float currentFontSize) {
        if (currentFontSize <= 0f) {
            return 0f;
        }
        return -(originalWidth * 1000f) / currentFontSize;
    }

    /**
     * 估算宽度：字符数 × 字号 × 比例
     */
    public float estimateWidth(int charCount, float fontSize) {
        return charCount * fontSize * charWidthRatio;
    }

    private float requiredSize(String text, float originalWidth) {
        return originalWidth / (text.length() * charWidthRatio);
    }

    /**
     * 排布结果
     */
    public static class Fit {
        public final String text;
        public final float fontSize;
        public final float width;
        /** TJ 数组中补齐宽度的字距值，0 表示不需要 */
        public final float spacing;

        public Fit(String text, float fontSize, float width, float spacing) {
            this.text = text;
            this.fontSize = fontSize;
            this.width = width;
            this.spacing = spacing;
        }

        public boolean isEmpty() {
            return text.isEmpty();
        }

        public boolean isAbbreviated(String requested) {
            return !text.equals(requested);
        }

        @Override
        public String toString() {
            return "Fit{'" + text + "', size=" + fontSize + ", width=" + width + ", spacing=" + spacing + "}";
        }
    }
}
