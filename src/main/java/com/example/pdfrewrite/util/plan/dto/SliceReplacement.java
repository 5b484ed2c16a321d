package com.example.pdfrewrite.util.plan.dto;

/**
 * span 原始文本中的一段替换 [start, end)
 */
public class SliceReplacement {

    private final int start;
    private final int end;
    private final String expected;
    private final String replacement;
    private final SpanMappingRef mapping;
    private final boolean overlayFallback;

    public SliceReplacement(int start, int end, String expected, String replacement,
                            SpanMappingRef mapping, boolean overlayFallback) {
        this.start = start;
        this.end = end;
        this.expected = expected;
        this.replacement = replacement == null ? "" : replacement;
        this.mapping = mapping;
        this.overlayFallback = overlayFallback;
    }

    /**
     * 区间修正后的副本
     */
    public SliceReplacement withRange(int newStart, int newEnd) {
        return new SliceReplacement(newStart, newEnd, expected, replacement, mapping, overlayFallback);
    }

    public boolean contains(SliceReplacement other) {
        return start <= other.start && other.end <= end;
    }

    public boolean overlaps(SliceReplacement other) {
        return start < other.end && other.start < end;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public String getExpected() {
        return expected;
    }

    public String getReplacement() {
        return replacement;
    }

    public SpanMappingRef getMapping() {
        return mapping;
    }

    public boolean isOverlayFallback() {
        return overlayFallback;
    }

    @Override
    public String toString() {
        return "[" + start + "," + end + ") '" + expected + "' -> '" + replacement + "'";
    }
}
