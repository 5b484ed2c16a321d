package com.example.pdfrewrite.util.stream.dto;

import com.example.pdfrewrite.util.locate.dto.MappingEntry;

/**
 * 替换计划中的一条记录：内容流偏移区间 [start, end) 替换为 replacementText
 *
 * 同一页已接受的记录区间互不重叠。applied 由改写器在成功写回后置位。
 */
public class ReplacementRecord {

    /**
     * 区间来源
     */
    public enum Source {
        /** 几何对齐得到的区间 */
        GEOMETRY,
        /** 内容流文本直接查找 */
        DIRECT,
        /** 字母数字紧凑查找 */
        COMPACT
    }

    private final int start;
    private final int end;
    private final String replacementText;
    private final MappingEntry entry;
    private final Source source;
    private boolean applied;
    private String strategy;

    public ReplacementRecord(int start, int end, String replacementText, MappingEntry entry, Source source) {
        if (end <= start) {
            throw new IllegalArgumentException("替换区间为空: [" + start + "," + end + ")");
        }
        this.start = start;
        this.end = end;
        this.replacementText = replacementText == null ? "" : replacementText;
        this.entry = entry;
        this.source = source;
    }

    public boolean overlaps(ReplacementRecord other) {
        return start < other.end && other.start < end;
    }

    public boolean overlaps(int otherStart, int otherEnd) {
        return start < otherEnd && otherStart < end;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public String getReplacementText() {
        return replacementText;
    }

    public MappingEntry getEntry() {
        return entry;
    }

    public Source getSource() {
        return source;
    }

    public boolean isApplied() {
        return applied;
    }

    public void markApplied(String strategyName) {
        this.applied = true;
        this.strategy = strategyName;
    }

    public void markUnapplied() {
        this.applied = false;
        this.strategy = null;
    }

    public String getStrategy() {
        return strategy;
    }

    @Override
    public String toString() {
        return "ReplacementRecord{[" + start + "," + end + ") -> '" + replacementText + "', source=" + source
                + ", applied=" + applied + "}";
    }
}
