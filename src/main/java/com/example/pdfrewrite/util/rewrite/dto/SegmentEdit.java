package com.example.pdfrewrite.util.rewrite.dto;

import com.example.pdfrewrite.util.stream.dto.ReplacementRecord;

/**
 * 一个文本段内的局部编辑：段内区间 [start, end) 替换为 replacement
 *
 * 跨段的替换记录只在第一个段中写入替换文本，后续段的编辑替换为空串（continuation 为 true）。
 */
public class SegmentEdit {

    public final int start;
    public final int end;
    public final String replacement;
    public final ReplacementRecord record;
    public final boolean continuation;

    public SegmentEdit(int start, int end, String replacement, ReplacementRecord record) {
        this(start, end, replacement, record, false);
    }

    public SegmentEdit(int start, int end, String replacement, ReplacementRecord record, boolean continuation) {
        this.start = start;
        this.end = end;
        this.replacement = replacement == null ? "" : replacement;
        this.record = record;
        this.continuation = continuation;
    }

    public boolean contains(int offset) {
        return offset >= start && offset < end;
    }

    /**
     * 偏移严格位于区间内部（不含两端）
     */
    public boolean strictlyInside(int offset) {
        return offset > start && offset < end;
    }

    @Override
    public String toString() {
        return "[" + start + "," + end + ")->'" + replacement + "'";
    }
}
