package com.example.pdfrewrite.util.locate.dto;

import com.example.pdfrewrite.util.coordinate.Rect;
import com.example.pdfrewrite.util.span.dto.SpanRecord;

/**
 * 页面扫描得到的一处出现
 */
public class PageOccurrence {

    public final SpanRecord span;
    public final int charStart;
    public final int charEnd;
    public final Rect rect;
    public final String text;
    /** 出现处前后最多 32 个字符（跨 span 拼接） */
    public final String prefix;
    public final String suffix;
    /** 几何排序后的序号 */
    public int ordinal;

    public PageOccurrence(SpanRecord span, int charStart, int charEnd, Rect rect,
                          String text, String prefix, String suffix) {
        this.span = span;
        this.charStart = charStart;
        this.charEnd = charEnd;
        this.rect = rect;
        this.text = text;
        this.prefix = prefix;
        this.suffix = suffix;
    }

    public GlyphPath toGlyphPath() {
        return new GlyphPath(span.getBlockIndex(), span.getLineIndex(), span.getSpanIndex(),
                charStart, charEnd, span.getSpanId());
    }

    @Override
    public String toString() {
        return "PageOccurrence{#" + ordinal + " '" + text + "' " + toGlyphPath() + " " + rect + "}";
    }
}
