package com.example.pdfrewrite.util.span.dto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一页的字形布局：按 (block, line, span) 排序的 span 列表
 *
 * 顺序来自内容流，近似阅读顺序但不保证；需要真实阅读顺序时使用 {@link #spansInReadingOrder()}。
 */
public class PageGlyphLayout {

    private final int page;
    private final float pageWidth;
    private final float pageHeight;
    private final List<SpanRecord> spans;
    private final Map<String, SpanRecord> spansById = new LinkedHashMap<>();

    public PageGlyphLayout(int page, float pageWidth, float pageHeight, List<SpanRecord> spans) {
        this.page = page;
        this.pageWidth = pageWidth;
        this.pageHeight = pageHeight;
        List<SpanRecord> ordered = new ArrayList<>(spans);
        ordered.sort(Comparator.comparingInt(SpanRecord::getBlockIndex)
                .thenComparingInt(SpanRecord::getLineIndex)
                .thenComparingInt(SpanRecord::getSpanIndex));
        this.spans = Collections.unmodifiableList(ordered);
        for (SpanRecord span : ordered) {
            spansById.put(span.getSpanId(), span);
        }
    }

    public SpanRecord findSpan(String spanId) {
        return spanId == null ? null : spansById.get(spanId);
    }

    public SpanRecord findSpan(int block, int line, int span) {
        return spansById.get(SpanRecord.formatSpanId(page, block, line, span));
    }

    /**
     * 按几何位置（自上而下、自左向右）排序的 span
     */
    public List<SpanRecord> spansInReadingOrder() {
        List<SpanRecord> sorted = new ArrayList<>(spans);
        sorted.sort(Comparator.comparingDouble((SpanRecord s) -> Math.round(s.getBbox().y0 * 1000f) / 1000f)
                .thenComparingDouble(s -> s.getBbox().x0));
        return sorted;
    }

    public int getPage() {
        return page;
    }

    public float getPageWidth() {
        return pageWidth;
    }

    public float getPageHeight() {
        return pageHeight;
    }

    public List<SpanRecord> getSpans() {
        return spans;
    }

    public int getGlyphCount() {
        int count = 0;
        for (SpanRecord span : spans) {
            count += span.getGlyphs().size();
        }
        return count;
    }
}
