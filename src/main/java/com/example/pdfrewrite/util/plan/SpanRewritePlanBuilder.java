package com.example.pdfrewrite.util.plan;

import com.example.pdfrewrite.util.locate.dto.GlyphPath;
import com.example.pdfrewrite.util.locate.dto.MappingEntry;
import com.example.pdfrewrite.util.plan.dto.SliceReplacement;
import com.example.pdfrewrite.util.plan.dto.SpanMappingRef;
import com.example.pdfrewrite.util.plan.dto.SpanRewriteEntry;
import com.example.pdfrewrite.util.plan.dto.ValidationFailure;
import com.example.pdfrewrite.util.span.dto.PageGlyphLayout;
import com.example.pdfrewrite.util.span.dto.SpanRecord;
import com.example.pdfrewrite.util.stream.dto.ReplacementRecord;
import com.example.pdfrewrite.util.stream.dto.SegmentExtraction;
import com.example.pdfrewrite.util.stream.dto.TextSegment;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 单页声明式改写计划构建器
 *
 * 不修改内容流，只把替换按视觉 span 汇总为 {@link SpanRewriteEntry}。
 * 一条跨 span 的替换被拆到各 span，替换文本只写在第一个 span 上。
 *
 * 以下切片标记为需要视觉覆盖兜底：记录未被应用到内容流、跨 span、或只能靠紧凑查找确定区间。
 */
public class SpanRewritePlanBuilder {

    private static final float MIN_SCALE = 0.01f;
    private static final float SCALING_TOLERANCE = 0.999f;

    private final PageGlyphLayout layout;
    private final TextWidthMeasurer measurer;
    private final Map<String, SpanRewriteAccumulator> accumulators = new LinkedHashMap<>();
    private final Map<String, Integer> operatorIndexes = new HashMap<>();

    public SpanRewritePlanBuilder(PageGlyphLayout layout, TextWidthMeasurer measurer) {
        this.layout = layout;
        this.measurer = measurer;
    }

    /**
     * 加入替换规划器的输出
     *
     * @param extraction 分段结果，用于记录操作符下标；可为 null
     */
    public void addRecords(List<ReplacementRecord> records, SegmentExtraction extraction) {
        for (ReplacementRecord record : records) {
            boolean fallback = !record.isApplied() || record.getSource() == ReplacementRecord.Source.COMPACT;
            Integer operatorIndex = null;
            if (extraction != null) {
                List<TextSegment> touched = extraction.segmentsOverlapping(record.getStart(), record.getStart() + 1);
                if (!touched.isEmpty()) {
                    operatorIndex = touched.get(0).getOperatorIndex();
                }
            }
            addEntry(record.getEntry(), fallback, operatorIndex);
        }
    }

    /**
     * 加入一个已定位的映射条目（按其字形路径切片）
     *
     * @param forceOverlay  是否强制视觉覆盖
     * @param operatorIndex 所在文本显示操作的下标，未知时为 null
     */
    public void addEntry(MappingEntry entry, boolean forceOverlay, Integer operatorIndex) {
        List<GlyphPath> paths = entry.getMatch().getGlyphPaths();
        boolean crossSpan = paths.size() > 1;
        for (int i = 0; i < paths.size(); i++) {
            GlyphPath path = paths.get(i);
            SpanRecord span = layout.findSpan(path.spanId);
            if (span == null) {
                span = layout.findSpan(path.block, path.line, path.span);
            }
            if (span == null) {
                continue;
            }
            // 跨 span 时各段只能对照 span 自身文本
            String expected = crossSpan ? span.rawSlice(path.charStart, path.charEnd) : entry.getOriginal();
            String replacement = i == 0 ? entry.getReplacement() : "";
            SpanMappingRef ref = new SpanMappingRef(entry.getQLabel(), entry.getEntryIndex(), expected,
                    replacement, path.charStart, path.charEnd, entry.getFingerprintKey());
            SliceReplacement slice = new SliceReplacement(path.charStart, path.charEnd, expected, replacement, ref,
                    forceOverlay || crossSpan);
            SpanRewriteAccumulator accumulator = accumulators.computeIfAbsent(span.getSpanId(),
                    k -> new SpanRewriteAccumulator(layout.findSpan(k)));
            if (accumulator.add(slice) && operatorIndex != null) {
                operatorIndexes.putIfAbsent(span.getSpanId(), operatorIndex);
            }
        }
    }

    /**
     * 生成计划条目，只为至少有一个已接受替换的 span 生成
     */
    public List<SpanRewriteEntry> build() {
        List<SpanRewriteEntry> entries = new ArrayList<>();
        for (SpanRewriteAccumulator accumulator : accumulators.values()) {
            if (accumulator.isEmpty()) {
                continue;
            }
            entries.add(toEntry(accumulator));
        }
        return entries;
    }

    public List<ValidationFailure> getValidationFailures() {
        List<ValidationFailure> failures = new ArrayList<>();
        for (SpanRewriteAccumulator accumulator : accumulators.values()) {
            failures.addAll(accumulator.getFailures());
        }
        return failures;
    }

    private SpanRewriteEntry toEntry(SpanRewriteAccumulator accumulator) {
        SpanRecord span = accumulator.getSpan();
        String original = span.getRawText();
        StringBuilder replaced = new StringBuilder();
        int cursor = 0;
        boolean overlay = false;
        List<SpanMappingRef> mappings = new ArrayList<>();
        for (SliceReplacement slice : accumulator.getSlices()) {
            replaced.append(original, cursor, slice.getStart());
            replaced.append(slice.getReplacement());
            cursor = slice.getEnd();
            overlay |= slice.isOverlayFallback();
            mappings.add(slice.getMapping());
        }
        replaced.append(original.substring(cursor));
        String replacementText = replaced.toString();

        float originalWidth = span.getBbox().width();
        float replacementWidth = measurer.replacementWidth(original, originalWidth, replacementText, span.getFontSize());
        float scale = 1f;
        if (replacementWidth > originalWidth && replacementWidth > 0f) {
            scale = Math.max(originalWidth / replacementWidth, MIN_SCALE);
        }
        boolean requiresScaling = scale < SCALING_TOLERANCE || replacementWidth > originalWidth;

        return new SpanRewriteEntry(span.getPage(), span.getBlockIndex(), span.getLineIndex(), span.getSpanIndex(),
                span.getSpanId(), operatorIndexes.get(span.getSpanId()), original, replacementText,
                span.getFont(), span.getFontSize(), span.getBbox(), span.getMatrix(), originalWidth,
                replacementWidth, scale, mappings, overlay, requiresScaling, accumulator.getFailures());
    }
}
