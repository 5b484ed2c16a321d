package com.example.pdfrewrite.util.span.dto;

import com.example.pdfrewrite.util.coordinate.Rect;
import com.example.pdfrewrite.util.text.NormalizedText;
import com.example.pdfrewrite.util.text.TextNormalizer;

import java.util.Collections;
import java.util.List;

/**
 * 页面上一段同字体同字号的连续字形（span）
 *
 * rawText 的第 i 个字符对应 glyphs 的第 i 项；normalized 记录归一化文本到 rawText 下标的映射。
 * 每页构建一次，由 {@code SpanIndex} 按运行缓存。
 */
public class SpanRecord {

    private final int page;
    private final int blockIndex;
    private final int lineIndex;
    private final int spanIndex;
    private final String font;
    private final float fontSize;
    private final Rect bbox;
    private final float[] matrix;
    private final List<GlyphBox> glyphs;
    private final String rawText;
    private final NormalizedText normalized;

    public SpanRecord(int page, int blockIndex, int lineIndex, int spanIndex,
                      String font, float fontSize, float[] matrix, List<GlyphBox> glyphs) {
        this.page = page;
        this.blockIndex = blockIndex;
        this.lineIndex = lineIndex;
        this.spanIndex = spanIndex;
        this.font = font;
        this.fontSize = fontSize;
        this.matrix = matrix;
        this.glyphs = Collections.unmodifiableList(glyphs);

        StringBuilder sb = new StringBuilder(glyphs.size());
        Rect box = null;
        for (GlyphBox g : glyphs) {
            sb.append(g.text);
            box = box == null ? g.rect : box.union(g.rect);
        }
        this.rawText = sb.toString();
        this.bbox = box;
        this.normalized = TextNormalizer.buildNormalizedMap(rawText);
    }

    /**
     * 生成 span 标识，格式：page{p}:block{b}:line{l}:span{s}
     */
    public static String formatSpanId(int page, int block, int line, int span) {
        return "page" + page + ":block" + block + ":line" + line + ":span" + span;
    }

    public String getSpanId() {
        return formatSpanId(page, blockIndex, lineIndex, spanIndex);
    }

    /**
     * 原始字符区间 [start, end) 的外接矩形，区间无效时返回 null
     */
    public Rect rectForRawRange(int start, int end) {
        int s = Math.max(0, start);
        int e = Math.min(glyphs.size(), end);
        Rect rect = null;
        for (int i = s; i < e; i++) {
            Rect r = glyphs.get(i).rect;
            rect = rect == null ? r : rect.union(r);
        }
        return rect;
    }

    public String rawSlice(int start, int end) {
        int s = Math.max(0, Math.min(start, rawText.length()));
        int e = Math.max(s, Math.min(end, rawText.length()));
        return rawText.substring(s, e);
    }

    public int getPage() {
        return page;
    }

    public int getBlockIndex() {
        return blockIndex;
    }

    public int getLineIndex() {
        return lineIndex;
    }

    public int getSpanIndex() {
        return spanIndex;
    }

    public String getFont() {
        return font;
    }

    public float getFontSize() {
        return fontSize;
    }

    public Rect getBbox() {
        return bbox;
    }

    public float[] getMatrix() {
        return matrix;
    }

    public List<GlyphBox> getGlyphs() {
        return glyphs;
    }

    public String getRawText() {
        return rawText;
    }

    public NormalizedText getNormalized() {
        return normalized;
    }

    @Override
    public String toString() {
        return getSpanId() + " '" + TextNormalizer.truncate(rawText, 40) + "' " + font + "@" + fontSize + " " + bbox;
    }
}
