package com.example.pdfrewrite.util.locate.dto;

import com.example.pdfrewrite.util.coordinate.Rect;

import java.util.ArrayList;
import java.util.List;

/**
 * 定位后写回映射条目的匹配信息，供规划、改写、覆盖层和校验使用
 */
public class MatchMetadata {

    private String matchedText;
    private Rect rect;
    private String font;
    private float fontSize;
    private int spanLength;
    private LocateMethod method;
    private Integer occurrenceOrdinal;
    private List<GlyphPath> glyphPaths = new ArrayList<>();
    private List<String> spanIds = new ArrayList<>();

    /** 内容流字符区间（几何对齐得到），未对齐时为 null */
    private Integer streamStart;
    private Integer streamEnd;
    private Double alignmentConfidence;

    public GlyphPath getPrimaryGlyphPath() {
        return glyphPaths.isEmpty() ? null : glyphPaths.get(0);
    }

    public boolean hasStreamRange() {
        return streamStart != null && streamEnd != null && streamEnd > streamStart;
    }

    public String getMatchedText() {
        return matchedText;
    }

    public void setMatchedText(String matchedText) {
        this.matchedText = matchedText;
    }

    public Rect getRect() {
        return rect;
    }

    public void setRect(Rect rect) {
        this.rect = rect;
    }

    public String getFont() {
        return font;
    }

    public void setFont(String font) {
        this.font = font;
    }

    public float getFontSize() {
        return fontSize;
    }

    public void setFontSize(float fontSize) {
        this.fontSize = fontSize;
    }

    public int getSpanLength() {
        return spanLength;
    }

    public void setSpanLength(int spanLength) {
        this.spanLength = spanLength;
    }

    public LocateMethod getMethod() {
        return method;
    }

    public void setMethod(LocateMethod method) {
        this.method = method;
    }

    public Integer getOccurrenceOrdinal() {
        return occurrenceOrdinal;
    }

    public void setOccurrenceOrdinal(Integer occurrenceOrdinal) {
        this.occurrenceOrdinal = occurrenceOrdinal;
    }

    public List<GlyphPath> getGlyphPaths() {
        return glyphPaths;
    }

    public void setGlyphPaths(List<GlyphPath> glyphPaths) {
        this.glyphPaths = glyphPaths;
    }

    public List<String> getSpanIds() {
        return spanIds;
    }

    public void setSpanIds(List<String> spanIds) {
        this.spanIds = spanIds;
    }

    public Integer getStreamStart() {
        return streamStart;
    }

    public void setStreamStart(Integer streamStart) {
        this.streamStart = streamStart;
    }

    public Integer getStreamEnd() {
        return streamEnd;
    }

    public void setStreamEnd(Integer streamEnd) {
        this.streamEnd = streamEnd;
    }

    public Double getAlignmentConfidence() {
        return alignmentConfidence;
    }

    public void setAlignmentConfidence(Double alignmentConfidence) {
        this.alignmentConfidence = alignmentConfidence;
    }

    @Override
    public String toString() {
        return "MatchMetadata{text='" + matchedText + "', rect=" + rect + ", method=" + method
                + ", paths=" + glyphPaths + ", stream=[" + streamStart + "," + streamEnd + ")"
                + ", confidence=" + alignmentConfidence + "}";
    }
}
