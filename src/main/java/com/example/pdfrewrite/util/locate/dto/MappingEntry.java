package com.example.pdfrewrite.util.locate.dto;

import com.example.pdfrewrite.util.coordinate.Rect;
import com.example.pdfrewrite.util.text.TextNormalizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 一条子串替换映射（已完成上下文计算）
 *
 * 构造时校验 original / replacement 归一化后非空；可选字段通过 Optional 访问。
 * fingerprintKey = sha1(prefix|original|suffix|occurrence)，在同一页只能被使用一次。
 */
public class MappingEntry {

    private final String qLabel;
    private final int entryIndex;
    private final String original;
    private final String replacement;

    private Integer pageIndex;
    private Rect stemBbox;
    private Rect selectionBbox;
    private List<List<Double>> selectionQuads = new ArrayList<>();
    private List<String> spanIds = new ArrayList<>();
    private String stemText = "";
    private int startPos;
    private int endPos;
    private String prefix = "";
    private String suffix = "";
    private Integer occurrenceIndex;
    private String fingerprintKey;
    private GlyphPath glyphPathHint;

    private final MatchMetadata match = new MatchMetadata();

    public MappingEntry(String qLabel, int entryIndex, String original, String replacement) {
        if (TextNormalizer.normalizeForMatch(original).isEmpty()) {
            throw new IllegalArgumentException("映射原文为空: q=" + qLabel + ", entry=" + entryIndex);
        }
        if (TextNormalizer.normalizeForMatch(replacement).isEmpty()) {
            throw new IllegalArgumentException("映射替换文本为空: q=" + qLabel + ", entry=" + entryIndex);
        }
        this.qLabel = qLabel;
        this.entryIndex = entryIndex;
        this.original = original;
        this.replacement = replacement;
    }

    /**
     * 期望的内容区域：优先选区，其次题干框
     */
    public Optional<Rect> clipRect() {
        if (selectionBbox != null) {
            return Optional.of(selectionBbox);
        }
        return Optional.ofNullable(stemBbox);
    }

    /**
     * 选区矩形：显式 bbox 优先，否则由四边形合成
     */
    public Optional<Rect> selectionRect() {
        if (selectionBbox != null) {
            return Optional.of(selectionBbox);
        }
        return Optional.ofNullable(Rect.fromQuads(selectionQuads));
    }

    public Optional<Integer> occurrenceIndex() {
        return Optional.ofNullable(occurrenceIndex);
    }

    public Optional<GlyphPath> glyphPathHint() {
        return Optional.ofNullable(glyphPathHint);
    }

    public boolean hasSelectionQuads() {
        return selectionQuads != null && !selectionQuads.isEmpty();
    }

    public String getQLabel() {
        return qLabel;
    }

    public int getEntryIndex() {
        return entryIndex;
    }

    public String getOriginal() {
        return original;
    }

    public String getReplacement() {
        return replacement;
    }

    public Integer getPageIndex() {
        return pageIndex;
    }

    public void setPageIndex(Integer pageIndex) {
        this.pageIndex = pageIndex;
    }

    public Rect getStemBbox() {
        return stemBbox;
    }

    public void setStemBbox(Rect stemBbox) {
        this.stemBbox = stemBbox;
    }

    public Rect getSelectionBbox() {
        return selectionBbox;
    }

    public void setSelectionBbox(Rect selectionBbox) {
        this.selectionBbox = selectionBbox;
    }

    public List<List<Double>> getSelectionQuads() {
        return selectionQuads;
    }

    public void setSelectionQuads(List<List<Double>> selectionQuads) {
        this.selectionQuads = selectionQuads == null ? new ArrayList<>() : selectionQuads;
    }

    public List<String> getSpanIds() {
        return spanIds;
    }

    public void setSpanIds(List<String> spanIds) {
        this.spanIds = spanIds == null ? new ArrayList<>() : spanIds;
    }

    public String getStemText() {
        return stemText;
    }

    public void setStemText(String stemText) {
        this.stemText = stemText == null ? "" : stemText;
    }

    public int getStartPos() {
        return startPos;
    }

    public void setStartPos(int startPos) {
        this.startPos = startPos;
    }

    public int getEndPos() {
        return endPos;
    }

    public void setEndPos(int endPos) {
        this.endPos = endPos;
    }

    public String getPrefix() {
        return prefix;
    }

    public void setPrefix(String prefix) {
        this.prefix = prefix == null ? "" : prefix;
    }

    public String getSuffix() {
        return suffix;
    }

    public void setSuffix(String suffix) {
        this.suffix = suffix == null ? "" : suffix;
    }

    public Integer getOccurrenceIndex() {
        return occurrenceIndex;
    }

    public void setOccurrenceIndex(Integer occurrenceIndex) {
        this.occurrenceIndex = occurrenceIndex;
    }

    public String getFingerprintKey() {
        return fingerprintKey;
    }

    public void setFingerprintKey(String fingerprintKey) {
        this.fingerprintKey = fingerprintKey;
    }

    public GlyphPath getGlyphPathHint() {
        return glyphPathHint;
    }

    public void setGlyphPathHint(GlyphPath glyphPathHint) {
        this.glyphPathHint = glyphPathHint;
    }

    public MatchMetadata getMatch() {
        return match;
    }

    @Override
    public String toString() {
        return "MappingEntry{q=" + qLabel + "#" + entryIndex + ", '" + original + "' -> '" + replacement
                + "', page=" + pageIndex + ", occurrence=" + occurrenceIndex + "}";
    }
}
