package com.example.pdfrewrite.service.dto;

import com.example.pdfrewrite.util.locate.dto.GlyphPath;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * 题目中的一条子串映射（映射上下文 JSON 输入）
 *
 * start_pos / end_pos 为原文在题干文本中的字符区间，要求 end_pos > start_pos。
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE,
        setterVisibility = JsonAutoDetect.Visibility.NONE)
public class SubstringMappingInput {

    @JsonProperty("original")
    private String original;

    @JsonProperty("replacement")
    private String replacement;

    @JsonProperty("start_pos")
    private Integer startPos;

    @JsonProperty("end_pos")
    private Integer endPos;

    @JsonProperty("selection_page")
    private Integer selectionPage;

    @JsonProperty("selection_bbox")
    private List<Double> selectionBbox;

    @JsonProperty("selection_quads")
    private List<List<Double>> selectionQuads;

    @JsonProperty("selection_span_ids")
    @JsonAlias({"span_ids", "spans"})
    private List<String> selectionSpanIds = new ArrayList<>();

    /** 已知的字形路径（上一次渲染的匹配结果） */
    @JsonProperty("glyph_path")
    private GlyphPath glyphPath;

    public SubstringMappingInput() {
    }

    public SubstringMappingInput(String original, String replacement, Integer startPos, Integer endPos) {
        this.original = original;
        this.replacement = replacement;
        this.startPos = startPos;
        this.endPos = endPos;
    }

    public String getOriginal() {
        return original;
    }

    public void setOriginal(String original) {
        this.original = original;
    }

    public String getReplacement() {
        return replacement;
    }

    public void setReplacement(String replacement) {
        this.replacement = replacement;
    }

    public Integer getStartPos() {
        return startPos;
    }

    public void setStartPos(Integer startPos) {
        this.startPos = startPos;
    }

    public Integer getEndPos() {
        return endPos;
    }

    public void setEndPos(Integer endPos) {
        this.endPos = endPos;
    }

    public Integer getSelectionPage() {
        return selectionPage;
    }

    public void setSelectionPage(Integer selectionPage) {
        this.selectionPage = selectionPage;
    }

    public List<Double> getSelectionBbox() {
        return selectionBbox;
    }

    public void setSelectionBbox(List<Double> selectionBbox) {
        this.selectionBbox = selectionBbox;
    }

    public List<List<Double>> getSelectionQuads() {
        return selectionQuads;
    }

    public void setSelectionQuads(List<List<Double>> selectionQuads) {
        this.selectionQuads = selectionQuads;
    }

    public List<String> getSelectionSpanIds() {
        return selectionSpanIds;
    }

    public void setSelectionSpanIds(List<String> selectionSpanIds) {
        this.selectionSpanIds = selectionSpanIds;
    }

    public GlyphPath getGlyphPath() {
        return glyphPath;
    }

    public void setGlyphPath(GlyphPath glyphPath) {
        this.glyphPath = glyphPath;
    }
}
