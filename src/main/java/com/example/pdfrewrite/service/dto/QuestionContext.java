package com.example.pdfrewrite.service.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * 一道题目的上下文：题干文本、所在页与区域、以及子串映射列表
 *
 * page 为 1 基页码（0 也按第一页处理）。
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE,
        setterVisibility = JsonAutoDetect.Visibility.NONE)
public class QuestionContext {

    @JsonProperty("q_label")
    @JsonAlias({"q_number", "question_number"})
    private String qLabel;

    @JsonProperty("stem_text")
    private String stemText;

    @JsonProperty("page")
    private Integer page;

    @JsonProperty("stem_bbox")
    private List<Double> stemBbox;

    @JsonProperty("stem_spans")
    private List<String> stemSpans = new ArrayList<>();

    @JsonProperty("substring_mappings")
    private List<SubstringMappingInput> substringMappings = new ArrayList<>();

    public QuestionContext() {
    }

    public QuestionContext(String qLabel, String stemText, Integer page) {
        this.qLabel = qLabel;
        this.stemText = stemText;
        this.page = page;
    }

    public String getQLabel() {
        return qLabel;
    }

    public void setQLabel(String qLabel) {
        this.qLabel = qLabel;
    }

    public String getStemText() {
        return stemText;
    }

    public void setStemText(String stemText) {
        this.stemText = stemText;
    }

    public Integer getPage() {
        return page;
    }

    public void setPage(Integer page) {
        this.page = page;
    }

    public List<Double> getStemBbox() {
        return stemBbox;
    }

    public void setStemBbox(List<Double> stemBbox) {
        this.stemBbox = stemBbox;
    }

    public List<String> getStemSpans() {
        return stemSpans;
    }

    public void setStemSpans(List<String> stemSpans) {
        this.stemSpans = stemSpans;
    }

    public List<SubstringMappingInput> getSubstringMappings() {
        return substringMappings;
    }

    public void setSubstringMappings(List<SubstringMappingInput> substringMappings) {
        this.substringMappings = substringMappings;
    }
}
