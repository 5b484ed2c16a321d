package com.example.pdfrewrite.service.dto;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * 映射上下文（结构化数据协作方提供的 JSON 根对象）
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE,
        setterVisibility = JsonAutoDetect.Visibility.NONE)
public class MappingContext {

    @JsonProperty("run_id")
    private String runId;

    @JsonProperty("questions")
    private List<QuestionContext> questions = new ArrayList<>();

    public String getRunId() {
        return runId;
    }

    public void setRunId(String runId) {
        this.runId = runId;
    }

    public List<QuestionContext> getQuestions() {
        return questions;
    }

    public void setQuestions(List<QuestionContext> questions) {
        this.questions = questions;
    }
}
