package com.example.pdfrewrite.util.plan.dto;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 计划校验失败：声明区间上的文本与期望原文不一致，且恢复查找也没有找到
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class ValidationFailure {

    @JsonProperty("span_id")
    private final String spanId;
    @JsonProperty("q_label")
    private final String qLabel;
    @JsonProperty("expected")
    private final String expected;
    @JsonProperty("actual")
    private final String actual;
    @JsonProperty("start")
    private final int start;
    @JsonProperty("end")
    private final int end;

    public ValidationFailure(String spanId, String qLabel, String expected, String actual, int start, int end) {
        this.spanId = spanId;
        this.qLabel = qLabel;
        this.expected = expected;
        this.actual = actual;
        this.start = start;
        this.end = end;
    }

    public String getSpanId() {
        return spanId;
    }

    public String getQLabel() {
        return qLabel;
    }

    public String getExpected() {
        return expected;
    }

    public String getActual() {
        return actual;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    @Override
    public String toString() {
        return spanId + " [" + start + "," + end + ") 期望 '" + expected + "' 实际 '" + actual + "'";
    }
}
