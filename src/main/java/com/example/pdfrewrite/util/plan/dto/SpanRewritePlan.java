package com.example.pdfrewrite.util.plan.dto;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 整个文档的声明式改写计划，按 (page, block, line, span) 排序
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class SpanRewritePlan {

    @JsonProperty("run_id")
    private final String runId;
    @JsonProperty("entries")
    private final List<SpanRewriteEntry> entries = new ArrayList<>();
    @JsonProperty("validation_failures")
    private final List<ValidationFailure> validationFailures = new ArrayList<>();

    public SpanRewritePlan(String runId) {
        this.runId = runId;
    }

    public void addAll(List<SpanRewriteEntry> pageEntries, List<ValidationFailure> failures) {
        entries.addAll(pageEntries);
        entries.sort(Comparator.comparingInt(SpanRewriteEntry::getPage)
                .thenComparingInt(SpanRewriteEntry::getBlock)
                .thenComparingInt(SpanRewriteEntry::getLine)
                .thenComparingInt(SpanRewriteEntry::getSpan));
        validationFailures.addAll(failures);
    }

    public String getRunId() {
        return runId;
    }

    public List<SpanRewriteEntry> getEntries() {
        return entries;
    }

    public List<ValidationFailure> getValidationFailures() {
        return validationFailures;
    }
}
