package com.example.pdfrewrite.service.dto;

import com.example.pdfrewrite.util.common.EntryFailure;
import com.example.pdfrewrite.util.locate.dto.MappingEntry;
import com.example.pdfrewrite.util.plan.dto.SpanRewritePlan;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 渲染结果：输出文档字节、统计、逐条失败、声明式计划与带标记的映射表
 */
public class RenderResult {

    private byte[] outputBytes;
    private final RenderStatistics statistics = new RenderStatistics();
    private final List<EntryFailure> failures = new ArrayList<>();
    private final List<MappingEntry> appliedEntries = new ArrayList<>();
    private SpanRewritePlan plan;
    private Map<String, String> mappingTable = new LinkedHashMap<>();
    private List<String> validationErrors = new ArrayList<>();

    public byte[] getOutputBytes() {
        return outputBytes;
    }

    public void setOutputBytes(byte[] outputBytes) {
        this.outputBytes = outputBytes;
    }

    public RenderStatistics getStatistics() {
        return statistics;
    }

    public List<EntryFailure> getFailures() {
        return failures;
    }

    public void addFailure(EntryFailure failure) {
        failures.add(failure);
    }

    /**
     * 已成功写入输出文档的条目（用于输出校验）
     */
    public List<MappingEntry> getAppliedEntries() {
        return appliedEntries;
    }

    public SpanRewritePlan getPlan() {
        return plan;
    }

    public void setPlan(SpanRewritePlan plan) {
        this.plan = plan;
    }

    public Map<String, String> getMappingTable() {
        return mappingTable;
    }

    public void setMappingTable(Map<String, String> mappingTable) {
        this.mappingTable = mappingTable;
    }

    public List<String> getValidationErrors() {
        return validationErrors;
    }

    public void setValidationErrors(List<String> validationErrors) {
        this.validationErrors = validationErrors;
    }
}
