package com.example.pdfrewrite.util.rewrite.dto;

import com.example.pdfrewrite.util.common.EntryFailure;

import java.util.ArrayList;
import java.util.List;

/**
 * 单页改写汇总
 */
public class RewriteReport {

    private int segmentsRewritten;
    private int segmentsFailed;
    private int recordsApplied;
    private final List<EntryFailure> failures = new ArrayList<>();

    public void segmentRewritten() {
        segmentsRewritten++;
    }

    public void segmentFailed() {
        segmentsFailed++;
    }

    public void recordApplied() {
        recordsApplied++;
    }

    public void addFailure(EntryFailure failure) {
        failures.add(failure);
    }

    public int getSegmentsRewritten() {
        return segmentsRewritten;
    }

    public int getSegmentsFailed() {
        return segmentsFailed;
    }

    public int getRecordsApplied() {
        return recordsApplied;
    }

    public List<EntryFailure> getFailures() {
        return failures;
    }

    /**
     * 有段被改写时才需要写回内容流
     */
    public boolean isModified() {
        return segmentsRewritten > 0;
    }
}
