package com.example.pdfrewrite.util.stream.dto;

import com.example.pdfrewrite.util.common.EntryFailure;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 单页替换计划：已接受的记录（按起始偏移升序）与被拒绝条目的失败原因
 */
public class ReplacementPlan {

    private final List<ReplacementRecord> records = new ArrayList<>();
    private final List<EntryFailure> failures = new ArrayList<>();

    public void accept(ReplacementRecord record) {
        records.add(record);
        records.sort(Comparator.comparingInt(ReplacementRecord::getStart));
    }

    public void reject(EntryFailure failure) {
        failures.add(failure);
    }

    /**
     * 与已接受记录重叠的第一条记录，没有时返回 null
     */
    public ReplacementRecord findOverlap(int start, int end) {
        for (ReplacementRecord record : records) {
            if (record.overlaps(start, end)) {
                return record;
            }
        }
        return null;
    }

    public List<ReplacementRecord> getRecords() {
        return records;
    }

    public List<EntryFailure> getFailures() {
        return failures;
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
