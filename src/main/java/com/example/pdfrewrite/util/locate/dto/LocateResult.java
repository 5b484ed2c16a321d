package com.example.pdfrewrite.util.locate.dto;

import com.example.pdfrewrite.util.common.EntryFailure;

/**
 * 定位结果：成功时携带 {@link LocatedMatch}，失败时携带失败类型和说明
 */
public class LocateResult {

    private final LocatedMatch match;
    private final EntryFailure.Kind failure;
    private final String detail;

    private LocateResult(LocatedMatch match, EntryFailure.Kind failure, String detail) {
        this.match = match;
        this.failure = failure;
        this.detail = detail;
    }

    public static LocateResult found(LocatedMatch match) {
        return new LocateResult(match, null, null);
    }

    public static LocateResult failed(EntryFailure.Kind kind, String detail) {
        return new LocateResult(null, kind, detail);
    }

    public boolean isFound() {
        return match != null;
    }

    public LocatedMatch getMatch() {
        return match;
    }

    public EntryFailure.Kind getFailure() {
        return failure;
    }

    public String getDetail() {
        return detail;
    }
}
