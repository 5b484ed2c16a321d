package com.example.pdfrewrite.util.rewrite.dto;

import java.util.Collections;
import java.util.List;

/**
 * 单个文本段的改写结果：成功时给出替换原操作（含操作数）的新 token 序列
 */
public class RewriteOutcome {

    private final boolean success;
    private final List<Object> tokens;
    private final String detail;

    private RewriteOutcome(boolean success, List<Object> tokens, String detail) {
        this.success = success;
        this.tokens = tokens;
        this.detail = detail;
    }

    public static RewriteOutcome ok(List<Object> tokens) {
        return new RewriteOutcome(true, tokens, null);
    }

    public static RewriteOutcome failed(String detail) {
        return new RewriteOutcome(false, Collections.emptyList(), detail);
    }

    public boolean isSuccess() {
        return success;
    }

    public List<Object> getTokens() {
        return tokens;
    }

    public String getDetail() {
        return detail;
    }
}
