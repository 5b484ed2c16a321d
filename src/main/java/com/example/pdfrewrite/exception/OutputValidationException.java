package com.example.pdfrewrite.exception;

import com.example.pdfrewrite.service.dto.RenderResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 输出校验失败：汇总全部不一致项，异常消息只列出前 5 条
 */
public class OutputValidationException extends RenderException {

    public static final int SUMMARY_LIMIT = 5;

    private final List<String> errors;
    private final transient RenderResult result;

    public OutputValidationException(List<String> errors) {
        this(errors, null);
    }

    /**
     * @param result 未通过校验的渲染结果，由调用方决定是否仍然采用
     */
    public OutputValidationException(List<String> errors, RenderResult result) {
        super(summarize(errors));
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
        this.result = result;
    }

    public List<String> getErrors() {
        return errors;
    }

    public RenderResult getResult() {
        return result;
    }

    static String summarize(List<String> errors) {
        List<String> head = errors.subList(0, Math.min(SUMMARY_LIMIT, errors.size()));
        String message = "输出校验失败（" + errors.size() + " 项）: " + String.join("; ", head);
        if (errors.size() > SUMMARY_LIMIT) {
            message += "; ...";
        }
        return message;
    }
}
