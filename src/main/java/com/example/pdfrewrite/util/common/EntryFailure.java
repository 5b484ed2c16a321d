package com.example.pdfrewrite.util.common;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 单条映射的可恢复失败
 *
 * 定位、规划、改写阶段各自返回该值，由渲染器汇总到结果和统计中，不会中断整页或整个文档。
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class EntryFailure {

    public enum Kind {
        /** 页面上找不到目标子串 */
        LOCATION_NOT_FOUND,
        /** 候选矩形与已占用矩形相交 */
        RECT_CONFLICT,
        /** 指纹已在本页被使用 */
        FINGERPRINT_CONSUMED,
        /** 无法在内容流中确定字符区间 */
        STREAM_RANGE_NOT_FOUND,
        /** 与已接受的替换区间重叠 */
        RANGE_CONFLICT,
        /** 截断后区间为空 */
        EMPTY_RANGE,
        /** 所有改写策略均失败 */
        REWRITE_FAILED
    }

    @JsonProperty("kind")
    private final Kind kind;
    @JsonProperty("page")
    private final int page;
    @JsonProperty("q_label")
    private final String qLabel;
    @JsonProperty("original")
    private final String original;
    @JsonProperty("detail")
    private final String detail;

    public EntryFailure(Kind kind, int page, String qLabel, String original, String detail) {
        this.kind = kind;
        this.page = page;
        this.qLabel = qLabel;
        this.original = original;
        this.detail = detail;
    }

    public Kind getKind() {
        return kind;
    }

    public int getPage() {
        return page;
    }

    public String getQLabel() {
        return qLabel;
    }

    public String getOriginal() {
        return original;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return kind + "[page=" + (page + 1) + ", q=" + qLabel + ", original='" + original + "', " + detail + "]";
    }
}
