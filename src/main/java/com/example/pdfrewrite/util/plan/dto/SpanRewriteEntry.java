package com.example.pdfrewrite.util.plan.dto;

import com.example.pdfrewrite.util.coordinate.Rect;
import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 声明式改写计划的单元：一个 span 上全部已接受替换的汇总
 *
 * 构造后不可变。scaleFactor 位于 (0, 1]，只有替换文本更宽时才小于 1。
 * operatorIndex 指向改写前内容流中第一个替换所在的文本显示操作。
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class SpanRewriteEntry {

    @JsonProperty("page")
    private final int page;
    @JsonProperty("block")
    private final int block;
    @JsonProperty("line")
    private final int line;
    @JsonProperty("span")
    private final int span;
    @JsonProperty("span_id")
    private final String spanId;
    @JsonProperty("operator_index")
    private final Integer operatorIndex;
    @JsonProperty("original_text")
    private final String originalText;
    @JsonProperty("replacement_text")
    private final String replacementText;
    @JsonProperty("font")
    private final String font;
    @JsonProperty("font_size")
    private final float fontSize;
    @JsonProperty("bbox")
    private final Rect bbox;
    @JsonProperty("matrix")
    private final float[] matrix;
    @JsonProperty("original_width")
    private final float originalWidth;
    @JsonProperty("replacement_width")
    private final float replacementWidth;
    @JsonProperty("scale_factor")
    private final float scaleFactor;
    @JsonProperty("mappings")
    private final List<SpanMappingRef> mappings;
    @JsonProperty("overlay_fallback")
    private final boolean overlayFallback;
    @JsonProperty("requires_scaling")
    private final boolean requiresScaling;
    @JsonProperty("validation_failures")
    private final List<ValidationFailure> validationFailures;

    public SpanRewriteEntry(int page, int block, int line, int span, String spanId, Integer operatorIndex,
                            String originalText, String replacementText, String font, float fontSize,
                            Rect bbox, float[] matrix, float originalWidth, float replacementWidth,
                            float scaleFactor, List<SpanMappingRef> mappings, boolean overlayFallback,
                            boolean requiresScaling, List<ValidationFailure> validationFailures) {
        this.page = page;
        this.block = block;
        this.line = line;
        this.span = span;
        this.spanId = spanId;
        this.operatorIndex = operatorIndex;
        this.originalText = originalText;
        this.replacementText = replacementText;
        this.font = font;
        this.fontSize = fontSize;
        this.bbox = bbox;
        this.matrix = matrix == null ? null : matrix.clone();
        this.originalWidth = originalWidth;
        this.replacementWidth = replacementWidth;
        this.scaleFactor = scaleFactor;
        this.mappings = Collections.unmodifiableList(new ArrayList<>(mappings));
        this.overlayFallback = overlayFallback;
        this.requiresScaling = requiresScaling;
        this.validationFailures = Collections.unmodifiableList(new ArrayList<>(validationFailures));
    }

    public int getPage() {
        return page;
    }

    public int getBlock() {
        return block;
    }

    public int getLine() {
        return line;
    }

    public int getSpan() {
        return span;
    }

    public String getSpanId() {
        return spanId;
    }

    public Integer getOperatorIndex() {
        return operatorIndex;
    }

    public String getOriginalText() {
        return originalText;
    }

    public String getReplacementText() {
        return replacementText;
    }

    public String getFont() {
        return font;
    }

    public float getFontSize() {
        return fontSize;
    }

    public Rect getBbox() {
        return bbox;
    }

    public float[] getMatrix() {
        return matrix == null ? null : matrix.clone();
    }

    public float getOriginalWidth() {
        return originalWidth;
    }

    public float getReplacementWidth() {
        return replacementWidth;
    }

    public float getScaleFactor() {
        return scaleFactor;
    }

    public List<SpanMappingRef> getMappings() {
        return mappings;
    }

    public boolean isOverlayFallback() {
        return overlayFallback;
    }

    public boolean isRequiresScaling() {
        return requiresScaling;
    }

    public List<ValidationFailure> getValidationFailures() {
        return validationFailures;
    }

    @Override
    public String toString() {
        return "SpanRewriteEntry{" + spanId + " '" + originalText + "' -> '" + replacementText + "', scale="
                + scaleFactor + ", overlay=" + overlayFallback + "}";
    }
}
