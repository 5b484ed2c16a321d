package com.example.pdfrewrite.util.locate.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 匹配所在的字形路径：span 坐标 + 原始字符区间 [charStart, charEnd)
 */
public class GlyphPath {

    public final int block;
    public final int line;
    public final int span;
    @JsonProperty("char_start")
    public final int charStart;
    @JsonProperty("char_end")
    public final int charEnd;
    @JsonProperty("span_id")
    public final String spanId;

    @JsonCreator
    public GlyphPath(@JsonProperty("block") int block,
                     @JsonProperty("line") int line,
                     @JsonProperty("span") int span,
                     @JsonProperty("char_start") int charStart,
                     @JsonProperty("char_end") int charEnd,
                     @JsonProperty("span_id") String spanId) {
        this.block = block;
        this.line = line;
        this.span = span;
        this.charStart = charStart;
        this.charEnd = charEnd;
        this.spanId = spanId;
    }

    public int length() {
        return charEnd - charStart;
    }

    @Override
    public String toString() {
        return "GlyphPath{" + block + ":" + line + ":" + span + " [" + charStart + "," + charEnd + ")}";
    }
}
