package com.example.pdfrewrite.util.plan.dto;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 计划条目引用的映射来源
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class SpanMappingRef {

    @JsonProperty("q_label")
    private final String qLabel;
    @JsonProperty("entry_index")
    private final int entryIndex;
    @JsonProperty("original")
    private final String original;
    @JsonProperty("replacement")
    private final String replacement;
    @JsonProperty("char_start")
    private final int charStart;
    @JsonProperty("char_end")
    private final int charEnd;
    @JsonProperty("fingerprint_key")
    private final String fingerprintKey;

    public SpanMappingRef(String qLabel, int entryIndex, String original, String replacement,
                          int charStart, int charEnd, String fingerprintKey) {
        this.qLabel = qLabel;
        this.entryIndex = entryIndex;
        this.original = original;
        this.replacement = replacement;
        this.charStart = charStart;
        this.charEnd = charEnd;
        this.fingerprintKey = fingerprintKey;
    }

    public String getQLabel() {
        return qLabel;
    }

    public int getEntryIndex() {
        return entryIndex;
    }

    public String getOriginal() {
        return original;
    }

    public String getReplacement() {
        return replacement;
    }

    public int getCharStart() {
        return charStart;
    }

    public int getCharEnd() {
        return charEnd;
    }

    public String getFingerprintKey() {
        return fingerprintKey;
    }
}
