package com.example.pdfrewrite.util.text;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CompactTextTest {

    @Test
    void foldedDropsAccentsAndWhitespace() {
        CompactText compact = CompactText.folded("Un caf\u00E9 noir");
        assertThat(compact.text).isEqualTo("uncafenoir");
        // "cafe" -> 原文 "caf\u00E9" 的 [3, 7)
        assertThat(compact.rawRange(2, 6)).containsExactly(3, 7);
    }

    @Test
    void alphanumericDropsPunctuation() {
        CompactText compact = CompactText.alphanumeric("x = (a+b)");
        assertThat(compact.text).isEqualTo("xab");
        assertThat(compact.rawRange(1, 3)).containsExactly(5, 8);
    }

    @Test
    void invalidRangeIsNull() {
        CompactText compact = CompactText.folded("ab");
        assertThat(compact.rawRange(1, 1)).isNull();
        assertThat(compact.rawRange(0, 5)).isNull();
    }
}
