package com.example.pdfrewrite.util.text;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MarkerCodecTest {

    @Test
    void markerIsSixZeroWidthCharacters() {
        String marker = MarkerCodec.encodeMarker("run-1:structured:3:0:0");
        assertThat(marker).hasSize(MarkerCodec.MARKER_LENGTH);
        for (char ch : marker.toCharArray()) {
            assertThat(TextNormalizer.isZeroWidth(ch)).isTrue();
        }
    }

    @Test
    void markerIsDeterministic() {
        assertThat(MarkerCodec.encodeMarker("ctx")).isEqualTo(MarkerCodec.encodeMarker("ctx"));
    }

    @Test
    void stripRestoresKey() {
        String[] keys = {"plain", "多行\n文本", "", "x + y = 2"};
        String[] contexts = {"a", "run:structured:q1:0:1", "", "中文上下文"};
        for (String key : keys) {
            for (String context : contexts) {
                String marked = MarkerCodec.mark(key, context);
                assertThat(MarkerCodec.hasMarker(marked)).isTrue();
                assertThat(MarkerCodec.strip(marked)).isEqualTo(key);
            }
        }
    }

    @Test
    void unmarkedTextHasNoMarker() {
        assertThat(MarkerCodec.hasMarker("abc")).isFalse();
        assertThat(MarkerCodec.hasMarker(null)).isFalse();
    }

    @Test
    void sha1HexOfKnownValue() {
        assertThat(MarkerCodec.sha1Hex("abc")).isEqualTo("a9993e364706816aba3e25717850c26c9cd0d89d");
    }
}
