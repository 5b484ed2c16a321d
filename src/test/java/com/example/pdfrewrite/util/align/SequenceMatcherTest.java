package com.example.pdfrewrite.util.align;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SequenceMatcherTest {

    @Test
    void blocksAreMonotonicAndMerged() {
        SequenceMatcher matcher = new SequenceMatcher("hello world", "hello wxrld");

        assertThat(matcher.getMatchingBlocks()).containsExactly(new int[]{0, 0, 7}, new int[]{8, 8, 3});
        assertThat(matcher.mapAtoB()).containsExactly(0, 1, 2, 3, 4, 5, 6, -1, 8, 9, 10);
    }

    @Test
    void ratioCountsMatchedCharacters() {
        assertThat(new SequenceMatcher("abcd", "bcd").ratio()).isCloseTo(6.0 / 7.0, within(1e-9));
        assertThat(new SequenceMatcher("same", "same").ratio()).isEqualTo(1.0);
        assertThat(new SequenceMatcher("", "").ratio()).isEqualTo(1.0);
        assertThat(new SequenceMatcher("abc", "xyz").ratio()).isZero();
    }

    @Test
    void missingSpacesStillAlign() {
        int[] mapping = new SequenceMatcher("a b c", "abc").mapAtoB();

        assertThat(mapping[0]).isZero();
        assertThat(mapping[2]).isEqualTo(1);
        assertThat(mapping[4]).isEqualTo(2);
        assertThat(mapping[1]).isEqualTo(-1);
    }

    @Test
    void frequentCharactersAreAbsorbedAtBlockEdges() {
        StringBuilder a = new StringBuilder();
        for (int i = 0; i < 60; i++) {
            a.append("w").append(i % 10).append("   ");
        }
        String text = a.toString();

        assertThat(new SequenceMatcher(text, text).ratio()).isEqualTo(1.0);
    }

    @Test
    void autojunkOffAlignsLongRepetitiveText() {
        StringBuilder glyphs = new StringBuilder();
        StringBuilder stream = new StringBuilder();
        for (int i = 0; i < 12; i++) {
            glyphs.append("Qathereseagull");
            stream.append("Qa there sea gull");
        }

        int[] pruned = new SequenceMatcher(glyphs.toString(), stream.toString()).mapAtoB();
        int[] full = new SequenceMatcher(glyphs.toString(), stream.toString(), false).mapAtoB();

        assertThat(pruned[16]).isEqualTo(-1);
        for (int k = 0; k < 5; k++) {
            assertThat(full[16 + k]).isEqualTo(20 + k);
        }
        assertThat(full).doesNotContain(-1);
    }
}
