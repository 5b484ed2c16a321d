package com.example.pdfrewrite.util.locate;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FingerprintSupportTest {

    @Test
    void keyDependsOnEveryPart() {
        String key = FingerprintSupport.fingerprintKey("a ", "fox", " b", 0);

        assertThat(key).hasSize(40).isEqualTo(FingerprintSupport.fingerprintKey("a ", "fox", " b", 0));
        assertThat(key).isNotEqualTo(FingerprintSupport.fingerprintKey("a ", "fox", " b", 1));
        assertThat(key).isNotEqualTo(FingerprintSupport.fingerprintKey("a", "fox", " b", 0));
        assertThat(FingerprintSupport.fingerprintKey(null, "fox", null, 0))
                .isEqualTo(FingerprintSupport.fingerprintKey("", "fox", "", 0));
    }

    @Test
    void prefixComparesTailIgnoringWhitespace() {
        assertThat(FingerprintSupport.matches("the quick brown ", "", "quickbrown", null)).isTrue();
        assertThat(FingerprintSupport.matches("The Quick", "", "quick", null)).isTrue();
        assertThat(FingerprintSupport.matches("the slow ", "", "quick", null)).isFalse();
    }

    @Test
    void suffixComparesHead() {
        assertThat(FingerprintSupport.matches("", " jumps over", null, "jumps")).isTrue();
        assertThat(FingerprintSupport.matches("", " sleeps", null, "jumps")).isFalse();
    }

    @Test
    void shorterActualContextComparesOverlapOnly() {
        assertThat(FingerprintSupport.matches("wn ", "", "brown", null)).isTrue();
        assertThat(FingerprintSupport.matches("", "", "brown", "fox")).isTrue();
    }

    @Test
    void contextScoreCountsOverlappingCharacters() {
        assertThat(FingerprintSupport.contextScore("pie and ", " x", "and ", null)).isEqualTo(3);
        assertThat(FingerprintSupport.contextScore("", "", "and ", "tart")).isZero();
        assertThat(FingerprintSupport.contextScore("a b", " tart now", "b", "tar")).isEqualTo(4);
    }
}
