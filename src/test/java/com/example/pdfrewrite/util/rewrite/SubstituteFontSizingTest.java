package com.example.pdfrewrite.util.rewrite;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SubstituteFontSizingTest {

    private final SubstituteFontSizing sizing = new SubstituteFontSizing();

    @Test
    void sameLengthFitsExactly() {
        SubstituteFontSizing.Fit fit = sizing.fit("cat", 18f, 3);

        assertThat(fit.text).isEqualTo("cat");
        assertThat(fit.fontSize).isCloseTo(10f, within(0.001f));
        assertThat(fit.width).isCloseTo(18f, within(0.001f));
        assertThat(fit.spacing).isZero();
    }

    @Test
    void shortReplacementIsCappedAndPadded() {
        SubstituteFontSizing.Fit fit = sizing.fit("ab", 30f, 5);

        assertThat(fit.fontSize).isEqualTo(12f);
        assertThat(fit.width).isCloseTo(14.4f, within(0.001f));
        assertThat(fit.spacing).isCloseTo(-1300f, within(0.5f));
    }

    @Test
    void longReplacementIsAbbreviated() {
        SubstituteFontSizing.Fit fit = sizing.fit("abcdefghijklmnopqrstuvwxyz", 20f, 5);

        assertThat(fit.text).isEqualTo("abcde...");
        assertThat(fit.isAbbreviated("abcdefghijklmnopqrstuvwxyz")).isTrue();
        assertThat(fit.fontSize).isGreaterThanOrEqualTo(4f);
        assertThat(fit.width).isCloseTo(20f, within(0.01f));
    }

    @Test
    void tinyWidthKeepsFirstCharacterOrNothing() {
        assertThat(sizing.abbreviate("abcdef", 4f)).isEqualTo("a");
        assertThat(sizing.fit("abcdef", 1f, 6).isEmpty()).isTrue();
        assertThat(sizing.fit("", 10f, 3).isEmpty()).isTrue();
    }

    @Test
    void removalSpacingConsumesWholeWidth() {
        assertThat(sizing.spacingForRemoval(12f, 12f)).isEqualTo(-1000f);
        assertThat(sizing.spacingForRemoval(12f, 0f)).isZero();
        assertThat(sizing.estimateWidth(5, 10f)).isCloseTo(30f, within(0.001f));
    }
}
