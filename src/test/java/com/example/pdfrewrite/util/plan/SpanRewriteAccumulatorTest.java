package com.example.pdfrewrite.util.plan;

import com.example.pdfrewrite.TestDocuments;
import com.example.pdfrewrite.util.plan.dto.SliceReplacement;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SpanRewriteAccumulatorTest {

    private final SpanRewriteAccumulator accumulator =
            new SpanRewriteAccumulator(TestDocuments.span(0, 0, 0, "hello brave new world", 72f, 100f));

    private static SliceReplacement slice(int start, int end, String expected) {
        return new SliceReplacement(start, end, expected, "x", null, false);
    }

    @Test
    void driftedRangeIsRecovered() {
        assertThat(accumulator.add(slice(0, 5, "brave"))).isTrue();

        SliceReplacement accepted = accumulator.getSlices().get(0);
        assertThat(accepted.getStart()).isEqualTo(6);
        assertThat(accepted.getEnd()).isEqualTo(11);
    }

    @Test
    void unrecoverableSliceIsRecordedAsFailure() {
        assertThat(accumulator.add(slice(0, 5, "zebra"))).isFalse();

        assertThat(accumulator.isEmpty()).isTrue();
        assertThat(accumulator.getFailures()).hasSize(1);
        assertThat(accumulator.getFailures().get(0).getActual()).isEqualTo("hello");
    }

    @Test
    void widerSliceSupersedesContainedOne() {
        assertThat(accumulator.add(slice(6, 11, "brave"))).isTrue();
        assertThat(accumulator.add(slice(6, 15, "brave new"))).isTrue();

        assertThat(accumulator.getSlices()).hasSize(1);
        assertThat(accumulator.getSlices().get(0).getEnd()).isEqualTo(15);
    }

    @Test
    void containedAndPartialOverlapsAreDropped() {
        accumulator.add(slice(6, 15, "brave new"));

        assertThat(accumulator.add(slice(12, 15, "new"))).isFalse();
        assertThat(accumulator.add(slice(0, 8, "hello br"))).isFalse();
        assertThat(accumulator.add(slice(16, 21, "world"))).isTrue();
        assertThat(accumulator.getSlices()).extracting(SliceReplacement::getStart).containsExactly(6, 16);
    }
}
