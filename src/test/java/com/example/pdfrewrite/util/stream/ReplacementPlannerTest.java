package com.example.pdfrewrite.util.stream;

import com.example.pdfrewrite.util.common.EntryFailure;
import com.example.pdfrewrite.util.locate.dto.MappingEntry;
import com.example.pdfrewrite.util.stream.dto.ReplacementPlan;
import com.example.pdfrewrite.util.stream.dto.ReplacementRecord;
import com.example.pdfrewrite.util.stream.dto.SegmentExtraction;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ReplacementPlannerTest {

    private static final SegmentExtraction STREAM =
            new SegmentExtraction(Collections.emptyList(), "apple pie apple tart", 0, 0);

    private final ReplacementPlanner planner = new ReplacementPlanner();

    private static MappingEntry entry(String original, String replacement) {
        MappingEntry entry = new MappingEntry("7", 0, original, replacement);
        entry.setPageIndex(0);
        return entry;
    }

    @Test
    void occurrenceIndexSelectsLaterCandidate() {
        MappingEntry entry = entry("apple", "pear");
        entry.setOccurrenceIndex(1);

        ReplacementPlan plan = planner.plan(STREAM, Collections.singletonList(entry), new HashSet<>());

        assertThat(plan.getRecords()).hasSize(1);
        ReplacementRecord record = plan.getRecords().get(0);
        assertThat(record.getStart()).isEqualTo(10);
        assertThat(record.getEnd()).isEqualTo(15);
        assertThat(record.getSource()).isEqualTo(ReplacementRecord.Source.DIRECT);
        assertThat(record.getReplacementText()).isEqualTo("pear");
    }

    @Test
    void suffixFingerprintBeatsOrder() {
        MappingEntry entry = entry("apple", "pear");
        entry.setSuffix(" tart");

        ReplacementPlan plan = planner.plan(STREAM, Collections.singletonList(entry), new HashSet<>());

        assertThat(plan.getRecords().get(0).getStart()).isEqualTo(10);
    }

    @Test
    void overlappingEntryIsRejected() {
        MappingEntry first = entry("apple pie", "cake");
        MappingEntry second = entry("pie", "tart");

        ReplacementPlan plan = planner.plan(STREAM, Arrays.asList(first, second), new HashSet<>());

        assertThat(plan.getRecords()).hasSize(1);
        assertThat(plan.getFailures()).extracting(EntryFailure::getKind)
                .containsExactly(EntryFailure.Kind.RANGE_CONFLICT);
    }

    @Test
    void missingTextIsReported() {
        ReplacementPlan plan = planner.plan(STREAM, Collections.singletonList(entry("banana", "kiwi")),
                new HashSet<>());

        assertThat(plan.isEmpty()).isTrue();
        assertThat(plan.getFailures()).extracting(EntryFailure::getKind)
                .containsExactly(EntryFailure.Kind.STREAM_RANGE_NOT_FOUND);
    }

    @Test
    void fingerprintIsConsumedOnce() {
        MappingEntry first = entry("apple", "pear");
        first.setFingerprintKey("fp");
        MappingEntry second = entry("tart", "pie");
        second.setFingerprintKey("fp");
        Set<String> used = new HashSet<>();

        ReplacementPlan plan = planner.plan(STREAM, Arrays.asList(first, second), used);

        assertThat(used).containsExactly("fp");
        assertThat(plan.getRecords()).hasSize(1);
        assertThat(plan.getFailures()).extracting(EntryFailure::getKind)
                .containsExactly(EntryFailure.Kind.FINGERPRINT_CONSUMED);
    }

    @Test
    void confidentGeometryRangeIsUsedDirectly() {
        MappingEntry entry = entry("apple", "pear");
        entry.getMatch().setStreamStart(10);
        entry.getMatch().setStreamEnd(15);
        entry.getMatch().setAlignmentConfidence(0.95);

        ReplacementRecord record = planner.plan(STREAM, Collections.singletonList(entry), new HashSet<>())
                .getRecords().get(0);

        assertThat(record.getSource()).isEqualTo(ReplacementRecord.Source.GEOMETRY);
        assertThat(record.getStart()).isEqualTo(10);
    }

    @Test
    void lowConfidenceGeometryFallsBackToSearch() {
        MappingEntry entry = entry("apple", "pear");
        entry.getMatch().setStreamStart(10);
        entry.getMatch().setStreamEnd(15);
        entry.getMatch().setAlignmentConfidence(0.4);

        ReplacementRecord record = planner.plan(STREAM, Collections.singletonList(entry), new HashSet<>())
                .getRecords().get(0);

        assertThat(record.getSource()).isEqualTo(ReplacementRecord.Source.DIRECT);
        assertThat(record.getStart()).isEqualTo(0);
    }

    @Test
    void compactSearchIgnoresPunctuation() {
        SegmentExtraction stream = new SegmentExtraction(Collections.emptyList(), "x=(a+b) end", 0, 0);

        ReplacementRecord record = planner.plan(stream, Collections.singletonList(entry("x (a b)", "y")),
                new HashSet<>()).getRecords().get(0);

        assertThat(record.getSource()).isEqualTo(ReplacementRecord.Source.COMPACT);
        assertThat(record.getStart()).isEqualTo(0);
        assertThat(record.getEnd()).isEqualTo(6);
    }
}
