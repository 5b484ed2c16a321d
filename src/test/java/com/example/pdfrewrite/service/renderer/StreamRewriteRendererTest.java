package com.example.pdfrewrite.service.renderer;

import com.example.pdfrewrite.TestDocuments;
import com.example.pdfrewrite.config.RewriteSettings;
import com.example.pdfrewrite.service.OutputValidator;
import com.example.pdfrewrite.service.dto.RenderResult;
import com.example.pdfrewrite.util.common.EntryFailure;
import com.example.pdfrewrite.util.locate.dto.GlyphPath;
import com.example.pdfrewrite.util.locate.dto.MappingEntry;
import com.example.pdfrewrite.util.overlay.OverlayMode;
import com.example.pdfrewrite.util.span.dto.PageGlyphLayout;
import com.example.pdfrewrite.util.span.dto.SpanRecord;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StreamRewriteRendererTest {

    private static MappingEntry entry(int page, String original, String replacement) {
        MappingEntry entry = new MappingEntry("1", 0, original, replacement);
        entry.setPageIndex(page);
        return entry;
    }

    @Test
    void textLayerIsRewritten() throws Exception {
        RewriteSettings settings = new RewriteSettings();
        byte[] pdf = TestDocuments.singlePage("The quick brown fox jumps", "over the lazy dog");
        List<MappingEntry> entries = Collections.singletonList(entry(0, "brown fox", "cat"));

        RenderResult result = new StreamRewriteRenderer(settings).render(pdf, entries, "run-test");

        String text = TestDocuments.extractText(result.getOutputBytes());
        assertThat(text).contains("cat").contains("quick").contains("jumps").doesNotContain("fox");
        assertThat(result.getFailures()).isEmpty();
        assertThat(result.getAppliedEntries()).hasSize(1);
        assertThat(result.getStatistics().getReplacementsApplied()).isEqualTo(1);
        assertThat(result.getStatistics().getPagesRewritten()).isEqualTo(1);
        assertThat(result.getStatistics().getMatchesFound()).isEqualTo(1);
        assertThat(result.getStatistics().getTextShowOps()).isEqualTo(2);
        assertThat(result.getStatistics().getEntriesSkipped()).isZero();
        assertThat(result.getPlan().getRunId()).isEqualTo("run-test");
        assertThat(result.getPlan().getEntries()).hasSize(1);
        assertThat(result.getPlan().getEntries().get(0).getReplacementText()).isEqualTo("The quick cat jumps");

        assertThat(new OutputValidator(settings).validate(result.getOutputBytes(), result.getAppliedEntries()))
                .isEmpty();
    }

    @Test
    void glyphPathHintRewritesTheHintedOccurrenceOnLongPage() throws Exception {
        byte[] pdf = TestDocuments.kernedLines(12, "Qa", -250f, "there", -250f, "sea", -250f, "gull");
        PageGlyphLayout layout = TestDocuments.layout(pdf, 0);
        SpanRecord second = layout.getSpans().get(1);
        int start = second.getRawText().indexOf("there");
        MappingEntry hinted = entry(0, "there", "XXXXX");
        hinted.setGlyphPathHint(new GlyphPath(second.getBlockIndex(), second.getLineIndex(),
                second.getSpanIndex(), start, start + 5, second.getSpanId()));

        RenderResult result = new StreamRewriteRenderer(new RewriteSettings())
                .render(pdf, Collections.singletonList(hinted), "run");

        assertThat(result.getFailures()).isEmpty();
        assertThat(hinted.getMatch().getAlignmentConfidence()).isEqualTo(1.0);
        String text = TestDocuments.extractText(result.getOutputBytes());
        int first = text.indexOf("there");
        int replaced = text.indexOf("XXXXX");
        assertThat(first).isNotNegative();
        assertThat(replaced).isGreaterThan(first);
        assertThat(text.indexOf("there", first + 1)).isGreaterThan(replaced);
        assertThat(text.split("there", -1)).hasSize(12);
    }

    @Test
    void replacementAcrossTwoShowOperatorsKeepsSingleSpace() throws Exception {
        byte[] pdf = TestDocuments.splitShows("The quick bro", "wn fox");

        RenderResult result = new StreamRewriteRenderer(new RewriteSettings())
                .render(pdf, Collections.singletonList(entry(0, "brown", "red")), "run");

        assertThat(result.getFailures()).isEmpty();
        String text = TestDocuments.extractText(result.getOutputBytes());
        assertThat(text).contains("The quick red fox").doesNotContain("red  fox").doesNotContain("brown");
    }

    @Test
    void unresolvableEntriesAreSkippedNotFatal() throws Exception {
        byte[] pdf = TestDocuments.singlePage("The quick brown fox");
        List<MappingEntry> entries = Arrays.asList(
                entry(0, "zebra", "horse"),
                entry(5, "fox", "cat"),
                entry(0, "quick", "slow"));

        RenderResult result = new StreamRewriteRenderer(new RewriteSettings()).render(pdf, entries, "run");

        assertThat(result.getFailures()).extracting(EntryFailure::getKind)
                .containsExactlyInAnyOrder(EntryFailure.Kind.LOCATION_NOT_FOUND, EntryFailure.Kind.LOCATION_NOT_FOUND);
        assertThat(result.getStatistics().getEntriesTotal()).isEqualTo(3);
        assertThat(result.getStatistics().getEntriesSkipped()).isEqualTo(2);
        assertThat(result.getAppliedEntries()).extracting(MappingEntry::getOriginal).containsExactly("quick");
    }

    @Test
    void hybridRendererOverlaysBelowCoverageThreshold() throws Exception {
        RewriteSettings settings = new RewriteSettings();
        settings.setOverlayMode(OverlayMode.VECTOR);
        settings.setOverlayCoverageThreshold(1.5);
        byte[] pdf = TestDocuments.singlePage("The quick brown fox");

        RenderResult result = new HybridOverlayRenderer(settings)
                .render(pdf, Collections.singletonList(entry(0, "brown", "red")), "run");

        assertThat(result.getStatistics().getRenderer()).isEqualTo("STREAM_REWRITE_WITH_OVERLAY");
        assertThat(result.getStatistics().getOverlayCount()).isEqualTo(1);
        assertThat(result.getStatistics().getOverlayAreaPct()).isPositive();
        assertThat(TestDocuments.extractText(result.getOutputBytes())).contains("red");
    }

    @Test
    void hybridRendererSkipsOverlayWhenEverythingApplied() throws Exception {
        byte[] pdf = TestDocuments.singlePage("The quick brown fox");

        RenderResult result = new HybridOverlayRenderer(new RewriteSettings())
                .render(pdf, Collections.singletonList(entry(0, "brown", "red")), "run");

        assertThat(result.getStatistics().getOverlayCount()).isZero();
    }
}
