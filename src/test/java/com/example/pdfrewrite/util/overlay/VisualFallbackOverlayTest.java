package com.example.pdfrewrite.util.overlay;

import com.example.pdfrewrite.TestDocuments;
import com.example.pdfrewrite.util.coordinate.Rect;
import com.example.pdfrewrite.util.plan.dto.SpanRewriteEntry;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class VisualFallbackOverlayTest {

    private static SpanRewriteEntry entry(int line, int span, Rect bbox, boolean overlay) {
        return new SpanRewriteEntry(0, 0, line, span, "s" + line + span, null, "a", "b", "Helvetica", 12f,
                bbox, new float[]{1, 0, 0, 1, 0, 0}, bbox.width(), bbox.width(), 1f,
                new ArrayList<>(), overlay, false, new ArrayList<>());
    }

    @Test
    void regionsMergePerLine() {
        List<SpanRewriteEntry> entries = Arrays.asList(
                entry(0, 0, new Rect(10, 10, 20, 20), true),
                entry(0, 1, new Rect(30, 12, 40, 22), true),
                entry(1, 0, new Rect(10, 40, 20, 50), true),
                entry(2, 0, new Rect(10, 70, 20, 80), false));

        List<Rect> regions = VisualFallbackOverlay.regionsFor(entries);

        assertThat(regions).containsExactly(new Rect(10, 10, 40, 22), new Rect(10, 40, 20, 50));
    }

    @Test
    void vectorOverlayRecordsClippedArea() throws Exception {
        byte[] pdf = TestDocuments.singlePage("The quick brown fox");
        try (PDDocument source = Loader.loadPDF(pdf); PDDocument target = Loader.loadPDF(pdf)) {
            VisualFallbackOverlay overlay = new VisualFallbackOverlay(72f, OverlayMode.VECTOR, 0f);

            OverlayStats stats = overlay.apply(source, target, 0,
                    Arrays.asList(new Rect(0, 0, 61.2f, 79.2f), new Rect(-50, -50, -10, -10)));

            assertThat(stats.getCount()).isEqualTo(1);
            assertThat(stats.getPageArea()).isCloseTo(612.0 * 792.0, within(0.5));
            assertThat(stats.getAreaPct()).isEqualTo(1.0);
        }
    }

    @Test
    void noRegionsLeavesPageUntouched() throws Exception {
        byte[] pdf = TestDocuments.singlePage("text");
        try (PDDocument source = Loader.loadPDF(pdf); PDDocument target = Loader.loadPDF(pdf)) {
            OverlayStats stats = new VisualFallbackOverlay(72f, OverlayMode.RASTER, 1f)
                    .apply(source, target, 0, Collections.emptyList());

            assertThat(stats.getCount()).isZero();
            assertThat(stats.getAreaPct()).isZero();
        }
    }

    @Test
    void statsMerge() {
        OverlayStats total = new OverlayStats();
        OverlayStats page = new OverlayStats();
        page.addPageArea(1000);
        page.record(25);
        page.record(5);

        total.merge(page);

        assertThat(total.getCount()).isEqualTo(2);
        assertThat(total.getOverlayArea()).isEqualTo(30.0);
        assertThat(total.getAreaPct()).isEqualTo(3.0);
    }
}
