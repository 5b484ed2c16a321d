package com.example.pdfrewrite.util.span;

import com.example.pdfrewrite.TestDocuments;
import com.example.pdfrewrite.util.span.dto.PageGlyphLayout;
import com.example.pdfrewrite.util.span.dto.SpanRecord;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SpanIndexTest {

    @Test
    void linesFarApartBecomeSeparateBlocks() throws Exception {
        PageGlyphLayout layout = TestDocuments.layout(TestDocuments.singlePage("The quick brown fox", "second line"), 0);

        List<SpanRecord> spans = layout.getSpans();
        assertThat(spans).hasSize(2);
        assertThat(spans.get(0).getRawText()).isEqualTo("The quick brown fox");
        assertThat(spans.get(1).getRawText()).isEqualTo("second line");
        assertThat(spans.get(1).getBlockIndex()).isGreaterThan(spans.get(0).getBlockIndex());
        assertThat(spans.get(0).getFontSize()).isEqualTo(TestDocuments.FONT_SIZE);
        assertThat(layout.findSpan(spans.get(1).getSpanId())).isSameAs(spans.get(1));
    }

    @Test
    void glyphBoxesUseTopLeftOrigin() throws Exception {
        PageGlyphLayout layout = TestDocuments.layout(TestDocuments.singlePage("Hi"), 0);

        SpanRecord span = layout.getSpans().get(0);
        float expectedBaseline = layout.getPageHeight() - TestDocuments.TOP;
        assertThat(span.getBbox().y1).isBetween(expectedBaseline, expectedBaseline + TestDocuments.FONT_SIZE);
        assertThat(span.getBbox().x0).isBetween(TestDocuments.LEFT - 1f, TestDocuments.LEFT + 1f);
    }

    @Test
    void separatedRunsOnOneLineBecomeSpans() throws Exception {
        PageGlyphLayout layout = TestDocuments.layout(
                TestDocuments.runsOnOneLine(new float[]{100f, 300f}, new String[]{"left", "right"}), 0);

        assertThat(layout.getSpans()).hasSize(2);
        assertThat(layout.getSpans().get(0).getLineIndex()).isEqualTo(layout.getSpans().get(1).getLineIndex());
        assertThat(layout.spansInReadingOrder().get(1).getRawText()).isEqualTo("right");
    }

    @Test
    void layoutIsCachedUntilInvalidated() throws Exception {
        try (PDDocument doc = Loader.loadPDF(TestDocuments.singlePage("cached text"))) {
            SpanIndex index = new SpanIndex(doc, "run-test");
            assertThat(index.isPageParsed(0)).isFalse();

            PageGlyphLayout first = index.layoutForPage(0);
            assertThat(index.isPageParsed(0)).isTrue();
            assertThat(index.layoutForPage(0)).isSameAs(first);

            index.invalidatePage(0);
            assertThat(index.isPageParsed(0)).isFalse();
            assertThat(index.layoutForPage(0)).isNotSameAs(first);
            assertThat(index.getStats()).contains("run=run-test", "pages=2", "hits=1");
        }
    }
}
