package com.example.pdfrewrite.service.renderer;

import com.example.pdfrewrite.TestDocuments;
import com.example.pdfrewrite.config.RewriteSettings;
import com.example.pdfrewrite.service.dto.RenderResult;
import com.example.pdfrewrite.util.common.EntryFailure;
import com.example.pdfrewrite.util.locate.dto.MappingEntry;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.cos.COSArray;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.cos.COSStream;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LiteralOverlayRendererTest {

    @Test
    void replacementIsDrawnOverOriginal() throws Exception {
        byte[] pdf = TestDocuments.singlePage("The quick brown fox");
        MappingEntry entry = new MappingEntry("1", 0, "brown", "red");
        entry.setPageIndex(0);
        LiteralOverlayRenderer renderer = new LiteralOverlayRenderer(new RewriteSettings());

        RenderResult result = renderer.render(pdf, Collections.singletonList(entry), "run");

        assertThat(renderer.rewritesTextLayer()).isFalse();
        String text = TestDocuments.extractText(result.getOutputBytes());
        assertThat(text).contains("red").contains("brown");
        assertThat(result.getStatistics().getOverlayCount()).isEqualTo(1);
        assertThat(result.getAppliedEntries()).containsExactly(entry);
        assertThat(result.getPlan().getEntries()).hasSize(1);
        assertThat(result.getPlan().getEntries().get(0).isOverlayFallback()).isTrue();
    }

    @Test
    void failedPageKeepsOriginalContentAndOtherPagesContinue() throws Exception {
        byte[] pdf = TestDocuments.pagesOf("The quick brown fox", "A lazy brown dog");
        MappingEntry first = new MappingEntry("1", 0, "quick", "slow");
        first.setPageIndex(0);
        MappingEntry second = new MappingEntry("2", 0, "lazy", "busy");
        second.setPageIndex(1);
        LiteralOverlayRenderer renderer = new LiteralOverlayRenderer(new RewriteSettings()) {
            @Override
            void drawPage(PDDocument document, PDPage page, PDFont font, List<MappingEntry> located,
                          float pageHeight) throws IOException {
                if (document.getPages().indexOf(page) == 0) {
                    try (PDPageContentStream cs = new PDPageContentStream(document, page,
                            PDPageContentStream.AppendMode.APPEND, true, true)) {
                        cs.addRect(0, 0, 10, 10);
                        cs.fill();
                        throw new IOException("内容流写入中断");
                    }
                }
                super.drawPage(document, page, font, located, pageHeight);
            }
        };

        RenderResult result = renderer.render(pdf, Arrays.asList(first, second), "run");

        assertThat(result.getStatistics().getPageFailures()).isEqualTo(1);
        assertThat(result.getStatistics().getPagesRewritten()).isEqualTo(1);
        assertThat(result.getStatistics().getOverlayCount()).isEqualTo(1);
        assertThat(result.getAppliedEntries()).containsExactly(second);
        assertThat(result.getFailures()).hasSize(1);
        assertThat(result.getFailures().get(0).getKind()).isEqualTo(EntryFailure.Kind.REWRITE_FAILED);
        assertThat(result.getFailures().get(0).getQLabel()).isEqualTo("1");
        assertThat(result.getStatistics().getEntriesSkipped()).isEqualTo(1);

        try (PDDocument out = Loader.loadPDF(result.getOutputBytes())) {
            assertThat(out.getPage(0).getCOSObject().getDictionaryObject(COSName.CONTENTS))
                    .isInstanceOf(COSStream.class);
            assertThat(out.getPage(1).getCOSObject().getDictionaryObject(COSName.CONTENTS))
                    .isInstanceOf(COSArray.class);
        }
    }

    @Test
    void sanitizeFlattensLinesAndReplacesUnencodable() {
        PDType1Font helvetica = new PDType1Font(Standard14Fonts.FontName.HELVETICA);

        assertThat(LiteralOverlayRenderer.sanitize(helvetica, "two\nlines")).isEqualTo("two lines");
        assertThat(LiteralOverlayRenderer.sanitize(helvetica, "x中y")).isEqualTo("x?y");
    }
}
