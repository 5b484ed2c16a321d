package com.example.pdfrewrite.util.stream;

import com.example.pdfrewrite.TestDocuments;
import com.example.pdfrewrite.util.stream.dto.SegmentExtraction;
import com.example.pdfrewrite.util.stream.dto.TextSegment;
import com.example.pdfrewrite.util.stream.dto.TjEntry;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.contentstream.operator.Operator;
import org.apache.pdfbox.cos.COSArray;
import org.apache.pdfbox.cos.COSFloat;
import org.apache.pdfbox.cos.COSInteger;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.cos.COSString;
import org.apache.pdfbox.pdfparser.PDFStreamParser;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StreamSegmentExtractorTest {

    private final StreamSegmentExtractor extractor = new StreamSegmentExtractor();

    private static COSArray array(Object... items) {
        COSArray array = new COSArray();
        for (Object item : items) {
            if (item instanceof String) {
                array.add(new COSString((String) item));
            } else {
                array.add(new COSFloat(((Number) item).floatValue()));
            }
        }
        return array;
    }

    @Test
    void wideKernInsertsSpaceAndIsRecorded() throws Exception {
        List<Object> tokens = new ArrayList<>(Arrays.asList(
                COSName.getPDFName("F1"), COSInteger.get(12), Operator.getOperator("Tf"),
                array("Hello", -250, "World", -20, "!"), Operator.getOperator("TJ")));

        SegmentExtraction extraction = extractor.extract(tokens, null);

        assertThat(extraction.getStreamText()).isEqualTo("Hello World!");
        assertThat(extraction.getTextShowOps()).isEqualTo(1);
        TextSegment segment = extraction.getSegments().get(0);
        assertThat(segment.isArrayShow()).isTrue();
        assertThat(segment.getOperatorIndex()).isEqualTo(4);
        assertThat(segment.getFontName()).isEqualTo("F1");
        assertThat(segment.getFontSize()).isEqualTo(12f);
        assertThat(segment.getKerns()).containsEntry(6, -250f).containsEntry(11, -20f);
        assertThat(segment.getEntries()).extracting(e -> e.kind)
                .containsExactly(TjEntry.Kind.TEXT, TjEntry.Kind.KERN, TjEntry.Kind.TEXT,
                        TjEntry.Kind.KERN, TjEntry.Kind.TEXT);
    }

    @Test
    void segmentsConcatenateToStreamText() throws Exception {
        List<Object> tokens = new ArrayList<>(Arrays.asList(
                new COSString("alpha "), Operator.getOperator("Tj"),
                array("beta"), Operator.getOperator("TJ"),
                new COSString(" gamma"), Operator.getOperator("Tj")));

        SegmentExtraction extraction = extractor.extract(tokens, null);

        assertThat(extraction.getStreamText()).isEqualTo("alpha beta gamma");
        assertThat(extraction.getSegments()).extracting(TextSegment::getStart).containsExactly(0, 6, 10);
        assertThat(extraction.getSegments()).extracting(TextSegment::getEnd).containsExactly(6, 10, 16);
        assertThat(extraction.segmentsOverlapping(5, 7)).hasSize(2);
        assertThat(extraction.getTokensScanned()).isEqualTo(16);
    }

    @Test
    void saveRestoreTracksFontAndScaling() throws Exception {
        List<Object> tokens = new ArrayList<>(Arrays.asList(
                COSName.getPDFName("F1"), COSInteger.get(10), Operator.getOperator("Tf"),
                Operator.getOperator("q"),
                COSName.getPDFName("F2"), COSInteger.get(20), Operator.getOperator("Tf"),
                COSInteger.get(80), Operator.getOperator("Tz"),
                new COSString("inner"), Operator.getOperator("Tj"),
                Operator.getOperator("Q"),
                new COSString("outer"), Operator.getOperator("Tj")));

        List<TextSegment> segments = extractor.extract(tokens, null).getSegments();

        assertThat(segments.get(0).getFontName()).isEqualTo("F2");
        assertThat(segments.get(0).getFontSize()).isEqualTo(20f);
        assertThat(segments.get(0).getHorizontalScaling()).isEqualTo(80f);
        assertThat(segments.get(1).getFontName()).isEqualTo("F1");
        assertThat(segments.get(1).getFontSize()).isEqualTo(10f);
        assertThat(segments.get(1).getHorizontalScaling()).isEqualTo(100f);
    }

    @Test
    void decodesThroughPageFont() throws Exception {
        byte[] pdf = TestDocuments.singlePage("The quick brown fox", "second line");
        try (PDDocument doc = Loader.loadPDF(pdf)) {
            PDPage page = doc.getPage(0);
            List<Object> tokens = new PDFStreamParser(page).parse();

            SegmentExtraction extraction = extractor.extract(tokens, page.getResources());

            assertThat(extraction.getStreamText()).isEqualTo("The quick brown foxsecond line");
            assertThat(extraction.getTextShowOps()).isEqualTo(2);
            TjEntry entry = extraction.getSegments().get(0).getEntries().get(0);
            assertThat(entry.codes).hasSize(19);
            assertThat(entry.codes.get(0).width).isPositive();
        }
    }
}
