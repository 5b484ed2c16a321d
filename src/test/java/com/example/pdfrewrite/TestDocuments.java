package com.example.pdfrewrite;

import com.example.pdfrewrite.util.coordinate.Rect;
import com.example.pdfrewrite.util.span.GlyphLayoutExtractor;
import com.example.pdfrewrite.util.span.dto.GlyphBox;
import com.example.pdfrewrite.util.span.dto.PageGlyphLayout;
import com.example.pdfrewrite.util.span.dto.SpanRecord;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.pdfbox.text.PDFTextStripper;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * 测试用的内存 PDF 与字形布局
 */
public final class TestDocuments {

    public static final float FONT_SIZE = 12f;
    public static final float LEFT = 72f;
    public static final float TOP = 720f;
    public static final float LINE_GAP = 40f;

    private TestDocuments() {
    }

    /**
     * 单页文档，每个参数一行 Helvetica 12pt 文本
     */
    public static byte[] singlePage(String... lines) throws IOException {
        try (PDDocument doc = new PDDocument()) {
            PDPage page = new PDPage(PDRectangle.LETTER);
            doc.addPage(page);
            try (PDPageContentStream cs = new PDPageContentStream(doc, page)) {
                cs.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), FONT_SIZE);
                for (int i = 0; i < lines.length; i++) {
                    cs.beginText();
                    cs.newLineAtOffset(LEFT, TOP - LINE_GAP * i);
                    cs.showText(lines[i]);
                    cs.endText();
                }
            }
            return save(doc);
        }
    }

    /**
     * 单页文档，lineCount 行相同的 TJ 文本，pieces 为字符串与字距交替的 TJ 数组，行距 20pt
     */
    public static byte[] kernedLines(int lineCount, Object... pieces) throws IOException {
        try (PDDocument doc = new PDDocument()) {
            PDPage page = new PDPage(PDRectangle.LETTER);
            doc.addPage(page);
            try (PDPageContentStream cs = new PDPageContentStream(doc, page)) {
                cs.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), FONT_SIZE);
                for (int i = 0; i < lineCount; i++) {
                    cs.beginText();
                    cs.newLineAtOffset(LEFT, TOP - 20f * i);
                    cs.showTextWithPositioning(pieces);
                    cs.endText();
                }
            }
            return save(doc);
        }
    }

    /**
     * 单页文档，一行文本由多个连续的 Tj 组成
     */
    public static byte[] splitShows(String... shows) throws IOException {
        try (PDDocument doc = new PDDocument()) {
            PDPage page = new PDPage(PDRectangle.LETTER);
            doc.addPage(page);
            try (PDPageContentStream cs = new PDPageContentStream(doc, page)) {
                cs.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), FONT_SIZE);
                cs.beginText();
                cs.newLineAtOffset(LEFT, TOP);
                for (String show : shows) {
                    cs.showText(show);
                }
                cs.endText();
            }
            return save(doc);
        }
    }

    /**
     * 多页文档，每个参数一页，一行文本
     */
    public static byte[] pagesOf(String... pageTexts) throws IOException {
        try (PDDocument doc = new PDDocument()) {
            for (String text : pageTexts) {
                PDPage page = new PDPage(PDRectangle.LETTER);
                doc.addPage(page);
                try (PDPageContentStream cs = new PDPageContentStream(doc, page)) {
                    cs.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), FONT_SIZE);
                    cs.beginText();
                    cs.newLineAtOffset(LEFT, TOP);
                    cs.showText(text);
                    cs.endText();
                }
            }
            return save(doc);
        }
    }

    /**
     * 单页文档，同一基线上在给定 x 位置各绘制一段文本（各自成为独立的 span）
     */
    public static byte[] runsOnOneLine(float[] xs, String[] texts) throws IOException {
        try (PDDocument doc = new PDDocument()) {
            PDPage page = new PDPage(PDRectangle.LETTER);
            doc.addPage(page);
            try (PDPageContentStream cs = new PDPageContentStream(doc, page)) {
                cs.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), FONT_SIZE);
                for (int i = 0; i < texts.length; i++) {
                    cs.beginText();
                    cs.newLineAtOffset(xs[i], TOP);
                    cs.showText(texts[i]);
                    cs.endText();
                }
            }
            return save(doc);
        }
    }

    public static PageGlyphLayout layout(byte[] pdf, int pageIndex) throws IOException {
        try (PDDocument doc = Loader.loadPDF(pdf)) {
            return new GlyphLayoutExtractor().extract(doc, pageIndex);
        }
    }

    public static String extractText(byte[] pdf) throws IOException {
        try (PDDocument doc = Loader.loadPDF(pdf)) {
            return new PDFTextStripper().getText(doc);
        }
    }

    /**
     * 手工构造的 span：每个字符宽 0.5em
     */
    public static SpanRecord span(int block, int line, int spanIndex, String text, float x, float baseline) {
        List<GlyphBox> glyphs = new ArrayList<>();
        float step = FONT_SIZE * 0.5f;
        for (int i = 0; i < text.length(); i++) {
            float cx = x + step * i;
            Rect rect = new Rect(cx, baseline - FONT_SIZE * 0.8f, cx + step, baseline + FONT_SIZE * 0.2f);
            glyphs.add(new GlyphBox(String.valueOf(text.charAt(i)), rect, cx, baseline));
        }
        return new SpanRecord(0, block, line, spanIndex, "Helvetica", FONT_SIZE,
                new float[]{1, 0, 0, 1, x, baseline}, glyphs);
    }

    private static byte[] save(PDDocument doc) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        doc.save(out);
        return out.toByteArray();
    }
}
