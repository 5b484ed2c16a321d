package com.example.pdfrewrite.util.span;

import com.example.pdfrewrite.util.coordinate.Rect;
import com.example.pdfrewrite.util.span.dto.GlyphBox;
import com.example.pdfrewrite.util.span.dto.PageGlyphLayout;
import com.example.pdfrewrite.util.span.dto.SpanRecord;
import com.example.pdfrewrite.util.text.TextNormalizer;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;
import org.apache.pdfbox.util.Matrix;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

/**
 * 字形布局提取器
 * 按内容流顺序收集页面每个字形的 TextPosition，并分组为 block → line → span
 *
 * <h3>分组规则</h3>
 * <ul>
 *   <li>基线偏移超过半个字号，或 x 明显回退：换行</li>
 *   <li>换行时纵向间距超过 1.8 倍字号，或基线向上跳：换块</li>
 *   <li>同一行内字体或字号变化，或水平间隙超过 2.5 倍字号：换 span</li>
 * </ul>
 *
 * 坐标使用 DirAdj（左上角原点），字形框高度按字号估算：基线上 0.8em，基线下 0.2em。
 */
public class GlyphLayoutExtractor extends PDFTextStripper {

    private static final float ASCENT_RATIO = 0.8f;
    private static final float DESCENT_RATIO = 0.2f;

    private final List<TextPosition> positions = new ArrayList<>();

    public GlyphLayoutExtractor() {
        super();
        setSortByPosition(false);
    }

    /**
     * 提取指定页（0 基）的字形布局
     *
     * @param document  PDF 文档
     * @param pageIndex 页码（0 基）
     * @return 页面布局
     * @throws IOException 内容流解析异常
     */
    public PageGlyphLayout extract(PDDocument document, int pageIndex) throws IOException {
        positions.clear();
        setStartPage(pageIndex + 1);
        setEndPage(pageIndex + 1);
        writeText(document, new StringWriter());

        PDPage page = document.getPage(pageIndex);
        PDRectangle box = page.getCropBox();
        return new PageGlyphLayout(pageIndex, box.getWidth(), box.getHeight(), groupSpans(pageIndex));
    }

    /**
     * 只收集字形，不走父类的排序与输出逻辑
     */
    @Override
    protected void processTextPosition(TextPosition text) {
        String unicode = text.getUnicode();
        if (unicode == null || TextNormalizer.stripZeroWidth(unicode).isEmpty()) {
            return;
        }
        positions.add(text);
    }

    private List<SpanRecord> groupSpans(int pageIndex) {
        List<SpanRecord> spans = new ArrayList<>();

        int block = -1;
        int line = -1;
        int span = -1;
        List<GlyphBox> current = new ArrayList<>();
        String currentFont = null;
        float currentSize = 0f;
        float[] currentMatrix = null;
        float lineBaseline = 0f;
        float lastX1 = 0f;

        for (TextPosition tp : positions) {
            float size = fontSizeOf(tp);
            String fontName = tp.getFont() != null && tp.getFont().getName() != null
                    ? tp.getFont().getName() : "unknown";
            float x = tp.getXDirAdj();
            float baseline = tp.getYDirAdj();

            boolean newLine;
            boolean newBlock = false;
            if (block < 0) {
                newLine = true;
                newBlock = true;
            } else {
                newLine = Math.abs(baseline - lineBaseline) > size * 0.5f || x < lastX1 - size * 1.5f;
                if (newLine) {
                    float gap = baseline - lineBaseline;
                    newBlock = gap > size * 1.8f || gap < -size * 0.5f;
                }
            }

            boolean newSpan = newLine
                    || !fontName.equals(currentFont)
                    || Math.abs(size - currentSize) > 0.1f
                    || x - lastX1 > size * 2.5f;

            if (newSpan && !current.isEmpty()) {
                spans.add(new SpanRecord(pageIndex, block, line, span, currentFont, currentSize, currentMatrix, current));
                current = new ArrayList<>();
            }
            if (newBlock) {
                block++;
                line = -1;
            }
            if (newLine) {
                line++;
                span = -1;
                lineBaseline = baseline;
            }
            if (newSpan) {
                span++;
                currentFont = fontName;
                currentSize = size;
                currentMatrix = toArray(tp.getTextMatrix());
            }

            appendGlyphs(current, tp, size);
            lastX1 = x + tp.getWidthDirAdj();
        }

        if (!current.isEmpty()) {
            spans.add(new SpanRecord(pageIndex, block, line, span, currentFont, currentSize, currentMatrix, current));
        }
        return spans;
    }

    /**
     * 一个字形可能映射多个字符（如 ToUnicode 中的连字），宽度均分给每个字符
     */
    private void appendGlyphs(List<GlyphBox> target, TextPosition tp, float size) {
        String unicode = TextNormalizer.stripZeroWidth(tp.getUnicode());
        float x = tp.getXDirAdj();
        float baseline = tp.getYDirAdj();
        float width = tp.getWidthDirAdj();
        float step = width / unicode.length();
        for (int i = 0; i < unicode.length(); i++) {
            float cx0 = x + step * i;
            Rect rect = new Rect(cx0, baseline - size * ASCENT_RATIO, cx0 + step, baseline + size * DESCENT_RATIO);
            target.add(new GlyphBox(String.valueOf(unicode.charAt(i)), rect, cx0, baseline));
        }
    }

    private static float fontSizeOf(TextPosition tp) {
        float size = tp.getFontSizeInPt();
        if (size <= 0f) {
            size = tp.getFontSize();
        }
        return size > 0f ? size : 10f;
    }

    private static float[] toArray(Matrix m) {
        if (m == null) {
            return new float[]{1, 0, 0, 1, 0, 0};
        }
        return new float[]{m.getScaleX(), m.getShearY(), m.getShearX(), m.getScaleY(), m.getTranslateX(), m.getTranslateY()};
    }
}
