package com.example.pdfrewrite.service.renderer;

import com.example.pdfrewrite.config.RewriteSettings;
import com.example.pdfrewrite.exception.RenderException;
import com.example.pdfrewrite.service.PdfDocumentHandle;
import com.example.pdfrewrite.service.RenderSession;
import com.example.pdfrewrite.service.dto.RenderResult;
import com.example.pdfrewrite.service.dto.RenderStatistics;
import com.example.pdfrewrite.util.common.EntryFailure;
import com.example.pdfrewrite.util.coordinate.Rect;
import com.example.pdfrewrite.util.locate.dto.MappingEntry;
import com.example.pdfrewrite.util.overlay.OverlayStats;
import com.example.pdfrewrite.util.plan.SpanRewritePlanBuilder;
import com.example.pdfrewrite.util.plan.TextWidthMeasurer;
import com.example.pdfrewrite.util.plan.dto.SpanRewritePlan;
import com.example.pdfrewrite.util.span.dto.PageGlyphLayout;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.springframework.stereotype.Component;

import java.awt.Color;
import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * 纯视觉覆盖渲染器
 *
 * 在定位到的矩形上先铺白底，再用 Helvetica 绘制替换文本；内容流中的原文保持不变，
 * 因此文本提取仍会得到原文，不做输出文本校验。
 */
@Slf4j
@Component
public class LiteralOverlayRenderer extends AbstractDocumentRenderer {

    private static final float MIN_FONT_SIZE = 4f;
    private static final float BASELINE_RATIO = 0.2f;

    public LiteralOverlayRenderer(RewriteSettings settings) {
        super(settings);
    }

    @Override
    public RendererKind kind() {
        return RendererKind.LITERAL_OVERLAY;
    }

    @Override
    public boolean rewritesTextLayer() {
        return false;
    }

    @Override
    public RenderResult render(byte[] pdfBytes, List<MappingEntry> entries, String runId) {
        RenderResult result = new RenderResult();
        RenderStatistics stats = result.getStatistics();
        stats.setRenderer(kind().name());
        stats.setEntriesTotal(entries.size());
        SpanRewritePlan plan = new SpanRewritePlan(runId);
        OverlayStats overlayStats = new OverlayStats();
        PDFont font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);

        try (PdfDocumentHandle handle = PdfDocumentHandle.open(pdfBytes)) {
            stats.setPages(handle.getPageCount());
            RenderSession session = new RenderSession(handle.getDocument(), runId);
            Map<Integer, List<MappingEntry>> byPage = groupByPage(entries, handle.getPageCount(), result);

            for (Map.Entry<Integer, List<MappingEntry>> page : byPage.entrySet()) {
                renderPage(handle, session, page.getKey(), page.getValue(), font, plan, overlayStats, result);
            }
            stats.applyOverlay(overlayStats);
            result.setOutputBytes(handle.toBytes());
        } catch (IOException e) {
            throw new RenderException("视觉覆盖渲染失败: " + e.getMessage(), e);
        }

        result.setPlan(plan);
        finish(result);
        return result;
    }

    /**
     * 单页覆盖；本页出错时恢复原内容流，条目记为改写失败，其余页面照常处理
     */
    private void renderPage(PdfDocumentHandle handle, RenderSession session, int pageIndex,
                            List<MappingEntry> pageEntries, PDFont font, SpanRewritePlan plan,
                            OverlayStats overlayStats, RenderResult result) {
        RenderStatistics stats = result.getStatistics();
        PDPage pdPage = handle.getPage(pageIndex);
        COSBase originalContents = pdPage.getCOSObject().getItem(COSName.CONTENTS);
        List<MappingEntry> located = null;
        try {
            PageGlyphLayout layout = session.getSpanIndex().layoutForPage(pageIndex);
            located = locatePage(layout, pageIndex, pageEntries, session.claims(pageIndex), result);
            if (located.isEmpty()) {
                return;
            }
            drawPage(handle.getDocument(), pdPage, font, located, layout.getPageHeight());

            overlayStats.addPageArea((double) layout.getPageWidth() * layout.getPageHeight());
            SpanRewritePlanBuilder builder = new SpanRewritePlanBuilder(layout,
                    new TextWidthMeasurer(settings.getCharWidthRatio()));
            for (MappingEntry entry : located) {
                overlayStats.record(entry.getMatch().getRect().area());
                builder.addEntry(entry, true, null);
                result.getAppliedEntries().add(entry);
            }
            plan.addAll(builder.build(), builder.getValidationFailures());
            stats.addReplacementsApplied(located.size());
            stats.pageRewritten();
            log.info("页面 {} 视觉覆盖完成: {} 条", pageIndex + 1, located.size());
        } catch (IOException | IllegalStateException | IllegalArgumentException e) {
            log.warn("页面 {} 视觉覆盖失败，保留原内容: {}", pageIndex + 1, e.getMessage(), e);
            pdPage.getCOSObject().setItem(COSName.CONTENTS, originalContents);
            stats.pageFailed();
            for (MappingEntry entry : located == null ? pageEntries : located) {
                result.addFailure(new EntryFailure(EntryFailure.Kind.REWRITE_FAILED, pageIndex,
                        entry.getQLabel(), entry.getOriginal(), "页面覆盖异常: " + e.getMessage()));
            }
        }
    }

    /**
     * 在页面末尾追加一个内容流，逐条铺白底并绘制替换文本
     */
    void drawPage(PDDocument document, PDPage page, PDFont font, List<MappingEntry> located,
                  float pageHeight) throws IOException {
        try (PDPageContentStream cs = new PDPageContentStream(document, page,
                PDPageContentStream.AppendMode.APPEND, true, true)) {
            for (MappingEntry entry : located) {
                drawReplacement(cs, font, entry.getMatch().getRect(), entry, pageHeight);
            }
        }
    }

    private void drawReplacement(PDPageContentStream cs, PDFont font, Rect rect, MappingEntry entry,
                                 float pageHeight) throws IOException {
        cs.setNonStrokingColor(Color.WHITE);
        cs.addRect(rect.x0, Rect.toPdfY(rect.y1, pageHeight), rect.width(), rect.height());
        cs.fill();

        String text = sanitize(font, entry.getReplacement());
        if (text.isEmpty()) {
            return;
        }
        float fontSize = entry.getMatch().getFontSize() > 0 ? entry.getMatch().getFontSize() : rect.height() * 0.8f;
        float width = font.getStringWidth(text) / 1000f * fontSize;
        if (width > rect.width() && width > 0f) {
            fontSize = Math.max(MIN_FONT_SIZE, fontSize * rect.width() / width);
        }
        cs.setNonStrokingColor(Color.BLACK);
        cs.beginText();
        cs.setFont(font, fontSize);
        cs.newLineAtOffset(rect.x0, Rect.toPdfY(rect.y1 - BASELINE_RATIO * fontSize, pageHeight));
        cs.showText(text);
        cs.endText();
    }

    /**
     * 换行折叠为空格，字体无法编码的字符替换为 '?'
     */
    static String sanitize(PDFont font, String text) {
        StringBuilder sb = new StringBuilder();
        String flat = text.replaceAll("[\\r\\n]+", " ").trim();
        for (int i = 0; i < flat.length(); ) {
            int cp = flat.codePointAt(i);
            String ch = new String(Character.toChars(cp));
            try {
                font.encode(ch);
                sb.append(ch);
            } catch (IllegalArgumentException | IOException e) {
                sb.append('?');
            }
            i += Character.charCount(cp);
        }
        return sb.toString();
    }
}
