package com.example.pdfrewrite.util.overlay;

import com.example.pdfrewrite.util.coordinate.Rect;
import com.example.pdfrewrite.util.plan.dto.SpanRewriteEntry;
import org.apache.pdfbox.multipdf.LayerUtility;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.form.PDFormXObject;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 视觉覆盖兜底
 *
 * 对文本改写不完整或无法确认的区域，把原文档对应区域合成到改写后的页面上，保证视觉与原文一致。
 * 这只是视觉兜底：需要可提取替换文本的调用方仍以内容流改写结果为准。
 *
 * 坐标使用左上角原点（与字形提取一致），绘制时换算为 PDF 坐标；不处理页面旋转和裁剪框偏移。
 */
public class VisualFallbackOverlay {

    private static final Logger log = LoggerFactory.getLogger(VisualFallbackOverlay.class);

    private final float dpi;
    private final OverlayMode mode;
    private final float padding;

    public VisualFallbackOverlay(float dpi, OverlayMode mode, float padding) {
        this.dpi = dpi;
        this.mode = mode;
        this.padding = padding;
    }

    /**
     * 把计划中需要兜底的条目按 (block, line) 合并为覆盖区域
     */
    public static List<Rect> regionsFor(List<SpanRewriteEntry> entries) {
        Map<String, Rect> byLine = new LinkedHashMap<>();
        for (SpanRewriteEntry entry : entries) {
            if (!entry.isOverlayFallback() || entry.getBbox() == null) {
                continue;
            }
            String key = entry.getPage() + ":" + entry.getBlock() + ":" + entry.getLine();
            byLine.merge(key, entry.getBbox(), Rect::union);
        }
        return new ArrayList<>(byLine.values());
    }

    /**
     * 把原文档第 pageIndex 页的若干区域合成到目标文档的同一页
     *
     * @param source    原文档
     * @param target    改写后的文档
     * @param pageIndex 页码（0 基）
     * @param regions   覆盖区域（左上角原点）
     * @return 本页覆盖统计
     * @throws IOException 渲染或写入异常
     */
    public OverlayStats apply(PDDocument source, PDDocument target, int pageIndex, List<Rect> regions)
            throws IOException {
        OverlayStats stats = new OverlayStats();
        PDPage page = target.getPage(pageIndex);
        PDRectangle box = page.getCropBox();
        stats.addPageArea((double) box.getWidth() * box.getHeight());

        List<Rect> clipped = new ArrayList<>();
        Rect pageRect = new Rect(0, 0, box.getWidth(), box.getHeight());
        for (Rect region : regions) {
            Rect padded = region.expand(padding);
            float x0 = Math.max(padded.x0, 0);
            float y0 = Math.max(padded.y0, 0);
            float x1 = Math.min(padded.x1, pageRect.x1);
            float y1 = Math.min(padded.y1, pageRect.y1);
            if (x1 > x0 && y1 > y0) {
                clipped.add(new Rect(x0, y0, x1, y1));
            }
        }
        if (clipped.isEmpty()) {
            return stats;
        }

        try (PDPageContentStream cs = new PDPageContentStream(target, page,
                PDPageContentStream.AppendMode.APPEND, true, true)) {
            if (mode == OverlayMode.VECTOR) {
                drawVector(source, target, pageIndex, clipped, box.getHeight(), cs);
            } else {
                drawRaster(source, target, pageIndex, clipped, box.getHeight(), cs);
            }
        }
        for (Rect rect : clipped) {
            stats.record(rect.area());
        }
        log.debug("页面 {} 视觉覆盖完成: {} 个区域, 模式 {}", pageIndex + 1, clipped.size(), mode);
        return stats;
    }

    private void drawVector(PDDocument source, PDDocument target, int pageIndex, List<Rect> regions,
                            float pageHeight, PDPageContentStream cs) throws IOException {
        PDFormXObject form = new LayerUtility(target).importPageAsForm(source, pageIndex);
        for (Rect rect : regions) {
            cs.saveGraphicsState();
            cs.addRect(rect.x0, Rect.toPdfY(rect.y1, pageHeight), rect.width(), rect.height());
            cs.clip();
            cs.drawForm(form);
            cs.restoreGraphicsState();
        }
    }

    private void drawRaster(PDDocument source, PDDocument target, int pageIndex, List<Rect> regions,
                            float pageHeight, PDPageContentStream cs) throws IOException {
        BufferedImage rendered = new PDFRenderer(source).renderImageWithDPI(pageIndex, dpi);
        float scale = dpi / 72f;
        for (Rect rect : regions) {
            int px = clamp(Math.round(rect.x0 * scale), rendered.getWidth() - 1);
            int py = clamp(Math.round(rect.y0 * scale), rendered.getHeight() - 1);
            int pw = Math.max(1, Math.min(Math.round(rect.width() * scale), rendered.getWidth() - px));
            int ph = Math.max(1, Math.min(Math.round(rect.height() * scale), rendered.getHeight() - py));
            BufferedImage crop = rendered.getSubimage(px, py, pw, ph);
            PDImageXObject image = LosslessFactory.createFromImage(target, crop);
            cs.drawImage(image, rect.x0, Rect.toPdfY(rect.y1, pageHeight), rect.width(), rect.height());
        }
    }

    private static int clamp(int value, int max) {
        return Math.max(0, Math.min(value, max));
    }
}
