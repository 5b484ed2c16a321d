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
import com.example.pdfrewrite.util.overlay.VisualFallbackOverlay;
import com.example.pdfrewrite.util.plan.SpanRewritePlanBuilder;
import com.example.pdfrewrite.util.plan.TextWidthMeasurer;
import com.example.pdfrewrite.util.plan.dto.SpanRewriteEntry;
import com.example.pdfrewrite.util.plan.dto.SpanRewritePlan;
import com.example.pdfrewrite.util.rewrite.RewriteContext;
import com.example.pdfrewrite.util.rewrite.TokenRewriter;
import com.example.pdfrewrite.util.rewrite.dto.RewriteReport;
import com.example.pdfrewrite.util.span.dto.PageGlyphLayout;
import com.example.pdfrewrite.util.stream.GlyphStreamAligner;
import com.example.pdfrewrite.util.stream.ReplacementPlanner;
import com.example.pdfrewrite.util.stream.StreamSegmentExtractor;
import com.example.pdfrewrite.util.stream.dto.ReplacementPlan;
import com.example.pdfrewrite.util.stream.dto.ReplacementRecord;
import com.example.pdfrewrite.util.stream.dto.SegmentExtraction;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDResources;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * 内容流改写渲染器
 *
 * 逐页执行：
 * <ol>
 *   <li>定位：在字形布局中找到每条映射的矩形，登记占用</li>
 *   <li>分段：解析内容流，解码文本显示操作符</li>
 *   <li>对齐：把字形区间映射到内容流字符区间，附带置信度</li>
 *   <li>规划：确定互不重叠的替换记录</li>
 *   <li>改写：按策略顺序改写 token 并写回页面</li>
 *   <li>计划：汇总为按 span 的声明式改写计划</li>
 * </ol>
 *
 * 单页改写抛出异常时保留该页原内容，失败计入统计，不中断整个文档。
 */
@Slf4j
@Component
public class StreamRewriteRenderer extends AbstractDocumentRenderer {

    public StreamRewriteRenderer(RewriteSettings settings) {
        super(settings);
    }

    @Override
    public RendererKind kind() {
        return RendererKind.STREAM_REWRITE;
    }

    @Override
    public boolean rewritesTextLayer() {
        return true;
    }

    /**
     * 是否在改写后叠加视觉兜底
     */
    protected boolean overlayEnabled() {
        return false;
    }

    @Override
    public RenderResult render(byte[] pdfBytes, List<MappingEntry> entries, String runId) {
        RenderResult result = new RenderResult();
        RenderStatistics stats = result.getStatistics();
        stats.setRenderer(kind().name());
        stats.setEntriesTotal(entries.size());
        SpanRewritePlan plan = new SpanRewritePlan(runId);
        Map<Integer, List<Rect>> overlayRegions = new TreeMap<>();

        try (PdfDocumentHandle handle = PdfDocumentHandle.open(pdfBytes)) {
            stats.setPages(handle.getPageCount());
            RenderSession session = new RenderSession(handle.getDocument(), runId);
            log.info("开始内容流改写 [{}]: run={}, {} 页, {} 条映射",
                    kind(), runId, handle.getPageCount(), entries.size());

            Map<Integer, List<MappingEntry>> byPage = groupByPage(entries, handle.getPageCount(), result);
            for (Map.Entry<Integer, List<MappingEntry>> page : byPage.entrySet()) {
                List<Rect> regions = renderPage(handle, session, page.getKey(), page.getValue(), result, plan);
                if (!regions.isEmpty()) {
                    overlayRegions.put(page.getKey(), regions);
                }
            }

            if (overlayEnabled() && !overlayRegions.isEmpty()) {
                stats.applyOverlay(applyOverlay(pdfBytes, handle, overlayRegions));
            }
            result.setOutputBytes(handle.toBytes());
            log.debug(session.getSpanIndex().getStats());
        } catch (IOException e) {
            throw new RenderException("渲染输出失败: " + e.getMessage(), e);
        }

        result.setPlan(plan);
        finish(result);
        return result;
    }

    /**
     * 处理单页
     *
     * @return 本页需要视觉兜底的区域（未启用覆盖时为空）
     */
    private List<Rect> renderPage(PdfDocumentHandle handle, RenderSession session, int pageIndex,
                                  List<MappingEntry> pageEntries, RenderResult result, SpanRewritePlan plan) {
        RenderStatistics stats = result.getStatistics();
        RenderSession.PageClaims claims = session.claims(pageIndex);
        List<MappingEntry> located = null;
        List<EntryFailure> pageFailures = new ArrayList<>();
        try {
            PageGlyphLayout layout = session.getSpanIndex().layoutForPage(pageIndex);
            located = locatePage(layout, pageIndex, pageEntries, claims, result);
            if (located.isEmpty()) {
                return new ArrayList<>();
            }

            List<Object> tokens = handle.readTokens(pageIndex);
            PDResources resources = handle.resources(pageIndex);
            SegmentExtraction extraction = new StreamSegmentExtractor(settings.getSpaceThreshold())
                    .extract(tokens, resources);
            stats.addTokensScanned(extraction.getTokensScanned());
            stats.addTextShowOps(extraction.getTextShowOps());

            GlyphStreamAligner aligner = new GlyphStreamAligner(layout, extraction.getStreamText());
            for (MappingEntry entry : located) {
                if (!aligner.attach(entry.getMatch(), settings.getAlignmentMinConfidence())) {
                    log.debug("对齐置信度不足: q={}, original='{}', confidence={}", entry.getQLabel(),
                            entry.getOriginal(), entry.getMatch().getAlignmentConfidence());
                }
            }

            ReplacementPlan replacementPlan = new ReplacementPlanner(settings.getAlignmentMinConfidence())
                    .plan(extraction, located, claims.getConsumedFingerprints());
            pageFailures.addAll(replacementPlan.getFailures());

            List<ReplacementRecord> records = replacementPlan.getRecords();
            List<MappingEntry> applied = new ArrayList<>();
            if (!records.isEmpty()) {
                TokenRewriter rewriter = TokenRewriter.of(settings.getStrategies(),
                        settings.getCharWidthRatio(), settings.getMinReadableSize());
                RewriteReport report = rewriter.apply(tokens, extraction, records,
                        new RewriteContext(resources), pageIndex);
                pageFailures.addAll(report.getFailures());
                if (report.isModified()) {
                    handle.writeTokens(pageIndex, tokens);
                    session.getSpanIndex().invalidatePage(pageIndex);
                    stats.pageRewritten();
                }
                for (ReplacementRecord record : records) {
                    if (record.isApplied()) {
                        applied.add(record.getEntry());
                    }
                }
            }

            SpanRewritePlanBuilder builder = new SpanRewritePlanBuilder(layout,
                    new TextWidthMeasurer(settings.getCharWidthRatio()));
            builder.addRecords(records, extraction);
            Set<MappingEntry> planned = new HashSet<>();
            for (ReplacementRecord record : records) {
                planned.add(record.getEntry());
            }
            for (MappingEntry entry : located) {
                if (!planned.contains(entry)) {
                    builder.addEntry(entry, true, null);
                }
            }
            List<SpanRewriteEntry> pagePlan = builder.build();
            plan.addAll(pagePlan, builder.getValidationFailures());

            for (EntryFailure failure : pageFailures) {
                log.warn("页面 {} 条目未改写: {}", pageIndex + 1, failure);
                result.addFailure(failure);
            }
            result.getAppliedEntries().addAll(applied);
            stats.addReplacementsApplied(applied.size());
            log.info("页面 {} 处理完成: 定位 {} 条, 改写 {} 条, 失败 {} 条",
                    pageIndex + 1, located.size(), applied.size(), pageFailures.size());

            return overlayEnabled() ? overlayRegions(pagePlan, located, applied) : new ArrayList<>();
        } catch (IOException | IllegalStateException | IllegalArgumentException e) {
            log.warn("页面 {} 改写失败，保留原内容: {}", pageIndex + 1, e.getMessage(), e);
            stats.pageFailed();
            for (MappingEntry entry : located == null ? pageEntries : located) {
                result.addFailure(new EntryFailure(EntryFailure.Kind.REWRITE_FAILED, pageIndex,
                        entry.getQLabel(), entry.getOriginal(), "页面改写异常: " + e.getMessage()));
            }
            return new ArrayList<>();
        }
    }

    /**
     * 兜底区域：计划中标记兜底的行；本页改写覆盖率低于阈值时，加上全部已定位矩形
     */
    private List<Rect> overlayRegions(List<SpanRewriteEntry> pagePlan, List<MappingEntry> located,
                                      List<MappingEntry> applied) {
        List<Rect> regions = new ArrayList<>(VisualFallbackOverlay.regionsFor(pagePlan));
        double coverage = (double) applied.size() / located.size();
        if (coverage < settings.getOverlayCoverageThreshold()) {
            for (MappingEntry entry : located) {
                Rect rect = entry.getMatch().getRect();
                if (rect != null && !regions.contains(rect)) {
                    regions.add(rect);
                }
            }
        }
        return regions;
    }

    private OverlayStats applyOverlay(byte[] pdfBytes, PdfDocumentHandle target,
                                      Map<Integer, List<Rect>> overlayRegions) throws IOException {
        VisualFallbackOverlay overlay = new VisualFallbackOverlay(settings.getOverlayDpi(),
                settings.getOverlayMode(), settings.getOverlayPadding());
        OverlayStats total = new OverlayStats();
        try (PdfDocumentHandle source = PdfDocumentHandle.open(pdfBytes)) {
            for (Map.Entry<Integer, List<Rect>> page : overlayRegions.entrySet()) {
                try {
                    total.merge(overlay.apply(source.getDocument(), target.getDocument(),
                            page.getKey(), page.getValue()));
                } catch (IOException e) {
                    log.warn("页面 {} 视觉覆盖失败: {}", page.getKey() + 1, e.getMessage());
                }
            }
        }
        log.info("视觉覆盖完成: {} 个区域, 覆盖面积 {}%", total.getCount(), total.getAreaPct());
        return total;
    }
}
