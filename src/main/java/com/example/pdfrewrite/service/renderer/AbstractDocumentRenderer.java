package com.example.pdfrewrite.service.renderer;

import com.example.pdfrewrite.config.RewriteSettings;
import com.example.pdfrewrite.service.RenderSession;
import com.example.pdfrewrite.service.dto.RenderResult;
import com.example.pdfrewrite.util.common.EntryFailure;
import com.example.pdfrewrite.util.locate.SubstringLocator;
import com.example.pdfrewrite.util.locate.dto.LocateResult;
import com.example.pdfrewrite.util.locate.dto.MappingEntry;
import com.example.pdfrewrite.util.span.dto.PageGlyphLayout;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 渲染器公共部分：按页分组、逐页定位并登记占用
 */
@Slf4j
public abstract class AbstractDocumentRenderer implements DocumentRenderer {

    protected final RewriteSettings settings;

    protected AbstractDocumentRenderer(RewriteSettings settings) {
        this.settings = settings;
    }

    /**
     * 按页码分组；页码缺失或超出文档页数的条目记为定位失败
     */
    protected Map<Integer, List<MappingEntry>> groupByPage(List<MappingEntry> entries, int pageCount,
                                                           RenderResult result) {
        Map<Integer, List<MappingEntry>> byPage = new TreeMap<>();
        for (MappingEntry entry : entries) {
            Integer page = entry.getPageIndex();
            if (page == null || page < 0 || page >= pageCount) {
                log.warn("条目页码超出文档范围: q={}, page={}, 文档共 {} 页", entry.getQLabel(), page, pageCount);
                result.addFailure(new EntryFailure(EntryFailure.Kind.LOCATION_NOT_FOUND,
                        page == null ? -1 : page, entry.getQLabel(), entry.getOriginal(),
                        "页码超出文档范围"));
                continue;
            }
            byPage.computeIfAbsent(page, k -> new ArrayList<>()).add(entry);
        }
        return byPage;
    }

    /**
     * 在一页上依次定位条目，成功的矩形与指纹登记到本页占用记录
     *
     * @return 定位成功的条目（保持输入顺序）
     */
    protected List<MappingEntry> locatePage(PageGlyphLayout layout, int pageIndex, List<MappingEntry> entries,
                                            RenderSession.PageClaims claims, RenderResult result) {
        SubstringLocator locator = new SubstringLocator(settings.getOccurrenceContext());
        List<MappingEntry> located = new ArrayList<>();
        for (MappingEntry entry : entries) {
            LocateResult found = locator.locate(layout, entry, claims.getUsedRects(), claims.getLocatedFingerprints());
            if (!found.isFound()) {
                log.warn("定位失败: page={}, q={}, original='{}', {} ({})", pageIndex + 1, entry.getQLabel(),
                        entry.getOriginal(), found.getFailure(), found.getDetail());
                result.addFailure(new EntryFailure(found.getFailure(), pageIndex, entry.getQLabel(),
                        entry.getOriginal(), found.getDetail()));
                continue;
            }
            claims.claim(found.getMatch().rect, entry.getFingerprintKey());
            result.getStatistics().matchFound();
            located.add(entry);
        }
        return located;
    }

    /**
     * 收尾：每个失败对应一条被跳过的条目
     */
    protected void finish(RenderResult result) {
        result.getStatistics().setEntriesSkipped(result.getFailures().size());
        log.info("渲染完成 [{}]: {}", kind(), result.getStatistics());
    }
}
