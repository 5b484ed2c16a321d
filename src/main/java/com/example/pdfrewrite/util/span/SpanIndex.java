package com.example.pdfrewrite.util.span;

import com.example.pdfrewrite.util.span.dto.PageGlyphLayout;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * 页面级别的 span 缓存
 *
 * 核心思路：
 * 1. 每个页面只提取一次字形布局，后续定位直接读缓存
 * 2. 缓存归属于一次渲染（runId），随渲染会话创建和丢弃，新的运行总是从空缓存开始
 *
 * 单写者：同一页面不会在写入时被并发读取，调用方按页串行访问。
 */
public class SpanIndex {

    private static final Logger log = LoggerFactory.getLogger(SpanIndex.class);

    /**
     * 缓存结构：页码（0 基） → 页面布局
     */
    private final Map<Integer, PageGlyphLayout> cache = new HashMap<>();

    private final PDDocument doc;
    private final String runId;

    private int cacheHits = 0;
    private int pagesParsed = 0;
    private long totalParseTimeMs = 0;

    public SpanIndex(PDDocument doc, String runId) {
        this.doc = doc;
        this.runId = runId;
    }

    /**
     * 获取指定页面的布局，未解析时先提取并缓存
     */
    public synchronized PageGlyphLayout layoutForPage(int pageIndex) throws IOException {
        PageGlyphLayout cached = cache.get(pageIndex);
        if (cached != null) {
            cacheHits++;
            return cached;
        }

        long startTime = System.currentTimeMillis();
        PageGlyphLayout layout = new GlyphLayoutExtractor().extract(doc, pageIndex);
        cache.put(pageIndex, layout);
        pagesParsed++;

        long elapsed = System.currentTimeMillis() - startTime;
        totalParseTimeMs += elapsed;
        log.debug("页面 {} 字形布局提取完成: {} 个span, {} 个字形, 耗时 {}ms",
                pageIndex + 1, layout.getSpans().size(), layout.getGlyphCount(), elapsed);
        return layout;
    }

    /**
     * 使某一页的缓存失效（页面内容被改写后调用）
     */
    public synchronized void invalidatePage(int pageIndex) {
        cache.remove(pageIndex);
    }

    public synchronized boolean isPageParsed(int pageIndex) {
        return cache.containsKey(pageIndex);
    }

    /**
     * 获取缓存统计信息
     */
    public String getStats() {
        double avgParseTime = pagesParsed > 0 ? (totalParseTimeMs * 1.0 / pagesParsed) : 0;
        return String.format(
                "SpanIndex Stats: run=%s, pages=%d, hits=%d, totalParseTime=%dms, avgParseTime=%.1fms",
                runId, pagesParsed, cacheHits, totalParseTimeMs, avgParseTime
        );
    }
}
