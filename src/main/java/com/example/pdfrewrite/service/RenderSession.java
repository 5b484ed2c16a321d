package com.example.pdfrewrite.service;

import com.example.pdfrewrite.util.coordinate.Rect;
import com.example.pdfrewrite.util.span.SpanIndex;
import org.apache.pdfbox.pdmodel.PDDocument;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 一次渲染的会话状态
 *
 * 持有页面 span 缓存和逐页的占用记录（已占用矩形、定位阶段与规划阶段的指纹），
 * 只在本次渲染内有效，不跨运行共享。
 */
public class RenderSession {

    private final String runId;
    private final SpanIndex spanIndex;
    private final Map<Integer, PageClaims> claims = new HashMap<>();

    public RenderSession(PDDocument document, String runId) {
        this.runId = runId;
        this.spanIndex = new SpanIndex(document, runId);
    }

    public String getRunId() {
        return runId;
    }

    public SpanIndex getSpanIndex() {
        return spanIndex;
    }

    public PageClaims claims(int pageIndex) {
        return claims.computeIfAbsent(pageIndex, k -> new PageClaims());
    }

    /**
     * 单页占用记录
     */
    public static class PageClaims {
        private final List<Rect> usedRects = new ArrayList<>();
        private final Set<String> locatedFingerprints = new HashSet<>();
        private final Set<String> consumedFingerprints = new HashSet<>();

        public void claim(Rect rect, String fingerprintKey) {
            if (rect != null) {
                usedRects.add(rect);
            }
            if (fingerprintKey != null) {
                locatedFingerprints.add(fingerprintKey);
            }
        }

        public List<Rect> getUsedRects() {
            return usedRects;
        }

        public Set<String> getLocatedFingerprints() {
            return locatedFingerprints;
        }

        public Set<String> getConsumedFingerprints() {
            return consumedFingerprints;
        }
    }
}
