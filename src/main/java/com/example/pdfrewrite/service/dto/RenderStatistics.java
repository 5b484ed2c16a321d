package com.example.pdfrewrite.service.dto;

import com.example.pdfrewrite.util.overlay.OverlayStats;
import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 渲染统计
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class RenderStatistics {

    @JsonProperty("renderer")
    private String renderer;
    @JsonProperty("pages")
    private int pages;
    @JsonProperty("text_show_ops")
    private int textShowOps;
    @JsonProperty("replacements_applied")
    private int replacementsApplied;
    @JsonProperty("matches_found")
    private int matchesFound;
    @JsonProperty("tokens_scanned")
    private int tokensScanned;
    @JsonProperty("pages_rewritten")
    private int pagesRewritten;
    @JsonProperty("page_failures")
    private int pageFailures;
    @JsonProperty("entries_total")
    private int entriesTotal;
    @JsonProperty("entries_skipped")
    private int entriesSkipped;
    @JsonProperty("overlay_count")
    private int overlayCount;
    @JsonProperty("overlay_area_pct")
    private double overlayAreaPct;

    public void addTextShowOps(int count) {
        textShowOps += count;
    }

    public void addReplacementsApplied(int count) {
        replacementsApplied += count;
    }

    public void matchFound() {
        matchesFound++;
    }

    public void addTokensScanned(int count) {
        tokensScanned += count;
    }

    public void pageRewritten() {
        pagesRewritten++;
    }

    public void pageFailed() {
        pageFailures++;
    }

    public void setEntriesSkipped(int entriesSkipped) {
        this.entriesSkipped = entriesSkipped;
    }

    public void applyOverlay(OverlayStats stats) {
        overlayCount = stats.getCount();
        overlayAreaPct = stats.getAreaPct();
    }

    public String getRenderer() {
        return renderer;
    }

    public void setRenderer(String renderer) {
        this.renderer = renderer;
    }

    public int getPages() {
        return pages;
    }

    public void setPages(int pages) {
        this.pages = pages;
    }

    public int getTextShowOps() {
        return textShowOps;
    }

    public int getReplacementsApplied() {
        return replacementsApplied;
    }

    public int getMatchesFound() {
        return matchesFound;
    }

    public int getTokensScanned() {
        return tokensScanned;
    }

    public int getPagesRewritten() {
        return pagesRewritten;
    }

    public int getPageFailures() {
        return pageFailures;
    }

    public int getEntriesTotal() {
        return entriesTotal;
    }

    public void setEntriesTotal(int entriesTotal) {
        this.entriesTotal = entriesTotal;
    }

    public int getEntriesSkipped() {
        return entriesSkipped;
    }

    public int getOverlayCount() {
        return overlayCount;
    }

    public double getOverlayAreaPct() {
        return overlayAreaPct;
    }

    @Override
    public String toString() {
        return "RenderStatistics{pages=" + pages + ", textShowOps=" + textShowOps
                + ", replacementsApplied=" + replacementsApplied + ", matchesFound=" + matchesFound
                + ", tokensScanned=" + tokensScanned + ", pagesRewritten=" + pagesRewritten
                + ", pageFailures=" + pageFailures + ", entriesSkipped=" + entriesSkipped
                + ", overlayCount=" + overlayCount + ", overlayAreaPct=" + overlayAreaPct + "}";
    }
}
