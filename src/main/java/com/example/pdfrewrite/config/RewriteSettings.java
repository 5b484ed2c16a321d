package com.example.pdfrewrite.config;

import com.example.pdfrewrite.service.renderer.RendererKind;
import com.example.pdfrewrite.util.overlay.OverlayMode;
import com.example.pdfrewrite.util.rewrite.RewriteStrategyKind;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 改写参数
 *
 * 由 {@link RewriteConfig} 从 application.yml 填充；单元测试直接 new 使用默认值。
 */
public class RewriteSettings {

    private String workDir = "/data/pdf_rewrite";
    private RendererKind renderer = RendererKind.STREAM_REWRITE_WITH_OVERLAY;

    /** TJ 字距不高于该值时视为空格 */
    private float spaceThreshold = -80f;
    private int fingerprintWindow = 24;
    private int occurrenceContext = 32;
    private double alignmentMinConfidence = 0.8;

    private float charWidthRatio = 0.6f;
    private float minReadableSize = 4f;
    private List<RewriteStrategyKind> strategies = new ArrayList<>(
            Arrays.asList(RewriteStrategyKind.SUBSTITUTE_FONT, RewriteStrategyKind.LITERAL));

    private float overlayDpi = 216f;
    /** 页面改写覆盖率低于该值时，本页全部已定位条目都做视觉覆盖 */
    private double overlayCoverageThreshold = 1.0;
    private OverlayMode overlayMode = OverlayMode.RASTER;
    private float overlayPadding = 1f;

    private boolean validationEnabled = true;
    private float validationBboxPadding = 10f;

    public String getWorkDir() {
        return workDir;
    }

    public void setWorkDir(String workDir) {
        this.workDir = workDir;
    }

    public RendererKind getRenderer() {
        return renderer;
    }

    public void setRenderer(RendererKind renderer) {
        this.renderer = renderer;
    }

    public float getSpaceThreshold() {
        return spaceThreshold;
    }

    public void setSpaceThreshold(float spaceThreshold) {
        this.spaceThreshold = spaceThreshold;
    }

    public int getFingerprintWindow() {
        return fingerprintWindow;
    }

    public void setFingerprintWindow(int fingerprintWindow) {
        this.fingerprintWindow = fingerprintWindow;
    }

    public int getOccurrenceContext() {
        return occurrenceContext;
    }

    public void setOccurrenceContext(int occurrenceContext) {
        this.occurrenceContext = occurrenceContext;
    }

    public double getAlignmentMinConfidence() {
        return alignmentMinConfidence;
    }

    public void setAlignmentMinConfidence(double alignmentMinConfidence) {
        this.alignmentMinConfidence = alignmentMinConfidence;
    }

    public float getCharWidthRatio() {
        return charWidthRatio;
    }

    public void setCharWidthRatio(float charWidthRatio) {
        this.charWidthRatio = charWidthRatio;
    }

    public float getMinReadableSize() {
        return minReadableSize;
    }

    public void setMinReadableSize(float minReadableSize) {
        this.minReadableSize = minReadableSize;
    }

    public List<RewriteStrategyKind> getStrategies() {
        return strategies;
    }

    public void setStrategies(List<RewriteStrategyKind> strategies) {
        this.strategies = strategies;
    }

    public float getOverlayDpi() {
        return overlayDpi;
    }

    public void setOverlayDpi(float overlayDpi) {
        this.overlayDpi = overlayDpi;
    }

    public double getOverlayCoverageThreshold() {
        return overlayCoverageThreshold;
    }

    public void setOverlayCoverageThreshold(double overlayCoverageThreshold) {
        this.overlayCoverageThreshold = overlayCoverageThreshold;
    }

    public OverlayMode getOverlayMode() {
        return overlayMode;
    }

    public void setOverlayMode(OverlayMode overlayMode) {
        this.overlayMode = overlayMode;
    }

    public float getOverlayPadding() {
        return overlayPadding;
    }

    public void setOverlayPadding(float overlayPadding) {
        this.overlayPadding = overlayPadding;
    }

    public boolean isValidationEnabled() {
        return validationEnabled;
    }

    public void setValidationEnabled(boolean validationEnabled) {
        this.validationEnabled = validationEnabled;
    }

    public float getValidationBboxPadding() {
        return validationBboxPadding;
    }

    public void setValidationBboxPadding(float validationBboxPadding) {
        this.validationBboxPadding = validationBboxPadding;
    }

    @Override
    public String toString() {
        return "RewriteSettings{renderer=" + renderer + ", strategies=" + strategies + ", overlay=" + overlayMode
                + "@" + overlayDpi + "dpi, validation=" + validationEnabled + "}";
    }
}
