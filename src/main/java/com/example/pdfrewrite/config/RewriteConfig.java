package com.example.pdfrewrite.config;

import com.example.pdfrewrite.service.renderer.RendererKind;
import com.example.pdfrewrite.util.overlay.OverlayMode;
import com.example.pdfrewrite.util.rewrite.RewriteStrategyKind;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * 改写参数配置（application.yml 中 rewrite.* 前缀）
 */
@Slf4j
@Configuration
public class RewriteConfig {

    @Value("${rewrite.work-dir:/data/pdf_rewrite}")
    private String workDir;

    @Value("${rewrite.renderer:STREAM_REWRITE_WITH_OVERLAY}")
    private RendererKind renderer;

    @Value("${rewrite.space-threshold:-80}")
    private float spaceThreshold;

    @Value("${rewrite.fingerprint-window:24}")
    private int fingerprintWindow;

    @Value("${rewrite.occurrence-context:32}")
    private int occurrenceContext;

    @Value("${rewrite.alignment-min-confidence:0.8}")
    private double alignmentMinConfidence;

    @Value("${rewrite.substitute-font.char-width-ratio:0.6}")
    private float charWidthRatio;

    @Value("${rewrite.substitute-font.min-readable-size:4.0}")
    private float minReadableSize;

    @Value("${rewrite.strategies:SUBSTITUTE_FONT,LITERAL}")
    private String strategies;

    @Value("${rewrite.overlay.dpi:216}")
    private float overlayDpi;

    @Value("${rewrite.overlay.coverage-threshold:1.0}")
    private double overlayCoverageThreshold;

    @Value("${rewrite.overlay.mode:RASTER}")
    private OverlayMode overlayMode;

    @Value("${rewrite.overlay.padding:1.0}")
    private float overlayPadding;

    @Value("${rewrite.validation.enabled:true}")
    private boolean validationEnabled;

    @Value("${rewrite.validation.bbox-padding:10}")
    private float validationBboxPadding;

    @Bean
    public RewriteSettings rewriteSettings() {
        RewriteSettings settings = new RewriteSettings();
        settings.setWorkDir(workDir);
        settings.setRenderer(renderer);
        settings.setSpaceThreshold(spaceThreshold);
        settings.setFingerprintWindow(fingerprintWindow);
        settings.setOccurrenceContext(occurrenceContext);
        settings.setAlignmentMinConfidence(alignmentMinConfidence);
        settings.setCharWidthRatio(charWidthRatio);
        settings.setMinReadableSize(minReadableSize);
        settings.setStrategies(parseStrategies(strategies));
        settings.setOverlayDpi(overlayDpi);
        settings.setOverlayCoverageThreshold(overlayCoverageThreshold);
        settings.setOverlayMode(overlayMode);
        settings.setOverlayPadding(overlayPadding);
        settings.setValidationEnabled(validationEnabled);
        settings.setValidationBboxPadding(validationBboxPadding);
        log.info("改写参数已加载: {}", settings);
        return settings;
    }

    /**
     * 统计与计划输出使用的 ObjectMapper
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    static List<RewriteStrategyKind> parseStrategies(String value) {
        List<RewriteStrategyKind> result = new ArrayList<>();
        for (String part : value.split(",")) {
            String name = part.trim();
            if (!name.isEmpty()) {
                result.add(RewriteStrategyKind.valueOf(name.toUpperCase()));
            }
        }
        if (result.isEmpty()) {
            throw new IllegalArgumentException("rewrite.strategies 不能为空");
        }
        return result;
    }
}
