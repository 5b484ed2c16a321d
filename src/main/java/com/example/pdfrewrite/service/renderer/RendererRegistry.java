package com.example.pdfrewrite.service.renderer;

import com.example.pdfrewrite.exception.RenderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 渲染器注册表：RendererKind → 渲染器实现
 */
@Slf4j
@Component
public class RendererRegistry {

    private final Map<RendererKind, DocumentRenderer> renderers = new EnumMap<>(RendererKind.class);

    public RendererRegistry(List<DocumentRenderer> renderers) {
        for (DocumentRenderer renderer : renderers) {
            DocumentRenderer previous = this.renderers.put(renderer.kind(), renderer);
            if (previous != null) {
                throw new IllegalStateException("渲染器重复注册: " + renderer.kind());
            }
        }
        log.info("已注册渲染器: {}", this.renderers.keySet());
    }

    public DocumentRenderer get(RendererKind kind) {
        DocumentRenderer renderer = renderers.get(kind);
        if (renderer == null) {
            throw new RenderException("未注册的渲染器: " + kind);
        }
        return renderer;
    }
}
