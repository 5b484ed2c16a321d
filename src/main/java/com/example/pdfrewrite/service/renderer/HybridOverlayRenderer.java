package com.example.pdfrewrite.service.renderer;

import com.example.pdfrewrite.config.RewriteSettings;
import org.springframework.stereotype.Component;

/**
 * 内容流改写 + 视觉兜底
 *
 * 文本层按 {@link StreamRewriteRenderer} 改写，改写不完整的区域再从原文档合成视觉覆盖。
 */
@Component
public class HybridOverlayRenderer extends StreamRewriteRenderer {

    public HybridOverlayRenderer(RewriteSettings settings) {
        super(settings);
    }

    @Override
    public RendererKind kind() {
        return RendererKind.STREAM_REWRITE_WITH_OVERLAY;
    }

    @Override
    protected boolean overlayEnabled() {
        return true;
    }
}
