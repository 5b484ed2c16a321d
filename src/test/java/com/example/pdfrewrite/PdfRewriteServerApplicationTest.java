package com.example.pdfrewrite;

import com.example.pdfrewrite.config.RewriteSettings;
import com.example.pdfrewrite.service.renderer.HybridOverlayRenderer;
import com.example.pdfrewrite.service.renderer.LiteralOverlayRenderer;
import com.example.pdfrewrite.service.renderer.RendererKind;
import com.example.pdfrewrite.service.renderer.RendererRegistry;
import com.example.pdfrewrite.service.renderer.StreamRewriteRenderer;
import com.example.pdfrewrite.util.overlay.OverlayMode;
import com.example.pdfrewrite.util.rewrite.RewriteStrategyKind;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "rewrite.overlay.mode=VECTOR")
class PdfRewriteServerApplicationTest {

    @Autowired
    private RewriteSettings settings;

    @Autowired
    private RendererRegistry registry;

    @Test
    void settingsComeFromConfiguration() {
        assertThat(settings.getRenderer()).isEqualTo(RendererKind.STREAM_REWRITE_WITH_OVERLAY);
        assertThat(settings.getStrategies())
                .containsExactly(RewriteStrategyKind.SUBSTITUTE_FONT, RewriteStrategyKind.LITERAL);
        assertThat(settings.getOverlayMode()).isEqualTo(OverlayMode.VECTOR);
        assertThat(settings.getSpaceThreshold()).isEqualTo(-80f);
        assertThat(settings.getValidationBboxPadding()).isEqualTo(10f);
    }

    @Test
    void everyRendererIsRegistered() {
        assertThat(registry.get(RendererKind.STREAM_REWRITE)).isExactlyInstanceOf(StreamRewriteRenderer.class);
        assertThat(registry.get(RendererKind.STREAM_REWRITE_WITH_OVERLAY)).isInstanceOf(HybridOverlayRenderer.class);
        assertThat(registry.get(RendererKind.LITERAL_OVERLAY)).isInstanceOf(LiteralOverlayRenderer.class);
    }
}
