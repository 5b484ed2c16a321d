package com.example.pdfrewrite.service.renderer;

import com.example.pdfrewrite.config.RewriteSettings;
import com.example.pdfrewrite.exception.RenderException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RendererRegistryTest {

    private final RewriteSettings settings = new RewriteSettings();

    @Test
    void resolvesRegisteredKinds() {
        RendererRegistry registry = new RendererRegistry(Arrays.asList(
                new StreamRewriteRenderer(settings), new HybridOverlayRenderer(settings),
                new LiteralOverlayRenderer(settings)));

        assertThat(registry.get(RendererKind.STREAM_REWRITE)).isInstanceOf(StreamRewriteRenderer.class);
        assertThat(registry.get(RendererKind.STREAM_REWRITE_WITH_OVERLAY)).isInstanceOf(HybridOverlayRenderer.class);
        assertThat(registry.get(RendererKind.LITERAL_OVERLAY)).isInstanceOf(LiteralOverlayRenderer.class);
    }

    @Test
    void missingKindIsReported() {
        RendererRegistry registry = new RendererRegistry(
                Collections.singletonList(new StreamRewriteRenderer(settings)));

        assertThatThrownBy(() -> registry.get(RendererKind.LITERAL_OVERLAY))
                .isInstanceOf(RenderException.class)
                .hasMessageContaining("LITERAL_OVERLAY");
    }

    @Test
    void duplicateKindIsRejected() {
        assertThatThrownBy(() -> new RendererRegistry(Arrays.asList(
                new StreamRewriteRenderer(settings), new StreamRewriteRenderer(settings))))
                .isInstanceOf(IllegalStateException.class);
    }
}
