package com.example.pdfrewrite.service;

import com.example.pdfrewrite.TestDocuments;
import com.example.pdfrewrite.config.RewriteConfig;
import com.example.pdfrewrite.config.RewriteSettings;
import com.example.pdfrewrite.exception.OutputValidationException;
import com.example.pdfrewrite.exception.RenderException;
import com.example.pdfrewrite.service.dto.MappingContext;
import com.example.pdfrewrite.service.dto.QuestionContext;
import com.example.pdfrewrite.service.dto.RenderResult;
import com.example.pdfrewrite.service.dto.SubstringMappingInput;
import com.example.pdfrewrite.service.renderer.DocumentRenderer;
import com.example.pdfrewrite.service.renderer.LiteralOverlayRenderer;
import com.example.pdfrewrite.service.renderer.RendererKind;
import com.example.pdfrewrite.service.renderer.RendererRegistry;
import com.example.pdfrewrite.service.renderer.StreamRewriteRenderer;
import com.example.pdfrewrite.util.locate.SubstringLocator;
import com.example.pdfrewrite.util.locate.dto.MappingEntry;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PdfRewriteServiceTest {

    private final RewriteSettings settings = new RewriteSettings();

    private PdfRewriteService service(DocumentRenderer... renderers) {
        return new PdfRewriteService(settings, new MappingContextLoader(settings, new RewriteConfig().objectMapper()),
                new MappingTableBuilder(), new RendererRegistry(Arrays.asList(renderers)),
                new OutputValidator(settings));
    }

    private static MappingContext context(String runId) {
        QuestionContext question = new QuestionContext("1", "The quick brown fox jumps", 1);
        question.setSubstringMappings(Collections.singletonList(new SubstringMappingInput("brown", "red", 10, 15)));
        MappingContext context = new MappingContext();
        context.setRunId(runId);
        context.setQuestions(new ArrayList<>(Collections.singletonList(question)));
        return context;
    }

    @Test
    void rendersAndValidates() throws Exception {
        byte[] pdf = TestDocuments.singlePage("The quick brown fox jumps");

        RenderResult result = service(new StreamRewriteRenderer(settings))
                .render(pdf, context("run-42"), RendererKind.STREAM_REWRITE);

        assertThat(result.getValidationErrors()).isEmpty();
        assertThat(result.getMappingTable()).hasSize(1);
        assertThat(result.getPlan().getRunId()).isEqualTo("run-42");
        assertThat(TestDocuments.extractText(result.getOutputBytes())).contains("red").doesNotContain("brown");
    }

    @Test
    void overlayRendererSkipsValidation() throws Exception {
        byte[] pdf = TestDocuments.singlePage("The quick brown fox jumps");

        RenderResult result = service(new LiteralOverlayRenderer(settings))
                .render(pdf, context(null), RendererKind.LITERAL_OVERLAY);

        assertThat(result.getPlan().getRunId()).startsWith("run-");
        assertThat(result.getValidationErrors()).isEmpty();
    }

    @Test
    void validationFailureCarriesResult() throws Exception {
        byte[] pdf = TestDocuments.singlePage("The quick brown fox jumps");
        DocumentRenderer noop = new DocumentRenderer() {
            @Override
            public RendererKind kind() {
                return RendererKind.STREAM_REWRITE;
            }

            @Override
            public boolean rewritesTextLayer() {
                return true;
            }

            @Override
            public RenderResult render(byte[] pdfBytes, List<MappingEntry> entries, String runId) {
                RenderResult result = new RenderResult();
                try {
                    for (MappingEntry entry : entries) {
                        new SubstringLocator().locate(TestDocuments.layout(pdfBytes, 0), entry,
                                new ArrayList<>(), new HashSet<>());
                        result.getAppliedEntries().add(entry);
                    }
                } catch (IOException e) {
                    throw new IllegalStateException(e);
                }
                result.setOutputBytes(pdfBytes);
                return result;
            }
        };

        assertThatThrownBy(() -> service(noop).render(pdf, context("run"), RendererKind.STREAM_REWRITE))
                .isInstanceOfSatisfying(OutputValidationException.class, e -> {
                    assertThat(e.getErrors()).hasSize(2);
                    assertThat(e.getResult().getOutputBytes()).isEqualTo(pdf);
                    assertThat(e.getResult().getValidationErrors()).isEqualTo(e.getErrors());
                });
    }

    @Test
    void missingContextIsRejected() {
        assertThatThrownBy(() -> service(new StreamRewriteRenderer(settings)).render(new byte[0], null))
                .isInstanceOf(RenderException.class);
    }
}
