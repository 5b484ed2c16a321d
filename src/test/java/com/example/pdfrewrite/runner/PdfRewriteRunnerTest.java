package com.example.pdfrewrite.runner;

import com.example.pdfrewrite.TestDocuments;
import com.example.pdfrewrite.config.RewriteConfig;
import com.example.pdfrewrite.config.RewriteSettings;
import com.example.pdfrewrite.service.MappingContextLoader;
import com.example.pdfrewrite.service.MappingTableBuilder;
import com.example.pdfrewrite.service.OutputValidator;
import com.example.pdfrewrite.service.PdfRewriteService;
import com.example.pdfrewrite.service.renderer.HybridOverlayRenderer;
import com.example.pdfrewrite.service.renderer.LiteralOverlayRenderer;
import com.example.pdfrewrite.service.renderer.RendererRegistry;
import com.example.pdfrewrite.service.renderer.StreamRewriteRenderer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PdfRewriteRunnerTest {

    private static final String MAPPING = "{\"run_id\":\"cli-run\",\"questions\":[{\"q_label\":\"1\","
            + "\"stem_text\":\"The quick brown fox jumps\",\"page\":1,"
            + "\"substring_mappings\":[{\"original\":\"brown\",\"replacement\":\"red\",\"start_pos\":10,\"end_pos\":15}]}]}";

    @TempDir
    Path workDir;

    private final ObjectMapper objectMapper = new RewriteConfig().objectMapper();
    private PdfRewriteRunner runner;

    @BeforeEach
    void setUp() throws Exception {
        RewriteSettings settings = new RewriteSettings();
        settings.setWorkDir(workDir.toString());
        MappingContextLoader loader = new MappingContextLoader(settings, objectMapper);
        PdfRewriteService service = new PdfRewriteService(settings, loader, new MappingTableBuilder(),
                new RendererRegistry(Arrays.asList(new StreamRewriteRenderer(settings),
                        new HybridOverlayRenderer(settings), new LiteralOverlayRenderer(settings))),
                new OutputValidator(settings));
        runner = new PdfRewriteRunner(settings, loader, service, objectMapper);

        Files.write(workDir.resolve("in.pdf"), TestDocuments.singlePage("The quick brown fox jumps"));
        Files.write(workDir.resolve("map.json"), MAPPING.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void writesOutputStatsAndPlan() throws Exception {
        runner.run(new DefaultApplicationArguments("--input=in.pdf", "--mapping=map.json",
                "--output=out/result.pdf", "--renderer=stream_rewrite", "--plan=plan.json"));

        Path output = workDir.resolve("out/result.pdf");
        assertThat(output).exists();
        assertThat(TestDocuments.extractText(Files.readAllBytes(output))).contains("red");

        JsonNode stats = objectMapper.readTree(workDir.resolve("out/result_stats.json").toFile());
        assertThat(stats.get("renderer").asText()).isEqualTo("STREAM_REWRITE");
        assertThat(stats.get("replacements_applied").asInt()).isEqualTo(1);
        assertThat(stats.get("entries_skipped").asInt()).isZero();

        JsonNode plan = objectMapper.readTree(workDir.resolve("plan.json").toFile());
        assertThat(plan.get("run_id").asText()).isEqualTo("cli-run");
    }

    @Test
    void runIdOptionOverridesContext() throws Exception {
        runner.run(new DefaultApplicationArguments("--input=in.pdf", "--mapping=map.json",
                "--output=result.pdf", "--run-id=override", "--plan=plan.json"));

        JsonNode plan = objectMapper.readTree(workDir.resolve("plan.json").toFile());
        assertThat(plan.get("run_id").asText()).isEqualTo("override");
    }

    @Test
    void withoutInputNothingHappens() throws Exception {
        runner.run(new DefaultApplicationArguments());

        assertThat(workDir.resolve("result.pdf")).doesNotExist();
    }

    @Test
    void incompleteOptionsAreRejected() {
        assertThatThrownBy(() -> runner.run(new DefaultApplicationArguments("--input=in.pdf")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
