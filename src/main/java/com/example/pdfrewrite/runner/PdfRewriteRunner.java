package com.example.pdfrewrite.runner;

import com.example.pdfrewrite.config.RewriteSettings;
import com.example.pdfrewrite.exception.OutputValidationException;
import com.example.pdfrewrite.exception.RenderException;
import com.example.pdfrewrite.service.MappingContextLoader;
import com.example.pdfrewrite.service.PdfRewriteService;
import com.example.pdfrewrite.service.dto.MappingContext;
import com.example.pdfrewrite.service.dto.RenderResult;
import com.example.pdfrewrite.service.renderer.RendererKind;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * 命令行入口
 *
 * <pre>
 * --input=&lt;pdf&gt; --mapping=&lt;json&gt; --output=&lt;pdf&gt; [--renderer=&lt;kind&gt;] [--run-id=&lt;id&gt;] [--plan=&lt;json&gt;]
 * </pre>
 *
 * 相对路径按 rewrite.work-dir 解析。统计写到输出文件旁的 {@code <输出名>_stats.json}。
 * 没有 --input 参数时不执行。
 */
@Slf4j
@Component
public class PdfRewriteRunner implements ApplicationRunner {

    private final RewriteSettings settings;
    private final MappingContextLoader contextLoader;
    private final PdfRewriteService rewriteService;
    private final ObjectMapper objectMapper;

    public PdfRewriteRunner(RewriteSettings settings, MappingContextLoader contextLoader,
                            PdfRewriteService rewriteService, ObjectMapper objectMapper) {
        this.settings = settings;
        this.contextLoader = contextLoader;
        this.rewriteService = rewriteService;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        String input = option(args, "input");
        if (input == null) {
            log.debug("未指定 --input，跳过命令行渲染");
            return;
        }
        String mapping = option(args, "mapping");
        String output = option(args, "output");
        if (mapping == null || output == null) {
            throw new IllegalArgumentException("需要同时指定 --input、--mapping、--output");
        }

        Path inputPath = resolve(input);
        Path outputPath = resolve(output);
        byte[] pdfBytes = Files.readAllBytes(inputPath);
        MappingContext context;
        try (InputStream in = Files.newInputStream(resolve(mapping))) {
            context = contextLoader.read(in);
        }
        String runId = option(args, "run-id");
        if (runId != null) {
            context.setRunId(runId);
        }
        String renderer = option(args, "renderer");
        RendererKind kind = renderer == null ? null : RendererKind.valueOf(renderer.trim().toUpperCase());

        log.info("命令行渲染: {} -> {}", inputPath, outputPath);
        try {
            RenderResult result = rewriteService.render(pdfBytes, context, kind);
            write(result, outputPath, option(args, "plan"));
        } catch (OutputValidationException e) {
            // 校验不通过仍写出结果，便于人工检查
            if (e.getResult() != null) {
                write(e.getResult(), outputPath, option(args, "plan"));
            }
            throw e;
        }
    }

    private void write(RenderResult result, Path outputPath, String plan) throws IOException {
        if (result.getOutputBytes() == null) {
            throw new RenderException("渲染没有产生输出");
        }
        if (outputPath.getParent() != null) {
            Files.createDirectories(outputPath.getParent());
        }
        Files.write(outputPath, result.getOutputBytes());

        String fileName = outputPath.getFileName().toString();
        String baseName = fileName.toLowerCase().endsWith(".pdf")
                ? fileName.substring(0, fileName.length() - 4) : fileName;
        Path statsPath = outputPath.resolveSibling(baseName + "_stats.json");
        objectMapper.writeValue(statsPath.toFile(), result.getStatistics());
        log.info("输出已写入: {} ({} 字节), 统计: {}", outputPath, result.getOutputBytes().length, statsPath);

        if (plan != null && result.getPlan() != null) {
            Path planPath = resolve(plan);
            objectMapper.writeValue(planPath.toFile(), result.getPlan());
            log.info("改写计划已写入: {} ({} 条)", planPath, result.getPlan().getEntries().size());
        }
        if (!result.getFailures().isEmpty()) {
            log.warn("{} 条映射未改写", result.getFailures().size());
        }
    }

    private Path resolve(String path) {
        Path p = Paths.get(path);
        return p.isAbsolute() ? p : Paths.get(settings.getWorkDir()).resolve(p);
    }

    private static String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        return values.get(0);
    }
}
