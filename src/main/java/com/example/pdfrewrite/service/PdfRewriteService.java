package com.example.pdfrewrite.service;

import com.example.pdfrewrite.config.RewriteSettings;
import com.example.pdfrewrite.exception.OutputValidationException;
import com.example.pdfrewrite.exception.RenderException;
import com.example.pdfrewrite.service.dto.MappingContext;
import com.example.pdfrewrite.service.dto.RenderResult;
import com.example.pdfrewrite.service.renderer.DocumentRenderer;
import com.example.pdfrewrite.service.renderer.RendererKind;
import com.example.pdfrewrite.service.renderer.RendererRegistry;
import com.example.pdfrewrite.util.locate.dto.MappingEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * PDF 改写服务
 *
 * 一次渲染的完整流程：
 * 1. 映射上下文展开为条目（校正偏移、计算指纹）
 * 2. 生成带零宽标记的映射表
 * 3. 按渲染器种类渲染
 * 4. 改写文本层的渲染器做输出校验，不通过时抛出 {@link OutputValidationException}（携带渲染结果）
 */
@Slf4j
@Service
public class PdfRewriteService {

    private final RewriteSettings settings;
    private final MappingContextLoader contextLoader;
    private final MappingTableBuilder tableBuilder;
    private final RendererRegistry rendererRegistry;
    private final OutputValidator outputValidator;

    public PdfRewriteService(RewriteSettings settings, MappingContextLoader contextLoader,
                             MappingTableBuilder tableBuilder, RendererRegistry rendererRegistry,
                             OutputValidator outputValidator) {
        this.settings = settings;
        this.contextLoader = contextLoader;
        this.tableBuilder = tableBuilder;
        this.rendererRegistry = rendererRegistry;
        this.outputValidator = outputValidator;
    }

    /**
     * 使用默认渲染器
     */
    public RenderResult render(byte[] pdfBytes, MappingContext context) {
        return render(pdfBytes, context, null);
    }

    /**
     * 渲染
     *
     * @param pdfBytes 原文档
     * @param context  映射上下文
     * @param kind     渲染器种类，null 时使用配置的默认值
     * @return 渲染结果
     * @throws RenderException           输入无法打开、映射上下文非法
     * @throws OutputValidationException 输出校验不通过
     */
    public RenderResult render(byte[] pdfBytes, MappingContext context, RendererKind kind) {
        if (context == null) {
            throw new RenderException("映射上下文为空");
        }
        String runId = context.getRunId() != null && !context.getRunId().isEmpty()
                ? context.getRunId()
                : "run-" + System.currentTimeMillis();
        RendererKind rendererKind = kind != null ? kind : settings.getRenderer();
        log.info("开始渲染: run={}, renderer={}, 输入 {} 字节", runId, rendererKind,
                pdfBytes == null ? 0 : pdfBytes.length);

        List<MappingEntry> entries = contextLoader.buildEntries(context);
        Map<String, String> mappingTable = tableBuilder.build(runId, context);

        DocumentRenderer renderer = rendererRegistry.get(rendererKind);
        RenderResult result = renderer.render(pdfBytes, entries, runId);
        result.setMappingTable(mappingTable);

        if (settings.isValidationEnabled() && renderer.rewritesTextLayer()) {
            List<String> errors = outputValidator.validate(result.getOutputBytes(), result.getAppliedEntries());
            result.setValidationErrors(errors);
            if (!errors.isEmpty()) {
                OutputValidationException error = new OutputValidationException(errors, result);
                log.error(error.getMessage());
                throw error;
            }
        }
        return result;
    }
}
