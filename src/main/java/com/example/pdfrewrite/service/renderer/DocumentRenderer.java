package com.example.pdfrewrite.service.renderer;

import com.example.pdfrewrite.service.dto.RenderResult;
import com.example.pdfrewrite.util.locate.dto.MappingEntry;

import java.util.List;

/**
 * 文档渲染器
 *
 * 每种 {@link RendererKind} 对应一个实现，由 {@link RendererRegistry} 按枚举选择。
 */
public interface DocumentRenderer {

    RendererKind kind();

    /**
     * 是否改写文本层（决定是否做输出文本校验）
     */
    boolean rewritesTextLayer();

    /**
     * 渲染一份文档
     *
     * @param pdfBytes 原文档字节
     * @param entries  已展开的映射条目
     * @param runId    运行标识
     * @return 渲染结果；单条映射的失败记录在结果中
     * @throws com.example.pdfrewrite.exception.RenderException 文档无法打开或序列化
     */
    RenderResult render(byte[] pdfBytes, List<MappingEntry> entries, String runId);
}
