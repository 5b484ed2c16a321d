package com.example.pdfrewrite.service.renderer;

/**
 * 渲染器种类
 */
public enum RendererKind {
    /** 只改写内容流 */
    STREAM_REWRITE,
    /** 改写内容流，并对未确认的区域做视觉覆盖兜底 */
    STREAM_REWRITE_WITH_OVERLAY,
    /** 只做视觉覆盖：白底遮盖原文并绘制替换文本，文本层不变 */
    LITERAL_OVERLAY
}
