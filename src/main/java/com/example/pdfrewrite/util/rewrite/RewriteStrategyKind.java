package com.example.pdfrewrite.util.rewrite;

/**
 * 文本段改写策略
 */
public enum RewriteStrategyKind {
    /** 拆分文本显示操作，中间用等宽替代字体绘制替换文本，宽度与原文一致 */
    SUBSTITUTE_FONT,
    /** 在原字体下直接拼接字符编码，必要时用 Tz 水平压缩 */
    LITERAL
}
