package com.example.pdfrewrite.exception;

/**
 * 渲染致命错误：输入文档无法打开、映射缺少必需的几何信息等，整个渲染中止
 */
public class RenderException extends RuntimeException {

    public RenderException(String message) {
        super(message);
    }

    public RenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
