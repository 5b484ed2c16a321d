package com.example.pdfrewrite.util.stream.dto;

/**
 * 字符串操作数中的一个字符编码
 *
 * bytes 为该编码在原字符串中的字节，unicode 为经 ToUnicode / 编码表解码后的文本（可能多于一个字符），
 * width 为字形宽度（千分之一文字空间单位）。
 */
public class GlyphCode {

    public final int code;
    public final byte[] bytes;
    public final String unicode;
    public final float width;

    public GlyphCode(int code, byte[] bytes, String unicode, float width) {
        this.code = code;
        this.bytes = bytes;
        this.unicode = unicode;
        this.width = width;
    }

    @Override
    public String toString() {
        return "'" + unicode + "'(" + code + ")";
    }
}
