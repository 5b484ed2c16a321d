package com.example.pdfrewrite.util.span.dto;

import com.example.pdfrewrite.util.coordinate.Rect;

/**
 * 单个字符的字形信息
 */
public class GlyphBox {

    public final String text;
    public final Rect rect;
    /** 基线起点 x */
    public final float originX;
    /** 基线 y（顶部坐标系） */
    public final float originY;

    public GlyphBox(String text, Rect rect, float originX, float originY) {
        this.text = text;
        this.rect = rect;
        this.originX = originX;
        this.originY = originY;
    }

    @Override
    public String toString() {
        return "'" + text + "'" + rect;
    }
}
