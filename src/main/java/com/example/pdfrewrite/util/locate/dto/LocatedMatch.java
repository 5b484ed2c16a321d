package com.example.pdfrewrite.util.locate.dto;

import com.example.pdfrewrite.util.coordinate.Rect;

/**
 * 定位结果：矩形、字号、字形数
 */
public class LocatedMatch {

    public final Rect rect;
    public final float fontSize;
    public final int glyphCount;

    public LocatedMatch(Rect rect, float fontSize, int glyphCount) {
        this.rect = rect;
        this.fontSize = fontSize;
        this.glyphCount = glyphCount;
    }

    @Override
    public String toString() {
        return "LocatedMatch{rect=" + rect + ", fontSize=" + fontSize + ", glyphs=" + glyphCount + "}";
    }
}
