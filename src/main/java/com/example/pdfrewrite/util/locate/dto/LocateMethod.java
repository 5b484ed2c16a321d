package com.example.pdfrewrite.util.locate.dto;

/**
 * 定位成功时采用的方式，按优先级排列
 */
public enum LocateMethod {
    GLYPH_PATH,
    SPAN_IDS,
    CROSS_SPAN,
    SPAN_SIMILARITY,
    SELECTION,
    PAGE_SCAN
}
