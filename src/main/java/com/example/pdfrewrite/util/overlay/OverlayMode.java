package com.example.pdfrewrite.util.overlay;

/**
 * 视觉覆盖的合成方式
 */
public enum OverlayMode {
    /** 把原页面作为表单 XObject 导入并按区域裁剪绘制（矢量，但会带回原文本层） */
    VECTOR,
    /** 把原页面区域渲染成位图后贴回 */
    RASTER
}
