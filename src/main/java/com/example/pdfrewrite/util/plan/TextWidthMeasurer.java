package com.example.pdfrewrite.util.plan;

import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * 文本宽度估算
 *
 * span 的实际字体不一定可用于测量（子集字体缺字形），这里用 Helvetica 度量两段文本的宽度比，
 * 再乘以原文的实测宽度。Helvetica 无法编码时退化为 字符数 × 字号 × 比例。
 */
public class TextWidthMeasurer {

    private static final Logger log = LoggerFactory.getLogger(TextWidthMeasurer.class);

    private final PDFont referenceFont = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
    private final float charWidthRatio;

    public TextWidthMeasurer() {
        this(0.6f);
    }

    public TextWidthMeasurer(float charWidthRatio) {
        this.charWidthRatio = charWidthRatio;
    }

    /**
     * 估算替换文本宽度
     *
     * @param originalText  原文
     * @param originalWidth 原文实测宽度（pt）
     * @param replacement   替换文本
     * @param fontSize      字号
     */
    public float replacementWidth(String originalText, float originalWidth, String replacement, float fontSize) {
        if (replacement == null || replacement.isEmpty()) {
            return 0f;
        }
        float referenceOriginal = referenceWidth(originalText, fontSize);
        float referenceReplacement = referenceWidth(replacement, fontSize);
        if (referenceOriginal > 0f && referenceReplacement > 0f && originalWidth > 0f) {
            return originalWidth * referenceReplacement / referenceOriginal;
        }
        return replacement.length() * fontSize * charWidthRatio;
    }

    private float referenceWidth(String text, float fontSize) {
        if (text == null || text.isEmpty()) {
            return 0f;
        }
        try {
            return referenceFont.getStringWidth(text) / 1000f * fontSize;
        } catch (IOException | IllegalArgumentException e) {
            log.debug("参考字体无法测量 '{}': {}", text, e.getMessage());
            return -1f;
        }
    }
}
