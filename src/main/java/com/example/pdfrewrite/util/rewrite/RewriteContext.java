package com.example.pdfrewrite.util.rewrite;

import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDResources;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * 单页改写上下文
 *
 * 缓存页面字体；替代字体（Courier）在第一次使用时才加入页面资源，只加一次。
 */
public class RewriteContext {

    private final PDResources resources;
    private final Map<String, PDFont> fonts = new HashMap<>();
    private PDFont substituteFont;
    private COSName substituteFontName;

    public RewriteContext(PDResources resources) {
        this.resources = resources;
    }

    /**
     * 按资源名解析页面字体，找不到返回 null
     */
    public PDFont font(String name) throws IOException {
        if (name == null || resources == null) {
            return null;
        }
        if (!fonts.containsKey(name)) {
            fonts.put(name, resources.getFont(COSName.getPDFName(name)));
        }
        return fonts.get(name);
    }

    public PDFont substituteFont() {
        if (substituteFont == null) {
            substituteFont = new PDType1Font(Standard14Fonts.FontName.COURIER);
        }
        return substituteFont;
    }

    /**
     * 替代字体在页面资源中的名称
     *
     * @throws IllegalStateException 页面没有资源字典
     */
    public COSName substituteFontName() {
        if (substituteFontName == null) {
            if (resources == null) {
                throw new IllegalStateException("页面没有资源字典，无法加入替代字体");
            }
            substituteFontName = resources.add(substituteFont());
        }
        return substituteFontName;
    }

    public boolean isSubstituteFontAdded() {
        return substituteFontName != null;
    }
}
