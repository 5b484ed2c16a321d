package com.example.pdfrewrite.util.stream.dto;

import org.apache.pdfbox.cos.COSBase;

import java.util.ArrayList;
import java.util.List;

/**
 * 文本显示操作数组中的一项：字符串、字距或其他
 *
 * start / end 为该项在所属段内的字符区间；字距不低于空格阈值时不占字符，
 * 低于阈值时视为一个空格，占一个字符。
 */
public class TjEntry {

    public enum Kind {
        TEXT,
        KERN,
        OTHER
    }

    public final Kind kind;
    public final COSBase template;
    public final List<GlyphCode> codes;
    public final float value;
    public final boolean addsSpace;
    public int start;
    public int end;

    private TjEntry(Kind kind, COSBase template, List<GlyphCode> codes, float value, boolean addsSpace) {
        this.kind = kind;
        this.template = template;
        this.codes = codes;
        this.value = value;
        this.addsSpace = addsSpace;
    }

    public static TjEntry text(COSBase template, List<GlyphCode> codes) {
        return new TjEntry(Kind.TEXT, template, codes, 0f, false);
    }

    public static TjEntry kern(COSBase template, float value, boolean addsSpace) {
        return new TjEntry(Kind.KERN, template, new ArrayList<>(), value, addsSpace);
    }

    public static TjEntry other(COSBase template) {
        return new TjEntry(Kind.OTHER, template, new ArrayList<>(), 0f, false);
    }

    /**
     * 该项贡献的文本
     */
    public String text() {
        if (kind == Kind.KERN) {
            return addsSpace ? " " : "";
        }
        if (kind != Kind.TEXT) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (GlyphCode code : codes) {
            sb.append(code.unicode);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return kind + "[" + start + "," + end + ")" + (kind == Kind.KERN ? "=" + value : "'" + text() + "'");
    }
}
