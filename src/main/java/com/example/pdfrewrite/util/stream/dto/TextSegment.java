package com.example.pdfrewrite.util.stream.dto;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 一个文本显示操作（Tj / TJ / ' / "）解码后的逻辑文本段
 *
 * [start, end) 为该段在整页内容流文本中的偏移，各段首尾相接、互不重叠。
 * kerns 以段内偏移为键记录字距（千分之一 em）。
 */
public class TextSegment {

    private final int operatorIndex;
    private final String operator;
    private final String text;
    private final int start;
    private final int end;
    private final Map<Integer, Float> kerns;
    private final List<TjEntry> entries;
    private final String fontName;
    private final float fontSize;
    private final float horizontalScaling;

    public TextSegment(int operatorIndex, String operator, String text, int start,
                       Map<Integer, Float> kerns, List<TjEntry> entries,
                       String fontName, float fontSize, float horizontalScaling) {
        this.operatorIndex = operatorIndex;
        this.operator = operator;
        this.text = text;
        this.start = start;
        this.end = start + text.length();
        this.kerns = Collections.unmodifiableMap(kerns);
        this.entries = Collections.unmodifiableList(entries);
        this.fontName = fontName;
        this.fontSize = fontSize;
        this.horizontalScaling = horizontalScaling;
    }

    public boolean isArrayShow() {
        return "TJ".equals(operator);
    }

    public boolean overlaps(int rangeStart, int rangeEnd) {
        return rangeStart < end && start < rangeEnd;
    }

    public int getOperatorIndex() {
        return operatorIndex;
    }

    public String getOperator() {
        return operator;
    }

    public String getText() {
        return text;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public Map<Integer, Float> getKerns() {
        return kerns;
    }

    public List<TjEntry> getEntries() {
        return entries;
    }

    public String getFontName() {
        return fontName;
    }

    public float getFontSize() {
        return fontSize;
    }

    public float getHorizontalScaling() {
        return horizontalScaling;
    }

    @Override
    public String toString() {
        return operator + "@" + operatorIndex + "[" + start + "," + end + ") '" + text + "' " + fontName + " " + fontSize;
    }
}
