package com.example.pdfrewrite.util.stream.dto;

/**
 * 几何对齐得到的内容流区间及置信度
 */
public class StreamRange {

    public final int start;
    public final int end;
    /** [0, 1]：区间内被对齐的字形比例，文本不一致时减半 */
    public final double confidence;

    public StreamRange(int start, int end, double confidence) {
        this.start = start;
        this.end = end;
        this.confidence = confidence;
    }

    @Override
    public String toString() {
        return "[" + start + "," + end + ") confidence=" + String.format("%.2f", confidence);
    }
}
