package com.example.pdfrewrite.util.stream.dto;

import java.util.ArrayList;
import java.util.List;

/**
 * 内容流分段结果
 */
public class SegmentExtraction {

    private final List<TextSegment> segments;
    private final String streamText;
    private final int tokensScanned;
    private final int textShowOps;

    public SegmentExtraction(List<TextSegment> segments, String streamText, int tokensScanned, int textShowOps) {
        this.segments = segments;
        this.streamText = streamText;
        this.tokensScanned = tokensScanned;
        this.textShowOps = textShowOps;
    }

    /**
     * 覆盖给定偏移区间的全部段
     */
    public List<TextSegment> segmentsOverlapping(int start, int end) {
        List<TextSegment> result = new ArrayList<>();
        for (TextSegment segment : segments) {
            if (segment.overlaps(start, end)) {
                result.add(segment);
            }
        }
        return result;
    }

    public List<TextSegment> getSegments() {
        return segments;
    }

    public String getStreamText() {
        return streamText;
    }

    public int getTokensScanned() {
        return tokensScanned;
    }

    public int getTextShowOps() {
        return textShowOps;
    }
}
