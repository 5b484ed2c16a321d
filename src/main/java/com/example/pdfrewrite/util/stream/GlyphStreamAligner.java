package com.example.pdfrewrite.util.stream;

import com.example.pdfrewrite.util.align.SequenceMatcher;
import com.example.pdfrewrite.util.locate.dto.GlyphPath;
import com.example.pdfrewrite.util.locate.dto.MatchMetadata;
import com.example.pdfrewrite.util.span.dto.PageGlyphLayout;
import com.example.pdfrewrite.util.span.dto.SpanRecord;
import com.example.pdfrewrite.util.stream.dto.StreamRange;
import com.example.pdfrewrite.util.text.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 字形与内容流的几何对齐
 *
 * 把页面字形按 (block, line, span) 顺序拼接成字形文本，与内容流文本做最长公共子序列式对齐，
 * 得到字形下标 → 内容流偏移的映射。定位结果的字形区间据此换算为内容流区间。
 *
 * 置信度 = 区间内被对齐的字形比例；若换算后的内容流切片与字形切片折叠后不一致，置信度减半。
 */
public class GlyphStreamAligner {

    private static final Logger log = LoggerFactory.getLogger(GlyphStreamAligner.class);

    private final String glyphText;
    private final String streamText;
    private final Map<String, Integer> spanOffsets = new HashMap<>();
    private final int[] glyphToStream;

    public GlyphStreamAligner(PageGlyphLayout layout, String streamText) {
        StringBuilder sb = new StringBuilder();
        for (SpanRecord span : layout.getSpans()) {
            spanOffsets.put(span.getSpanId(), sb.length());
            sb.append(span.getRawText());
        }
        this.glyphText = sb.toString();
        this.streamText = streamText == null ? "" : streamText;
        this.glyphToStream = new SequenceMatcher(glyphText, this.streamText, false).mapAtoB();
    }

    /**
     * 把一组字形路径换算为内容流区间
     *
     * @return 区间，没有任何字形被对齐时返回 null
     */
    public StreamRange rangeFor(List<GlyphPath> paths) {
        if (paths == null || paths.isEmpty()) {
            return null;
        }
        int total = 0;
        int mapped = 0;
        int start = Integer.MAX_VALUE;
        int end = -1;
        StringBuilder expected = new StringBuilder();

        for (GlyphPath path : paths) {
            Integer offset = spanOffsets.get(path.spanId);
            if (offset == null) {
                continue;
            }
            for (int i = offset + path.charStart; i < offset + path.charEnd && i < glyphToStream.length; i++) {
                total++;
                expected.append(glyphText.charAt(i));
                int target = glyphToStream[i];
                if (target >= 0) {
                    mapped++;
                    start = Math.min(start, target);
                    end = Math.max(end, target + 1);
                }
            }
        }
        if (mapped == 0) {
            return null;
        }

        double confidence = mapped * 1.0 / total;
        String actual = streamText.substring(start, end);
        if (!TextNormalizer.collapseForValidation(actual).equals(TextNormalizer.collapseForValidation(expected.toString()))) {
            confidence *= 0.5;
        }
        return new StreamRange(start, end, confidence);
    }

    /**
     * 为定位结果附加内容流区间，置信度低于阈值时不附加
     *
     * @return 是否已附加
     */
    public boolean attach(MatchMetadata match, double minConfidence) {
        StreamRange range = rangeFor(match.getGlyphPaths());
        if (range == null) {
            log.debug("字形区间未能对齐到内容流: {}", match.getMatchedText());
            return false;
        }
        match.setAlignmentConfidence(range.confidence);
        if (range.confidence < minConfidence) {
            log.debug("对齐置信度 {} 低于阈值 {}，放弃几何区间: {}",
                    String.format("%.2f", range.confidence), minConfidence, match.getMatchedText());
            return false;
        }
        match.setStreamStart(range.start);
        match.setStreamEnd(range.end);
        return true;
    }

    public String getGlyphText() {
        return glyphText;
    }
}
