package com.example.pdfrewrite.util.locate;

import com.example.pdfrewrite.util.align.SequenceMatcher;
import com.example.pdfrewrite.util.common.EntryFailure;
import com.example.pdfrewrite.util.coordinate.Rect;
import com.example.pdfrewrite.util.locate.dto.GlyphPath;
import com.example.pdfrewrite.util.locate.dto.LocateMethod;
import com.example.pdfrewrite.util.locate.dto.LocateResult;
import com.example.pdfrewrite.util.locate.dto.LocatedMatch;
import com.example.pdfrewrite.util.locate.dto.MappingEntry;
import com.example.pdfrewrite.util.locate.dto.MatchMetadata;
import com.example.pdfrewrite.util.locate.dto.PageOccurrence;
import com.example.pdfrewrite.util.span.dto.PageGlyphLayout;
import com.example.pdfrewrite.util.span.dto.SpanRecord;
import com.example.pdfrewrite.util.text.CompactText;
import com.example.pdfrewrite.util.text.NormalizedText;
import com.example.pdfrewrite.util.text.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 子串定位器
 * 在页面字形布局中找到映射原文对应的字形区间，并消除重复出现带来的歧义
 *
 * <h3>定位顺序</h3>
 * <ol>
 *   <li>字形路径提示：条目已带 (block, line, span, char 区间) 且文本仍一致时直接采用</li>
 *   <li>span 标识：按 (block, line, span) 排序后逐个 span 查找；找不到时跨 span 拼接查找，
 *       再退化为相似度最高的单个 span（相似度不低于 0.6）</li>
 *   <li>选区：只在与选区矩形相交的 span 中查找</li>
 *   <li>整页扫描：找出全部出现，按几何排序，用前后缀指纹与出现序号消歧</li>
 * </ol>
 *
 * 与已占用矩形相交、或指纹已被使用的候选一律拒绝。定位失败是单条映射的可恢复失败，
 * 由调用方记录并跳过。
 */
public class SubstringLocator {

    private static final Logger log = LoggerFactory.getLogger(SubstringLocator.class);

    private static final double SIMILARITY_THRESHOLD = 0.6;
    private static final float CLIP_PADDING = 6f;

    /** 出现处前后缀截取长度 */
    private final int occurrenceContext;

    public SubstringLocator() {
        this(32);
    }

    public SubstringLocator(int occurrenceContext) {
        this.occurrenceContext = occurrenceContext;
    }

    /**
     * 定位映射条目
     *
     * 成功时把匹配文本、矩形、字形路径等写入 {@code entry.getMatch()}。
     *
     * @param layout           页面字形布局
     * @param entry            映射条目
     * @param usedRects        本页已占用的矩形
     * @param usedFingerprints 本页已使用的指纹键
     * @return 定位结果
     */
    public LocateResult locate(PageGlyphLayout layout, MappingEntry entry,
                               Collection<Rect> usedRects, Set<String> usedFingerprints) {
        String fingerprintKey = entry.getFingerprintKey();
        if (fingerprintKey != null && usedFingerprints != null && usedFingerprints.contains(fingerprintKey)) {
            return LocateResult.failed(EntryFailure.Kind.FINGERPRINT_CONSUMED, "指纹已被本页其他条目使用");
        }

        // 1. 字形路径提示
        if (entry.glyphPathHint().isPresent()) {
            LocatedMatch match = locateByGlyphPath(layout, entry, entry.getGlyphPathHint());
            if (match != null) {
                return accept(match, usedRects, entry);
            }
            log.debug("字形路径提示已失效，继续其他定位方式: {}", entry.getGlyphPathHint());
        }

        // 2. span 标识
        if (!entry.getSpanIds().isEmpty()) {
            LocatedMatch match = locateBySpanIds(layout, entry);
            if (match != null) {
                return accept(match, usedRects, entry);
            }
        }

        // 3. 选区
        if (entry.selectionRect().isPresent()) {
            Rect selection = entry.selectionRect().get();
            List<PageOccurrence> inSelection = findOccurrences(layout, entry.getOriginal(), selection);
            List<PageOccurrence> free = new ArrayList<>();
            for (PageOccurrence occ : inSelection) {
                if (!conflicts(occ.rect, usedRects)) {
                    free.add(occ);
                }
            }
            if (!free.isEmpty()) {
                annotate(entry, bestByContext(free, entry), LocateMethod.SELECTION);
                return LocateResult.found(toLocatedMatch(entry.getMatch()));
            }
            if (!inSelection.isEmpty()) {
                return LocateResult.failed(EntryFailure.Kind.RECT_CONFLICT, "选区内的候选均与已占用区域重叠");
            }
        }

        // 4. 整页扫描
        return locateByPageScan(layout, entry, usedRects);
    }

    private LocateResult accept(LocatedMatch match, Collection<Rect> usedRects, MappingEntry entry) {
        if (conflicts(match.rect, usedRects)) {
            log.debug("候选矩形 {} 与已占用区域重叠: {}", match.rect, entry);
            return LocateResult.failed(EntryFailure.Kind.RECT_CONFLICT, "候选矩形与已占用区域重叠 " + match.rect);
        }
        return LocateResult.found(match);
    }

    // ==================== 字形路径 ====================

    private LocatedMatch locateByGlyphPath(PageGlyphLayout layout, MappingEntry entry, GlyphPath hint) {
        SpanRecord span = layout.findSpan(hint.spanId);
        if (span == null) {
            span = layout.findSpan(hint.block, hint.line, hint.span);
        }
        if (span == null || hint.charEnd <= hint.charStart) {
            return null;
        }
        String slice = span.rawSlice(hint.charStart, hint.charEnd);
        if (!sameText(slice, entry.getOriginal())) {
            return null;
        }
        Map<SpanRecord, int[]> ranges = new LinkedHashMap<>();
        ranges.put(span, new int[]{hint.charStart, Math.min(hint.charEnd, span.getRawText().length())});
        annotate(entry, ranges, LocateMethod.GLYPH_PATH);
        return toLocatedMatch(entry.getMatch());
    }

    // ==================== span 标识 ====================

    private LocatedMatch locateBySpanIds(PageGlyphLayout layout, MappingEntry entry) {
        List<SpanRecord> ordered = orderSpans(entry.getSpanIds(), layout);
        if (ordered.isEmpty()) {
            return null;
        }
        String target = TextNormalizer.normalizeForCompare(entry.getOriginal());

        for (SpanRecord span : ordered) {
            NormalizedText normalized = span.getNormalized();
            String lower = normalized.getText().toLowerCase(Locale.ROOT);
            if (lower.length() != normalized.length()) {
                continue;
            }
            int index = lower.indexOf(target);
            if (index < 0) {
                continue;
            }
            int[] raw = normalized.rawRange(index, index + target.length());
            if (raw == null) {
                continue;
            }
            Map<SpanRecord, int[]> ranges = new LinkedHashMap<>();
            ranges.put(span, raw);
            annotate(entry, ranges, LocateMethod.SPAN_IDS);
            return toLocatedMatch(entry.getMatch());
        }

        if (ordered.size() > 1) {
            LocatedMatch combined = locateAcrossSpans(ordered, entry, target);
            if (combined != null) {
                return combined;
            }
        }
        return locateBySimilarity(ordered, entry, target);
    }

    /**
     * 跨 span 拼接查找：先在去空白的紧凑文本中找，找不到再直接找
     */
    private LocatedMatch locateAcrossSpans(List<SpanRecord> spans, MappingEntry entry, String target) {
        List<SpanRecord> charSpan = new ArrayList<>();
        List<Integer> charRaw = new ArrayList<>();
        StringBuilder combined = new StringBuilder();
        StringBuilder compact = new StringBuilder();
        List<Integer> compactMap = new ArrayList<>();

        for (SpanRecord span : spans) {
            NormalizedText normalized = span.getNormalized();
            String lower = normalized.getText().toLowerCase(Locale.ROOT);
            if (lower.length() != normalized.length()) {
                continue;
            }
            for (int i = 0; i < lower.length(); i++) {
                char ch = lower.charAt(i);
                charSpan.add(span);
                charRaw.add(normalized.rawIndex(i));
                combined.append(ch);
                if (ch != ' ') {
                    compact.append(ch);
                    compactMap.add(combined.length() - 1);
                }
            }
        }
        if (combined.length() == 0) {
            return null;
        }

        int startEntry;
        int endEntry;
        String targetCompact = target.replace(" ", "");
        int compactIndex = targetCompact.isEmpty() ? -1 : compact.indexOf(targetCompact);
        if (compactIndex >= 0) {
            startEntry = compactMap.get(compactIndex);
            endEntry = compactMap.get(compactIndex + targetCompact.length() - 1) + 1;
        } else {
            int index = combined.indexOf(target);
            if (index < 0) {
                return null;
            }
            startEntry = index;
            endEntry = index + target.length();
        }

        Map<SpanRecord, int[]> ranges = new LinkedHashMap<>();
        for (int i = startEntry; i < endEntry; i++) {
            SpanRecord span = charSpan.get(i);
            int raw = charRaw.get(i);
            int[] range = ranges.get(span);
            if (range == null) {
                ranges.put(span, new int[]{raw, raw + 1});
            } else {
                range[0] = Math.min(range[0], raw);
                range[1] = Math.max(range[1], raw + 1);
            }
        }
        annotate(entry, ranges, LocateMethod.CROSS_SPAN);
        entry.getMatch().setMatchedText(TextNormalizer.stripZeroWidth(entry.getOriginal()).trim());
        return toLocatedMatch(entry.getMatch());
    }

    /**
     * 相似度兜底：紧凑文本包含目标时取对应区间，否则取相似度最高的整个 span
     */
    private LocatedMatch locateBySimilarity(List<SpanRecord> spans, MappingEntry entry, String target) {
        String targetCompact = TextNormalizer.compact(target);
        if (targetCompact.isEmpty()) {
            return null;
        }
        SpanRecord best = null;
        double bestScore = 0.0;
        for (SpanRecord span : spans) {
            CompactText key = CompactText.alphanumeric(span.getRawText());
            int index = key.text.indexOf(targetCompact);
            if (index >= 0) {
                Map<SpanRecord, int[]> ranges = new LinkedHashMap<>();
                ranges.put(span, key.rawRange(index, index + targetCompact.length()));
                annotate(entry, ranges, LocateMethod.SPAN_SIMILARITY);
                return toLocatedMatch(entry.getMatch());
            }
            double score = new SequenceMatcher(key.text, targetCompact).ratio();
            if (score > bestScore) {
                bestScore = score;
                best = span;
            }
        }
        if (best != null && bestScore >= SIMILARITY_THRESHOLD) {
            log.debug("span 相似度兜底命中: {} score={}", best.getSpanId(), String.format("%.2f", bestScore));
            Map<SpanRecord, int[]> ranges = new LinkedHashMap<>();
            ranges.put(best, new int[]{0, best.getRawText().length()});
            annotate(entry, ranges, LocateMethod.SPAN_SIMILARITY);
            return toLocatedMatch(entry.getMatch());
        }
        return null;
    }

    /**
     * span 标识去重并按 (block, line, span) 排序；页面上不存在的标识按字面解析排序后丢弃
     */
    List<SpanRecord> orderSpans(List<String> spanIds, PageGlyphLayout layout) {
        Set<String> deduped = new LinkedHashSet<>();
        for (String id : spanIds) {
            if (id != null && !id.isEmpty()) {
                deduped.add(id);
            }
        }
        List<SpanRecord> spans = new ArrayList<>();
        for (String id : deduped) {
            SpanRecord span = layout.findSpan(id);
            if (span != null) {
                spans.add(span);
            } else {
                log.debug("span 标识 {} 在第 {} 页不存在", id, layout.getPage() + 1);
            }
        }
        spans.sort(Comparator.comparingInt(SpanRecord::getBlockIndex)
                .thenComparingInt(SpanRecord::getLineIndex)
                .thenComparingInt(SpanRecord::getSpanIndex));
        return spans;
    }

    // ==================== 整页扫描 ====================

    private LocateResult locateByPageScan(PageGlyphLayout layout, MappingEntry entry, Collection<Rect> usedRects) {
        List<PageOccurrence> occurrences = findOccurrences(layout, entry.getOriginal(), null);
        if (occurrences.isEmpty()) {
            return LocateResult.failed(EntryFailure.Kind.LOCATION_NOT_FOUND,
                    "第 " + (layout.getPage() + 1) + " 页找不到 '" + entry.getOriginal() + "'");
        }

        Rect clip = entry.clipRect().orElse(null);
        Rect padded = clip != null ? clip.expand(CLIP_PADDING) : null;

        List<PageOccurrence> compatible = new ArrayList<>();
        boolean conflictSeen = false;
        for (PageOccurrence occ : occurrences) {
            if (padded != null && !occ.rect.intersects(padded)) {
                continue;
            }
            if (conflicts(occ.rect, usedRects)) {
                conflictSeen = true;
                continue;
            }
            if (!FingerprintSupport.matches(occ.prefix, occ.suffix, entry.getPrefix(), entry.getSuffix())) {
                log.debug("指纹不一致，跳过 {}", occ);
                continue;
            }
            compatible.add(occ);
        }

        if (compatible.isEmpty()) {
            if (conflictSeen) {
                return LocateResult.failed(EntryFailure.Kind.RECT_CONFLICT, "所有候选均与已占用区域重叠");
            }
            return LocateResult.failed(EntryFailure.Kind.LOCATION_NOT_FOUND,
                    "共 " + occurrences.size() + " 处出现，无一与区域和指纹一致");
        }

        PageOccurrence chosen = bestByContext(compatible, entry);
        if (compatible.size() > 1 && entry.occurrenceIndex().isPresent()) {
            int wanted = entry.getOccurrenceIndex();
            if (wanted >= 0 && wanted < compatible.size()) {
                chosen = compatible.get(wanted);
            }
        }
        annotate(entry, chosen, LocateMethod.PAGE_SCAN);
        entry.getMatch().setOccurrenceOrdinal(compatible.indexOf(chosen));
        return LocateResult.found(toLocatedMatch(entry.getMatch()));
    }

    /**
     * 候选中与期望前后缀吻合最多的一处；与上下文不一致的排在后面，同分取靠前者
     */
    private static PageOccurrence bestByContext(List<PageOccurrence> candidates, MappingEntry entry) {
        PageOccurrence best = null;
        int bestScore = -1;
        for (PageOccurrence occ : candidates) {
            int score = FingerprintSupport.contextScore(occ.prefix, occ.suffix, entry.getPrefix(), entry.getSuffix());
            if (!FingerprintSupport.matches(occ.prefix, occ.suffix, entry.getPrefix(), entry.getSuffix())) {
                score = -1;
            }
            if (best == null || score > bestScore) {
                best = occ;
                bestScore = score;
            }
        }
        return best;
    }

    /**
     * 查找页面上目标子串的全部出现，按 (y0, x0) 排序
     *
     * 先在归一化文本中做大小写无关查找；整页无结果时，去除重音和空白后再查找。
     *
     * @param layout 页面布局
     * @param needle 目标子串
     * @param clip   限定区域，null 表示整页
     */
    public List<PageOccurrence> findOccurrences(PageGlyphLayout layout, String needle, Rect clip) {
        List<PageOccurrence> results = new ArrayList<>();
        String target = TextNormalizer.normalizeForCompare(needle);
        if (target.isEmpty()) {
            return results;
        }

        PageText pageText = new PageText(layout.getSpans());

        for (SpanRecord span : layout.getSpans()) {
            if (clip != null && (span.getBbox() == null || !span.getBbox().intersects(clip))) {
                continue;
            }
            NormalizedText normalized = span.getNormalized();
            String lower = normalized.getText().toLowerCase(Locale.ROOT);
            if (lower.length() != normalized.length()) {
                continue;
            }
            int from = 0;
            while (true) {
                int index = lower.indexOf(target, from);
                if (index < 0) {
                    break;
                }
                int[] raw = normalized.rawRange(index, index + target.length());
                addOccurrence(results, pageText, span, raw, clip);
                from = index + target.length();
            }
        }

        if (results.isEmpty()) {
            CompactText targetKey = CompactText.folded(needle);
            if (!targetKey.text.isEmpty()) {
                for (SpanRecord span : layout.getSpans()) {
                    if (clip != null && (span.getBbox() == null || !span.getBbox().intersects(clip))) {
                        continue;
                    }
                    CompactText key = CompactText.folded(span.getRawText());
                    int from = 0;
                    while (true) {
                        int index = key.text.indexOf(targetKey.text, from);
                        if (index < 0) {
                            break;
                        }
                        addOccurrence(results, pageText, span, key.rawRange(index, index + targetKey.text.length()), clip);
                        from = index + targetKey.text.length();
                    }
                }
            }
        }

        results.sort(Comparator.comparingDouble((PageOccurrence o) -> Math.round(o.rect.y0 * 1000f) / 1000f)
                .thenComparingDouble(o -> o.rect.x0));
        for (int i = 0; i < results.size(); i++) {
            results.get(i).ordinal = i;
        }
        return results;
    }

    private void addOccurrence(List<PageOccurrence> results, PageText pageText, SpanRecord span, int[] raw, Rect clip) {
        if (raw == null) {
            return;
        }
        Rect rect = span.rectForRawRange(raw[0], raw[1]);
        if (rect == null || (clip != null && !rect.intersects(clip))) {
            return;
        }
        int pageStart = pageText.offsetOf(span) + raw[0];
        int pageEnd = pageText.offsetOf(span) + raw[1];
        String prefix = pageText.text.substring(Math.max(0, pageStart - occurrenceContext), pageStart);
        String suffix = pageText.text.substring(pageEnd, Math.min(pageText.text.length(), pageEnd + occurrenceContext));
        results.add(new PageOccurrence(span, raw[0], raw[1], rect, span.rawSlice(raw[0], raw[1]), prefix, suffix));
    }

    // ==================== 公共工具 ====================

    private static boolean conflicts(Rect rect, Collection<Rect> usedRects) {
        if (rect == null || usedRects == null) {
            return false;
        }
        for (Rect used : usedRects) {
            if (rect.intersects(used)) {
                return true;
            }
        }
        return false;
    }

    private static boolean sameText(String actual, String expected) {
        String a = TextNormalizer.normalizeForCompare(actual);
        String e = TextNormalizer.normalizeForCompare(expected);
        if (!e.isEmpty() && a.equals(e)) {
            return true;
        }
        String ka = CompactText.folded(actual).text;
        String ke = CompactText.folded(expected).text;
        return !ke.isEmpty() && ka.equals(ke);
    }

    private void annotate(MappingEntry entry, PageOccurrence occ, LocateMethod method) {
        Map<SpanRecord, int[]> ranges = new LinkedHashMap<>();
        ranges.put(occ.span, new int[]{occ.charStart, occ.charEnd});
        annotate(entry, ranges, method);
    }

    /**
     * 把匹配到的各 span 原始区间写入条目的匹配信息
     */
    private void annotate(MappingEntry entry, Map<SpanRecord, int[]> ranges, LocateMethod method) {
        MatchMetadata match = entry.getMatch();
        Rect union = null;
        StringBuilder text = new StringBuilder();
        List<GlyphPath> paths = new ArrayList<>();
        List<String> spanIds = new ArrayList<>();
        int length = 0;
        SpanRecord first = null;

        for (Map.Entry<SpanRecord, int[]> e : ranges.entrySet()) {
            SpanRecord span = e.getKey();
            int start = e.getValue()[0];
            int end = e.getValue()[1];
            Rect rect = span.rectForRawRange(start, end);
            if (rect == null) {
                continue;
            }
            if (first == null) {
                first = span;
            }
            union = union == null ? rect : union.union(rect);
            text.append(span.rawSlice(start, end));
            paths.add(new GlyphPath(span.getBlockIndex(), span.getLineIndex(), span.getSpanIndex(),
                    start, end, span.getSpanId()));
            spanIds.add(span.getSpanId());
            length += end - start;
        }

        match.setRect(union);
        match.setMatchedText(text.toString());
        match.setGlyphPaths(paths);
        match.setSpanIds(spanIds);
        match.setSpanLength(length);
        match.setMethod(method);
        if (first != null) {
            match.setFont(first.getFont());
            match.setFontSize(first.getFontSize());
        }
        log.debug("定位成功 [{}] q={} '{}' -> {} {}", method, entry.getQLabel(),
                TextNormalizer.truncate(entry.getOriginal(), 30), union, paths);
    }

    private static LocatedMatch toLocatedMatch(MatchMetadata match) {
        if (match.getRect() == null) {
            return null;
        }
        float fontSize = match.getFontSize() > 0f ? match.getFontSize() : 10f;
        return new LocatedMatch(match.getRect(), fontSize, match.getSpanLength());
    }

    /**
     * 页面拼接文本（span 之间以空格分隔），用于截取跨 span 的前后缀
     */
    private static class PageText {
        final String text;
        final Map<SpanRecord, Integer> offsets = new HashMap<>();

        PageText(List<SpanRecord> spans) {
            StringBuilder sb = new StringBuilder();
            for (SpanRecord span : spans) {
                if (sb.length() > 0) {
                    sb.append(' ');
                }
                offsets.put(span, sb.length());
                sb.append(span.getRawText());
            }
            this.text = sb.toString();
        }

        int offsetOf(SpanRecord span) {
            return offsets.getOrDefault(span, 0);
        }
    }
}
