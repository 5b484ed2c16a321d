package com.example.pdfrewrite.util.plan;

import com.example.pdfrewrite.util.plan.dto.SliceReplacement;
import com.example.pdfrewrite.util.plan.dto.ValidationFailure;
import com.example.pdfrewrite.util.span.dto.SpanRecord;
import com.example.pdfrewrite.util.text.CompactText;
import com.example.pdfrewrite.util.text.NormalizedText;
import com.example.pdfrewrite.util.text.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;

/**
 * 单个 span 上的替换累积器
 *
 * <h3>加入规则</h3>
 * <ol>
 *   <li>先校验声明区间上的文本与期望原文一致（忽略连字、空白、大小写）；
 *       不一致时依次在 span 归一化文本中直接查找、在紧凑文本中查找，仍找不到则记录校验失败并丢弃</li>
 *   <li>已有替换包含新替换：丢弃新替换</li>
 *   <li>新替换包含已有替换：取代它们</li>
 *   <li>其他重叠：丢弃新替换（先到者优先）</li>
 * </ol>
 */
public class SpanRewriteAccumulator {

    private static final Logger log = LoggerFactory.getLogger(SpanRewriteAccumulator.class);

    private final SpanRecord span;
    private final List<SliceReplacement> slices = new ArrayList<>();
    private final List<ValidationFailure> failures = new ArrayList<>();

    public SpanRewriteAccumulator(SpanRecord span) {
        this.span = span;
    }

    /**
     * @return 是否被接受
     */
    public boolean add(SliceReplacement candidate) {
        SliceReplacement validated = validate(candidate);
        if (validated == null) {
            return false;
        }

        for (SliceReplacement existing : slices) {
            if (existing.contains(validated)) {
                log.debug("span {} 的替换 {} 已被 {} 包含，丢弃", span.getSpanId(), validated, existing);
                return false;
            }
        }
        List<SliceReplacement> superseded = new ArrayList<>();
        for (SliceReplacement existing : slices) {
            if (validated.contains(existing)) {
                superseded.add(existing);
            } else if (validated.overlaps(existing)) {
                log.debug("span {} 的替换 {} 与 {} 部分重叠，丢弃", span.getSpanId(), validated, existing);
                return false;
            }
        }
        for (Iterator<SliceReplacement> it = slices.iterator(); it.hasNext(); ) {
            if (superseded.contains(it.next())) {
                it.remove();
            }
        }
        slices.add(validated);
        slices.sort(Comparator.comparingInt(SliceReplacement::getStart));
        return true;
    }

    /**
     * 校验并在必要时修正区间，无法恢复时返回 null
     */
    SliceReplacement validate(SliceReplacement candidate) {
        String raw = span.getRawText();
        String expected = TextNormalizer.collapseForValidation(candidate.getExpected());
        int start = Math.max(0, Math.min(candidate.getStart(), raw.length()));
        int end = Math.max(start, Math.min(candidate.getEnd(), raw.length()));
        String actual = raw.substring(start, end);
        if (!expected.isEmpty() && TextNormalizer.collapseForValidation(actual).equals(expected)) {
            return start == candidate.getStart() && end == candidate.getEnd() ? candidate : candidate.withRange(start, end);
        }

        // 恢复 1：归一化文本直接查找
        NormalizedText normalized = span.getNormalized();
        String target = TextNormalizer.normalizeForCompare(candidate.getExpected());
        String lower = normalized.getText().toLowerCase(Locale.ROOT);
        if (!target.isEmpty() && lower.length() == normalized.length()) {
            int[] range = nearest(lower, target, candidate.getStart(), normalized, null);
            if (range != null) {
                log.debug("span {} 区间漂移，直接查找修正为 [{},{})", span.getSpanId(), range[0], range[1]);
                return candidate.withRange(range[0], range[1]);
            }
        }

        // 恢复 2：紧凑文本查找
        CompactText compact = CompactText.folded(raw);
        String compactTarget = CompactText.folded(candidate.getExpected()).text;
        if (!compactTarget.isEmpty()) {
            int[] range = nearest(compact.text, compactTarget, candidate.getStart(), null, compact);
            if (range != null) {
                log.debug("span {} 区间漂移，紧凑查找修正为 [{},{})", span.getSpanId(), range[0], range[1]);
                return candidate.withRange(range[0], range[1]);
            }
        }

        String qLabel = candidate.getMapping() == null ? null : candidate.getMapping().getQLabel();
        ValidationFailure failure = new ValidationFailure(span.getSpanId(), qLabel, candidate.getExpected(), actual,
                candidate.getStart(), candidate.getEnd());
        failures.add(failure);
        log.warn("计划校验失败，替换被丢弃: {}", failure);
        return null;
    }

    /**
     * 在 haystack 中找离声明起点最近的出现，换算回原始区间
     */
    private static int[] nearest(String haystack, String target, int claimedStart,
                                 NormalizedText normalized, CompactText compact) {
        int[] best = null;
        int bestDistance = Integer.MAX_VALUE;
        int index = haystack.indexOf(target);
        while (index >= 0) {
            int end = index + target.length();
            int[] raw = normalized != null ? normalized.rawRange(index, end) : compact.rawRange(index, end);
            if (raw != null) {
                int distance = Math.abs(raw[0] - claimedStart);
                if (distance < bestDistance) {
                    best = raw;
                    bestDistance = distance;
                }
            }
            index = haystack.indexOf(target, index + 1);
        }
        return best;
    }

    public SpanRecord getSpan() {
        return span;
    }

    public List<SliceReplacement> getSlices() {
        return slices;
    }

    public List<ValidationFailure> getFailures() {
        return failures;
    }

    public boolean isEmpty() {
        return slices.isEmpty();
    }
}
