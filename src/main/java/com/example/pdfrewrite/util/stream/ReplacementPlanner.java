package com.example.pdfrewrite.util.stream;

import com.example.pdfrewrite.util.common.EntryFailure;
import com.example.pdfrewrite.util.locate.FingerprintSupport;
import com.example.pdfrewrite.util.locate.dto.MappingEntry;
import com.example.pdfrewrite.util.locate.dto.MatchMetadata;
import com.example.pdfrewrite.util.stream.dto.ReplacementPlan;
import com.example.pdfrewrite.util.stream.dto.ReplacementRecord;
import com.example.pdfrewrite.util.stream.dto.SegmentExtraction;
import com.example.pdfrewrite.util.text.CompactText;
import com.example.pdfrewrite.util.text.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 替换规划器
 * 把已定位的映射条目换算为内容流偏移区间，生成互不重叠的替换记录
 *
 * <h3>区间来源（按优先级）</h3>
 * <ol>
 *   <li>几何对齐：条目已附带置信度足够的内容流区间</li>
 *   <li>直接查找：在内容流文本中查找原文，用前后缀指纹和出现序号消歧</li>
 *   <li>紧凑查找：只保留字母数字后查找，应对残留的空白和标点差异</li>
 * </ol>
 *
 * 与已接受记录重叠、或截断后为空的区间被拒绝；指纹被接受后本页不可再用。
 */
public class ReplacementPlanner {

    private static final Logger log = LoggerFactory.getLogger(ReplacementPlanner.class);

    private final double minConfidence;

    public ReplacementPlanner() {
        this(0.8);
    }

    public ReplacementPlanner(double minConfidence) {
        this.minConfidence = minConfidence;
    }

    /**
     * 生成单页替换计划
     *
     * @param extraction       内容流分段结果
     * @param entries          已定位的条目（按处理顺序）
     * @param usedFingerprints 本页已消耗的指纹键，接受记录时写入
     * @return 替换计划
     */
    public ReplacementPlan plan(SegmentExtraction extraction, List<MappingEntry> entries, Set<String> usedFingerprints) {
        ReplacementPlan plan = new ReplacementPlan();
        String streamText = extraction.getStreamText();

        for (MappingEntry entry : entries) {
            int page = entry.getPageIndex() == null ? -1 : entry.getPageIndex();
            String key = entry.getFingerprintKey();
            if (key != null && usedFingerprints.contains(key)) {
                log.warn("指纹已被使用，跳过条目 {}: '{}'", entry.getQLabel(), entry.getOriginal());
                plan.reject(failure(EntryFailure.Kind.FINGERPRINT_CONSUMED, page, entry, "指纹已被本页其他记录使用"));
                continue;
            }

            ReplacementRecord record = fromGeometry(streamText, entry, plan);
            if (record == null) {
                record = directSearch(streamText, entry, plan);
            }
            if (record == null) {
                record = compactSearch(streamText, entry, plan);
            }
            if (record == null) {
                EntryFailure failure = diagnose(streamText, entry, plan, page);
                log.warn("条目 {} 未能确定内容流区间（{}）: '{}'", entry.getQLabel(), failure.getKind(),
                        TextNormalizer.truncate(entry.getOriginal(), 40));
                plan.reject(failure);
                continue;
            }

            plan.accept(record);
            if (key != null) {
                usedFingerprints.add(key);
            }
            log.debug("接受替换记录 {}: {}", entry.getQLabel(), record);
        }
        return plan;
    }

    // ==================== 几何区间 ====================

    private ReplacementRecord fromGeometry(String streamText, MappingEntry entry, ReplacementPlan plan) {
        MatchMetadata match = entry.getMatch();
        if (!match.hasStreamRange()) {
            return null;
        }
        Double confidence = match.getAlignmentConfidence();
        if (confidence != null && confidence < minConfidence) {
            return null;
        }
        int start = clamp(match.getStreamStart(), streamText.length());
        int end = clamp(match.getStreamEnd(), streamText.length());
        if (end <= start || plan.findOverlap(start, end) != null) {
            return null;
        }
        return new ReplacementRecord(start, end, entry.getReplacement(), entry, ReplacementRecord.Source.GEOMETRY);
    }

    // ==================== 直接查找 ====================

    private ReplacementRecord directSearch(String streamText, MappingEntry entry, ReplacementPlan plan) {
        String target = TextNormalizer.stripZeroWidth(entry.getOriginal());
        String haystack = streamText;
        int from = 0;
        List<int[]> candidates = new ArrayList<>();
        int index = haystack.indexOf(target, from);
        if (index < 0) {
            // 大小写差异
            haystack = streamText.toLowerCase(Locale.ROOT);
            target = target.toLowerCase(Locale.ROOT);
            if (haystack.length() != streamText.length()) {
                return null;
            }
            index = haystack.indexOf(target, from);
        }
        while (index >= 0) {
            candidates.add(new int[]{index, index + target.length()});
            from = index + 1;
            index = haystack.indexOf(target, from);
        }
        int[] chosen = choose(streamText, candidates, entry, plan);
        if (chosen == null) {
            return null;
        }
        return new ReplacementRecord(chosen[0], chosen[1], entry.getReplacement(), entry, ReplacementRecord.Source.DIRECT);
    }

    // ==================== 紧凑查找 ====================

    private ReplacementRecord compactSearch(String streamText, MappingEntry entry, ReplacementPlan plan) {
        String target = CompactText.alphanumeric(entry.getOriginal()).text;
        if (target.isEmpty()) {
            return null;
        }
        CompactText compact = CompactText.alphanumeric(streamText);
        List<int[]> candidates = new ArrayList<>();
        int from = 0;
        int index = compact.text.indexOf(target, from);
        while (index >= 0) {
            int[] raw = compact.rawRange(index, index + target.length());
            if (raw != null) {
                candidates.add(raw);
            }
            from = index + 1;
            index = compact.text.indexOf(target, from);
        }
        int[] chosen = choose(streamText, candidates, entry, plan);
        if (chosen == null) {
            return null;
        }
        return new ReplacementRecord(chosen[0], chosen[1], entry.getReplacement(), entry, ReplacementRecord.Source.COMPACT);
    }

    /**
     * 在候选区间中挑选：先排除重叠，再按指纹过滤；指纹全部不符时退回未过滤的候选，
     * 有出现序号时优先取对应序号
     */
    private int[] choose(String streamText, List<int[]> candidates, MappingEntry entry, ReplacementPlan plan) {
        List<int[]> free = new ArrayList<>();
        for (int[] candidate : candidates) {
            if (plan.findOverlap(candidate[0], candidate[1]) == null) {
                free.add(candidate);
            }
        }
        if (free.isEmpty()) {
            return null;
        }

        List<int[]> compatible = new ArrayList<>();
        int window = Math.max(lengthOf(entry.getPrefix()), lengthOf(entry.getSuffix()));
        for (int[] candidate : free) {
            String prefix = streamText.substring(Math.max(0, candidate[0] - window), candidate[0]);
            String suffix = streamText.substring(candidate[1], Math.min(streamText.length(), candidate[1] + window));
            if (FingerprintSupport.matches(prefix, suffix, entry.getPrefix(), entry.getSuffix())) {
                compatible.add(candidate);
            }
        }
        List<int[]> pool = compatible.isEmpty() ? free : compatible;

        Integer occurrence = entry.getOccurrenceIndex();
        if (pool.size() > 1 && occurrence != null && occurrence >= 0 && occurrence < pool.size()) {
            return pool.get(occurrence);
        }
        return pool.get(0);
    }

    /**
     * 区分失败原因：原文出现过但都被占用则为区间冲突，否则为找不到
     */
    private EntryFailure diagnose(String streamText, MappingEntry entry, ReplacementPlan plan, int page) {
        MatchMetadata match = entry.getMatch();
        if (match.hasStreamRange()) {
            int start = clamp(match.getStreamStart(), streamText.length());
            int end = clamp(match.getStreamEnd(), streamText.length());
            if (end <= start) {
                return failure(EntryFailure.Kind.EMPTY_RANGE, page, entry, "几何区间截断后为空");
            }
            if (plan.findOverlap(start, end) != null) {
                return failure(EntryFailure.Kind.RANGE_CONFLICT, page, entry,
                        "与已接受区间重叠 " + plan.findOverlap(start, end));
            }
        }
        String target = CompactText.alphanumeric(entry.getOriginal()).text;
        if (!target.isEmpty() && CompactText.alphanumeric(streamText).text.contains(target)) {
            return failure(EntryFailure.Kind.RANGE_CONFLICT, page, entry, "所有出现均与已接受区间重叠");
        }
        return failure(EntryFailure.Kind.STREAM_RANGE_NOT_FOUND, page, entry, "内容流文本中找不到原文");
    }

    private static EntryFailure failure(EntryFailure.Kind kind, int page, MappingEntry entry, String detail) {
        return new EntryFailure(kind, page, entry.getQLabel(), entry.getOriginal(), detail);
    }

    private static int clamp(Integer value, int length) {
        if (value == null) {
            return 0;
        }
        return Math.max(0, Math.min(value, length));
    }

    private static int lengthOf(String value) {
        return value == null ? 0 : value.length();
    }
}
