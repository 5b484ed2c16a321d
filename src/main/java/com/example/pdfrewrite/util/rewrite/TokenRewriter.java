package com.example.pdfrewrite.util.rewrite;

import com.example.pdfrewrite.util.common.EntryFailure;
import com.example.pdfrewrite.util.rewrite.dto.RewriteOutcome;
import com.example.pdfrewrite.util.rewrite.dto.RewriteReport;
import com.example.pdfrewrite.util.rewrite.dto.SegmentEdit;
import com.example.pdfrewrite.util.stream.dto.ReplacementRecord;
import com.example.pdfrewrite.util.stream.dto.SegmentExtraction;
import com.example.pdfrewrite.util.stream.dto.TextSegment;
import org.apache.pdfbox.contentstream.operator.Operator;
import org.apache.pdfbox.cos.COSBase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 内容流 token 改写器
 *
 * 把替换记录分解到各文本段的局部编辑，按操作符下标从后往前逐段改写，
 * 这样前面段的下标不受后面改写的影响。
 *
 * 每个段按配置的策略顺序尝试（默认先等宽替代字体，再原字体拼接），第一个成功的策略生效；
 * 全部失败时该段保持原样，涉及的记录标记为未应用并报告 REWRITE_FAILED。
 * 跨段记录要么所有段都改写，要么都不改写：所有段的结果先算出来再统一写回 token。
 */
public class TokenRewriter {

    private static final Logger log = LoggerFactory.getLogger(TokenRewriter.class);

    private final List<SegmentRewriteStrategy> strategies;

    public TokenRewriter(List<SegmentRewriteStrategy> strategies) {
        if (strategies == null || strategies.isEmpty()) {
            throw new IllegalArgumentException("至少需要一个改写策略");
        }
        this.strategies = new ArrayList<>(strategies);
    }

    /**
     * 按策略种类顺序创建
     *
     * @param kinds           策略尝试顺序，例如 [SUBSTITUTE_FONT, LITERAL]
     * @param charWidthRatio  等宽字宽比例
     * @param minReadableSize 最小可读字号
     */
    public static TokenRewriter of(List<RewriteStrategyKind> kinds, float charWidthRatio, float minReadableSize) {
        List<SegmentRewriteStrategy> list = new ArrayList<>();
        for (RewriteStrategyKind kind : kinds) {
            switch (kind) {
                case SUBSTITUTE_FONT:
                    list.add(new SubstituteFontStrategy(new SubstituteFontSizing(charWidthRatio, minReadableSize),
                            charWidthRatio));
                    break;
                case LITERAL:
                    list.add(new LiteralStrategy(charWidthRatio));
                    break;
                default:
                    throw new IllegalArgumentException("未知的改写策略: " + kind);
            }
        }
        return new TokenRewriter(list);
    }

    /**
     * 在 token 序列上原地应用替换记录
     *
     * @param tokens     页面内容流 token（原地修改）
     * @param extraction 同一 token 序列的分段结果
     * @param records    互不重叠的替换记录
     * @param context    页面改写上下文
     * @param page       页码（0 基），用于失败记录
     * @return 改写汇总
     */
    public RewriteReport apply(List<Object> tokens, SegmentExtraction extraction, List<ReplacementRecord> records,
                               RewriteContext context, int page) {
        RewriteReport report = new RewriteReport();
        Map<TextSegment, List<SegmentEdit>> editsBySegment = distribute(extraction, records);

        List<TextSegment> ordered = new ArrayList<>(editsBySegment.keySet());
        ordered.sort(Comparator.comparingInt(TextSegment::getOperatorIndex).reversed());

        Set<ReplacementRecord> failed = new LinkedHashSet<>();
        Map<TextSegment, RewriteOutcome> outcomes = new HashMap<>();
        Map<TextSegment, RewriteStrategyKind> usedBySegment = new HashMap<>();
        Set<TextSegment> failedSegments = new LinkedHashSet<>();

        // 一条记录涉及的任一段失败时整条记录撤销，其余段去掉该记录的编辑后重新计算，直到不再有新的失败
        boolean changed = true;
        while (changed) {
            changed = false;
            outcomes.clear();
            usedBySegment.clear();
            for (TextSegment segment : ordered) {
                List<SegmentEdit> edits = activeEdits(editsBySegment.get(segment), failed);
                if (edits.isEmpty()) {
                    continue;
                }
                List<COSBase> operands = operands(tokens, segment.getOperatorIndex());
                RewriteOutcome outcome = null;
                for (SegmentRewriteStrategy strategy : strategies) {
                    RewriteOutcome attempt = strategy.rewrite(segment, operands, edits, context);
                    if (attempt.isSuccess()) {
                        outcome = attempt;
                        usedBySegment.put(segment, strategy.kind());
                        break;
                    }
                    log.debug("策略 {} 未能改写段 {}: {}", strategy.kind(), segment, attempt.getDetail());
                }
                if (outcome == null) {
                    if (failedSegments.add(segment)) {
                        report.segmentFailed();
                        log.warn("页面 {} 的文本段 {} 所有改写策略均失败，保留原内容", page + 1, segment);
                    }
                    for (SegmentEdit edit : edits) {
                        changed |= failed.add(edit.record);
                    }
                } else {
                    outcomes.put(segment, outcome);
                }
            }
        }

        Map<ReplacementRecord, String> strategyByRecord = new HashMap<>();
        for (TextSegment segment : ordered) {
            RewriteOutcome outcome = outcomes.get(segment);
            if (outcome == null) {
                continue;
            }
            int operatorIndex = segment.getOperatorIndex();
            List<Object> range = tokens.subList(operandStart(tokens, operatorIndex), operatorIndex + 1);
            range.clear();
            range.addAll(outcome.getTokens());
            report.segmentRewritten();
            for (SegmentEdit edit : activeEdits(editsBySegment.get(segment), failed)) {
                strategyByRecord.putIfAbsent(edit.record, usedBySegment.get(segment).name());
            }
        }

        for (ReplacementRecord record : records) {
            if (!editsCover(editsBySegment, record)) {
                failed.add(record);
            }
            if (failed.contains(record)) {
                record.markUnapplied();
                report.addFailure(new EntryFailure(EntryFailure.Kind.REWRITE_FAILED, page,
                        record.getEntry() == null ? null : record.getEntry().getQLabel(),
                        record.getEntry() == null ? null : record.getEntry().getOriginal(),
                        "文本段改写失败，原内容保留"));
            } else {
                record.markApplied(strategyByRecord.get(record));
                report.recordApplied();
            }
        }
        return report;
    }

    /**
     * 把每条记录按段切分为段内编辑；跨段记录只在第一个段写入替换文本
     */
    Map<TextSegment, List<SegmentEdit>> distribute(SegmentExtraction extraction, List<ReplacementRecord> records) {
        Map<TextSegment, List<SegmentEdit>> result = new LinkedHashMap<>();
        for (ReplacementRecord record : records) {
            List<TextSegment> touched = extraction.segmentsOverlapping(record.getStart(), record.getEnd());
            for (int i = 0; i < touched.size(); i++) {
                TextSegment segment = touched.get(i);
                int localStart = Math.max(record.getStart(), segment.getStart()) - segment.getStart();
                int localEnd = Math.min(record.getEnd(), segment.getEnd()) - segment.getStart();
                String replacement = i == 0 ? record.getReplacementText() : "";
                result.computeIfAbsent(segment, k -> new ArrayList<>())
                        .add(new SegmentEdit(localStart, localEnd, replacement, record, i > 0));
            }
        }
        for (List<SegmentEdit> edits : result.values()) {
            edits.sort(Comparator.comparingInt(e -> e.start));
        }
        return result;
    }

    private static List<SegmentEdit> activeEdits(List<SegmentEdit> edits, Set<ReplacementRecord> failed) {
        List<SegmentEdit> active = new ArrayList<>(edits.size());
        for (SegmentEdit edit : edits) {
            if (!failed.contains(edit.record)) {
                active.add(edit);
            }
        }
        return active;
    }

    private static List<COSBase> operands(List<Object> tokens, int operatorIndex) {
        List<COSBase> operands = new ArrayList<>();
        for (int i = operandStart(tokens, operatorIndex); i < operatorIndex; i++) {
            if (tokens.get(i) instanceof COSBase) {
                operands.add((COSBase) tokens.get(i));
            }
        }
        return operands;
    }

    private static boolean editsCover(Map<TextSegment, List<SegmentEdit>> editsBySegment, ReplacementRecord record) {
        for (List<SegmentEdit> edits : editsBySegment.values()) {
            for (SegmentEdit edit : edits) {
                if (edit.record == record) {
                    return true;
                }
            }
        }
        return false;
    }

    private static int operandStart(List<Object> tokens, int operatorIndex) {
        int start = operatorIndex;
        while (start > 0 && !(tokens.get(start - 1) instanceof Operator)) {
            start--;
        }
        return start;
    }
}
