package com.example.pdfrewrite.service;

import com.example.pdfrewrite.config.RewriteSettings;
import com.example.pdfrewrite.exception.RenderException;
import com.example.pdfrewrite.service.dto.MappingContext;
import com.example.pdfrewrite.service.dto.QuestionContext;
import com.example.pdfrewrite.service.dto.SubstringMappingInput;
import com.example.pdfrewrite.util.coordinate.Rect;
import com.example.pdfrewrite.util.locate.FingerprintSupport;
import com.example.pdfrewrite.util.locate.dto.MappingEntry;
import com.example.pdfrewrite.util.text.TextNormalizer;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 映射上下文加载
 *
 * 把题目级的 JSON 输入展开为逐条的 {@link MappingEntry}：
 * <ol>
 *   <li>去除零宽标记，原文或替换文本为空的条目直接跳过</li>
 *   <li>start_pos / end_pos 缺失或 end_pos &lt;= start_pos：致命错误，消息包含题号</li>
 *   <li>在题干文本中校正偏移漂移，计算出现序号、前后缀窗口与指纹键</li>
 *   <li>selection_page 覆盖题目页码；只有选区四边形时用其外接矩形作为选区；映射没有 span 标识时继承题干的</li>
 * </ol>
 */
@Slf4j
@Service
public class MappingContextLoader {

    private final RewriteSettings settings;
    private final ObjectMapper objectMapper;

    public MappingContextLoader(RewriteSettings settings, ObjectMapper objectMapper) {
        this.settings = settings;
        this.objectMapper = objectMapper;
    }

    /**
     * 读取映射上下文 JSON
     */
    public MappingContext read(InputStream in) throws IOException {
        return objectMapper.readValue(in, MappingContext.class);
    }

    /**
     * 展开全部题目的映射条目，按页码排序
     *
     * @throws RenderException 偏移非法、无法在题干中对齐、或缺少可解析的页码
     */
    public List<MappingEntry> buildEntries(MappingContext context) {
        List<MappingEntry> entries = new ArrayList<>();
        if (context == null || context.getQuestions() == null) {
            return entries;
        }
        for (QuestionContext question : context.getQuestions()) {
            entries.addAll(buildEntries(question));
        }
        // 稳定排序：同一页内保持题目与条目的原始顺序
        entries.sort(Comparator.comparingInt(e -> e.getPageIndex() == null ? -1 : e.getPageIndex()));
        log.info("映射上下文展开完成: {} 道题, {} 条映射", context.getQuestions().size(), entries.size());
        return entries;
    }

    List<MappingEntry> buildEntries(QuestionContext question) {
        List<MappingEntry> entries = new ArrayList<>();
        String qLabel = question.getQLabel() == null ? "" : question.getQLabel().trim();
        String stemText = TextNormalizer.stripZeroWidth(question.getStemText());
        Rect stemBbox = Rect.of(question.getStemBbox());
        List<SubstringMappingInput> mappings = question.getSubstringMappings();
        if (mappings == null) {
            return entries;
        }

        for (int entryIndex = 0; entryIndex < mappings.size(); entryIndex++) {
            SubstringMappingInput mapping = mappings.get(entryIndex);
            if (mapping == null) {
                continue;
            }
            String original = TextNormalizer.stripZeroWidth(mapping.getOriginal()).trim();
            String replacement = TextNormalizer.stripZeroWidth(mapping.getReplacement()).trim();
            if (TextNormalizer.normalizeForMatch(original).isEmpty()
                    || TextNormalizer.normalizeForMatch(replacement).isEmpty()) {
                log.debug("题目 {} 第 {} 条映射原文或替换文本为空，跳过", qLabel, entryIndex);
                continue;
            }

            if (mapping.getStartPos() == null || mapping.getEndPos() == null) {
                throw new RenderException("题目 " + qLabel + " 的映射 '" + original + "' 缺少有效的 start_pos / end_pos");
            }
            if (mapping.getEndPos() <= mapping.getStartPos()) {
                throw new RenderException("题目 " + qLabel + " 的映射 '" + original + "' 区间非法: end_pos("
                        + mapping.getEndPos() + ") <= start_pos(" + mapping.getStartPos() + ")");
            }

            int[] span = normalizeSpanPosition(stemText, original, mapping.getStartPos(), mapping.getEndPos());
            if (span == null) {
                throw new RenderException("题目 " + qLabel + " 的映射 '" + original + "' 无法在题干文本中对齐");
            }
            int occurrence = computeOccurrenceIndex(stemText, original, span[0]);
            int window = settings.getFingerprintWindow();
            String prefix = stemText.substring(Math.max(0, span[0] - window), span[0]);
            String suffix = stemText.substring(span[1], Math.min(stemText.length(), span[1] + window));

            Integer page = mapping.getSelectionPage() != null ? mapping.getSelectionPage() : question.getPage();
            Integer pageIndex = safePageIndex(page);
            if (pageIndex == null) {
                throw new RenderException("题目 " + qLabel + " 的映射 '" + original + "' 没有可解析的页码");
            }

            MappingEntry entry = new MappingEntry(qLabel, entryIndex, original, replacement);
            entry.setPageIndex(pageIndex);
            entry.setStemText(stemText);
            entry.setStemBbox(stemBbox);
            entry.setStartPos(span[0]);
            entry.setEndPos(span[1]);
            entry.setPrefix(prefix);
            entry.setSuffix(suffix);
            entry.setOccurrenceIndex(occurrence);
            entry.setFingerprintKey(FingerprintSupport.fingerprintKey(prefix, original, suffix, occurrence));
            entry.setGlyphPathHint(mapping.getGlyphPath());

            Rect selection = Rect.of(mapping.getSelectionBbox());
            if (mapping.getSelectionQuads() != null && !mapping.getSelectionQuads().isEmpty()) {
                entry.setSelectionQuads(mapping.getSelectionQuads());
                if (selection == null) {
                    selection = Rect.fromQuads(mapping.getSelectionQuads());
                }
            }
            entry.setSelectionBbox(selection);

            if (mapping.getSelectionSpanIds() != null && !mapping.getSelectionSpanIds().isEmpty()) {
                entry.setSpanIds(new ArrayList<>(mapping.getSelectionSpanIds()));
            } else if (question.getStemSpans() != null && !question.getStemSpans().isEmpty()) {
                entry.setSpanIds(new ArrayList<>(question.getStemSpans()));
            }

            entries.add(entry);
        }
        return entries;
    }

    /**
     * 校正题干中的偏移漂移
     *
     * 依次尝试：声明区间恰好是原文 → 在前后 max(len+12, 24) 的窗口内查找 → 从 start_pos 起向后查找。
     *
     * @return [start, end)，找不到返回 null
     */
    static int[] normalizeSpanPosition(String stemText, String original, int startPos, int endPos) {
        int start = Math.max(0, startPos);
        int end = endPos < start ? start + original.length() : endPos;
        if (end <= stemText.length() && stemText.substring(start, end).equals(original)) {
            return new int[]{start, end};
        }

        int window = Math.max(original.length() + 12, 24);
        int localStart = Math.max(0, start - window);
        int localEnd = Math.min(stemText.length(), end + window);
        if (localStart < localEnd) {
            int relative = stemText.substring(localStart, localEnd).indexOf(original);
            if (relative >= 0) {
                return new int[]{localStart + relative, localStart + relative + original.length()};
            }
        }

        int fallback = stemText.indexOf(original, start);
        if (fallback >= 0) {
            return new int[]{fallback, fallback + original.length()};
        }
        return null;
    }

    /**
     * 原文在题干中的出现序号：目标位置恰好是某次出现时取其序号，否则取最近的一次
     */
    static int computeOccurrenceIndex(String stemText, String original, int targetIndex) {
        if (original == null || original.isEmpty()) {
            return 0;
        }
        List<Integer> occurrences = new ArrayList<>();
        int index = stemText.indexOf(original);
        while (index >= 0) {
            occurrences.add(index);
            index = stemText.indexOf(original, index + 1);
        }
        if (occurrences.isEmpty()) {
            return 0;
        }
        int exact = occurrences.indexOf(targetIndex);
        if (exact >= 0) {
            return exact;
        }
        int best = 0;
        for (int i = 1; i < occurrences.size(); i++) {
            if (Math.abs(occurrences.get(i) - targetIndex) < Math.abs(occurrences.get(best) - targetIndex)) {
                best = i;
            }
        }
        return best;
    }

    /**
     * 1 基页码转 0 基；0 视为第一页，负数和 null 返回 null
     */
    static Integer safePageIndex(Integer page) {
        if (page == null || page < 0) {
            return null;
        }
        return page == 0 ? 0 : page - 1;
    }
}
