package com.example.pdfrewrite.service;

import com.example.pdfrewrite.service.dto.MappingContext;
import com.example.pdfrewrite.service.dto.QuestionContext;
import com.example.pdfrewrite.service.dto.SubstringMappingInput;
import com.example.pdfrewrite.util.text.MarkerCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 带零宽标记的映射表
 *
 * 多行的原文和替换文本按行拆分后逐行配对（替换行不足时重复最后一行，多余的丢弃），
 * 每对生成 原文+标记 → 替换+标记，标记由 "{run}:structured:{题号}:{条目}:{行}" 派生。
 * 标记不可见，比较前必须去除。
 */
@Slf4j
@Service
public class MappingTableBuilder {

    public Map<String, String> build(String runId, MappingContext context) {
        Map<String, String> table = new LinkedHashMap<>();
        if (context == null || context.getQuestions() == null) {
            return table;
        }
        for (int questionIndex = 0; questionIndex < context.getQuestions().size(); questionIndex++) {
            QuestionContext question = context.getQuestions().get(questionIndex);
            List<SubstringMappingInput> mappings = question.getSubstringMappings();
            if (mappings == null || mappings.isEmpty()) {
                continue;
            }
            String qLabel = question.getQLabel() != null && !question.getQLabel().trim().isEmpty()
                    ? question.getQLabel().trim() : String.valueOf(questionIndex + 1);

            for (int entryIndex = 0; entryIndex < mappings.size(); entryIndex++) {
                SubstringMappingInput mapping = mappings.get(entryIndex);
                String original = mapping.getOriginal() == null ? "" : mapping.getOriginal().trim();
                String replacement = mapping.getReplacement() == null ? "" : mapping.getReplacement().trim();
                if (original.isEmpty() || replacement.isEmpty()) {
                    continue;
                }
                List<String[]> pairs = splitLines(original, replacement);
                for (int spanIndex = 0; spanIndex < pairs.size(); spanIndex++) {
                    String marker = MarkerCodec.encodeMarker(
                            runId + ":structured:" + qLabel + ":" + entryIndex + ":" + spanIndex);
                    table.put(pairs.get(spanIndex)[0] + marker, pairs.get(spanIndex)[1] + marker);
                }
            }
        }
        log.debug("映射表生成完成: {} 项", table.size());
        return table;
    }

    /**
     * 按行拆分并配对
     */
    static List<String[]> splitLines(String original, String replacement) {
        List<String> originals = lines(original);
        List<String> replacements = lines(replacement);
        List<String[]> pairs = new ArrayList<>();
        if (originals.isEmpty()) {
            return pairs;
        }
        if (replacements.isEmpty()) {
            replacements = new ArrayList<>(originals);
        }
        for (int i = 0; i < originals.size(); i++) {
            String repl = i < replacements.size() ? replacements.get(i) : replacements.get(replacements.size() - 1);
            pairs.add(new String[]{originals.get(i), repl});
        }
        return pairs;
    }

    private static List<String> lines(String text) {
        List<String> result = new ArrayList<>();
        for (String part : text.split("(?:\\r?\\n)+")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                result.add(trimmed);
            }
        }
        return result;
    }
}
