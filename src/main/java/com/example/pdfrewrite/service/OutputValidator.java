package com.example.pdfrewrite.service;

import com.example.pdfrewrite.config.RewriteSettings;
import com.example.pdfrewrite.util.coordinate.Rect;
import com.example.pdfrewrite.util.locate.dto.MappingEntry;
import com.example.pdfrewrite.util.text.TextNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.text.PDFTextStripperByArea;
import org.springframework.stereotype.Service;

import java.awt.geom.Rectangle2D;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 输出校验
 *
 * 重新打开输出文档，在每条已应用映射的矩形（外扩 10pt，有选区四边形时 1pt）内提取文本：
 * 原文不应再出现（替换文本本身包含原文时除外），替换文本应恰好出现一次。
 * 比较前去除空白、折叠大小写与兼容字符。
 */
@Slf4j
@Service
public class OutputValidator {

    private static final float QUAD_PADDING = 1f;

    private final RewriteSettings settings;

    public OutputValidator(RewriteSettings settings) {
        this.settings = settings;
    }

    /**
     * @return 不一致项描述，全部通过时为空
     */
    public List<String> validate(byte[] outputBytes, List<MappingEntry> appliedEntries) {
        List<String> errors = new ArrayList<>();
        Map<Integer, List<MappingEntry>> byPage = new TreeMap<>();
        for (MappingEntry entry : appliedEntries) {
            if (entry.getPageIndex() == null || entry.getMatch().getRect() == null) {
                continue;
            }
            byPage.computeIfAbsent(entry.getPageIndex(), k -> new ArrayList<>()).add(entry);
        }
        if (byPage.isEmpty()) {
            return errors;
        }

        try (PdfDocumentHandle handle = PdfDocumentHandle.open(outputBytes)) {
            for (Map.Entry<Integer, List<MappingEntry>> page : byPage.entrySet()) {
                validatePage(handle, page.getKey(), page.getValue(), errors);
            }
        } catch (IOException e) {
            errors.add("无法读取输出文档: " + e.getMessage());
        }

        if (errors.isEmpty()) {
            log.info("输出校验通过: {} 条映射", appliedEntries.size());
        } else {
            log.error("输出校验发现 {} 处不一致", errors.size());
        }
        return errors;
    }

    private void validatePage(PdfDocumentHandle handle, int pageIndex, List<MappingEntry> entries,
                              List<String> errors) throws IOException {
        PDFTextStripperByArea stripper = new PDFTextStripperByArea();
        stripper.setSortByPosition(true);
        for (int i = 0; i < entries.size(); i++) {
            MappingEntry entry = entries.get(i);
            float padding = entry.hasSelectionQuads() ? QUAD_PADDING : settings.getValidationBboxPadding();
            Rect region = entry.getMatch().getRect().expand(padding);
            stripper.addRegion(regionName(i),
                    new Rectangle2D.Float(region.x0, region.y0, region.width(), region.height()));
        }
        stripper.extractRegions(handle.getPage(pageIndex));

        for (int i = 0; i < entries.size(); i++) {
            MappingEntry entry = entries.get(i);
            String actual = TextNormalizer.collapseForValidation(stripper.getTextForRegion(regionName(i)));
            String original = TextNormalizer.collapseForValidation(entry.getOriginal());
            String replacement = TextNormalizer.collapseForValidation(entry.getReplacement());

            if (!original.isEmpty() && !replacement.contains(original) && actual.contains(original)) {
                errors.add(String.format("第 %d 页 %s: 原文 '%s' 仍然存在", pageIndex + 1,
                        entry.getQLabel(), entry.getOriginal()));
            }
            int count = countOccurrences(actual, replacement);
            if (count != 1) {
                errors.add(String.format("第 %d 页 %s: 替换文本 '%s' 出现 %d 次（应为 1 次）", pageIndex + 1,
                        entry.getQLabel(), entry.getReplacement(), count));
            }
        }
    }

    private static String regionName(int index) {
        return "entry" + index;
    }

    static int countOccurrences(String text, String needle) {
        if (needle.isEmpty()) {
            return 0;
        }
        int count = 0;
        int index = text.indexOf(needle);
        while (index >= 0) {
            count++;
            index = text.indexOf(needle, index + needle.length());
        }
        return count;
    }
}
