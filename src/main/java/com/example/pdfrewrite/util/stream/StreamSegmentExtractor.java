package com.example.pdfrewrite.util.stream;

import com.example.pdfrewrite.util.stream.dto.GlyphCode;
import com.example.pdfrewrite.util.stream.dto.SegmentExtraction;
import com.example.pdfrewrite.util.stream.dto.TextSegment;
import com.example.pdfrewrite.util.stream.dto.TjEntry;
import org.apache.pdfbox.contentstream.operator.Operator;
import org.apache.pdfbox.cos.COSArray;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.cos.COSNumber;
import org.apache.pdfbox.cos.COSString;
import org.apache.pdfbox.pdmodel.PDResources;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 内容流文本分段提取器
 *
 * 遍历页面操作符序列：
 * <ul>
 *   <li>Tf 记录当前字体和字号，Tz 记录水平缩放，q / Q 保存和恢复这些状态</li>
 *   <li>Tj、'、" 的字符串解码后生成一个段</li>
 *   <li>TJ 数组中字符串解码后拼接；数值视为字距，不高于空格阈值（默认 -80）时插入一个空格，
 *       并按段内偏移记录到字距表</li>
 * </ul>
 *
 * 解码优先使用字体的 ToUnicode 映射，没有时按 ISO-8859-1 直接解释字节。
 * 全部段文本按顺序拼接恰好等于整页的线性化文本，段偏移可直接寻址。
 */
public class StreamSegmentExtractor {

    private static final Logger log = LoggerFactory.getLogger(StreamSegmentExtractor.class);

    public static final float DEFAULT_SPACE_THRESHOLD = -80f;

    private final float spaceThreshold;

    public StreamSegmentExtractor() {
        this(DEFAULT_SPACE_THRESHOLD);
    }

    public StreamSegmentExtractor(float spaceThreshold) {
        this.spaceThreshold = spaceThreshold;
    }

    /**
     * 提取文本段
     *
     * @param tokens    页面内容流解析出的操作数与操作符序列
     * @param resources 页面资源（查找字体），可为 null
     * @return 分段结果
     * @throws IOException 字体解码异常
     */
    public SegmentExtraction extract(List<Object> tokens, PDResources resources) throws IOException {
        List<TextSegment> segments = new ArrayList<>();
        StringBuilder streamText = new StringBuilder();
        Map<String, PDFont> fontCache = new HashMap<>();
        Deque<TextState> stack = new ArrayDeque<>();
        TextState state = new TextState();
        List<COSBase> operands = new ArrayList<>();
        int tokensScanned = 0;
        int textShowOps = 0;

        for (int index = 0; index < tokens.size(); index++) {
            Object token = tokens.get(index);
            if (!(token instanceof Operator)) {
                if (token instanceof COSBase) {
                    operands.add((COSBase) token);
                }
                continue;
            }

            String op = ((Operator) token).getName();
            switch (op) {
                case "q":
                    stack.push(state.copy());
                    break;
                case "Q":
                    if (!stack.isEmpty()) {
                        state = stack.pop();
                    }
                    break;
                case "Tf":
                    if (operands.size() >= 2 && operands.get(0) instanceof COSName) {
                        state.fontName = ((COSName) operands.get(0)).getName();
                        if (operands.get(1) instanceof COSNumber) {
                            state.fontSize = ((COSNumber) operands.get(1)).floatValue();
                        }
                    }
                    break;
                case "Tz":
                    if (!operands.isEmpty() && operands.get(0) instanceof COSNumber) {
                        state.horizontalScaling = ((COSNumber) operands.get(0)).floatValue();
                    }
                    break;
                case "Tj":
                case "'":
                case "\"":
                    COSBase last = operands.isEmpty() ? null : operands.get(operands.size() - 1);
                    if (last instanceof COSString) {
                        textShowOps++;
                        PDFont font = resolveFont(resources, state.fontName, fontCache);
                        List<GlyphCode> codes = decode((COSString) last, font);
                        TjEntry entry = TjEntry.text(last, codes);
                        String text = entry.text();
                        entry.start = 0;
                        entry.end = text.length();
                        List<TjEntry> entries = new ArrayList<>();
                        entries.add(entry);
                        segments.add(new TextSegment(index, op, text, streamText.length(), new LinkedHashMap<>(),
                                entries, state.fontName, state.fontSize, state.horizontalScaling));
                        streamText.append(text);
                        tokensScanned += text.length();
                    }
                    break;
                case "TJ":
                    if (!operands.isEmpty() && operands.get(0) instanceof COSArray) {
                        textShowOps++;
                        PDFont font = resolveFont(resources, state.fontName, fontCache);
                        TextSegment segment = decodeArray(index, (COSArray) operands.get(0), font, state,
                                streamText.length());
                        segments.add(segment);
                        streamText.append(segment.getText());
                        tokensScanned += segment.getText().length();
                    }
                    break;
                default:
                    break;
            }
            operands.clear();
        }

        log.debug("内容流分段完成: {} 个文本显示操作, {} 个字符", textShowOps, streamText.length());
        return new SegmentExtraction(segments, streamText.toString(), tokensScanned, textShowOps);
    }

    private TextSegment decodeArray(int index, COSArray array, PDFont font, TextState state, int offset)
            throws IOException {
        List<TjEntry> entries = new ArrayList<>();
        Map<Integer, Float> kerns = new LinkedHashMap<>();
        StringBuilder text = new StringBuilder();

        for (int i = 0; i < array.size(); i++) {
            COSBase item = array.get(i);
            TjEntry entry;
            if (item instanceof COSString) {
                entry = TjEntry.text(item, decode((COSString) item, font));
            } else if (item instanceof COSNumber) {
                float value = ((COSNumber) item).floatValue();
                entry = TjEntry.kern(item, value, value <= spaceThreshold);
            } else {
                entry = TjEntry.other(item);
            }
            entry.start = text.length();
            text.append(entry.text());
            entry.end = text.length();
            if (entry.kind == TjEntry.Kind.KERN) {
                kerns.merge(entry.end, entry.value, Float::sum);
            }
            entries.add(entry);
        }
        return new TextSegment(index, "TJ", text.toString(), offset, kerns, entries,
                state.fontName, state.fontSize, state.horizontalScaling);
    }

    /**
     * 把字符串操作数拆成字符编码，并解码出 Unicode 文本与字形宽度
     */
    public static List<GlyphCode> decode(COSString string, PDFont font) throws IOException {
        byte[] data = string.getBytes();
        List<GlyphCode> codes = new ArrayList<>();
        if (font == null) {
            for (byte b : data) {
                codes.add(new GlyphCode(b & 0xff, new byte[]{b},
                        new String(new byte[]{b}, StandardCharsets.ISO_8859_1), 0f));
            }
            return codes;
        }

        ByteArrayInputStream in = new ByteArrayInputStream(data);
        int position = 0;
        while (in.available() > 0) {
            int before = in.available();
            int code = font.readCode(in);
            int consumed = before - in.available();
            if (consumed <= 0) {
                break;
            }
            byte[] bytes = Arrays.copyOfRange(data, position, position + consumed);
            position += consumed;
            String unicode = font.toUnicode(code);
            if (unicode == null || unicode.isEmpty()) {
                unicode = new String(bytes, StandardCharsets.ISO_8859_1);
            }
            codes.add(new GlyphCode(code, bytes, unicode, font.getWidth(code)));
        }
        return codes;
    }

    private PDFont resolveFont(PDResources resources, String fontName, Map<String, PDFont> cache) {
        if (resources == null || fontName == null) {
            return null;
        }
        if (cache.containsKey(fontName)) {
            return cache.get(fontName);
        }
        PDFont font = null;
        try {
            font = resources.getFont(COSName.getPDFName(fontName));
        } catch (IOException e) {
            log.warn("字体资源 {} 加载失败，按 ISO-8859-1 解码: {}", fontName, e.getMessage());
        }
        cache.put(fontName, font);
        return font;
    }

    /**
     * 文本状态（随 q / Q 保存恢复）
     */
    private static class TextState {
        String fontName;
        float fontSize = 12f;
        float horizontalScaling = 100f;

        TextState copy() {
            TextState copy = new TextState();
            copy.fontName = fontName;
            copy.fontSize = fontSize;
            copy.horizontalScaling = horizontalScaling;
            return copy;
        }
    }
}
