package com.example.pdfrewrite.util.rewrite;

import com.example.pdfrewrite.util.rewrite.dto.RewriteOutcome;
import com.example.pdfrewrite.util.rewrite.dto.SegmentEdit;
import com.example.pdfrewrite.util.stream.dto.TextSegment;
import org.apache.pdfbox.contentstream.operator.Operator;
import org.apache.pdfbox.cos.COSArray;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSFloat;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.cos.COSString;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * 等宽替代字体策略
 *
 * 把一个文本显示操作拆成：
 * <pre>
 * [前缀] TJ
 * /Courier size Tf
 * [(替换文本) 补齐字距] TJ
 * /原字体 原字号 Tf
 * [后缀] TJ
 * </pre>
 * 替换文本的宽度与原文一致，后续文字位置不变。空替换只输出一个吃掉原宽度的字距。
 * ' 和 " 先展开为 T*（" 另加 Tw / Tc），再按 TJ 拆分。
 */
public class SubstituteFontStrategy implements SegmentRewriteStrategy {

    private static final Logger log = LoggerFactory.getLogger(SubstituteFontStrategy.class);

    private final SubstituteFontSizing sizing;
    private final float charWidthRatio;

    public SubstituteFontStrategy(SubstituteFontSizing sizing, float charWidthRatio) {
        this.sizing = sizing;
        this.charWidthRatio = charWidthRatio;
    }

    @Override
    public RewriteStrategyKind kind() {
        return RewriteStrategyKind.SUBSTITUTE_FONT;
    }

    @Override
    public RewriteOutcome rewrite(TextSegment segment, List<COSBase> operands, List<SegmentEdit> edits,
                                  RewriteContext context) {
        if (segment.getFontName() == null || segment.getFontSize() <= 0f) {
            return RewriteOutcome.failed("缺少 Tf 字体状态，无法恢复原字体");
        }
        COSName substituteName;
        try {
            substituteName = context.substituteFontName();
        } catch (IllegalStateException e) {
            return RewriteOutcome.failed(e.getMessage());
        }

        List<Object> tokens = new ArrayList<>();
        String op = segment.getOperator();
        if ("'".equals(op)) {
            tokens.add(Operator.getOperator("T*"));
        } else if ("\"".equals(op)) {
            if (operands.size() < 3) {
                return RewriteOutcome.failed("\" 操作数不足");
            }
            tokens.add(operands.get(0));
            tokens.add(Operator.getOperator("Tw"));
            tokens.add(operands.get(1));
            tokens.add(Operator.getOperator("Tc"));
            tokens.add(Operator.getOperator("T*"));
        }

        COSName originalFont = COSName.getPDFName(segment.getFontName());
        float originalSize = segment.getFontSize();
        int cursor = 0;
        for (int i = 0; i < edits.size(); i++) {
            SegmentEdit edit = edits.get(i);
            addShow(tokens, TextShowSlicer.slice(segment.getEntries(), cursor, edit.start));

            int end = edit.end;
            if (edit.continuation && edit.replacement.isEmpty()) {
                int limit = i + 1 < edits.size() ? edits.get(i + 1).start : segment.getText().length();
                end = absorbTrailingSpace(segment.getText(), edit, limit);
            }
            float originalWidth = TextShowSlicer.measure(segment, edit.start, end, charWidthRatio);
            if (edit.replacement.isEmpty()) {
                addSpacing(tokens, sizing.spacingForRemoval(originalWidth, originalSize));
            } else {
                SubstituteFontSizing.Fit fit = sizing.fit(edit.replacement, originalWidth, edit.end - edit.start);
                if (fit.isEmpty()) {
                    addSpacing(tokens, sizing.spacingForRemoval(originalWidth, originalSize));
                } else {
                    byte[] encoded = encode(context.substituteFont(), fit.text);
                    tokens.add(substituteName);
                    tokens.add(new COSFloat(fit.fontSize));
                    tokens.add(Operator.getOperator("Tf"));
                    COSArray array = new COSArray();
                    array.add(new COSString(encoded));
                    if (fit.spacing != 0f) {
                        array.add(new COSFloat(fit.spacing));
                    }
                    tokens.add(array);
                    tokens.add(Operator.getOperator("TJ"));
                    tokens.add(originalFont);
                    tokens.add(new COSFloat(originalSize));
                    tokens.add(Operator.getOperator("Tf"));
                    if (fit.isAbbreviated(edit.replacement)) {
                        log.debug("替换文本过长，已截断: '{}' -> '{}'", edit.replacement, fit.text);
                    }
                }
            }
            cursor = end;
        }
        addShow(tokens, TextShowSlicer.slice(segment.getEntries(), cursor, segment.getText().length()));
        return RewriteOutcome.ok(tokens);
    }

    /**
     * 跨段记录在后续段留下的空白
     *
     * 删除区之后紧跟的空白与替换文本之间还隔着被删字形的宽度，文本提取会把这段空隙再算成一个空格。
     * 替换文本本身以空白结尾时不吸收。
     */
    static int absorbTrailingSpace(String text, SegmentEdit edit, int limit) {
        String replacement = edit.record == null ? "" : edit.record.getReplacementText();
        if (replacement == null || replacement.isEmpty()
                || Character.isWhitespace(replacement.charAt(replacement.length() - 1))) {
            return edit.end;
        }
        int end = edit.end;
        while (end < limit && end < text.length() && Character.isWhitespace(text.charAt(end))) {
            end++;
        }
        return end;
    }

    private static void addShow(List<Object> tokens, COSArray array) {
        if (array.size() > 0) {
            tokens.add(array);
            tokens.add(Operator.getOperator("TJ"));
        }
    }

    private static void addSpacing(List<Object> tokens, float spacing) {
        if (spacing == 0f) {
            return;
        }
        COSArray array = new COSArray();
        array.add(new COSFloat(spacing));
        tokens.add(array);
        tokens.add(Operator.getOperator("TJ"));
    }

    /**
     * 按替代字体编码，无法编码的字符用 '?' 代替
     */
    static byte[] encode(PDFont font, String text) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (int i = 0; i < text.length(); ) {
            int cp = text.codePointAt(i);
            String ch = new String(Character.toChars(cp));
            byte[] bytes;
            try {
                bytes = font.encode(ch);
            } catch (IllegalArgumentException | IOException e) {
                log.debug("替代字体无法编码字符 U+{}，以 '?' 代替", Integer.toHexString(cp).toUpperCase());
                bytes = new byte[]{'?'};
            }
            out.write(bytes, 0, bytes.length);
            i += Character.charCount(cp);
        }
        return out.toByteArray();
    }
}
