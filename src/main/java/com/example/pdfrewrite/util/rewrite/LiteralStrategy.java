package com.example.pdfrewrite.util.rewrite;

import com.example.pdfrewrite.util.rewrite.dto.RewriteOutcome;
import com.example.pdfrewrite.util.rewrite.dto.SegmentEdit;
import com.example.pdfrewrite.util.stream.dto.GlyphCode;
import com.example.pdfrewrite.util.stream.dto.TextSegment;
import com.example.pdfrewrite.util.stream.dto.TjEntry;
import org.apache.pdfbox.contentstream.operator.Operator;
import org.apache.pdfbox.cos.COSArray;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSFloat;
import org.apache.pdfbox.cos.COSString;
import org.apache.pdfbox.pdmodel.font.PDFont;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 原字体直接拼接策略
 *
 * 保留段的原字体、字号和编辑区间以外的字距，在编辑区间内写入用原字体编码的替换文本；
 * 严格位于编辑区间内部的字距被丢弃。替换后变宽时在操作前后加 Tz 压缩并恢复原缩放。
 */
public class LiteralStrategy implements SegmentRewriteStrategy {

    private static final float SCALING_LIMIT = 99.5f;

    private final float charWidthRatio;

    public LiteralStrategy(float charWidthRatio) {
        this.charWidthRatio = charWidthRatio;
    }

    @Override
    public RewriteStrategyKind kind() {
        return RewriteStrategyKind.LITERAL;
    }

    @Override
    public RewriteOutcome rewrite(TextSegment segment, List<COSBase> operands, List<SegmentEdit> edits,
                                  RewriteContext context) {
        PDFont font;
        Map<SegmentEdit, byte[]> encoded = new HashMap<>();
        float replacementWidth = 0f;
        try {
            font = context.font(segment.getFontName());
            for (SegmentEdit edit : edits) {
                encoded.put(edit, encode(font, edit.replacement));
                if (font != null && !edit.replacement.isEmpty()) {
                    replacementWidth += font.getStringWidth(edit.replacement) / 1000f * segment.getFontSize();
                } else {
                    replacementWidth += edit.replacement.length() * segment.getFontSize() * charWidthRatio;
                }
            }
        } catch (IOException | IllegalArgumentException e) {
            return RewriteOutcome.failed("原字体无法编码替换文本: " + e.getMessage());
        }

        COSArray array = new COSArray();
        List<SegmentEdit> emitted = new ArrayList<>();
        for (TjEntry entry : segment.getEntries()) {
            if (entry.kind == TjEntry.Kind.TEXT) {
                ByteArrayOutputStream out = new ByteArrayOutputStream();
                int position = entry.start;
                for (GlyphCode code : entry.codes) {
                    SegmentEdit edit = editAt(edits, position);
                    if (edit == null) {
                        out.write(code.bytes, 0, code.bytes.length);
                    } else if (!emitted.contains(edit)) {
                        byte[] bytes = encoded.get(edit);
                        out.write(bytes, 0, bytes.length);
                        emitted.add(edit);
                    }
                    position += code.unicode.length();
                }
                if (out.size() > 0) {
                    array.add(new COSString(out.toByteArray()));
                }
            } else if (entry.kind == TjEntry.Kind.KERN) {
                if (entry.addsSpace) {
                    SegmentEdit edit = editAt(edits, entry.start);
                    if (edit == null) {
                        array.add(entry.template);
                    } else if (!emitted.contains(edit)) {
                        array.add(new COSString(encoded.get(edit)));
                        emitted.add(edit);
                    }
                } else if (!TextShowSlicer.insideAnyEdit(entry, edits)) {
                    array.add(entry.template);
                }
            } else {
                array.add(entry.template);
            }
        }
        if (emitted.size() != edits.size()) {
            return RewriteOutcome.failed("编辑区间未落在任何字符编码上");
        }

        List<Object> tokens = new ArrayList<>();
        float removedWidth = 0f;
        for (SegmentEdit edit : edits) {
            removedWidth += TextShowSlicer.measure(segment, edit.start, edit.end, charWidthRatio);
        }
        float originalWidth = TextShowSlicer.measure(segment, 0, segment.getText().length(), charWidthRatio);
        float newWidth = originalWidth - removedWidth + replacementWidth;
        float baseScaling = segment.getHorizontalScaling();
        float scaling = baseScaling;
        if (newWidth > originalWidth && newWidth > 0f) {
            scaling = baseScaling * originalWidth / newWidth;
        }
        boolean compress = scaling < SCALING_LIMIT * baseScaling / 100f;
        if (compress) {
            tokens.add(new COSFloat(scaling));
            tokens.add(Operator.getOperator("Tz"));
        }

        if (segment.isArrayShow()) {
            tokens.add(array);
            tokens.add(Operator.getOperator("TJ"));
        } else {
            // Tj / ' / " 只有一个字符串操作数，保留其余操作数
            for (int i = 0; i < operands.size() - 1; i++) {
                tokens.add(operands.get(i));
            }
            tokens.add(new COSString(joinStrings(array)));
            tokens.add(Operator.getOperator(segment.getOperator()));
        }

        if (compress) {
            tokens.add(new COSFloat(baseScaling));
            tokens.add(Operator.getOperator("Tz"));
        }
        return RewriteOutcome.ok(tokens);
    }

    private static SegmentEdit editAt(List<SegmentEdit> edits, int position) {
        for (SegmentEdit edit : edits) {
            if (edit.contains(position)) {
                return edit;
            }
        }
        return null;
    }

    private static byte[] encode(PDFont font, String text) throws IOException {
        if (text.isEmpty()) {
            return new byte[0];
        }
        if (font == null) {
            return text.getBytes(StandardCharsets.ISO_8859_1);
        }
        return font.encode(text);
    }

    private static byte[] joinStrings(COSArray array) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (int i = 0; i < array.size(); i++) {
            COSBase item = array.get(i);
            if (item instanceof COSString) {
                byte[] bytes = ((COSString) item).getBytes();
                out.write(bytes, 0, bytes.length);
            }
        }
        return out.toByteArray();
    }
}
