package com.example.pdfrewrite.util.rewrite;

import com.example.pdfrewrite.util.rewrite.dto.SegmentEdit;
import com.example.pdfrewrite.util.stream.dto.GlyphCode;
import com.example.pdfrewrite.util.stream.dto.TextSegment;
import com.example.pdfrewrite.util.stream.dto.TjEntry;
import org.apache.pdfbox.cos.COSArray;
import org.apache.pdfbox.cos.COSString;

import java.io.ByteArrayOutputStream;
import java.util.List;

/**
 * 按段内字符区间切分文本显示操作的数组项，并测量区间宽度
 *
 * 字距项的归属：
 * <ul>
 *   <li>不占字符的字距落在区间两端时保留在保留片段里，严格位于替换区间内部时丢弃</li>
 *   <li>被当作空格的字距占一个字符，随该字符归属</li>
 * </ul>
 */
public class TextShowSlicer {

    private TextShowSlicer() {
    }

    /**
     * 截取段内 [start, end] 范围的数组项（两端的零宽字距包含在内）
     */
    public static COSArray slice(List<TjEntry> entries, int start, int end) {
        COSArray array = new COSArray();
        for (TjEntry entry : entries) {
            switch (entry.kind) {
                case TEXT:
                    byte[] bytes = codeBytes(entry, start, end);
                    if (bytes.length > 0) {
                        array.add(new COSString(bytes));
                    }
                    break;
                case KERN:
                    if (entry.addsSpace) {
                        if (entry.start >= start && entry.end <= end) {
                            array.add(entry.template);
                        }
                    } else if (entry.start >= start && entry.start <= end) {
                        array.add(entry.template);
                    }
                    break;
                default:
                    if (entry.start >= start && entry.start <= end) {
                        array.add(entry.template);
                    }
                    break;
            }
        }
        return array;
    }

    /**
     * 测量段内 [start, end) 的宽度（pt，未计水平缩放）
     *
     * 有字形宽度时按字形宽度与内部字距累加；字体不可用或宽度为 0 时退化为 字符数 × 字号 × 比例。
     */
    public static float measure(TextSegment segment, int start, int end, float fallbackRatio) {
        float size = segment.getFontSize();
        float glyphWidth = 0f;
        float kernWidth = 0f;
        for (TjEntry entry : segment.getEntries()) {
            if (entry.kind == TjEntry.Kind.TEXT) {
                int position = entry.start;
                for (GlyphCode code : entry.codes) {
                    if (position >= start && position < end) {
                        glyphWidth += code.width / 1000f * size;
                    }
                    position += code.unicode.length();
                }
            } else if (entry.kind == TjEntry.Kind.KERN) {
                boolean inside = entry.addsSpace
                        ? entry.start >= start && entry.end <= end
                        : entry.start > start && entry.start < end;
                if (inside) {
                    kernWidth += -entry.value / 1000f * size;
                }
            }
        }
        if (glyphWidth <= 0f) {
            return Math.max(0f, (end - start) * size * fallbackRatio + kernWidth);
        }
        return glyphWidth + kernWidth;
    }

    /**
     * 字距是否严格落在任一编辑区间内部
     */
    public static boolean insideAnyEdit(TjEntry kern, List<SegmentEdit> edits) {
        for (SegmentEdit edit : edits) {
            if (kern.addsSpace ? edit.contains(kern.start) : edit.strictlyInside(kern.start)) {
                return true;
            }
        }
        return false;
    }

    private static byte[] codeBytes(TjEntry entry, int start, int end) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        int position = entry.start;
        for (GlyphCode code : entry.codes) {
            if (position >= start && position < end) {
                out.write(code.bytes, 0, code.bytes.length);
            }
            position += code.unicode.length();
        }
        return out.toByteArray();
    }
}
