package com.example.pdfrewrite.util.text;

import java.text.Normalizer;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 文本归一化工具类
 * 用于页面字形文本、内容流文本与映射原文之间的比对
 *
 * <h3>处理内容</h3>
 * <ul>
 *   <li>去除零宽标记字符（\u200B, \u200C, \u200D, \u2060-\u2063, \uFEFF）</li>
 *   <li>连字展开（\uFB01 → fi 等），引号、破折号、省略号转为 ASCII</li>
 *   <li>连续空白压缩为单个空格，并去除首尾空白</li>
 * </ul>
 *
 * 所有方法对任意输入（包括 null 和空串）都有定义，不抛异常。
 */
public class TextNormalizer {

    /**
     * 零宽标记字符，既用于清理文本，也是 {@link MarkerCodec} 的编码字母表
     */
    public static final char[] ZERO_WIDTH_MARKERS = {
            '\u200B',  // Zero Width Space
            '\u200C',  // Zero Width Non-Joiner
            '\u200D',  // Zero Width Joiner
            '\u2060',  // Word Joiner
            '\u2061',  // Function Application
            '\u2062',  // Invisible Times
            '\u2063',  // Invisible Separator
            '\uFEFF'   // Zero Width No-Break Space (BOM)
    };

    private static final Map<Character, String> TRANSLATIONS = new HashMap<>();

    static {
        // 连字
        TRANSLATIONS.put('\uFB01', "fi");
        TRANSLATIONS.put('\uFB02', "fl");
        TRANSLATIONS.put('\uFB00', "ff");
        TRANSLATIONS.put('\uFB03', "ffi");
        TRANSLATIONS.put('\uFB04', "ffl");
        TRANSLATIONS.put('\uFB05', "ft");
        TRANSLATIONS.put('\uFB06', "st");
        // 破折号 / 连字符
        TRANSLATIONS.put('\u2013', "-");
        TRANSLATIONS.put('\u2014', "-");
        TRANSLATIONS.put('\u2212', "-");
        TRANSLATIONS.put('\u2011', "-");
        TRANSLATIONS.put('\u2010', "-");
        // 引号
        TRANSLATIONS.put('\u201C', "\"");
        TRANSLATIONS.put('\u201D', "\"");
        TRANSLATIONS.put('\u201F', "\"");
        TRANSLATIONS.put('\u2019', "'");
        TRANSLATIONS.put('\u2018', "'");
        TRANSLATIONS.put('\u201B', "'");
        TRANSLATIONS.put('\u201A', ",");
        TRANSLATIONS.put('\u2026', "...");
        TRANSLATIONS.put('\u00A0', " ");
        // 重音符号单独出现时丢弃
        TRANSLATIONS.put('^', "");
        TRANSLATIONS.put('\u02C6', "");
    }

    private TextNormalizer() {
    }

    /**
     * 判断字符是否为零宽标记
     */
    public static boolean isZeroWidth(char ch) {
        for (char marker : ZERO_WIDTH_MARKERS) {
            if (marker == ch) {
                return true;
            }
        }
        return false;
    }

    /**
     * 去除零宽标记字符，其余内容原样保留
     *
     * @param text 原始文本
     * @return 去除零宽字符后的文本，null 返回空串
     */
    public static String stripZeroWidth(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (!isZeroWidth(ch)) {
                sb.append(ch);
            }
        }
        return sb.toString();
    }

    /**
     * 匹配用归一化（保留大小写）
     *
     * 示例：
     * 输入："  the \uFB01rst\u200B  \u201Cvalue\u201D "
     * 输出："the first \"value\""
     *
     * @param text 原始文本
     * @return 归一化后的文本
     */
    public static String normalizeForMatch(String text) {
        return buildNormalizedMap(text).getText();
    }

    /**
     * 比对用归一化：在 {@link #normalizeForMatch(String)} 基础上转小写
     */
    public static String normalizeForCompare(String text) {
        return normalizeForMatch(text).toLowerCase(Locale.ROOT);
    }

    /**
     * 归一化并记录每个归一化字符来源于原始文本的哪个下标
     *
     * 连字展开后的多个字符指向同一个原始下标；被去除的字符（零宽、多余空白）不出现在映射中。
     *
     * @param text 原始文本
     * @return 归一化文本与下标映射，两者长度相同
     */
    public static NormalizedText buildNormalizedMap(String text) {
        if (text == null || text.isEmpty()) {
            return NormalizedText.EMPTY;
        }

        StringBuilder chars = new StringBuilder(text.length());
        int[] indexMap = new int[text.length() * 3];
        int size = 0;
        boolean lastWasSpace = false;

        for (int i = 0; i < text.length(); i++) {
            char raw = text.charAt(i);
            if (isZeroWidth(raw)) {
                continue;
            }
            String translated = TRANSLATIONS.get(raw);
            if (translated == null) {
                translated = String.valueOf(raw);
            }
            for (int k = 0; k < translated.length(); k++) {
                char piece = translated.charAt(k);
                boolean space = isWhitespace(piece);
                if (space) {
                    if (lastWasSpace || size == 0) {
                        // 压缩连续空白，并去除前导空白
                        lastWasSpace = true;
                        continue;
                    }
                    piece = ' ';
                }
                lastWasSpace = space;
                if (size == indexMap.length) {
                    int[] grown = new int[indexMap.length * 2];
                    System.arraycopy(indexMap, 0, grown, 0, size);
                    indexMap = grown;
                }
                chars.append(piece);
                indexMap[size++] = i;
            }
        }

        // 去除尾部空白
        while (size > 0 && chars.charAt(size - 1) == ' ') {
            size--;
            chars.setLength(size);
        }
        if (size == 0) {
            return NormalizedText.EMPTY;
        }

        int[] trimmed = new int[size];
        System.arraycopy(indexMap, 0, trimmed, 0, size);
        return new NormalizedText(chars.toString(), trimmed);
    }

    /**
     * 去除重音符号（NFKD 分解后丢弃组合标记）
     *
     * 示例："caf\u00E9" → "cafe"
     */
    public static String foldAccents(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String decomposed = Normalizer.normalize(text, Normalizer.Form.NFKD);
        return decomposed.replaceAll("\\p{M}+", "");
    }

    /**
     * 紧凑比对键：比对归一化后只保留小写字母和数字
     *
     * 用于空白或标点漂移时的兜底匹配，例如 "index i" 与 "indexi" 的键相同
     */
    public static String compact(String text) {
        String normalized = normalizeForCompare(text);
        StringBuilder sb = new StringBuilder(normalized.length());
        for (int i = 0; i < normalized.length(); i++) {
            char ch = normalized.charAt(i);
            if ((ch >= '0' && ch <= '9') || (ch >= 'a' && ch <= 'z')) {
                sb.append(ch);
            }
        }
        return sb.toString();
    }

    /**
     * 校验用折叠：NFKD、去除所有空白、转小写
     *
     * 用于判断两段文本在连字和空白差异之外是否相同
     */
    public static String collapseForValidation(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String decomposed = Normalizer.normalize(stripZeroWidth(text), Normalizer.Form.NFKD);
        StringBuilder sb = new StringBuilder(decomposed.length());
        for (int i = 0; i < decomposed.length(); i++) {
            char ch = decomposed.charAt(i);
            if (!isWhitespace(ch)) {
                sb.append(Character.toLowerCase(ch));
            }
        }
        return sb.toString();
    }

    /**
     * 空白判断：包含不换行空格等 Unicode 空格字符
     */
    public static boolean isWhitespace(char ch) {
        return Character.isWhitespace(ch) || Character.isSpaceChar(ch);
    }

    /**
     * 截断文本用于日志输出
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "...";
    }
}
