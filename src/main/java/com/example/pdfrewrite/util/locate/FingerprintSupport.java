package com.example.pdfrewrite.util.locate;

import com.example.pdfrewrite.util.text.MarkerCodec;
import com.example.pdfrewrite.util.text.TextNormalizer;

/**
 * 前后缀指纹工具
 *
 * 指纹比较前先做比对归一化并去除空白：提取出的页面文本常缺少词间空格，而题干文本带空格。
 */
public class FingerprintSupport {

    private FingerprintSupport() {
    }

    /**
     * 指纹键：sha1(prefix|original|suffix|occurrence)
     */
    public static String fingerprintKey(String prefix, String original, String suffix, int occurrence) {
        String raw = nullToEmpty(prefix) + "|" + nullToEmpty(original) + "|" + nullToEmpty(suffix) + "|" + occurrence;
        return MarkerCodec.sha1Hex(raw);
    }

    /**
     * 判断一处出现的实际前后缀是否与期望一致
     *
     * 只检查非空的期望值：前缀比较两者重叠长度的尾部，后缀比较重叠长度的头部。
     */
    public static boolean matches(String actualPrefix, String actualSuffix,
                                  String expectedPrefix, String expectedSuffix) {
        String expPrefix = key(expectedPrefix);
        String expSuffix = key(expectedSuffix);
        if (!expPrefix.isEmpty()) {
            String actual = key(actualPrefix);
            int n = Math.min(actual.length(), expPrefix.length());
            if (!actual.substring(actual.length() - n).equals(expPrefix.substring(expPrefix.length() - n))) {
                return false;
            }
        }
        if (!expSuffix.isEmpty()) {
            String actual = key(actualSuffix);
            int n = Math.min(actual.length(), expSuffix.length());
            if (!actual.substring(0, n).equals(expSuffix.substring(0, n))) {
                return false;
            }
        }
        return true;
    }

    /**
     * 上下文吻合程度：实际前缀与期望前缀的公共尾部长度 + 实际后缀与期望后缀的公共头部长度（忽略空白）
     */
    public static int contextScore(String actualPrefix, String actualSuffix,
                                   String expectedPrefix, String expectedSuffix) {
        String ap = key(actualPrefix);
        String ep = key(expectedPrefix);
        int score = 0;
        while (score < ap.length() && score < ep.length()
                && ap.charAt(ap.length() - 1 - score) == ep.charAt(ep.length() - 1 - score)) {
            score++;
        }
        String as = key(actualSuffix);
        String es = key(expectedSuffix);
        int head = 0;
        while (head < as.length() && head < es.length() && as.charAt(head) == es.charAt(head)) {
            head++;
        }
        return score + head;
    }

    static String key(String value) {
        String normalized = TextNormalizer.normalizeForCompare(value);
        StringBuilder sb = new StringBuilder(normalized.length());
        for (int i = 0; i < normalized.length(); i++) {
            char ch = normalized.charAt(i);
            if (ch != ' ') {
                sb.append(ch);
            }
        }
        return sb.toString();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
