package com.example.pdfrewrite.util.text;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * 零宽标记编解码
 *
 * 将上下文字符串（如 "run:structured:q1:0:0"）经 SHA-1 摘要后映射为 6 个零宽字符，
 * 追加在映射键值之后以携带来源信息。标记只可检测、不可解析：解码即去除零宽字符。
 */
public class MarkerCodec {

    public static final int MARKER_LENGTH = 6;

    private MarkerCodec() {
    }

    /**
     * 生成上下文对应的零宽标记
     *
     * @param context 上下文字符串
     * @return 6 个零宽字符组成的标记
     */
    public static String encodeMarker(String context) {
        byte[] digest = sha1(context == null ? "" : context);
        char[] alphabet = TextNormalizer.ZERO_WIDTH_MARKERS;
        StringBuilder sb = new StringBuilder(MARKER_LENGTH);
        for (int i = 0; i < MARKER_LENGTH; i++) {
            sb.append(alphabet[(digest[i] & 0xff) % alphabet.length]);
        }
        return sb.toString();
    }

    /**
     * 给文本追加标记
     */
    public static String mark(String text, String context) {
        return (text == null ? "" : text) + encodeMarker(context);
    }

    /**
     * 判断文本是否以零宽标记结尾
     */
    public static boolean hasMarker(String text) {
        if (text == null || text.length() < MARKER_LENGTH) {
            return false;
        }
        for (int i = text.length() - MARKER_LENGTH; i < text.length(); i++) {
            if (!TextNormalizer.isZeroWidth(text.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * 去除标记（即去除全部零宽字符）
     */
    public static String strip(String text) {
        return TextNormalizer.stripZeroWidth(text);
    }

    /**
     * SHA-1 十六进制摘要
     */
    public static String sha1Hex(String value) {
        byte[] digest = sha1(value == null ? "" : value);
        StringBuilder sb = new StringBuilder(digest.length * 2);
        for (byte b : digest) {
            sb.append(String.format("%02x", b & 0xff));
        }
        return sb.toString();
    }

    private static byte[] sha1(String value) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-1");
            return md.digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("JVM 不支持 SHA-1", e);
        }
    }
}
