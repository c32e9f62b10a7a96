package com.jz.chatflow.utils;

import java.util.Optional;

public final class TextSanitizer {
    private TextSanitizer() {}

    private static final int MAX_NAME_CHARS = 40;

    /** 日志里只打前 max 个字符，null 返回 "" */
    public static String preview(String s, int max) {
        if (s == null || max <= 0) return "";
        String flat = s.replaceAll("\\s+", " ").trim();
        return flat.length() <= max ? flat : flat.substring(0, max) + "…";
    }

    public static String preview(String s) {
        return preview(s, 60);
    }

    /**
     * 发送者昵称清洗：只保留字母(含组合附标)/数字/空白，压缩空白。清洗后为空则没有可用名字。
     * 例："~Rahul 🔥 K." → "Rahul K"
     */
    public static Optional<String> cleanDisplayName(String raw) {
        if (raw == null) return Optional.empty();
        String cleaned = raw.replaceAll("[\\x{FE0E}\\x{FE0F}\\x{200C}\\x{200D}]", "")
                .replaceAll("[^\\p{L}\\p{M}\\p{Nd}\\s]", "")
                .replaceAll("\\s+", " ")
                .trim();
        if (cleaned.isEmpty()) return Optional.empty();
        if (cleaned.length() > MAX_NAME_CHARS) {
            cleaned = cleaned.substring(0, MAX_NAME_CHARS).trim();
        }
        return Optional.of(cleaned);
    }
}
