package com.jz.chatflow.chat.flow;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 内置的字段匹配器。覆盖英文 + 罗马化印地语（Hinglish）的常见说法。
 */
public final class FieldMatchers {
    private FieldMatchers() {}

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final String MONTHS =
            "jan(?:uary)?|feb(?:ruary)?|mar(?:ch)?|apr(?:il)?|may|june?|july?|aug(?:ust)?"
                    + "|sep(?:t(?:ember)?)?|oct(?:ober)?|nov(?:ember)?|dec(?:ember)?";

    // 数字：不能是时间(5pm / 5:30 / 5 baje)、日期(12/5, 5th june, 5 june)的一部分
    private static final Pattern NUMBER = Pattern.compile(
            "(?<![\\d:/.])(?<!\\d-)(\\d{1,4})(?![\\d:/.])(?!-\\d)"
                    + "(?!\\s*(?:am|pm|baje|bje)\\b)"
                    + "(?!\\s*(?:st|nd|rd|th)\\b)"
                    + "(?!\\s*(?:" + MONTHS + ")\\b)", FLAGS);

    // 5pm / 5:30 pm / 5 baje / 17:30
    private static final Pattern TIME_12H = Pattern.compile(
            "(?<![\\d:])(\\d{1,2})(?::([0-5]\\d))?\\s*(am|pm)\\b", FLAGS);
    private static final Pattern TIME_BAJE = Pattern.compile(
            "(?<![\\d:])(\\d{1,2})\\s*(?:baje|bje)\\b", FLAGS);
    private static final Pattern TIME_24H = Pattern.compile(
            "(?<![\\d:])([01]?\\d|2[0-3]):([0-5]\\d)(?![\\d:])", FLAGS);

    private static final Pattern DATE_WORD = Pattern.compile(
            "(?<![\\p{L}])(day after tomorrow|today|tomorrow|tonight|aaj|kal|parso|parson"
                    + "|monday|tuesday|wednesday|thursday|friday|saturday|sunday"
                    + "|somvar|mangalvar|budhvar|guruvar|shukravar|shanivar|ravivar)(?![\\p{L}])", FLAGS);
    private static final Pattern DATE_NUMERIC = Pattern.compile(
            "(?<![\\d/])(\\d{1,2})[/-](\\d{1,2})(?:[/-](\\d{2,4}))?(?![\\d/])", FLAGS);
    private static final Pattern DATE_DAY_MONTH = Pattern.compile(
            "(?<!\\d)(\\d{1,2})(?:st|nd|rd|th)?\\s*(" + MONTHS + ")\\b", FLAGS);
    private static final Pattern DATE_MONTH_DAY = Pattern.compile(
            "\\b(" + MONTHS + ")\\s*(\\d{1,2})(?:st|nd|rd|th)?(?!\\d)", FLAGS);

    public static FieldMatcher of(FieldType type, String pattern) {
        return switch (type) {
            case NUMBER -> FieldMatchers::number;
            case TIME -> FieldMatchers::time;
            case DATE -> FieldMatchers::date;
            case FREE_TEXT -> FieldMatchers::freeText;
            case REGEX -> regex(pattern);
        };
    }

    public static Optional<String> number(String s) {
        if (s == null) return Optional.empty();
        Matcher m = NUMBER.matcher(s);
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }

    public static Optional<String> time(String s) {
        if (s == null) return Optional.empty();
        Matcher m = TIME_12H.matcher(s);
        if (m.find()) {
            String mm = m.group(2) == null ? "" : ":" + m.group(2);
            return Optional.of(m.group(1) + mm + m.group(3).toLowerCase());
        }
        m = TIME_24H.matcher(s);
        if (m.find()) return Optional.of(m.group(1) + ":" + m.group(2));
        m = TIME_BAJE.matcher(s);
        if (m.find()) return Optional.of(m.group(1) + " baje");
        return Optional.empty();
    }

    public static Optional<String> date(String s) {
        if (s == null) return Optional.empty();
        Matcher m = DATE_WORD.matcher(s);
        if (m.find()) return Optional.of(m.group(1).toLowerCase().replaceAll("\\s+", " "));
        m = DATE_NUMERIC.matcher(s);
        if (m.find()) return Optional.of(m.group().replace('-', '/'));
        m = DATE_DAY_MONTH.matcher(s);
        if (m.find()) return Optional.of(m.group(1) + " " + m.group(2).toLowerCase());
        m = DATE_MONTH_DAY.matcher(s);
        if (m.find()) return Optional.of(m.group(2) + " " + m.group(1).toLowerCase());
        return Optional.empty();
    }

    public static Optional<String> freeText(String s) {
        if (s == null || s.isBlank()) return Optional.empty();
        return Optional.of(s.trim());
    }

    /** 第一个捕获组（没有捕获组则整段匹配）作为取值 */
    public static FieldMatcher regex(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("REGEX field requires a pattern");
        }
        Pattern p = Pattern.compile(pattern, FLAGS);
        return s -> {
            if (s == null) return Optional.empty();
            Matcher m = p.matcher(s);
            if (!m.find()) return Optional.empty();
            String v = m.groupCount() >= 1 && m.group(1) != null ? m.group(1) : m.group();
            return v.isBlank() ? Optional.empty() : Optional.of(v.trim());
        };
    }
}
