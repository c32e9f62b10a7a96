package com.jz.chatflow.chat.flow;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 关键词表。两种匹配方式：整词/短语（拒绝词、话题词）和子串（重置词）。
 */
public final class Lexicon {

    private final List<String> words;
    private final Pattern wholeWord;   // null = 子串模式

    private Lexicon(List<String> words, boolean wholeWordMode) {
        this.words = words.stream()
                .filter(Objects::nonNull)
                .map(w -> w.trim().toLowerCase(Locale.ROOT))
                .filter(w -> !w.isEmpty())
                .distinct()
                .toList();
        this.wholeWord = wholeWordMode && !this.words.isEmpty() ? compile(this.words) : null;
    }

    public static Lexicon wholeWords(List<String> words) {
        return new Lexicon(words == null ? List.of() : words, true);
    }

    public static Lexicon substrings(List<String> words) {
        return new Lexicon(words == null ? List.of() : words, false);
    }

    public boolean matches(String text) {
        if (text == null || text.isBlank() || words.isEmpty()) return false;
        if (wholeWord != null) return wholeWord.matcher(text).find();
        String s = text.toLowerCase(Locale.ROOT);
        for (String w : words) if (s.contains(w)) return true;
        return false;
    }

    public List<String> words() {
        return words;
    }

    private static Pattern compile(List<String> words) {
        // 长短语优先；短语内部的空白放宽成 \s+
        String alt = words.stream()
                .sorted((a, b) -> Integer.compare(b.length(), a.length()))
                .map(w -> Pattern.quote(w).replaceAll("\\s+", "\\\\E\\\\s+\\\\Q"))
                .collect(Collectors.joining("|"));
        return Pattern.compile("(?<![\\p{L}\\p{N}])(?:" + alt + ")(?![\\p{L}\\p{N}])",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }
}
