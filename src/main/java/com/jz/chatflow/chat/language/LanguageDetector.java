package com.jz.chatflow.chat.language;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 启发式语种判断：先看文字系统，再看罗马化印地语的常见词。
 */
@Component
public class LanguageDetector {

    private static final Pattern DEVANAGARI = Pattern.compile("[\\u0900-\\u097F]");
    private static final Pattern GUJARATI = Pattern.compile("[\\u0A80-\\u0AFF]");
    private static final Pattern TOKEN = Pattern.compile("[^\\p{L}]+");

    private static final Set<String> HINGLISH_MARKERS = Set.of(
            "hai", "hain", "ho", "nahi", "nahin", "chahiye", "kya", "kyu", "kyun", "aap", "tum",
            "mujhe", "mera", "meri", "hum", "log", "kal", "aaj", "parso", "kitna", "kitne",
            "kaise", "kab", "kaha", "kahan", "batao", "bataiye", "karna", "karo", "krna",
            "accha", "acha", "theek", "thik", "haan", "ji", "bhai", "yaar", "abhi", "wala", "wali",
            "baje", "hoga", "hogi", "sakte", "milega", "dijiye", "chalega");

    public ReplyLanguage detect(String text) {
        if (text == null || text.isBlank()) return ReplyLanguage.HINGLISH;
        if (GUJARATI.matcher(text).find()) return ReplyLanguage.GUJARATI;
        if (DEVANAGARI.matcher(text).find()) return ReplyLanguage.HINDI;

        int hits = 0;
        for (String tok : TOKEN.split(text.toLowerCase(Locale.ROOT))) {
            if (HINGLISH_MARKERS.contains(tok)) hits++;
        }
        return hits > 0 ? ReplyLanguage.HINGLISH : ReplyLanguage.ENGLISH;
    }

    /** 转写给出的语言提示优先；罗马化文本被标成 hi 时按 Hinglish 处理 */
    public ReplyLanguage detect(String text, String languageHint) {
        return ReplyLanguage.fromHint(languageHint)
                .map(hinted -> hinted == ReplyLanguage.HINDI && text != null
                        && !DEVANAGARI.matcher(text).find() ? ReplyLanguage.HINGLISH : hinted)
                .orElseGet(() -> detect(text));
    }
}
