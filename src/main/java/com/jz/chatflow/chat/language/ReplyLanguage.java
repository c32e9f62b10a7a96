package com.jz.chatflow.chat.language;

import java.util.Locale;
import java.util.Optional;

/**
 * 回复语言 + 该语言下的兜底话术（模型失败/超时/无资料时用）。
 */
public enum ReplyLanguage {
    HINGLISH("Hinglish (Hindi written in Roman letters)",
            "Is topic pe abhi exact info available nahi hai 😊 Aap kuch aur pooch sakte ho."),
    HINDI("Hindi",
            "Is vishay par abhi jaankari uplabdh nahi hai 😊"),
    ENGLISH("English",
            "I don’t have the right information on this yet 😊"),
    GUJARATI("Gujarati",
            "આ વિષય પર હાલમાં ચોક્કસ માહિતી ઉપલબ્ધ નથી 😊");

    private final String promptLabel;
    private final String fallbackText;

    ReplyLanguage(String promptLabel, String fallbackText) {
        this.promptLabel = promptLabel;
        this.fallbackText = fallbackText;
    }

    public String promptLabel() {
        return promptLabel;
    }

    public String fallbackText() {
        return fallbackText;
    }

    /** 转写接口返回的语言提示（"hi" / "hindi" / "gu" / "en" ...） */
    public static Optional<ReplyLanguage> fromHint(String hint) {
        if (hint == null || hint.isBlank()) return Optional.empty();
        String h = hint.trim().toLowerCase(Locale.ROOT);
        return switch (h) {
            case "hi", "hin", "hindi" -> Optional.of(HINDI);
            case "gu", "guj", "gujarati" -> Optional.of(GUJARATI);
            case "en", "eng", "english" -> Optional.of(ENGLISH);
            case "hinglish" -> Optional.of(HINGLISH);
            default -> Optional.empty();
        };
    }
}
