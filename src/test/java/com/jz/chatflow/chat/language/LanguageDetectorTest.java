package com.jz.chatflow.chat.language;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LanguageDetectorTest {

    private final LanguageDetector detector = new LanguageDetector();

    @Test
    void shouldDetectHinglishFromRomanHindiMarkers() {
        assertThat(detector.detect("VR chahiye kal")).isEqualTo(ReplyLanguage.HINGLISH);
    }

    @Test
    void shouldDetectEnglishWithoutMarkers() {
        assertThat(detector.detect("What are your timings?")).isEqualTo(ReplyLanguage.ENGLISH);
    }

    @Test
    void shouldDetectScripts() {
        assertThat(detector.detect("मुझे जानकारी चाहिए")).isEqualTo(ReplyLanguage.HINDI);
        assertThat(detector.detect("મને માહિતી જોઈએ")).isEqualTo(ReplyLanguage.GUJARATI);
    }

    @Test
    void shouldPreferTranscriptionHint() {
        assertThat(detector.detect("anything", "gujarati")).isEqualTo(ReplyLanguage.GUJARATI);
        assertThat(detector.detect("What are your timings?", "unknown")).isEqualTo(ReplyLanguage.ENGLISH);
    }

    @Test
    void shouldTreatRomanTextHintedAsHindiAsHinglish() {
        assertThat(detector.detect("kya timing hai", "hi")).isEqualTo(ReplyLanguage.HINGLISH);
        assertThat(detector.detect("क्या टाइमिंग है", "hindi")).isEqualTo(ReplyLanguage.HINDI);
    }

    @Test
    void shouldHaveNonEmptyFallbackForEveryLanguage() {
        for (ReplyLanguage l : ReplyLanguage.values()) {
            assertThat(l.fallbackText()).isNotBlank();
        }
    }
}
