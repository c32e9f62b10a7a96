package com.jz.chatflow.chat.flow;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LexiconTest {

    @Test
    void shouldMatchWholeWordsAndPhrasesIgnoringCase() {
        Lexicon reject = Lexicon.wholeWords(List.of("no", "not interested"));

        assertThat(reject.matches("No thanks")).isTrue();
        assertThat(reject.matches("I am NOT   interested")).isTrue();
        assertThat(reject.matches("Nope")).isFalse();
        assertThat(reject.matches("I know the place")).isFalse();
    }

    @Test
    void shouldMatchSubstringsForSubstringLexicon() {
        Lexicon reset = Lexicon.substrings(List.of("Reset"));

        assertThat(reset.matches("pls RESET it")).isTrue();
        assertThat(reset.matches("resetting")).isTrue();
        assertThat(reset.matches("hello")).isFalse();
    }

    @Test
    void shouldIgnoreBlankEntriesAndBlankText() {
        Lexicon lex = Lexicon.wholeWords(java.util.Arrays.asList("  ", null, "later"));

        assertThat(lex.words()).containsExactly("later");
        assertThat(lex.matches("")).isFalse();
        assertThat(lex.matches(null)).isFalse();
    }
}
