package com.jz.chatflow.utils;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConversationKeysTest {

    @Test
    void shouldNormalizeBothNumbersIntoKey() {
        assertThat(ConversationKeys.of("+91 98765-43210", "+911140000000"))
                .isEqualTo("wa:919876543210:911140000000");
    }

    @Test
    void shouldGiveSameKeyForDifferentlyFormattedSender() {
        assertThat(ConversationKeys.of("919876543210", "911140000000"))
                .isEqualTo(ConversationKeys.of("+91 98765 43210", "911140000000"));
    }

    @Test
    void shouldParseUserAndBusiness() {
        String key = "wa:919876543210:911140000000";

        assertThat(ConversationKeys.parseUser(key)).isEqualTo("919876543210");
        assertThat(ConversationKeys.parseBusiness(key)).isEqualTo("911140000000");
    }

    @Test
    void shouldReturnNullForMalformedKeys() {
        assertThat(ConversationKeys.parseUser("919876543210:911140000000")).isNull();
        assertThat(ConversationKeys.parseBusiness("wa:919876543210")).isNull();
        assertThat(ConversationKeys.parseBusiness("wa::911140000000")).isNull();
        assertThat(ConversationKeys.parseUser(null)).isNull();
    }

    @Test
    void shouldKeepWebKeysApartFromWhatsAppKeys() {
        String web = ConversationKeys.web("919876543210", "+91 11 4000 0000");

        assertThat(web).isEqualTo("web:919876543210:911140000000");
        assertThat(web).isNotEqualTo(ConversationKeys.of("919876543210", "911140000000"));
        assertThat(ConversationKeys.parseUser(web)).isNull();
    }

    @Test
    void shouldRejectMissingNumbers() {
        assertThatThrownBy(() -> ConversationKeys.of(null, "911140000000"))
                .isInstanceOf(NullPointerException.class);
    }
}
