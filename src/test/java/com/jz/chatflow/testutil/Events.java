package com.jz.chatflow.testutil;

import com.jz.chatflow.domain.dto.ContentKind;
import com.jz.chatflow.domain.dto.InboundEvent;

import java.time.Instant;

public final class Events {
    private Events() {}

    public static final String USER = "+91 98765 43210";
    public static final String BUSINESS = "911140000000";
    public static final String KEY = "wa:919876543210:911140000000";

    public static InboundEvent text(String id, String text) {
        return text(id, text, "Rahul");
    }

    public static InboundEvent text(String id, String text, String senderName) {
        return InboundEvent.builder()
                .id(id)
                .from(USER)
                .to(BUSINESS)
                .occurredAt(Instant.now())
                .kind(ContentKind.TEXT)
                .rawText(text)
                .senderDisplayName(senderName)
                .eventKind(InboundEvent.USER_MESSAGE_EVENT)
                .build();
    }

    public static InboundEvent voice(String id, String mediaUrl) {
        return InboundEvent.builder()
                .id(id)
                .from(USER)
                .to(BUSINESS)
                .occurredAt(Instant.now())
                .kind(ContentKind.AUDIO)
                .mediaRef(mediaUrl)
                .senderDisplayName("Rahul")
                .eventKind(InboundEvent.USER_MESSAGE_EVENT)
                .build();
    }

    public static InboundEvent receipt(String id) {
        return InboundEvent.builder()
                .id(id)
                .from(USER)
                .to(BUSINESS)
                .occurredAt(Instant.now())
                .kind(ContentKind.TEXT)
                .eventKind("DeliveryReport")
                .build();
    }
}
