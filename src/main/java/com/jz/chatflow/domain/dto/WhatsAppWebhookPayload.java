package com.jz.chatflow.domain.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Set;

/**
 * 服务商 webhook 原始报文（只取编排需要的字段，其余忽略）。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class WhatsAppWebhookPayload {

    private static final Set<String> VOICE_MEDIA = Set.of("voice", "audio");

    private String messageId;
    private String from;
    private String to;
    private String event;
    private String receivedAt;
    private Content content;
    private Whatsapp whatsapp;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Content {
        private String contentType;          // text / media
        private String text;
        private Media media;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Media {
        private String type;                 // voice / audio / image ...
        private String url;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Whatsapp {
        private String senderName;
    }

    public boolean hasIdentity() {
        return notBlank(messageId) && notBlank(from) && notBlank(to);
    }

    public InboundEvent toInboundEvent() {
        boolean voice = content != null
                && "media".equalsIgnoreCase(content.getContentType())
                && content.getMedia() != null
                && content.getMedia().getUrl() != null
                && content.getMedia().getType() != null
                && VOICE_MEDIA.contains(content.getMedia().getType().toLowerCase(Locale.ROOT));
        return InboundEvent.builder()
                .id(messageId.trim())
                .from(from.trim())
                .to(to.trim())
                .occurredAt(parseInstant(receivedAt))
                .kind(voice ? ContentKind.AUDIO : ContentKind.TEXT)
                .rawText(content == null ? null : content.getText())
                .mediaRef(voice ? content.getMedia().getUrl() : null)
                .senderDisplayName(whatsapp == null ? null : whatsapp.getSenderName())
                .eventKind(event)
                .build();
    }

    private static Instant parseInstant(String s) {
        if (!notBlank(s)) return Instant.now();
        try {
            return Instant.parse(s.trim());
        } catch (DateTimeParseException e) {
            return Instant.now();
        }
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
