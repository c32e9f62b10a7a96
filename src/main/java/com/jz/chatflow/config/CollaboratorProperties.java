package com.jz.chatflow.config;

import com.jz.chatflow.client.Collaborator;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 外部协作方的超时（必须有上限）。
 */
@Data
@ConfigurationProperties(prefix = "chatflow.collaborators")
public class CollaboratorProperties {
    private Duration transcriptionTimeout = Duration.ofSeconds(45);
    private Duration embeddingTimeout = Duration.ofSeconds(5);
    private Duration knowledgeIndexTimeout = Duration.ofSeconds(5);
    private Duration generationTimeout = Duration.ofSeconds(25);
    private Duration deliveryTimeout = Duration.ofSeconds(10);

    public Duration timeoutOf(Collaborator c) {
        return switch (c) {
            case TRANSCRIPTION -> transcriptionTimeout;
            case EMBEDDING -> embeddingTimeout;
            case KNOWLEDGE_INDEX -> knowledgeIndexTimeout;
            case GENERATION -> generationTimeout;
            case DELIVERY -> deliveryTimeout;
        };
    }
}
