package com.jz.chatflow.domain.dto;

import com.jz.chatflow.client.DeliveryCredentials;
import com.jz.chatflow.exception.ConfigurationMissingException;
import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * 一个业务号码聚合后的渠道配置：知识范围 + 渠道提示词 + 发送凭证。
 */
@Value
@Builder
public class ChannelProfile {
    String businessNumber;
    @Builder.Default
    Set<String> knowledgeScope = Set.of();
    String systemPrompt;
    String intent;
    String authToken;
    String origin;

    public static ChannelProfile empty(String businessNumber) {
        return ChannelProfile.builder().businessNumber(businessNumber).build();
    }

    public boolean hasCredentials() {
        return authToken != null && !authToken.isBlank() && origin != null && !origin.isBlank();
    }

    public DeliveryCredentials requireCredentials() {
        if (!hasCredentials()) {
            throw new ConfigurationMissingException(businessNumber, "WhatsApp delivery credentials");
        }
        return new DeliveryCredentials(authToken, origin);
    }
}
