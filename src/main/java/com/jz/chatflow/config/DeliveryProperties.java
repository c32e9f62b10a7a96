package com.jz.chatflow.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * WhatsApp 服务商发送接口。凭证（authToken/origin）按业务号码从 channel_binding 取，不在这里配。
 */
@Data
@ConfigurationProperties(prefix = "chatflow.delivery")
public class DeliveryProperties {
    private String baseUrl = "https://api.11za.in";
    private String sendPath = "/apis/sendMessage/sendMessages";
}
