package com.jz.chatflow.client.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.jz.chatflow.client.Collaborator;
import com.jz.chatflow.client.DeliveryClient;
import com.jz.chatflow.client.DeliveryCredentials;
import com.jz.chatflow.config.DeliveryProperties;
import com.jz.chatflow.exception.CollaboratorException;
import com.jz.chatflow.utils.TextSanitizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 11za 风格的 WhatsApp 发送接口：按业务号码的 authToken + origin 发文本。
 */
@Slf4j
@Component
public class WhatsAppDeliveryClient implements DeliveryClient {

    private final RestClient http;
    private final DeliveryProperties props;

    public WhatsAppDeliveryClient(RestClient.Builder builder, DeliveryProperties props) {
        this.http = builder.baseUrl(props.getBaseUrl()).build();
        this.props = props;
    }

    @Override
    public void send(String destination, String text, DeliveryCredentials credentials) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("sendto", destination);
        body.put("authToken", credentials.getAuthToken());
        body.put("originWebsite", credentials.getOrigin());
        body.put("contentType", "text");
        body.put("text", text);

        try {
            JsonNode resp = http.post()
                    .uri(props.getSendPath())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);
            // 有的服务商 200 里带 status=false
            if (resp != null && resp.has("status") && resp.get("status").isBoolean() && !resp.get("status").asBoolean()) {
                throw new CollaboratorException(Collaborator.DELIVERY,
                        "provider rejected message: " + TextSanitizer.preview(resp.toString(), 200), null);
            }
            log.info("delivered to={}, chars={}, via={}", destination, text.length(), credentials);
        } catch (RestClientResponseException e) {
            throw new CollaboratorException(Collaborator.DELIVERY,
                    "HTTP " + e.getStatusCode().value() + " " + TextSanitizer.preview(e.getResponseBodyAsString(), 200), e);
        }
    }
}
