package com.jz.chatflow.client;

import lombok.Value;

@Value
public class DeliveryCredentials {
    String authToken;
    String origin;

    @Override
    public String toString() {
        // 不把 token 打进日志
        return "DeliveryCredentials(origin=" + origin + ")";
    }
}
