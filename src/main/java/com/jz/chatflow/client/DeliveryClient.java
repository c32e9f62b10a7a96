package com.jz.chatflow.client;

public interface DeliveryClient {
    /** 发送一条文本；服务商拒收或网络失败时抛 CollaboratorException */
    void send(String destination, String text, DeliveryCredentials credentials);
}
