package com.jz.chatflow.client;

public interface EmbeddingClient {
    float[] embed(String text);
}
