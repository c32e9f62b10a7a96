package com.jz.chatflow.client.impl;

import com.jz.chatflow.client.EmbeddingClient;
import lombok.RequiredArgsConstructor;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.stereotype.Component;

/** DashScope text-embedding，通过 Spring AI 的 EmbeddingModel 调用 */
@Component
@RequiredArgsConstructor
public class SpringAiEmbeddingClient implements EmbeddingClient {

    private final EmbeddingModel embeddingModel;

    @Override
    public float[] embed(String text) {
        return embeddingModel.embed(text);
    }
}
