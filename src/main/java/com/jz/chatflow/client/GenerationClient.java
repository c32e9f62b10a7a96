package com.jz.chatflow.client;

import reactor.core.publisher.Flux;

public interface GenerationClient {

    /** 一次性生成完整回复 */
    String complete(GenerationRequest request);

    /** 流式：按顺序吐出片段 */
    Flux<String> stream(GenerationRequest request);
}
