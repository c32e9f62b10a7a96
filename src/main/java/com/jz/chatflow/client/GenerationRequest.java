package com.jz.chatflow.client;

import com.jz.chatflow.domain.dto.ChatTurn;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class GenerationRequest {
    String systemInstruction;
    @Builder.Default
    List<ChatTurn> history = List.of();
    String userText;
}
