package com.jz.chatflow.client.impl;

import com.jz.chatflow.client.GenerationClient;
import com.jz.chatflow.client.GenerationRequest;
import com.jz.chatflow.domain.dto.ChatTurn;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class SpringAiGenerationClient implements GenerationClient {

    // 无记忆的 ChatClient，历史由我们自己拼
    private final ChatClient chatClient;

    @Override
    public String complete(GenerationRequest request) {
        String out = spec(request).call().content();
        return out == null ? "" : out.trim();
    }

    @Override
    public Flux<String> stream(GenerationRequest request) {
        return spec(request).stream().content();
    }

    private ChatClient.ChatClientRequestSpec spec(GenerationRequest request) {
        List<Message> history = new ArrayList<>(request.getHistory().size());
        for (ChatTurn t : request.getHistory()) {
            if (t.getText() == null || t.getText().isBlank()) continue;
            history.add(t.getRole() == ChatTurn.Role.ASSISTANT
                    ? new AssistantMessage(t.getText())
                    : new UserMessage(t.getText()));
        }
        log.debug("generation request: history={}, sysLen={}", history.size(),
                request.getSystemInstruction() == null ? 0 : request.getSystemInstruction().length());
        return chatClient.prompt()
                .system(request.getSystemInstruction())
                .messages(history)
                .user(request.getUserText());
    }
}
