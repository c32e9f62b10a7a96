package com.jz.chatflow.controller;

import com.jz.chatflow.chat.dispatch.DispatchPolicy;
import com.jz.chatflow.domain.dto.ChatStreamRequest;
import com.jz.chatflow.domain.dto.ChatTurn;
import com.jz.chatflow.rag.ConversationContext;
import com.jz.chatflow.rag.RetrievalAssembler;
import com.jz.chatflow.utils.ConversationKeys;
import com.jz.chatflow.utils.TextSanitizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.Objects;

/**
 * 网页端流式问答：检索 + 同一套回复规则，不推进会话状态，也不落库。
 * 会话键在 web: 命名空间下，历史由前端随请求带上。
 */
@Slf4j
@RestController
@RequestMapping("api/chat")
@RequiredArgsConstructor
public class ChatStreamController {

    static final String DONE = "[DONE]";

    private final RetrievalAssembler retrievalAssembler;
    private final DispatchPolicy dispatchPolicy;

    @PostMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<String>> stream(@RequestBody ChatStreamRequest req) {
        if (req == null || req.getMessage() == null || req.getMessage().isBlank()
                || req.getBusinessNumber() == null || req.getBusinessNumber().isBlank()) {
            throw new IllegalArgumentException("message and businessNumber are required");
        }
        String session = req.getSessionId() == null || req.getSessionId().isBlank() ? "anonymous" : req.getSessionId();
        String business = ConversationKeys.normalize(req.getBusinessNumber());
        String key = ConversationKeys.web(session, business);
        String text = req.getMessage().trim();
        List<ChatTurn> history = req.getHistory() == null ? List.of()
                : req.getHistory().stream().filter(Objects::nonNull).map(ChatStreamRequest.Turn::toChatTurn).toList();
        log.info("web stream key={}, q={}, history={}", key, TextSanitizer.preview(text, 40), history.size());

        ConversationContext ctx = retrievalAssembler.assembleWithHistory(text, business, key, history);
        return dispatchPolicy.stream(ctx)
                .map(part -> ServerSentEvent.builder(part).build())
                .concatWith(Flux.just(ServerSentEvent.builder(DONE).build()));
    }
}
