package com.jz.chatflow.controller;

import com.jz.chatflow.chat.dispatch.DispatchPolicy;
import com.jz.chatflow.domain.dto.ChatStreamRequest;
import com.jz.chatflow.domain.dto.ChatTurn;
import com.jz.chatflow.rag.ConversationContext;
import com.jz.chatflow.rag.RetrievalAssembler;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.codec.ServerSentEvent;
import reactor.core.publisher.Flux;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChatStreamControllerTest {

    @Mock
    private RetrievalAssembler assembler;
    @Mock
    private DispatchPolicy dispatchPolicy;

    @Test
    void shouldStreamPartsAndFinishWithDoneMarker() {
        ChatStreamRequest req = new ChatStreamRequest();
        req.setSessionId("browser-1");
        req.setMessage("  VR timing?  ");
        req.setBusinessNumber("+91 11 4000 0000");
        ConversationContext ctx = ConversationContext.bare("web:browser1:911140000000", "VR timing?");
        when(assembler.assembleWithHistory("VR timing?", "911140000000", "web:browser1:911140000000", List.of()))
                .thenReturn(ctx);
        when(dispatchPolicy.stream(ctx)).thenReturn(Flux.just("Open ", "11am to 10pm."));

        List<String> parts = new ChatStreamController(assembler, dispatchPolicy).stream(req)
                .map(ServerSentEvent::data)
                .collectList()
                .block();

        assertThat(parts).containsExactly("Open ", "11am to 10pm.", ChatStreamController.DONE);
        verify(assembler).assembleWithHistory("VR timing?", "911140000000", "web:browser1:911140000000", List.of());
    }

    @Test
    void shouldUseAnonymousWebSessionWhenNoneGiven() {
        ChatStreamRequest req = new ChatStreamRequest();
        req.setMessage("hello");
        req.setBusinessNumber("911140000000");
        ConversationContext ctx = ConversationContext.bare("web:anonymous:911140000000", "hello");
        when(assembler.assembleWithHistory("hello", "911140000000", "web:anonymous:911140000000", List.of()))
                .thenReturn(ctx);
        when(dispatchPolicy.stream(ctx)).thenReturn(Flux.empty());

        List<String> parts = new ChatStreamController(assembler, dispatchPolicy).stream(req)
                .map(ServerSentEvent::data)
                .collectList()
                .block();

        assertThat(parts).containsExactly(ChatStreamController.DONE);
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldKeepWebSessionOutOfWhatsAppNamespaceAndPassClientHistory() {
        ChatStreamRequest req = new ChatStreamRequest();
        // 网页 sessionId 恰好是某个 WhatsApp 用户的号码
        req.setSessionId("919876543210");
        req.setMessage("aur price?");
        req.setBusinessNumber("911140000000");
        req.setHistory(List.of(turn("user", "VR timing?"), turn("assistant", "11am to 10pm.")));
        ConversationContext ctx = ConversationContext.bare("web:919876543210:911140000000", "aur price?");
        when(assembler.assembleWithHistory(eq("aur price?"), eq("911140000000"),
                eq("web:919876543210:911140000000"), anyList())).thenReturn(ctx);
        when(dispatchPolicy.stream(ctx)).thenReturn(Flux.just("500 per head."));

        new ChatStreamController(assembler, dispatchPolicy).stream(req).collectList().block();

        ArgumentCaptor<List<ChatTurn>> history = ArgumentCaptor.forClass(List.class);
        verify(assembler).assembleWithHistory(eq("aur price?"), eq("911140000000"),
                eq("web:919876543210:911140000000"), history.capture());
        assertThat(history.getValue()).containsExactly(
                ChatTurn.user("VR timing?"), ChatTurn.assistant("11am to 10pm."));
    }

    @Test
    void shouldRejectRequestWithoutMessage() {
        ChatStreamRequest req = new ChatStreamRequest();
        req.setBusinessNumber("911140000000");

        assertThatThrownBy(() -> new ChatStreamController(assembler, dispatchPolicy).stream(req))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(assembler, dispatchPolicy);
    }

    private static ChatStreamRequest.Turn turn(String role, String content) {
        ChatStreamRequest.Turn t = new ChatStreamRequest.Turn();
        t.setRole(role);
        t.setContent(content);
        return t;
    }
}
