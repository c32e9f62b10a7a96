package com.jz.chatflow.service;

import com.jz.chatflow.domain.entity.ConversationSession;

import java.util.Optional;

public interface SessionStore {

    Optional<ConversationSession> find(String conversationKey);

    /** 没有就返回一个初始会话（第一次 upsert 时才真正落库） */
    default ConversationSession loadOrCreate(String conversationKey) {
        return find(conversationKey).orElseGet(() -> ConversationSession.fresh(conversationKey));
    }

    /** 按 conversationKey upsert */
    void upsert(ConversationSession session);
}
