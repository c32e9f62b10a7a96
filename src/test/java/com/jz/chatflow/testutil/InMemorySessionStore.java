package com.jz.chatflow.testutil;

import com.jz.chatflow.domain.entity.ConversationSession;
import com.jz.chatflow.service.SessionStore;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/** 存取都做拷贝，模拟落库后对象不共享 */
public class InMemorySessionStore implements SessionStore {

    private final Map<String, ConversationSession> sessions = new ConcurrentHashMap<>();
    public final AtomicInteger saveCount = new AtomicInteger();
    private volatile boolean failUpserts;

    public void failUpserts(boolean fail) {
        this.failUpserts = fail;
    }

    @Override
    public Optional<ConversationSession> find(String conversationKey) {
        ConversationSession s = sessions.get(conversationKey);
        return s == null ? Optional.empty() : Optional.of(s.copy());
    }

    @Override
    public void upsert(ConversationSession session) {
        if (failUpserts) throw new IllegalStateException("simulated session store failure");
        saveCount.incrementAndGet();
        sessions.put(session.getConversationKey(), session.copy());
    }

    public ConversationSession get(String conversationKey) {
        return sessions.get(conversationKey);
    }
}
