package com.jz.chatflow.testutil;

import com.jz.chatflow.domain.dto.ChatTurn;
import com.jz.chatflow.domain.dto.InboundEvent;
import com.jz.chatflow.domain.entity.MessageDirection;
import com.jz.chatflow.service.EventStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 内存版消息流水：putIfAbsent 模拟 message_id 唯一键。
 */
public class InMemoryEventStore implements EventStore {

    public static final class Row {
        public final String messageId;
        public final String conversationKey;
        public final MessageDirection direction;
        public volatile String text;
        public volatile boolean responded;

        Row(String messageId, String conversationKey, MessageDirection direction, String text) {
            this.messageId = messageId;
            this.conversationKey = conversationKey;
            this.direction = direction;
            this.text = text;
        }
    }

    private final Map<String, Row> byId = new ConcurrentHashMap<>();
    private final List<Row> ordered = new CopyOnWriteArrayList<>();
    private volatile boolean failOutbound;
    private int outboundSeq;

    public void failOutboundInserts(boolean fail) {
        this.failOutbound = fail;
    }

    @Override
    public boolean recordInbound(InboundEvent event) {
        Row row = new Row(event.getId(), event.conversationKey(), MessageDirection.INBOUND,
                event.getRawText() == null || event.getRawText().isBlank() ? null : event.getRawText().trim());
        if (byId.putIfAbsent(event.getId(), row) != null) return false;
        ordered.add(row);
        return true;
    }

    @Override
    public void fillTranscript(String messageId, String text) {
        Row r = byId.get(messageId);
        if (r != null && (r.text == null || r.text.isEmpty())) r.text = text;
    }

    @Override
    public synchronized String recordOutbound(String conversationKey, String inboundMessageId, String text) {
        if (failOutbound) throw new IllegalStateException("simulated outbound insert failure");
        String id = "auto_" + inboundMessageId + "_" + (++outboundSeq);
        Row row = new Row(id, conversationKey, MessageDirection.OUTBOUND, text);
        byId.put(id, row);
        ordered.add(row);
        return id;
    }

    @Override
    public void markResponded(String messageId) {
        Row r = byId.get(messageId);
        if (r != null) r.responded = true;
    }

    @Override
    public List<ChatTurn> recentHistory(String conversationKey, String excludeMessageId, int limit) {
        List<ChatTurn> all = new ArrayList<>();
        for (Row r : ordered) {
            if (!r.conversationKey.equals(conversationKey)) continue;
            if (r.messageId.equals(excludeMessageId)) continue;
            if (r.text == null || r.text.isEmpty()) continue;
            all.add(r.direction == MessageDirection.OUTBOUND ? ChatTurn.assistant(r.text) : ChatTurn.user(r.text));
        }
        return all.size() <= limit ? all : all.subList(all.size() - limit, all.size());
    }

    @Override
    public boolean hasDeliveredReply(String conversationKey) {
        return ordered.stream().anyMatch(r -> r.conversationKey.equals(conversationKey)
                && (r.direction == MessageDirection.OUTBOUND || r.responded));
    }

    @Override
    public boolean isResponded(String messageId) {
        Row r = byId.get(messageId);
        return r != null && r.responded;
    }

    public Row row(String messageId) {
        return byId.get(messageId);
    }

    public long count(MessageDirection direction) {
        return ordered.stream().filter(r -> r.direction == direction).count();
    }

    public List<String> outboundTexts(String conversationKey) {
        return ordered.stream()
                .filter(r -> r.conversationKey.equals(conversationKey) && r.direction == MessageDirection.OUTBOUND)
                .map(r -> r.text)
                .toList();
    }
}
