package com.jz.chatflow.service.impl;


import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.jz.chatflow.chat.log.ChatSequencer;
import com.jz.chatflow.domain.dto.ChatTurn;
import com.jz.chatflow.domain.dto.InboundEvent;
import com.jz.chatflow.domain.entity.ChatMessage;
import com.jz.chatflow.domain.entity.MessageDirection;
import com.jz.chatflow.mapper.ChatMessageMapper;
import com.jz.chatflow.service.EventStore;
import com.jz.chatflow.utils.TextSanitizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class EventStoreImpl extends ServiceImpl<ChatMessageMapper, ChatMessage>
        implements EventStore {

    private static final String OUTBOUND_EVENT = "MtMessage";

    private final ChatSequencer chatSequencer;

    private static LocalDateTime toLdt(Instant ts) {
        return LocalDateTime.ofInstant(ts == null ? Instant.now() : ts, ZoneId.systemDefault());
    }

    @Override
    public boolean recordInbound(InboundEvent event) {
        ChatMessage m = ChatMessage.builder()
                .messageId(event.getId())
                .conversationKey(event.conversationKey())
                .direction(MessageDirection.INBOUND)
                .contentKind(event.getKind().code())
                .text(blankToNull(event.getRawText()))
                .mediaRef(event.getMediaRef())
                .senderName(event.getSenderDisplayName())
                .eventKind(event.getEventKind())
                .responded(false)
                .seq(chatSequencer.next(event.conversationKey()))
                .createdAt(toLdt(event.getOccurredAt()))
                .build();
        try {
            // 唯一索引 uk_message_id 兜底：并发重复投递只有一个能插进去
            this.save(m);
            return true;
        } catch (DuplicateKeyException e) {
            log.info("duplicate inbound ignored, messageId={}", event.getId());
            return false;
        }
    }

    @Override
    public void fillTranscript(String messageId, String text) {
        int n = baseMapper.fillTextOnce(messageId, text);
        if (n == 0) {
            log.debug("transcript not filled (already has text), messageId={}", messageId);
        }
    }

    @Override
    public String recordOutbound(String conversationKey, String inboundMessageId, String text) {
        String outboundId = "auto_" + inboundMessageId + "_" + System.currentTimeMillis();
        ChatMessage a = ChatMessage.builder()
                .messageId(outboundId)
                .conversationKey(conversationKey)
                .direction(MessageDirection.OUTBOUND)
                .contentKind("text")
                .text(text)
                .eventKind(OUTBOUND_EVENT)
                .responded(true)
                .seq(chatSequencer.next(conversationKey))
                .createdAt(LocalDateTime.now())
                .build();
        try {
            this.save(a);
            return outboundId;
        } catch (Exception e) {
            log.error("persist outbound failed, key={}, inbound={}, err={}",
                    conversationKey, inboundMessageId, e.getMessage(), e);
            throw e;
        }
    }

    @Override
    public void markResponded(String messageId) {
        this.lambdaUpdate()
                .eq(ChatMessage::getMessageId, messageId)
                .set(ChatMessage::getResponded, true)
                .set(ChatMessage::getRespondedAt, LocalDateTime.now())
                .update();
    }

    @Override
    public List<ChatTurn> recentHistory(String conversationKey, String excludeMessageId, int limit) {
        if (limit <= 0) return List.of();
        List<ChatMessage> rows = baseMapper.selectRecentExcluding(
                conversationKey, excludeMessageId == null ? "" : excludeMessageId, limit);
        // 最新在前 → 反转成正序
        List<ChatMessage> asc = new ArrayList<>(rows);
        Collections.reverse(asc);
        List<ChatTurn> out = new ArrayList<>(asc.size());
        for (ChatMessage m : asc) {
            out.add(m.getDirection() == MessageDirection.OUTBOUND
                    ? ChatTurn.assistant(m.getText())
                    : ChatTurn.user(m.getText()));
        }
        log.debug("history loaded key={}, n={}, last={}", conversationKey, out.size(),
                out.isEmpty() ? "" : TextSanitizer.preview(out.get(out.size() - 1).getText(), 30));
        return out;
    }

    @Override
    public boolean hasDeliveredReply(String conversationKey) {
        // 出站记录可能写失败，已回复的入站标记同样算送达过
        return this.lambdaQuery()
                .eq(ChatMessage::getConversationKey, conversationKey)
                .and(w -> w.eq(ChatMessage::getDirection, MessageDirection.OUTBOUND)
                        .or()
                        .eq(ChatMessage::getResponded, true))
                .count() > 0;
    }

    @Override
    public boolean isResponded(String messageId) {
        return this.lambdaQuery()
                .eq(ChatMessage::getMessageId, messageId)
                .eq(ChatMessage::getResponded, true)
                .count() > 0;
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s.trim();
    }
}
