package com.jz.chatflow.service;

import com.jz.chatflow.domain.dto.ChatTurn;
import com.jz.chatflow.domain.dto.InboundEvent;

import java.util.List;

/**
 * 收发消息流水。只有编排器（以及按会话重发）会写。
 */
public interface EventStore {

    /**
     * 以入站消息的形式原子插入事件；message_id 唯一键冲突时返回 false（重复投递）。
     */
    boolean recordInbound(InboundEvent event);

    /** 语音转写文本补写（只写一次） */
    void fillTranscript(String messageId, String text);

    /** 记录一条已送达的出站回复，返回出站 message_id */
    String recordOutbound(String conversationKey, String inboundMessageId, String text);

    void markResponded(String messageId);

    /**
     * 最近 limit 条历史，旧的在前，不含 excludeMessageId 这条。
     */
    List<ChatTurn> recentHistory(String conversationKey, String excludeMessageId, int limit);

    /** 该会话是否已经成功发出过任何回复（出站记录或已回复标记，任一即可） */
    boolean hasDeliveredReply(String conversationKey);

    /** 这条入站事件是否已标记回复 */
    boolean isResponded(String messageId);
}
