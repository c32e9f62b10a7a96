package com.jz.chatflow.domain.dto;

import com.jz.chatflow.utils.ConversationKeys;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * 一条收到的渠道事件（不可变）。id 由服务商分配，全局唯一。
 */
@Value
@Builder
public class InboundEvent {

    public static final String USER_MESSAGE_EVENT = "MoMessage";

    String id;
    String from;
    String to;
    Instant occurredAt;
    ContentKind kind;
    String rawText;
    String mediaRef;
    String senderDisplayName;
    String eventKind;

    public String conversationKey() {
        return ConversationKeys.of(from, to);
    }

    /** 只有用户发来的消息才需要回复；回执/回显只落库 */
    public boolean isUserOriginated() {
        return USER_MESSAGE_EVENT.equalsIgnoreCase(eventKind);
    }
}
