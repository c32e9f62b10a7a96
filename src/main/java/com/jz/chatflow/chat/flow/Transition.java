package com.jz.chatflow.chat.flow;

import com.jz.chatflow.domain.entity.ConversationSession;
import lombok.Value;

import java.util.Map;

@Value
public class Transition {
    ConversationSession session;
    RequiredAction action;
    /** 本轮新抽到的字段（日志用） */
    Map<String, String> captured;
}
