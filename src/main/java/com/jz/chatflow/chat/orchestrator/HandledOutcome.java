package com.jz.chatflow.chat.orchestrator;

import com.jz.chatflow.domain.entity.SessionStage;
import lombok.Value;

@Value
public class HandledOutcome {
    String messageId;
    String conversationKey;
    Outcome outcome;
    /** 处理后的会话阶段；没走到状态机时为 null */
    SessionStage stage;
    /** 实际发出（或准备发出）的回复 */
    String replyText;

    public static HandledOutcome of(String messageId, String conversationKey, Outcome outcome) {
        return new HandledOutcome(messageId, conversationKey, outcome, null, null);
    }

    public boolean isDuplicate() {
        return outcome == Outcome.DUPLICATE;
    }
}
