package com.jz.chatflow.exception;

/** 在等待时间内没有拿到会话锁。 */
public class ConversationBusyException extends ChatflowException {

    private final String conversationKey;

    public ConversationBusyException(String conversationKey, long waitedMs) {
        super("conversation lock not acquired within " + waitedMs + "ms: " + conversationKey);
        this.conversationKey = conversationKey;
    }

    public String getConversationKey() {
        return conversationKey;
    }
}
