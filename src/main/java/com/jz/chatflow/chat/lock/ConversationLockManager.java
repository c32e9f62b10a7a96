package com.jz.chatflow.chat.lock;

import java.util.function.Supplier;

/**
 * 按 conversationKey 串行化处理。等待超时抛 ConversationBusyException。
 */
public interface ConversationLockManager {
    <T> T withLock(String conversationKey, Supplier<T> body);
}
