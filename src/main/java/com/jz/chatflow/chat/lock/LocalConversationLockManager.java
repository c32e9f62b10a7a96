package com.jz.chatflow.chat.lock;

import com.jz.chatflow.config.LockProperties;
import com.jz.chatflow.exception.ConversationBusyException;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 单实例用的进程内会话锁。没人用的锁会从 map 里移除。
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "chatflow.lock", name = "mode", havingValue = "LOCAL")
public class LocalConversationLockManager implements ConversationLockManager {

    private final LockProperties props;
    private final ConcurrentHashMap<String, Entry> locks = new ConcurrentHashMap<>();

    private static final class Entry {
        final ReentrantLock lock = new ReentrantLock();
        int users;
    }

    @Override
    public <T> T withLock(String conversationKey, Supplier<T> body) {
        Entry e = locks.compute(conversationKey, (k, v) -> {
            Entry x = v == null ? new Entry() : v;
            x.users++;
            return x;
        });
        try {
            boolean ok;
            try {
                ok = e.lock.tryLock(props.getWaitMs(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new ConversationBusyException(conversationKey, props.getWaitMs());
            }
            if (!ok) throw new ConversationBusyException(conversationKey, props.getWaitMs());
            try {
                return body.get();
            } finally {
                e.lock.unlock();
            }
        } finally {
            locks.computeIfPresent(conversationKey, (k, v) -> --v.users <= 0 ? null : v);
        }
    }

    int size() {
        return locks.size();
    }
}
