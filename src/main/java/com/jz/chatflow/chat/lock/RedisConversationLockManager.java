package com.jz.chatflow.chat.lock;

import com.jz.chatflow.config.LockProperties;
import com.jz.chatflow.exception.ConversationBusyException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.UUID;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Redis 分布式会话锁：SET NX PX + token，看门狗按 ttl/3 续期，释放时比对 token 再 DEL。
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "chatflow.lock", name = "mode", havingValue = "REDIS", matchIfMissing = true)
public class RedisConversationLockManager implements ConversationLockManager {

    private final StringRedisTemplate redis;
    private final DefaultRedisScript<Long> unlockScript;
    private final DefaultRedisScript<Long> renewScript;
    private final ScheduledExecutorService scheduler;
    private final LockProperties props;

    public RedisConversationLockManager(StringRedisTemplate redis,
                                        @Qualifier("unlockScript") DefaultRedisScript<Long> unlockScript,
                                        @Qualifier("renewScript") DefaultRedisScript<Long> renewScript,
                                        @Qualifier("lockRenewScheduler") ScheduledExecutorService scheduler,
                                        LockProperties props) {
        this.redis = redis;
        this.unlockScript = unlockScript;
        this.renewScript = renewScript;
        this.scheduler = scheduler;
        this.props = props;
    }

    @Override
    public <T> T withLock(String conversationKey, Supplier<T> body) {
        try (LockSession lock = acquire(props.getKeyPrefix() + conversationKey, conversationKey)) {
            lock.startWatchdog();
            return body.get();
        }
    }

    private LockSession acquire(String redisKey, String conversationKey) {
        long deadline = System.currentTimeMillis() + props.getWaitMs();
        while (true) {
            LockSession s = tryAcquire(redisKey);
            if (s != null) return s;
            if (System.currentTimeMillis() >= deadline) {
                throw new ConversationBusyException(conversationKey, props.getWaitMs());
            }
            try {
                Thread.sleep(props.getRetryIntervalMs());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ConversationBusyException(conversationKey, props.getWaitMs());
            }
        }
    }

    /** SET NX PX，成功返回会话，失败返回 null */
    LockSession tryAcquire(String key) {
        String token = UUID.randomUUID().toString();
        Boolean ok = redis.opsForValue().setIfAbsent(key, token, props.getTtlMs(), TimeUnit.MILLISECONDS);
        if (!Boolean.TRUE.equals(ok)) return null;
        return new LockSession(key, token, props.getTtlMs());
    }

    /** 持锁会话，try-with-resources 释放 */
    final class LockSession implements AutoCloseable {
        private final String key;
        private final String token;
        private final long ttlMs;
        private volatile ScheduledFuture<?> renewTask;
        private volatile boolean closed;

        private LockSession(String key, String token, long ttlMs) {
            this.key = key;
            this.token = token;
            this.ttlMs = ttlMs;
        }

        void startWatchdog() {
            long period = Math.max(props.getMinRenewIntervalMs(), ttlMs / 3);
            // 轻微抖动，避免同时续期
            long jitter = ThreadLocalRandom.current().nextLong(Math.max(1, period / 10));
            this.renewTask = scheduler.scheduleAtFixedRate(() -> {
                try {
                    Long res = redis.execute(renewScript, Collections.singletonList(key), token, String.valueOf(ttlMs));
                    if (res == null || res == 0L) {
                        // 锁已过期或被别人拿走
                        cancelRenewal();
                        log.warn("conversation lock lost before release, key={}", key);
                    }
                } catch (Exception e) {
                    log.debug("lock renew error key={}, err={}", key, e.toString());
                }
            }, period + jitter, period, TimeUnit.MILLISECONDS);
        }

        private void cancelRenewal() {
            ScheduledFuture<?> t = this.renewTask;
            if (t != null) t.cancel(false);
            this.renewTask = null;
        }

        @Override
        public void close() {
            if (closed) return;
            closed = true;
            cancelRenewal();
            try {
                Long res = redis.execute(unlockScript, Collections.singletonList(key), token);
                if (res == null || res == 0L) {
                    log.warn("unlock skipped, lock no longer owned. key={}", key);
                }
            } catch (Exception e) {
                // 解锁失败只能等 TTL 过期
                log.warn("unlock failed, will expire in {}ms. key={}, err={}", ttlMs, key, e.toString());
            }
        }
    }
}
