package com.jz.chatflow.chat.log;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.util.Collections;

/**
 * 会话内消息序号，历史按 seq 排序，不依赖各实例的时钟。
 * 取值 max(上一个 + 1, 当前毫秒)，Redis 挂掉时退化成的时间戳和它可比。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChatSequencer {

    static final DefaultRedisScript<Long> NEXT_SCRIPT = new DefaultRedisScript<>("""
            local v = redis.call('incr', KEYS[1])
            local now = tonumber(ARGV[1])
            if v < now then
              redis.call('set', KEYS[1], now)
              return now
            end
            return v
            """, Long.class);

    private final StringRedisTemplate redis;

    public long next(String conversationKey) {
        long now = System.currentTimeMillis();
        try {
            // key 例：chatflow:seq:wa:9198...:9111...
            Long v = redis.execute(NEXT_SCRIPT, Collections.singletonList("chatflow:seq:" + conversationKey),
                    String.valueOf(now));
            if (v != null) return v;
        } catch (Exception e) {
            log.debug("seq increment failed, fallback to clock. key={}, err={}", conversationKey, e.toString());
        }
        return now;
    }
}
