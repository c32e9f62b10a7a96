package com.jz.chatflow.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * 会话锁用到的 Lua 脚本和续期线程。
 */
@Configuration
public class ConversationLockConfig {

    /** token 一致才删除，防止误删别人的锁 */
    @Bean
    public DefaultRedisScript<Long> unlockScript() {
        var s = new DefaultRedisScript<Long>();
        s.setResultType(Long.class);
        s.setScriptText("""
                if redis.call('get', KEYS[1]) == ARGV[1] then
                  return redis.call('del', KEYS[1])
                end
                return 0
                """);
        return s;
    }

    /** token 一致才续期，ARGV[2] 为新的 TTL(ms) */
    @Bean
    public DefaultRedisScript<Long> renewScript() {
        var s = new DefaultRedisScript<Long>();
        s.setResultType(Long.class);
        s.setScriptText("""
                if redis.call('get', KEYS[1]) == ARGV[1] then
                  return redis.call('pexpire', KEYS[1], tonumber(ARGV[2]))
                end
                return 0
                """);
        return s;
    }

    @Bean(name = "lockRenewScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService lockRenewScheduler() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "conv-lock-renewer");
            t.setDaemon(true);
            return t;
        });
    }
}
