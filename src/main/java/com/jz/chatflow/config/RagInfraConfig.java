package com.jz.chatflow.config;

import org.springframework.boot.autoconfigure.data.redis.RedisProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import redis.clients.jedis.DefaultJedisClientConfig;
import redis.clients.jedis.HostAndPort;
import redis.clients.jedis.JedisPooled;

/**
 * 向量检索走 Jedis（RediSearch 命令），连接参数复用 spring.data.redis.*。
 */
@Configuration
public class RagInfraConfig {

    @Bean(destroyMethod = "close")
    public JedisPooled jedisPooled(RedisProperties redis) {
        DefaultJedisClientConfig.Builder cfg = DefaultJedisClientConfig.builder()
                .database(redis.getDatabase());
        if (redis.getPassword() != null && !redis.getPassword().isBlank()) {
            // Redis 6+ ACL，没配用户名就用 default
            cfg.user(redis.getUsername() == null || redis.getUsername().isBlank() ? "default" : redis.getUsername())
                    .password(redis.getPassword());
        }
        if (redis.getTimeout() != null) {
            cfg.socketTimeoutMillis((int) redis.getTimeout().toMillis());
        }
        return new JedisPooled(new HostAndPort(redis.getHost(), redis.getPort()), cfg.build());
    }
}
