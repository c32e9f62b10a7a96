package com.jz.chatflow.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "chatflow.lock")
public class LockProperties {

    public enum Mode { REDIS, LOCAL }

    /** REDIS：多实例部署；LOCAL：单实例/本地调试 */
    private Mode mode = Mode.REDIS;
    private String keyPrefix = "chatflow:lock:";
    private long ttlMs = 30_000;
    private long waitMs = 20_000;
    private long retryIntervalMs = 50;
    private long minRenewIntervalMs = 1_000;
}
