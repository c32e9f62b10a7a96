package com.jz.chatflow.utils;

import java.util.Objects;

public final class ConversationKeys {
    private ConversationKeys() {}

    public static final String PREFIX = "wa:";
    public static final String WEB_PREFIX = "web:";

    /** 用户号码 + 业务号码，例如：wa:919812345678:911140000000 */
    public static String of(String from, String to) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        return PREFIX + normalize(from) + ":" + normalize(to);
    }

    /** 网页会话单独一个命名空间，不会和 WhatsApp 会话撞上，例如：web:browser1:911140000000 */
    public static String web(String sessionId, String business) {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(business, "business");
        return WEB_PREFIX + normalize(sessionId) + ":" + normalize(business);
    }

    /** 解析出用户号码；格式不符返回 null */
    public static String parseUser(String key) {
        String[] parts = split(key);
        return parts == null ? null : parts[0];
    }

    /** 解析出业务号码（渠道身份）；格式不符返回 null */
    public static String parseBusiness(String key) {
        String[] parts = split(key);
        return parts == null ? null : parts[1];
    }

    /** 号码只保留数字，去掉 + 和空格，避免同一个人出现两个会话 */
    public static String normalize(String number) {
        if (number == null) return null;
        return number.replaceAll("[^0-9A-Za-z]", "");
    }

    private static String[] split(String key) {
        if (key == null || !key.startsWith(PREFIX)) return null;
        String[] parts = key.substring(PREFIX.length()).split(":");
        if (parts.length != 2 || parts[0].isEmpty() || parts[1].isEmpty()) return null;
        return parts;
    }
}
