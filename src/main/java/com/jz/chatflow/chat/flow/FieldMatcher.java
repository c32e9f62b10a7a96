package com.jz.chatflow.chat.flow;

import java.util.Optional;

/**
 * 从一句用户话里抽取某个字段的值；抽不到返回 empty。
 */
@FunctionalInterface
public interface FieldMatcher {
    Optional<String> match(String utterance);
}
