package com.jz.chatflow.domain.dto;

import lombok.Value;

/** 喂给模型的一轮历史（只有 user / assistant 两类） */
@Value
public class ChatTurn {
    public enum Role { USER, ASSISTANT }

    Role role;
    String text;

    public static ChatTurn user(String text) {
        return new ChatTurn(Role.USER, text);
    }

    public static ChatTurn assistant(String text) {
        return new ChatTurn(Role.ASSISTANT, text);
    }
}
