package com.jz.chatflow.domain.dto;

public enum ContentKind {
    TEXT,
    AUDIO;

    public String code() {
        return name().toLowerCase();
    }
}
