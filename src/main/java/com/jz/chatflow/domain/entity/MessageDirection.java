package com.jz.chatflow.domain.entity;

public enum MessageDirection {
    INBOUND,
    OUTBOUND
}
