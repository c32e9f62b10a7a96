package com.jz.chatflow.chat.flow;

/** 待收集字段的取值方式 */
public enum FieldType {
    NUMBER,
    TIME,
    DATE,
    FREE_TEXT,
    REGEX
}
