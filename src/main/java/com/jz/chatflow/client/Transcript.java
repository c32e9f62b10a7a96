package com.jz.chatflow.client;

import lombok.Value;

@Value
public class Transcript {
    String text;
    /** 可能为空（Groq Whisper 不一定返回） */
    String language;
}
