package com.jz.chatflow.client;

import java.util.Optional;

public interface TranscriptionClient {
    /** 语音转文字；没听出内容返回 empty，下载/接口失败抛异常 */
    Optional<Transcript> transcribe(String mediaUrl);
}
