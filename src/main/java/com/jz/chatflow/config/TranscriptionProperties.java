package com.jz.chatflow.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** OpenAI 兼容的 /audio/transcriptions 接口（默认 Groq Whisper） */
@Data
@ConfigurationProperties(prefix = "chatflow.transcription")
public class TranscriptionProperties {
    private String baseUrl = "https://api.groq.com/openai/v1";
    private String apiKey;
    private String model = "whisper-large-v3";
    /** 语音文件大小上限，超过直接判定转写失败 */
    private long maxMediaBytes = 16L * 1024 * 1024;
}
