package com.jz.chatflow.client.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.jz.chatflow.client.Collaborator;
import com.jz.chatflow.client.Transcript;
import com.jz.chatflow.client.TranscriptionClient;
import com.jz.chatflow.config.TranscriptionProperties;
import com.jz.chatflow.exception.CollaboratorException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;

import java.io.InputStream;
import java.util.Optional;

/**
 * OpenAI 兼容的 Whisper 转写（默认 Groq）。先下载语音，再 multipart 上传。
 */
@Slf4j
@Component
public class WhisperTranscriptionClient implements TranscriptionClient {

    private final RestClient http;
    private final TranscriptionProperties props;

    public WhisperTranscriptionClient(RestClient.Builder builder, TranscriptionProperties props) {
        this.http = builder.build();
        this.props = props;
    }

    @Override
    public Optional<Transcript> transcribe(String mediaUrl) {
        if (props.getApiKey() == null || props.getApiKey().isBlank()) {
            throw new CollaboratorException(Collaborator.TRANSCRIPTION, "transcription api key not configured", null);
        }
        byte[] audio = download(mediaUrl);
        if (audio.length == 0) {
            log.warn("empty audio downloaded from {}", mediaUrl);
            return Optional.empty();
        }

        MultiValueMap<String, Object> form = new LinkedMultiValueMap<>();
        form.add("file", new ByteArrayResource(audio) {
            @Override
            public String getFilename() {
                return "voice.ogg";
            }
        });
        form.add("model", props.getModel());
        form.add("response_format", "verbose_json");

        JsonNode resp = http.post()
                .uri(props.getBaseUrl() + "/audio/transcriptions")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + props.getApiKey())
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(form)
                .retrieve()
                .body(JsonNode.class);

        String text = resp == null ? null : resp.path("text").asText(null);
        if (text == null || text.isBlank()) return Optional.empty();
        String lang = resp.path("language").asText(null);
        log.info("voice transcribed: {} bytes, lang={}, chars={}", audio.length, lang, text.trim().length());
        return Optional.of(new Transcript(text.trim(), lang));
    }

    /** 边读边计数，超过上限立刻中断，不把整个文件读进内存 */
    private byte[] download(String mediaUrl) {
        long max = props.getMaxMediaBytes();
        return http.get().uri(mediaUrl).exchange((request, response) -> {
            if (response.getStatusCode().isError()) {
                throw new CollaboratorException(Collaborator.TRANSCRIPTION,
                        "media download HTTP " + response.getStatusCode().value(), null);
            }
            long declared = response.getHeaders().getContentLength();
            if (declared > max) {
                throw tooLarge(declared);
            }
            try (InputStream in = response.getBody()) {
                byte[] bytes = in.readNBytes((int) Math.min(max + 1, Integer.MAX_VALUE - 8));
                if (bytes.length > max) {
                    throw tooLarge(bytes.length);
                }
                return bytes;
            }
        });
    }

    private static CollaboratorException tooLarge(long bytes) {
        return new CollaboratorException(Collaborator.TRANSCRIPTION, "audio too large: " + bytes + "+ bytes", null);
    }
}
