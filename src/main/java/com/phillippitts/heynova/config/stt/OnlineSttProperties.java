package com.phillippitts.heynova.config.stt;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration for the online (Whisper-compatible HTTP) transcription backend.
 * Binds to properties prefixed with "stt.online".
 *
 * <p>Any server exposing {@code POST /v1/audio/transcriptions} works (OpenAI,
 * faster-whisper, whisper.cpp server). A blank url disables the backend.
 *
 * @param url base url of the transcription server
 * @param apiKey optional bearer token
 * @param model model name sent with each request
 * @param language ISO-639-1 language hint
 * @param timeoutMs per-call timeout covering connect, upload and response
 */
@ConfigurationProperties(prefix = "stt.online")
public record OnlineSttProperties(
        String url,
        String apiKey,
        String model,
        String language,
        long timeoutMs
) {
    public OnlineSttProperties {
        url = url == null ? "" : url.trim();
        apiKey = apiKey == null ? "" : apiKey.trim();
        model = (model == null || model.isBlank()) ? "whisper-1" : model;
        language = (language == null || language.isBlank()) ? "en" : language;
        if (timeoutMs <= 0) {
            timeoutMs = 10_000;
        }
    }

    public boolean isConfigured() {
        return !url.isEmpty();
    }

    public Duration timeout() {
        return Duration.ofMillis(timeoutMs);
    }
}
