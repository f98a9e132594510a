package com.phillippitts.heynova.config.answer;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration for the generative-answer backend (OpenAI-compatible chat completions).
 * Binds to properties prefixed with "answer"; {@code ANSWER_API_KEY} in the environment
 * works through relaxed binding.
 *
 * <p>A blank api key disables generative answers and the fallback goes straight to web search.
 *
 * @param apiKey bearer token for the chat completions endpoint
 * @param model model name
 * @param baseUrl server base url
 * @param timeoutMs per-call timeout
 * @param maxSentences answer length requested in the system prompt
 */
@ConfigurationProperties(prefix = "answer")
public record AnswerProperties(
        String apiKey,
        String model,
        String baseUrl,
        long timeoutMs,
        int maxSentences
) {
    public AnswerProperties {
        apiKey = apiKey == null ? "" : apiKey.trim();
        model = (model == null || model.isBlank()) ? "gpt-4o-mini" : model;
        baseUrl = (baseUrl == null || baseUrl.isBlank()) ? "https://api.openai.com" : baseUrl.trim();
        if (timeoutMs <= 0) {
            timeoutMs = 15_000;
        }
        if (maxSentences <= 0) {
            maxSentences = 2;
        }
    }

    public boolean isConfigured() {
        return !apiKey.isEmpty();
    }

    public Duration timeout() {
        return Duration.ofMillis(timeoutMs);
    }
}
