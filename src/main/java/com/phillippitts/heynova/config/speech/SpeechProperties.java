package com.phillippitts.heynova.config.speech;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Speech output settings. Binds to properties prefixed with "speech".
 *
 * <p>{@code command} is an external text-to-speech program that receives the line to speak
 * as its last argument, e.g. {@code say} on macOS or {@code espeak} on Linux. When blank,
 * lines are only echoed to the log.
 *
 * @param command speech program and leading arguments, whitespace separated
 * @param timeoutMs upper bound for a single spoken line
 */
@ConfigurationProperties(prefix = "speech")
public record SpeechProperties(String command, long timeoutMs) {

    public SpeechProperties {
        command = command == null ? "" : command.trim();
        if (timeoutMs <= 0) {
            timeoutMs = 30_000;
        }
    }

    public boolean isConfigured() {
        return !command.isEmpty();
    }

    public List<String> commandTokens() {
        if (command.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(command.split("\\s+"));
    }

    public Duration timeout() {
        return Duration.ofMillis(timeoutMs);
    }
}
