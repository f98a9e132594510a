package com.phillippitts.heynova.config.stt;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the offline Vosk STT engine.
 * Binds to properties prefixed with "stt.vosk".
 *
 * <p>Example application.properties:
 * <pre>
 * stt.vosk.model-path=models/vosk-model-small-en-us-0.15
 * stt.vosk.sample-rate=16000
 * stt.vosk.max-alternatives=0
 * </pre>
 *
 * <p>A blank model path disables offline transcription; it is not a startup error.
 *
 * @param modelPath Path to the Vosk model directory (blank = offline backend disabled)
 * @param sampleRate Audio sample rate in Hz (defaults to 16000)
 * @param maxAlternatives Alternatives requested from the recognizer (0 = plain result format)
 */
@ConfigurationProperties(prefix = "stt.vosk")
public record VoskConfig(
        String modelPath,
        int sampleRate,
        int maxAlternatives
) {
    public VoskConfig {
        modelPath = modelPath == null ? "" : modelPath.trim();
        if (sampleRate <= 0) {
            sampleRate = 16_000;
        }
        if (maxAlternatives < 0) {
            maxAlternatives = 0;
        }
    }

    public boolean isConfigured() {
        return !modelPath.isEmpty();
    }
}
