package com.phillippitts.heynova.domain;

import java.util.Objects;

/**
 * What one transcription backend heard. Empty text is a valid result: silence and
 * unclear audio both produce it, and the pipeline then asks the next backend.
 *
 * @param text heard text, never null
 * @param confidence backend confidence in [0.0, 1.0]; backends without scores report 1.0
 * @param engineName backend that produced the text ({@code vosk}, {@code online})
 */
public record TranscriptionResult(String text, double confidence, String engineName) {

    public TranscriptionResult {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(engineName, "engineName");
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence out of range: " + confidence);
        }
        text = text.trim();
    }

    public static TranscriptionResult of(String text, double confidence, String engineName) {
        return new TranscriptionResult(text, confidence, engineName);
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }
}
