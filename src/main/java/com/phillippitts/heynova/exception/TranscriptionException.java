package com.phillippitts.heynova.exception;

/**
 * A transcription backend failed to turn audio into text. Never escapes the
 * {@code TranscriptionPipeline}; it is converted to empty text there.
 */
public class TranscriptionException extends HeyNovaException {

    private final String engineName;

    public TranscriptionException(String message, String engineName) {
        this(message, engineName, null);
    }

    public TranscriptionException(String message, String engineName, Throwable cause) {
        super("[" + engineName + "] " + message, cause);
        this.engineName = engineName;
    }

    /** Backend that failed: {@code vosk} or {@code online}. */
    public String getEngineName() {
        return engineName;
    }
}
