package com.phillippitts.heynova.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link TranscriptionException} carrying engine diagnostics.
 *
 * <p>Usage:
 * <pre>
 * throw TranscriptionExceptionBuilder.create("Failed to initialize Vosk")
 *         .engine("vosk")
 *         .cause(t)
 *         .metadata("modelPath", modelPath)
 *         .build();
 * </pre>
 *
 * <p>Resulting message: {@code {message} (durationMs={ms}, {key1}={val1}, ...)}.
 */
public final class TranscriptionExceptionBuilder {

    private final String message;
    private String engineName;
    private Throwable cause;
    private Long durationMs;
    private Integer httpStatus;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private TranscriptionExceptionBuilder(String message) {
        this.message = message;
    }

    public static TranscriptionExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new TranscriptionExceptionBuilder(message);
    }

    public TranscriptionExceptionBuilder engine(String engineName) {
        this.engineName = engineName;
        return this;
    }

    public TranscriptionExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public TranscriptionExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /** HTTP status returned by an online backend. */
    public TranscriptionExceptionBuilder httpStatus(int httpStatus) {
        this.httpStatus = httpStatus;
        return this;
    }

    /** Null keys or values are skipped. */
    public TranscriptionExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    public TranscriptionException build() {
        String detailedMessage = buildDetailedMessage();
        String engine = engineName != null ? engineName : "unknown";
        if (cause != null) {
            return new TranscriptionException(detailedMessage, engine, cause);
        }
        return new TranscriptionException(detailedMessage, engine);
    }

    private String buildDetailedMessage() {
        Map<String, String> details = new LinkedHashMap<>();
        if (httpStatus != null) {
            details.put("httpStatus", String.valueOf(httpStatus));
        }
        if (durationMs != null) {
            details.put("durationMs", String.valueOf(durationMs));
        }
        details.putAll(metadata);
        if (details.isEmpty()) {
            return message;
        }
        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        for (Map.Entry<String, String> entry : details.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
