package com.phillippitts.heynova.service.stt.event;

import java.time.Instant;
import java.util.Map;

/**
 * A transcription backend failed to load or to answer. {@code context} carries diagnostics
 * such as status codes and timings, never heard text.
 *
 * @param engine backend name
 * @param at failure time; null means now
 * @param message short description
 * @param cause underlying error, may be null
 * @param context diagnostics, copied
 */
public record EngineFailureEvent(
        String engine,
        Instant at,
        String message,
        Throwable cause,
        Map<String, String> context
) {
    public EngineFailureEvent {
        if (at == null) {
            at = Instant.now();
        }
        context = context == null ? Map.of() : Map.copyOf(context);
    }
}
