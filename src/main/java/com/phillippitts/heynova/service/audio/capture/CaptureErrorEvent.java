package com.phillippitts.heynova.service.audio.capture;

import java.time.Instant;

/**
 * The microphone could not be opened or read. Carries no audio.
 *
 * @param reason one of the reason constants below
 * @param at when the capture attempt failed
 */
public record CaptureErrorEvent(String reason, Instant at) {

    /** The OS refused microphone access. */
    public static final String MIC_PERMISSION_DENIED = "MIC_PERMISSION_DENIED";
    /** No input line matches the configured device and 16 kHz mono format. */
    public static final String MIC_UNAVAILABLE = "MIC_UNAVAILABLE";
    public static final String CAPTURE_ERROR = "CAPTURE_ERROR";

    public CaptureErrorEvent {
        if (at == null) {
            at = Instant.now();
        }
    }

    public static CaptureErrorEvent now(String reason) {
        return new CaptureErrorEvent(reason, Instant.now());
    }
}
