package com.phillippitts.heynova.config.backend;

/**
 * Which optional backends are usable in this run. Resolved once at startup from configuration
 * and never changed afterwards; components consult these flags instead of probing.
 *
 * @param offlineTranscription Vosk model configured and present on disk
 * @param onlineTranscription  Whisper-compatible transcription url configured
 * @param generativeAnswer     chat completions api key configured
 * @param weather              weather api key configured
 * @param translation          translation service url configured
 */
public record BackendCapabilities(
        boolean offlineTranscription,
        boolean onlineTranscription,
        boolean generativeAnswer,
        boolean weather,
        boolean translation
) {

    /** Every optional backend disabled. */
    public static BackendCapabilities none() {
        return new BackendCapabilities(false, false, false, false, false);
    }

    public boolean anyTranscription() {
        return offlineTranscription || onlineTranscription;
    }
}
