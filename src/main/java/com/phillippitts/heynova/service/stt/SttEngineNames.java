package com.phillippitts.heynova.service.stt;

/**
 * Constants for STT engine name identifiers, used in results, events, metrics and logs.
 */
public final class SttEngineNames {

    /** Offline Vosk engine. */
    public static final String VOSK = "vosk";

    /** Online Whisper-compatible HTTP engine. */
    public static final String ONLINE = "online";

    private SttEngineNames() {
        // Utility class - prevent instantiation
    }
}
