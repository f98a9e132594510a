package com.phillippitts.heynova.util;

import java.time.Duration;

/**
 * Standard timeout values for process and thread management.
 *
 * @see com.phillippitts.heynova.service.action.ProcessSpeechOutput
 * @see com.phillippitts.heynova.service.orchestration.AssistantLoop
 */
public final class ProcessTimeouts {

    /**
     * Timeout for graceful process shutdown via {@link Process#destroy()}.
     *
     * <p>Most processes terminate within 100-200ms.
     */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /**
     * Timeout for forceful process termination via {@link Process#destroyForcibly()}.
     */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    /**
     * How long {@code stop()} waits for the assistant loop to finish its current cycle.
     *
     * <p>A cycle can include a listen timeout, a phrase limit and network calls.
     */
    public static final Duration LOOP_STOP_TIMEOUT = Duration.ofSeconds(30);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
