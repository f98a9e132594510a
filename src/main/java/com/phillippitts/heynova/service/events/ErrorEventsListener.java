package com.phillippitts.heynova.service.events;

import com.phillippitts.heynova.service.audio.capture.CaptureErrorEvent;
import com.phillippitts.heynova.service.stt.event.EngineFailureEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns repeated capture and engine failures into one actionable log line per minute.
 * The loop keeps running; these only tell the user what to fix.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();

    @EventListener
    void onCaptureError(CaptureErrorEvent e) {
        if (!shouldLog("capture-" + e.reason())) {
            return;
        }
        switch (e.reason()) {
            case CaptureErrorEvent.MIC_PERMISSION_DENIED -> LOG.warn("Microphone access denied. Grant the terminal or JVM "
                    + "microphone permission in the OS privacy settings and restart.");
            case CaptureErrorEvent.MIC_UNAVAILABLE -> LOG.warn("No usable microphone. Check audio.capture.device-name "
                    + "and that a 16 kHz mono input is available.");
            default -> LOG.warn("Capture error: reason={}. Check microphone device & permissions.", e.reason());
        }
    }

    @EventListener
    void onEngineFailure(EngineFailureEvent e) {
        if (shouldLog("engine-" + e.engine())) {
            LOG.warn("Transcription backend '{}' failing: {} {}", e.engine(), e.message(), e.context());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
