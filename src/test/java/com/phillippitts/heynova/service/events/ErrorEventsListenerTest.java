package com.phillippitts.heynova.service.events;

import com.phillippitts.heynova.service.audio.capture.CaptureErrorEvent;
import com.phillippitts.heynova.service.stt.event.EngineFailureEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class ErrorEventsListenerTest {

    @Test
    void logsOncePerKeyWithinThrottleWindow() {
        ErrorEventsListener listener = new ErrorEventsListener();

        assertThat(listener.shouldLog("capture-MIC_UNAVAILABLE")).isTrue();
        assertThat(listener.shouldLog("capture-MIC_UNAVAILABLE")).isFalse();
        assertThat(listener.shouldLog("engine-online")).isTrue();
    }

    @Test
    void handlesEveryEventKind() {
        ErrorEventsListener listener = new ErrorEventsListener();

        assertThatCode(() -> {
            listener.onCaptureError(new CaptureErrorEvent("MIC_PERMISSION_DENIED", Instant.now()));
            listener.onCaptureError(new CaptureErrorEvent("MIC_UNAVAILABLE", Instant.now()));
            listener.onCaptureError(new CaptureErrorEvent("CAPTURE_ERROR", Instant.now()));
            listener.onEngineFailure(new EngineFailureEvent("online", null, "HTTP 503", null, Map.of("elapsedMs", "12")));
        }).doesNotThrowAnyException();
    }
}
