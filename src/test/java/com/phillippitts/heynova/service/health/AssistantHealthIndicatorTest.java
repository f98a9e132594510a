package com.phillippitts.heynova.service.health;

import com.phillippitts.heynova.config.backend.BackendCapabilities;
import com.phillippitts.heynova.service.stt.SttEngine;
import com.phillippitts.heynova.service.stt.TranscriptionPipeline;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AssistantHealthIndicatorTest {

    private final SttEngine vosk = mock(SttEngine.class);
    private final SttEngine online = mock(SttEngine.class);
    private final TranscriptionPipeline pipeline = mock(TranscriptionPipeline.class);

    private Health health(boolean offlineEnabled, boolean offlineHealthy, boolean onlineEnabled, boolean onlineHealthy) {
        when(pipeline.isOfflineAvailable()).thenReturn(offlineEnabled);
        when(pipeline.isOnlineAvailable()).thenReturn(onlineEnabled);
        when(vosk.isHealthy()).thenReturn(offlineHealthy);
        when(online.isHealthy()).thenReturn(onlineHealthy);
        BackendCapabilities caps = new BackendCapabilities(offlineEnabled, onlineEnabled, true, false, true);
        return new AssistantHealthIndicator(vosk, online, pipeline, caps).health();
    }

    @Test
    void upWhenBothBackendsReady() {
        Health health = health(true, true, true, true);

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("offline", "ready")
                .containsEntry("online", "ready")
                .containsEntry("generativeAnswer", true)
                .containsEntry("weather", false);
    }

    @Test
    void degradedWithOnlyOfflineBackend() {
        Health health = health(true, true, false, false);

        assertThat(health.getStatus()).isEqualTo(new Status("DEGRADED"));
        assertThat(health.getDetails()).containsEntry("online", "disabled");
    }

    @Test
    void downWhenNothingCanTranscribe() {
        Health health = health(true, false, false, false);

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("offline", "unhealthy");
    }
}
