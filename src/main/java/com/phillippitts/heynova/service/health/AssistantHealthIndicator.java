package com.phillippitts.heynova.service.health;

import com.phillippitts.heynova.config.backend.BackendCapabilities;
import com.phillippitts.heynova.service.stt.SttEngine;
import com.phillippitts.heynova.service.stt.TranscriptionPipeline;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the transcription backends and the optional skill services.
 *
 * <ul>
 *   <li>UP: offline and online transcription both ready</li>
 *   <li>DEGRADED: one transcription backend ready</li>
 *   <li>DOWN: nothing can transcribe, every utterance is treated as silence</li>
 * </ul>
 */
@Component
public class AssistantHealthIndicator implements HealthIndicator {

    private final SttEngine vosk;
    private final SttEngine online;
    private final TranscriptionPipeline pipeline;
    private final BackendCapabilities capabilities;

    public AssistantHealthIndicator(SttEngine voskSttEngine,
                                    SttEngine onlineSttEngine,
                                    TranscriptionPipeline pipeline,
                                    BackendCapabilities capabilities) {
        this.vosk = voskSttEngine;
        this.online = onlineSttEngine;
        this.pipeline = pipeline;
        this.capabilities = capabilities;
    }

    @Override
    public Health health() {
        boolean offlineEnabled = pipeline.isOfflineAvailable();
        boolean onlineEnabled = pipeline.isOnlineAvailable();
        boolean offlineReady = offlineEnabled && vosk.isHealthy();
        boolean onlineReady = onlineEnabled && online.isHealthy();

        Health.Builder builder = new Health.Builder();
        if (offlineReady && onlineReady) {
            builder.up().withDetail("status", "Both transcription backends operational");
        } else if (offlineReady || onlineReady) {
            builder.status("DEGRADED").withDetail("status", "Partial transcription availability");
        } else {
            builder.down().withDetail("status", "No transcription backend available");
        }
        return builder
                .withDetail("offline", engineStatus(offlineEnabled, offlineReady))
                .withDetail("online", engineStatus(onlineEnabled, onlineReady))
                .withDetail("generativeAnswer", capabilities.generativeAnswer())
                .withDetail("weather", capabilities.weather())
                .withDetail("translation", capabilities.translation())
                .build();
    }

    private static String engineStatus(boolean enabled, boolean ready) {
        if (!enabled) {
            return "disabled";
        }
        return ready ? "ready" : "unhealthy";
    }
}
