package com.phillippitts.heynova.service.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DispatchMetricsTest {

    private SimpleMeterRegistry registry;
    private DispatchMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new DispatchMetrics(registry);
    }

    @Test
    void countsSkillOutcomesPerSkill() {
        metrics.incrementSkill("time", "handled");
        metrics.incrementSkill("time", "handled");
        metrics.incrementSkill("exit", "session_end");

        assertThat(registry.get("heynova.skill.invocations").tags("skill", "time", "outcome", "handled")
                .counter().count()).isEqualTo(2.0);
        assertThat(registry.get("heynova.skill.invocations").tags("skill", "exit")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void tagsTranscriptionFailuresByReason() {
        metrics.incrementTranscriptionFailure("vosk", "unintelligible");
        metrics.incrementTranscriptionSuccess("online");

        assertThat(registry.get("heynova.transcription.failure").tags("engine", "vosk", "reason", "unintelligible")
                .counter().count()).isEqualTo(1.0);
        assertThat(registry.get("heynova.transcription.success").tag("engine", "online")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void recordsLatencies() {
        metrics.recordTranscriptionLatency("vosk", 5_000_000L);
        metrics.recordDispatchLatency(12_000_000L);
        metrics.incrementFallback("web_search");

        assertThat(registry.get("heynova.transcription.latency").timer().count()).isEqualTo(1L);
        assertThat(registry.get("heynova.dispatch.latency").timer().count()).isEqualTo(1L);
        assertThat(registry.get("heynova.fallback").tag("kind", "web_search").counter().count()).isEqualTo(1.0);
    }
}
