package com.phillippitts.heynova.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for the dispatch pipeline.
 *
 * <p>Provides:
 * <ul>
 *   <li>Transcription latency and success/failure per backend (vosk, online)</li>
 *   <li>Skill outcomes per skill name</li>
 *   <li>Fallback results per kind (answer, web_search)</li>
 *   <li>End-to-end command dispatch latency</li>
 * </ul>
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class DispatchMetrics {

    private static final String METRIC_PREFIX = "heynova";

    private final MeterRegistry registry;

    public DispatchMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param engineName backend name (vosk, online)
     * @param durationNanos duration in nanoseconds
     */
    public void recordTranscriptionLatency(String engineName, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".transcription.latency")
                .description("Time taken by one transcription backend call")
                .tag("engine", engineName)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementTranscriptionSuccess(String engineName) {
        Counter.builder(METRIC_PREFIX + ".transcription.success")
                .description("Number of backend calls that produced text")
                .tag("engine", engineName)
                .register(registry)
                .increment();
    }

    /**
     * @param engineName backend name (vosk, online)
     * @param reason unintelligible, unavailable or error
     */
    public void incrementTranscriptionFailure(String engineName, String reason) {
        Counter.builder(METRIC_PREFIX + ".transcription.failure")
                .description("Number of backend calls that produced no text")
                .tag("engine", engineName)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * @param skill name of the skill that claimed the command
     * @param outcome dispatch outcome (handled, session_end)
     */
    public void incrementSkill(String skill, String outcome) {
        Counter.builder(METRIC_PREFIX + ".skill.invocations")
                .description("Commands claimed per skill")
                .tag("skill", skill)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * @param kind answer or web_search
     */
    public void incrementFallback(String kind) {
        Counter.builder(METRIC_PREFIX + ".fallback")
                .description("Unclaimed commands per fallback kind")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void recordDispatchLatency(long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".dispatch.latency")
                .description("Time from command text to presented result")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }
}
