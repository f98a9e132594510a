package com.phillippitts.heynova.service.orchestration.event;

import com.phillippitts.heynova.domain.CycleResult;

import java.time.Instant;

/**
 * Emitted after a command has been routed and its result presented.
 *
 * @param stage     HANDLED, FALLBACK or SESSION_END
 * @param skill     claiming skill, or null for a fallback
 * @param latencyMs time from command text to presented result
 * @param at        when dispatch completed
 */
public record CommandDispatchedEvent(
        CycleResult.Stage stage,
        String skill,
        long latencyMs,
        Instant at
) {}
