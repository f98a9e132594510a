package com.phillippitts.heynova.service.fallback.event;

import com.phillippitts.heynova.domain.FallbackResult;

import java.time.Instant;

/**
 * Published when the fallback chain decides how to answer an unclaimed command.
 *
 * <p>No command text: {@code reason} is a short technical tag such as "answered",
 * "not-configured", "no-answer" or the failing exception type.
 */
public record FallbackResolvedEvent(FallbackResult.Kind kind, String reason, Instant at) {
}
