package com.phillippitts.heynova.service.orchestration.event;

import java.time.Instant;

/**
 * Emitted by the assistant loop when the user ended the session with an exit command.
 */
public record SessionEndedEvent(String reason, Instant at) {}
