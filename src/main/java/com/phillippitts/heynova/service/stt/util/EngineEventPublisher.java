package com.phillippitts.heynova.service.stt.util;

import com.phillippitts.heynova.service.stt.event.EngineFailureEvent;
import org.springframework.context.ApplicationEventPublisher;

import java.util.Map;

/** Publishes {@link EngineFailureEvent}s; a null publisher (plain unit tests) is a no-op. */
public final class EngineEventPublisher {

    private EngineEventPublisher() {}

    public static void publishFailure(ApplicationEventPublisher publisher,
                                      String engineName,
                                      String message,
                                      Throwable cause,
                                      Map<String, String> context) {
        if (publisher == null) {
            return;
        }
        // the event constructor fills in the timestamp
        publisher.publishEvent(new EngineFailureEvent(engineName, null, message, cause, context));
    }

    public static void publishFailure(ApplicationEventPublisher publisher,
                                      String engineName,
                                      String message,
                                      Throwable cause) {
        publishFailure(publisher, engineName, message, cause, Map.of());
    }
}
