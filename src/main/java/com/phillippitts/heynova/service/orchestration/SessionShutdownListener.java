package com.phillippitts.heynova.service.orchestration;

import com.phillippitts.heynova.service.orchestration.event.SessionEndedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Closes the application once the user ended the session. Runs the close on its own thread
 * because the event arrives on the loop thread, which the close waits for.
 */
@Component
class SessionShutdownListener {

    private static final Logger LOG = LogManager.getLogger(SessionShutdownListener.class);

    private final ConfigurableApplicationContext context;

    SessionShutdownListener(ConfigurableApplicationContext context) {
        this.context = context;
    }

    @EventListener
    void onSessionEnded(SessionEndedEvent event) {
        LOG.info("Shutting down: {}", event.reason());
        Thread t = new Thread(() -> SpringApplication.exit(context, () -> 0), "session-shutdown");
        t.start();
    }
}
