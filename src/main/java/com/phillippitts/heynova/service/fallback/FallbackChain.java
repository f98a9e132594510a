package com.phillippitts.heynova.service.fallback;

import com.phillippitts.heynova.config.backend.BackendCapabilities;
import com.phillippitts.heynova.domain.FallbackResult;
import com.phillippitts.heynova.service.fallback.event.FallbackResolvedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides how to answer a command no skill claimed: a generative answer when the backend is
 * configured and produces one, otherwise a web search for the original command.
 *
 * <p>Missing configuration, request errors, timeouts and blank answers are all "no answer".
 * Never throws; the caller presents the result.
 */
@Service
public class FallbackChain {

    private static final Logger LOG = LogManager.getLogger(FallbackChain.class);

    private final GenerativeAnswerBackend answers;
    private final BackendCapabilities capabilities;
    private final ApplicationEventPublisher publisher;

    public FallbackChain(GenerativeAnswerBackend answers,
                         BackendCapabilities capabilities,
                         ApplicationEventPublisher publisher) {
        this.answers = Objects.requireNonNull(answers);
        this.capabilities = Objects.requireNonNull(capabilities);
        this.publisher = Objects.requireNonNull(publisher);
    }

    public FallbackResult resolve(String command) {
        String query = command == null ? "" : command.trim();
        if (!capabilities.generativeAnswer()) {
            return webSearch(query, "not-configured");
        }
        Optional<String> answer;
        try {
            answer = answers.answer(query);
        } catch (RuntimeException e) {
            LOG.warn("Generative answer failed: {}", e.getMessage());
            return webSearch(query, e.getClass().getSimpleName());
        }
        if (answer.isEmpty() || answer.get().isBlank()) {
            return webSearch(query, "no-answer");
        }
        publisher.publishEvent(new FallbackResolvedEvent(FallbackResult.Kind.ANSWER, "answered", Instant.now()));
        return FallbackResult.answer(answer.get());
    }

    private FallbackResult webSearch(String query, String reason) {
        LOG.debug("Falling back to web search ({})", reason);
        publisher.publishEvent(new FallbackResolvedEvent(FallbackResult.Kind.WEB_SEARCH, reason, Instant.now()));
        return FallbackResult.webSearch(query);
    }
}
