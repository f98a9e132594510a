package com.phillippitts.heynova.service.orchestration;

import com.phillippitts.heynova.domain.CycleResult;
import com.phillippitts.heynova.domain.FallbackResult;
import com.phillippitts.heynova.service.action.SpeechOutput;
import com.phillippitts.heynova.service.action.WebSearchOpener;
import com.phillippitts.heynova.service.fallback.FallbackChain;
import com.phillippitts.heynova.service.metrics.DispatchMetrics;
import com.phillippitts.heynova.service.orchestration.event.CommandDispatchedEvent;
import com.phillippitts.heynova.service.skill.SkillRouter;
import com.phillippitts.heynova.service.skill.SkillRouter.RouteResult;
import com.phillippitts.heynova.service.wake.WakeWordGate;
import com.phillippitts.heynova.util.LogSanitizer;
import com.phillippitts.heynova.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * Everything after transcription: wake-word gating, skill routing, the fallback chain and
 * presentation of fallback results. Stateless; one call per utterance.
 */
@Service
public class CommandDispatcher {

    private static final Logger LOG = LogManager.getLogger(CommandDispatcher.class);

    static final String BROWSER_APOLOGY = "Sorry, I couldn't open the browser.";

    private final WakeWordGate gate;
    private final SkillRouter router;
    private final FallbackChain fallback;
    private final SpeechOutput speech;
    private final WebSearchOpener search;
    private final DispatchMetrics metrics;
    private final ApplicationEventPublisher publisher;

    public CommandDispatcher(WakeWordGate gate,
                             SkillRouter router,
                             FallbackChain fallback,
                             SpeechOutput speech,
                             WebSearchOpener search,
                             DispatchMetrics metrics,
                             ApplicationEventPublisher publisher) {
        this.gate = Objects.requireNonNull(gate);
        this.router = Objects.requireNonNull(router);
        this.fallback = Objects.requireNonNull(fallback);
        this.speech = Objects.requireNonNull(speech);
        this.search = Objects.requireNonNull(search);
        this.metrics = Objects.requireNonNull(metrics);
        this.publisher = Objects.requireNonNull(publisher);
    }

    /**
     * Handles a freshly heard utterance, which must contain a wake phrase.
     *
     * @param normalized normalized transcription, may be empty
     * @return IGNORED without a wake phrase, AWAITING_COMMAND for a bare wake phrase,
     *         otherwise the dispatch result
     */
    public CycleResult handleUtterance(String normalized) {
        if (normalized == null || normalized.isEmpty()) {
            return CycleResult.ignored();
        }
        if (!gate.heardWakeWord(normalized)) {
            LOG.debug("No wake phrase in '{}'", LogSanitizer.preview(normalized));
            return CycleResult.ignored();
        }
        String command = gate.extractCommand(normalized);
        if (command.isEmpty()) {
            return CycleResult.awaitingCommand();
        }
        return dispatchCommand(command);
    }

    /**
     * Handles the single follow-up utterance after a bare wake phrase. The wake phrase is not
     * required again but is stripped if repeated.
     */
    public CycleResult handleFollowUp(String normalized) {
        String command = gate.extractCommand(normalized);
        if (command.isEmpty()) {
            return CycleResult.ignored();
        }
        return dispatchCommand(command);
    }

    /**
     * Routes a command through the skill table and, when unclaimed, the fallback chain.
     */
    public CycleResult dispatchCommand(String command) {
        long start = System.nanoTime();
        LOG.info("Command: '{}'", LogSanitizer.preview(command));

        RouteResult route = router.route(command);
        CycleResult result;
        if (route.outcome().isHandled()) {
            if (route.skill() != null) {
                metrics.incrementSkill(route.skill(), route.outcome().name().toLowerCase(Locale.ROOT));
            }
            result = CycleResult.handled(command, route.skill(), route.outcome());
        } else {
            FallbackResult resolved = fallback.resolve(command);
            present(resolved);
            metrics.incrementFallback(resolved.kind().name().toLowerCase(Locale.ROOT));
            result = CycleResult.fallback(command, resolved);
        }

        long elapsed = System.nanoTime() - start;
        metrics.recordDispatchLatency(elapsed);
        publisher.publishEvent(new CommandDispatchedEvent(result.stage(), result.skill(),
                TimeUtils.nanosToMillis(elapsed), Instant.now()));
        return result;
    }

    void present(FallbackResult result) {
        if (result.isAnswer()) {
            speech.speak(result.answer());
            return;
        }
        speech.speak("Here is what I found for " + result.query() + ".");
        try {
            search.open(result.query());
        } catch (RuntimeException e) {
            LOG.warn("Web search could not be opened: {}", e.getMessage());
            speech.speak(BROWSER_APOLOGY);
        }
    }
}
