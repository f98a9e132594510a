package com.phillippitts.heynova.service.orchestration;

import com.phillippitts.heynova.config.assistant.AssistantProperties;
import com.phillippitts.heynova.config.audio.AudioCaptureProperties;
import com.phillippitts.heynova.domain.CycleResult;
import com.phillippitts.heynova.domain.Utterance;
import com.phillippitts.heynova.service.action.SpeechOutput;
import com.phillippitts.heynova.service.audio.capture.AudioCaptureService;
import com.phillippitts.heynova.service.orchestration.event.SessionEndedEvent;
import com.phillippitts.heynova.service.stt.TranscriptionPipeline;
import com.phillippitts.heynova.util.LogSanitizer;
import com.phillippitts.heynova.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The listen-transcribe-dispatch loop, run on a single {@code assistant-loop} thread.
 *
 * <p>A cycle is fully processed before the next capture starts. A bare wake phrase is answered
 * with "Yes?" and exactly one more utterance is captured for the command. The loop ends after
 * the cycle in which the exit skill ran, or after the cycle in progress when {@link #stop()} is
 * called; a cycle is never aborted mid-flight. Every cycle logs with a {@code cycleId} in the
 * Log4j2 {@link ThreadContext}.
 *
 * <p>Disabled with {@code assistant.loop-enabled=false}.
 */
@Component
public class AssistantLoop implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(AssistantLoop.class);

    static final String CYCLE_ID_KEY = "cycleId";
    static final String PROMPT = "Yes?";
    static final String NOT_CAUGHT = "Sorry, I didn't catch that.";

    private final AudioCaptureService capture;
    private final TranscriptionPipeline pipeline;
    private final CommandDispatcher dispatcher;
    private final SpeechOutput speech;
    private final AssistantProperties assistant;
    private final AudioCaptureProperties audio;
    private final ApplicationEventPublisher publisher;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Thread loopThread;

    public AssistantLoop(AudioCaptureService capture,
                         TranscriptionPipeline pipeline,
                         CommandDispatcher dispatcher,
                         SpeechOutput speech,
                         AssistantProperties assistant,
                         AudioCaptureProperties audio,
                         ApplicationEventPublisher publisher) {
        this.capture = Objects.requireNonNull(capture);
        this.pipeline = Objects.requireNonNull(pipeline);
        this.dispatcher = Objects.requireNonNull(dispatcher);
        this.speech = Objects.requireNonNull(speech);
        this.assistant = Objects.requireNonNull(assistant);
        this.audio = Objects.requireNonNull(audio);
        this.publisher = Objects.requireNonNull(publisher);
    }

    @Override
    public void start() {
        if (!assistant.isLoopEnabled()) {
            LOG.info("Assistant loop disabled (assistant.loop-enabled=false)");
            return;
        }
        if (!running.compareAndSet(false, true)) {
            return;
        }
        // Non-daemon: without a web server this thread keeps the JVM alive
        Thread t = new Thread(this::runLoop, "assistant-loop");
        t.setDaemon(false);
        loopThread = t;
        t.start();
        LOG.info("Assistant loop started; wake phrases: {}", assistant.getWakePhrases());
    }

    /**
     * Requests the loop to end after the current cycle and waits for it.
     */
    @Override
    public void stop() {
        running.set(false);
        Thread t = loopThread;
        if (t == null || t == Thread.currentThread() || !t.isAlive()) {
            return;
        }
        try {
            t.join(ProcessTimeouts.LOOP_STOP_TIMEOUT.toMillis());
            if (t.isAlive()) {
                LOG.warn("Assistant loop did not finish its cycle within {} ms",
                        ProcessTimeouts.LOOP_STOP_TIMEOUT.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for the assistant loop to stop");
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    // Package-private for tests
    void runLoop() {
        try {
            greet();
            while (running.get()) {
                CycleResult result;
                try {
                    result = runCycle();
                } catch (RuntimeException e) {
                    LOG.error("Dispatch cycle failed", e);
                    continue;
                }
                if (result.endsSession()) {
                    LOG.info("Session ended by user");
                    running.set(false);
                    publisher.publishEvent(new SessionEndedEvent("exit-command", Instant.now()));
                }
            }
        } finally {
            // isRunning() must not report a thread that has died
            running.set(false);
            LOG.info("Assistant loop stopped");
        }
    }

    private void greet() {
        try {
            speech.speak(assistant.getGreeting());
        } catch (RuntimeException e) {
            LOG.warn("Greeting could not be spoken: {}", e.getMessage());
        }
    }

    /**
     * One dispatch cycle: capture, transcribe, gate, route.
     */
    CycleResult runCycle() {
        ThreadContext.put(CYCLE_ID_KEY, UUID.randomUUID().toString().substring(0, 8));
        try {
            Utterance heard = listen();
            CycleResult result = dispatcher.handleUtterance(heard.normalized());
            if (result.stage() == CycleResult.Stage.AWAITING_COMMAND) {
                speech.speak(PROMPT);
                Utterance followUp = listen();
                if (followUp.isEmpty() && followUp.raw().length > 0) {
                    speech.speak(NOT_CAUGHT);
                }
                result = dispatcher.handleFollowUp(followUp.normalized());
            }
            LOG.debug("Cycle finished: stage={}, skill={}", result.stage(), result.skill());
            return result;
        } finally {
            ThreadContext.remove(CYCLE_ID_KEY);
        }
    }

    private Utterance listen() {
        byte[] pcm = capture.listen(audio.listenTimeout(), audio.phraseLimit());
        Utterance utterance = pipeline.transcribeUtterance(pcm);
        if (!utterance.isEmpty()) {
            LOG.info("Heard: '{}'", LogSanitizer.preview(utterance.normalized()));
        }
        return utterance;
    }
}
