package com.phillippitts.heynova.service.stt;

import com.phillippitts.heynova.config.backend.BackendCapabilities;
import com.phillippitts.heynova.domain.TranscriptionResult;
import com.phillippitts.heynova.domain.Utterance;
import com.phillippitts.heynova.exception.BackendUnavailableException;
import com.phillippitts.heynova.exception.UnintelligibleSpeechException;
import com.phillippitts.heynova.service.metrics.DispatchMetrics;
import com.phillippitts.heynova.service.stt.util.EngineEventPublisher;
import com.phillippitts.heynova.util.LogSanitizer;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.Objects;

/**
 * Turns captured audio into normalized text, offline backend first, online backend second.
 *
 * <p>Never throws. Empty or null audio short-circuits to "" without touching any backend;
 * a backend that fails, times out or hears nothing counts as "no result" and the next one is
 * tried. Which backends take part is decided once at startup from {@link BackendCapabilities}
 * and the outcome of {@link SttEngine#initialize()}.
 */
@Service
public class TranscriptionPipeline {

    private static final Logger LOG = LogManager.getLogger(TranscriptionPipeline.class);

    private final SttEngine offline;
    private final SttEngine online;
    private final BackendCapabilities capabilities;
    private final DispatchMetrics metrics;
    private final ApplicationEventPublisher publisher;

    private boolean offlineAvailable;
    private boolean onlineAvailable;

    public TranscriptionPipeline(SttEngine voskSttEngine,
                                 SttEngine onlineSttEngine,
                                 BackendCapabilities capabilities,
                                 DispatchMetrics metrics,
                                 ApplicationEventPublisher publisher) {
        this.offline = Objects.requireNonNull(voskSttEngine, "voskSttEngine");
        this.online = Objects.requireNonNull(onlineSttEngine, "onlineSttEngine");
        this.capabilities = Objects.requireNonNull(capabilities, "capabilities");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.publisher = publisher;
    }

    @PostConstruct
    public void initializeBackends() {
        offlineAvailable = capabilities.offlineTranscription() && tryInitialize(offline);
        onlineAvailable = capabilities.onlineTranscription() && tryInitialize(online);
        LOG.info("Transcription backends: offline={}, online={}", offlineAvailable, onlineAvailable);
        if (!offlineAvailable && !onlineAvailable) {
            LOG.warn("No transcription backend available; every utterance will be treated as silence");
        }
    }

    private boolean tryInitialize(SttEngine engine) {
        try {
            engine.initialize();
            return true;
        } catch (RuntimeException | LinkageError e) {
            LOG.warn("Transcription backend '{}' disabled: {}", engine.getEngineName(), e.getMessage());
            EngineEventPublisher.publishFailure(publisher, engine.getEngineName(), "initialize failure", e);
            return false;
        }
    }

    /**
     * @param audio raw PCM, may be null or empty
     * @return normalized text, or "" when nothing usable was understood
     */
    public String transcribe(byte[] audio) {
        return transcribeUtterance(audio).normalized();
    }

    /**
     * @param audio raw PCM, may be null or empty
     * @return the utterance in raw, transcribed and normalized form
     */
    public Utterance transcribeUtterance(byte[] audio) {
        if (audio == null || audio.length == 0) {
            return Utterance.silence(audio);
        }
        if (offlineAvailable) {
            String text = attempt(offline, audio);
            if (!text.isBlank()) {
                return Utterance.of(audio, text);
            }
        }
        if (onlineAvailable) {
            String text = attempt(online, audio);
            if (!text.isBlank()) {
                return Utterance.of(audio, text);
            }
        }
        return Utterance.silence(audio);
    }

    private String attempt(SttEngine engine, byte[] audio) {
        String name = engine.getEngineName();
        long start = System.nanoTime();
        try {
            TranscriptionResult result = engine.transcribe(audio);
            metrics.recordTranscriptionLatency(name, System.nanoTime() - start);
            if (result == null || result.isEmpty()) {
                LOG.debug("Backend '{}' heard nothing", name);
                metrics.incrementTranscriptionFailure(name, "unintelligible");
                return "";
            }
            metrics.incrementTranscriptionSuccess(name);
            LOG.info("Heard via {}: '{}'", name, LogSanitizer.preview(result.text()));
            return result.text();
        } catch (UnintelligibleSpeechException e) {
            LOG.info("Backend '{}' could not understand the audio", name);
            metrics.incrementTranscriptionFailure(name, "unintelligible");
        } catch (BackendUnavailableException e) {
            LOG.warn("Backend '{}' unavailable: {}", name, e.getMessage());
            metrics.incrementTranscriptionFailure(name, "unavailable");
        } catch (RuntimeException | LinkageError e) {
            LOG.warn("Backend '{}' failed: {}", name, e.toString());
            metrics.incrementTranscriptionFailure(name, "error");
        }
        return "";
    }

    public boolean isOfflineAvailable() {
        return offlineAvailable;
    }

    public boolean isOnlineAvailable() {
        return onlineAvailable;
    }
}
