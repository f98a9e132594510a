package com.phillippitts.heynova.service.stt.vosk;

import com.phillippitts.heynova.config.stt.VoskConfig;
import com.phillippitts.heynova.domain.TranscriptionResult;
import com.phillippitts.heynova.exception.TranscriptionException;
import com.phillippitts.heynova.exception.TranscriptionExceptionBuilder;
import com.phillippitts.heynova.service.stt.AbstractSttEngine;
import com.phillippitts.heynova.service.stt.SttEngineNames;
import com.phillippitts.heynova.service.stt.util.EngineEventPublisher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.vosk.Model;
import org.vosk.Recognizer;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;

/**
 * Offline transcription backend backed by the Vosk JNI library.
 *
 * <p>Only the {@link Model} is held; a {@link Recognizer} is created per call and closed
 * afterwards. Empty text is a valid result (silence or unclear audio); the pipeline then
 * moves on to the online backend.
 *
 * <p>Audio contract: raw PCM in the format defined by
 * {@link com.phillippitts.heynova.service.audio.AudioFormat} (16kHz, 16-bit, mono, little-endian).
 */
@Component
public class VoskSttEngine extends AbstractSttEngine {

    private static final Logger LOG = LogManager.getLogger(VoskSttEngine.class);

    /**
     * Maximum accepted JSON response size from the recognizer (1MB).
     */
    private static final int MAX_JSON_SIZE = 1_048_576;

    private final VoskConfig config;
    private final ApplicationEventPublisher publisher;

    // @GuardedBy("lock")
    private Model model;

    public VoskSttEngine(VoskConfig config, ApplicationEventPublisher publisher) {
        this.config = Objects.requireNonNull(config, "config");
        this.publisher = publisher;
    }

    /**
     * Loads the model. Called by {@link #initialize()} within synchronized context.
     *
     * @throws TranscriptionException if model loading fails
     */
    @Override
    protected void doInitialize() {
        LOG.info("Initializing Vosk engine: modelPath={}, sampleRate={}, maxAlternatives={}",
                config.modelPath(), config.sampleRate(), config.maxAlternatives());
        try {
            this.model = new Model(config.modelPath());
            LOG.info("Vosk engine initialized");
        } catch (IOException | RuntimeException | LinkageError e) {
            safeCloseUnlocked();
            EngineEventPublisher.publishFailure(
                publisher,
                SttEngineNames.VOSK,
                "initialize failure",
                e,
                Map.of("modelPath", config.modelPath(),
                       "sampleRate", String.valueOf(config.sampleRate()))
            );
            throw TranscriptionExceptionBuilder
                    .create("Failed to initialize Vosk")
                    .engine(SttEngineNames.VOSK)
                    .cause(e)
                    .metadata("modelPath", config.modelPath())
                    .metadata("sampleRate", config.sampleRate())
                    .build();
        }
    }

    /**
     * @param audioData PCM audio data (16kHz, 16-bit, mono)
     * @return transcription result; text may be empty
     * @throws IllegalArgumentException if audioData is null or empty
     * @throws TranscriptionException if engine not initialized or transcription fails
     */
    @Override
    public TranscriptionResult transcribe(byte[] audioData) {
        if (audioData == null || audioData.length == 0) {
            throw new IllegalArgumentException("audioData must not be null or empty");
        }
        Model localModel = getModelForTranscription();
        try (Recognizer recognizer = new Recognizer(localModel, config.sampleRate())) {
            configureRecognizer(recognizer);
            recognizer.acceptWaveForm(audioData, audioData.length);
            String json = recognizer.getFinalResult();
            LOG.debug("Vosk returned JSON ({} chars)", json == null ? 0 : json.length());

            VoskTranscription transcription = parseVoskJson(json);
            return TranscriptionResult.of(transcription.text(), transcription.confidence(), getEngineName());
        } catch (Exception e) {
            throw handleTranscriptionError(e, publisher, Map.of("audioBytes", String.valueOf(audioData.length)));
        }
    }

    private Model getModelForTranscription() {
        ensureInitialized();
        synchronized (lock) {
            return this.model;
        }
    }

    private void configureRecognizer(Recognizer recognizer) {
        if (config.maxAlternatives() <= 0) {
            return;
        }
        try {
            recognizer.setMaxAlternatives(config.maxAlternatives());
        } catch (NoSuchMethodError e) {
            LOG.debug("Vosk build does not support alternatives; using plain result format");
        }
    }

    @Override
    public String getEngineName() {
        return SttEngineNames.VOSK;
    }

    @Override
    protected void doClose() {
        safeCloseUnlocked();
        LOG.info("Vosk engine closed");
    }

    // GuardedBy: lock (caller must hold lock)
    private void safeCloseUnlocked() {
        if (model != null) {
            try {
                model.close();
            } catch (RuntimeException | LinkageError e) {
                LOG.warn("Error closing model", e);
            }
            model = null;
        }
    }

    /**
     * Extracts text and confidence from a recognizer result.
     *
     * <p>Vosk returns either {@code {"text": "...", "result": [{"conf": ...}]}} or, with
     * alternatives enabled, {@code {"alternatives": [{"text": "...", "confidence": ...}]}}.
     * Unparseable input yields empty text. Package-private for testing.
     *
     * @param json JSON string from Vosk recognizer
     * @return parsed text and confidence clamped to [0.0, 1.0]
     */
    static VoskTranscription parseVoskJson(String json) {
        if (json == null || json.isBlank()) {
            return new VoskTranscription("", 1.0);
        }
        if (json.length() > MAX_JSON_SIZE) {
            LOG.warn("Vosk JSON response exceeds {}B cap (actual: {}B); truncating", MAX_JSON_SIZE, json.length());
            json = json.substring(0, MAX_JSON_SIZE);
        }
        try {
            JSONObject obj = new JSONObject(json);
            if (obj.has("alternatives")) {
                JSONArray alternatives = obj.getJSONArray("alternatives");
                if (alternatives.isEmpty()) {
                    return new VoskTranscription("", 1.0);
                }
                JSONObject first = alternatives.getJSONObject(0);
                // alternatives report unnormalized scores
                return new VoskTranscription(first.optString("text", "").trim(),
                        clamp(first.optDouble("confidence", 1.0)));
            }
            return new VoskTranscription(obj.optString("text", "").trim(), averageWordConfidence(obj));
        } catch (RuntimeException e) {
            LOG.warn("Failed to parse Vosk JSON response: {}", e.getMessage());
            return new VoskTranscription("", 1.0);
        }
    }

    private static double averageWordConfidence(JSONObject obj) {
        JSONArray results = obj.optJSONArray("result");
        if (results == null || results.isEmpty()) {
            return 1.0;
        }
        double sum = 0.0;
        int count = 0;
        for (int i = 0; i < results.length(); i++) {
            JSONObject word = results.getJSONObject(i);
            if (word.has("conf")) {
                sum += word.getDouble("conf");
                count++;
            }
        }
        return count > 0 ? clamp(sum / count) : 1.0;
    }

    private static double clamp(double v) {
        return Math.min(1.0, Math.max(0.0, v));
    }

    /**
     * @param text transcribed text (may be empty)
     * @param confidence confidence score (0.0-1.0)
     */
    record VoskTranscription(String text, double confidence) {
    }
}
