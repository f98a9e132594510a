package com.phillippitts.heynova.config.backend;

import com.phillippitts.heynova.config.answer.AnswerProperties;
import com.phillippitts.heynova.config.skills.SkillProperties;
import com.phillippitts.heynova.config.stt.OnlineSttProperties;
import com.phillippitts.heynova.config.stt.VoskConfig;
import com.phillippitts.heynova.exception.ModelNotFoundException;
import com.phillippitts.heynova.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Resolves {@link BackendCapabilities} once at startup.
 *
 * <p>Missing configuration disables a backend silently. A configured but broken Vosk model
 * directory disables offline transcription with a warning instead of aborting startup, so the
 * assistant can still run on the online backend.
 */
@Configuration
public class BackendCapabilitiesConfig {

    private static final Logger LOG = LogManager.getLogger(BackendCapabilitiesConfig.class);

    @Bean
    public BackendCapabilities backendCapabilities(VoskConfig vosk,
                                                   OnlineSttProperties online,
                                                   AnswerProperties answer,
                                                   SkillProperties skills) {
        BackendCapabilities caps = new BackendCapabilities(
                offlineAvailable(vosk),
                online.isConfigured(),
                answer.isConfigured(),
                skills.isWeatherConfigured(),
                skills.isTranslationConfigured());

        LOG.info("Backend capabilities: offlineStt={}, onlineStt={}, generativeAnswer={}, weather={}, translation={}",
                caps.offlineTranscription(), caps.onlineTranscription(), caps.generativeAnswer(),
                caps.weather(), caps.translation());
        if (caps.generativeAnswer()) {
            LOG.info("Generative answers via {} model={} key={}",
                    answer.baseUrl(), answer.model(), LogSanitizer.maskSecret(answer.apiKey()));
        }
        if (!caps.anyTranscription()) {
            LOG.warn("No transcription backend configured; set stt.vosk.model-path or stt.online.url");
        }
        return caps;
    }

    static boolean offlineAvailable(VoskConfig vosk) {
        if (!vosk.isConfigured()) {
            return false;
        }
        try {
            validateVoskDirectoryStructure(Paths.get(vosk.modelPath()));
            return true;
        } catch (ModelNotFoundException e) {
            LOG.warn("Offline transcription disabled: {}", e.getMessage());
            return false;
        } catch (InvalidPathException e) {
            LOG.warn("Offline transcription disabled: malformed stt.vosk.model-path: {}", e.getMessage());
            return false;
        }
    }

    // Package-private to enable hermetic tests without JNI or real model
    static void validateVoskDirectoryStructure(Path modelDir) {
        if (!Files.isDirectory(modelDir)) {
            throw new ModelNotFoundException(modelDir.toString());
        }
        // Layout varies across models; am/ and conf/ are common to all of them
        if (!Files.isDirectory(modelDir.resolve("am")) || !Files.isDirectory(modelDir.resolve("conf"))) {
            throw new ModelNotFoundException(modelDir.toString(), "Missing expected Vosk model subdirectories under");
        }
    }
}
