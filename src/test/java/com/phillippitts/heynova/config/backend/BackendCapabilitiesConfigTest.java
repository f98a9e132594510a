package com.phillippitts.heynova.config.backend;

import com.phillippitts.heynova.config.answer.AnswerProperties;
import com.phillippitts.heynova.config.skills.SkillProperties;
import com.phillippitts.heynova.config.stt.OnlineSttProperties;
import com.phillippitts.heynova.config.stt.VoskConfig;
import com.phillippitts.heynova.exception.ModelNotFoundException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackendCapabilitiesConfigTest {

    @TempDir
    Path tmp;

    @Test
    void acceptsModelDirectoryWithExpectedLayout() throws IOException {
        Files.createDirectories(tmp.resolve("am"));
        Files.createDirectories(tmp.resolve("conf"));

        BackendCapabilitiesConfig.validateVoskDirectoryStructure(tmp);

        assertThat(BackendCapabilitiesConfig.offlineAvailable(new VoskConfig(tmp.toString(), 16_000, 0))).isTrue();
    }

    @Test
    void rejectsMissingDirectory() {
        Path missing = tmp.resolve("nope");

        assertThatThrownBy(() -> BackendCapabilitiesConfig.validateVoskDirectoryStructure(missing))
                .isInstanceOf(ModelNotFoundException.class)
                .hasMessageContaining("nope");
    }

    @Test
    void incompleteModelDisablesOfflineInsteadOfFailingStartup() throws IOException {
        Files.createDirectories(tmp.resolve("am"));

        assertThat(BackendCapabilitiesConfig.offlineAvailable(new VoskConfig(tmp.toString(), 16_000, 0))).isFalse();
    }

    @Test
    void derivesCapabilitiesFromConfiguration() {
        BackendCapabilities caps = new BackendCapabilitiesConfig().backendCapabilities(
                new VoskConfig("", 16_000, 0),
                new OnlineSttProperties("http://stt.local", "", null, null, 0),
                new AnswerProperties("", null, null, 0, 0),
                new SkillProperties("owm-key", null, "", null, null, null, null));

        assertThat(caps.offlineTranscription()).isFalse();
        assertThat(caps.onlineTranscription()).isTrue();
        assertThat(caps.anyTranscription()).isTrue();
        assertThat(caps.generativeAnswer()).isFalse();
        assertThat(caps.weather()).isTrue();
        assertThat(caps.translation()).isFalse();
    }

    @Test
    void nothingConfiguredMeansNoCapabilities() {
        BackendCapabilities caps = new BackendCapabilitiesConfig().backendCapabilities(
                new VoskConfig(null, 0, 0),
                new OnlineSttProperties(null, null, null, null, 0),
                new AnswerProperties(null, null, null, 0, 0),
                new SkillProperties(null, null, "", null, null, null, null));

        assertThat(caps).isEqualTo(BackendCapabilities.none());
    }

    @Test
    void malformedModelPathDisablesOfflineInsteadOfFailingStartup() {
        VoskConfig malformed = new VoskConfig("models/bad\u0000model", 16_000, 0);

        assertThat(BackendCapabilitiesConfig.offlineAvailable(malformed)).isFalse();

        BackendCapabilities caps = new BackendCapabilitiesConfig().backendCapabilities(
                malformed,
                new OnlineSttProperties(null, null, null, null, 0),
                new AnswerProperties(null, null, null, 0, 0),
                new SkillProperties(null, null, "", null, null, null, null));
        assertThat(caps.offlineTranscription()).isFalse();
    }
}
