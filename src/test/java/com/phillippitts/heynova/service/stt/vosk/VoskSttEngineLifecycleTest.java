package com.phillippitts.heynova.service.stt.vosk;

import com.phillippitts.heynova.config.stt.VoskConfig;
import com.phillippitts.heynova.exception.TranscriptionException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VoskSttEngineLifecycleTest {

    private final VoskSttEngine engine = new VoskSttEngine(new VoskConfig("", 16_000, 0), null);

    @Test
    void transcribeBeforeInitializeFails() {
        assertThatThrownBy(() -> engine.transcribe(new byte[320]))
                .isInstanceOf(TranscriptionException.class)
                .hasMessageContaining("not initialized");
    }

    @Test
    void rejectsEmptyAudio() {
        assertThatThrownBy(() -> engine.transcribe(new byte[0]))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void closeWithoutInitializeIsHarmlessAndIdempotent() {
        engine.close();
        engine.close();

        assertThat(engine.isHealthy()).isFalse();
        assertThat(engine.getEngineName()).isEqualTo("vosk");
    }
}
