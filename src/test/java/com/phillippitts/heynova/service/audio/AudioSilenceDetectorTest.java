package com.phillippitts.heynova.service.audio;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class AudioSilenceDetectorTest {

    private static byte[] constant(short sample, int samples) {
        byte[] pcm = new byte[samples * 2];
        for (int i = 0; i < pcm.length; i += 2) {
            pcm[i] = (byte) (sample & 0xFF);
            pcm[i + 1] = (byte) ((sample >> 8) & 0xFF);
        }
        return pcm;
    }

    @Test
    void rmsOfConstantSignalIsItsAmplitude() {
        assertThat(AudioSilenceDetector.calculateRMS(constant((short) -1_000, 160), 0, 320))
                .isCloseTo(1_000.0, within(0.01));
    }

    @Test
    void speechThresholdIsInclusive() {
        byte[] pcm = constant((short) 800, 160);

        assertThat(AudioSilenceDetector.isSpeech(pcm, 0, pcm.length, 800)).isTrue();
        assertThat(AudioSilenceDetector.isSpeech(pcm, 0, pcm.length, 801)).isFalse();
    }

    @Test
    void emptyWindowIsSilent() {
        assertThat(AudioSilenceDetector.calculateRMS(new byte[1], 0, 1)).isZero();
        assertThat(AudioSilenceDetector.calculateRMS(null, 0, 10)).isZero();
    }

    @Test
    void framesAreMillisecondAligned() {
        assertThat(AudioFormat.bytesFor(20)).isEqualTo(640);
        assertThat(AudioFormat.millisFor(32_000)).isEqualTo(1_000);
    }
}
