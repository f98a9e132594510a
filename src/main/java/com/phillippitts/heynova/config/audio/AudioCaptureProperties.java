package com.phillippitts.heynova.config.audio;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for microphone capture.
 *
 * Required format (enforced by service): 16 kHz, 16-bit PCM, mono, little-endian.
 */
@Validated
@ConfigurationProperties(prefix = "audio.capture")
public class AudioCaptureProperties {

    /** Size of a read chunk from the TargetDataLine in milliseconds. */
    @Min(10)
    @Max(200)
    private final int chunkMillis;

    /** How long to wait for speech to start before giving up on a cycle. */
    @Min(500)
    @Max(60_000)
    private final int listenTimeoutMs;

    /** Hard limit on a single phrase once speech has started. */
    @Min(500)
    @Max(120_000)
    private final int phraseLimitMs;

    /** Trailing silence that ends a phrase early. */
    @Min(100)
    @Max(5_000)
    private final int endSilenceMs;

    /** RMS amplitude (16-bit PCM) at or above which a chunk counts as speech. */
    @Min(1)
    @Max(32_767)
    private final int speechThreshold;

    /** Optional input device name hint; falls back to system default when null/blank. */
    private final String deviceName;

    @ConstructorBinding
    public AudioCaptureProperties(Integer chunkMillis,
                                  Integer listenTimeoutMs,
                                  Integer phraseLimitMs,
                                  Integer endSilenceMs,
                                  Integer speechThreshold,
                                  String deviceName) {
        this.chunkMillis = chunkMillis == null ? 50 : chunkMillis;
        this.listenTimeoutMs = listenTimeoutMs == null ? 5_000 : listenTimeoutMs;
        this.phraseLimitMs = phraseLimitMs == null ? 8_000 : phraseLimitMs;
        this.endSilenceMs = endSilenceMs == null ? 800 : endSilenceMs;
        this.speechThreshold = speechThreshold == null ? 800 : speechThreshold;
        this.deviceName = (deviceName == null || deviceName.isBlank()) ? null : deviceName;
    }

    public int getChunkMillis() { return chunkMillis; }
    public int getListenTimeoutMs() { return listenTimeoutMs; }
    public int getPhraseLimitMs() { return phraseLimitMs; }
    public int getEndSilenceMs() { return endSilenceMs; }
    public int getSpeechThreshold() { return speechThreshold; }
    public String getDeviceName() { return deviceName; }

    public Duration listenTimeout() {
        return Duration.ofMillis(listenTimeoutMs);
    }

    public Duration phraseLimit() {
        return Duration.ofMillis(phraseLimitMs);
    }
}
