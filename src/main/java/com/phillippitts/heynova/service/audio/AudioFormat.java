package com.phillippitts.heynova.service.audio;

/**
 * Single source of truth for captured audio format.
 * Required: 16 kHz, 16-bit signed PCM, mono, little-endian.
 */
public final class AudioFormat {

    /** Required sample rate in Hz. */
    public static final int REQUIRED_SAMPLE_RATE = 16_000;
    /** Required bits per sample. */
    public static final int REQUIRED_BITS_PER_SAMPLE = 16;
    /** Required number of channels (mono). */
    public static final int REQUIRED_CHANNELS = 1;

    /** Required signed PCM flag for Java Sound. */
    public static final boolean REQUIRED_SIGNED = true;
    /** Required endian flag for Java Sound (false = little-endian). */
    public static final boolean REQUIRED_BIG_ENDIAN = false;

    /** Bytes per PCM frame (sample for all channels). */
    public static final int REQUIRED_BLOCK_ALIGN = (REQUIRED_BITS_PER_SAMPLE / 8) * REQUIRED_CHANNELS; // 2 bytes
    /** Bytes per second at required format. */
    public static final int REQUIRED_BYTE_RATE = REQUIRED_SAMPLE_RATE * REQUIRED_BLOCK_ALIGN;           // 32,000

    public static final int WAV_HEADER_SIZE = 44;

    private AudioFormat() {}

    /** Number of PCM bytes covering {@code millis} of audio, aligned to whole frames. */
    public static int bytesFor(long millis) {
        long bytes = (millis * REQUIRED_BYTE_RATE) / 1000L;
        bytes -= bytes % REQUIRED_BLOCK_ALIGN;
        return (int) Math.min(Integer.MAX_VALUE - REQUIRED_BLOCK_ALIGN, bytes);
    }

    /** Playback duration of {@code bytes} of PCM in milliseconds. */
    public static long millisFor(long bytes) {
        return (bytes * 1000L) / REQUIRED_BYTE_RATE;
    }
}
