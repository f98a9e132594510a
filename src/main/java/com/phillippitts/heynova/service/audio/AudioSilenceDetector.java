package com.phillippitts.heynova.service.audio;

/**
 * Energy-based voice activity detection for PCM16LE mono audio.
 *
 * <p>A chunk counts as speech when its RMS (root mean square) amplitude reaches the configured
 * threshold. Values around 500-1000 separate normal speech from room noise for 16-bit PCM.
 * Capture uses this to decide when a phrase starts and when trailing silence ends it.
 *
 * @since 1.0
 */
public final class AudioSilenceDetector {

    private AudioSilenceDetector() {
        // Utility class
    }

    /**
     * @param pcmData PCM16LE audio buffer
     * @param offset first byte to analyze
     * @param length number of bytes to analyze
     * @param threshold RMS amplitude threshold (0-32767)
     * @return true if the window's RMS is at or above {@code threshold}
     */
    public static boolean isSpeech(byte[] pcmData, int offset, int length, int threshold) {
        return calculateRMS(pcmData, offset, length) >= threshold;
    }

    /**
     * Calculates RMS amplitude for a PCM window.
     *
     * @param pcmData PCM16LE audio buffer
     * @param offset starting byte position
     * @param length number of bytes to analyze (trailing odd byte ignored)
     * @return RMS amplitude (0-32767 range for 16-bit PCM), 0 for empty windows
     */
    public static double calculateRMS(byte[] pcmData, int offset, int length) {
        if (pcmData == null || length < 2) {
            return 0;
        }
        long sumSquares = 0;
        int sampleCount = 0;

        for (int i = offset; i + 1 < offset + length && i + 1 < pcmData.length; i += 2) {
            // little-endian: low byte unsigned, high byte carries the sign
            int sample = (pcmData[i] & 0xFF) | (pcmData[i + 1] << 8);
            sumSquares += (long) sample * sample;
            sampleCount++;
        }

        if (sampleCount == 0) {
            return 0;
        }
        return Math.sqrt((double) sumSquares / sampleCount);
    }
}
