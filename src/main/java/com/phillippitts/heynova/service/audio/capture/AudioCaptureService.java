package com.phillippitts.heynova.service.audio.capture;

import java.time.Duration;

/**
 * Microphone capture service.
 *
 * Contract:
 * - Blocks the calling thread for at most {@code listenTimeout + phraseLimit}
 * - Returned data is raw PCM (16kHz, 16-bit, mono, little-endian)
 * - Returns an empty array when no speech started in time or the device failed; never throws
 */
public interface AudioCaptureService {

    /**
     * Waits for speech to start, then records one phrase.
     *
     * @param listenTimeout how long to wait for speech to start
     * @param phraseLimit   maximum length of the recorded phrase
     * @return PCM bytes of the phrase, or an empty array for "no audio"
     */
    byte[] listen(Duration listenTimeout, Duration phraseLimit);
}
