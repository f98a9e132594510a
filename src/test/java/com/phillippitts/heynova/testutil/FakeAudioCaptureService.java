package com.phillippitts.heynova.testutil;

import com.phillippitts.heynova.service.audio.capture.AudioCaptureService;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test double for AudioCaptureService that "hears" one second of zeroed PCM on every call.
 *
 * <p>Pair it with a mocked pipeline or a {@link FakeSttEngine} to control what is understood.
 */
public class FakeAudioCaptureService implements AudioCaptureService {

    private static final int ONE_SECOND = 32_000;

    private final AtomicInteger listens = new AtomicInteger();

    @Override
    public byte[] listen(Duration listenTimeout, Duration phraseLimit) {
        listens.incrementAndGet();
        return new byte[ONE_SECOND];
    }

    public int listens() {
        return listens.get();
    }
}
