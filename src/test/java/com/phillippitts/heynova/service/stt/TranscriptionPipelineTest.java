package com.phillippitts.heynova.service.stt;

import com.phillippitts.heynova.config.backend.BackendCapabilities;
import com.phillippitts.heynova.domain.Utterance;
import com.phillippitts.heynova.service.metrics.DispatchMetrics;
import com.phillippitts.heynova.service.stt.event.EngineFailureEvent;
import com.phillippitts.heynova.testutil.EventCapturingPublisher;
import com.phillippitts.heynova.testutil.FakeSttEngine;
import com.phillippitts.heynova.testutil.FakeSttEngine.Failure;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TranscriptionPipelineTest {

    private static final byte[] AUDIO = new byte[3_200];

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final EventCapturingPublisher publisher = new EventCapturingPublisher();

    private TranscriptionPipeline pipeline(FakeSttEngine offline, FakeSttEngine online, boolean offOn, boolean onOn) {
        BackendCapabilities caps = new BackendCapabilities(offOn, onOn, false, false, false);
        TranscriptionPipeline pipeline = new TranscriptionPipeline(offline, online, caps,
                new DispatchMetrics(registry), publisher);
        pipeline.initializeBackends();
        return pipeline;
    }

    @Test
    void offlineResultWinsWithoutCallingOnline() {
        FakeSttEngine offline = new FakeSttEngine("vosk", "Hey Nova, what time is it?");
        FakeSttEngine online = new FakeSttEngine("online", "something else");

        String text = pipeline(offline, online, true, true).transcribe(AUDIO);

        assertThat(text).isEqualTo("hey nova, what time is it?");
        assertThat(online.calls()).isZero();
    }

    @Test
    void fallsThroughToOnlineWhenOfflineHearsNothing() {
        FakeSttEngine offline = new FakeSttEngine("vosk", "");
        FakeSttEngine online = new FakeSttEngine("online", "Open YouTube");

        Utterance utterance = pipeline(offline, online, true, true).transcribeUtterance(AUDIO);

        assertThat(utterance.transcribed()).isEqualTo("Open YouTube");
        assertThat(utterance.normalized()).isEqualTo("open youtube");
        assertThat(offline.calls()).isEqualTo(1);
        assertThat(online.calls()).isEqualTo(1);
    }

    @Test
    void everyFailureKindFallsThroughToNextBackend() {
        for (Failure failure : new Failure[] {Failure.UNINTELLIGIBLE, Failure.UNAVAILABLE, Failure.ERROR}) {
            FakeSttEngine offline = FakeSttEngine.failing("vosk", failure);
            FakeSttEngine online = new FakeSttEngine("online", "hello");

            assertThat(pipeline(offline, online, true, true).transcribe(AUDIO))
                    .as("after %s", failure)
                    .isEqualTo("hello");
        }
    }

    @Test
    void bothBackendsFailingYieldsEmptyText() {
        FakeSttEngine offline = FakeSttEngine.failing("vosk", Failure.ERROR);
        FakeSttEngine online = FakeSttEngine.failing("online", Failure.UNAVAILABLE);

        assertThat(pipeline(offline, online, true, true).transcribe(AUDIO)).isEmpty();
        assertThat(registry.get("heynova.transcription.failure").tag("engine", "online")
                .tag("reason", "unavailable").counter().count()).isEqualTo(1.0);
    }

    @Test
    void emptyAudioNeverReachesABackend() {
        FakeSttEngine offline = new FakeSttEngine("vosk", "hello");
        FakeSttEngine online = new FakeSttEngine("online", "hello");
        TranscriptionPipeline pipeline = pipeline(offline, online, true, true);

        assertThat(pipeline.transcribe(new byte[0])).isEmpty();
        assertThat(pipeline.transcribe(null)).isEmpty();
        assertThat(offline.calls()).isZero();
        assertThat(online.calls()).isZero();
    }

    @Test
    void unconfiguredBackendIsSkipped() {
        FakeSttEngine offline = new FakeSttEngine("vosk", "hello");
        FakeSttEngine online = new FakeSttEngine("online", "from online");

        TranscriptionPipeline pipeline = pipeline(offline, online, false, true);

        assertThat(pipeline.transcribe(AUDIO)).isEqualTo("from online");
        assertThat(pipeline.isOfflineAvailable()).isFalse();
        assertThat(offline.calls()).isZero();
    }

    @Test
    void backendThatFailsToInitializeIsDisabledAndReported() {
        FakeSttEngine offline = new FakeSttEngine("vosk", "hello");
        offline.failInitialize = true;
        FakeSttEngine online = new FakeSttEngine("online", "from online");

        TranscriptionPipeline pipeline = pipeline(offline, online, true, true);

        assertThat(pipeline.isOfflineAvailable()).isFalse();
        assertThat(pipeline.isOnlineAvailable()).isTrue();
        assertThat(pipeline.transcribe(AUDIO)).isEqualTo("from online");
        assertThat(publisher.first(EngineFailureEvent.class).engine()).isEqualTo("vosk");
    }

    @Test
    void noBackendsMeansEverythingIsSilence() {
        TranscriptionPipeline pipeline = pipeline(new FakeSttEngine("vosk", "x"),
                new FakeSttEngine("online", "y"), false, false);

        assertThat(pipeline.transcribe(AUDIO)).isEmpty();
    }

    @Test
    void recordsSuccessPerEngine() {
        pipeline(new FakeSttEngine("vosk", "hello"), new FakeSttEngine("online", ""), true, true)
                .transcribe(AUDIO);

        assertThat(registry.get("heynova.transcription.success").tag("engine", "vosk").counter().count())
                .isEqualTo(1.0);
    }
}
