package com.phillippitts.heynova.service.audio.capture;

import com.phillippitts.heynova.config.audio.AudioCaptureProperties;
import com.phillippitts.heynova.service.audio.AudioFormat;
import com.phillippitts.heynova.service.audio.AudioSilenceDetector;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.Mixer;
import javax.sound.sampled.TargetDataLine;
import java.io.ByteArrayOutputStream;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Java Sound based microphone capture that produces raw PCM16LE mono @16kHz.
 *
 * <p>Each {@link #listen} call opens the line, waits for the RMS level to reach the speech
 * threshold, records until {@code end-silence-ms} of quiet or the phrase limit, and closes the
 * line again. Both bounds are measured in audio bytes read; a wall-clock guard covers devices
 * that stop delivering data. Called only from the assistant loop thread.
 */
@Service
public class JavaSoundAudioCaptureService implements AudioCaptureService {

    private static final Logger LOG = LogManager.getLogger(JavaSoundAudioCaptureService.class);

    /** Audio kept from before the speech onset. */
    static final int PRE_ROLL_MS = 300;

    /** Extra wall-clock allowance on top of the audio-time bounds. */
    private static final long WALL_CLOCK_SLACK_MS = 2_000;
    private static final Duration ERROR_BACKOFF = Duration.ofSeconds(1);

    /** Abstraction to open a TargetDataLine (for testing). */
    public interface DataLineProvider {
        TargetDataLine open(javax.sound.sampled.AudioFormat format, Optional<String> deviceName)
                throws LineUnavailableException;
    }

    private final AudioCaptureProperties props;
    private final ApplicationEventPublisher publisher;
    private final DataLineProvider provider;

    @Autowired
    public JavaSoundAudioCaptureService(AudioCaptureProperties props, ApplicationEventPublisher publisher) {
        this(props, publisher, defaultProvider());
    }

    // Package-private for tests
    JavaSoundAudioCaptureService(AudioCaptureProperties props,
                                 ApplicationEventPublisher publisher,
                                 DataLineProvider provider) {
        this.props = Objects.requireNonNull(props);
        this.publisher = Objects.requireNonNull(publisher);
        this.provider = Objects.requireNonNull(provider);
    }

    @PostConstruct
    public void logSystemInfo() {
        String device = props.getDeviceName() != null ? props.getDeviceName() : "default";
        LOG.info("Audio capture initialized: os={}, device='{}', chunk={}ms, listen-timeout={}ms, "
                        + "phrase-limit={}ms, end-silence={}ms, threshold={}",
                System.getProperty("os.name"), device, props.getChunkMillis(), props.getListenTimeoutMs(),
                props.getPhraseLimitMs(), props.getEndSilenceMs(), props.getSpeechThreshold());
    }

    private static DataLineProvider defaultProvider() {
        return (format, device) -> {
            TargetDataLine line = null;
            if (device.isPresent()) {
                for (Mixer.Info info : AudioSystem.getMixerInfo()) {
                    if (info.getName().equalsIgnoreCase(device.get())) {
                        Mixer m = AudioSystem.getMixer(info);
                        line = (TargetDataLine) m.getLine(new DataLine.Info(TargetDataLine.class, format));
                        break;
                    }
                }
                if (line == null) {
                    LOG.warn("Audio device '{}' not found; using system default", device.get());
                }
            }
            if (line == null) {
                line = (TargetDataLine) AudioSystem.getLine(new DataLine.Info(TargetDataLine.class, format));
            }
            line.open(format);
            return line;
        };
    }

    @Override
    public byte[] listen(Duration listenTimeout, Duration phraseLimit) {
        final javax.sound.sampled.AudioFormat fmt = new javax.sound.sampled.AudioFormat(
                AudioFormat.REQUIRED_SAMPLE_RATE,
                AudioFormat.REQUIRED_BITS_PER_SAMPLE,
                AudioFormat.REQUIRED_CHANNELS,
                AudioFormat.REQUIRED_SIGNED,
                AudioFormat.REQUIRED_BIG_ENDIAN
        );
        TargetDataLine line = null;
        try {
            line = provider.open(fmt, Optional.ofNullable(props.getDeviceName()));
            line.start();
            return capturePhrase(line, listenTimeout, phraseLimit);
        } catch (LineUnavailableException e) {
            LOG.warn("Microphone unavailable: {}", e.getMessage());
            publisher.publishEvent(CaptureErrorEvent.now(CaptureErrorEvent.MIC_UNAVAILABLE));
        } catch (SecurityException se) {
            LOG.warn("Microphone access denied: {}", se.getMessage());
            publisher.publishEvent(CaptureErrorEvent.now(CaptureErrorEvent.MIC_PERMISSION_DENIED));
        } catch (RuntimeException re) {
            LOG.warn("Capture failed: {}", re.toString());
            publisher.publishEvent(CaptureErrorEvent.now(CaptureErrorEvent.CAPTURE_ERROR));
        } finally {
            closeQuietly(line);
        }
        backOff(listenTimeout);
        return new byte[0];
    }

    // Failed opens return at most this late; the caller goes straight back into listen()
    private static void backOff(Duration listenTimeout) {
        long millis = Math.min(listenTimeout.toMillis(), ERROR_BACKOFF.toMillis());
        try {
            Thread.sleep(Math.max(0, millis));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private byte[] capturePhrase(TargetDataLine line, Duration listenTimeout, Duration phraseLimit) {
        final int bytesPerChunk = Math.max(AudioFormat.REQUIRED_BLOCK_ALIGN,
                AudioFormat.bytesFor(props.getChunkMillis()));
        final long listenBytes = AudioFormat.bytesFor(listenTimeout.toMillis());
        final long phraseBytes = AudioFormat.bytesFor(phraseLimit.toMillis());
        final long endSilenceBytes = AudioFormat.bytesFor(props.getEndSilenceMs());
        final long deadline = System.currentTimeMillis()
                + listenTimeout.toMillis() + phraseLimit.toMillis() + WALL_CLOCK_SLACK_MS;

        PcmRingBuffer preRoll = new PcmRingBuffer(AudioFormat.bytesFor(PRE_ROLL_MS));
        ByteArrayOutputStream phrase = null;
        byte[] buf = new byte[bytesPerChunk];
        long waited = 0;
        long recorded = 0;
        long trailingSilence = 0;

        while (System.currentTimeMillis() < deadline && !Thread.currentThread().isInterrupted()) {
            int n = line.read(buf, 0, buf.length);
            if (n < 0) {
                break;
            }
            if (n == 0) {
                continue;
            }
            boolean speech = AudioSilenceDetector.isSpeech(buf, 0, n, props.getSpeechThreshold());

            if (phrase == null) {
                preRoll.write(buf, 0, n);
                waited += n;
                if (speech) {
                    phrase = new ByteArrayOutputStream();
                    byte[] head = preRoll.toByteArray();
                    phrase.write(head, 0, head.length);
                    recorded = head.length;
                    LOG.debug("Speech onset after {} ms", AudioFormat.millisFor(waited));
                } else if (waited >= listenBytes) {
                    LOG.debug("No speech within {} ms", listenTimeout.toMillis());
                    return new byte[0];
                }
                continue;
            }

            phrase.write(buf, 0, n);
            recorded += n;
            trailingSilence = speech ? 0 : trailingSilence + n;
            if (trailingSilence >= endSilenceBytes) {
                LOG.debug("Phrase ended by {} ms of silence", props.getEndSilenceMs());
                break;
            }
            if (recorded >= phraseBytes) {
                LOG.info("Phrase limit reached ({} ms)", phraseLimit.toMillis());
                break;
            }
        }

        if (phrase == null) {
            return new byte[0];
        }
        byte[] pcm = phrase.toByteArray();
        LOG.debug("Audio capture completed: {} bytes ({} ms)", pcm.length, AudioFormat.millisFor(pcm.length));
        return pcm;
    }

    private static void closeQuietly(TargetDataLine line) {
        if (line == null) {
            return;
        }
        try {
            line.stop();
            line.close();
        } catch (RuntimeException e) {
            LOG.debug("Error closing audio line: {}", e.toString());
        }
    }
}
