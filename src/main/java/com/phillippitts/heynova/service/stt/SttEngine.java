package com.phillippitts.heynova.service.stt;

import com.phillippitts.heynova.domain.TranscriptionResult;
import com.phillippitts.heynova.exception.BackendUnavailableException;
import com.phillippitts.heynova.exception.TranscriptionException;
import com.phillippitts.heynova.exception.UnintelligibleSpeechException;

/**
 * Contract for Speech-to-Text (STT) backends (Vosk JNI, Whisper-compatible HTTP).
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>Engine is constructed with configuration</li>
 *   <li>{@link #initialize()} loads the model or prepares the client (may throw {@link TranscriptionException})</li>
 *   <li>{@link #transcribe(byte[])} processes audio and returns results</li>
 *   <li>{@link #close()} releases resources when engine is no longer needed</li>
 * </ol>
 *
 * <p>Audio Format: All implementations accept audio in the format defined by
 * {@link com.phillippitts.heynova.service.audio.AudioFormat}:
 * 16kHz, 16-bit signed PCM, mono, little-endian.
 *
 * <p>Engines throw; the {@link TranscriptionPipeline} decides what a failure means.
 */
public interface SttEngine extends AutoCloseable {

    /**
     * Loads the model or prepares the client. Typically called once at startup.
     *
     * @throws TranscriptionException if the engine cannot be prepared
     */
    void initialize();

    /**
     * Transcribes the given audio data to text.
     *
     * @param audioData raw PCM audio, non-empty
     * @return transcription result; text may be empty for engines that report silence that way
     * @throws UnintelligibleSpeechException if the backend answered but recognized nothing
     * @throws BackendUnavailableException if the backend could not be reached or failed
     * @throws TranscriptionException for any other engine failure
     */
    TranscriptionResult transcribe(byte[] audioData);

    /** Stable engine identifier, see {@link SttEngineNames}. */
    String getEngineName();

    /**
     * @return true if initialized and not closed
     */
    boolean isHealthy();

    @Override
    void close();
}
