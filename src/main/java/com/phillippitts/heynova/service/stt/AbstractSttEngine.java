package com.phillippitts.heynova.service.stt;

import com.phillippitts.heynova.exception.TranscriptionException;
import com.phillippitts.heynova.service.stt.util.EngineEventPublisher;
import jakarta.annotation.PreDestroy;
import org.springframework.context.ApplicationEventPublisher;

import java.util.Map;

/**
 * Abstract base class for STT engine implementations providing common lifecycle and state management.
 *
 * <p>Template Method: {@link #initialize()} and {@link #close()} are idempotent and synchronized
 * on an internal lock; subclasses supply {@link #doInitialize()} and {@link #doClose()}.
 *
 * <p><b>Lifecycle:</b>
 * <ol>
 *   <li><b>Uninitialized:</b> Engine created but not yet initialized</li>
 *   <li><b>Initialized:</b> {@link #initialize()} called successfully</li>
 *   <li><b>Closed:</b> {@link #close()} called, engine no longer usable</li>
 * </ol>
 *
 * @see com.phillippitts.heynova.service.stt.vosk.VoskSttEngine
 * @see com.phillippitts.heynova.service.stt.online.OnlineSttEngine
 */
public abstract class AbstractSttEngine implements SttEngine {

    /**
     * Guards {@link #initialized} and {@link #closed}.
     */
    protected final Object lock = new Object();

    protected boolean initialized = false;

    protected boolean closed = false;

    /**
     * Initializes the engine once; later calls are no-ops until {@link #close()}.
     *
     * @throws TranscriptionException if initialization fails
     */
    @Override
    public final void initialize() {
        synchronized (lock) {
            if (initialized && !closed) {
                return;
            }
            doInitialize();
            initialized = true;
            closed = false;
        }
    }

    /**
     * Engine-specific initialization, called with {@link #lock} held.
     *
     * @throws TranscriptionException if initialization fails
     */
    protected abstract void doInitialize();

    @Override
    public final boolean isHealthy() {
        synchronized (lock) {
            return initialized && !closed;
        }
    }

    /**
     * Releases engine resources. Idempotent; invoked by the container on shutdown.
     */
    @Override
    @PreDestroy
    public final void close() {
        synchronized (lock) {
            if (closed || !initialized) {
                closed = true;
                return;
            }
            doClose();
            closed = true;
            initialized = false;
        }
    }

    /**
     * Engine-specific cleanup, called with {@link #lock} held. Must not throw.
     */
    protected abstract void doClose();

    /**
     * @throws TranscriptionException if engine is not initialized or is closed
     */
    protected final void ensureInitialized() {
        synchronized (lock) {
            if (!initialized || closed) {
                throw new TranscriptionException(
                    getEngineName() + " engine not initialized or closed",
                    getEngineName()
                );
            }
        }
    }

    /**
     * Publishes a failure event and rethrows as a {@link TranscriptionException}
     * (subtypes pass through unwrapped).
     *
     * <pre>{@code
     * try {
     *     ...
     * } catch (Exception e) {
     *     throw handleTranscriptionError(e, publisher, context);
     * }
     * }</pre>
     *
     * @param exception the exception that occurred during transcription
     * @param publisher Spring event publisher for failure events (may be null)
     * @param context additional context to include in failure event (may be null)
     * @return never returns normally
     */
    protected final TranscriptionException handleTranscriptionError(
            Exception exception,
            ApplicationEventPublisher publisher,
            Map<String, String> context) {

        EngineEventPublisher.publishFailure(
            publisher,
            getEngineName(),
            "transcription failure",
            exception,
            context
        );

        if (exception instanceof TranscriptionException te) {
            throw te;
        }

        throw new TranscriptionException(
            getEngineName() + " transcription failed: " + exception.getMessage(),
            getEngineName(),
            exception
        );
    }
}
