package com.phillippitts.heynova.exception;

/**
 * A configured external backend (online transcription, generative answer, weather,
 * translation) is unreachable, misconfigured, timed out or answered with an error status.
 */
public class BackendUnavailableException extends HeyNovaException {

    private final String backend;

    public BackendUnavailableException(String backend, String message) {
        super(backend + " unavailable: " + message);
        this.backend = backend;
    }

    public BackendUnavailableException(String backend, String message, Throwable cause) {
        super(backend + " unavailable: " + message, cause);
        this.backend = backend;
    }

    public String getBackend() {
        return backend;
    }
}
