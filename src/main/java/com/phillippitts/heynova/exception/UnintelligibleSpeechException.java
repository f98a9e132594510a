package com.phillippitts.heynova.exception;

/**
 * Audio was captured and reached a backend, but nothing could be recognized in it.
 * Distinct from {@link BackendUnavailableException}: the service answered, the speech was unclear.
 */
public class UnintelligibleSpeechException extends TranscriptionException {

    public UnintelligibleSpeechException(String engineName) {
        super("Speech not recognized", engineName);
    }
}
