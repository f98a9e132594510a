package com.phillippitts.heynova.service.action;

/**
 * Speaks a line to the user and blocks until it has been spoken.
 *
 * <p>Implementations never throw: a failed speech attempt is logged and the line is lost.
 */
public interface SpeechOutput {

    void speak(String text);
}
