package com.phillippitts.heynova.service.fallback;

import java.util.Optional;

/**
 * Produces a short spoken-style answer for a free-form question.
 */
public interface GenerativeAnswerBackend {

    /**
     * @param question normalized command text
     * @return the answer, or empty when the backend produced nothing usable
     * @throws com.phillippitts.heynova.exception.BackendUnavailableException on request failure or timeout
     */
    Optional<String> answer(String question);
}
