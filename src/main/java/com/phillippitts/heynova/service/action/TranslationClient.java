package com.phillippitts.heynova.service.action;

import com.phillippitts.heynova.exception.BackendUnavailableException;

/** Machine translation from English. */
public interface TranslationClient {

    /**
     * @param text           English text to translate
     * @param targetLanguage ISO-639-1 code of the target language
     * @return translated text, never blank
     * @throws BackendUnavailableException on network errors, timeouts, error responses or blank results
     */
    String translate(String text, String targetLanguage);
}
