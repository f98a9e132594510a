package com.phillippitts.heynova.domain;

import java.util.Objects;

/**
 * Decision of the fallback chain for a command no skill claimed: either a generative
 * answer to speak, or a web search to open with the original command as query.
 *
 * @param kind   which fallback tier produced the result
 * @param answer generative answer text (non-empty for {@link Kind#ANSWER}, empty otherwise)
 * @param query  search query (the original command for {@link Kind#WEB_SEARCH}, empty otherwise)
 */
public record FallbackResult(Kind kind, String answer, String query) {

    public enum Kind { ANSWER, WEB_SEARCH }

    public FallbackResult {
        Objects.requireNonNull(kind, "kind must not be null");
        answer = answer == null ? "" : answer;
        query = query == null ? "" : query;
        if (kind == Kind.ANSWER && answer.isBlank()) {
            throw new IllegalArgumentException("A generative answer must not be blank");
        }
    }

    public static FallbackResult answer(String answer) {
        return new FallbackResult(Kind.ANSWER, answer.trim(), "");
    }

    public static FallbackResult webSearch(String query) {
        return new FallbackResult(Kind.WEB_SEARCH, "", query);
    }

    public boolean isAnswer() {
        return kind == Kind.ANSWER;
    }
}
