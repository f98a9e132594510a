package com.phillippitts.heynova.domain;

import com.phillippitts.heynova.service.text.TextNormalizer;

import java.util.Objects;

/**
 * One captured utterance in its three progressive forms.
 *
 * <p>{@code normalized} is always {@code TextNormalizer.normalize(transcribed)}; the canonical
 * constructor rejects any other combination. Lives for a single dispatch cycle.
 *
 * @param raw         captured PCM audio (empty when nothing was heard)
 * @param transcribed best-effort text from whichever backend succeeded, or empty
 * @param normalized  cleaned text used for wake-word gating and routing
 */
public record Utterance(byte[] raw, String transcribed, String normalized) {

    private static final byte[] NO_AUDIO = new byte[0];

    public Utterance {
        raw = raw == null ? NO_AUDIO : raw;
        Objects.requireNonNull(transcribed, "transcribed must not be null");
        Objects.requireNonNull(normalized, "normalized must not be null");
        if (!normalized.equals(TextNormalizer.normalize(transcribed))) {
            throw new IllegalArgumentException("normalized text must be derived from transcribed text");
        }
    }

    public static Utterance of(byte[] raw, String transcribed) {
        String text = transcribed == null ? "" : transcribed;
        return new Utterance(raw, text, TextNormalizer.normalize(text));
    }

    /** Nothing captured, or nothing usable was understood. */
    public static Utterance silence(byte[] raw) {
        return new Utterance(raw, "", "");
    }

    public boolean isEmpty() {
        return normalized.isEmpty();
    }
}
