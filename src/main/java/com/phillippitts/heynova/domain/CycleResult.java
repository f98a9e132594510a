package com.phillippitts.heynova.domain;

import java.util.Optional;

/**
 * What happened to one utterance after transcription.
 *
 * @param stage    furthest stage the utterance reached
 * @param command  command text after wake-word stripping (empty when none)
 * @param skill    name of the claiming skill, or null
 * @param fallback fallback decision when no skill claimed the command, or null
 */
public record CycleResult(Stage stage, String command, String skill, FallbackResult fallback) {

    public enum Stage {
        /** Nothing heard, or the utterance was not addressed to the assistant. */
        IGNORED,
        /** Wake phrase heard with no command; the caller listens once more. */
        AWAITING_COMMAND,
        /** A skill handled the command. */
        HANDLED,
        /** No skill claimed it; a fallback result was presented. */
        FALLBACK,
        /** The exit skill ran. */
        SESSION_END
    }

    public CycleResult {
        command = command == null ? "" : command;
    }

    public static CycleResult ignored() {
        return new CycleResult(Stage.IGNORED, "", null, null);
    }

    public static CycleResult awaitingCommand() {
        return new CycleResult(Stage.AWAITING_COMMAND, "", null, null);
    }

    public static CycleResult handled(String command, String skill, DispatchOutcome outcome) {
        Stage stage = outcome == DispatchOutcome.SESSION_END ? Stage.SESSION_END : Stage.HANDLED;
        return new CycleResult(stage, command, skill, null);
    }

    public static CycleResult fallback(String command, FallbackResult fallback) {
        return new CycleResult(Stage.FALLBACK, command, null, fallback);
    }

    public boolean endsSession() {
        return stage == Stage.SESSION_END;
    }

    public Optional<FallbackResult> fallbackResult() {
        return Optional.ofNullable(fallback);
    }
}
