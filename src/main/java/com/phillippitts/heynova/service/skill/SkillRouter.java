package com.phillippitts.heynova.service.skill;

import com.phillippitts.heynova.domain.DispatchOutcome;
import com.phillippitts.heynova.service.action.SpeechOutput;
import com.phillippitts.heynova.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;

/**
 * Routes a command through the ordered skill table. First match wins; there is no scoring.
 *
 * <p>The table is fixed at construction and never changes. Skills are evaluated in
 * registration order and exactly one action runs per command. A failure escaping a skill is
 * logged, apologized for and reported as handled; the next command is unaffected.
 */
public class SkillRouter {

    private static final Logger LOG = LogManager.getLogger(SkillRouter.class);

    static final String FAILURE_APOLOGY = "Sorry, something went wrong with that.";

    private final List<Skill> skills;
    private final SpeechOutput speech;

    public SkillRouter(List<Skill> skills, SpeechOutput speech) {
        this.skills = List.copyOf(skills);
        this.speech = Objects.requireNonNull(speech, "speech");
        LOG.info("Skill table: {}", skillNames());
    }

    /**
     * @param command normalized command text
     * @return the outcome plus the name of the skill that claimed the command (null when none did)
     */
    public RouteResult route(String command) {
        if (command == null || command.isBlank()) {
            return RouteResult.noop();
        }
        for (Skill skill : skills) {
            if (!safeClaims(skill, command)) {
                continue;
            }
            LOG.info("Skill '{}' claimed '{}'", skill.name(), LogSanitizer.preview(command));
            try {
                DispatchOutcome outcome = skill.execute(command);
                if (outcome == null || outcome == DispatchOutcome.UNCLAIMED) {
                    // a claimed command counts as handled
                    outcome = DispatchOutcome.HANDLED;
                }
                return new RouteResult(outcome, skill.name());
            } catch (RuntimeException e) {
                LOG.error("Skill '{}' threw while handling a command", skill.name(), e);
                speech.speak(FAILURE_APOLOGY);
                return new RouteResult(DispatchOutcome.HANDLED, skill.name());
            }
        }
        return RouteResult.unclaimed();
    }

    public DispatchOutcome dispatch(String command) {
        return route(command).outcome();
    }

    private static boolean safeClaims(Skill skill, String command) {
        try {
            return skill.claims(command);
        } catch (RuntimeException e) {
            LOG.warn("Skill '{}' predicate failed; skipping: {}", skill.name(), e.toString());
            return false;
        }
    }

    public List<String> skillNames() {
        return skills.stream().map(Skill::name).toList();
    }

    /**
     * @param outcome dispatch outcome
     * @param skill   claiming skill, or null for a no-op or unclaimed command
     */
    public record RouteResult(DispatchOutcome outcome, String skill) {

        public RouteResult {
            Objects.requireNonNull(outcome, "outcome");
        }

        static RouteResult noop() {
            return new RouteResult(DispatchOutcome.HANDLED, null);
        }

        static RouteResult unclaimed() {
            return new RouteResult(DispatchOutcome.UNCLAIMED, null);
        }
    }
}
