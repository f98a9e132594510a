package com.phillippitts.heynova.service.skill;

import com.phillippitts.heynova.domain.DispatchOutcome;
import com.phillippitts.heynova.service.action.SpeechOutput;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Base class for pattern-matched skills.
 *
 * <p>A command is claimed when one of the skill's patterns is found in it and
 * {@link #accepts(Matcher)} agrees, e.g. when a captured site name is in the configured table.
 * {@link #execute(String)} is a template method: failures thrown by {@link #perform} are
 * logged, answered with the skill's {@link #apology()} and reported as
 * {@link DispatchOutcome#HANDLED}, so a broken collaborator never reaches the router.
 */
public abstract class AbstractSkill implements Skill {

    private static final Logger LOG = LogManager.getLogger(AbstractSkill.class);

    private final String name;
    private final List<Pattern> patterns;
    protected final SpeechOutput speech;

    protected AbstractSkill(String name, SpeechOutput speech, String... regexes) {
        this.name = Objects.requireNonNull(name, "name");
        this.speech = Objects.requireNonNull(speech, "speech");
        if (regexes.length == 0) {
            throw new IllegalArgumentException("A skill needs at least one pattern: " + name);
        }
        this.patterns = Arrays.stream(regexes).map(Pattern::compile).toList();
    }

    @Override
    public final String name() {
        return name;
    }

    @Override
    public boolean claims(String command) {
        return match(command).isPresent();
    }

    protected final Optional<Matcher> match(String command) {
        if (command == null || command.isEmpty()) {
            return Optional.empty();
        }
        for (Pattern pattern : patterns) {
            Matcher m = pattern.matcher(command);
            if (m.find() && accepts(m)) {
                return Optional.of(m);
            }
        }
        return Optional.empty();
    }

    /**
     * Extra claim check on a successful match. Default accepts every match.
     */
    protected boolean accepts(Matcher matcher) {
        return true;
    }

    @Override
    public final DispatchOutcome execute(String command) {
        Optional<Matcher> matcher = match(command);
        if (matcher.isEmpty()) {
            throw new IllegalStateException("Skill '" + name + "' executed for a command it does not claim");
        }
        try {
            return perform(command, matcher.get());
        } catch (RuntimeException e) {
            LOG.warn("Skill '{}' failed: {}", name, e.toString());
            LOG.debug("Skill '{}' failure detail", name, e);
            speech.speak(apology());
            return DispatchOutcome.HANDLED;
        }
    }

    /**
     * Runs the action for a claimed command.
     *
     * @param command normalized command text
     * @param matcher the successful match, for capture groups
     */
    protected abstract DispatchOutcome perform(String command, Matcher matcher);

    /** Spoken when {@link #perform} fails. */
    protected String apology() {
        return "Sorry, I couldn't do that.";
    }

    /** Trims a captured group and drops trailing sentence punctuation. */
    protected static String cleanCapture(String group) {
        if (group == null) {
            return "";
        }
        return group.replaceAll("[\\s.,!?]+$", "").trim();
    }
}
