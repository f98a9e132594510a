package com.phillippitts.heynova.service.skill;

import com.phillippitts.heynova.domain.DispatchOutcome;

/**
 * One entry of the ordered skill table: a predicate over command text plus the action that
 * runs when the predicate claims the command.
 *
 * <p>{@link #claims(String)} must be side-effect free; {@link SkillRouter} may call it for
 * many skills per command. {@link #execute(String)} runs only for the first claiming skill.
 */
public interface Skill {

    /** Stable name for logs, metrics and events. */
    String name();

    /**
     * @param command normalized command text, never empty
     */
    boolean claims(String command);

    /**
     * Runs the skill's action. Only called after {@link #claims(String)} returned true.
     *
     * @return {@link DispatchOutcome#HANDLED} or {@link DispatchOutcome#SESSION_END}
     */
    DispatchOutcome execute(String command);
}
