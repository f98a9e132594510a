package com.phillippitts.heynova.service.skill.builtin;

import com.phillippitts.heynova.domain.DispatchOutcome;
import com.phillippitts.heynova.service.action.SpeechOutput;
import com.phillippitts.heynova.service.skill.AbstractSkill;

import java.util.regex.Matcher;

/**
 * Ends the session. The whole command must be an exit phrase so that
 * "stop the music" or "search for bye bye birdie" are not taken as a request to quit.
 */
public class ExitSkill extends AbstractSkill {

    public static final String NAME = "exit";

    public ExitSkill(SpeechOutput speech) {
        super(NAME, speech,
                "^(?:please\\s+)?(?:stop|exit|quit|goodbye|good bye|bye|bye bye|go to sleep|shut down|"
                        + "that's all|that is all|thats all)(?:\\s+(?:now|please|for now|for today))?[.!?]*$");
    }

    @Override
    protected DispatchOutcome perform(String command, Matcher matcher) {
        speech.speak("Goodbye!");
        return DispatchOutcome.SESSION_END;
    }

    @Override
    protected String apology() {
        return "Goodbye.";
    }
}
