package com.phillippitts.heynova.service.skill.builtin;

import com.phillippitts.heynova.domain.DispatchOutcome;
import com.phillippitts.heynova.service.action.SpeechOutput;
import com.phillippitts.heynova.service.skill.AbstractSkill;

import java.util.regex.Matcher;

/** Small talk: hello and how-are-you. */
public class GreetingSkill extends AbstractSkill {

    public static final String NAME = "greeting";

    public GreetingSkill(SpeechOutput speech) {
        super(NAME, speech,
                "^(?:hello|hi|hey|hey there|hi there|good morning|good afternoon|good evening)[.!?]*$",
                "^(?:hi |hello )?how are you(?: doing)?(?: today)?[.!?]*$");
    }

    @Override
    protected DispatchOutcome perform(String command, Matcher matcher) {
        if (command.contains("how are you")) {
            speech.speak("I'm doing well, thanks for asking. How can I help?");
        } else {
            speech.speak("Hello! How can I help?");
        }
        return DispatchOutcome.HANDLED;
    }
}
