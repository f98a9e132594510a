package com.phillippitts.heynova.service.skill.builtin;

import com.phillippitts.heynova.domain.DispatchOutcome;
import com.phillippitts.heynova.service.action.SpeechOutput;
import com.phillippitts.heynova.service.skill.AbstractSkill;

import java.time.Clock;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;

/**
 * Speaks the current time as "The time is 3:05 PM." (12-hour clock, no leading zero).
 */
public class TimeSkill extends AbstractSkill {

    public static final String NAME = "time";

    static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("h:mm a", Locale.US);

    private final Clock clock;

    public TimeSkill(SpeechOutput speech, Clock clock) {
        super(NAME, speech,
                "\\bwhat time is it\\b",
                "\\bwhat(?:'s| is) the time\\b",
                "\\btell me the time\\b",
                "\\b(?:the )?current time\\b",
                "^(?:the )?time(?: please)?[.!?]*$");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    protected DispatchOutcome perform(String command, Matcher matcher) {
        speech.speak(sentence(LocalTime.now(clock)));
        return DispatchOutcome.HANDLED;
    }

    static String sentence(LocalTime time) {
        return "The time is " + FORMAT.format(time) + ".";
    }
}
