package com.phillippitts.heynova.service.skill.builtin;

import com.phillippitts.heynova.domain.DispatchOutcome;
import com.phillippitts.heynova.service.action.SpeechOutput;
import com.phillippitts.heynova.service.skill.AbstractSkill;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;

/**
 * Speaks today's date as "Today is Monday, October 19, 2026.".
 */
public class DateSkill extends AbstractSkill {

    public static final String NAME = "date";

    static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("EEEE, MMMM d, yyyy", Locale.US);

    private final Clock clock;

    public DateSkill(SpeechOutput speech, Clock clock) {
        super(NAME, speech,
                "\\bwhat(?:'s| is) the date\\b",
                "\\bwhat(?:'s| is) today(?:'s date)?[.!?]*$",
                "\\bwhat day is (?:it|today)\\b",
                "\\btoday's date\\b",
                "\\btell me the date\\b",
                "^(?:the )?date(?: please)?[.!?]*$");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    protected DispatchOutcome perform(String command, Matcher matcher) {
        speech.speak("Today is " + FORMAT.format(LocalDate.now(clock)) + ".");
        return DispatchOutcome.HANDLED;
    }
}
