package com.phillippitts.heynova.service.skill.builtin;

import com.phillippitts.heynova.domain.DispatchOutcome;
import com.phillippitts.heynova.service.action.SpeechOutput;
import com.phillippitts.heynova.service.action.WeatherClient;
import com.phillippitts.heynova.service.action.WeatherReport;
import com.phillippitts.heynova.service.skill.AbstractSkill;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * "what's the weather in paris": current conditions from the {@link WeatherClient}.
 * Registered only when a weather api key is configured.
 */
public class WeatherSkill extends AbstractSkill {

    public static final String NAME = "weather";

    private final WeatherClient client;

    public WeatherSkill(SpeechOutput speech, WeatherClient client) {
        super(NAME, speech,
                "\\b(?:weather|temperature|forecast)\\s+(?:like\\s+)?(?:in|for|at)\\s+(.+)$",
                "\\bhow(?:'s| is) (?:the )?weather (?:in|at) (.+)$");
        this.client = Objects.requireNonNull(client, "client");
    }

    @Override
    protected boolean accepts(Matcher matcher) {
        return !cleanCapture(matcher.group(1)).isEmpty();
    }

    @Override
    protected DispatchOutcome perform(String command, Matcher matcher) {
        String city = cleanCapture(matcher.group(1)).replaceFirst("\\s+(?:today|now|right now)$", "");
        Optional<WeatherReport> report = client.currentWeather(city);
        if (report.isPresent()) {
            speech.speak(report.get().toSentence());
        } else {
            speech.speak("Sorry, I couldn't find the weather for " + city + ".");
        }
        return DispatchOutcome.HANDLED;
    }

    @Override
    protected String apology() {
        return "Sorry, I couldn't get the weather right now.";
    }
}
