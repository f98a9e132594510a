package com.phillippitts.heynova.service.skill.builtin;

import com.phillippitts.heynova.domain.DispatchOutcome;
import com.phillippitts.heynova.service.action.SpeechOutput;
import com.phillippitts.heynova.service.action.TranslationClient;
import com.phillippitts.heynova.service.skill.AbstractSkill;

import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;

/**
 * "translate good morning to spanish", "how do you say thank you in german".
 * An unsupported target language is answered with an apology and still counts as handled.
 */
public class TranslateSkill extends AbstractSkill {

    public static final String NAME = "translate";

    static final Map<String, String> LANGUAGES = Map.ofEntries(
            Map.entry("spanish", "es"),
            Map.entry("french", "fr"),
            Map.entry("german", "de"),
            Map.entry("italian", "it"),
            Map.entry("portuguese", "pt"),
            Map.entry("dutch", "nl"),
            Map.entry("russian", "ru"),
            Map.entry("japanese", "ja"),
            Map.entry("chinese", "zh"),
            Map.entry("korean", "ko"),
            Map.entry("arabic", "ar"),
            Map.entry("hindi", "hi"),
            Map.entry("turkish", "tr"),
            Map.entry("polish", "pl"),
            Map.entry("swedish", "sv"),
            Map.entry("greek", "el"));

    private final TranslationClient client;

    public TranslateSkill(SpeechOutput speech, TranslationClient client) {
        super(NAME, speech,
                "^(?:please\\s+)?translate\\s+(.+?)\\s+(?:to|into|in)\\s+(\\p{L}+)[.!?]*$",
                "^how (?:do|would) (?:you|i) say\\s+(.+?)\\s+in\\s+(\\p{L}+)[.!?]*$");
        this.client = Objects.requireNonNull(client, "client");
    }

    @Override
    protected DispatchOutcome perform(String command, Matcher matcher) {
        String text = cleanCapture(matcher.group(1)).replaceAll("^['\"]|['\"]$", "");
        String language = matcher.group(2);
        String code = LANGUAGES.get(language);
        if (code == null) {
            speech.speak("Sorry, I can't translate to " + language + " yet.");
            return DispatchOutcome.HANDLED;
        }
        String translated = client.translate(text, code);
        speech.speak("In " + capitalize(language) + ", " + text + " is: " + translated);
        return DispatchOutcome.HANDLED;
    }

    @Override
    protected String apology() {
        return "Sorry, I couldn't reach the translation service.";
    }

    private static String capitalize(String word) {
        return word.isEmpty() ? word : Character.toUpperCase(word.charAt(0)) + word.substring(1);
    }
}
