package com.phillippitts.heynova.service.skill.builtin;

import com.phillippitts.heynova.domain.DispatchOutcome;
import com.phillippitts.heynova.service.action.SpeechOutput;
import com.phillippitts.heynova.service.action.WebSearchOpener;
import com.phillippitts.heynova.service.skill.AbstractSkill;

import java.util.Objects;
import java.util.regex.Matcher;

/** "search for ...", "google ...", "look up ...": opens a web search for the rest of the command. */
public class SearchSkill extends AbstractSkill {

    public static final String NAME = "search";

    private final WebSearchOpener search;

    public SearchSkill(SpeechOutput speech, WebSearchOpener search) {
        super(NAME, speech,
                "^(?:please\\s+)?(?:search(?:\\s+the\\s+web)?(?:\\s+for)?|google|look up)\\s+(.+)$");
        this.search = Objects.requireNonNull(search, "search");
    }

    @Override
    protected boolean accepts(Matcher matcher) {
        return !cleanCapture(matcher.group(1)).isEmpty();
    }

    @Override
    protected DispatchOutcome perform(String command, Matcher matcher) {
        String query = cleanCapture(matcher.group(1));
        speech.speak("Searching for " + query + ".");
        search.open(query);
        return DispatchOutcome.HANDLED;
    }

    @Override
    protected String apology() {
        return "Sorry, I couldn't open the search.";
    }
}
