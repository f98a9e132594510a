package com.phillippitts.heynova.service.skill.builtin;

import com.phillippitts.heynova.domain.DispatchOutcome;
import com.phillippitts.heynova.service.action.BrowserLauncher;
import com.phillippitts.heynova.service.action.SpeechOutput;
import com.phillippitts.heynova.service.skill.AbstractSkill;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * "open youtube", "go to github": opens a site from the {@code skills.websites.*} table.
 * Sites outside the table are not claimed.
 */
public class OpenWebsiteSkill extends AbstractSkill {

    public static final String NAME = "open-website";

    private final Map<String, String> websites;
    private final BrowserLauncher browser;

    public OpenWebsiteSkill(SpeechOutput speech, BrowserLauncher browser, Map<String, String> websites) {
        super(NAME, speech, "^(?:please\\s+)?(?:open|go to|launch|show me)\\s+(.+)$");
        this.browser = Objects.requireNonNull(browser, "browser");
        this.websites = Map.copyOf(websites);
    }

    @Override
    protected boolean accepts(Matcher matcher) {
        return lookup(matcher.group(1)).isPresent();
    }

    @Override
    protected DispatchOutcome perform(String command, Matcher matcher) {
        String site = siteName(matcher.group(1));
        String url = lookup(matcher.group(1)).orElseThrow();
        speech.speak("Opening " + site + ".");
        browser.open(url);
        return DispatchOutcome.HANDLED;
    }

    @Override
    protected String apology() {
        return "Sorry, I couldn't open the browser.";
    }

    Optional<String> lookup(String spoken) {
        String site = siteName(spoken);
        String compact = site.replace(" ", "");
        for (Map.Entry<String, String> entry : websites.entrySet()) {
            String key = entry.getKey();
            if (key.equals(site) || key.replace(" ", "").equals(compact)) {
                return Optional.of(entry.getValue());
            }
        }
        return Optional.empty();
    }

    static String siteName(String spoken) {
        String site = cleanCapture(spoken);
        site = site.replaceFirst("^the\\s+", "");
        site = site.replaceFirst("(?:\\.com|\\s+dot com|\\s+website|\\s+site|\\s+page)$", "");
        return site.trim();
    }
}
