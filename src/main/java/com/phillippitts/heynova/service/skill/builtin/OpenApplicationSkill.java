package com.phillippitts.heynova.service.skill.builtin;

import com.phillippitts.heynova.domain.DispatchOutcome;
import com.phillippitts.heynova.service.action.ApplicationLauncher;
import com.phillippitts.heynova.service.action.SpeechOutput;
import com.phillippitts.heynova.service.skill.AbstractSkill;

import java.util.Objects;
import java.util.regex.Matcher;

/**
 * "open calculator", "launch the terminal app": starts an application whose path is
 * configured and exists. Anything else is not claimed.
 */
public class OpenApplicationSkill extends AbstractSkill {

    public static final String NAME = "open-application";

    private final ApplicationLauncher launcher;

    public OpenApplicationSkill(SpeechOutput speech, ApplicationLauncher launcher) {
        super(NAME, speech, "^(?:please\\s+)?(?:open|launch|start|run)\\s+(.+)$");
        this.launcher = Objects.requireNonNull(launcher, "launcher");
    }

    @Override
    protected boolean accepts(Matcher matcher) {
        return launcher.isAvailable(appName(matcher.group(1)));
    }

    @Override
    protected DispatchOutcome perform(String command, Matcher matcher) {
        String app = appName(matcher.group(1));
        speech.speak("Opening " + app + ".");
        launcher.launch(app);
        return DispatchOutcome.HANDLED;
    }

    @Override
    protected String apology() {
        return "Sorry, I couldn't open that application.";
    }

    static String appName(String spoken) {
        String app = cleanCapture(spoken);
        app = app.replaceFirst("^the\\s+", "");
        app = app.replaceFirst("\\s+(?:app|application|program)$", "");
        return app.trim();
    }
}
