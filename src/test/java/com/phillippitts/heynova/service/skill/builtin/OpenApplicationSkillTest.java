package com.phillippitts.heynova.service.skill.builtin;

import com.phillippitts.heynova.domain.DispatchOutcome;
import com.phillippitts.heynova.exception.SkillExecutionException;
import com.phillippitts.heynova.service.action.ApplicationLauncher;
import com.phillippitts.heynova.testutil.RecordingSpeechOutput;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class OpenApplicationSkillTest {

    private final RecordingSpeechOutput speech = new RecordingSpeechOutput();
    private final List<String> launched = new ArrayList<>();
    private boolean failLaunch;

    private final ApplicationLauncher launcher = new ApplicationLauncher() {
        @Override
        public Set<String> availableApplications() {
            return Set.of("calculator", "visual studio code");
        }

        @Override
        public void launch(String name) {
            if (failLaunch) {
                throw new SkillExecutionException("open-application", "exit code 1");
            }
            launched.add(name);
        }
    };

    private final OpenApplicationSkill skill = new OpenApplicationSkill(speech, launcher);

    @Test
    void launchesConfiguredApplication() {
        assertThat(skill.execute("open the calculator app")).isEqualTo(DispatchOutcome.HANDLED);

        assertThat(launched).containsExactly("calculator");
        assertThat(speech.lines()).containsExactly("Opening calculator.");
    }

    @Test
    void claimsMultiWordNames() {
        assertThat(skill.claims("launch visual studio code")).isTrue();
    }

    @Test
    void leavesUnknownApplicationsUnclaimed() {
        assertThat(skill.claims("open photoshop")).isFalse();
    }

    @Test
    void launchFailureIsApologizedFor() {
        failLaunch = true;

        assertThat(skill.execute("start calculator")).isEqualTo(DispatchOutcome.HANDLED);
        assertThat(speech.last()).isEqualTo("Sorry, I couldn't open that application.");
    }
}
