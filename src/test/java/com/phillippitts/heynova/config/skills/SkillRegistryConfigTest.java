package com.phillippitts.heynova.config.skills;

import com.phillippitts.heynova.config.backend.BackendCapabilities;
import com.phillippitts.heynova.domain.DispatchOutcome;
import com.phillippitts.heynova.service.action.ApplicationLauncher;
import com.phillippitts.heynova.service.action.BrowserLauncher;
import com.phillippitts.heynova.service.action.TranslationClient;
import com.phillippitts.heynova.service.action.WeatherClient;
import com.phillippitts.heynova.service.action.WebSearchOpener;
import com.phillippitts.heynova.service.skill.SkillRouter;
import com.phillippitts.heynova.testutil.RecordingSpeechOutput;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SkillRegistryConfigTest {

    private final RecordingSpeechOutput speech = new RecordingSpeechOutput();
    private final Clock clock = Clock.fixed(Instant.parse("2024-03-05T15:05:00Z"), ZoneOffset.UTC);
    private final SkillProperties props = new SkillProperties(null, null, null, null, null, null, null);
    private final BrowserLauncher browser = mock(BrowserLauncher.class);
    private final ApplicationLauncher apps = mock(ApplicationLauncher.class);

    private SkillRouter router(BackendCapabilities caps) {
        when(apps.availableApplications()).thenReturn(Set.of("calculator"));
        when(apps.isAvailable("calculator")).thenReturn(true);
        return new SkillRegistryConfig().skillRouter(speech, clock, props, caps, browser, apps,
                mock(WeatherClient.class), mock(TranslationClient.class), new WebSearchOpener(props, browser));
    }

    @Test
    void registersSkillsInPriorityOrder() {
        SkillRouter router = router(new BackendCapabilities(true, false, false, true, true));

        assertThat(router.skillNames()).containsExactly(
                "exit", "greeting", "time", "date", "open-website", "open-application",
                "weather", "translate", "search");
    }

    @Test
    void leavesOutSkillsWhoseServiceIsNotConfigured() {
        SkillRouter router = router(BackendCapabilities.none());

        assertThat(router.skillNames()).doesNotContain("weather", "translate").contains("search");
        assertThat(router.dispatch("weather in paris")).isEqualTo(DispatchOutcome.UNCLAIMED);
    }

    @Test
    void routesRealCommandsToTheExpectedSkill() {
        SkillRouter router = router(BackendCapabilities.none());

        assertThat(router.route("goodbye").outcome()).isEqualTo(DispatchOutcome.SESSION_END);
        assertThat(router.route("what time is it").skill()).isEqualTo("time");
        assertThat(router.route("open youtube").skill()).isEqualTo("open-website");
        assertThat(router.route("open calculator").skill()).isEqualTo("open-application");
        assertThat(router.route("open photoshop").outcome()).isEqualTo(DispatchOutcome.UNCLAIMED);
        assertThat(router.route("who wrote hamlet").outcome()).isEqualTo(DispatchOutcome.UNCLAIMED);

        verify(browser).open("https://www.youtube.com");
        verify(apps).launch("calculator");
        assertThat(speech.lines()).contains("Goodbye!", "The time is 3:05 PM.");
    }
}
