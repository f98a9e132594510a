package com.phillippitts.heynova.service.orchestration;

import com.phillippitts.heynova.config.backend.BackendCapabilities;
import com.phillippitts.heynova.config.skills.SkillProperties;
import com.phillippitts.heynova.domain.CycleResult;
import com.phillippitts.heynova.domain.CycleResult.Stage;
import com.phillippitts.heynova.domain.FallbackResult;
import com.phillippitts.heynova.exception.SkillExecutionException;
import com.phillippitts.heynova.service.action.BrowserLauncher;
import com.phillippitts.heynova.service.action.WebSearchOpener;
import com.phillippitts.heynova.service.fallback.FallbackChain;
import com.phillippitts.heynova.service.fallback.GenerativeAnswerBackend;
import com.phillippitts.heynova.service.metrics.DispatchMetrics;
import com.phillippitts.heynova.service.orchestration.event.CommandDispatchedEvent;
import com.phillippitts.heynova.service.skill.SkillRouter;
import com.phillippitts.heynova.service.skill.builtin.ExitSkill;
import com.phillippitts.heynova.service.skill.builtin.TimeSkill;
import com.phillippitts.heynova.service.wake.WakeWordGate;
import com.phillippitts.heynova.testutil.EventCapturingPublisher;
import com.phillippitts.heynova.testutil.RecordingSpeechOutput;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class CommandDispatcherTest {

    private final RecordingSpeechOutput speech = new RecordingSpeechOutput();
    private final EventCapturingPublisher publisher = new EventCapturingPublisher();
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final BrowserLauncher browser = mock(BrowserLauncher.class);
    private final GenerativeAnswerBackend answers = mock(GenerativeAnswerBackend.class);
    private final Clock clock = Clock.fixed(Instant.parse("2024-03-05T15:05:00Z"), ZoneOffset.UTC);

    private CommandDispatcher dispatcher(boolean generativeAnswers) {
        SkillProperties props = new SkillProperties(null, null, null, null, null, null, null);
        SkillRouter router = new SkillRouter(List.of(new ExitSkill(speech), new TimeSkill(speech, clock)), speech);
        BackendCapabilities caps = new BackendCapabilities(true, false, generativeAnswers, false, false);
        return new CommandDispatcher(
                new WakeWordGate(List.of("hey nova", "okay nova")),
                router,
                new FallbackChain(answers, caps, publisher),
                speech,
                new WebSearchOpener(props, browser),
                new DispatchMetrics(registry),
                publisher);
    }

    @Test
    void utteranceWithoutWakePhraseIsIgnored() {
        CycleResult result = dispatcher(true).handleUtterance("what time is it");

        assertThat(result.stage()).isEqualTo(Stage.IGNORED);
        assertThat(speech.lines()).isEmpty();
        verifyNoInteractions(answers, browser);
    }

    @Test
    void bareWakePhraseAwaitsCommand() {
        assertThat(dispatcher(true).handleUtterance("hey nova").stage()).isEqualTo(Stage.AWAITING_COMMAND);
        assertThat(speech.lines()).isEmpty();
    }

    @Test
    void claimedCommandIsHandledBySkill() {
        CycleResult result = dispatcher(true).handleUtterance("hey nova what time is it?");

        assertThat(result.stage()).isEqualTo(Stage.HANDLED);
        assertThat(result.skill()).isEqualTo("time");
        assertThat(result.command()).isEqualTo("what time is it?");
        assertThat(speech.lines()).containsExactly("The time is 3:05 PM.");
        assertThat(registry.get("heynova.skill.invocations").tag("skill", "time").counter().count()).isEqualTo(1.0);
        assertThat(publisher.first(CommandDispatchedEvent.class).skill()).isEqualTo("time");
    }

    @Test
    void exitCommandEndsSession() {
        CycleResult result = dispatcher(true).handleUtterance("okay nova goodbye");

        assertThat(result.endsSession()).isTrue();
        assertThat(speech.lines()).containsExactly("Goodbye!");
    }

    @Test
    void unclaimedCommandIsAnsweredGeneratively() {
        when(answers.answer("who wrote hamlet")).thenReturn(Optional.of("Shakespeare wrote Hamlet."));

        CycleResult result = dispatcher(true).handleUtterance("hey nova who wrote hamlet");

        assertThat(result.stage()).isEqualTo(Stage.FALLBACK);
        assertThat(result.fallbackResult()).contains(FallbackResult.answer("Shakespeare wrote Hamlet."));
        assertThat(speech.lines()).containsExactly("Shakespeare wrote Hamlet.");
        verifyNoInteractions(browser);
    }

    @Test
    void unclaimedCommandWithoutAnswerOpensWebSearch() {
        CycleResult result = dispatcher(false).handleUtterance("hey nova who wrote hamlet");

        assertThat(result.fallbackResult().map(FallbackResult::query)).contains("who wrote hamlet");
        assertThat(speech.lines()).containsExactly("Here is what I found for who wrote hamlet.");
        verify(browser).open("https://www.google.com/search?q=who+wrote+hamlet");
        assertThat(registry.get("heynova.fallback").tag("kind", "web_search").counter().count()).isEqualTo(1.0);
    }

    @Test
    void browserFailureDuringFallbackIsApologizedFor() {
        doThrow(new SkillExecutionException("browser", "no browser")).when(browser).open(anyString());

        CycleResult result = dispatcher(false).dispatchCommand("tell me a joke");

        assertThat(result.stage()).isEqualTo(Stage.FALLBACK);
        assertThat(speech.last()).isEqualTo(CommandDispatcher.BROWSER_APOLOGY);
    }

    @Test
    void followUpDoesNotNeedWakePhrase() {
        CommandDispatcher dispatcher = dispatcher(true);

        assertThat(dispatcher.handleFollowUp("what time is it").skill()).isEqualTo("time");
        assertThat(dispatcher.handleFollowUp("hey nova").stage()).isEqualTo(Stage.IGNORED);
        assertThat(dispatcher.handleFollowUp("").stage()).isEqualTo(Stage.IGNORED);
    }
}
