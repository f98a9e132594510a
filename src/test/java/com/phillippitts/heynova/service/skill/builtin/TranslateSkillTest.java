package com.phillippitts.heynova.service.skill.builtin;

import com.phillippitts.heynova.domain.DispatchOutcome;
import com.phillippitts.heynova.exception.BackendUnavailableException;
import com.phillippitts.heynova.service.action.TranslationClient;
import com.phillippitts.heynova.testutil.RecordingSpeechOutput;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class TranslateSkillTest {

    private final RecordingSpeechOutput speech = new RecordingSpeechOutput();
    private final TranslationClient client = mock(TranslationClient.class);
    private final TranslateSkill skill = new TranslateSkill(speech, client);

    @Test
    void translatesToSupportedLanguage() {
        when(client.translate("good morning", "es")).thenReturn("buenos días");

        assertThat(skill.execute("translate good morning to spanish")).isEqualTo(DispatchOutcome.HANDLED);
        assertThat(speech.lines()).containsExactly("In Spanish, good morning is: buenos días");
    }

    @Test
    void understandsHowDoYouSay() {
        when(client.translate("thank you", "de")).thenReturn("danke");

        skill.execute("how do you say thank you in german?");

        assertThat(speech.last()).isEqualTo("In German, thank you is: danke");
    }

    @Test
    void unsupportedLanguageIsHandledWithoutCallingService() {
        assertThat(skill.execute("translate hello to klingon")).isEqualTo(DispatchOutcome.HANDLED);

        assertThat(speech.lines()).containsExactly("Sorry, I can't translate to klingon yet.");
        verifyNoInteractions(client);
    }

    @Test
    void serviceOutageIsApologizedFor() {
        when(client.translate(anyString(), anyString()))
                .thenThrow(new BackendUnavailableException("translation", "timeout"));

        skill.execute("translate cat into french");

        assertThat(speech.last()).isEqualTo("Sorry, I couldn't reach the translation service.");
    }
}
