package com.phillippitts.heynova.config.skills;

import com.phillippitts.heynova.config.backend.BackendCapabilities;
import com.phillippitts.heynova.service.action.ApplicationLauncher;
import com.phillippitts.heynova.service.action.BrowserLauncher;
import com.phillippitts.heynova.service.action.SpeechOutput;
import com.phillippitts.heynova.service.action.TranslationClient;
import com.phillippitts.heynova.service.action.WeatherClient;
import com.phillippitts.heynova.service.action.WebSearchOpener;
import com.phillippitts.heynova.service.skill.Skill;
import com.phillippitts.heynova.service.skill.SkillRouter;
import com.phillippitts.heynova.service.skill.builtin.DateSkill;
import com.phillippitts.heynova.service.skill.builtin.ExitSkill;
import com.phillippitts.heynova.service.skill.builtin.GreetingSkill;
import com.phillippitts.heynova.service.skill.builtin.OpenApplicationSkill;
import com.phillippitts.heynova.service.skill.builtin.OpenWebsiteSkill;
import com.phillippitts.heynova.service.skill.builtin.SearchSkill;
import com.phillippitts.heynova.service.skill.builtin.TimeSkill;
import com.phillippitts.heynova.service.skill.builtin.TranslateSkill;
import com.phillippitts.heynova.service.skill.builtin.WeatherSkill;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the skill table. List order is match priority: the exit phrase is checked first,
 * specific intents before the open-ended search skill. Skills whose backend is not configured
 * are left out, so their commands fall through to the fallback chain.
 */
@Configuration
public class SkillRegistryConfig {

    @Bean
    public SkillRouter skillRouter(SpeechOutput speech,
                                   Clock clock,
                                   SkillProperties props,
                                   BackendCapabilities capabilities,
                                   BrowserLauncher browser,
                                   ApplicationLauncher applications,
                                   WeatherClient weather,
                                   TranslationClient translation,
                                   WebSearchOpener search) {
        List<Skill> skills = new ArrayList<>();
        skills.add(new ExitSkill(speech));
        skills.add(new GreetingSkill(speech));
        skills.add(new TimeSkill(speech, clock));
        skills.add(new DateSkill(speech, clock));
        skills.add(new OpenWebsiteSkill(speech, browser, props.getWebsites()));
        skills.add(new OpenApplicationSkill(speech, applications));
        if (capabilities.weather()) {
            skills.add(new WeatherSkill(speech, weather));
        }
        if (capabilities.translation()) {
            skills.add(new TranslateSkill(speech, translation));
        }
        skills.add(new SearchSkill(speech, search));
        return new SkillRouter(skills, speech);
    }
}
