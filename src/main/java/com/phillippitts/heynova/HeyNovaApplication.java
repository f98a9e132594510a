package com.phillippitts.heynova;

import com.phillippitts.heynova.config.answer.AnswerProperties;
import com.phillippitts.heynova.config.assistant.AssistantProperties;
import com.phillippitts.heynova.config.audio.AudioCaptureProperties;
import com.phillippitts.heynova.config.skills.SkillProperties;
import com.phillippitts.heynova.config.speech.SpeechProperties;
import com.phillippitts.heynova.config.stt.OnlineSttProperties;
import com.phillippitts.heynova.config.stt.VoskConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        AssistantProperties.class,
        AudioCaptureProperties.class,
        VoskConfig.class,
        OnlineSttProperties.class,
        AnswerProperties.class,
        SpeechProperties.class,
        SkillProperties.class
})
public class HeyNovaApplication {

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(HeyNovaApplication.class);
        // Desktop#browse needs a non-headless AWT toolkit
        app.setHeadless(false);
        app.run(args);
    }

}
