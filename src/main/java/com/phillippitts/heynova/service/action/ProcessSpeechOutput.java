package com.phillippitts.heynova.service.action;

import com.phillippitts.heynova.config.assistant.AssistantProperties;
import com.phillippitts.heynova.config.speech.SpeechProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Speaks through an external text-to-speech program ({@code say}, {@code espeak}, ...).
 *
 * <p>Every line is echoed to the log. When {@code speech.command} is blank the log is the only
 * output. The program gets the line as its last argument and must exit within
 * {@code speech.timeout-ms}; otherwise it is destroyed.
 */
@Component
public class ProcessSpeechOutput implements SpeechOutput {

    private static final Logger LOG = LogManager.getLogger(ProcessSpeechOutput.class);

    private final SpeechProperties props;
    private final String speaker;
    private final ProcessFactory processFactory;

    @Autowired
    public ProcessSpeechOutput(SpeechProperties props, AssistantProperties assistant) {
        this(props, assistant.getDisplayName(), new DefaultProcessFactory());
    }

    // Package-private for tests
    ProcessSpeechOutput(SpeechProperties props, String speaker, ProcessFactory processFactory) {
        this.props = Objects.requireNonNull(props);
        this.speaker = Objects.requireNonNull(speaker);
        this.processFactory = Objects.requireNonNull(processFactory);
    }

    @Override
    public void speak(String text) {
        if (text == null || text.isBlank()) {
            return;
        }
        LOG.info("{} says: {}", speaker, text);
        if (!props.isConfigured()) {
            return;
        }
        List<String> command = new ArrayList<>(props.commandTokens());
        command.add(text);
        try {
            Process process = processFactory.start(command);
            int exit = Processes.awaitExit(process, props.timeout());
            if (exit != 0) {
                LOG.warn("Speech command exited with code {}", exit);
            }
        } catch (IOException e) {
            LOG.warn("Speech command '{}' failed to start: {}", command.get(0), e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while speaking");
        }
    }
}
