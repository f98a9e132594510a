package com.phillippitts.heynova.service.wake;

import com.phillippitts.heynova.config.assistant.AssistantProperties;
import com.phillippitts.heynova.service.text.TextNormalizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Decides whether a normalized utterance is addressed to the assistant and isolates the command.
 *
 * <p>Wake phrases match as whole words anywhere in the text: "hey nova" matches
 * "well hey nova play music" but not "heynovascotia" or "hey novak". Words inside a phrase
 * may be separated by whitespace or sentence punctuation ("hey, nova"). Gating runs after
 * normalization, so casing and punctuation noise from the transcription backend never affects
 * matching, and before routing, so skills never see the wake phrase.
 */
@Component
public class WakeWordGate {

    private static final Logger LOG = LogManager.getLogger(WakeWordGate.class);

    // Letters and digits count as word characters; apostrophes and hyphens do not.
    private static final String WORD_START = "(?<![\\p{L}\\p{Nd}])";
    private static final String WORD_END = "(?![\\p{L}\\p{Nd}])";
    // "hey, nova" and "hey nova" are the same phrase
    private static final String WORD_GAP = "[\\s,.!?]+";

    private final List<String> phrases;
    private final Pattern wakePattern;

    @Autowired
    public WakeWordGate(AssistantProperties props) {
        this(props.getWakePhrases());
    }

    public WakeWordGate(List<String> wakePhrases) {
        Objects.requireNonNull(wakePhrases, "wakePhrases must not be null");
        this.phrases = wakePhrases.stream()
                .map(TextNormalizer::normalize)
                .filter(p -> !p.isEmpty())
                .distinct()
                // Longest first so "hello nova" wins over a shorter overlapping phrase
                .sorted(Comparator.comparingInt(String::length).reversed())
                .toList();
        if (phrases.isEmpty()) {
            throw new IllegalArgumentException("At least one non-blank wake phrase is required");
        }
        this.wakePattern = Pattern.compile(phrases.stream()
                .map(WakeWordGate::phraseRegex)
                .collect(Collectors.joining("|", "(?:", ")")));
        LOG.info("Wake phrases: {}", phrases);
    }

    private static String phraseRegex(String phrase) {
        String words = Arrays.stream(phrase.split(" "))
                .map(Pattern::quote)
                .collect(Collectors.joining(WORD_GAP));
        return WORD_START + words + WORD_END;
    }

    /**
     * @param text normalized utterance text
     * @return true if any wake phrase occurs as whole words in {@code text}
     */
    public boolean heardWakeWord(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        return wakePattern.matcher(text.toLowerCase(Locale.ROOT)).find();
    }

    /**
     * Removes every occurrence of every wake phrase (plus punctuation directly attached to it)
     * and re-normalizes the remainder.
     *
     * <p>An empty result means "wake word heard, no command yet": the caller should listen
     * once more rather than dropping the turn.
     *
     * @param text normalized utterance text
     * @return command text, possibly empty
     */
    public String extractCommand(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String stripped = wakePattern.matcher(text.toLowerCase(Locale.ROOT))
                .replaceAll(" ");
        String command = TextNormalizer.normalize(stripped);
        return stripLeadingPunctuation(command);
    }

    private static String stripLeadingPunctuation(String command) {
        int i = 0;
        while (i < command.length() && ",.!?'-".indexOf(command.charAt(i)) >= 0) {
            i++;
        }
        return i == 0 ? command : command.substring(i).trim();
    }

    public List<String> getPhrases() {
        return phrases;
    }
}
