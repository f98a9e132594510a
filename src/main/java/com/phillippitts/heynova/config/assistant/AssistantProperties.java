package com.phillippitts.heynova.config.assistant;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.List;
import java.util.Locale;

/**
 * Typed properties for the assistant persona and the dispatch loop.
 *
 * <p>Example application.properties:
 * <pre>
 * assistant.name=nova
 * assistant.wake-phrases=hey nova,okay nova
 * assistant.loop-enabled=true
 * </pre>
 *
 * When no wake phrases are configured they are derived from the name
 * ("hey", "okay", "ok", "hi", "hello" followed by the name).
 */
@Validated
@ConfigurationProperties(prefix = "assistant")
public class AssistantProperties {

    private static final List<String> WAKE_PREFIXES = List.of("hey", "okay", "ok", "hi", "hello");

    @NotBlank
    private final String name;

    @NotEmpty
    private final List<String> wakePhrases;

    /** Spoken once when the loop starts. */
    private final String greeting;

    /** Set to false to keep the microphone loop from starting (tests, headless runs). */
    private final boolean loopEnabled;

    @ConstructorBinding
    public AssistantProperties(String name,
                               List<String> wakePhrases,
                               String greeting,
                               Boolean loopEnabled) {
        this.name = (name == null || name.isBlank()) ? "nova" : name.trim().toLowerCase(Locale.ROOT);
        this.wakePhrases = (wakePhrases == null || wakePhrases.isEmpty())
                ? defaultWakePhrases(this.name)
                : List.copyOf(wakePhrases);
        this.greeting = (greeting == null || greeting.isBlank())
                ? "Hi, I'm " + capitalize(this.name) + ". Say hey " + this.name + " followed by a command."
                : greeting;
        this.loopEnabled = loopEnabled == null ? true : loopEnabled;
    }

    static List<String> defaultWakePhrases(String name) {
        return WAKE_PREFIXES.stream().map(prefix -> prefix + " " + name).toList();
    }

    private static String capitalize(String s) {
        return s.isEmpty() ? s : Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }

    public String getName() {
        return name;
    }

    public String getDisplayName() {
        return capitalize(name);
    }

    public List<String> getWakePhrases() {
        return wakePhrases;
    }

    public String getGreeting() {
        return greeting;
    }

    public boolean isLoopEnabled() {
        return loopEnabled;
    }
}
