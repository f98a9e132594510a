package com.phillippitts.heynova.service.text;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonicalizes transcribed text into a comparable command string.
 *
 * <p>Steps: lowercase, turn any whitespace run (Unicode spaces included) into a single space, drop every character
 * outside letters, digits, space and {@code ? ! . , ' -}, collapse spaces, trim.
 *
 * <p>Total and idempotent: {@code normalize(normalize(x)).equals(normalize(x))} for every input,
 * and null yields the empty string.
 */
public final class TextNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\p{Z}]+");
    private static final Pattern DISALLOWED = Pattern.compile("[^\\p{L}\\p{Nd} ?!.,'\\-]");
    private static final Pattern SPACES = Pattern.compile(" {2,}");

    private TextNormalizer() {
        // Utility class - prevent instantiation
    }

    public static String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String s = text.toLowerCase(Locale.ROOT);
        s = WHITESPACE.matcher(s).replaceAll(" ");
        s = DISALLOWED.matcher(s).replaceAll("");
        s = SPACES.matcher(s).replaceAll(" ");
        return s.trim();
    }
}
