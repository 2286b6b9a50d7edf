package com.paramkit.codec;

import lombok.experimental.UtilityClass;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient scalar parsing. Reads the longest numeric prefix after leading
 * whitespace, the way stream extraction does, and falls back to zero.
 */
@UtilityClass
public class ScalarText {

    private static final Pattern INTEGER_PREFIX = Pattern.compile("[+-]?\\d+");

    private static final Pattern DECIMAL_PREFIX = Pattern.compile(
            "[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    public static int parseInt(String text) {
        String prefix = prefix(INTEGER_PREFIX, text);
        if (prefix == null) {
            return 0;
        }
        try {
            return Integer.parseInt(prefix);
        } catch (NumberFormatException e) {
            // out of int range
            return 0;
        }
    }

    public static double parseDouble(String text) {
        String special = special(text);
        if (special != null) {
            return Double.parseDouble(special);
        }
        String prefix = prefix(DECIMAL_PREFIX, text);
        return prefix == null ? 0.0 : Double.parseDouble(prefix);
    }

    public static float parseFloat(String text) {
        String special = special(text);
        if (special != null) {
            return Float.parseFloat(special);
        }
        String prefix = prefix(DECIMAL_PREFIX, text);
        return prefix == null ? 0.0f : Float.parseFloat(prefix);
    }

    /**
     * "true"/"yes" and "false"/"no" (any case), otherwise a positive integer prefix.
     */
    public static boolean parseBoolean(String text) {
        String trimmed = text == null ? "" : text.trim();
        if (trimmed.equalsIgnoreCase("true") || trimmed.equalsIgnoreCase("yes")) {
            return true;
        }
        if (trimmed.equalsIgnoreCase("false") || trimmed.equalsIgnoreCase("no")) {
            return false;
        }
        return parseInt(trimmed) > 0;
    }

    private static String prefix(Pattern pattern, String text) {
        if (text == null) {
            return null;
        }
        Matcher matcher = pattern.matcher(text.strip());
        return matcher.lookingAt() ? matcher.group() : null;
    }

    // Double.toString/Float.toString spellings of the non-finite values
    private static String special(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.strip();
        return switch (trimmed) {
            case "NaN", "Infinity", "-Infinity" -> trimmed;
            default -> null;
        };
    }
}
