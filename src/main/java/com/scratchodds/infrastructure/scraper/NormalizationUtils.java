package com.scratchodds.infrastructure.scraper;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts raw page text into typed values.
 *
 * <p>None of these methods throw. A value that cannot be parsed comes back as 0 (or
 * {@link #ODDS_NOT_AVAILABLE} for odds), which is indistinguishable from a true zero.
 * Pack cost and max loss rely on zero meaning "unknown", so keep it that way.
 */
public final class NormalizationUtils {

    public static final String ODDS_NOT_AVAILABLE = "N/A";

    private static final Pattern NON_CURRENCY = Pattern.compile("[^0-9.]");
    private static final Pattern NON_DIGIT = Pattern.compile("[^0-9]");
    private static final Pattern ODDS = Pattern.compile("1\\s+in\\s+\\d[\\d,]*(?:\\.\\d+)?", Pattern.CASE_INSENSITIVE);

    private NormalizationUtils() {
    }

    /**
     * Parses dollar amounts like "$1,000,000" to 1000000.
     *
     * Rules:
     * 1. Drop everything except digits and the decimal point
     * 2. Parse what is left as a double
     * 3. Anything empty or unparseable is 0
     */
    public static double parseCurrency(String text) {
        if (text == null) {
            return 0;
        }
        String cleaned = NON_CURRENCY.matcher(text).replaceAll("");
        if (cleaned.isEmpty()) {
            return 0;
        }
        try {
            return Double.parseDouble(cleaned);
        } catch (NumberFormatException e) {
            // "1.2.3" and similar leftovers
            return leadingNumber(cleaned);
        }
    }

    /**
     * Parses grouped counts like "1,234,567 tickets" to 1234567.
     */
    public static long parseCount(String text) {
        if (text == null) {
            return 0;
        }
        String digits = NON_DIGIT.matcher(text).replaceAll("");
        if (digits.isEmpty()) {
            return 0;
        }
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    /**
     * Extracts an odds phrase such as "1 in 4.33".
     *
     * @return the phrase, {@link #ODDS_NOT_AVAILABLE} for blank input, or the trimmed
     *         input itself when it holds no odds phrase
     */
    public static String parseOdds(String text) {
        if (text == null || text.isBlank()) {
            return ODDS_NOT_AVAILABLE;
        }
        return findOdds(text).orElse(text.trim());
    }

    /**
     * Finds the first odds phrase in the text, if there is one.
     */
    public static Optional<String> findOdds(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = ODDS.matcher(text);
        return matcher.find() ? Optional.of(matcher.group().trim()) : Optional.empty();
    }

    private static double leadingNumber(String cleaned) {
        int firstDot = cleaned.indexOf('.');
        int secondDot = cleaned.indexOf('.', firstDot + 1);
        String head = secondDot > 0 ? cleaned.substring(0, secondDot) : cleaned;
        if (head.equals(".")) {
            return 0;
        }
        try {
            return Double.parseDouble(head);
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
