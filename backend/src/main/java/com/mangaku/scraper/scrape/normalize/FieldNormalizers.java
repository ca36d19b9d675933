package com.mangaku.scraper.scrape.normalize;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pure text-to-value conversions shared by the extraction rules. None of these throw;
 * unparseable input maps to the documented zero value.
 */
public final class FieldNormalizers {
    private static final Pattern SUFFIXED_NUMBER = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s?([KkMm])(?![A-Za-z])");
    private static final Pattern DIGITS = Pattern.compile("\\d+");
    private static final Pattern YEAR = Pattern.compile("\\d{4}");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    public static final String ELLIPSIS = "...";

    private FieldNormalizers() {
    }

    public static long views(String raw) {
        if (isBlankOrDash(raw)) {
            return 0L;
        }
        String cleaned = raw.replace(",", "").trim();
        try {
            Matcher suffixed = SUFFIXED_NUMBER.matcher(cleaned);
            if (suffixed.find()) {
                double value = Double.parseDouble(suffixed.group(1));
                double multiplier = Character.toUpperCase(suffixed.group(2).charAt(0)) == 'M' ? 1_000_000d : 1_000d;
                return (long) (value * multiplier);
            }
            Matcher digits = DIGITS.matcher(cleaned);
            return digits.find() ? Long.parseLong(digits.group()) : 0L;
        } catch (NumberFormatException e) {
            return 0L;
        }
    }

    public static double rating(String raw) {
        if (isBlankOrDash(raw)) {
            return 0.0d;
        }
        try {
            double value = Double.parseDouble(raw.trim());
            if (Double.isNaN(value) || Double.isInfinite(value) || value < 0) {
                return 0.0d;
            }
            return value;
        } catch (NumberFormatException e) {
            return 0.0d;
        }
    }

    public static int firstInt(String raw) {
        if (raw == null) {
            return 0;
        }
        Matcher digits = DIGITS.matcher(raw);
        if (!digits.find()) {
            return 0;
        }
        try {
            return Integer.parseInt(digits.group());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    /**
     * Returns the first four-digit number found in the candidates, checked in order, or
     * {@code fallback} when none has one.
     */
    public static int year(int fallback, String... candidates) {
        for (String candidate : candidates) {
            if (candidate == null) {
                continue;
            }
            Matcher matcher = YEAR.matcher(candidate);
            if (matcher.find()) {
                return Integer.parseInt(matcher.group());
            }
        }
        return fallback;
    }

    public static String collapseWhitespace(String raw) {
        if (raw == null) {
            return "";
        }
        return WHITESPACE.matcher(raw).replaceAll(" ").trim();
    }

    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + ELLIPSIS;
    }

    private static boolean isBlankOrDash(String raw) {
        return raw == null || raw.isBlank() || "-".equals(raw.trim());
    }
}
