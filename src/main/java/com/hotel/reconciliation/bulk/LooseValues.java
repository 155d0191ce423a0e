package com.hotel.reconciliation.bulk;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts numbers from loosely formatted scraped values such as {@code "€ 1,234"},
 * {@code "2,345 reviews"} or {@code "850 m from centre"}.
 * Values without any digit yield null; validation is left to the normalizer.
 */
public final class LooseValues {

    private static final Pattern NUMBER = Pattern.compile("(-?\\d+\\.?\\d*)");
    private static final String[] KILOMETER_UNITS = {"km", "ק\"מ"};

    private LooseValues() {
        // Utility class
    }

    /**
     * First number in the value, thousands separators (commas) removed.
     * A minus sign directly before the digits is kept.
     */
    public static Double extractNumber(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        Matcher matcher = NUMBER.matcher(value.replace(",", "").trim());
        if (!matcher.find()) {
            return null;
        }
        return Double.valueOf(matcher.group(1));
    }

    /**
     * First number in the value, truncated to an integer.
     */
    public static Integer extractInteger(String value) {
        Double number = extractNumber(value);
        if (number == null || number > Integer.MAX_VALUE) {
            return null;
        }
        return number.intValue();
    }

    /**
     * Distance in km. Values stating a kilometer unit are taken as is; anything else
     * (meters or no unit) is read as meters.
     */
    public static Double extractDistanceKm(String value) {
        if (value == null || value.isBlank() || value.trim().equalsIgnoreCase("n/a")) {
            return null;
        }
        Matcher matcher = NUMBER.matcher(value);
        if (!matcher.find()) {
            return null;
        }
        double number = Double.parseDouble(matcher.group(1));
        String lower = value.toLowerCase(Locale.ROOT);
        for (String unit : KILOMETER_UNITS) {
            if (lower.contains(unit)) {
                return number;
            }
        }
        return number / 1000.0;
    }

    /**
     * Trimmed text, or null when blank.
     */
    public static String text(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}
