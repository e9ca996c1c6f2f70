package com.certextract.infrastructure.extraction.template;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes the date notations found on UK certificates to ISO yyyy-MM-dd.
 */
public final class CertificateDates {

    private static final Pattern DAY_FIRST = Pattern.compile("(\\d{1,2})[/\\-.](\\d{1,2})[/\\-.](\\d{2,4})");
    private static final Pattern YEAR_FIRST = Pattern.compile("(\\d{4})[/\\-.](\\d{1,2})[/\\-.](\\d{1,2})");
    private static final Pattern MONTH_NAME = Pattern.compile(
            "(\\d{1,2})(?:st|nd|rd|th)?\\s+(Jan|Feb|Mar|Apr|May|Jun|Jul|Aug|Sep|Oct|Nov|Dec)[a-z]*\\.?\\s+(\\d{4})",
            Pattern.CASE_INSENSITIVE);

    private static final Map<String, Integer> MONTHS = Map.ofEntries(
            Map.entry("jan", 1), Map.entry("feb", 2), Map.entry("mar", 3), Map.entry("apr", 4),
            Map.entry("may", 5), Map.entry("jun", 6), Map.entry("jul", 7), Map.entry("aug", 8),
            Map.entry("sep", 9), Map.entry("oct", 10), Map.entry("nov", 11), Map.entry("dec", 12));

    private CertificateDates() {
    }

    /**
     * @return ISO date, or null when the text holds no valid calendar date
     */
    public static String normalize(String text) {
        if (text == null || text.isBlank()) return null;

        Matcher m = YEAR_FIRST.matcher(text);
        if (m.find()) {
            return toIso(m.group(1), m.group(2), m.group(3));
        }
        m = DAY_FIRST.matcher(text);
        if (m.find()) {
            String year = m.group(3);
            if (year.length() == 2) {
                year = "20" + year;
            } else if (year.length() != 4) {
                return null;
            }
            return toIso(year, m.group(2), m.group(1));
        }
        m = MONTH_NAME.matcher(text);
        if (m.find()) {
            Integer month = MONTHS.get(m.group(2).toLowerCase(Locale.ROOT).substring(0, 3));
            return toIso(m.group(3), String.valueOf(month), m.group(1));
        }
        return null;
    }

    private static String toIso(String year, String month, String day) {
        try {
            return LocalDate.of(Integer.parseInt(year), Integer.parseInt(month), Integer.parseInt(day)).toString();
        } catch (DateTimeException | NumberFormatException e) {
            return null;
        }
    }
}
