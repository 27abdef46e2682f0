package com.bulk.ingest.pipeline;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the date layouts found in invoice exports and normalizes them to {@link LocalDate}.
 *
 * <p>Accepted: {@code YYYY-MM-DD} (also with '/' or '.'), {@code DD/MM/YYYY}, {@code DD-MM-YYYY},
 * {@code DD.MM.YYYY}, and the day-first forms with a two-digit year. Two-digit years below the
 * pivot land in the 2000s, the rest in the 1900s. Impossible dates such as 31/02 are rejected.
 */
public class DateNormalizer {

    private static final Pattern YEAR_FIRST = Pattern.compile("^(\\d{4})[-/.](\\d{1,2})[-/.](\\d{1,2})$");
    private static final Pattern DAY_FIRST = Pattern.compile("^(\\d{1,2})[-/.](\\d{1,2})[-/.](\\d{4}|\\d{2})$");

    private final int twoDigitYearPivot;

    public DateNormalizer(int twoDigitYearPivot) {
        this.twoDigitYearPivot = twoDigitYearPivot;
    }

    public Optional<LocalDate> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String value = stripTime(raw.trim());

        Matcher matcher = YEAR_FIRST.matcher(value);
        if (matcher.matches()) {
            return toDate(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)),
                    Integer.parseInt(matcher.group(3)));
        }

        matcher = DAY_FIRST.matcher(value);
        if (matcher.matches()) {
            int year = Integer.parseInt(matcher.group(3));
            if (matcher.group(3).length() == 2) {
                year += year < twoDigitYearPivot ? 2000 : 1900;
            }
            return toDate(year, Integer.parseInt(matcher.group(2)), Integer.parseInt(matcher.group(1)));
        }
        return Optional.empty();
    }

    // "2024-03-01T10:15:00" and "2024-03-01 10:15" carry a usable date part
    private static String stripTime(String value) {
        if (value.length() > 10 && (value.charAt(10) == 'T' || value.charAt(10) == ' ')) {
            return value.substring(0, 10);
        }
        return value;
    }

    private static Optional<LocalDate> toDate(int year, int month, int day) {
        try {
            return Optional.of(LocalDate.of(year, month, day));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }
}
