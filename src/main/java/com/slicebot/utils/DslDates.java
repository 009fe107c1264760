package com.slicebot.utils;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Date tokens used inside slice DSL clauses: {@code 1-Jan-26}, {@code 2026-01-01} or relative {@code -30d}.
 */
public final class DslDates {
    private static final DateTimeFormatter UK = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern("d-MMM-")
            .appendValueReduced(java.time.temporal.ChronoField.YEAR, 2, 2, 2000)
            .toFormatter(Locale.ENGLISH);
    private static final Pattern RELATIVE = Pattern.compile("^-?(\\d+)([dw])$");

    private DslDates() {
    }

    public static LocalDate parse(String token, LocalDate referenceDate) {
        String t = token == null ? "" : token.trim();
        if (t.isEmpty()) {
            if (referenceDate == null) {
                throw new IllegalArgumentException("open-ended date requires a reference date");
            }
            return referenceDate;
        }
        Matcher rel = RELATIVE.matcher(t);
        if (rel.matches()) {
            if (referenceDate == null) {
                throw new IllegalArgumentException("relative date '" + t + "' requires a reference date");
            }
            long amount = Long.parseLong(rel.group(1));
            long days = "w".equals(rel.group(2)) ? amount * 7L : amount;
            return referenceDate.minusDays(days);
        }
        try {
            if (t.length() == 10 && t.charAt(4) == '-') {
                return LocalDate.parse(t);
            }
            return LocalDate.parse(t, UK);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("unparseable date '" + t + "'", e);
        }
    }

    public static String format(LocalDate date) {
        return date == null ? "" : UK.format(date);
    }
}
