package com.archiver.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.LocalDate;
import java.time.Month;
import java.time.temporal.IsoFields;
import java.util.Comparator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Archive partition key: ISO week-based year and ISO week number.
 * Rendered as "2024-W05".
 */
public record WeekKey(int year, int week) implements Comparable<WeekKey> {

    private static final Pattern FORMAT = Pattern.compile("^(\\d{4})-W(\\d{1,2})$");
    private static final Comparator<WeekKey> ORDER =
        Comparator.comparingInt(WeekKey::year).thenComparingInt(WeekKey::week);

    public WeekKey {
        if (year < 1 || year > 9999) {
            throw new IllegalArgumentException("Year out of range: " + year);
        }
        if (week < 1 || week > weeksIn(year)) {
            throw new IllegalArgumentException("Week out of range for " + year + ": " + week);
        }
    }

    /**
     * Parse the "YYYY-Www" form.
     *
     * @throws IllegalArgumentException if the text is not a week key
     */
    @JsonCreator
    public static WeekKey parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Week key must not be null");
        }
        Matcher m = FORMAT.matcher(text.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("Invalid week key '" + text + "', expected YYYY-Www");
        }
        return new WeekKey(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
    }

    /**
     * Number of ISO weeks in a week-based year: 52, or 53 for long years.
     */
    public static int weeksIn(int year) {
        // Mid-year dates always belong to the week-based year of the same number
        return (int) LocalDate.of(year, Month.JULY, 1).range(IsoFields.WEEK_OF_WEEK_BASED_YEAR).getMaximum();
    }

    @Override
    public int compareTo(WeekKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    @JsonValue
    public String toString() {
        return String.format("%04d-W%02d", year, week);
    }
}
