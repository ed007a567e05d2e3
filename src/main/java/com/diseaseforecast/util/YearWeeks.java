package com.diseaseforecast.util;

import com.diseaseforecast.exception.InvalidYearweekException;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.IsoFields;
import java.time.temporal.TemporalAdjusters;
import java.util.regex.Pattern;

/**
 * ISO week keys in {@code YYYYWW} form.
 * <p>
 * The year part is the ISO week-based year, so a date such as 2024-12-30 maps to
 * {@code "202501"} and every key has exactly one Monday.
 */
public final class YearWeeks {

    private static final Pattern FORMAT = Pattern.compile("^[0-9]{4}[0-9]{2}$");

    private YearWeeks() {
    }

    public static String of(LocalDate date) {
        return format(date.get(IsoFields.WEEK_BASED_YEAR), date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
    }

    public static LocalDate mondayOf(LocalDate date) {
        return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    }

    public static LocalDate mondayOf(String yearweek) {
        int year = year(yearweek);
        int week = weekNumber(yearweek);
        if (week < 1 || week > weeksInYear(year)) {
            throw new InvalidYearweekException(yearweek,
                "week must be between 01 and " + weeksInYear(year) + " for " + year);
        }
        return LocalDate.of(year, 1, 4)
            .with(IsoFields.WEEK_OF_WEEK_BASED_YEAR, week)
            .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    }

    /** Advances by calendar weeks, so week 53 is produced in years that have one. */
    public static String plusWeeks(String yearweek, int weeks) {
        return of(mondayOf(yearweek).plusWeeks(weeks));
    }

    public static int year(String yearweek) {
        return Integer.parseInt(validateFormat(yearweek).substring(0, 4));
    }

    public static int weekNumber(String yearweek) {
        return Integer.parseInt(validateFormat(yearweek).substring(4));
    }

    public static String weekSuffix(String yearweek) {
        return validateFormat(yearweek).substring(4);
    }

    public static int weeksInYear(int year) {
        return LocalDate.of(year, 12, 28).get(IsoFields.WEEK_OF_WEEK_BASED_YEAR);
    }

    public static String validate(String yearweek) {
        mondayOf(yearweek);
        return yearweek;
    }

    private static String validateFormat(String yearweek) {
        if (yearweek == null || !FORMAT.matcher(yearweek).matches()) {
            throw new InvalidYearweekException(String.valueOf(yearweek), "expected format YYYYWW");
        }
        return yearweek;
    }

    private static String format(int year, int week) {
        return String.format("%04d%02d", year, week);
    }
}
