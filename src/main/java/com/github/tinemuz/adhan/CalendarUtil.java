/*
 * MIT License
 *
 * Copyright (c) 2025 tinemuz
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package com.github.tinemuz.adhan;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

/**
 * Calendar helpers. All instant arithmetic is done in UTC on the proleptic
 * Gregorian calendar so results do not depend on the default time zone.
 */
public final class CalendarUtil {

    private CalendarUtil() {}

    /**
     * Whether a year has 366 days.
     *
     * Divisible by 4, except centuries not divisible by 400.
     */
    public static boolean isLeapYear(int year) {
        return year % 4 == 0 && (year % 100 != 0 || year % 400 == 0);
    }

    public static int daysInYear(int year) {
        return isLeapYear(year) ? 366 : 365;
    }

    /**
     * Start of the given day.
     *
     * @return the instant at 00:00:00 UTC on that date
     */
    public static Instant resolveTime(DateComponents components) {
        return LocalDateTime.of(components.year(), components.month(), components.day(), 0, 0, 0)
                .toInstant(ZoneOffset.UTC);
    }

    /**
     * Add an amount of a time unit to an instant. Calendar-based units
     * (days and longer) are resolved in UTC.
     */
    public static Instant add(Instant when, long amount, ChronoUnit unit) {
        if (unit.isTimeBased() || unit == ChronoUnit.DAYS) {
            return when.plus(amount, unit);
        }
        return LocalDateTime.ofInstant(when, ZoneOffset.UTC)
                .plus(amount, unit)
                .toInstant(ZoneOffset.UTC);
    }

    /**
     * Fold the seconds of an instant into its minute: 30 seconds and above
     * round up to the next minute (rolling over hour and day), anything
     * below is dropped.
     */
    public static Instant roundedMinute(Instant when) {
        Instant minute = when.truncatedTo(ChronoUnit.MINUTES);
        long seconds = ChronoUnit.SECONDS.between(minute, when);
        return seconds >= 30 ? minute.plus(1, ChronoUnit.MINUTES) : minute;
    }

    /** The following calendar day, rolling over month and year boundaries. */
    public static DateComponents tomorrow(DateComponents components) {
        return DateComponents.from(components.toLocalDate().plusDays(1));
    }
}
