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

import java.time.LocalDateTime;
import java.time.ZoneId;

/**
 * Seasonal twilight offsets for high latitudes.
 *
 * <p>The offset is interpolated across the year between four reference
 * values a, b, c and d, each linear in the absolute latitude, following
 * a &rarr; b &rarr; c &rarr; d &rarr; c &rarr; b &rarr; a from one winter
 * solstice to the next. The segments are 91, 46, 46, 46, 46 and 91 days
 * long. Morning and evening use different coefficients.</p>
 */
public final class TwilightAdjuster {

    private static final int NORTHERN_OFFSET = 10;

    private TwilightAdjuster() {}

    /**
     * Fajr bound: the given sunrise moved earlier by the seasonal morning offset.
     *
     * @param latitude  observer latitude in degrees
     * @param dayOfYear 1-based day of the year
     * @param year      the year, for its length
     * @param sunrise   local sunrise in {@code zone}
     * @param zone      zone of {@code sunrise}; the shift is applied to the instant
     */
    public static LocalDateTime seasonAdjustedMorningTwilight(
            double latitude, int dayOfYear, int year, LocalDateTime sunrise, ZoneId zone) {
        double lat = Math.abs(latitude);
        double a = 75 + ((28.65 / 55.0) * lat);
        double b = 75 + ((19.44 / 55.0) * lat);
        double c = 75 + ((32.74 / 55.0) * lat);
        double d = 75 + ((48.10 / 55.0) * lat);

        double adjustment = interpolate(a, b, c, d, daysSinceSolstice(dayOfYear, year, latitude));
        long seconds = Math.round(adjustment * 60.0);
        return sunrise.atZone(zone).minusSeconds(seconds).withZoneSameInstant(zone).toLocalDateTime();
    }

    /**
     * Isha bound: the given sunset moved later by the seasonal evening offset.
     *
     * @see #seasonAdjustedMorningTwilight(double, int, int, LocalDateTime, ZoneId)
     */
    public static LocalDateTime seasonAdjustedEveningTwilight(
            double latitude, int dayOfYear, int year, LocalDateTime sunset, ZoneId zone) {
        double lat = Math.abs(latitude);
        double a = 75 + ((25.60 / 55.0) * lat);
        double b = 75 + ((2.050 / 55.0) * lat);
        double c = 75 - ((9.210 / 55.0) * lat);
        double d = 75 + ((6.140 / 55.0) * lat);

        double adjustment = interpolate(a, b, c, d, daysSinceSolstice(dayOfYear, year, latitude));
        long seconds = Math.round(adjustment * 60.0);
        return sunset.atZone(zone).plusSeconds(seconds).withZoneSameInstant(zone).toLocalDateTime();
    }

    /**
     * Days since the winter solstice of the observer's hemisphere.
     *
     * @return a value in [0, days in year)
     */
    public static int daysSinceSolstice(int dayOfYear, int year, double latitude) {
        int daysInYear = CalendarUtil.daysInYear(year);
        if (latitude >= 0) {
            return Math.floorMod(dayOfYear + NORTHERN_OFFSET, daysInYear);
        }
        int southernOffset = CalendarUtil.isLeapYear(year) ? 173 : 172;
        return Math.floorMod(dayOfYear - southernOffset, daysInYear);
    }

    /** Offset in minutes for the given point of the seasonal cycle. */
    static double interpolate(double a, double b, double c, double d, int days) {
        if (days < 91) {
            return a + (b - a) / 91.0 * days;
        } else if (days < 137) {
            return b + (c - b) / 46.0 * (days - 91);
        } else if (days < 183) {
            return c + (d - c) / 46.0 * (days - 137);
        } else if (days < 229) {
            return d + (c - d) / 46.0 * (days - 183);
        } else if (days < 275) {
            return c + (b - c) / 46.0 * (days - 229);
        }
        return b + (a - b) / 91.0 * (days - 275);
    }
}
