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

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prayer time calculator.
 *
 * <p>Derives the six daily times from the sun's position for a date,
 * location and {@link CalculationParameters}, and returns them as an
 * immutable {@link PrayerTimes}. The single entry point is
 * {@link #calculate}; it is stateless and safe to call from any thread.</p>
 *
 * <p>Each time is a target altitude of the sun converted to a UTC clock
 * time on the requested date. When the sun never reaches the altitude the
 * time is left empty. A configured {@link HighLatitudeRule} then bounds
 * Fajr and Isha by a portion of the night, measured from today's sunset to
 * tomorrow's sunrise. Where the sun does not rise or set there is no night
 * to measure, and both bounds fall on solar midnight.</p>
 */
public final class PrayerTimeCalculator {
    private static final Logger log = LoggerFactory.getLogger(PrayerTimeCalculator.class);
    // Refraction plus the solar radius
    private static final double SUNRISE_ALTITUDE = 0.833;
    private static final double SUNSET_ALTITUDE = -0.833;

    private PrayerTimeCalculator() {}

    /**
     * Compute the prayer times.
     *
     * @param coordinates observer location
     * @param date        the calendar date, interpreted in UTC
     * @param parameters  calculation convention
     * @return times for the date; individual times may be empty
     * @throws NullPointerException if any argument is null
     * @throws IllegalArgumentException if {@code date} is the last supported
     *         day, since the following day is needed for the night length
     */
    public static PrayerTimes calculate(
            Coordinates coordinates, DateComponents date, CalculationParameters parameters) {
        Objects.requireNonNull(coordinates, "coordinates");
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(parameters, "parameters");

        SolarPosition today = new SolarPosition(date, coordinates);
        DateComponents tomorrowDate = CalendarUtil.tomorrow(date);
        SolarPosition tomorrow = new SolarPosition(tomorrowDate, coordinates);

        LocalDateTime fajr = toDateTime(today.hourAngle(-parameters.fajrAngle(), false), date);
        LocalDateTime sunrise = toDateTime(today.hourAngle(SUNRISE_ALTITUDE, false), date);
        LocalDateTime dhuhr = toDateTime(today.transit(), date);
        LocalDateTime asr = toDateTime(today.afternoon(parameters.madhab().shadowLength()), date);
        LocalDateTime maghrib = toDateTime(today.hourAngle(SUNSET_ALTITUDE, true), date);
        LocalDateTime isha;
        if (parameters.usesIshaInterval()) {
            isha = maghrib == null ? null : maghrib.plusMinutes(parameters.ishaInterval());
        } else {
            isha = toDateTime(today.hourAngle(-parameters.ishaAngle(), true), date);
        }

        HighLatitudeRule rule = parameters.highLatitudeRule();
        if (rule != HighLatitudeRule.NONE) {
            LocalDateTime tomorrowSunrise =
                    toDateTime(tomorrow.hourAngle(SUNRISE_ALTITUDE, false), tomorrowDate);
            LocalDateTime safeFajr;
            LocalDateTime safeIsha;
            if (sunrise == null || maghrib == null || tomorrowSunrise == null) {
                // No measurable night: collapse it to solar midnight on either side of transit
                log.debug("No sunrise or sunset on {} at {}; {} bounds fall on solar midnight",
                        date, coordinates, rule);
                safeFajr = toDateTime(today.transit() - 12, date);
                safeIsha = toDateTime(today.transit() + 12, date);
            } else if (rule == HighLatitudeRule.SEASON_ADJUSTED) {
                safeFajr = TwilightAdjuster.seasonAdjustedMorningTwilight(
                        coordinates.latitude(), date.dayOfYear(), date.year(), sunrise, ZoneOffset.UTC);
                safeIsha = TwilightAdjuster.seasonAdjustedEveningTwilight(
                        coordinates.latitude(), date.dayOfYear(), date.year(), maghrib, ZoneOffset.UTC);
            } else {
                long nightSeconds = Duration.between(maghrib, tomorrowSunrise).getSeconds();
                safeFajr = sunrise.minusSeconds(
                        Math.round(rule.nightPortion(parameters.fajrAngle()) * nightSeconds));
                safeIsha = maghrib.plusSeconds(
                        Math.round(rule.nightPortion(parameters.ishaAngle()) * nightSeconds));
            }
            safeFajr = safeFajr.truncatedTo(ChronoUnit.MINUTES);
            safeIsha = safeIsha.truncatedTo(ChronoUnit.MINUTES);

            if (fajr == null || fajr.isBefore(safeFajr)) {
                log.debug("Fajr on {} bounded by {}: {} -> {}", date, rule, fajr, safeFajr);
                fajr = safeFajr;
            }
            if (!parameters.usesIshaInterval() && (isha == null || isha.isAfter(safeIsha))) {
                log.debug("Isha on {} bounded by {}: {} -> {}", date, rule, isha, safeIsha);
                isha = safeIsha;
            }
        }

        PrayerAdjustments adjustments = parameters.adjustments();
        PrayerTimes times = new PrayerTimes(coordinates, date, parameters,
                adjust(fajr, adjustments.fajr()),
                adjust(sunrise, adjustments.sunrise()),
                adjust(dhuhr, adjustments.dhuhr()),
                adjust(asr, adjustments.asr()),
                adjust(maghrib, adjustments.maghrib()),
                adjust(isha, adjustments.isha()));
        log.debug("Computed {} at {}", times, coordinates);
        return times;
    }

    /**
     * Convert fractional UTC hours on {@code date} into a date-time. The
     * seconds are dropped by flooring, so negative hours move toward the
     * earlier minute as well. Values outside [0, 24) move into the
     * neighbouring day.
     *
     * @return the date-time, or {@code null} if {@code hours} is not finite
     */
    static LocalDateTime toDateTime(double hours, DateComponents date) {
        if (!Double.isFinite(hours)) {
            log.debug("No solution on {}: hour angle is {}", date, hours);
            return null;
        }
        long minutes = (long) Math.floor(hours * 60);
        Instant time = CalendarUtil.add(CalendarUtil.resolveTime(date), minutes, ChronoUnit.MINUTES);
        return LocalDateTime.ofInstant(time, ZoneOffset.UTC);
    }

    private static LocalDateTime adjust(LocalDateTime time, int minutes) {
        if (time == null || minutes == 0) {
            return time;
        }
        return time.plusMinutes(minutes);
    }
}
