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

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable prayer times for one date and location, produced by
 * {@link PrayerTimeCalculator#calculate}.
 *
 * <p>All times are UTC. A time is empty when it cannot be observed on that
 * day at that location, typically because the sun never reaches the
 * required angle at high latitudes. Queries skip empty times rather than
 * failing.</p>
 */
public final class PrayerTimes {

    private static final Prayer[] CHRONOLOGICAL = {
        Prayer.FAJR, Prayer.SUNRISE, Prayer.DHUHR, Prayer.ASR, Prayer.MAGHRIB, Prayer.ISHA
    };

    private final Coordinates coordinates;
    private final DateComponents date;
    private final CalculationParameters parameters;
    private final LocalDateTime fajr;
    private final LocalDateTime sunrise;
    private final LocalDateTime dhuhr;
    private final LocalDateTime asr;
    private final LocalDateTime maghrib;
    private final LocalDateTime isha;

    PrayerTimes(Coordinates coordinates, DateComponents date, CalculationParameters parameters,
                LocalDateTime fajr, LocalDateTime sunrise, LocalDateTime dhuhr,
                LocalDateTime asr, LocalDateTime maghrib, LocalDateTime isha) {
        this.coordinates = coordinates;
        this.date = date;
        this.parameters = parameters;
        this.fajr = fajr;
        this.sunrise = sunrise;
        this.dhuhr = dhuhr;
        this.asr = asr;
        this.maghrib = maghrib;
        this.isha = isha;
    }

    public Optional<LocalDateTime> fajr() {
        return Optional.ofNullable(fajr);
    }

    public Optional<LocalDateTime> sunrise() {
        return Optional.ofNullable(sunrise);
    }

    public Optional<LocalDateTime> dhuhr() {
        return Optional.ofNullable(dhuhr);
    }

    public Optional<LocalDateTime> asr() {
        return Optional.ofNullable(asr);
    }

    public Optional<LocalDateTime> maghrib() {
        return Optional.ofNullable(maghrib);
    }

    public Optional<LocalDateTime> isha() {
        return Optional.ofNullable(isha);
    }

    public Coordinates coordinates() {
        return coordinates;
    }

    public DateComponents date() {
        return date;
    }

    public CalculationParameters parameters() {
        return parameters;
    }

    /**
     * Time of the given prayer in UTC.
     *
     * @return empty for {@link Prayer#NONE} and for times not observable that day
     */
    public Optional<LocalDateTime> timeForPrayer(Prayer prayer) {
        return Optional.ofNullable(rawTime(prayer));
    }

    /** Time of the given prayer as seen in {@code zone}. */
    public Optional<ZonedDateTime> timeForPrayer(Prayer prayer, ZoneId zone) {
        Objects.requireNonNull(zone, "zone");
        return timeForPrayer(prayer).map(t -> t.atZone(ZoneOffset.UTC).withZoneSameInstant(zone));
    }

    /**
     * Latest prayer whose time is at or before {@code now}.
     *
     * @param now a UTC date-time
     * @return {@link Prayer#NONE} before Fajr
     */
    public Prayer currentPrayer(LocalDateTime now) {
        Objects.requireNonNull(now, "now");
        for (int i = CHRONOLOGICAL.length - 1; i >= 0; i--) {
            LocalDateTime time = rawTime(CHRONOLOGICAL[i]);
            if (time != null && !time.isAfter(now)) {
                return CHRONOLOGICAL[i];
            }
        }
        return Prayer.NONE;
    }

    public Prayer currentPrayer(Clock clock) {
        return currentPrayer(utcNow(clock));
    }

    /**
     * First prayer whose time is strictly after {@code now}.
     *
     * @param now a UTC date-time
     * @return {@link Prayer#NONE} at or after Isha
     */
    public Prayer nextPrayer(LocalDateTime now) {
        Objects.requireNonNull(now, "now");
        for (Prayer prayer : CHRONOLOGICAL) {
            LocalDateTime time = rawTime(prayer);
            if (time != null && time.isAfter(now)) {
                return prayer;
            }
        }
        return Prayer.NONE;
    }

    public Prayer nextPrayer(Clock clock) {
        return nextPrayer(utcNow(clock));
    }

    private LocalDateTime rawTime(Prayer prayer) {
        switch (prayer) {
            case FAJR:
                return fajr;
            case SUNRISE:
                return sunrise;
            case DHUHR:
                return dhuhr;
            case ASR:
                return asr;
            case MAGHRIB:
                return maghrib;
            case ISHA:
                return isha;
            default:
                return null;
        }
    }

    private static LocalDateTime utcNow(Clock clock) {
        Objects.requireNonNull(clock, "clock");
        return LocalDateTime.ofInstant(clock.instant(), ZoneOffset.UTC);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PrayerTimes)) return false;
        PrayerTimes that = (PrayerTimes) o;
        return coordinates.equals(that.coordinates)
                && date.equals(that.date)
                && parameters.equals(that.parameters)
                && Objects.equals(fajr, that.fajr)
                && Objects.equals(sunrise, that.sunrise)
                && Objects.equals(dhuhr, that.dhuhr)
                && Objects.equals(asr, that.asr)
                && Objects.equals(maghrib, that.maghrib)
                && Objects.equals(isha, that.isha);
    }

    @Override
    public int hashCode() {
        return Objects.hash(coordinates, date, parameters, fajr, sunrise, dhuhr, asr, maghrib, isha);
    }

    @Override
    public String toString() {
        return "PrayerTimes{date=" + date
                + ", fajr=" + fajr
                + ", sunrise=" + sunrise
                + ", dhuhr=" + dhuhr
                + ", asr=" + asr
                + ", maghrib=" + maghrib
                + ", isha=" + isha
                + '}';
    }
}
