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

import java.util.Objects;

/**
 * Sun geometry for one calendar day at one location.
 *
 * <p>Times are fractional hours after 00:00 UTC of the date; they can fall
 * slightly outside [0, 24) for longitudes far from Greenwich. The
 * coordinates of the sun on the previous and next day are kept so transit
 * and hour angles can be interpolated through the day.</p>
 *
 * <p>Instances are immutable and cheap to build; create one per
 * (date, coordinates) pair.</p>
 */
public final class SolarPosition {

    private final Coordinates observer;
    private final SolarCoordinates solar;
    private final SolarCoordinates prevSolar;
    private final SolarCoordinates nextSolar;
    private final double approxTransit;
    private final double transit;

    public SolarPosition(DateComponents date, Coordinates coordinates) {
        Objects.requireNonNull(date, "date");
        this.observer = Objects.requireNonNull(coordinates, "coordinates");
        double julianDay = Astronomical.julianDay(date.year(), date.month(), date.day());
        this.solar = new SolarCoordinates(julianDay);
        this.prevSolar = new SolarCoordinates(julianDay - 1);
        this.nextSolar = new SolarCoordinates(julianDay + 1);

        double m0 = Astronomical.approximateTransit(
                coordinates.longitude(), solar.apparentSiderealTime, solar.rightAscension);
        this.approxTransit = m0;
        this.transit = Astronomical.correctedTransit(
                m0, coordinates.longitude(), solar.apparentSiderealTime,
                solar.rightAscension, prevSolar.rightAscension, nextSolar.rightAscension);
    }

    /** Apparent solar noon, in fractional hours UTC. */
    public double transit() {
        return transit;
    }

    /**
     * Time at which the centre of the sun crosses {@code angle}.
     *
     * @param angle        altitude in degrees, negative below the horizon
     * @param afterTransit {@code true} for the afternoon crossing, {@code false} for the morning
     * @return fractional hours UTC, or {@code NaN} if the sun never reaches the angle that day
     */
    public double hourAngle(double angle, boolean afterTransit) {
        return Astronomical.correctedHourAngle(
                approxTransit, angle, observer, afterTransit, solar.apparentSiderealTime,
                solar.rightAscension, prevSolar.rightAscension, nextSolar.rightAscension,
                solar.declination, prevSolar.declination, nextSolar.declination);
    }

    /**
     * Afternoon time when an object's shadow is {@code shadowLength} times
     * its height plus the length of its shadow at noon.
     *
     * @param shadowLength 1 for the standard Asr, 2 for the Hanafi Asr
     */
    public double afternoon(double shadowLength) {
        double tangent = Math.abs(observer.latitude() - solar.declination);
        double inverse = shadowLength + Math.tan(Math.toRadians(tangent));
        double angle = Math.toDegrees(Math.atan(1.0 / inverse));
        return hourAngle(angle, true);
    }

    /** Declination of the sun at 0h UT of the date, in degrees. */
    public double declination() {
        return solar.declination;
    }
}
