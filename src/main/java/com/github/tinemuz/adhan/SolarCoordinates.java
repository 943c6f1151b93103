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

/**
 * Equatorial position of the sun at one Julian day, plus the apparent
 * sidereal time at Greenwich for that day.
 */
final class SolarCoordinates {

    /** Declination of the sun in degrees, north positive. */
    final double declination;

    /** Right ascension of the sun in degrees, [0, 360). */
    final double rightAscension;

    /** Apparent sidereal time at Greenwich in degrees. */
    final double apparentSiderealTime;

    SolarCoordinates(double julianDay) {
        double t = Astronomical.julianCentury(julianDay);
        double l0 = Astronomical.meanSolarLongitude(t);
        double lp = Astronomical.meanLunarLongitude(t);
        double omega = Astronomical.ascendingLunarNodeLongitude(t);
        double lambda = Math.toRadians(Astronomical.apparentSolarLongitude(t, l0));
        double theta0 = Astronomical.meanSiderealTime(t);
        double dPsi = Astronomical.nutationInLongitude(l0, lp, omega);
        double dEpsilon = Astronomical.nutationInObliquity(l0, lp, omega);
        double epsilon0 = Astronomical.meanObliquityOfTheEcliptic(t);
        double epsilonApparent = Math.toRadians(
                Astronomical.apparentObliquityOfTheEcliptic(t, epsilon0));

        // Meeus 25.6 / 25.7
        this.declination = Math.toDegrees(Math.asin(Math.sin(epsilonApparent) * Math.sin(lambda)));
        this.rightAscension = Astronomical.unwindAngle(Math.toDegrees(
                Math.atan2(Math.cos(epsilonApparent) * Math.sin(lambda), Math.cos(lambda))));

        // Meeus p. 88: nutation correction in arcseconds, back to degrees
        this.apparentSiderealTime =
                theta0 + (dPsi * 3600) * Math.cos(Math.toRadians(epsilon0 + dEpsilon)) / 3600;
    }
}
