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
 * Low-level solar astronomy formulas.
 *
 * <p>Expressions follow Jean Meeus, <i>Astronomical Algorithms</i> (2nd ed.).
 * Angles are in degrees unless a parameter name says otherwise; {@code t}
 * is always the Julian century relative to J2000.0.</p>
 */
final class Astronomical {

    private Astronomical() {}

    /** Geometric mean longitude of the sun (Meeus 25.2). */
    static double meanSolarLongitude(double t) {
        double term1 = 280.4664567;
        double term2 = 36000.76983 * t;
        double term3 = 0.0003032 * t * t;
        return unwindAngle(term1 + term2 + term3);
    }

    /** Mean longitude of the moon (Meeus p. 144). */
    static double meanLunarLongitude(double t) {
        return unwindAngle(218.3165 + 481267.8813 * t);
    }

    /** Longitude of the ascending node of the moon's mean orbit (Meeus p. 144). */
    static double ascendingLunarNodeLongitude(double t) {
        double term1 = 125.04452;
        double term2 = 1934.136261 * t;
        double term3 = 0.0020708 * t * t;
        double term4 = t * t * t / 450000.0;
        return unwindAngle(term1 - term2 + term3 + term4);
    }

    /** Mean anomaly of the sun (Meeus 25.3). */
    static double meanSolarAnomaly(double t) {
        double term1 = 357.52911;
        double term2 = 35999.05029 * t;
        double term3 = 0.0001537 * t * t;
        return unwindAngle(term1 + term2 - term3);
    }

    /** Sun's equation of the centre (Meeus p. 164). */
    static double solarEquationOfTheCenter(double t, double meanAnomaly) {
        double mRad = Math.toRadians(meanAnomaly);
        double term1 = (1.914602 - 0.004817 * t - 0.000014 * t * t) * Math.sin(mRad);
        double term2 = (0.019993 - 0.000101 * t) * Math.sin(2 * mRad);
        double term3 = 0.000289 * Math.sin(3 * mRad);
        return term1 + term2 + term3;
    }

    /** Apparent longitude of the sun, corrected for nutation and aberration (Meeus p. 164). */
    static double apparentSolarLongitude(double t, double meanLongitude) {
        double longitude = meanLongitude + solarEquationOfTheCenter(t, meanSolarAnomaly(t));
        double omega = 125.04 - 1934.136 * t;
        double lambda = longitude - 0.00569 - 0.00478 * Math.sin(Math.toRadians(omega));
        return unwindAngle(lambda);
    }

    /** Mean obliquity of the ecliptic (Meeus 22.2). */
    static double meanObliquityOfTheEcliptic(double t) {
        double term1 = 23.439291;
        double term2 = 0.013004167 * t;
        double term3 = 0.0000001639 * t * t;
        double term4 = 0.0000005036 * t * t * t;
        return term1 - term2 - term3 + term4;
    }

    /** Apparent obliquity of the ecliptic (Meeus p. 165). */
    static double apparentObliquityOfTheEcliptic(double t, double meanObliquity) {
        double o = 125.04 - 1934.136 * t;
        return meanObliquity + 0.00256 * Math.cos(Math.toRadians(o));
    }

    /** Mean sidereal time at Greenwich (Meeus 12.4). */
    static double meanSiderealTime(double t) {
        double jd = t * 36525 + 2451545.0;
        double term1 = 280.46061837;
        double term2 = 360.98564736629 * (jd - 2451545);
        double term3 = 0.000387933 * t * t;
        double term4 = t * t * t / 38710000;
        return unwindAngle(term1 + term2 + term3 - term4);
    }

    /** Nutation in longitude (Meeus p. 144), in degrees. */
    static double nutationInLongitude(double solarLongitude, double lunarLongitude, double ascendingNode) {
        double l0 = Math.toRadians(solarLongitude);
        double lp = Math.toRadians(lunarLongitude);
        double omega = Math.toRadians(ascendingNode);
        double term1 = (-17.2 / 3600) * Math.sin(omega);
        double term2 = (1.32 / 3600) * Math.sin(2 * l0);
        double term3 = (0.23 / 3600) * Math.sin(2 * lp);
        double term4 = (0.21 / 3600) * Math.sin(2 * omega);
        return term1 - term2 - term3 + term4;
    }

    /** Nutation in obliquity (Meeus p. 144), in degrees. */
    static double nutationInObliquity(double solarLongitude, double lunarLongitude, double ascendingNode) {
        double l0 = Math.toRadians(solarLongitude);
        double lp = Math.toRadians(lunarLongitude);
        double omega = Math.toRadians(ascendingNode);
        double term1 = (9.2 / 3600) * Math.cos(omega);
        double term2 = (0.57 / 3600) * Math.cos(2 * l0);
        double term3 = (0.10 / 3600) * Math.cos(2 * lp);
        double term4 = (0.09 / 3600) * Math.cos(2 * omega);
        return term1 + term2 + term3 - term4;
    }

    /** Altitude of a body with declination {@code delta} at local hour angle {@code hourAngle} (Meeus 13.6). */
    static double altitudeOfCelestialBody(double latitude, double delta, double hourAngle) {
        double phi = Math.toRadians(latitude);
        double d = Math.toRadians(delta);
        double h = Math.toRadians(hourAngle);
        return Math.toDegrees(Math.asin(
                Math.sin(phi) * Math.sin(d) + Math.cos(phi) * Math.cos(d) * Math.cos(h)));
    }

    /**
     * Approximate transit as a fraction of the day (Meeus 15.2).
     *
     * @param longitude      observer longitude, east positive
     * @param siderealTime   apparent sidereal time at Greenwich at 0h UT
     * @param rightAscension right ascension of the sun on the day
     */
    static double approximateTransit(double longitude, double siderealTime, double rightAscension) {
        double lw = -longitude;
        return normalizeWithBound((rightAscension + lw - siderealTime) / 360, 1);
    }

    /**
     * Transit corrected with the interpolated right ascension (Meeus 15.2),
     * in fractional hours after 0h UT.
     */
    static double correctedTransit(double approximateTransit, double longitude, double siderealTime,
                                   double rightAscension, double previousRightAscension,
                                   double nextRightAscension) {
        double m0 = approximateTransit;
        double lw = -longitude;
        double theta = unwindAngle(siderealTime + 360.985647 * m0);
        double alpha = unwindAngle(interpolateAngles(
                rightAscension, previousRightAscension, nextRightAscension, m0));
        double h = closestAngle(theta - lw - alpha);
        double deltaM = h / -360;
        return (m0 + deltaM) * 24;
    }

    /**
     * Time at which the sun reaches altitude {@code h0}, corrected with
     * interpolated coordinates (Meeus 15.1, 15.2). Returns {@code NaN} when
     * the sun never reaches that altitude on the day.
     */
    static double correctedHourAngle(double approximateTransit, double h0, Coordinates coordinates,
                                     boolean afterTransit, double siderealTime,
                                     double rightAscension, double previousRightAscension,
                                     double nextRightAscension, double declination,
                                     double previousDeclination, double nextDeclination) {
        double m0 = approximateTransit;
        double lw = -coordinates.longitude();
        double phi = Math.toRadians(coordinates.latitude());
        double term1 = Math.sin(Math.toRadians(h0)) - Math.sin(phi) * Math.sin(Math.toRadians(declination));
        double term2 = Math.cos(phi) * Math.cos(Math.toRadians(declination));
        double bigH0 = Math.toDegrees(Math.acos(term1 / term2));
        double m = afterTransit ? m0 + bigH0 / 360 : m0 - bigH0 / 360;
        double theta = unwindAngle(siderealTime + 360.985647 * m);
        double alpha = unwindAngle(interpolateAngles(
                rightAscension, previousRightAscension, nextRightAscension, m));
        double delta = interpolate(declination, previousDeclination, nextDeclination, m);
        double bigH = theta - lw - alpha;
        double h = altitudeOfCelestialBody(coordinates.latitude(), delta, bigH);
        double term3 = h - h0;
        double term4 = 360 * Math.cos(Math.toRadians(delta)) * Math.cos(phi) * Math.sin(Math.toRadians(bigH));
        double deltaM = term3 / term4;
        return (m + deltaM) * 24;
    }

    /** Three-point interpolation (Meeus 3.3). */
    static double interpolate(double y2, double y1, double y3, double n) {
        double a = y2 - y1;
        double b = y3 - y2;
        double c = b - a;
        return y2 + (n / 2) * (a + b + n * c);
    }

    /** Three-point interpolation of angles, unwinding across 0/360. */
    static double interpolateAngles(double y2, double y1, double y3, double n) {
        double a = unwindAngle(y2 - y1);
        double b = unwindAngle(y3 - y2);
        double c = b - a;
        return y2 + (n / 2) * (a + b + n * c);
    }

    /** Julian day at 0h UT of the given Gregorian date (Meeus 7.1). */
    static double julianDay(int year, int month, int day) {
        return julianDay(year, month, day, 0.0);
    }

    static double julianDay(int year, int month, int day, double hours) {
        int y = month > 2 ? year : year - 1;
        int m = month > 2 ? month : month + 12;
        double d = day + hours / 24;
        int a = y / 100;
        int b = 2 - a + a / 4;
        int i0 = (int) (365.25 * (y + 4716));
        int i1 = (int) (30.6001 * (m + 1));
        return i0 + i1 + d + b - 1524.5;
    }

    /** Julian century since J2000.0 (Meeus 11.1). */
    static double julianCentury(double julianDay) {
        return (julianDay - 2451545.0) / 36525;
    }

    /** Normalize into [0, 360). */
    static double unwindAngle(double angle) {
        return normalizeWithBound(angle, 360);
    }

    /** Closest equivalent angle in [-180, 180]. */
    static double closestAngle(double angle) {
        if (angle >= -180 && angle <= 180) {
            return angle;
        }
        return angle - (360 * Math.round(angle / 360));
    }

    static double normalizeWithBound(double value, double max) {
        return value - (max * Math.floor(value / max));
    }
}
