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

/** Published calculation conventions. */
public enum CalculationMethod {
    /** Muslim World League: Fajr 18°, Isha 17°. */
    MUSLIM_WORLD_LEAGUE(18.0, 17.0, 0, HighLatitudeRule.NONE),

    /** Egyptian General Authority of Survey: Fajr 19.5°, Isha 17.5°. */
    EGYPTIAN(19.5, 17.5, 0, HighLatitudeRule.NONE),

    /** University of Islamic Sciences, Karachi: Fajr 18°, Isha 18°. */
    KARACHI(18.0, 18.0, 0, HighLatitudeRule.NONE),

    /** Umm al-Qura University, Makkah: Fajr 18.5°, Isha 90 minutes after Maghrib. */
    UMM_AL_QURA(18.5, 0.0, 90, HighLatitudeRule.NONE),

    /** ISNA: Fajr 15°, Isha 15°. */
    NORTH_AMERICA(15.0, 15.0, 0, HighLatitudeRule.NONE),

    /** Moonsighting Committee: Fajr 18°, Isha 18°, with seasonal twilight bounds. */
    MOON_SIGHTING_COMMITTEE(18.0, 18.0, 0, HighLatitudeRule.SEASON_ADJUSTED),

    /** Caller-defined angles; build {@link CalculationParameters} directly. */
    OTHER(0.0, 0.0, 0, HighLatitudeRule.NONE);

    private final double fajrAngle;
    private final double ishaAngle;
    private final int ishaInterval;
    private final HighLatitudeRule highLatitudeRule;

    CalculationMethod(double fajrAngle, double ishaAngle, int ishaInterval, HighLatitudeRule highLatitudeRule) {
        this.fajrAngle = fajrAngle;
        this.ishaAngle = ishaAngle;
        this.ishaInterval = ishaInterval;
        this.highLatitudeRule = highLatitudeRule;
    }

    /**
     * Parameters for this method with the Shafi madhab and no adjustments.
     *
     * @throws IllegalStateException for {@link #OTHER}, which has no angles
     */
    public CalculationParameters parameters() {
        if (this == OTHER) {
            throw new IllegalStateException("Method OTHER has no preset angles");
        }
        return new CalculationParameters(
                fajrAngle, ishaAngle, ishaInterval, Madhab.SHAFI, highLatitudeRule, PrayerAdjustments.NONE);
    }
}
