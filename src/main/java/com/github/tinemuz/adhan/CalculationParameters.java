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
 * Convention used to derive the prayer times.
 *
 * <p>Angles are degrees below the horizon. When {@code ishaInterval} is
 * positive, Isha is that many minutes after Maghrib and {@code ishaAngle}
 * is only used by the {@link HighLatitudeRule#TWILIGHT_ANGLE} rule, if at
 * all. Instances are validated on construction; use the {@code with*}
 * methods to derive variations.</p>
 *
 * @param fajrAngle        sun depression for Fajr, (0, 90)
 * @param ishaAngle        sun depression for Isha, [0, 90); must be positive without an interval
 * @param ishaInterval     minutes after Maghrib, 0 to use the angle
 * @param madhab           Asr shadow convention
 * @param highLatitudeRule substitute rule for Fajr and Isha
 * @param adjustments      per-prayer minute offsets
 */
public record CalculationParameters(
        double fajrAngle,
        double ishaAngle,
        int ishaInterval,
        Madhab madhab,
        HighLatitudeRule highLatitudeRule,
        PrayerAdjustments adjustments) {

    public CalculationParameters {
        Objects.requireNonNull(madhab, "madhab");
        Objects.requireNonNull(highLatitudeRule, "highLatitudeRule");
        Objects.requireNonNull(adjustments, "adjustments");
        if (!Double.isFinite(fajrAngle) || fajrAngle <= 0.0 || fajrAngle >= 90.0) {
            throw new IllegalArgumentException("Fajr angle must be within (0, 90), got: " + fajrAngle);
        }
        if (!Double.isFinite(ishaAngle) || ishaAngle < 0.0 || ishaAngle >= 90.0) {
            throw new IllegalArgumentException("Isha angle must be within [0, 90), got: " + ishaAngle);
        }
        if (ishaInterval < 0) {
            throw new IllegalArgumentException("Isha interval must not be negative, got: " + ishaInterval);
        }
        if (ishaInterval == 0 && ishaAngle == 0.0) {
            throw new IllegalArgumentException("Either an Isha angle or an Isha interval is required");
        }
    }

    /** Angle-based parameters with the Shafi madhab, no high-latitude rule and no adjustments. */
    public CalculationParameters(double fajrAngle, double ishaAngle) {
        this(fajrAngle, ishaAngle, 0, Madhab.SHAFI, HighLatitudeRule.NONE, PrayerAdjustments.NONE);
    }

    public boolean usesIshaInterval() {
        return ishaInterval > 0;
    }

    public CalculationParameters withMadhab(Madhab value) {
        return new CalculationParameters(fajrAngle, ishaAngle, ishaInterval, value, highLatitudeRule, adjustments);
    }

    public CalculationParameters withHighLatitudeRule(HighLatitudeRule value) {
        return new CalculationParameters(fajrAngle, ishaAngle, ishaInterval, madhab, value, adjustments);
    }

    public CalculationParameters withAdjustments(PrayerAdjustments value) {
        return new CalculationParameters(fajrAngle, ishaAngle, ishaInterval, madhab, highLatitudeRule, value);
    }

    public CalculationParameters withIshaInterval(int minutes) {
        return new CalculationParameters(fajrAngle, ishaAngle, minutes, madhab, highLatitudeRule, adjustments);
    }
}
