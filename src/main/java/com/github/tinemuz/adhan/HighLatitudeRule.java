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
 * Substitute for Fajr and Isha where the twilight angles are not reached
 * or give unusable times. Every rule except {@link #NONE} measures the
 * night from sunset to the next day's sunrise.
 */
public enum HighLatitudeRule {
    /** Use the raw angle-based times; unreachable angles stay absent. */
    NONE,

    /** Fajr no earlier than the middle of the night, Isha no later. */
    MIDDLE_OF_THE_NIGHT,

    /** Fajr no earlier than the last seventh of the night, Isha no later than the first seventh. */
    SEVENTH_OF_THE_NIGHT,

    /** The portion of the night is the twilight angle divided by 60. */
    TWILIGHT_ANGLE,

    /** Fajr and Isha bounded by the latitude- and season-dependent offsets of {@link TwilightAdjuster}. */
    SEASON_ADJUSTED;

    /**
     * Fraction of the night used as the bound for a prayer with the given
     * twilight angle. Not defined for {@link #NONE} and {@link #SEASON_ADJUSTED}.
     */
    double nightPortion(double twilightAngle) {
        switch (this) {
            case MIDDLE_OF_THE_NIGHT:
                return 1.0 / 2.0;
            case SEVENTH_OF_THE_NIGHT:
                return 1.0 / 7.0;
            case TWILIGHT_ANGLE:
                return twilightAngle / 60.0;
            default:
                throw new IllegalStateException("No night portion for rule " + this);
        }
    }
}
