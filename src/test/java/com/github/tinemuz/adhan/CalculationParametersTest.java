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

import static org.junit.jupiter.api.Assertions.*;

import java.time.LocalDate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Validation of the input value types and method presets.
 */
class CalculationParametersTest {

    @Nested
    @DisplayName("Calculation Parameters")
    class ParameterTests {

        @Test
        @DisplayName("Defaults for the angle-only constructor")
        void defaults() {
            CalculationParameters p = new CalculationParameters(18.0, 17.0);
            assertEquals(Madhab.SHAFI, p.madhab());
            assertEquals(HighLatitudeRule.NONE, p.highLatitudeRule());
            assertEquals(PrayerAdjustments.NONE, p.adjustments());
            assertFalse(p.usesIshaInterval());
        }

        @Test
        @DisplayName("Out-of-range angles are rejected")
        void invalidAngles() {
            assertThrows(IllegalArgumentException.class, () -> new CalculationParameters(0.0, 17.0));
            assertThrows(IllegalArgumentException.class, () -> new CalculationParameters(-18.0, 17.0));
            assertThrows(IllegalArgumentException.class, () -> new CalculationParameters(90.0, 17.0));
            assertThrows(IllegalArgumentException.class, () -> new CalculationParameters(Double.NaN, 17.0));
            assertThrows(IllegalArgumentException.class, () -> new CalculationParameters(18.0, -1.0));
            assertThrows(IllegalArgumentException.class, () -> new CalculationParameters(18.0, 95.0));
        }

        @Test
        @DisplayName("Isha needs an angle or an interval")
        void ishaAngleOrInterval() {
            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                    () -> new CalculationParameters(18.0, 0.0));
            assertTrue(e.getMessage().contains("Isha"));

            CalculationParameters interval = new CalculationParameters(18.0, 18.0).withIshaInterval(90);
            assertTrue(interval.usesIshaInterval());
            assertThrows(IllegalArgumentException.class,
                    () -> new CalculationParameters(18.0, 18.0).withIshaInterval(-5));
        }

        @Test
        @DisplayName("Null components are rejected")
        void nullComponents() {
            CalculationParameters p = new CalculationParameters(18.0, 17.0);
            assertThrows(NullPointerException.class, () -> p.withMadhab(null));
            assertThrows(NullPointerException.class, () -> p.withHighLatitudeRule(null));
            assertThrows(NullPointerException.class, () -> p.withAdjustments(null));
        }

        @Test
        @DisplayName("Copies leave the original untouched")
        void immutableCopies() {
            CalculationParameters p = new CalculationParameters(18.0, 17.0);
            CalculationParameters hanafi = p.withMadhab(Madhab.HANAFI);
            assertEquals(Madhab.SHAFI, p.madhab());
            assertEquals(Madhab.HANAFI, hanafi.madhab());
            assertEquals(p.fajrAngle(), hanafi.fajrAngle());
        }
    }

    @Nested
    @DisplayName("Calculation Methods")
    class MethodTests {

        @Test
        @DisplayName("Preset angles")
        void presets() {
            CalculationParameters mwl = CalculationMethod.MUSLIM_WORLD_LEAGUE.parameters();
            assertEquals(18.0, mwl.fajrAngle());
            assertEquals(17.0, mwl.ishaAngle());

            CalculationParameters ummAlQura = CalculationMethod.UMM_AL_QURA.parameters();
            assertEquals(18.5, ummAlQura.fajrAngle());
            assertEquals(90, ummAlQura.ishaInterval());

            assertEquals(HighLatitudeRule.SEASON_ADJUSTED,
                    CalculationMethod.MOON_SIGHTING_COMMITTEE.parameters().highLatitudeRule());
        }

        @Test
        @DisplayName("OTHER has no preset")
        void other() {
            assertThrows(IllegalStateException.class, CalculationMethod.OTHER::parameters);
        }

        @Test
        @DisplayName("Madhab shadow lengths")
        void madhab() {
            assertEquals(1, Madhab.SHAFI.shadowLength());
            assertEquals(2, Madhab.HANAFI.shadowLength());
        }

        @Test
        @DisplayName("Night portions")
        void nightPortions() {
            assertEquals(0.5, HighLatitudeRule.MIDDLE_OF_THE_NIGHT.nightPortion(18.0), 1e-12);
            assertEquals(1.0 / 7.0, HighLatitudeRule.SEVENTH_OF_THE_NIGHT.nightPortion(18.0), 1e-12);
            assertEquals(0.3, HighLatitudeRule.TWILIGHT_ANGLE.nightPortion(18.0), 1e-12);
            assertThrows(IllegalStateException.class, () -> HighLatitudeRule.NONE.nightPortion(18.0));
        }
    }

    @Nested
    @DisplayName("Coordinates and Dates")
    class InputTests {

        @Test
        @DisplayName("Coordinates outside the valid range are rejected")
        void coordinates() {
            assertDoesNotThrow(() -> new Coordinates(90.0, -180.0));
            assertDoesNotThrow(() -> new Coordinates(-90.0, 180.0));
            assertThrows(IllegalArgumentException.class, () -> new Coordinates(90.1, 0.0));
            assertThrows(IllegalArgumentException.class, () -> new Coordinates(0.0, -180.5));
            assertThrows(IllegalArgumentException.class, () -> new Coordinates(Double.NaN, 0.0));
        }

        @Test
        @DisplayName("Invalid calendar dates are rejected")
        void dates() {
            assertThrows(IllegalArgumentException.class, () -> new DateComponents(2023, 2, 29));
            assertThrows(IllegalArgumentException.class, () -> new DateComponents(2024, 13, 1));
            assertThrows(IllegalArgumentException.class, () -> new DateComponents(2024, 4, 31));
            assertDoesNotThrow(() -> new DateComponents(2024, 2, 29));
        }

        @Test
        @DisplayName("Years outside the supported range are rejected")
        void yearRange() {
            assertDoesNotThrow(() -> new DateComponents(DateComponents.MIN_YEAR, 1, 1));
            assertDoesNotThrow(() -> new DateComponents(DateComponents.MAX_YEAR, 12, 31));
            assertThrows(IllegalArgumentException.class, () -> new DateComponents(0, 1, 1));
            assertThrows(IllegalArgumentException.class, () -> new DateComponents(10000, 1, 1));
            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                    () -> new DateComponents(999_999_999, 12, 31));
            assertTrue(e.getMessage().contains("999999999"));
        }

        @Test
        @DisplayName("Date conversions")
        void dateConversions() {
            DateComponents date = DateComponents.from(LocalDate.of(2024, 3, 15));
            assertEquals(new DateComponents(2024, 3, 15), date);
            assertEquals(LocalDate.of(2024, 3, 15), date.toLocalDate());
            assertEquals(75, date.dayOfYear());
        }
    }
}
