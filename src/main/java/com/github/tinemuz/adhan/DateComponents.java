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

import java.time.DateTimeException;
import java.time.LocalDate;

/**
 * A proleptic Gregorian calendar date without time or zone, in years
 * {@value #MIN_YEAR} to {@value #MAX_YEAR}.
 *
 * @param year  the year
 * @param month the month, 1-based
 * @param day   the day of month
 */
public record DateComponents(int year, int month, int day) {
    public static final int MIN_YEAR = 1;
    public static final int MAX_YEAR = 9999;

    public DateComponents {
        if (year < MIN_YEAR || year > MAX_YEAR) {
            throw new IllegalArgumentException(String.format(
                    "Year %d outside supported range [%d, %d]", year, MIN_YEAR, MAX_YEAR));
        }
        try {
            LocalDate.of(year, month, day);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException(
                    String.format("Invalid date %04d-%02d-%02d", year, month, day), e);
        }
    }

    public static DateComponents from(LocalDate date) {
        return new DateComponents(date.getYear(), date.getMonthValue(), date.getDayOfMonth());
    }

    public LocalDate toLocalDate() {
        return LocalDate.of(year, month, day);
    }

    /** 1-based ordinal day within the year. */
    public int dayOfYear() {
        return toLocalDate().getDayOfYear();
    }
}
