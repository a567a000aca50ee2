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
package com.github.tinemuz.praytimes;

import java.time.LocalDate;

/**
 * Gregorian calendar date to Julian day conversion (Meeus, Astronomical
 * Algorithms, chapter 7).
 *
 * <p>Valid for the proleptic Gregorian calendar. The inputs are not range
 * checked: month must be 1-12 and day 1-31.</p>
 */
public final class JulianDate {

    private JulianDate() {}

    /**
     * Julian day at 00:00 UT of the given Gregorian date.
     */
    public static double of(int year, int month, int day) {
        if (month <= 2) {
            year -= 1;
            month += 12;
        }
        double a = Math.floor(year / 100.0);
        double b = 2 - a + Math.floor(a / 4.0);
        return Math.floor(365.25 * (year + 4716))
                + Math.floor(30.6001 * (month + 1))
                + day
                + b
                - 1524.5;
    }

    public static double of(LocalDate date) {
        return of(date.getYear(), date.getMonthValue(), date.getDayOfMonth());
    }

    /**
     * Julian date of local midnight at the given longitude, i.e. the UT
     * midnight shifted by the longitude expressed as a fraction of a day.
     *
     * @param longitudeDeg east positive
     */
    public static double atLongitude(LocalDate date, double longitudeDeg) {
        return of(date) - longitudeDeg / (15.0 * 24.0);
    }
}
