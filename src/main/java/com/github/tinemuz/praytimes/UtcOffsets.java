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
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Derives the numeric UTC offset and DST flag the calculator expects from a
 * time zone's rules.
 */
public final class UtcOffsets {

    private UtcOffsets() {}

    /**
     * Standard (non-DST) offset in hours: the smaller of the zone's offsets at
     * noon on January 1 and July 1 of the date's year.
     */
    public static double standardOffsetHours(ZoneId zone, LocalDate date) {
        double jan = offsetHoursAt(zone, LocalDate.of(date.getYear(), 1, 1));
        double jul = offsetHoursAt(zone, LocalDate.of(date.getYear(), 7, 1));
        return Math.min(jan, jul);
    }

    /** 1 if daylight saving is in effect at noon on {@code date}, else 0. */
    public static int dst(ZoneId zone, LocalDate date) {
        return offsetHoursAt(zone, date) != standardOffsetHours(zone, date) ? 1 : 0;
    }

    /** Offset in hours at local noon on {@code date}. */
    public static double offsetHoursAt(ZoneId zone, LocalDate date) {
        return ZonedDateTime.of(date, LocalTime.NOON, zone).getOffset().getTotalSeconds() / 3600.0;
    }
}
