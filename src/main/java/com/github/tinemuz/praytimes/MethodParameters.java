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

/**
 * Parameter set of a calculation convention. Every field is populated;
 * conventions that do not define maghrib or midnight get the global defaults
 * ({@code 0 min} after sunset, {@link MidnightMode#STANDARD}).
 */
public record MethodParameters(
        TimeParameter fajr, TimeParameter isha, TimeParameter maghrib, MidnightMode midnight) {

    static final TimeParameter DEFAULT_MAGHRIB = TimeParameter.minutes(0);
    static final MidnightMode DEFAULT_MIDNIGHT = MidnightMode.STANDARD;

    public MethodParameters {
        if (fajr == null || isha == null) {
            throw new IllegalArgumentException("fajr and isha are required");
        }
        if (fajr.minutes()) {
            throw new IllegalArgumentException("fajr must be an angle, got " + fajr);
        }
        maghrib = maghrib == null ? DEFAULT_MAGHRIB : maghrib;
        midnight = midnight == null ? DEFAULT_MIDNIGHT : midnight;
    }

    static MethodParameters of(double fajrDeg, String isha) {
        return new MethodParameters(TimeParameter.degrees(fajrDeg), TimeParameter.parse(isha), null, null);
    }

    static MethodParameters of(double fajrDeg, String isha, String maghrib, MidnightMode midnight) {
        return new MethodParameters(
                TimeParameter.degrees(fajrDeg), TimeParameter.parse(isha), TimeParameter.parse(maghrib), midnight);
    }
}
