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

import java.util.EnumMap;
import java.util.Map;

/**
 * The nine computed times of one day, as fractional hours of zone-local civil
 * time in [0, 24). A time that cannot be computed (the sun never reaches the
 * required altitude) is NaN; use {@link #isAvailable} to test for it.
 */
public record PrayerTimeSet(
        double imsak,
        double fajr,
        double sunrise,
        double dhuhr,
        double asr,
        double sunset,
        double maghrib,
        double isha,
        double midnight) {

    static PrayerTimeSet fromArray(double[] t) {
        return new PrayerTimeSet(t[0], t[1], t[2], t[3], t[4], t[5], t[6], t[7], t[8]);
    }

    public double get(PrayerTime time) {
        switch (time) {
            case IMSAK: return imsak;
            case FAJR: return fajr;
            case SUNRISE: return sunrise;
            case DHUHR: return dhuhr;
            case ASR: return asr;
            case SUNSET: return sunset;
            case MAGHRIB: return maghrib;
            case ISHA: return isha;
            default: return midnight;
        }
    }

    public boolean isAvailable(PrayerTime time) {
        return !Double.isNaN(get(time));
    }

    /** All nine values keyed by time, in chronological enum order. */
    public Map<PrayerTime, Double> asMap() {
        Map<PrayerTime, Double> m = new EnumMap<>(PrayerTime.class);
        for (PrayerTime t : PrayerTime.values()) m.put(t, get(t));
        return m;
    }

    /** Render every time; unavailable ones become {@code invalidTime}. */
    public Map<PrayerTime, String> format(TimeFormat format, String invalidTime) {
        return format(format, invalidTime, TimeFormat.AM, TimeFormat.PM);
    }

    /** Render every time with custom 12 hour suffixes. */
    public Map<PrayerTime, String> format(
            TimeFormat format, String invalidTime, String amSuffix, String pmSuffix) {
        Map<PrayerTime, String> m = new EnumMap<>(PrayerTime.class);
        for (PrayerTime t : PrayerTime.values()) {
            m.put(t, format.format(get(t), invalidTime, amSuffix, pmSuffix));
        }
        return m;
    }

    /** Render with the library default invalid-time marker. */
    public Map<PrayerTime, String> format(TimeFormat format) {
        return format(format, PrayTimesDefaults.invalidTime());
    }
}
