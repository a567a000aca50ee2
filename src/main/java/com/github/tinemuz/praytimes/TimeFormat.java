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

import java.util.Locale;

/** Rendering of fractional hour values. */
public enum TimeFormat {
    /** {@code 05:07} */
    H24("24h"),
    /** {@code 5:07 am} */
    H12("12h"),
    /** {@code 5:07} */
    H12_NO_SUFFIX("12hNS"),
    /** The raw fractional hour, e.g. {@code 5.1246} */
    FLOAT("Float");

    private final String label;

    TimeFormat(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /** Default suffixes for {@link #H12}. */
    public static final String AM = "am";
    public static final String PM = "pm";

    /**
     * Render an hour value. Unavailable times (NaN) render as
     * {@code invalidTime}. Clock formats round to the nearest minute.
     */
    public String format(double hours, String invalidTime) {
        return format(hours, invalidTime, AM, PM);
    }

    /**
     * As {@link #format(double, String)}, with the suffixes {@link #H12}
     * appends before and after noon. Other formats ignore them.
     */
    public String format(double hours, String invalidTime, String amSuffix, String pmSuffix) {
        if (Double.isNaN(hours)) return invalidTime;
        if (this == FLOAT) return Double.toString(hours);

        double t = AngleMath.normalizeHour(hours + 0.5 / 60.0);
        int h = (int) Math.floor(t);
        int m = (int) Math.floor((t - h) * 60.0);
        switch (this) {
            case H24:
                return String.format(Locale.ROOT, "%02d:%02d", h, m);
            case H12:
                return String.format(Locale.ROOT, "%d:%02d %s", to12(h), m, h < 12 ? amSuffix : pmSuffix);
            default:
                return String.format(Locale.ROOT, "%d:%02d", to12(h), m);
        }
    }

    private static int to12(int h) {
        return (h + 11) % 12 + 1;
    }

    public static TimeFormat parse(String value) {
        for (TimeFormat f : values()) {
            if (f.label.equalsIgnoreCase(value.trim())) return f;
        }
        throw new IllegalArgumentException("Unknown time format: '" + value + "'");
    }
}
