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
 * Trigonometry in degrees and periodic normalization helpers.
 *
 * <p>Forward functions take degrees; inverse functions return degrees. Every
 * angle or hour value that is compared or differenced downstream goes through
 * {@link #normalizeAngle} or {@link #normalizeHour} first.</p>
 */
public final class AngleMath {

    private AngleMath() {}

    public static double sin(double deg) {
        return Math.sin(Math.toRadians(deg));
    }

    public static double cos(double deg) {
        return Math.cos(Math.toRadians(deg));
    }

    public static double tan(double deg) {
        return Math.tan(Math.toRadians(deg));
    }

    public static double arcsin(double x) {
        return Math.toDegrees(Math.asin(x));
    }

    /** Returns NaN when |x| > 1, which callers treat as "unavailable". */
    public static double arccos(double x) {
        return Math.toDegrees(Math.acos(x));
    }

    public static double arctan(double x) {
        return Math.toDegrees(Math.atan(x));
    }

    public static double arccot(double x) {
        return Math.toDegrees(Math.atan(1.0 / x));
    }

    public static double arctan2(double y, double x) {
        return Math.toDegrees(Math.atan2(y, x));
    }

    /** Reduce an angle to [0, 360). */
    public static double normalizeAngle(double a) {
        return normalize(a, 360.0);
    }

    /** Reduce an hour value to [0, 24). */
    public static double normalizeHour(double a) {
        return normalize(a, 24.0);
    }

    /**
     * Forward difference from {@code from} to {@code to} on the 24 hour clock,
     * always in [0, 24).
     */
    public static double hourDiff(double from, double to) {
        return normalizeHour(to - from);
    }

    private static double normalize(double a, double b) {
        double r = a - b * Math.floor(a / b);
        // floor() can leave a tiny negative remainder for inputs just below a multiple of b
        return r < 0 ? r + b : r;
    }
}
