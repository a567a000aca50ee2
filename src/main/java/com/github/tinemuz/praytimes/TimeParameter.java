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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A setting that is either a sun depression angle in degrees or a fixed
 * number of minutes relative to another time.
 *
 * <p>The textual form is the one used by the calculation method tables:
 * {@code "18"} or {@code "18.5"} for an angle, {@code "10 min"} or
 * {@code "90 min"} for minutes.</p>
 */
public record TimeParameter(double value, boolean minutes) {

    private static final Pattern LEADING_NUMBER = Pattern.compile("^[0-9.+-]+");

    public static TimeParameter degrees(double value) {
        return new TimeParameter(value, false);
    }

    public static TimeParameter minutes(double value) {
        return new TimeParameter(value, true);
    }

    /**
     * Parse the textual form. The first numeric token is the value; the word
     * {@code min} anywhere marks it as minutes.
     *
     * @throws IllegalArgumentException if there is no leading number
     */
    public static TimeParameter parse(String text) {
        String s = text.trim();
        Matcher m = LEADING_NUMBER.matcher(s);
        if (!m.find()) {
            throw new IllegalArgumentException("Not an angle or minute value: '" + text + "'");
        }
        double v;
        try {
            v = Double.parseDouble(m.group());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not an angle or minute value: '" + text + "'", e);
        }
        return new TimeParameter(v, s.contains("min"));
    }

    @Override
    public String toString() {
        String v = value == Math.rint(value) ? Long.toString((long) value) : Double.toString(value);
        return minutes ? v + " min" : v;
    }
}
