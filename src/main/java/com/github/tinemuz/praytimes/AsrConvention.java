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

/** Named juristic conventions for the asr shadow factor. */
public enum AsrConvention {
    /** Shafi'i, Maliki, Ja'fari and Hanbali: shadow equals object length. */
    STANDARD("Standard", 1.0),
    /** Hanafi: shadow twice the object length. */
    HANAFI("Hanafi", 2.0);

    private final String label;
    private final double shadowFactor;

    AsrConvention(String label, double shadowFactor) {
        this.label = label;
        this.shadowFactor = shadowFactor;
    }

    public String label() {
        return label;
    }

    public double shadowFactor() {
        return shadowFactor;
    }

    /**
     * Resolve an asr parameter to its shadow factor.
     *
     * @param value {@code Standard}, {@code Hanafi} or a positive number
     * @throws InvalidAsrConventionException for anything else
     */
    public static double factorOf(String value) {
        if (value == null) throw new InvalidAsrConventionException(null);
        String s = value.trim();
        for (AsrConvention c : values()) {
            if (c.label.equalsIgnoreCase(s)) return c.shadowFactor;
        }
        double factor;
        try {
            factor = Double.parseDouble(s);
        } catch (NumberFormatException e) {
            throw new InvalidAsrConventionException(value);
        }
        return checkFactor(factor, value);
    }

    static double checkFactor(double factor, String original) {
        if (!(factor > 0) || Double.isInfinite(factor)) {
            throw new InvalidAsrConventionException(original);
        }
        return factor;
    }
}
