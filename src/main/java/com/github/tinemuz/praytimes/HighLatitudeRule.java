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
 * Rule used to bound angle-based times near the poles, where the sun may never
 * dip far enough below the horizon for fajr or isha to be reached.
 */
public enum HighLatitudeRule {
    /** At most half of the night. */
    NIGHT_MIDDLE("NightMiddle"),
    /** At most one seventh of the night. */
    ONE_SEVENTH("OneSeventh"),
    /** At most angle/60 of the night. */
    ANGLE_BASED("AngleBased"),
    /** No correction; unreachable angles stay unavailable. */
    NONE("None");

    private final String label;

    HighLatitudeRule(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Longest allowed distance, in hours, between a twilight time and its
     * reference (sunrise or sunset).
     *
     * @param angleDeg  twilight angle of the time being bounded
     * @param nightHrs  sunset to sunrise duration in hours
     */
    public double nightPortion(double angleDeg, double nightHrs) {
        double portion;
        switch (this) {
            case ANGLE_BASED:
                portion = angleDeg / 60.0;
                break;
            case ONE_SEVENTH:
                portion = 1.0 / 7.0;
                break;
            default:
                portion = 0.5;
        }
        return portion * nightHrs;
    }

    public static HighLatitudeRule parse(String value) {
        for (HighLatitudeRule r : values()) {
            if (r.label.equalsIgnoreCase(value.trim())) return r;
        }
        throw new IllegalArgumentException("Unknown high latitude rule: '" + value + "'");
    }
}
