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

import static com.github.tinemuz.praytimes.AngleMath.arcsin;
import static com.github.tinemuz.praytimes.AngleMath.arctan2;
import static com.github.tinemuz.praytimes.AngleMath.cos;
import static com.github.tinemuz.praytimes.AngleMath.normalizeAngle;
import static com.github.tinemuz.praytimes.AngleMath.normalizeHour;
import static com.github.tinemuz.praytimes.AngleMath.sin;

/**
 * Low-precision solar ephemeris: declination and equation of time.
 *
 * <p>Uses the USNO approximate formulas, good to roughly 0.01 degrees for
 * dates within a couple of centuries of J2000. This is not a general
 * ephemeris and makes no attempt at higher-order terms.</p>
 *
 * @param declinationDeg    solar declination in degrees
 * @param equationOfTimeHrs equation of time in hours (apparent minus mean)
 */
public record SolarPosition(double declinationDeg, double equationOfTimeHrs) {

    /** Julian date of the J2000.0 epoch. */
    static final double J2000 = 2451545.0;

    /**
     * Evaluate the sun's position at a Julian date.
     *
     * @param julianDate Julian date including the fractional day
     * @return declination (degrees) and equation of time (hours)
     */
    public static SolarPosition at(double julianDate) {
        double d = julianDate - J2000;
        double g = normalizeAngle(357.529 + 0.98560028 * d);  // mean anomaly
        double q = normalizeAngle(280.459 + 0.98564736 * d);  // mean longitude
        double l = normalizeAngle(q + 1.915 * sin(g) + 0.020 * sin(2 * g));  // ecliptic longitude
        double e = 23.439 - 0.00000036 * d;  // obliquity of the ecliptic

        double rightAscensionHrs = arctan2(cos(e) * sin(l), cos(l)) / 15.0;
        double eqt = q / 15.0 - normalizeHour(rightAscensionHrs);
        double decl = arcsin(sin(e) * sin(l));
        return new SolarPosition(decl, eqt);
    }
}
