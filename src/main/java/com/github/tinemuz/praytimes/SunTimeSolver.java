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

import static com.github.tinemuz.praytimes.AngleMath.arccos;
import static com.github.tinemuz.praytimes.AngleMath.arccot;
import static com.github.tinemuz.praytimes.AngleMath.cos;
import static com.github.tinemuz.praytimes.AngleMath.normalizeHour;
import static com.github.tinemuz.praytimes.AngleMath.sin;
import static com.github.tinemuz.praytimes.AngleMath.tan;

/**
 * Inverts sun altitude to time of day for one observer and one date.
 *
 * <p>Each solve takes an estimate {@code t} of the answer as a fraction of
 * the day and evaluates the sun's position at that instant, so repeated
 * solves converge toward a fixed point. Results are hours of local solar
 * time measured from the base Julian date.</p>
 */
public final class SunTimeSolver {

    /** Which side of solar noon a time falls on. */
    public enum Side {
        MORNING,
        EVENING
    }

    private final double baseJulianDate;
    private final double latitudeDeg;

    /**
     * @param baseJulianDate Julian date of local midnight (see
     *                       {@link JulianDate#atLongitude})
     * @param latitudeDeg    observer latitude
     */
    public SunTimeSolver(double baseJulianDate, double latitudeDeg) {
        this.baseJulianDate = baseJulianDate;
        this.latitudeDeg = latitudeDeg;
    }

    /** Solar noon in hours, using the sun's position at day fraction {@code t}. */
    public double midday(double t) {
        double eqt = SolarPosition.at(baseJulianDate + t).equationOfTimeHrs();
        return normalizeHour(12 - eqt);
    }

    /**
     * Time at which the sun is {@code angleDeg} below the horizon (negative
     * means above). Returns NaN when the sun never reaches that altitude on
     * this date at this latitude.
     */
    public double sunAngleTime(double angleDeg, double t, Side side) {
        double decl = SolarPosition.at(baseJulianDate + t).declinationDeg();
        double noon = midday(t);
        double offset = arccos(
                        (-sin(angleDeg) - sin(decl) * sin(latitudeDeg))
                                / (cos(decl) * cos(latitudeDeg)))
                / 15.0;
        return noon + (side == Side.MORNING ? -offset : offset);
    }

    /** Afternoon time at which shadows reach {@code factor} times object length plus the noon shadow. */
    public double asrTime(double factor, double t) {
        double decl = SolarPosition.at(baseJulianDate + t).declinationDeg();
        double angle = -arccot(factor + tan(Math.abs(latitudeDeg - decl)));
        return sunAngleTime(angle, t, Side.EVENING);
    }

    /**
     * Sun depression at sunrise and sunset: refraction plus solar semi-diameter
     * (0.833 degrees), plus a dip term for elevated observers.
     */
    public static double riseSetAngle(double elevationMeters) {
        return 0.833 + 0.0347 * Math.sqrt(elevationMeters);
    }
}
