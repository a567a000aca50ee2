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

import static com.github.tinemuz.praytimes.AngleMath.hourDiff;
import static com.github.tinemuz.praytimes.AngleMath.normalizeHour;

import com.github.tinemuz.praytimes.SunTimeSolver.Side;
import java.time.LocalDate;
import java.time.ZoneId;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Daily prayer time calculator.
 *
 * <p>Given a {@link PrayTimesConfig}, a {@link Location}, a calendar date and
 * the zone's UTC offset, {@link #compute} returns the nine times of that day
 * as fractional hours of civil time. The computation is a pure function of
 * its arguments: no state survives between calls and the same inputs always
 * give bit-identical results.</p>
 *
 * <p>Times the sun never reaches (polar day or night) come back as NaN unless
 * the configured {@link HighLatitudeRule} bounds them. Latitude, longitude and
 * date ranges are not validated.</p>
 */
public final class PrayerTimesCalculator {
    private static final Logger log = LoggerFactory.getLogger(PrayerTimesCalculator.class);

    // Array slots, matching PrayerTime ordinals
    private static final int IMSAK = 0;
    private static final int FAJR = 1;
    private static final int SUNRISE = 2;
    private static final int DHUHR = 3;
    private static final int ASR = 4;
    private static final int SUNSET = 5;
    private static final int MAGHRIB = 6;
    private static final int ISHA = 7;
    private static final int MIDNIGHT = 8;

    /** Starting estimates in hours for the fixed-point refinement. */
    private static final double[] SEED_HOURS = {5, 5, 6, 12, 13, 18, 18, 18};

    private static volatile boolean warnedUnavailable = false;

    private PrayerTimesCalculator() {}

    /**
     * Compute one day's times.
     *
     * @param config         method, settings, offsets and iteration count
     * @param location       observer position
     * @param date           Gregorian calendar date
     * @param utcOffsetHours standard offset of the zone, east positive
     * @param dst            1 if daylight saving applies, otherwise 0
     * @return the nine times in [0, 24) or NaN where unavailable
     */
    public static PrayerTimeSet compute(
            PrayTimesConfig config, Location location, LocalDate date, double utcOffsetHours, int dst) {
        Settings s = config.settings();
        double jDate = JulianDate.atLongitude(date, location.longitudeDeg());
        SunTimeSolver solver = new SunTimeSolver(jDate, location.latitudeDeg());

        double[] times = SEED_HOURS.clone();
        for (int i = 0; i < config.iterations(); i++) {
            times = refine(solver, s, location.elevationMeters(), times);
        }

        double zone = utcOffsetHours + (dst != 0 ? 1 : 0);
        double shift = zone - location.longitudeDeg() / 15.0;
        for (int i = 0; i < times.length; i++) {
            times[i] += shift;
        }

        if (s.highLats() != HighLatitudeRule.NONE) {
            adjustHighLatitudes(times, s);
        }

        if (s.imsak().minutes()) {
            times[IMSAK] = times[FAJR] - s.imsak().value() / 60.0;
        }
        if (s.maghrib().minutes()) {
            times[MAGHRIB] = times[SUNSET] + s.maghrib().value() / 60.0;
        }
        if (s.isha().minutes()) {
            times[ISHA] = times[MAGHRIB] + s.isha().value() / 60.0;
        }
        times[DHUHR] += s.dhuhrMinutes() / 60.0;

        double[] all = new double[MIDNIGHT + 1];
        System.arraycopy(times, 0, all, 0, times.length);
        double nightEnd = s.midnight() == MidnightMode.JAFARI ? times[FAJR] : times[SUNRISE];
        all[MIDNIGHT] = times[SUNSET] + hourDiff(times[SUNSET], nightEnd) / 2.0;

        for (PrayerTime t : PrayerTime.values()) {
            all[t.ordinal()] = normalizeHour(all[t.ordinal()] + config.offsetMinutes(t) / 60.0);
        }

        PrayerTimeSet result = PrayerTimeSet.fromArray(all);
        if (log.isDebugEnabled()) {
            log.debug("{} at ({}, {}) with {}: {}",
                    date, location.latitudeDeg(), location.longitudeDeg(), config.method().id(), result);
        }
        if (s.highLats() == HighLatitudeRule.NONE) {
            warnIfUnavailable(result, location, date);
        }
        return result;
    }

    /**
     * Compute one day's times using the zone's actual offset at noon on that
     * date. Daylight saving shifts of any size (Lord Howe's half hour, Troll's
     * two hours) are carried by the offset itself, so the DST flag is 0.
     */
    public static PrayerTimeSet compute(
            PrayTimesConfig config, Location location, LocalDate date, ZoneId zone) {
        return compute(config, location, date, UtcOffsets.offsetHoursAt(zone, date), 0);
    }

    /** Compute with the library default configuration. */
    public static PrayerTimeSet compute(Location location, LocalDate date, double utcOffsetHours) {
        return compute(PrayTimesConfig.defaults(), location, date, utcOffsetHours, 0);
    }

    /**
     * One refinement pass: re-solve all eight times from the previous
     * estimates (hours in, hours out).
     */
    private static double[] refine(SunTimeSolver solver, Settings s, double elevation, double[] hours) {
        double[] t = new double[hours.length];
        for (int i = 0; i < hours.length; i++) {
            t[i] = hours[i] / 24.0;
        }
        double riseSet = SunTimeSolver.riseSetAngle(elevation);

        double[] out = new double[hours.length];
        out[IMSAK] = solver.sunAngleTime(s.imsak().value(), t[IMSAK], Side.MORNING);
        out[FAJR] = solver.sunAngleTime(s.fajr().value(), t[FAJR], Side.MORNING);
        out[SUNRISE] = solver.sunAngleTime(riseSet, t[SUNRISE], Side.MORNING);
        out[DHUHR] = solver.midday(t[DHUHR]);
        out[ASR] = solver.asrTime(s.asrFactor(), t[ASR]);
        out[SUNSET] = solver.sunAngleTime(riseSet, t[SUNSET], Side.EVENING);
        out[MAGHRIB] = solver.sunAngleTime(s.maghrib().value(), t[MAGHRIB], Side.EVENING);
        out[ISHA] = solver.sunAngleTime(s.isha().value(), t[ISHA], Side.EVENING);
        return out;
    }

    /**
     * Bound imsak and fajr to a portion of the night before sunrise, and
     * maghrib and isha to a portion after sunset.
     */
    private static void adjustHighLatitudes(double[] times, Settings s) {
        double night = hourDiff(times[SUNSET], times[SUNRISE]);
        HighLatitudeRule rule = s.highLats();
        times[IMSAK] = bound(rule, times[IMSAK], times[SUNRISE], s.imsak().value(), night, Side.MORNING);
        times[FAJR] = bound(rule, times[FAJR], times[SUNRISE], s.fajr().value(), night, Side.MORNING);
        times[ISHA] = bound(rule, times[ISHA], times[SUNSET], s.isha().value(), night, Side.EVENING);
        times[MAGHRIB] = bound(rule, times[MAGHRIB], times[SUNSET], s.maghrib().value(), night, Side.EVENING);
    }

    private static double bound(
            HighLatitudeRule rule, double time, double base, double angle, double night, Side side) {
        double portion = rule.nightPortion(angle, night);
        double diff = side == Side.MORNING ? hourDiff(time, base) : hourDiff(base, time);
        if (Double.isNaN(time) || diff > portion) {
            return base + (side == Side.MORNING ? -portion : portion);
        }
        return time;
    }

    private static void warnIfUnavailable(PrayerTimeSet result, Location location, LocalDate date) {
        if (warnedUnavailable) return;
        for (PrayerTime t : PrayerTime.values()) {
            if (!result.isAvailable(t)) {
                synchronized (PrayerTimesCalculator.class) {
                    if (!warnedUnavailable) {
                        warnedUnavailable = true;
                        log.warn(
                                "{} cannot be computed on {} at latitude {} with highLats=None; "
                                    + "consider NightMiddle, OneSeventh or AngleBased",
                                t.displayName(), date, location.latitudeDeg());
                    }
                }
                return;
            }
        }
    }
}
