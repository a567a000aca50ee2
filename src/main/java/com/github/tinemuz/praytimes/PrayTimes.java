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

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stateful convenience wrapper around {@link PrayerTimesCalculator}.
 *
 * <pre>{@code
 * PrayTimes pt = new PrayTimes("ISNA");
 * Map<PrayerTime, String> times = pt.getTimes(LocalDate.now(), new Location(43, -80), -5, 0);
 * }</pre>
 *
 * <p>Each mutator swaps the held {@link PrayTimesConfig} for a new one; a
 * mutator that fails leaves the previous configuration in place. Instances
 * are not safe for concurrent mutation. Callers that share one across
 * threads should take a {@link #snapshot()} and compute from that.</p>
 */
public class PrayTimes {
    private static final Logger log = LoggerFactory.getLogger(PrayTimes.class);

    private PrayTimesConfig config;
    private TimeFormat timeFormat;
    private String invalidTime;
    private String amSuffix = TimeFormat.AM;
    private String pmSuffix = TimeFormat.PM;

    /** Library defaults. */
    public PrayTimes() {
        this(PrayTimesConfig.defaults());
    }

    /**
     * @throws InvalidMethodException if the method name is unknown
     */
    public PrayTimes(String method) {
        this(PrayTimesConfig.of(method));
    }

    public PrayTimes(PrayTimesConfig config) {
        this.config = config;
        this.timeFormat = PrayTimesDefaults.timeFormat();
        this.invalidTime = PrayTimesDefaults.invalidTime();
    }

    /**
     * @throws InvalidMethodException if the name is unknown; the current
     *         method and settings are left untouched
     */
    public void setMethod(String method) {
        config = config.withMethod(method);
        log.debug("Method set to {}", config.method().id());
    }

    public void setMethod(CalculationMethod method) {
        config = config.withMethod(method);
    }

    /** Override settings by name, e.g. {@code asr -> Hanafi}. */
    public void adjust(Map<String, String> params) {
        config = config.adjust(params);
    }

    /** Set fine-tune offsets in minutes; unmentioned times are unchanged. */
    public void tune(Map<PrayerTime, Double> offsets) {
        config = config.tune(offsets);
    }

    public void setTimeFormat(TimeFormat format) {
        this.timeFormat = format;
    }

    public void setInvalidTime(String marker) {
        this.invalidTime = marker;
    }

    /** Suffixes used by {@link TimeFormat#H12}, e.g. {@code "AM"} and {@code "PM"}. */
    public void setTimeSuffixes(String am, String pm) {
        this.amSuffix = Objects.requireNonNull(am, "am");
        this.pmSuffix = Objects.requireNonNull(pm, "pm");
    }

    public CalculationMethod getMethod() {
        return config.method();
    }

    public Settings getSettings() {
        return config.settings();
    }

    public Map<PrayerTime, Double> getOffsets() {
        return config.offsets();
    }

    /** The current configuration; immutable, so safe to hand to other threads. */
    public PrayTimesConfig snapshot() {
        return config;
    }

    /** Raw times for a date with an explicit UTC offset and DST flag. */
    public PrayerTimeSet computeTimes(LocalDate date, Location location, double utcOffsetHours, int dst) {
        return PrayerTimesCalculator.compute(config, location, date, utcOffsetHours, dst);
    }

    /** Formatted times with an explicit UTC offset and DST flag. */
    public Map<PrayerTime, String> getTimes(LocalDate date, Location location, double utcOffsetHours, int dst) {
        return render(computeTimes(date, location, utcOffsetHours, dst), timeFormat);
    }

    public Map<PrayerTime, String> getTimes(
            LocalDate date, Location location, double utcOffsetHours, int dst, TimeFormat format) {
        return render(computeTimes(date, location, utcOffsetHours, dst), format);
    }

    /**
     * Formatted times with an explicit standard UTC offset; whether daylight
     * saving applies is read from {@code dstZone}'s rules for the date.
     */
    public Map<PrayerTime, String> getTimes(
            LocalDate date, Location location, double utcOffsetHours, ZoneId dstZone) {
        return getTimes(date, location, utcOffsetHours, UtcOffsets.dst(dstZone, date));
    }

    /** Formatted times with offset and DST taken from the zone's rules. */
    public Map<PrayerTime, String> getTimes(LocalDate date, Location location, ZoneId zone) {
        return render(PrayerTimesCalculator.compute(config, location, date, zone), timeFormat);
    }

    /** Formatted times in the JVM's default zone. */
    public Map<PrayerTime, String> getTimes(LocalDate date, Location location) {
        return getTimes(date, location, ZoneId.systemDefault());
    }

    private Map<PrayerTime, String> render(PrayerTimeSet times, TimeFormat format) {
        return times.format(format, invalidTime, amSuffix, pmSuffix);
    }
}
