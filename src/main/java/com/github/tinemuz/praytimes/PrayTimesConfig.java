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

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Everything a computation needs besides location, date and zone: the active
 * method, the merged settings, per-time fine tuning and the refinement
 * iteration count.
 *
 * <p>Immutable. Each transform returns a new configuration, so one instance
 * can be shared freely between threads.</p>
 */
public final class PrayTimesConfig {
    private static final Logger log = LoggerFactory.getLogger(PrayTimesConfig.class);

    private final CalculationMethod method;
    private final Settings settings;
    private final Map<PrayerTime, Double> offsets;
    private final int iterations;

    private PrayTimesConfig(
            CalculationMethod method, Settings settings, Map<PrayerTime, Double> offsets, int iterations) {
        this.method = method;
        this.settings = settings;
        this.offsets = offsets;
        this.iterations = iterations;
    }

    /** Library defaults from <code>praytimes.properties</code>, no offsets. */
    public static PrayTimesConfig defaults() {
        return new PrayTimesConfig(
                PrayTimesDefaults.method(),
                PrayTimesDefaults.settings(),
                zeroOffsets(),
                PrayTimesDefaults.iterations());
    }

    /** Library defaults with the given method applied. */
    public static PrayTimesConfig of(CalculationMethod method) {
        return defaults().withMethod(method);
    }

    /**
     * @throws InvalidMethodException if {@code methodName} is unknown
     */
    public static PrayTimesConfig of(String methodName) {
        return of(CalculationMethod.fromName(methodName));
    }

    public CalculationMethod method() {
        return method;
    }

    public Settings settings() {
        return settings;
    }

    /** Read-only view of the fine-tune offsets in minutes. */
    public Map<PrayerTime, Double> offsets() {
        return Collections.unmodifiableMap(offsets);
    }

    public double offsetMinutes(PrayerTime time) {
        return offsets.get(time);
    }

    public int iterations() {
        return iterations;
    }

    /**
     * Switch method. The method's fajr, isha, maghrib and midnight replace the
     * current ones; other settings and all offsets are kept.
     */
    public PrayTimesConfig withMethod(CalculationMethod m) {
        Objects.requireNonNull(m, "method");
        if (m != method) {
            log.debug("Switching calculation method {} -> {}", method.id(), m.id());
        }
        return new PrayTimesConfig(m, settings.applying(m.params()), offsets, iterations);
    }

    /**
     * @throws InvalidMethodException if the name is unknown; nothing changes
     */
    public PrayTimesConfig withMethod(String name) {
        return withMethod(CalculationMethod.fromName(name));
    }

    public PrayTimesConfig withSettings(Settings s) {
        return new PrayTimesConfig(method, Objects.requireNonNull(s, "settings"), offsets, iterations);
    }

    /**
     * Apply textual overrides, keyed by setting name (see
     * {@link Settings#with(String, String)}). All overrides are validated
     * before the new configuration is returned.
     */
    public PrayTimesConfig adjust(Map<String, String> overrides) {
        Settings s = settings;
        for (Map.Entry<String, String> e : overrides.entrySet()) {
            s = s.with(e.getKey(), e.getValue());
        }
        return withSettings(s);
    }

    /** Set the fine-tune offset of one time, in minutes. */
    public PrayTimesConfig tune(PrayerTime time, double minutes) {
        EnumMap<PrayerTime, Double> copy = new EnumMap<>(offsets);
        copy.put(Objects.requireNonNull(time, "prayer time"), minutes);
        return new PrayTimesConfig(method, settings, copy, iterations);
    }

    /**
     * Set several fine-tune offsets; times not mentioned keep their offset.
     *
     * @throws NullPointerException if any key or value is null
     */
    public PrayTimesConfig tune(Map<PrayerTime, Double> minutes) {
        EnumMap<PrayerTime, Double> copy = new EnumMap<>(offsets);
        for (Map.Entry<PrayerTime, Double> e : minutes.entrySet()) {
            PrayerTime time = Objects.requireNonNull(e.getKey(), "prayer time");
            copy.put(time, Objects.requireNonNull(e.getValue(), () -> "offset for " + time.displayName()));
        }
        return new PrayTimesConfig(method, settings, copy, iterations);
    }

    public PrayTimesConfig withIterations(int n) {
        if (n < 1) throw new IllegalArgumentException("iterations must be >= 1, got " + n);
        return new PrayTimesConfig(method, settings, offsets, n);
    }

    private static EnumMap<PrayerTime, Double> zeroOffsets() {
        EnumMap<PrayerTime, Double> m = new EnumMap<>(PrayerTime.class);
        for (PrayerTime t : PrayerTime.values()) m.put(t, 0.0);
        return m;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PrayTimesConfig)) return false;
        PrayTimesConfig that = (PrayTimesConfig) o;
        return iterations == that.iterations
                && method == that.method
                && settings.equals(that.settings)
                && offsets.equals(that.offsets);
    }

    @Override
    public int hashCode() {
        return Objects.hash(method, settings, offsets, iterations);
    }

    @Override
    public String toString() {
        return "PrayTimesConfig{method=" + method.id() + ", settings=" + settings
                + ", offsets=" + offsets + ", iterations=" + iterations + '}';
    }
}
