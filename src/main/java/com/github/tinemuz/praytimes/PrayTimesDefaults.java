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

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Library-wide defaults, loaded once from the classpath resource
 * <code>praytimes.properties</code>. Call {@link #preload()} at startup to
 * surface a missing or malformed resource early.
 */
public final class PrayTimesDefaults {
    private static final Logger log = LoggerFactory.getLogger(PrayTimesDefaults.class);
    static final String RESOURCE = "praytimes.properties";

    private static volatile boolean loaded = false;
    private static CalculationMethod method;
    private static Settings settings;
    private static int iterations;
    private static TimeFormat timeFormat;
    private static String invalidTime;

    private PrayTimesDefaults() {}

    /** Load the defaults resource now instead of on first use. */
    public static void preload() {
        ensureLoaded();
    }

    public static CalculationMethod method() {
        ensureLoaded();
        return method;
    }

    /** Default settings, already merged with the default method's parameters. */
    public static Settings settings() {
        ensureLoaded();
        return settings;
    }

    public static int iterations() {
        ensureLoaded();
        return iterations;
    }

    public static TimeFormat timeFormat() {
        ensureLoaded();
        return timeFormat;
    }

    /** Marker rendered for times that cannot be computed. */
    public static String invalidTime() {
        ensureLoaded();
        return invalidTime;
    }

    private static synchronized void ensureLoaded() {
        if (loaded) return;
        loadFromResource();
        loaded = true;
    }

    /**
     * Read and validate the defaults. Any problem reading or parsing the
     * resource is logged and rethrown as IllegalStateException.
     */
    private static void loadFromResource() {
        InputStream in = PrayTimesDefaults.class.getClassLoader().getResourceAsStream(RESOURCE);
        if (in == null) {
            log.error("Defaults file '{}' not found on classpath", RESOURCE);
            throw new IllegalStateException("Defaults file '" + RESOURCE + "' not found on classpath");
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            Properties props = new Properties();
            props.load(reader);
            CalculationMethod m = CalculationMethod.fromName(required(props, "method"));
            MethodParameters p = m.params();
            Settings s = new Settings(
                    TimeParameter.parse(required(props, "imsak")),
                    p.fajr(),
                    TimeParameter.parse(required(props, "dhuhr")).value(),
                    AsrConvention.factorOf(required(props, "asr")),
                    p.maghrib(),
                    p.isha(),
                    p.midnight(),
                    HighLatitudeRule.parse(required(props, "highLats")));
            int iters = Integer.parseInt(required(props, "iterations"));
            if (iters < 1) {
                throw new IllegalArgumentException("iterations must be >= 1, got " + iters);
            }
            method = m;
            settings = s;
            iterations = iters;
            timeFormat = TimeFormat.parse(required(props, "timeFormat"));
            invalidTime = props.getProperty("invalidTime", "-----");
            log.debug("Loaded defaults: method={}, settings={}, iterations={}", m.id(), s, iters);
        } catch (IOException e) {
            log.error("Failed to read defaults file '{}'", RESOURCE, e);
            throw new IllegalStateException("Failed to read defaults file '" + RESOURCE + "'", e);
        } catch (RuntimeException e) {
            log.error("Failed to parse defaults file '{}'", RESOURCE, e);
            throw new IllegalStateException("Failed to parse defaults file '" + RESOURCE + "'", e);
        }
    }

    private static String required(Properties props, String key) {
        String v = props.getProperty(key);
        if (v == null || v.isBlank()) {
            throw new IllegalArgumentException("Missing required key '" + key + "'");
        }
        return v.trim();
    }
}
