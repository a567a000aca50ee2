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
 * Calculation settings: the active method's parameters merged with the
 * caller's overrides. Immutable; every {@code with*} call returns a copy.
 *
 * @param imsak        angle, or minutes before fajr
 * @param fajr         fajr depression angle
 * @param dhuhrMinutes minutes added to solar noon
 * @param asrFactor    asr shadow factor (1 standard, 2 Hanafi)
 * @param maghrib      angle, or minutes after sunset
 * @param isha         angle, or minutes after maghrib
 * @param midnight     midnight convention
 * @param highLats     high latitude correction rule
 */
public record Settings(
        TimeParameter imsak,
        TimeParameter fajr,
        double dhuhrMinutes,
        double asrFactor,
        TimeParameter maghrib,
        TimeParameter isha,
        MidnightMode midnight,
        HighLatitudeRule highLats) {

    public Settings {
        if (imsak == null || fajr == null || maghrib == null || isha == null
                || midnight == null || highLats == null) {
            throw new IllegalArgumentException("settings must be fully populated");
        }
        AsrConvention.checkFactor(asrFactor, String.valueOf(asrFactor));
    }

    /**
     * Overwrite the fields a calculation method defines (fajr, isha, maghrib,
     * midnight). Imsak, dhuhr, asr and highLats are kept.
     */
    public Settings applying(MethodParameters p) {
        return new Settings(imsak, p.fajr(), dhuhrMinutes, asrFactor, p.maghrib(), p.isha(), p.midnight(), highLats);
    }

    public Settings withImsak(TimeParameter v) {
        return new Settings(v, fajr, dhuhrMinutes, asrFactor, maghrib, isha, midnight, highLats);
    }

    public Settings withFajr(TimeParameter v) {
        return new Settings(imsak, v, dhuhrMinutes, asrFactor, maghrib, isha, midnight, highLats);
    }

    public Settings withDhuhrMinutes(double v) {
        return new Settings(imsak, fajr, v, asrFactor, maghrib, isha, midnight, highLats);
    }

    public Settings withAsrFactor(double v) {
        return new Settings(imsak, fajr, dhuhrMinutes, v, maghrib, isha, midnight, highLats);
    }

    public Settings withAsr(AsrConvention v) {
        return withAsrFactor(v.shadowFactor());
    }

    public Settings withMaghrib(TimeParameter v) {
        return new Settings(imsak, fajr, dhuhrMinutes, asrFactor, v, isha, midnight, highLats);
    }

    public Settings withIsha(TimeParameter v) {
        return new Settings(imsak, fajr, dhuhrMinutes, asrFactor, maghrib, v, midnight, highLats);
    }

    public Settings withMidnight(MidnightMode v) {
        return new Settings(imsak, fajr, dhuhrMinutes, asrFactor, maghrib, isha, v, highLats);
    }

    public Settings withHighLats(HighLatitudeRule v) {
        return new Settings(imsak, fajr, dhuhrMinutes, asrFactor, maghrib, isha, midnight, v);
    }

    /**
     * Apply one override in its textual form, as found in configuration files.
     * Keys: imsak, fajr, dhuhr, asr, maghrib, isha, midnight, highLats.
     *
     * @throws IllegalArgumentException for an unknown key or malformed value
     * @throws InvalidAsrConventionException for a bad asr value
     */
    public Settings with(String key, String value) {
        switch (key) {
            case "imsak":
                return withImsak(TimeParameter.parse(value));
            case "fajr":
                return withFajr(TimeParameter.parse(value));
            case "dhuhr":
                return withDhuhrMinutes(TimeParameter.parse(value).value());
            case "asr":
                return withAsrFactor(AsrConvention.factorOf(value));
            case "maghrib":
                return withMaghrib(TimeParameter.parse(value));
            case "isha":
                return withIsha(TimeParameter.parse(value));
            case "midnight":
                return withMidnight(MidnightMode.parse(value));
            case "highLats":
                return withHighLats(HighLatitudeRule.parse(value));
            default:
                throw new IllegalArgumentException("Unknown setting: '" + key + "'");
        }
    }
}
