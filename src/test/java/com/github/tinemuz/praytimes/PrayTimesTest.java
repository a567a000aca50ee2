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

import static org.junit.jupiter.api.Assertions.*;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PrayTimesTest {

    private static final Location WATERLOO = new Location(43, -80);
    private static final LocalDate DATE = LocalDate.of(2011, 2, 9);

    @Nested
    @DisplayName("Stateful facade")
    class FacadeTests {

        @Test
        @DisplayName("Formatted times for the manual sample")
        void sample() {
            PrayTimes pt = new PrayTimes("ISNA");
            Map<PrayerTime, String> times = pt.getTimes(DATE, WATERLOO, -5, 0);
            assertEquals("07:26", times.get(PrayerTime.SUNRISE));
            assertEquals("12:34", times.get(PrayerTime.DHUHR));
            assertEquals("19:03", times.get(PrayerTime.ISHA));
        }

        @Test
        @DisplayName("Zone-based times match explicit offsets")
        void zone() {
            PrayTimes pt = new PrayTimes("ISNA");
            assertEquals(pt.getTimes(DATE, WATERLOO, -5, 0),
                    pt.getTimes(DATE, WATERLOO, ZoneId.of("America/Toronto")));
        }

        @Test
        @DisplayName("12h format and custom invalid marker")
        void formatOptions() {
            PrayTimes pt = new PrayTimes("ISNA");
            assertEquals("5:43 pm", pt.getTimes(DATE, WATERLOO, -5, 0, TimeFormat.H12).get(PrayerTime.SUNSET));

            pt.adjust(Map.of("highLats", "None"));
            pt.setInvalidTime("n/a");
            pt.setTimeFormat(TimeFormat.H12_NO_SUFFIX);
            Map<PrayerTime, String> polar =
                    pt.getTimes(LocalDate.of(2024, 6, 1), new Location(66, 25), 3, 0);
            assertEquals("n/a", polar.get(PrayerTime.FAJR));
            assertEquals("2:30", polar.get(PrayerTime.SUNRISE));
        }

        @Test
        @DisplayName("Custom 12h suffixes")
        void suffixes() {
            PrayTimes pt = new PrayTimes("ISNA");
            pt.setTimeFormat(TimeFormat.H12);
            pt.setTimeSuffixes("AM", "PM");
            Map<PrayerTime, String> times = pt.getTimes(DATE, WATERLOO, -5, 0);
            assertEquals("7:26 AM", times.get(PrayerTime.SUNRISE));
            assertEquals("5:43 PM", times.get(PrayerTime.SUNSET));
        }

        @Test
        @DisplayName("Explicit standard offset with DST read from a zone")
        void offsetWithZoneDst() {
            PrayTimes pt = new PrayTimes("ISNA");
            LocalDate summer = LocalDate.of(2011, 7, 9);
            ZoneId toronto = ZoneId.of("America/Toronto");
            assertEquals(pt.getTimes(summer, WATERLOO, -5, 1), pt.getTimes(summer, WATERLOO, -5, toronto));
            assertEquals(pt.getTimes(DATE, WATERLOO, -5, 0), pt.getTimes(DATE, WATERLOO, -5, toronto));
        }

        @Test
        @DisplayName("setMethod with an unknown name keeps the previous method and settings")
        void invalidMethodKeepsState() {
            PrayTimes pt = new PrayTimes("Jafari");
            pt.adjust(Map.of("asr", "Hanafi"));
            Settings before = pt.getSettings();
            assertThrows(InvalidMethodException.class, () -> pt.setMethod("Unknown"));
            assertSame(CalculationMethod.JAFARI, pt.getMethod());
            assertEquals(before, pt.getSettings());
        }

        @Test
        @DisplayName("Unknown method in the constructor fails fast")
        void invalidConstructor() {
            assertThrows(InvalidMethodException.class, () -> new PrayTimes("Default"));
        }

        @Test
        @DisplayName("Tune shifts the formatted time")
        void tune() {
            PrayTimes pt = new PrayTimes("ISNA");
            pt.tune(Map.of(PrayerTime.DHUHR, 2.0));
            assertEquals(2.0, pt.getOffsets().get(PrayerTime.DHUHR));
            assertEquals("12:36", pt.getTimes(DATE, WATERLOO, -5, 0).get(PrayerTime.DHUHR));
        }

        @Test
        @DisplayName("Snapshot is unaffected by later mutation")
        void snapshot() {
            PrayTimes pt = new PrayTimes();
            PrayTimesConfig snap = pt.snapshot();
            pt.setMethod(CalculationMethod.MAKKAH);
            assertSame(CalculationMethod.MWL, snap.method());
            assertSame(CalculationMethod.MAKKAH, pt.getMethod());
        }
    }

    @Nested
    @DisplayName("Thread Safety Tests")
    class ThreadSafetyTests {

        @Test
        @DisplayName("Shared configuration snapshot from multiple threads")
        void concurrentSnapshot() throws InterruptedException {
            final PrayTimesConfig config = PrayTimesConfig.of(CalculationMethod.MWL);
            final PrayerTimeSet expected = PrayerTimesCalculator.compute(config, WATERLOO, DATE, -5, 0);
            final int threadCount = 8;
            final boolean[] ok = new boolean[threadCount];
            Thread[] threads = new Thread[threadCount];

            for (int i = 0; i < threadCount; i++) {
                final int id = i;
                threads[i] = new Thread(() -> {
                    boolean same = true;
                    for (int j = 0; j < 200; j++) {
                        PrayerTimeSet r = PrayerTimesCalculator.compute(config, WATERLOO, DATE, -5, 0);
                        same &= expected.equals(r);
                    }
                    ok[id] = same;
                });
                threads[i].start();
            }
            for (Thread t : threads) {
                t.join();
            }
            for (boolean b : ok) {
                assertTrue(b, "every thread sees identical results");
            }
        }
    }

    @Nested
    @DisplayName("Performance Tests")
    class PerformanceTests {

        @Test
        @DisplayName("A day's times compute in well under a millisecond after warmup")
        void fast() {
            PrayTimesConfig config = PrayTimesConfig.defaults();
            for (int i = 0; i < 2000; i++) {
                PrayerTimesCalculator.compute(config, WATERLOO, DATE.plusDays(i % 365), -5, 0);
            }
            long start = System.nanoTime();
            for (int i = 0; i < 10000; i++) {
                PrayerTimesCalculator.compute(config, WATERLOO, DATE.plusDays(i % 365), -5, 0);
            }
            double avgMicros = (System.nanoTime() - start) / 10000.0 / 1000.0;
            assertTrue(avgMicros < 500, "Compute < 500us: " + avgMicros);
        }
    }
}
