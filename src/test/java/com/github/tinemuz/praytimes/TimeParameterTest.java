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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class TimeParameterTest {

    @Nested
    @DisplayName("Textual parameters")
    class ParseTests {

        @Test
        @DisplayName("Plain numbers are angles")
        void angles() {
            assertEquals(TimeParameter.degrees(18), TimeParameter.parse("18"));
            assertEquals(TimeParameter.degrees(18.5), TimeParameter.parse(" 18.5 "));
            assertEquals(TimeParameter.degrees(-0.5), TimeParameter.parse("-0.5"));
        }

        @Test
        @DisplayName("'min' marks minutes")
        void minutes() {
            assertEquals(TimeParameter.minutes(10), TimeParameter.parse("10 min"));
            assertEquals(TimeParameter.minutes(90), TimeParameter.parse("90min"));
            assertEquals(TimeParameter.minutes(0), TimeParameter.parse("0 minutes"));
        }

        @Test
        @DisplayName("Text without a leading number is rejected")
        void rejects() {
            assertThrows(IllegalArgumentException.class, () -> TimeParameter.parse("min"));
            assertThrows(IllegalArgumentException.class, () -> TimeParameter.parse(""));
            assertThrows(IllegalArgumentException.class, () -> TimeParameter.parse("1.2.3"));
        }

        @Test
        @DisplayName("toString gives the textual form back")
        void textualForm() {
            assertEquals("10 min", TimeParameter.minutes(10).toString());
            assertEquals("17.5", TimeParameter.degrees(17.5).toString());
            assertEquals("18", TimeParameter.degrees(18).toString());
        }
    }

    @Nested
    @DisplayName("Named enums")
    class EnumParseTests {

        @Test
        @DisplayName("Asr conventions and numeric factors")
        void asr() {
            assertEquals(1.0, AsrConvention.factorOf("Standard"));
            assertEquals(2.0, AsrConvention.factorOf("hanafi"));
            assertEquals(1.5, AsrConvention.factorOf("1.5"));
        }

        @Test
        @DisplayName("Bad asr values fail with InvalidAsrConventionException")
        void badAsr() {
            assertThrows(InvalidAsrConventionException.class, () -> AsrConvention.factorOf("Maliki"));
            assertThrows(InvalidAsrConventionException.class, () -> AsrConvention.factorOf("0"));
            assertThrows(InvalidAsrConventionException.class, () -> AsrConvention.factorOf("-2"));
            assertThrows(InvalidAsrConventionException.class, () -> AsrConvention.factorOf("NaN"));
            assertThrows(InvalidAsrConventionException.class, () -> AsrConvention.factorOf(null));
        }

        @Test
        @DisplayName("High latitude rules, midnight modes and prayer names")
        void labels() {
            assertSame(HighLatitudeRule.NIGHT_MIDDLE, HighLatitudeRule.parse("NightMiddle"));
            assertSame(HighLatitudeRule.ANGLE_BASED, HighLatitudeRule.parse("anglebased"));
            assertSame(HighLatitudeRule.NONE, HighLatitudeRule.parse("None"));
            assertSame(MidnightMode.JAFARI, MidnightMode.parse("Jafari"));
            assertSame(PrayerTime.MAGHRIB, PrayerTime.parse("Maghrib"));
            assertSame(PrayerTime.MIDNIGHT, PrayerTime.parse("MIDNIGHT"));
            assertThrows(IllegalArgumentException.class, () -> HighLatitudeRule.parse("Polar"));
            assertThrows(IllegalArgumentException.class, () -> MidnightMode.parse("Late"));
            assertThrows(IllegalArgumentException.class, () -> PrayerTime.parse("Tahajjud"));
        }

        @Test
        @DisplayName("Every label parses back to its constant")
        void labelRoundTrip() {
            for (HighLatitudeRule r : HighLatitudeRule.values()) {
                assertSame(r, HighLatitudeRule.parse(r.label()));
            }
            for (MidnightMode m : MidnightMode.values()) {
                assertSame(m, MidnightMode.parse(m.label()));
            }
            for (AsrConvention c : AsrConvention.values()) {
                assertEquals(c.shadowFactor(), AsrConvention.factorOf(c.label()));
            }
        }

        @Test
        @DisplayName("Night portions")
        void nightPortions() {
            assertEquals(5.0, HighLatitudeRule.NIGHT_MIDDLE.nightPortion(18, 10), 1e-12);
            assertEquals(10.0 / 7, HighLatitudeRule.ONE_SEVENTH.nightPortion(18, 10), 1e-12);
            assertEquals(3.0, HighLatitudeRule.ANGLE_BASED.nightPortion(18, 10), 1e-12);
        }
    }
}
