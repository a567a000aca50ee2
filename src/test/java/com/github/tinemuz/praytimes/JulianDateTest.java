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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class JulianDateTest {

    @Test
    @DisplayName("Known Julian days")
    void knownValues() {
        assertEquals(2451544.5, JulianDate.of(2000, 1, 1));
        assertEquals(2446822.5, JulianDate.of(1987, 1, 27));
        assertEquals(2436115.5, JulianDate.of(1957, 10, 4));
        assertEquals(2460390.5, JulianDate.of(2024, 3, 21));
    }

    @Test
    @DisplayName("January and February count as months 13 and 14 of the previous year")
    void earlyMonths() {
        assertEquals(JulianDate.of(2024, 3, 1) - 1, JulianDate.of(2024, 2, 29));
        assertEquals(JulianDate.of(2024, 1, 1) - 1, JulianDate.of(2023, 12, 31));
    }

    @Test
    @DisplayName("Consecutive days differ by exactly one")
    void consecutiveDays() {
        LocalDate d = LocalDate.of(1999, 12, 1);
        for (int i = 0; i < 500; i++) {
            assertEquals(JulianDate.of(d) + 1, JulianDate.of(d.plusDays(1)), d.toString());
            d = d.plusDays(1);
        }
    }

    @Test
    @DisplayName("Longitude shifts the base by longitude/360 of a day")
    void longitudeShift() {
        LocalDate d = LocalDate.of(2024, 3, 21);
        assertEquals(JulianDate.of(d) - 0.25, JulianDate.atLongitude(d, 90), 1e-12);
        assertEquals(JulianDate.of(d) + 0.5, JulianDate.atLongitude(d, -180), 1e-12);
    }
}
