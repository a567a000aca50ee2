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
import org.junit.jupiter.api.Test;

class CalculationMethodTest {

    @Test
    @DisplayName("Angles of the published conventions")
    void table() {
        assertEquals(18.0, CalculationMethod.MWL.params().fajr().value());
        assertEquals(TimeParameter.degrees(17), CalculationMethod.MWL.params().isha());
        assertEquals(TimeParameter.degrees(15), CalculationMethod.ISNA.params().isha());
        assertEquals(19.5, CalculationMethod.EGYPT.params().fajr().value());
        assertEquals(TimeParameter.minutes(90), CalculationMethod.MAKKAH.params().isha());
        assertEquals(18.0, CalculationMethod.KARACHI.params().isha().value());
        assertEquals(TimeParameter.degrees(4.5), CalculationMethod.TEHRAN.params().maghrib());
        assertEquals(TimeParameter.degrees(4), CalculationMethod.JAFARI.params().maghrib());
    }

    @Test
    @DisplayName("Unset maghrib and midnight fall back to 0 min and Standard")
    void defaultsFilled() {
        for (CalculationMethod m : CalculationMethod.values()) {
            MethodParameters p = m.params();
            assertNotNull(p.maghrib(), m.name());
            assertNotNull(p.midnight(), m.name());
        }
        assertEquals(TimeParameter.minutes(0), CalculationMethod.MWL.params().maghrib());
        assertEquals(MidnightMode.STANDARD, CalculationMethod.ISNA.params().midnight());
        assertEquals(MidnightMode.JAFARI, CalculationMethod.TEHRAN.params().midnight());
        assertEquals(MidnightMode.JAFARI, CalculationMethod.JAFARI.params().midnight());
    }

    @Test
    @DisplayName("Lookup by identifier or constant name")
    void lookup() {
        assertSame(CalculationMethod.EGYPT, CalculationMethod.fromName("Egypt"));
        assertSame(CalculationMethod.EGYPT, CalculationMethod.fromName("EGYPT"));
        assertSame(CalculationMethod.MWL, CalculationMethod.fromName("MWL"));
        assertEquals("Umm Al-Qura University, Makkah", CalculationMethod.fromName("Makkah").displayName());
    }

    @Test
    @DisplayName("Unknown names fail instead of falling back")
    void unknownName() {
        InvalidMethodException e =
                assertThrows(InvalidMethodException.class, () -> CalculationMethod.fromName("Moonsighting"));
        assertEquals("Moonsighting", e.getMethodName());
        assertThrows(InvalidMethodException.class, () -> CalculationMethod.fromName("egypt"));
        assertThrows(InvalidMethodException.class, () -> CalculationMethod.fromName(null));
    }

    @Test
    @DisplayName("Fajr must be an angle")
    void fajrMustBeAngle() {
        assertThrows(IllegalArgumentException.class,
                () -> new MethodParameters(TimeParameter.minutes(90), TimeParameter.degrees(17), null, null));
    }
}
