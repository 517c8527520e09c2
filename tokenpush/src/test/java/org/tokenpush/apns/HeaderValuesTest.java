/*
 * Copyright (c) 2020 Jon Chambers
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */

package org.tokenpush.apns;

import io.netty.util.AsciiString;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

public class HeaderValuesTest {

    @ParameterizedTest
    @ValueSource(strings = {"", "com.example.app", "with\ttab", "spaces are fine", "café", "ÿ"})
    void testRequireValidRequestValue(final String value) throws InvalidHeaderException {
        assertEquals(value, HeaderValues.requireValidRequestValue("test", value));
    }

    @ParameterizedTest
    @ValueSource(strings = {"line\nbreak", "carriage\rreturn", "nul\u0000", "del\u007f", "Ā", "snow☃man"})
    void testRequireValidRequestValueInvalid(final String value) {
        assertThrows(InvalidHeaderException.class, () -> HeaderValues.requireValidRequestValue("test", value));
    }

    @Test
    void testRequireVisibleAscii() throws HeaderDecodeException {
        assertEquals("a\tb c~", HeaderValues.requireVisibleAscii("test", new AsciiString("a\tb c~")));
    }

    @Test
    void testRequireVisibleAsciiInvalid() {
        final AsciiString nonAscii = new AsciiString(new byte[] { 'i', 'd', (byte) 0xc3, (byte) 0xa9 });

        assertThrows(HeaderDecodeException.class, () -> HeaderValues.requireVisibleAscii("test", nonAscii));
        assertThrows(HeaderDecodeException.class, () -> HeaderValues.requireVisibleAscii("test", "del\u007f"));
        assertThrows(HeaderDecodeException.class, () -> HeaderValues.requireVisibleAscii("test", "line\nbreak"));
    }
}
