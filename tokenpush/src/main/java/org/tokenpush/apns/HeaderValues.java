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

/**
 * Checks header values against the characters HTTP/2 allows in a field value.
 */
class HeaderValues {

    private HeaderValues() {
        // Prevent instantiation
    }

    /**
     * Checks that a value may be sent as a request header. Horizontal tabs, visible ASCII, spaces and the Latin-1
     * range {@code 0x80-0xFF} are accepted; all other control characters, DEL and anything beyond {@code U+00FF} are
     * rejected.
     *
     * @throws InvalidHeaderException if the value contains a character that may not be sent
     */
    static String requireValidRequestValue(final String name, final String value) throws InvalidHeaderException {
        for (int i = 0; i < value.length(); i++) {
            final char c = value.charAt(i);

            if (!(c == '\t' || (c >= 0x20 && c <= 0x7e) || (c >= 0x80 && c <= 0xff))) {
                throw new InvalidHeaderException(String.format("Value for \"%s\" contains invalid character U+%04X at index %d.",
                        name, (int) c, i));
            }
        }

        return value;
    }

    /**
     * Checks that a response header value is visible ASCII text, allowing spaces and horizontal tabs.
     *
     * @throws HeaderDecodeException if the value contains any other character
     */
    static String requireVisibleAscii(final String name, final CharSequence value) throws HeaderDecodeException {
        for (int i = 0; i < value.length(); i++) {
            final char c = value.charAt(i);

            if (!(c == '\t' || (c >= 0x20 && c <= 0x7e))) {
                throw new HeaderDecodeException(String.format("Response header \"%s\" contains non-ASCII byte 0x%02X at index %d.",
                        name, (int) c, i));
            }
        }

        return value.toString();
    }
}
