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

package org.tokenpush.apns.payload;

import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;

/**
 * A Gson type adapter for boolean flags that APNs expects as the integer {@code 1} when set and as an absent field
 * otherwise. {@code true} is written as {@code 1}; {@code false} and {@code null} are written as JSON {@code null},
 * which Gson drops from objects unless it has been configured to serialize nulls.
 */
public class IntegerFlagTypeAdapter extends TypeAdapter<Boolean> {

    @Override
    public void write(final JsonWriter out, final Boolean value) throws IOException {
        if (Boolean.TRUE.equals(value)) {
            out.value(1);
        } else {
            out.nullValue();
        }
    }

    /**
     * Payloads are only ever written, so flags are never read back.
     *
     * @throws UnsupportedOperationException always
     */
    @Override
    public Boolean read(final JsonReader in) {
        throw new UnsupportedOperationException("Integer flags are write-only.");
    }
}
