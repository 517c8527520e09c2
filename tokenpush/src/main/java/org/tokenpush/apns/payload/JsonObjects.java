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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

import java.util.Objects;

/**
 * Utility methods for converting arbitrary values into JSON object trees.
 */
public final class JsonObjects {

    static final Gson DEFAULT_GSON = new GsonBuilder()
            .disableHtmlEscaping()
            .create();

    private JsonObjects() {
        // Prevent instantiation
    }

    /**
     * Converts the given value into a JSON object using the given Gson instance.
     *
     * @param gson the Gson instance with which to convert the value
     * @param value the value to convert; may be a {@link JsonObject}, a {@link java.util.Map} or any other object Gson
     * can serialize as a JSON object
     *
     * @return a JSON object tree representing the given value
     *
     * @throws PayloadBuildException if Gson could not serialize the value or if the value did not serialize as a JSON
     * object; in the latter case, the cause is a {@link NotAnObjectException}
     */
    public static JsonObject toJsonObject(final Gson gson, final Object value) throws PayloadBuildException {
        Objects.requireNonNull(gson, "Gson instance must not be null.");
        Objects.requireNonNull(value, "Value must not be null.");

        final JsonElement element;

        try {
            element = gson.toJsonTree(value);
        } catch (final JsonParseException e) {
            throw new PayloadBuildException("Could not serialize value as JSON.", e);
        }

        if (!element.isJsonObject()) {
            throw new PayloadBuildException("Value must serialize as a JSON object.",
                    new NotAnObjectException("Expected a JSON object, but got " + describe(element) + "."));
        }

        return element.getAsJsonObject();
    }

    private static String describe(final JsonElement element) {
        if (element.isJsonArray()) {
            return "an array";
        } else if (element.isJsonNull()) {
            return "null";
        } else if (element.getAsJsonPrimitive().isString()) {
            return "a string";
        } else if (element.getAsJsonPrimitive().isNumber()) {
            return "a number";
        } else {
            return "a boolean";
        }
    }
}
