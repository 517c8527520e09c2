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

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

import java.time.Instant;

class ErrorResponse {
    private final String reason;
    private final Instant timestamp;

    ErrorResponse(final String reason, final Instant timestamp) {
        this.reason = reason;
        this.timestamp = timestamp;
    }

    /**
     * Decodes an error response body of the form {@code {"reason": "...", "timestamp": <epoch millis>}}, where the
     * timestamp is optional.
     *
     * @throws InvalidResponseException if the body is not a JSON object with a string reason and, if present, an
     * integer timestamp
     */
    static ErrorResponse fromJson(final String json) throws InvalidResponseException {
        final JsonElement element;

        try {
            element = JsonParser.parseString(json);
        } catch (final JsonParseException e) {
            throw new InvalidResponseException("Could not parse error response body.", e);
        }

        if (!element.isJsonObject()) {
            throw new InvalidResponseException("Error response body was not a JSON object.");
        }

        final JsonObject errorResponseObject = element.getAsJsonObject();

        final JsonElement reasonElement = errorResponseObject.get("reason");

        if (!isString(reasonElement)) {
            throw new InvalidResponseException("Error response body did not contain a reason.");
        }

        final JsonElement timestampElement = errorResponseObject.get("timestamp");
        final Instant timestamp;

        if (timestampElement == null || timestampElement.isJsonNull()) {
            timestamp = null;
        } else if (timestampElement.isJsonPrimitive() && timestampElement.getAsJsonPrimitive().isNumber()) {
            try {
                timestamp = Instant.ofEpochMilli(timestampElement.getAsJsonPrimitive().getAsBigDecimal().longValueExact());
            } catch (final ArithmeticException e) {
                throw new InvalidResponseException("Error response timestamp was not an integer.", e);
            }
        } else {
            throw new InvalidResponseException("Error response timestamp was not a number.");
        }

        return new ErrorResponse(reasonElement.getAsString(), timestamp);
    }

    private static boolean isString(final JsonElement element) {
        return element != null && element.isJsonPrimitive() && ((JsonPrimitive) element).isString();
    }

    String getReason() {
        return this.reason;
    }

    Instant getTimestamp() {
        return this.timestamp;
    }
}
