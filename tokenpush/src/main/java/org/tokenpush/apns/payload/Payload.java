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
import com.google.gson.JsonObject;

import java.util.Objects;
import java.util.Optional;

/**
 * A complete push notification payload: the {@code aps} dictionary described by a {@link Notification} plus optional
 * custom top-level fields the receiving app reads for itself.
 */
public class Payload {

    /**
     * The name of the top-level field that holds the {@code aps} dictionary. Custom content may not use this name.
     */
    public static final String APS_KEY = "aps";

    private final Notification notification;
    private JsonObject custom;

    /**
     * Constructs a payload with the given {@code aps} dictionary and no custom fields.
     */
    public Payload(final Notification notification) {
        this.notification = Objects.requireNonNull(notification, "Notification must not be null.");
    }

    /**
     * Sets the custom fields of this payload. The given value is converted to a JSON object with a default Gson
     * instance, and each of its properties becomes a top-level field of the serialized payload.
     *
     * @param custom any value Gson serializes as a JSON object, or {@code null} to clear previously-set custom fields
     *
     * @throws PayloadBuildException if the value could not be converted to a JSON object or if it contains an
     * {@value APS_KEY} property
     */
    public Payload setCustom(final Object custom) throws PayloadBuildException {
        return setCustom(custom, JsonObjects.DEFAULT_GSON);
    }

    /**
     * Sets the custom fields of this payload, converting the given value with the given Gson instance.
     *
     * @param custom any value Gson serializes as a JSON object, or {@code null} to clear previously-set custom fields
     * @param gson the Gson instance with which to convert the value
     *
     * @throws PayloadBuildException if the value could not be converted to a JSON object or if it contains an
     * {@value APS_KEY} property
     */
    public Payload setCustom(final Object custom, final Gson gson) throws PayloadBuildException {
        if (custom == null) {
            this.custom = null;
            return this;
        }

        final JsonObject customObject = JsonObjects.toJsonObject(gson, custom);

        if (customObject.has(APS_KEY)) {
            throw new PayloadBuildException("Custom content may not contain an \"" + APS_KEY + "\" property.");
        }

        this.custom = customObject;
        return this;
    }

    public Notification getNotification() {
        return notification;
    }

    public Optional<JsonObject> getCustom() {
        return Optional.ofNullable(custom).map(JsonObject::deepCopy);
    }
}
