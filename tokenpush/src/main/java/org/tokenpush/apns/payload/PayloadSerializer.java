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

/**
 * Serializes {@link Payload} and {@link Notification} instances as the JSON APNs expects. Serializers are immutable
 * and may be shared between threads.
 */
public class PayloadSerializer {

    private final Gson gson;

    /**
     * Constructs a serializer with a default Gson instance that does not escape HTML characters.
     */
    public PayloadSerializer() {
        this(JsonObjects.DEFAULT_GSON);
    }

    /**
     * Constructs a serializer that uses the given Gson instance, which may carry type adapters for custom content.
     *
     * @param gson the Gson instance to use; must not be configured to serialize nulls, since unset fields are
     * represented as nulls and must be omitted
     */
    public PayloadSerializer(final Gson gson) {
        Objects.requireNonNull(gson, "Gson instance must not be null.");

        if (gson.serializeNulls()) {
            throw new IllegalArgumentException("Gson instances that serialize nulls cannot be used to serialize payloads.");
        }

        this.gson = gson;
    }

    /**
     * Returns the JSON object tree for the given payload: an {@code aps} property holding the notification, followed
     * by the payload's custom properties in insertion order.
     */
    public JsonObject toJsonObject(final Payload payload) {
        final JsonObject root = new JsonObject();
        root.add(Payload.APS_KEY, gson.toJsonTree(payload.getNotification()));

        payload.getCustom().ifPresent(custom -> custom.entrySet()
                .forEach(entry -> root.add(entry.getKey(), entry.getValue())));

        return root;
    }

    public String serialize(final Payload payload) {
        return gson.toJson(toJsonObject(payload));
    }

    public String serialize(final Notification notification) {
        return gson.toJson(notification);
    }
}
