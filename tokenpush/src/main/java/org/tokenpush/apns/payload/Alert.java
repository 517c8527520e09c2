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

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializationContext;
import com.google.gson.JsonSerializer;
import com.google.gson.annotations.JsonAdapter;

import java.lang.reflect.Type;
import java.util.Objects;
import java.util.Optional;

/**
 * The alert portion of a notification. An alert is either a plain string, which the device shows as the notification
 * body, or a full alert composed of an optional title, subtitle, body and launch image.
 *
 * <p>Plain alerts serialize as a bare JSON string. Full alerts serialize as an object into which the title, subtitle
 * and body fields are flattened, in that order, followed by {@code launch-image}.</p>
 */
@JsonAdapter(Alert.AlertSerializer.class)
public final class Alert {

    /**
     * The form of an alert.
     */
    public enum Kind {
        TEXT,
        FULL
    }

    private final Kind kind;

    private final String text;

    private final Title title;
    private final Subtitle subtitle;
    private final Body body;
    private final String launchImage;

    private Alert(final String text) {
        this.kind = Kind.TEXT;
        this.text = Objects.requireNonNull(text, "Alert text must not be null.");

        this.title = null;
        this.subtitle = null;
        this.body = null;
        this.launchImage = null;
    }

    private Alert(final Title title, final Subtitle subtitle, final Body body, final String launchImage) {
        this.kind = Kind.FULL;
        this.text = null;

        this.title = title;
        this.subtitle = subtitle;
        this.body = body;
        this.launchImage = launchImage;
    }

    /**
     * Returns a plain alert with the given body text.
     */
    public static Alert text(final String text) {
        return new Alert(text);
    }

    /**
     * Returns a full alert. Any of the given parts may be {@code null}, in which case the corresponding fields are
     * omitted.
     */
    public static Alert full(final Title title, final Subtitle subtitle, final Body body, final String launchImage) {
        return new Alert(title, subtitle, body, launchImage);
    }

    /**
     * Returns a full alert with the given title and body.
     */
    public static Alert full(final Title title, final Body body) {
        return new Alert(title, null, body, null);
    }

    public Kind getKind() {
        return kind;
    }

    public Optional<String> getText() {
        return Optional.ofNullable(text);
    }

    public Optional<Title> getTitle() {
        return Optional.ofNullable(title);
    }

    public Optional<Subtitle> getSubtitle() {
        return Optional.ofNullable(subtitle);
    }

    public Optional<Body> getBody() {
        return Optional.ofNullable(body);
    }

    public Optional<String> getLaunchImage() {
        return Optional.ofNullable(launchImage);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final Alert alert = (Alert) o;
        return kind == alert.kind &&
                Objects.equals(text, alert.text) &&
                Objects.equals(title, alert.title) &&
                Objects.equals(subtitle, alert.subtitle) &&
                Objects.equals(body, alert.body) &&
                Objects.equals(launchImage, alert.launchImage);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text, title, subtitle, body, launchImage);
    }

    static class AlertSerializer implements JsonSerializer<Alert> {

        @Override
        public JsonElement serialize(final Alert alert, final Type type, final JsonSerializationContext context) {
            if (alert.kind == Kind.TEXT) {
                return new JsonPrimitive(alert.text);
            }

            final JsonObject object = new JsonObject();

            if (alert.title != null) {
                alert.title.addTo(object);
            }

            if (alert.subtitle != null) {
                alert.subtitle.addTo(object);
            }

            if (alert.body != null) {
                alert.body.addTo(object);
            }

            if (alert.launchImage != null) {
                object.addProperty("launch-image", alert.launchImage);
            }

            return object;
        }
    }
}
