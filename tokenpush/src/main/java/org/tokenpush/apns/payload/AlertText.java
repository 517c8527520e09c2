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

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A piece of alert text: either a literal string shown as-is or a localization key (with optional format arguments)
 * the receiving device resolves from the app's string tables. Subclasses name the alert fields each form is written
 * to.
 */
public abstract class AlertText {

    /**
     * The form of a piece of alert text.
     */
    public enum Kind {
        LITERAL,
        LOCALIZED
    }

    private final Kind kind;

    private final String text;
    private final String localizationKey;
    private final List<String> localizationArguments;

    AlertText(final String text) {
        this.kind = Kind.LITERAL;
        this.text = Objects.requireNonNull(text, "Text must not be null.");
        this.localizationKey = null;
        this.localizationArguments = null;
    }

    AlertText(final String localizationKey, final List<String> localizationArguments) {
        this.kind = Kind.LOCALIZED;
        this.text = null;
        this.localizationKey = Objects.requireNonNull(localizationKey, "Localization key must not be null.");
        this.localizationArguments = localizationArguments != null ?
                Collections.unmodifiableList(new ArrayList<>(localizationArguments)) : null;
    }

    static List<String> argumentsOrNull(final String... arguments) {
        return arguments != null && arguments.length > 0 ? Arrays.asList(arguments) : null;
    }

    public Kind getKind() {
        return kind;
    }

    public Optional<String> getText() {
        return Optional.ofNullable(text);
    }

    public Optional<String> getLocalizationKey() {
        return Optional.ofNullable(localizationKey);
    }

    public Optional<List<String>> getLocalizationArguments() {
        return Optional.ofNullable(localizationArguments);
    }

    abstract String getTextFieldName();

    abstract String getLocalizationKeyFieldName();

    abstract String getLocalizationArgumentsFieldName();

    /**
     * Writes the fields for this piece of text into the given alert object.
     */
    void addTo(final JsonObject alert) {
        if (kind == Kind.LITERAL) {
            alert.addProperty(getTextFieldName(), text);
        } else {
            alert.addProperty(getLocalizationKeyFieldName(), localizationKey);

            if (localizationArguments != null) {
                final JsonArray arguments = new JsonArray(localizationArguments.size());
                localizationArguments.forEach(arguments::add);

                alert.add(getLocalizationArgumentsFieldName(), arguments);
            }
        }
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final AlertText that = (AlertText) o;
        return kind == that.kind &&
                Objects.equals(text, that.text) &&
                Objects.equals(localizationKey, that.localizationKey) &&
                Objects.equals(localizationArguments, that.localizationArguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text, localizationKey, localizationArguments);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "kind=" + kind +
                ", text='" + text + '\'' +
                ", localizationKey='" + localizationKey + '\'' +
                ", localizationArguments=" + localizationArguments +
                '}';
    }
}
