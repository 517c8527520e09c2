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

import java.util.List;

/**
 * The alert body of a full alert. Literal text is written to the {@code body} field; localized text is written to
 * {@code loc-key} and, when arguments are given, {@code loc-args}.
 */
public final class Body extends AlertText {

    private Body(final String text) {
        super(text);
    }

    private Body(final String localizationKey, final List<String> localizationArguments) {
        super(localizationKey, localizationArguments);
    }

    /**
     * Returns literal alert body text.
     */
    public static Body of(final String text) {
        return new Body(text);
    }

    /**
     * Returns localized alert body text. The arguments field is omitted when no arguments are given.
     */
    public static Body localized(final String localizationKey, final String... localizationArguments) {
        return new Body(localizationKey, argumentsOrNull(localizationArguments));
    }

    /**
     * Returns localized alert body text. The arguments field is written whenever the given list is non-null, even if it
     * is empty.
     */
    public static Body localized(final String localizationKey, final List<String> localizationArguments) {
        return new Body(localizationKey, localizationArguments);
    }

    @Override
    String getTextFieldName() {
        return "body";
    }

    @Override
    String getLocalizationKeyFieldName() {
        return "loc-key";
    }

    @Override
    String getLocalizationArgumentsFieldName() {
        return "loc-args";
    }
}
