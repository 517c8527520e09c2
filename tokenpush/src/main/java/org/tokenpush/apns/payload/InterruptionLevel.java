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

import com.google.gson.annotations.SerializedName;

/**
 * An enumeration of interruption levels that may be specified in a notification. Interruption levels tell the
 * receiving device how urgently it should present a notification.
 */
public enum InterruptionLevel {

    /**
     * The device adds the notification to its list without lighting up the screen or playing a sound.
     */
    @SerializedName("passive")
    PASSIVE("passive"),

    /**
     * The device presents the notification immediately. Notifications with no explicit interruption level are
     * treated as {@code active}.
     */
    @SerializedName("active")
    ACTIVE("active"),

    /**
     * The device presents the notification immediately, even when a focus mode would otherwise hold it back.
     */
    @SerializedName("time-sensitive")
    TIME_SENSITIVE("time-sensitive"),

    /**
     * The device presents the notification immediately and bypasses the mute switch. Sending critical notifications
     * requires a special entitlement.
     */
    @SerializedName("critical")
    CRITICAL("critical");

    private final String value;

    InterruptionLevel(final String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
