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
 * An enumeration of push notification types, sent to the server in the {@code apns-push-type} header. The push type
 * must match the contents of the notification's payload.
 *
 * @see <a href="https://developer.apple.com/documentation/usernotifications/sending-notification-requests-to-apns">Sending
 * notification requests to APNs</a>
 */
public enum PushType {

    /**
     * Indicates a notification that shows an alert, plays a sound or badges the app icon.
     */
    ALERT("alert"),

    /**
     * Indicates a notification that delivers content in the background without interacting with the user.
     */
    BACKGROUND("background"),

    /**
     * Indicates a notification that requests the user's location.
     */
    LOCATION("location"),

    /**
     * Indicates a notification that wakes a VoIP app for an incoming call.
     */
    VOIP("voip"),

    /**
     * Indicates a notification that updates a watchOS complication.
     */
    COMPLICATION("complication"),

    /**
     * Indicates a notification that signals a File Provider extension.
     */
    FILEPROVIDER("fileprovider"),

    /**
     * Indicates a notification that tells a managed device to contact its MDM server.
     */
    MDM("mdm"),

    /**
     * Indicates a notification that starts, updates or ends a Live Activity.
     */
    LIVE_ACTIVITY("liveactivity"),

    /**
     * Indicates a notification for a Push to Talk app.
     */
    PUSH_TO_TALK("pushtotalk");

    private final String headerValue;

    PushType(final String headerValue) {
        this.headerValue = headerValue;
    }

    public String getHeaderValue() {
        return this.headerValue;
    }

    public static PushType getFromHeaderValue(final CharSequence headerValue) {
        for (final PushType pushType : PushType.values()) {
            if (pushType.headerValue.contentEquals(headerValue)) {
                return pushType;
            }
        }

        throw new IllegalArgumentException("No push type found for header value: " + headerValue);
    }
}
