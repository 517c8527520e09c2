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

import java.time.Instant;
import java.util.Optional;

/**
 * Indicates that the APNs server received a push notification but rejected it. Carries the HTTP status and the
 * rejection reason reported by the server.
 *
 * @see <a href="https://developer.apple.com/documentation/usernotifications/handling-notification-responses-from-apns">Handling
 * notification responses from APNs</a>
 */
public class ApnsServiceException extends ApnsClientException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;
    private final String reason;
    private final transient Instant timestamp;
    private final transient PushReceipt receipt;

    public ApnsServiceException(final int statusCode, final String reason, final Instant timestamp, final PushReceipt receipt) {
        super("APNs rejected notification with status " + statusCode + ": " + reason);

        this.statusCode = statusCode;
        this.reason = reason;
        this.timestamp = timestamp;
        this.receipt = receipt;
    }

    /**
     * Returns the HTTP status code of the server's response.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * Returns the reason the server gave for rejecting the notification, e.g. {@code BadDeviceToken}.
     */
    public String getReason() {
        return reason;
    }

    /**
     * Returns the time at which the server last confirmed the device token was no longer valid for the topic, if the
     * server reported one. Present only for {@code 410 Unregistered} responses.
     */
    public Optional<Instant> getTimestamp() {
        return Optional.ofNullable(timestamp);
    }

    /**
     * Returns the identifiers the server assigned to the rejected notification.
     */
    public PushReceipt getReceipt() {
        return receipt;
    }
}
