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

import java.util.Objects;
import java.util.Optional;

/**
 * The identifiers the APNs server returns for an accepted notification.
 */
public class PushReceipt {

    private final String apnsId;
    private final String apnsUniqueId;

    public PushReceipt(final String apnsId, final String apnsUniqueId) {
        this.apnsId = Objects.requireNonNull(apnsId, "APNs ID must not be null.");
        this.apnsUniqueId = apnsUniqueId;
    }

    /**
     * Returns the canonical identifier of the notification, either chosen by the sender via the {@code apns-id}
     * request header or generated by the server.
     */
    public String getApnsId() {
        return apnsId;
    }

    /**
     * Returns the unique identifier the server assigned to the notification, which may be used to look up the
     * notification's delivery status. Only present when sending to the development environment.
     */
    public Optional<String> getApnsUniqueId() {
        return Optional.ofNullable(apnsUniqueId);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final PushReceipt that = (PushReceipt) o;
        return apnsId.equals(that.apnsId) && Objects.equals(apnsUniqueId, that.apnsUniqueId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(apnsId, apnsUniqueId);
    }

    @Override
    public String toString() {
        return "PushReceipt{" +
                "apnsId='" + apnsId + '\'' +
                ", apnsUniqueId='" + apnsUniqueId + '\'' +
                '}';
    }
}
