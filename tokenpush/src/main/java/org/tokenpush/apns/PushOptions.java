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
import java.util.Objects;
import java.util.Optional;

/**
 * The per-request options sent to the APNs server as request headers alongside a notification's payload. Only the
 * topic is mandatory; every other option is sent only when set.
 *
 * <p>Options are immutable and are created with a {@link Builder}:</p>
 *
 * <pre>final PushOptions options = new PushOptions.Builder("com.example.app")
 *         .setPushType(PushType.ALERT)
 *         .setPriority(DeliveryPriority.IMMEDIATE)
 *         .build();</pre>
 */
public final class PushOptions {

    private final String topic;
    private final PushType pushType;
    private final String apnsId;
    private final Instant expiration;
    private final DeliveryPriority priority;
    private final String collapseId;

    private PushOptions(final Builder builder) {
        this.topic = builder.topic;
        this.pushType = builder.pushType;
        this.apnsId = builder.apnsId;
        this.expiration = builder.expiration;
        this.priority = builder.priority;
        this.collapseId = builder.collapseId;
    }

    /**
     * Returns the topic of the notification, which is typically the bundle identifier of the receiving app.
     */
    public String getTopic() {
        return topic;
    }

    public Optional<PushType> getPushType() {
        return Optional.ofNullable(pushType);
    }

    /**
     * Returns the caller-chosen canonical identifier for the notification, if any. If absent, the server assigns one.
     */
    public Optional<String> getApnsId() {
        return Optional.ofNullable(apnsId);
    }

    /**
     * Returns the time after which the server should stop trying to deliver the notification, if any. An expiration
     * at the epoch tells the server to attempt delivery only once.
     */
    public Optional<Instant> getExpiration() {
        return Optional.ofNullable(expiration);
    }

    public Optional<DeliveryPriority> getPriority() {
        return Optional.ofNullable(priority);
    }

    /**
     * Returns the identifier under which the device coalesces notifications into one, if any.
     */
    public Optional<String> getCollapseId() {
        return Optional.ofNullable(collapseId);
    }

    @Override
    public String toString() {
        return "PushOptions{" +
                "topic='" + topic + '\'' +
                ", pushType=" + pushType +
                ", apnsId='" + apnsId + '\'' +
                ", expiration=" + expiration +
                ", priority=" + priority +
                ", collapseId='" + collapseId + '\'' +
                '}';
    }

    /**
     * A builder for {@link PushOptions}. Builders are not thread-safe.
     */
    public static class Builder {

        private final String topic;
        private PushType pushType;
        private String apnsId;
        private Instant expiration;
        private DeliveryPriority priority;
        private String collapseId;

        /**
         * Constructs a builder for options with the given topic.
         *
         * @param topic the topic of the notification; must not be {@code null}
         */
        public Builder(final String topic) {
            this.topic = Objects.requireNonNull(topic, "Topic must not be null.");
        }

        public Builder setPushType(final PushType pushType) {
            this.pushType = pushType;
            return this;
        }

        public Builder setApnsId(final String apnsId) {
            this.apnsId = apnsId;
            return this;
        }

        public Builder setExpiration(final Instant expiration) {
            this.expiration = expiration;
            return this;
        }

        public Builder setPriority(final DeliveryPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder setCollapseId(final String collapseId) {
            this.collapseId = collapseId;
            return this;
        }

        public PushOptions build() {
            return new PushOptions(this);
        }
    }
}
