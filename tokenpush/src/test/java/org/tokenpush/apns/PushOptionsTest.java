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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

public class PushOptionsTest {

    @Test
    void testDefaults() {
        final PushOptions options = new PushOptions.Builder("com.example.app").build();

        assertEquals("com.example.app", options.getTopic());
        assertFalse(options.getPushType().isPresent());
        assertFalse(options.getApnsId().isPresent());
        assertFalse(options.getExpiration().isPresent());
        assertFalse(options.getPriority().isPresent());
        assertFalse(options.getCollapseId().isPresent());
    }

    @Test
    void testBuilder() {
        final Instant expiration = Instant.ofEpochSecond(1_700_003_600);

        final PushOptions options = new PushOptions.Builder("com.example.app.voip")
                .setPushType(PushType.VOIP)
                .setApnsId("123e4567-e89b-12d3-a456-4266554400a0")
                .setExpiration(expiration)
                .setPriority(DeliveryPriority.CONSERVE_POWER)
                .setCollapseId("scores")
                .build();

        assertEquals(PushType.VOIP, options.getPushType().get());
        assertEquals("123e4567-e89b-12d3-a456-4266554400a0", options.getApnsId().get());
        assertEquals(expiration, options.getExpiration().get());
        assertEquals(DeliveryPriority.CONSERVE_POWER, options.getPriority().get());
        assertEquals("scores", options.getCollapseId().get());
    }

    @Test
    void testNullTopic() {
        assertThrows(NullPointerException.class, () -> new PushOptions.Builder(null));
    }

    @ParameterizedTest
    @EnumSource(PushType.class)
    void testPushTypeHeaderValue(final PushType pushType) {
        assertEquals(pushType, PushType.getFromHeaderValue(pushType.getHeaderValue()));
    }

    @Test
    void testPushTypeHeaderValues() {
        assertEquals("liveactivity", PushType.LIVE_ACTIVITY.getHeaderValue());
        assertEquals("pushtotalk", PushType.PUSH_TO_TALK.getHeaderValue());
        assertThrows(IllegalArgumentException.class, () -> PushType.getFromHeaderValue("carrier-pigeon"));
    }

    @Test
    void testDeliveryPriorityCodes() {
        assertEquals(10, DeliveryPriority.IMMEDIATE.getCode());
        assertEquals(5, DeliveryPriority.CONSERVE_POWER.getCode());
        assertEquals(1, DeliveryPriority.MINIMAL.getCode());

        assertEquals(DeliveryPriority.MINIMAL, DeliveryPriority.getFromCode(1));
        assertThrows(IllegalArgumentException.class, () -> DeliveryPriority.getFromCode(7));
    }
}
