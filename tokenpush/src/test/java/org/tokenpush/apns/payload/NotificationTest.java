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

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NotificationTest {

    private PayloadSerializer serializer;

    @BeforeEach
    void setUp() {
        this.serializer = new PayloadSerializer();
    }

    @Test
    void testEmptyNotification() {
        assertEquals("{}", serializer.serialize(new Notification()));
    }

    @Test
    void testFilledNotification() {
        final Notification notification = new Notification()
                .setAlert(Alert.full(Title.of("Title"), Subtitle.localized("SUBTITLE_KEY"), null, null))
                .setSound(Sound.structured(true, null, null))
                .setMutableContent(true)
                .setInterruptionLevel(InterruptionLevel.TIME_SENSITIVE);

        assertEquals("{\"alert\":{\"title\":\"Title\",\"subtitle-loc-key\":\"SUBTITLE_KEY\"}," +
                        "\"sound\":{\"critical\":1},\"mutable-content\":1,\"interruption-level\":\"time-sensitive\"}",
                serializer.serialize(notification));
    }

    @Test
    void testFilledNotificationWithAttributes() throws PayloadBuildException {
        final Notification notification = new Notification()
                .setAlert(Alert.full(Title.of("Title"), Subtitle.localized("SUBTITLE_KEY"), null, null))
                .setSound(Sound.structured(true, null, null))
                .setMutableContent(true)
                .setInterruptionLevel(InterruptionLevel.TIME_SENSITIVE)
                .setAttributes(Collections.singletonMap("attr", "foo"));

        assertEquals("{\"alert\":{\"title\":\"Title\",\"subtitle-loc-key\":\"SUBTITLE_KEY\"}," +
                        "\"sound\":{\"critical\":1},\"mutable-content\":1,\"interruption-level\":\"time-sensitive\"," +
                        "\"attributes\":{\"attr\":\"foo\"}}",
                serializer.serialize(notification));
    }

    @Test
    void testFlagsAreIntegersOrAbsent() {
        assertEquals("{\"content-available\":1}", serializer.serialize(new Notification().setContentAvailable(true)));
        assertEquals("{}", serializer.serialize(new Notification().setContentAvailable(false)));
        assertEquals("{}", serializer.serialize(new Notification().setMutableContent(false)));

        final String serialized = serializer.serialize(new Notification()
                .setContentAvailable(true)
                .setMutableContent(false));

        assertFalse(serialized.contains("true"));
        assertFalse(serialized.contains("false"));
        assertFalse(serialized.contains("null"));
    }

    @Test
    void testFieldOrder() throws PayloadBuildException {
        final Notification notification = new Notification()
                .setAttributes(Collections.singletonMap("a", 1))
                .setAttributesType("Attributes")
                .setDismissalDate(Instant.ofEpochSecond(50))
                .setEvent(LiveActivityEvent.UPDATE)
                .setTimestamp(Instant.ofEpochSecond(40))
                .setContentState(Collections.singletonMap("s", 2))
                .setStaleDate(Instant.ofEpochSecond(30))
                .setFilterCriteria("work")
                .setRelevanceScore(0.5)
                .setInterruptionLevel(InterruptionLevel.PASSIVE)
                .setTargetContentId("target")
                .setMutableContent(true)
                .setContentAvailable(true)
                .setCategory("CATEGORY")
                .setThreadId("thread")
                .setSound(Sound.named("default"))
                .setBadge(7)
                .setAlert(Alert.text("Hello"));

        assertEquals("{\"alert\":\"Hello\",\"badge\":7,\"sound\":\"default\",\"thread-id\":\"thread\"," +
                        "\"category\":\"CATEGORY\",\"content-available\":1,\"mutable-content\":1," +
                        "\"target-content-id\":\"target\",\"interruption-level\":\"passive\",\"relevance-score\":0.5," +
                        "\"filter-criteria\":\"work\",\"stale-date\":30,\"content-state\":{\"s\":2},\"timestamp\":40," +
                        "\"event\":\"update\",\"dismissal-date\":50,\"attributes-type\":\"Attributes\"," +
                        "\"attributes\":{\"a\":1}}",
                serializer.serialize(notification));
    }

    @ParameterizedTest
    @EnumSource(InterruptionLevel.class)
    void testInterruptionLevel(final InterruptionLevel interruptionLevel) {
        final JsonObject serialized = parse(serializer.serialize(new Notification().setInterruptionLevel(interruptionLevel)));

        assertEquals(interruptionLevel.getValue(), serialized.get("interruption-level").getAsString());
    }

    @ParameterizedTest
    @EnumSource(LiveActivityEvent.class)
    void testEvent(final LiveActivityEvent event) {
        final JsonObject serialized = parse(serializer.serialize(new Notification().setEvent(event)));

        assertEquals(event.getValue(), serialized.get("event").getAsString());
    }

    @ParameterizedTest
    @ValueSource(doubles = {-0.1, 1.1, Double.NaN})
    void testSetRelevanceScoreOutOfRange(final double relevanceScore) {
        assertThrows(IllegalArgumentException.class, () -> new Notification().setRelevanceScore(relevanceScore));
    }

    @Test
    void testClearFields() throws PayloadBuildException {
        final Notification notification = new Notification()
                .setAlert(Alert.text("Hello"))
                .setRelevanceScore(1.0)
                .setContentState(Collections.singletonMap("s", 2));

        notification.setAlert(null)
                .setRelevanceScore(null)
                .setContentState(null);

        assertEquals("{}", serializer.serialize(notification));
    }

    @Test
    void testSetContentStateFromObject() throws PayloadBuildException {
        final Map<String, Object> contentState = new LinkedHashMap<>();
        contentState.put("score", 3);
        contentState.put("players", Arrays.asList("a", "b"));

        final JsonObject serialized = parse(serializer.serialize(new Notification().setContentState(contentState)));

        assertEquals(parse("{\"score\":3,\"players\":[\"a\",\"b\"]}"), serialized.getAsJsonObject("content-state"));
    }

    @Test
    void testGetters() throws PayloadBuildException {
        final Notification notification = new Notification()
                .setTargetContentId("window-1")
                .setFilterCriteria("work")
                .setStaleDate(Instant.ofEpochSecond(1_700_000_100))
                .setContentState(Collections.singletonMap("score", 3))
                .setTimestamp(Instant.ofEpochMilli(1_700_000_000_999L))
                .setDismissalDate(Instant.ofEpochSecond(1_700_000_200))
                .setAttributesType("ScoreAttributes")
                .setAttributes(Collections.singletonMap("team", "home"));

        assertEquals("window-1", notification.getTargetContentId().get());
        assertEquals("work", notification.getFilterCriteria().get());
        assertEquals(Instant.ofEpochSecond(1_700_000_100), notification.getStaleDate().get());
        assertEquals(parse("{\"score\":3}"), notification.getContentState().get());
        assertEquals(Instant.ofEpochSecond(1_700_000_000), notification.getTimestamp().get());
        assertEquals(Instant.ofEpochSecond(1_700_000_200), notification.getDismissalDate().get());
        assertEquals("ScoreAttributes", notification.getAttributesType().get());
        assertEquals(parse("{\"team\":\"home\"}"), notification.getAttributes().get());

        final Notification empty = new Notification();

        assertFalse(empty.getTargetContentId().isPresent());
        assertFalse(empty.getStaleDate().isPresent());
        assertFalse(empty.getContentState().isPresent());
        assertFalse(empty.getAttributes().isPresent());
    }

    @Test
    void testGetContentStateReturnsCopy() throws PayloadBuildException {
        final Notification notification = new Notification().setContentState(Collections.singletonMap("score", 3));

        notification.getContentState().get().addProperty("score", 4);

        assertEquals(parse("{\"score\":3}"), notification.getContentState().get());
    }

    @Test
    void testSetContentStateNotAnObject() {
        final PayloadBuildException exception =
                assertThrows(PayloadBuildException.class, () -> new Notification().setContentState(Arrays.asList(1, 2, 3)));

        assertTrue(exception.getCause() instanceof NotAnObjectException);
    }

    @Test
    void testSetAttributesNotAnObject() {
        final PayloadBuildException exception =
                assertThrows(PayloadBuildException.class, () -> new Notification().setAttributes("attributes"));

        assertTrue(exception.getCause() instanceof NotAnObjectException);
    }

    @Test
    void testDoesNotEscapeHtml() {
        assertEquals("{\"alert\":\"<b>&'\"}", serializer.serialize(new Notification().setAlert(Alert.text("<b>&'"))));
    }

    private static JsonObject parse(final String json) {
        return JsonParser.parseString(json).getAsJsonObject();
    }
}
