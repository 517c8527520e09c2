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
import com.google.gson.annotations.JsonAdapter;
import com.google.gson.annotations.SerializedName;

import java.time.Instant;
import java.util.Optional;

/**
 * The {@code aps} dictionary of a push notification payload. Every field is optional; unset fields are omitted from
 * the serialized form, and an empty notification serializes as {@code {}}. Flag fields are written as the integer
 * {@code 1} when set and omitted otherwise.
 *
 * <p>Setters return the notification itself so calls may be chained. Notifications are mutable and not thread-safe.</p>
 *
 * @see PayloadSerializer
 * @see <a href="https://developer.apple.com/documentation/usernotifications/generating-a-remote-notification">Generating
 * a remote notification</a>
 */
public class Notification {

    @SerializedName("alert")
    private Alert alert;

    @SerializedName("badge")
    private Integer badge;

    @SerializedName("sound")
    private Sound sound;

    @SerializedName("thread-id")
    private String threadId;

    @SerializedName("category")
    private String category;

    @SerializedName("content-available")
    @JsonAdapter(IntegerFlagTypeAdapter.class)
    private Boolean contentAvailable;

    @SerializedName("mutable-content")
    @JsonAdapter(IntegerFlagTypeAdapter.class)
    private Boolean mutableContent;

    @SerializedName("target-content-id")
    private String targetContentId;

    @SerializedName("interruption-level")
    private InterruptionLevel interruptionLevel;

    @SerializedName("relevance-score")
    private Double relevanceScore;

    @SerializedName("filter-criteria")
    private String filterCriteria;

    @SerializedName("stale-date")
    private Long staleDate;

    @SerializedName("content-state")
    private JsonObject contentState;

    @SerializedName("timestamp")
    private Long timestamp;

    @SerializedName("event")
    private LiveActivityEvent event;

    @SerializedName("dismissal-date")
    private Long dismissalDate;

    @SerializedName("attributes-type")
    private String attributesType;

    @SerializedName("attributes")
    private JsonObject attributes;

    /**
     * Sets the alert to display. Pass {@code null} to remove a previously-set alert.
     */
    public Notification setAlert(final Alert alert) {
        this.alert = alert;
        return this;
    }

    /**
     * Sets the number to display as the app icon's badge. Zero clears the badge; {@code null} leaves it unchanged.
     */
    public Notification setBadge(final Integer badge) {
        this.badge = badge;
        return this;
    }

    public Notification setSound(final Sound sound) {
        this.sound = sound;
        return this;
    }

    /**
     * Sets the identifier the device uses to group related notifications into a thread.
     */
    public Notification setThreadId(final String threadId) {
        this.threadId = threadId;
        return this;
    }

    /**
     * Sets the notification category, which selects the set of actions offered with the notification.
     */
    public Notification setCategory(final String category) {
        this.category = category;
        return this;
    }

    /**
     * Sets whether this notification should wake the app to fetch new content in the background.
     */
    public Notification setContentAvailable(final boolean contentAvailable) {
        this.contentAvailable = contentAvailable;
        return this;
    }

    /**
     * Sets whether a notification service extension may modify this notification before it is displayed.
     */
    public Notification setMutableContent(final boolean mutableContent) {
        this.mutableContent = mutableContent;
        return this;
    }

    public Notification setTargetContentId(final String targetContentId) {
        this.targetContentId = targetContentId;
        return this;
    }

    public Notification setInterruptionLevel(final InterruptionLevel interruptionLevel) {
        this.interruptionLevel = interruptionLevel;
        return this;
    }

    /**
     * Sets the relevance score the system uses to pick the featured notification in a notification summary.
     *
     * @param relevanceScore a score between 0 and 1, inclusive, or {@code null} to clear a previously-set score
     *
     * @throws IllegalArgumentException if the score is outside the range [0, 1]
     */
    public Notification setRelevanceScore(final Double relevanceScore) {
        if (relevanceScore != null && !(relevanceScore >= 0 && relevanceScore <= 1)) {
            throw new IllegalArgumentException("Relevance score must be between 0 and 1, inclusive.");
        }

        this.relevanceScore = relevanceScore;
        return this;
    }

    /**
     * Sets the criteria a device's focus filter uses to decide whether to show this notification.
     */
    public Notification setFilterCriteria(final String filterCriteria) {
        this.filterCriteria = filterCriteria;
        return this;
    }

    /**
     * Sets the time after which a Live Activity updated by this notification is considered out of date.
     */
    public Notification setStaleDate(final Instant staleDate) {
        this.staleDate = staleDate != null ? staleDate.getEpochSecond() : null;
        return this;
    }

    /**
     * Sets the content state of the Live Activity this notification updates. The given value is converted to a JSON
     * object immediately.
     *
     * @param contentState any value Gson serializes as a JSON object, or {@code null} to clear the content state
     *
     * @throws PayloadBuildException if the value could not be converted to a JSON object
     */
    public Notification setContentState(final Object contentState) throws PayloadBuildException {
        this.contentState = contentState != null ?
                JsonObjects.toJsonObject(JsonObjects.DEFAULT_GSON, contentState) : null;

        return this;
    }

    /**
     * Sets the time at which the content of a Live Activity update was produced.
     */
    public Notification setTimestamp(final Instant timestamp) {
        this.timestamp = timestamp != null ? timestamp.getEpochSecond() : null;
        return this;
    }

    public Notification setEvent(final LiveActivityEvent event) {
        this.event = event;
        return this;
    }

    /**
     * Sets the time at which an ended Live Activity is removed from the lock screen.
     */
    public Notification setDismissalDate(final Instant dismissalDate) {
        this.dismissalDate = dismissalDate != null ? dismissalDate.getEpochSecond() : null;
        return this;
    }

    /**
     * Sets the name of the attributes type of a Live Activity started by this notification.
     */
    public Notification setAttributesType(final String attributesType) {
        this.attributesType = attributesType;
        return this;
    }

    /**
     * Sets the attributes of a Live Activity started by this notification. The given value is converted to a JSON
     * object immediately.
     *
     * @param attributes any value Gson serializes as a JSON object, or {@code null} to clear the attributes
     *
     * @throws PayloadBuildException if the value could not be converted to a JSON object
     */
    public Notification setAttributes(final Object attributes) throws PayloadBuildException {
        this.attributes = attributes != null ?
                JsonObjects.toJsonObject(JsonObjects.DEFAULT_GSON, attributes) : null;

        return this;
    }

    public Optional<Alert> getAlert() {
        return Optional.ofNullable(alert);
    }

    public Optional<Integer> getBadge() {
        return Optional.ofNullable(badge);
    }

    public Optional<Sound> getSound() {
        return Optional.ofNullable(sound);
    }

    public Optional<String> getThreadId() {
        return Optional.ofNullable(threadId);
    }

    public Optional<String> getCategory() {
        return Optional.ofNullable(category);
    }

    public boolean isContentAvailable() {
        return Boolean.TRUE.equals(contentAvailable);
    }

    public boolean isMutableContent() {
        return Boolean.TRUE.equals(mutableContent);
    }

    public Optional<String> getTargetContentId() {
        return Optional.ofNullable(targetContentId);
    }

    public Optional<InterruptionLevel> getInterruptionLevel() {
        return Optional.ofNullable(interruptionLevel);
    }

    public Optional<Double> getRelevanceScore() {
        return Optional.ofNullable(relevanceScore);
    }

    public Optional<String> getFilterCriteria() {
        return Optional.ofNullable(filterCriteria);
    }

    /**
     * Returns the stale date, truncated to whole seconds.
     */
    public Optional<Instant> getStaleDate() {
        return Optional.ofNullable(staleDate).map(Instant::ofEpochSecond);
    }

    /**
     * Returns a copy of the live activity content state; changes to the copy do not affect this notification.
     */
    public Optional<JsonObject> getContentState() {
        return Optional.ofNullable(contentState).map(JsonObject::deepCopy);
    }

    public Optional<Instant> getTimestamp() {
        return Optional.ofNullable(timestamp).map(Instant::ofEpochSecond);
    }

    public Optional<LiveActivityEvent> getEvent() {
        return Optional.ofNullable(event);
    }

    public Optional<Instant> getDismissalDate() {
        return Optional.ofNullable(dismissalDate).map(Instant::ofEpochSecond);
    }

    public Optional<String> getAttributesType() {
        return Optional.ofNullable(attributesType);
    }

    public Optional<JsonObject> getAttributes() {
        return Optional.ofNullable(attributes).map(JsonObject::deepCopy);
    }
}
