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

import com.google.gson.JsonElement;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializationContext;
import com.google.gson.JsonSerializer;
import com.google.gson.annotations.JsonAdapter;
import com.google.gson.annotations.SerializedName;

import java.lang.reflect.Type;
import java.util.Objects;
import java.util.Optional;

/**
 * The sound to play when a notification arrives. A sound is either the name of a sound file in the app's bundle
 * (serialized as a bare string) or a structured sound that may additionally be marked as critical and carry a playback
 * volume.
 */
@JsonAdapter(Sound.SoundSerializer.class)
public final class Sound {

    /**
     * The name of the device's default notification sound.
     */
    public static final String DEFAULT_SOUND_NAME = "default";

    /**
     * The form of a sound.
     */
    public enum Kind {
        NAMED,
        STRUCTURED
    }

    private final Kind kind;

    private final Boolean critical;
    private final String name;
    private final Double volume;

    private Sound(final Kind kind, final Boolean critical, final String name, final Double volume) {
        this.kind = kind;
        this.critical = critical;
        this.name = name;
        this.volume = volume;
    }

    /**
     * Returns a sound that plays the named sound file, or the default sound if the name is
     * {@value DEFAULT_SOUND_NAME}.
     */
    public static Sound named(final String name) {
        return new Sound(Kind.NAMED, null, Objects.requireNonNull(name, "Sound name must not be null."), null);
    }

    /**
     * Returns a structured sound. All arguments are optional.
     *
     * @param critical whether the sound is a critical alert sound; written as {@code 1} when {@code true} and omitted
     * otherwise
     * @param name the name of the sound file to play
     * @param volume the playback volume, between 0 (silent) and 1 (full volume)
     */
    public static Sound structured(final Boolean critical, final String name, final Double volume) {
        if (volume != null && !(volume >= 0 && volume <= 1)) {
            throw new IllegalArgumentException("Volume must be between 0 and 1, inclusive.");
        }

        return new Sound(Kind.STRUCTURED, critical, name, volume);
    }

    /**
     * Returns a critical alert sound that plays the named sound file at the given volume.
     */
    public static Sound critical(final String name, final double volume) {
        return structured(true, name, volume);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isCritical() {
        return Boolean.TRUE.equals(critical);
    }

    public Optional<String> getName() {
        return Optional.ofNullable(name);
    }

    public Optional<Double> getVolume() {
        return Optional.ofNullable(volume);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final Sound sound = (Sound) o;
        return kind == sound.kind &&
                isCritical() == sound.isCritical() &&
                Objects.equals(name, sound.name) &&
                Objects.equals(volume, sound.volume);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, isCritical(), name, volume);
    }

    private static class StructuredSound {

        @SerializedName("critical")
        @JsonAdapter(IntegerFlagTypeAdapter.class)
        private final Boolean critical;

        @SerializedName("name")
        private final String name;

        @SerializedName("volume")
        private final Double volume;

        private StructuredSound(final Sound sound) {
            this.critical = sound.critical;
            this.name = sound.name;
            this.volume = sound.volume;
        }
    }

    static class SoundSerializer implements JsonSerializer<Sound> {

        @Override
        public JsonElement serialize(final Sound sound, final Type type, final JsonSerializationContext context) {
            if (sound.kind == Kind.NAMED) {
                return new JsonPrimitive(sound.name);
            }

            return context.serialize(new StructuredSound(sound));
        }
    }
}
