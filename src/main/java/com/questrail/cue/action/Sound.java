package com.questrail.cue.action;

import java.util.Objects;

/**
 * Plays a named sound to the actor.
 *
 * <p>
 * {@code volume} lies in [{@value #MIN_VOLUME}, {@value #MAX_VOLUME}] and
 * {@code pitch} in [{@value #MIN_PITCH}, {@value #MAX_PITCH}]. The parser
 * clamps out-of-range input before constructing the record.
 * </p>
 */
public record Sound(String name, float volume, float pitch) implements Action
{
    public static final float MIN_VOLUME = 0.0f;
    public static final float MAX_VOLUME = 10.0f;
    public static final float MIN_PITCH = 0.5f;
    public static final float MAX_PITCH = 2.0f;
    public static final float DEFAULT_VOLUME = 1.0f;
    public static final float DEFAULT_PITCH = 1.0f;

    public Sound {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("sound name must not be blank");
        }
        if (volume < MIN_VOLUME || volume > MAX_VOLUME) {
            throw new IllegalArgumentException("volume out of range: " + volume);
        }
        if (pitch < MIN_PITCH || pitch > MAX_PITCH) {
            throw new IllegalArgumentException("pitch out of range: " + pitch);
        }
    }

    @Override
    public ActionType type() {
        return ActionType.SOUND;
    }
}
