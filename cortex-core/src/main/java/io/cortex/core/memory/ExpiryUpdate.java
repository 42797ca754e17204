package io.cortex.core.memory;

import java.time.Instant;
import java.util.Objects;

/**
 * How an update treats the expiration of a memory: keep the current value, clear it, or set a new one.
 */
public final class ExpiryUpdate {
    private static final ExpiryUpdate KEEP = new ExpiryUpdate(Mode.KEEP, null);
    private static final ExpiryUpdate CLEAR = new ExpiryUpdate(Mode.CLEAR, null);

    private final Mode mode;
    private final Instant expiresAt;

    private ExpiryUpdate(Mode mode, Instant expiresAt) {
        this.mode = mode;
        this.expiresAt = expiresAt;
    }

    public static ExpiryUpdate keep() {
        return KEEP;
    }

    public static ExpiryUpdate clear() {
        return CLEAR;
    }

    public static ExpiryUpdate at(Instant expiresAt) {
        return new ExpiryUpdate(Mode.SET, Objects.requireNonNull(expiresAt, "expiresAt must not be null"));
    }

    public boolean isKeep() {
        return mode == Mode.KEEP;
    }

    public Instant apply(Instant current) {
        if (mode == Mode.KEEP) {
            return current;
        }
        return mode == Mode.CLEAR ? null : expiresAt;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ExpiryUpdate that)) {
            return false;
        }
        return mode == that.mode && Objects.equals(expiresAt, that.expiresAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(mode, expiresAt);
    }

    @Override
    public String toString() {
        return mode == Mode.SET ? "ExpiryUpdate[" + expiresAt + "]" : "ExpiryUpdate[" + mode + "]";
    }

    private enum Mode {
        KEEP,
        CLEAR,
        SET
    }
}
