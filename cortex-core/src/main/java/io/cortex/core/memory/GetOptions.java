package io.cortex.core.memory;

import java.time.Instant;

/**
 * @param now reference instant for the expiry check, {@code null} for the service clock
 */
public record GetOptions(boolean includeExpired, Instant now) {

    public static GetOptions defaults() {
        return new GetOptions(false, null);
    }
}
