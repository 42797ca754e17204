package io.cortex.core.error;

import java.util.Objects;

/**
 * A failure reported by the store.
 *
 * @param code machine-readable code
 * @param message human-readable message
 * @param path slug path, category path or file the error concerns, may be {@code null}
 * @param reason lower-layer error this one wraps, may be {@code null}
 * @param cause platform exception that triggered the error, may be {@code null}
 */
public record StoreError(ErrorCode code, String message, String path, StoreError reason, Throwable cause) {

    public StoreError {
        Objects.requireNonNull(code, "code must not be null");
        message = message == null ? code.name() : message;
    }

    public static StoreError of(ErrorCode code, String message) {
        return new StoreError(code, message, null, null, null);
    }

    public static StoreError of(ErrorCode code, String message, String path) {
        return new StoreError(code, message, path, null, null);
    }

    public static StoreError wrap(ErrorCode code, String message, String path, StoreError reason) {
        return new StoreError(code, message, path, reason, null);
    }

    public static StoreError fromException(ErrorCode code, String message, String path, Throwable cause) {
        return new StoreError(code, message, path, null, cause);
    }

    public ErrorKind kind() {
        return code.kind();
    }

    /**
     * Message with the wrapped reason and cause appended, for log lines and CLI output.
     */
    public String describe() {
        StringBuilder out = new StringBuilder(message);
        if (reason != null) {
            out.append(": ").append(reason.describe());
        } else if (cause != null && cause.getMessage() != null) {
            out.append(": ").append(cause.getMessage());
        }
        return out.toString();
    }
}
