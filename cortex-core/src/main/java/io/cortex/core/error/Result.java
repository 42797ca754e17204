package io.cortex.core.error;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a store operation: either a value (which may be {@code null}) or a {@link StoreError}.
 */
public final class Result<T> {
    private final T value;
    private final StoreError error;

    private Result(T value, StoreError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> Result<T> ok(T value) {
        return new Result<>(value, null);
    }

    public static Result<Void> ok() {
        return new Result<>(null, null);
    }

    public static <T> Result<T> err(StoreError error) {
        return new Result<>(null, Objects.requireNonNull(error, "error must not be null"));
    }

    public static <T> Result<T> err(ErrorCode code, String message) {
        return err(StoreError.of(code, message));
    }

    public static <T> Result<T> err(ErrorCode code, String message, String path) {
        return err(StoreError.of(code, message, path));
    }

    public boolean isOk() {
        return error == null;
    }

    public boolean isErr() {
        return error != null;
    }

    public T value() {
        if (error != null) {
            throw new IllegalStateException("Result is an error: " + error.code() + " " + error.message());
        }
        return value;
    }

    public StoreError error() {
        if (error == null) {
            throw new IllegalStateException("Result is not an error");
        }
        return error;
    }

    /**
     * Re-types an error result so it can be returned from an operation with a different value type.
     */
    public <U> Result<U> propagate() {
        return err(error());
    }

    public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
        if (error != null) {
            return err(error);
        }
        return ok(mapper.apply(value));
    }

    @Override
    public String toString() {
        return error == null ? "Ok[" + value + "]" : "Err[" + error.code() + ": " + error.message() + "]";
    }
}
