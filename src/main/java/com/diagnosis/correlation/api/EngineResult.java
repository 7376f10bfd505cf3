package com.diagnosis.correlation.api;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of an engine operation: either a value or an error kind with a message.
 *
 * @param <T> the value type
 */
public final class EngineResult<T> {

    private final T value;
    private final ErrorKind errorKind;
    private final String message;

    private EngineResult(T value, ErrorKind errorKind, String message) {
        this.value = value;
        this.errorKind = errorKind;
        this.message = message;
    }

    public static <T> EngineResult<T> success(T value) {
        return new EngineResult<>(Objects.requireNonNull(value, "value is required"), null, null);
    }

    public static <T> EngineResult<T> failure(ErrorKind errorKind, String message) {
        return new EngineResult<>(null, Objects.requireNonNull(errorKind, "errorKind is required"),
                message != null ? message : errorKind.name());
    }

    public boolean isSuccess() {
        return errorKind == null;
    }

    /**
     * Returns the value.
     *
     * @throws NoSuchElementException if the operation failed
     */
    public T getValue() {
        if (!isSuccess()) {
            throw new NoSuchElementException("No value present: " + message);
        }
        return value;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Applies the mapper to a successful value; a failure is passed through unchanged.
     */
    @SuppressWarnings("unchecked")
    public <R> EngineResult<R> map(Function<T, R> mapper) {
        return isSuccess() ? success(mapper.apply(value)) : (EngineResult<R>) this;
    }

    /**
     * The failure as a {@code {"error": message}} map.
     *
     * @throws IllegalStateException if the operation succeeded
     */
    public Map<String, Object> toErrorMap() {
        if (isSuccess()) {
            throw new IllegalStateException("Result is not a failure");
        }
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("error", message);
        error.put("error_kind", errorKind.name());
        return error;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "EngineResult{value=" + value + '}'
                : "EngineResult{errorKind=" + errorKind + ", message='" + message + "'}";
    }
}
