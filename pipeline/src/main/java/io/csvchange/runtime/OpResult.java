package io.csvchange.runtime;

/**
 * Outcome of a caller operation: either a value or an error message, never an exception.
 */
public record OpResult<T>(boolean success, T value, String error) {

    public static <T> OpResult<T> ok(T value) { return new OpResult<>(true, value, null); }

    public static <T> OpResult<T> failed(String error) { return new OpResult<>(false, null, error); }
}
