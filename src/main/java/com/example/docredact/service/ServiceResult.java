package com.example.docredact.service;

import java.util.Map;

/**
 * Outcome of a session operation: a value, or an {@link ErrorKind} with a human-readable cause.
 */
public class ServiceResult<T> {
    private final T value;
    private final ErrorKind errorKind;
    private final String message;

    private ServiceResult(T value, ErrorKind errorKind, String message) {
        this.value = value;
        this.errorKind = errorKind;
        this.message = message;
    }

    public static <T> ServiceResult<T> success(T value) {
        return new ServiceResult<>(value, null, null);
    }

    public static <T> ServiceResult<T> failure(ErrorKind errorKind, String message) {
        return new ServiceResult<>(null, errorKind, message);
    }

    public boolean isSuccess() { return errorKind == null; }
    public T getValue() { return value; }
    public ErrorKind getErrorKind() { return errorKind; }
    public String getMessage() { return message; }

    public Map<String, Object> errorBody() {
        return Map.of(
            "error", Map.of(
                "kind", errorKind.name(),
                "message", message != null ? message : errorKind.name()
            ),
            "isError", true
        );
    }
}
