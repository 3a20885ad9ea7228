package com.usermanagement.api;

import java.util.Map;

/**
 * Thrown by HTTP handlers to end a request with a specific status code and machine-readable error type.
 * Gatekeeper stages do not throw these: they return Rejections, which the route pipeline turns into responses.
 */
public class ApiServerException extends RuntimeException {

    public int httpCode;
    public Type type;
    public String message;

    /** For validation failures, the user-facing name of each rejected field mapped to the reason. Otherwise null. */
    public Map<String, String> fieldErrors;

    public enum Type {
        BAD_REQUEST,
        CONFLICT,
        INTERNAL_ERROR,
        JSON_PARSING,
        NOT_FOUND,
        VALIDATION_FAILED;
    }

    public static ApiServerException badRequest (String message) {
        return new ApiServerException(Type.BAD_REQUEST, message, 400);
    }

    public static ApiServerException conflict (String message) {
        return new ApiServerException(Type.CONFLICT, message, 409);
    }

    public static ApiServerException notFound (String message) {
        return new ApiServerException(Type.NOT_FOUND, message, 404);
    }

    public static ApiServerException validationFailed (Map<String, String> fieldErrors) {
        ApiServerException exception = new ApiServerException(Type.VALIDATION_FAILED, "Validation failed", 400);
        exception.fieldErrors = fieldErrors;
        return exception;
    }

    public ApiServerException (Type t, String m, int c) {
        httpCode = c;
        type = t;
        message = m;
    }

    @Override
    public String getMessage () {
        return message;
    }
}
