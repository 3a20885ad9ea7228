package com.usermanagement.api.models;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * The JSON envelope of every response body: a success flag and message, plus either data on success or a
 * machine-readable error tag on failure. Absent members are left out of the JSON rather than written as null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse {

    public final boolean success;

    public final String message;

    public final Object data;

    public final String error;

    public ApiResponse (boolean success, String message, Object data, String error) {
        this.success = success;
        this.message = message;
        this.data = data;
        this.error = error;
    }

    public static ApiResponse success (String message, Object data) {
        return new ApiResponse(true, message, data, null);
    }

    public static ApiResponse success (String message) {
        return new ApiResponse(true, message, null, null);
    }

    public static ApiResponse failure (String message, String error) {
        return new ApiResponse(false, message, null, error);
    }

    public static ApiResponse failure (String message, String error, Object data) {
        return new ApiResponse(false, message, data, error);
    }

}
