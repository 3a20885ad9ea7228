package com.usermanagement.api.models;

import com.usermanagement.api.ApiServerException;

import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Accumulates validation errors for the fields of one request, then throws them all at once.
 */
public class UserValidation {

    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    private final Map<String, String> errors = new TreeMap<>();

    /**
     * Check the length of a text field.
     * @param required if false, a missing or blank value is accepted without further checks.
     */
    public UserValidation text (UserField field, String value, boolean required, int minLength, int maxLength) {
        if (isBlank(value)) {
            if (required) {
                reject(field, UserField.REQUIRED);
            }
        } else if (value.length() < minLength) {
            reject(field, UserField.TOO_SHORT);
        } else if (value.length() > maxLength) {
            reject(field, UserField.TOO_LONG);
        }
        return this;
    }

    public UserValidation email (String value, boolean required) {
        if (isBlank(value)) {
            if (required) {
                reject(UserField.EMAIL, UserField.REQUIRED);
            }
        } else if (!EMAIL.matcher(value).matches()) {
            reject(UserField.EMAIL, UserField.INVALID_EMAIL);
        }
        return this;
    }

    public UserValidation role (String value, boolean required) {
        if (isBlank(value)) {
            if (required) {
                reject(UserField.ROLE, UserField.REQUIRED);
            }
        } else if (!UserField.ROLES.contains(value)) {
            reject(UserField.ROLE, UserField.INVALID_VALUE);
        }
        return this;
    }

    public static boolean isBlank (String value) {
        return value == null || value.isBlank();
    }

    private void reject (UserField field, String message) {
        errors.putIfAbsent(field.jsonName, message);
    }

    /** @throws ApiServerException of type VALIDATION_FAILED if any check failed. */
    public void throwIfInvalid () {
        if (!errors.isEmpty()) {
            throw ApiServerException.validationFailed(Map.copyOf(errors));
        }
    }

}
