package com.usermanagement.api.models;

import java.util.Set;

/**
 * The validated fields of user create and update requests, each with the name clients use for it in JSON. Validation
 * errors are keyed on these JSON names, so clients can attach each message to the right form input.
 */
public enum UserField {

    USERNAME("username"),
    EMAIL("email"),
    FIRST_NAME("first_name"),
    LAST_NAME("last_name"),
    ROLE("role"),
    AVATAR("avatar");

    public static final Set<String> ROLES = Set.of("admin", "user");

    public static final String REQUIRED = "This field is required";
    public static final String INVALID_EMAIL = "Invalid email format";
    public static final String TOO_SHORT = "Value is too short";
    public static final String TOO_LONG = "Value is too long";
    public static final String INVALID_VALUE = "Invalid value";

    public final String jsonName;

    UserField (String jsonName) {
        this.jsonName = jsonName;
    }

}
