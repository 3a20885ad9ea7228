package com.usermanagement.api.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A user account as managed through the admin endpoints. Field names in JSON are snake_case.
 */
public class User {

    public String id;

    public String username;

    public String email;

    @JsonProperty("first_name")
    public String firstName;

    @JsonProperty("last_name")
    public String lastName;

    /** Either "admin" or "user". */
    public String role;

    /** URL of the profile picture, omitted from JSON when not set. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public String avatar;

    @JsonProperty("is_active")
    public boolean isActive;

    @JsonProperty("created_at")
    public Instant createdAt;

    @JsonProperty("updated_at")
    public Instant updatedAt;

    public User copy () {
        User copy = new User();
        copy.id = id;
        copy.username = username;
        copy.email = email;
        copy.firstName = firstName;
        copy.lastName = lastName;
        copy.role = role;
        copy.avatar = avatar;
        copy.isActive = isActive;
        copy.createdAt = createdAt;
        copy.updatedAt = updatedAt;
        return copy;
    }

    @Override
    public String toString () {
        return String.format("User{%s, %s, role %s}", id, username, role);
    }
}
