package com.usermanagement.api.models;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Body of a request to update a user. Every field is optional: only the fields present are changed. */
public class UpdateUserRequest {

    public String username;

    public String email;

    @JsonProperty("first_name")
    public String firstName;

    @JsonProperty("last_name")
    public String lastName;

    public String role;

    public String avatar;

    @JsonProperty("is_active")
    public Boolean isActive;

    public void validate () {
        new UserValidation()
                .text(UserField.USERNAME, username, false, 3, 20)
                .email(email, false)
                .text(UserField.FIRST_NAME, firstName, false, 1, 50)
                .text(UserField.LAST_NAME, lastName, false, 1, 50)
                .role(role, false)
                .text(UserField.AVATAR, avatar, false, 1, 500)
                .throwIfInvalid();
    }

}
