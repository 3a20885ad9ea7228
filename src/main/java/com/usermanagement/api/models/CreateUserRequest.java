package com.usermanagement.api.models;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Body of a request to create a user. Passwords are handled by the external login service, not here. */
public class CreateUserRequest {

    public String username;

    public String email;

    @JsonProperty("first_name")
    public String firstName;

    @JsonProperty("last_name")
    public String lastName;

    public String role;

    public String avatar;

    public void validate () {
        new UserValidation()
                .text(UserField.USERNAME, username, true, 3, 20)
                .email(email, true)
                .text(UserField.FIRST_NAME, firstName, true, 1, 50)
                .text(UserField.LAST_NAME, lastName, true, 1, 50)
                .role(role, true)
                .text(UserField.AVATAR, avatar, false, 1, 500)
                .throwIfInvalid();
    }

}
