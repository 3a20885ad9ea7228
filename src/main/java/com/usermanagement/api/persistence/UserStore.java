package com.usermanagement.api.persistence;

import com.usermanagement.api.models.CreateUserRequest;
import com.usermanagement.api.models.UpdateUserRequest;
import com.usermanagement.api.models.User;
import com.usermanagement.api.models.UserPage;

/**
 * Storage of user accounts. Methods throw ApiServerException (NOT_FOUND, CONFLICT) for conditions the client should
 * see, so controllers can pass them straight through to the HttpApi exception handlers.
 */
public interface UserStore {

    User create (CreateUserRequest request);

    User get (String id);

    User update (String id, UpdateUserRequest request);

    void delete (String id);

    /** @param page one-based page number. */
    UserPage list (int page, int limit);

}
