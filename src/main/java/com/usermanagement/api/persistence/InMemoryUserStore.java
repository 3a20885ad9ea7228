package com.usermanagement.api.persistence;

import com.usermanagement.api.ApiServerException;
import com.usermanagement.api.components.Component;
import com.usermanagement.api.models.CreateUserRequest;
import com.usermanagement.api.models.UpdateUserRequest;
import com.usermanagement.api.models.User;
import com.usermanagement.api.models.UserPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static com.usermanagement.api.models.UserValidation.isBlank;

/**
 * Keeps user accounts in memory, in creation order. Contents are lost on restart. All methods are synchronized so the
 * uniqueness checks on username and email cannot race with each other. Callers always receive copies, never the
 * stored instances.
 */
public class InMemoryUserStore implements UserStore, Component {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryUserStore.class);

    private final Map<String, User> users = new LinkedHashMap<>();

    private final Clock clock;

    public InMemoryUserStore () {
        this(Clock.systemUTC());
    }

    public InMemoryUserStore (Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized User create (CreateUserRequest request) {
        checkUnique(null, request.username, request.email);
        User user = new User();
        user.id = UUID.randomUUID().toString();
        user.username = request.username;
        user.email = request.email;
        user.firstName = request.firstName;
        user.lastName = request.lastName;
        user.role = request.role;
        user.avatar = isBlank(request.avatar) ? null : request.avatar;
        user.isActive = true;
        user.createdAt = clock.instant();
        user.updatedAt = user.createdAt;
        users.put(user.id, user);
        LOG.info("Created {}.", user);
        return user.copy();
    }

    @Override
    public synchronized User get (String id) {
        return find(id).copy();
    }

    @Override
    public synchronized User update (String id, UpdateUserRequest request) {
        User user = find(id);
        checkUnique(id, request.username, request.email);
        if (!isBlank(request.username)) user.username = request.username;
        if (!isBlank(request.email)) user.email = request.email;
        if (!isBlank(request.firstName)) user.firstName = request.firstName;
        if (!isBlank(request.lastName)) user.lastName = request.lastName;
        if (!isBlank(request.role)) user.role = request.role;
        if (!isBlank(request.avatar)) user.avatar = request.avatar;
        if (request.isActive != null) user.isActive = request.isActive;
        user.updatedAt = clock.instant();
        return user.copy();
    }

    @Override
    public synchronized void delete (String id) {
        find(id);
        users.remove(id);
        LOG.info("Deleted user {}.", id);
    }

    @Override
    public synchronized UserPage list (int page, int limit) {
        List<User> all = new ArrayList<>(users.values());
        int from = Math.min((page - 1) * limit, all.size());
        int to = Math.min(from + limit, all.size());
        List<User> pageOfUsers = new ArrayList<>();
        for (User user : all.subList(from, to)) {
            pageOfUsers.add(user.copy());
        }
        return new UserPage(pageOfUsers, page, limit, all.size());
    }

    private User find (String id) {
        User user = users.get(id);
        if (user == null) {
            throw ApiServerException.notFound("User not found");
        }
        return user;
    }

    /** Usernames and emails must be unique, apart from the user being updated keeping its own. */
    private void checkUnique (String exceptId, String username, String email) {
        for (User user : users.values()) {
            if (user.id.equals(exceptId)) {
                continue;
            }
            if ((username != null && username.equals(user.username)) ||
                    (email != null && email.equalsIgnoreCase(user.email))) {
                throw ApiServerException.conflict("User already exists");
            }
        }
    }

}
