package com.usermanagement.api.persistence;

import com.usermanagement.api.ApiServerException;
import com.usermanagement.api.models.CreateUserRequest;
import com.usermanagement.api.models.UpdateUserRequest;
import com.usermanagement.api.models.User;
import com.usermanagement.api.models.UserPage;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class InMemoryUserStoreTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private final InMemoryUserStore store = new InMemoryUserStore(Clock.fixed(NOW, ZoneOffset.UTC));

    private static CreateUserRequest newUser (String username) {
        CreateUserRequest request = new CreateUserRequest();
        request.username = username;
        request.email = username + "@example.com";
        request.firstName = "First";
        request.lastName = "Last";
        request.role = "user";
        request.avatar = "";
        return request;
    }

    @Test
    void createdUsersAreActiveAndTimestamped () {
        User user = store.create(newUser("ada"));
        assertTrue(user.isActive);
        assertEquals(NOW, user.createdAt);
        assertEquals(NOW, user.updatedAt);
        assertNull(user.avatar);
        assertEquals("ada", store.get(user.id).username);
    }

    @Test
    void callersGetCopies () {
        User user = store.create(newUser("ada"));
        user.username = "mallory";
        assertEquals("ada", store.get(user.id).username);
    }

    @Test
    void usernameAndEmailAreUnique () {
        store.create(newUser("ada"));
        ApiServerException e = assertThrows(ApiServerException.class, () -> store.create(newUser("ada")));
        assertEquals(409, e.httpCode);
        CreateUserRequest sameEmail = newUser("lovelace");
        sameEmail.email = "ADA@example.com";
        assertThrows(ApiServerException.class, () -> store.create(sameEmail));
    }

    @Test
    void updateChangesOnlyTheFieldsPresent () {
        User user = store.create(newUser("ada"));
        UpdateUserRequest update = new UpdateUserRequest();
        update.username = "ada";
        update.lastName = "Lovelace";
        update.isActive = false;
        User updated = store.update(user.id, update);
        assertEquals("ada", updated.username);
        assertEquals("First", updated.firstName);
        assertEquals("Lovelace", updated.lastName);
        assertFalse(updated.isActive);
    }

    @Test
    void missingUsers () {
        ApiServerException e = assertThrows(ApiServerException.class, () -> store.get("no-such-user"));
        assertEquals(404, e.httpCode);
        assertThrows(ApiServerException.class, () -> store.delete("no-such-user"));
        User user = store.create(newUser("ada"));
        store.delete(user.id);
        assertThrows(ApiServerException.class, () -> store.get(user.id));
    }

    @Test
    void paging () {
        for (int i = 0; i < 5; i++) {
            store.create(newUser("user" + i));
        }
        UserPage second = store.list(2, 2);
        assertEquals(2, second.users.size());
        assertEquals("user2", second.users.get(0).username);
        assertEquals(5, second.total);
        assertEquals(3, second.totalPages);
        assertEquals(1, store.list(3, 2).users.size());
        assertTrue(store.list(4, 2).users.isEmpty());
    }

}
