package com.usermanagement.api.controllers;

import com.usermanagement.api.ApiServerException;
import com.usermanagement.api.gatekeeper.Gatekeeper;
import com.usermanagement.api.gatekeeper.IdentityClaims;
import com.usermanagement.api.gatekeeper.RateLimit;
import com.usermanagement.api.gatekeeper.RoutePipeline;
import com.usermanagement.api.models.ApiResponse;
import com.usermanagement.api.models.CreateUserRequest;
import com.usermanagement.api.models.UpdateUserRequest;
import com.usermanagement.api.models.User;
import com.usermanagement.api.persistence.UserStore;
import spark.Request;
import spark.Response;
import spark.Service;

import java.io.IOException;
import java.util.UUID;

import static com.usermanagement.api.util.JsonUtil.objectMapper;
import static com.usermanagement.api.util.JsonUtil.toJson;

/**
 * The profile of the signed-in user, plus listing and editing of all user accounts for administrators.
 */
public class UserController implements HttpController {

    public static final String ADMIN_ROLE = "admin";

    private static final int DEFAULT_PAGE_SIZE = 10;
    private static final int MAX_PAGE_SIZE = 100;

    private final Gatekeeper gatekeeper;
    private final UserStore userStore;

    public UserController (Gatekeeper gatekeeper, UserStore userStore) {
        this.gatekeeper = gatekeeper;
        this.userStore = userStore;
    }

    @Override
    public void registerEndpoints (Service sparkService) {
        // Registered before /:id so that "profile" is not taken for a user ID.
        sparkService.get("/api/v1/users/profile", gatekeeper.route("getProfile")
                .authenticate()
                .guard(this::getProfile), toJson);
        sparkService.get("/api/v1/users", adminRoute("listUsers").guard(this::listUsers), toJson);
        sparkService.post("/api/v1/users", adminRoute("createUser").guard(this::createUser), toJson);
        sparkService.get("/api/v1/users/:id", adminRoute("getUser").guard(this::getUser), toJson);
        sparkService.put("/api/v1/users/:id", adminRoute("updateUser").guard(this::updateUser), toJson);
        sparkService.delete("/api/v1/users/:id", adminRoute("deleteUser").guard(this::deleteUser), toJson);
    }

    /** Administration routes share the moderate rate class. Each still gets its own rate limiter. */
    private RoutePipeline.Builder adminRoute (String name) {
        return gatekeeper.route(name).rateLimit(RateLimit.MODERATE).requireRole(ADMIN_ROLE);
    }

    private ApiResponse getProfile (Request req, Response res) {
        IdentityClaims claims = IdentityClaims.from(req);
        User user = userStore.get(claims.subject);
        return ApiResponse.success("Profile retrieved successfully", user);
    }

    private ApiResponse listUsers (Request req, Response res) {
        int page = intQueryParam(req, "page", 1);
        int limit = Math.min(intQueryParam(req, "limit", DEFAULT_PAGE_SIZE), MAX_PAGE_SIZE);
        return ApiResponse.success("Users retrieved successfully", userStore.list(page, limit));
    }

    private ApiResponse createUser (Request req, Response res) throws IOException {
        CreateUserRequest request = objectMapper.readValue(req.body(), CreateUserRequest.class);
        request.validate();
        User user = userStore.create(request);
        res.status(201);
        return ApiResponse.success("User created successfully", user);
    }

    private ApiResponse getUser (Request req, Response res) {
        return ApiResponse.success("User retrieved successfully", userStore.get(userId(req)));
    }

    private ApiResponse updateUser (Request req, Response res) throws IOException {
        String id = userId(req);
        UpdateUserRequest request = objectMapper.readValue(req.body(), UpdateUserRequest.class);
        request.validate();
        return ApiResponse.success("User updated successfully", userStore.update(id, request));
    }

    private ApiResponse deleteUser (Request req, Response res) {
        userStore.delete(userId(req));
        return ApiResponse.success("User deleted successfully");
    }

    private static String userId (Request req) {
        String id = req.params("id");
        try {
            return UUID.fromString(id).toString();
        } catch (IllegalArgumentException e) {
            throw ApiServerException.badRequest("Invalid user ID");
        }
    }

    /** Missing or unparseable values fall back to the default, as do values below one. */
    private static int intQueryParam (Request req, String name, int defaultValue) {
        String value = req.queryParams(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value);
            return parsed < 1 ? defaultValue : parsed;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

}
