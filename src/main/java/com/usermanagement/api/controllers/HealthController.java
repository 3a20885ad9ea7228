package com.usermanagement.api.controllers;

import com.google.common.collect.ImmutableMap;
import com.usermanagement.api.models.ApiResponse;
import spark.Request;
import spark.Response;
import spark.Service;

import java.time.Instant;

import static com.usermanagement.api.util.JsonUtil.toJson;

/** Unauthenticated liveness check for load balancers and container orchestration. */
public class HealthController implements HttpController {

    @Override
    public void registerEndpoints (Service sparkService) {
        sparkService.get("/health", this::health, toJson);
    }

    private ApiResponse health (Request req, Response res) {
        return ApiResponse.success("Service is running", ImmutableMap.of(
                "status", "OK",
                "timestamp", Instant.now().toString()
        ));
    }

}
