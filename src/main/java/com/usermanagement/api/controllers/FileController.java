package com.usermanagement.api.controllers;

import com.google.common.collect.ImmutableMap;
import com.usermanagement.api.gatekeeper.GateContext;
import com.usermanagement.api.gatekeeper.Gatekeeper;
import com.usermanagement.api.gatekeeper.RateLimit;
import com.usermanagement.api.gatekeeper.StoredFileRecord;
import com.usermanagement.api.gatekeeper.UploadConstraints;
import com.usermanagement.api.models.ApiResponse;
import spark.Request;
import spark.Response;
import spark.Service;

import java.util.List;

import static com.usermanagement.api.util.JsonUtil.toJson;

/**
 * Upload endpoints. All validation and storage happens in the gatekeeper's upload stage, so by the time a handler here
 * runs the files are already stored and only need to be reported back to the client.
 */
public class FileController implements HttpController {

    public static final int MAX_IMAGES_PER_REQUEST = 5;

    private final Gatekeeper gatekeeper;

    public FileController (Gatekeeper gatekeeper) {
        this.gatekeeper = gatekeeper;
    }

    @Override
    public void registerEndpoints (Service sparkService) {
        sparkService.post("/api/v1/files/upload", gatekeeper.route("uploadFile")
                .rateLimit(RateLimit.MODERATE)
                .authenticate()
                .upload(UploadConstraints.DEFAULT)
                .guard(this::reportStoredFiles), toJson);
        // Images get the strict rate class to discourage spam.
        sparkService.post("/api/v1/files/upload/image", gatekeeper.route("uploadImage")
                .rateLimit(RateLimit.STRICT)
                .authenticate()
                .upload(UploadConstraints.IMAGE)
                .guard(this::reportStoredFiles), toJson);
        sparkService.post("/api/v1/files/upload/document", gatekeeper.route("uploadDocument")
                .rateLimit(RateLimit.MODERATE)
                .authenticate()
                .upload(UploadConstraints.DOCUMENT)
                .guard(this::reportStoredFiles), toJson);
        sparkService.post("/api/v1/files/upload/images", gatekeeper.route("uploadImages")
                .rateLimit(RateLimit.STRICT)
                .authenticate()
                .upload(UploadConstraints.multipleImages(MAX_IMAGES_PER_REQUEST))
                .guard(this::reportStoredFiles), toJson);
    }

    private ApiResponse reportStoredFiles (Request req, Response res) {
        List<StoredFileRecord> files = GateContext.from(req).storedFiles();
        String message = files.size() == 1 ? "File uploaded successfully" : "Files uploaded successfully";
        return ApiResponse.success(message, ImmutableMap.of("files", files, "count", files.size()));
    }

}
