package com.usermanagement.api.gatekeeper;

import com.usermanagement.api.components.eventbus.EventBus;
import com.usermanagement.api.components.eventbus.FileUploadEvent;
import com.usermanagement.api.util.HttpUtils;
import org.apache.commons.fileupload.FileCountLimitExceededException;
import org.apache.commons.fileupload.FileItem;
import org.apache.commons.fileupload.FileUploadBase;
import org.apache.commons.fileupload.FileUploadException;
import org.apache.commons.fileupload.InvalidFileNameException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spark.Request;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Parses the multipart body of a request and hands its files to the UploadValidator. The temporary files created
 * while parsing are always removed, whether or not the upload is accepted.
 */
class UploadStage implements GateStage {

    private static final Logger LOG = LoggerFactory.getLogger(UploadStage.class);

    /**
     * Allowance for other form fields on top of the file contents themselves. Within this cap the body is always read
     * far enough to see whether it carries too many files, before any file size is judged.
     */
    private static final long FORM_OVERHEAD_BYTES = 1024 * 1024;

    private final String routeName;
    private final UploadConstraints constraints;
    private final UploadValidator uploadValidator;
    private final EventBus eventBus;

    UploadStage (String routeName, UploadConstraints constraints, UploadValidator uploadValidator, EventBus eventBus) {
        this.routeName = routeName;
        this.constraints = constraints;
        this.uploadValidator = uploadValidator;
        this.eventBus = eventBus;
    }

    @Override
    public Rejection check (Request req, GateContext context) {
        if (!HttpUtils.isMultipart(req.raw())) {
            if (constraints.required) {
                return Rejection.upload(UploadFailure.INVALID_FORM_DATA, "Request must be multipart/form-data");
            }
            return null;
        }
        long maxRequestBytes = constraints.maxSizeBytes * constraints.maxFiles + FORM_OVERHEAD_BYTES;
        Map<String, List<FileItem>> formFields;
        try {
            formFields = HttpUtils.getRequestFiles(req.raw(), constraints.fieldName, constraints.maxFiles,
                    constraints.maxSizeBytes, maxRequestBytes);
        } catch (FileCountLimitExceededException e) {
            return Rejection.upload(UploadFailure.TOO_MANY_FILES,
                    String.format("Too many files: at most %d allowed", constraints.maxFiles));
        } catch (FileUploadBase.SizeLimitExceededException e) {
            return Rejection.upload(UploadFailure.FILE_TOO_LARGE, e.getMessage());
        } catch (FileUploadException | IOException | InvalidFileNameException e) {
            LOG.debug("Unreadable multipart body on route {}: {}", routeName, e.toString());
            return Rejection.upload(UploadFailure.INVALID_FORM_DATA, "Failed to parse multipart form");
        }
        UploadResult result;
        try {
            result = uploadValidator.process(formFields, constraints, context.deadline);
        } finally {
            HttpUtils.deleteFileItems(formFields);
        }
        if (!result.isSuccess()) {
            return Rejection.upload(result.failure, result.message);
        }
        context.setStoredFiles(result.files);
        if (!result.files.isEmpty()) {
            long totalBytes = result.files.stream().mapToLong(f -> f.sizeBytes).sum();
            eventBus.send(new FileUploadEvent(routeName, result.files.size(), totalBytes).forUser(context.claims()));
        }
        return null;
    }

}
