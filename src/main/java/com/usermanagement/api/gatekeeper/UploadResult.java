package com.usermanagement.api.gatekeeper;

import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Outcome of processing the files in a multipart form: either all files were stored, or none were and failure says why.
 */
public class UploadResult {

    /** The stored files, in the order they appeared in the form. Empty (never null) on failure. */
    public final List<StoredFileRecord> files;

    public final UploadFailure failure;

    /** Human-readable explanation of the failure, suitable for the client. Null on success. */
    public final String message;

    private UploadResult (List<StoredFileRecord> files, UploadFailure failure, String message) {
        this.files = files;
        this.failure = failure;
        this.message = message;
    }

    static UploadResult stored (List<StoredFileRecord> files) {
        return new UploadResult(List.copyOf(files), null, null);
    }

    static UploadResult failed (UploadFailure failure, String message) {
        return new UploadResult(List.of(), checkNotNull(failure), message);
    }

    public boolean isSuccess () {
        return failure == null;
    }

    @Override
    public String toString () {
        return isSuccess() ? "UploadResult{" + files.size() + " files}" : "UploadResult{" + failure + ": " + message + "}";
    }
}
