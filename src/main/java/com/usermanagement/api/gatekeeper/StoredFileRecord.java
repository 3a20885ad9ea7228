package com.usermanagement.api.gatekeeper;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Describes one uploaded file after it has been accepted and moved to its final location. Serialized as-is in the
 * responses of the upload endpoints.
 */
public class StoredFileRecord {

    /** The filename as supplied by the client. Only for display, it is never used to build a path. */
    @JsonProperty("original_name")
    public final String originalName;

    @JsonProperty("filename")
    public final String storedName;

    @JsonProperty("size")
    public final long sizeBytes;

    /** Location of the stored file relative to the working directory, always with forward slashes. */
    @JsonProperty("path")
    public final String path;

    @JsonProperty("uploaded_at")
    public final Instant uploadedAt;

    public StoredFileRecord (String originalName, String storedName, long sizeBytes, String path, Instant uploadedAt) {
        this.originalName = originalName;
        this.storedName = storedName;
        this.sizeBytes = sizeBytes;
        this.path = path;
        this.uploadedAt = uploadedAt;
    }

    @Override
    public String toString () {
        return String.format("StoredFileRecord{%s -> %s, %d bytes}", originalName, path, sizeBytes);
    }
}
