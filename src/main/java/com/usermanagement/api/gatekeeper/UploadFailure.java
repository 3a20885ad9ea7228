package com.usermanagement.api.gatekeeper;

/**
 * The reasons an upload can be refused. Each carries the HTTP status code and the machine-readable error tag sent to
 * the client. Everything the client could correct is a 400; failures on our side of the connection are a 500.
 */
public enum UploadFailure {

    INVALID_FORM_DATA(400),
    FILE_REQUIRED(400),
    TOO_MANY_FILES(400),
    FILE_TOO_LARGE(400),
    DISALLOWED_EXTENSION(400),
    DISALLOWED_CONTENT_TYPE(400),
    STORAGE_FAILURE(500),
    DESTINATION_UNAVAILABLE(500, "INTERNAL_ERROR");

    public final int httpCode;

    public final String tag;

    UploadFailure (int httpCode) {
        this.httpCode = httpCode;
        this.tag = name();
    }

    UploadFailure (int httpCode, String tag) {
        this.httpCode = httpCode;
        this.tag = tag;
    }

}
