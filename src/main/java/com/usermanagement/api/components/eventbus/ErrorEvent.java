package com.usermanagement.api.components.eventbus;

import com.usermanagement.api.util.ExceptionUtils;

/**
 * This Event is fired each time a Throwable (usually an Exception or Error) escapes an HTTP handler, so that it can be
 * recorded in the logs.
 */
public class ErrorEvent extends Event {

    // Events are intended to be eligible for serialization into a log, so we convert the Throwable to some Strings.

    public final String summary;

    /**
     * The path portion of the HTTP URL, if the error has occurred while responding to an HTTP request.
     * May be null if this information is unavailable.
     */
    public final String httpPath;

    /** The error tag sent to the client in the response envelope, such as INTERNAL_ERROR. */
    public final String errorTag;

    /** The full stack trace of the exception that occurred. */
    public final String stackTrace;

    /** A minimal stack trace showing the immediate cause within our own code. */
    public final String filteredStackTrace;

    public ErrorEvent (Throwable throwable, String httpPath, String errorTag) {
        this.summary = ExceptionUtils.shortCauseString(throwable);
        this.stackTrace = ExceptionUtils.stackTraceString(throwable);
        this.filteredStackTrace = ExceptionUtils.filterStackTrace(throwable);
        this.httpPath = httpPath;
        this.errorTag = errorTag;
        this.success = false;
    }

    /** Return a string intended for logging on the console. */
    public String traceWithContext (boolean verbose) {
        StringBuilder builder = new StringBuilder();
        if (user == null) {
            builder.append("Unknown/unauthenticated user");
        } else {
            builder.append("User ");
            builder.append(user);
            builder.append(" with role ");
            builder.append(role);
        }
        if (httpPath != null) {
            builder.append(" accessing ");
            builder.append(httpPath);
        }
        builder.append(": ");
        if (verbose) {
            builder.append(stackTrace);
        } else {
            builder.append(filteredStackTrace);
        }
        return builder.toString();
    }

}
