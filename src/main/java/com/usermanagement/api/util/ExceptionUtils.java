package com.usermanagement.api.util;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Convenience functions for working with exceptions (or more generally throwables).
 */
public abstract class ExceptionUtils {

    private static final String OWN_PACKAGE_PREFIX = "com.usermanagement";

    /**
     * Returns the output of Throwable.printStackTrace() in a String.
     * This is the usual Java stack trace we're accustomed to seeing on the console, including the chain of causes.
     */
    public static String stackTraceString (Throwable throwable) {
        StringWriter sw = new StringWriter();
        throwable.printStackTrace(new PrintWriter(sw));
        return sw.toString();
    }

    /**
     * Short-form exception summary that includes the chain of causality, reversed such that the root cause comes first.
     */
    public static String shortCauseString (Throwable throwable) {
        List<String> items = new ArrayList<>();
        Set<Throwable> seen = new HashSet<>(); // Bail out if there are cycles in the cause chain
        while (throwable != null && !seen.contains(throwable)) {
            String item = throwable.getClass().getSimpleName();
            if (throwable.getMessage() != null) {
                item += ": " + throwable.getMessage();
            }
            items.add(item);
            seen.add(throwable);
            throwable = throwable.getCause();
        }
        Collections.reverse(items);
        return String.join(", caused ", items);
    }

    /**
     * A minimal stack trace: the exception summary followed by the first few frames, stopping after the first frame
     * within our own code. Library frames below the entry point into our code are rarely useful in a response body.
     */
    public static String filterStackTrace (Throwable throwable) {
        if (throwable == null) return null;
        StringBuilder builder = new StringBuilder(throwable.toString());
        for (StackTraceElement element : throwable.getStackTrace()) {
            builder.append("\n  at ").append(element);
            if (element.getClassName().startsWith(OWN_PACKAGE_PREFIX)) {
                break;
            }
        }
        return builder.toString();
    }

}
