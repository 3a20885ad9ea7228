package com.usermanagement.api.components.eventbus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes every server error to the log with its full stack trace, next to the error tag the client received in the
 * response envelope. The client never sees the trace, so this log line is the only place it is kept.
 */
public class ErrorLogger implements EventHandler {

    private static final Logger LOG = LoggerFactory.getLogger(ErrorLogger.class);

    @Override
    public void handleEvent (Event event) {
        ErrorEvent errorEvent = (ErrorEvent) event;
        LOG.error("{} returned to client. {}", errorEvent.errorTag, errorEvent.traceWithContext(true));
    }

    @Override
    public boolean acceptEvent (Event event) {
        return event instanceof ErrorEvent;
    }

    /** Logged in the failing request thread, so the error is recorded even if the light task pool is saturated. */
    @Override
    public boolean synchronous () {
        return true;
    }

}
