package com.usermanagement.api.components.eventbus;

/**
 * Fired when a gatekeeper stage refuses a request. The client only sees the collapsed error tag, while this event
 * carries the internal reason (for example which kind of token failure occurred) for the logs.
 */
public class GateRejectionEvent extends Event {

    /** Name of the guarded route, as declared when it was composed. */
    public final String route;

    public final String path;

    public final String clientKey;

    public final int statusCode;

    public final String tag;

    public final String reason;

    public GateRejectionEvent (String route, String path, String clientKey, int statusCode, String tag, String reason) {
        this.route = route;
        this.path = path;
        this.clientKey = clientKey;
        this.statusCode = statusCode;
        this.tag = tag;
        this.reason = reason;
        this.success = false;
    }

    @Override
    public String toString () {
        return String.format("[Rejected %s on route %s from %s (user %s): %d %s, %s]",
                path, route, clientKey, user, statusCode, tag, reason);
    }
}
