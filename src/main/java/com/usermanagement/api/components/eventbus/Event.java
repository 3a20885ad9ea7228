package com.usermanagement.api.components.eventbus;

import com.usermanagement.api.gatekeeper.IdentityClaims;

import java.util.Date;

/**
 * Metadata about server operation and user activity, as opposed to a domain model class. These are intended to be
 * written to a log, so the field visibility and types of every subclass should take that into consideration.
 */
public abstract class Event {

    public Date timestamp = new Date();
    public String user;
    public String role;
    public boolean success = true;

    /**
     * Set the user and role from the supplied claims (if any) and return the modified instance.
     * These fluent setter methods return this abstract supertype instead of the specific subtype, which can be a
     * little awkward. But the alternative of declaring Event <S extends Event> and casting is more ugly.
     * @param claims if this is null, the call will have no effect.
     */
    public Event forUser (IdentityClaims claims) {
        if (claims != null) {
            this.user = claims.subject;
            this.role = claims.role;
        }
        return this;
    }

    /** Serialize the specific subtype of event to facilitate filtering. */
    public String getType () {
        // Will resolve to specific subclass
        return this.getClass().getSimpleName();
    }

}
