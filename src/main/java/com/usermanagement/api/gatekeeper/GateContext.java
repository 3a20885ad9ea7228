package com.usermanagement.api.gatekeeper;

import spark.Request;

import java.time.Instant;
import java.util.List;

/**
 * Everything the gatekeeper has established about one request, attached to the request before the first stage runs.
 * Handlers read it through the typed accessors here (or IdentityClaims.from) rather than through request attributes.
 * Only gatekeeper stages can set the claims and stored files.
 */
public class GateContext {

    private static final String REQUEST_ATTRIBUTE = "gateContext";

    /** The key requests are rate limited on, usually the client IP address. */
    public final String clientKey;

    /** Work on behalf of this request (such as writing uploads) is abandoned after this instant. */
    public final Instant deadline;

    private IdentityClaims claims;

    private List<StoredFileRecord> storedFiles = List.of();

    GateContext (String clientKey, Instant deadline) {
        this.clientKey = clientKey;
        this.deadline = deadline;
    }

    /** @return the verified identity, or null if the route does not authenticate. */
    public IdentityClaims claims () {
        return claims;
    }

    /** @return the files accepted and stored by the upload stage, empty if the route takes no uploads. */
    public List<StoredFileRecord> storedFiles () {
        return storedFiles;
    }

    void setClaims (IdentityClaims claims) {
        this.claims = claims;
    }

    void setStoredFiles (List<StoredFileRecord> storedFiles) {
        this.storedFiles = List.copyOf(storedFiles);
    }

    static GateContext attach (Request req, String clientKey, Instant deadline) {
        GateContext context = new GateContext(clientKey, deadline);
        req.attribute(REQUEST_ATTRIBUTE, context);
        return context;
    }

    /** @return the context of a request that went through a route pipeline, or null for an unguarded route. */
    public static GateContext from (Request req) {
        Object context = req.attribute(REQUEST_ATTRIBUTE);
        return context instanceof GateContext ? (GateContext) context : null;
    }

}
