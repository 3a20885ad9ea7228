package com.usermanagement.api.gatekeeper;

import spark.Request;

/**
 * One step of a route pipeline. Stages record what they establish (identity, stored files) in the GateContext.
 */
@FunctionalInterface
interface GateStage {

    /** @return null to let the request continue to the next stage, or the reason to refuse it. */
    Rejection check (Request req, GateContext context);

}
