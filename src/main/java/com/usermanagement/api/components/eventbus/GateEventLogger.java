package com.usermanagement.api.components.eventbus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Log the decisions of the gatekeeper and the completion of HTTP requests. Rejections are logged at warn level since a
 * burst of them usually means a misconfigured client or someone probing the API.
 */
public class GateEventLogger implements EventHandler {

    private static final Logger LOG = LoggerFactory.getLogger(GateEventLogger.class);

    @Override
    public void handleEvent (Event event) {
        if (event instanceof GateRejectionEvent) {
            LOG.warn(event.toString());
        } else if (event instanceof FileUploadEvent) {
            LOG.info(event.toString());
        } else if (event instanceof HttpApiEvent) {
            LOG.debug(event.toString());
        }
    }

    @Override
    public boolean acceptEvent (Event event) {
        return event instanceof GateRejectionEvent
                || event instanceof FileUploadEvent
                || event instanceof HttpApiEvent;
    }

}
