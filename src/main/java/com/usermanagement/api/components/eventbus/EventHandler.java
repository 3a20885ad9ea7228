package com.usermanagement.api.components.eventbus;

/**
 * Receives the events sent on the EventBus, such as gatekeeper rejections, stored uploads and server errors.
 * Handlers must not send events themselves.
 */
public interface EventHandler {

    void handleEvent (Event event);

    /** Only events for which this returns true reach handleEvent. By default a handler sees every event. */
    default boolean acceptEvent (Event event) {
        return true;
    }

    /**
     * True to handle events in the thread that sent them, which is usually a request thread. Only handlers that never
     * block and return at once (like a single log call) should do this. By default events are handed to the light
     * task pool, so a slow handler never delays a response.
     */
    default boolean synchronous () {
        return false;
    }

}
