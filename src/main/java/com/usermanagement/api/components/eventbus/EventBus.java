package com.usermanagement.api.components.eventbus;

import com.usermanagement.api.components.Component;
import com.usermanagement.api.components.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkState;

/**
 * Shared listener registration across all components. A component such as the gatekeeper reports what it did (a
 * request rejected, files stored, an error) without knowing which other components care about it.
 *
 * By default execution of the handlers receiving events is asynchronous, handled by the light task pool of the
 * TaskScheduler. Handlers that declare themselves synchronous run in the thread that sent the event. Event handlers
 * should never themselves trigger more events, to avoid self-amplifying event loops.
 */
public class EventBus implements Component {

    private static final Logger LOG = LoggerFactory.getLogger(EventBus.class);

    private final TaskScheduler taskScheduler;

    // Linear scan through handlers is simpler than a map keyed on event class, and fast for a handful of handlers.
    private final List<EventHandler> handlers = new ArrayList<>();

    public EventBus (TaskScheduler taskScheduler) {
        this.taskScheduler = taskScheduler;
    }

    /** This class is not synchronized, so you should add all handlers at once before any events are fired. */
    public void addHandlers (EventHandler... handlers) {
        checkState(this.handlers.isEmpty());
        for (EventHandler handler : handlers) {
            LOG.info("An instance of {} will receive events.", handler.getClass().getSimpleName());
            this.handlers.add(handler);
        }
    }

    public <T extends Event> void send (final T event) {
        LOG.debug("Bus received event: {}", event);
        for (EventHandler handler : handlers) {
            final boolean accept = handler.acceptEvent(event);
            final boolean synchronous = handler.synchronous();
            if (accept) {
                if (synchronous) {
                    try {
                        handler.handleEvent(event);
                    } catch (Throwable t) {
                        // Do not recursively fire events on errors, there is some programming mistake.
                        LOG.error("Event handler {} failed.", handler.getClass().getSimpleName(), t);
                    }
                } else {
                    taskScheduler.enqueueLightTask(() -> handler.handleEvent(event));
                }
            }
        }
    }

}
