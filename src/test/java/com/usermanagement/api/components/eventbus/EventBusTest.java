package com.usermanagement.api.components.eventbus;

import com.usermanagement.api.components.TaskScheduler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class EventBusTest {

    private final TaskScheduler taskScheduler = new TaskScheduler(() -> 1);

    @AfterEach
    void tearDown () {
        taskScheduler.shutDown();
    }

    /** Records what it receives in the sending thread. */
    private static class RecordingHandler implements EventHandler {
        final List<Event> received = new ArrayList<>();
        Thread thread;

        @Override
        public void handleEvent (Event event) {
            thread = Thread.currentThread();
            received.add(event);
        }

        @Override
        public boolean acceptEvent (Event event) {
            return event instanceof GateRejectionEvent;
        }

        @Override
        public boolean synchronous () {
            return true;
        }
    }

    private static GateRejectionEvent rejection () {
        return new GateRejectionEvent("listUsers", "/api/v1/users", "10.0.0.1", 429,
                "RATE_LIMIT_EXCEEDED", "rate class moderate exhausted");
    }

    @Test
    void synchronousHandlersRunInTheSendingThread () {
        EventBus eventBus = new EventBus(taskScheduler);
        RecordingHandler handler = new RecordingHandler();
        eventBus.addHandlers(handler);
        GateRejectionEvent event = rejection();
        eventBus.send(event);
        eventBus.send(new FileUploadEvent("uploadImage", 1, 42));
        assertEquals(1, handler.received.size());
        assertSame(event, handler.received.get(0));
        assertSame(Thread.currentThread(), handler.thread);
    }

    @Test
    void asynchronousHandlersRunInTheBackground () throws InterruptedException {
        EventBus eventBus = new EventBus(taskScheduler);
        CountDownLatch handled = new CountDownLatch(1);
        AtomicReference<Thread> handlerThread = new AtomicReference<>();
        // Handlers that do not say otherwise are asynchronous.
        eventBus.addHandlers(new EventHandler() {
            @Override
            public void handleEvent (Event event) {
                handlerThread.set(Thread.currentThread());
                handled.countDown();
            }
        });
        eventBus.send(rejection());
        assertTrue(handled.await(5, TimeUnit.SECONDS));
        assertNotSame(Thread.currentThread(), handlerThread.get());
    }

    @Test
    void failingHandlerDoesNotStopTheOthers () {
        EventBus eventBus = new EventBus(taskScheduler);
        RecordingHandler handler = new RecordingHandler();
        eventBus.addHandlers(new EventHandler() {
            @Override
            public void handleEvent (Event event) {
                throw new IllegalStateException("handler is broken");
            }

            @Override
            public boolean synchronous () {
                return true;
            }
        }, handler);
        eventBus.send(rejection());
        assertEquals(1, handler.received.size());
    }

    @Test
    void errorEventsAreFailures () {
        ErrorEvent event = new ErrorEvent(new RuntimeException("disk on fire"), "/api/v1/files/upload",
                "INTERNAL_ERROR");
        assertFalse(event.success);
        assertEquals("INTERNAL_ERROR", event.errorTag);
        assertTrue(event.traceWithContext(false).contains("disk on fire"));
        ErrorLogger errorLogger = new ErrorLogger();
        assertTrue(errorLogger.acceptEvent(event));
        assertTrue(errorLogger.synchronous());
        assertFalse(errorLogger.acceptEvent(rejection()));
    }

}
