package com.usermanagement.api.components;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * This provides application-wide queues of one-off or repeating background tasks. Periodic tasks (such as sweeping
 * idle rate limiter buckets) run on a single scheduled thread. One-off tasks (such as asynchronous event handlers) run
 * on a "light" executor whose number of threads is set in the main configuration file.
 *
 * Every task is wrapped so that any Throwable is caught and logged. An uncaught exception would otherwise silently
 * cancel all future executions of a periodic task.
 */
public class TaskScheduler implements Component {

    private static final Logger LOG = LoggerFactory.getLogger(TaskScheduler.class);

    // The Javadoc on the ExecutorService interface implies that it's threadsafe by mentioning happens-before.
    // So we don't need to explicitly synchronize use of these executor services from multiple simultaneous requests.
    private final ScheduledExecutorService scheduledExecutor;
    private final ExecutorService lightExecutor;

    // Keep the futures returned when periodic tasks are scheduled, giving access to status information and exceptions.
    private final List<ScheduledFuture<?>> periodicTaskFutures = new ArrayList<>();

    public interface Config {
        int lightThreads ();
    }

    /**
     * Interface for all actions that we want to repeat at regular intervals.
     * Single-method interfaces allow supplying lambdas and method references where convenient.
     */
    public interface PeriodicTask extends Runnable {
        int getPeriodSeconds();
    }

    public TaskScheduler (Config config) {
        scheduledExecutor = Executors.newSingleThreadScheduledExecutor(
                new ThreadFactoryBuilder().setNameFormat("periodic-%d").setDaemon(true).build()
        );
        lightExecutor = Executors.newFixedThreadPool(
                config.lightThreads(),
                new ThreadFactoryBuilder().setNameFormat("light-%d").setDaemon(true).build()
        );
    }

    /**
     * Run the task every getPeriodSeconds() seconds, starting one period from now.
     * @return a future that the caller may cancel to stop further executions.
     */
    public ScheduledFuture<?> repeatRegularly (PeriodicTask periodicTask) {
        String className = periodicTask.getClass().getSimpleName();
        int periodSeconds = periodicTask.getPeriodSeconds();
        LOG.info("An instance of {} will run every {} seconds.", className, periodSeconds);
        ErrorTrap wrappedPeriodicTask = new ErrorTrap(periodicTask);
        ScheduledFuture<?> future = scheduledExecutor.scheduleAtFixedRate(
                wrappedPeriodicTask, periodSeconds, periodSeconds, TimeUnit.SECONDS
        );
        synchronized (periodicTaskFutures) {
            periodicTaskFutures.removeIf(ScheduledFuture::isDone);
            periodicTaskFutures.add(future);
        }
        return future;
    }

    public void enqueueLightTask (Runnable runnable) {
        lightExecutor.submit(new ErrorTrap(runnable));
    }

    /** Cancel all periodic tasks and stop accepting new ones. Tasks already running are allowed to finish. */
    public void shutDown () {
        synchronized (periodicTaskFutures) {
            periodicTaskFutures.forEach(future -> future.cancel(false));
            periodicTaskFutures.clear();
        }
        scheduledExecutor.shutdown();
        lightExecutor.shutdown();
    }

    /**
     * Wrap a runnable, catching any Errors or Exceptions that occur. This prevents them from propagating up to the
     * scheduled executor, which would swallow them and silently halt the periodic execution of the runnable.
     */
    private static class ErrorTrap implements Runnable {

        private final Runnable runnable;

        public ErrorTrap (Runnable runnable) {
            this.runnable = runnable;
        }

        @Override
        public final void run () {
            try {
                runnable.run();
            } catch (Throwable t) {
                LOG.error("Background execution of {} caused exception.", runnable.getClass(), t);
            }
        }
    }

}
