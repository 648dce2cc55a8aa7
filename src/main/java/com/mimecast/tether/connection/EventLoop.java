package com.mimecast.tether.connection;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Single threaded execution context owning all connection state.
 *
 * <p>Tasks run one at a time in submission order.
 * <br>Exceptions are logged and never escape a task.
 * <br>Tasks submitted after shutdown are dropped.
 */
public class EventLoop implements Executor {
    private static final Logger log = LogManager.getLogger(EventLoop.class);

    private final String name;
    private final ScheduledExecutorService executor;
    private volatile Thread thread;

    /**
     * Constructs a new EventLoop instance.
     *
     * @param name Thread name.
     */
    public EventLoop(String name) {
        this.name = name;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            thread = t;
            return t;
        });
    }

    /**
     * Runs task on the loop as soon as possible.
     *
     * @param task Runnable.
     */
    @Override
    public void execute(Runnable task) {
        try {
            executor.execute(wrap(task));
        } catch (RejectedExecutionException e) {
            log.debug("Task dropped, {} is shut down", name);
        }
    }

    /**
     * Runs task on the loop after a delay.
     *
     * @param task  Runnable.
     * @param delay Delay.
     * @return ScheduledFuture or null if the loop is shut down.
     */
    public ScheduledFuture<?> schedule(Runnable task, Duration delay) {
        try {
            return executor.schedule(wrap(task), delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Scheduled task dropped, {} is shut down", name);
            return null;
        }
    }

    /**
     * Is the calling thread the loop thread.
     *
     * @return Boolean.
     */
    public boolean inEventLoop() {
        return Thread.currentThread() == thread;
    }

    public String getName() {
        return name;
    }

    /**
     * Stops accepting tasks and waits for queued ones.
     *
     * @param timeout Wait limit.
     */
    public void shutdown(Duration timeout) {
        executor.shutdown();
        if (inEventLoop()) {
            return;
        }
        try {
            if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("{} did not terminate within {}ms", name, timeout.toMillis());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    private Runnable wrap(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("Uncaught error on {}: {}", name, e.getMessage(), e);
            }
        };
    }
}
