package com.mimecast.tether.connection;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Checks that connection state is only touched from the connection thread.
 *
 * <p>A violation is a programming error. The operation must be abandoned without side effects.
 */
public class ThreadAffinityGuard {
    private static final Logger log = LogManager.getLogger(ThreadAffinityGuard.class);

    private final EventLoop eventLoop;

    /**
     * Constructs a new ThreadAffinityGuard instance.
     *
     * @param eventLoop Designated EventLoop.
     */
    public ThreadAffinityGuard(EventLoop eventLoop) {
        this.eventLoop = eventLoop;
    }

    /**
     * Is the calling thread the designated one.
     *
     * @return Boolean.
     */
    public boolean isOnDesignatedContext() {
        return eventLoop.inEventLoop();
    }

    /**
     * Checks thread affinity and logs a violation.
     *
     * @param operation Operation name for the log.
     * @return True if the operation may proceed.
     */
    public boolean check(String operation) {
        if (isOnDesignatedContext()) {
            return true;
        }
        log.error("Aborting {} because it is not running on the {} thread (caller: {})",
                operation, eventLoop.getName(), Thread.currentThread().getName());
        return false;
    }
}
