package com.mimecast.tether.connection;

import com.mimecast.tether.trust.CredentialStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

/**
 * Reconnect policy.
 *
 * <p>Decides whether the next attempt must obtain certificates first and schedules retries.
 * <p>Certificates are requested when:
 * <ul>
 *     <li>Any of the three credential files is missing or empty.</li>
 *     <li>The failure threshold is reached, so a rejected or expired certificate heals itself.</li>
 * </ul>
 * <p>Retries use a constant interval without backoff.
 */
public class ReconnectPolicy {
    private static final Logger log = LogManager.getLogger(ReconnectPolicy.class);

    private final EventLoop eventLoop;
    private final Duration interval;
    private final int threshold;

    /**
     * Constructs a new ReconnectPolicy instance.
     *
     * @param eventLoop EventLoop to schedule retries on.
     * @param interval  Delay before each retry.
     * @param threshold Consecutive failures forcing a new certificate exchange.
     */
    public ReconnectPolicy(EventLoop eventLoop, Duration interval, int threshold) {
        this.eventLoop = eventLoop;
        this.interval = interval;
        this.threshold = threshold;
    }

    /**
     * Should the next attempt bootstrap.
     *
     * @param credentials         CredentialStore instance.
     * @param consecutiveFailures Failures counted so far.
     * @return Boolean.
     */
    public boolean shouldBootstrap(CredentialStore credentials, int consecutiveFailures) {
        if (consecutiveFailures >= threshold) {
            log.info("Requesting new certificates after {} failed attempts", consecutiveFailures);
            return true;
        }
        if (!credentials.isUsable()) {
            log.debug("Credentials missing in {}", credentials.getDirectory());
            return true;
        }
        return false;
    }

    /**
     * Schedules retry on the event loop.
     *
     * @param callback Runnable.
     * @return ScheduledFuture or null if the loop is shut down.
     */
    public ScheduledFuture<?> scheduleRetry(Runnable callback) {
        log.debug("Reconnecting in {}ms", interval.toMillis());
        return eventLoop.schedule(callback, interval);
    }

    public Duration getInterval() {
        return interval;
    }

    public int getThreshold() {
        return threshold;
    }
}
