package com.mimecast.tether.metrics;

import com.mimecast.tether.connection.AttemptMode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Locale;

/**
 * Connection Micrometer metrics.
 *
 * <p>Counts connection attempts, failures and certificate exchanges per attempt mode.
 * <br>Uses a private SimpleMeterRegistry unless the embedder supplies its own registry.
 */
public class ConnectionMetrics {
    private static final Logger log = LogManager.getLogger(ConnectionMetrics.class);

    private final MeterRegistry registry;

    /**
     * Constructs a new ConnectionMetrics instance with a private registry.
     */
    public ConnectionMetrics() {
        this(new SimpleMeterRegistry());
    }

    /**
     * Constructs a new ConnectionMetrics instance.
     *
     * @param registry MeterRegistry instance.
     */
    public ConnectionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    /**
     * Increment the connection attempt counter.
     *
     * @param mode Attempt mode.
     */
    public void incrementAttempt(AttemptMode mode) {
        increment(Counter.builder("tether.connection.attempts")
                .description("Number of connection attempts")
                .tag("mode", mode.name().toLowerCase(Locale.ROOT)));
    }

    /**
     * Increment the connection failure counter.
     *
     * @param mode    Attempt mode.
     * @param counted False for the benign desktop not running case.
     */
    public void incrementFailure(AttemptMode mode, boolean counted) {
        increment(Counter.builder("tether.connection.failures")
                .description("Number of failed connection attempts")
                .tag("mode", mode.name().toLowerCase(Locale.ROOT))
                .tag("counted", String.valueOf(counted)));
    }

    /**
     * Increment the trusted connection counter.
     */
    public void incrementConnected() {
        increment(Counter.builder("tether.connection.connected")
                .description("Number of trusted connections established"));
    }

    /**
     * Increment the certificate exchange counter.
     *
     * @param outcome Exchange outcome name.
     */
    public void incrementExchange(String outcome) {
        increment(Counter.builder("tether.bootstrap.exchanges")
                .description("Number of certificate exchanges by outcome")
                .tag("outcome", outcome.toLowerCase(Locale.ROOT)));
    }

    private void increment(Counter.Builder builder) {
        try {
            builder.register(registry).increment();
        } catch (Exception e) {
            log.warn("Failed to increment counter: {}", e.getMessage());
        }
    }
}
