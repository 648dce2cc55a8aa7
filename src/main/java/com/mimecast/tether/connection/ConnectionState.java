package com.mimecast.tether.connection;

/**
 * Mutable connection state.
 *
 * <p>Written only on the connection thread by {@link ConnectionStateMachine}.
 * <br>Fields are volatile so any thread may read a snapshot.
 * <br>Invariant: trusted implies open.
 */
public class ConnectionState {

    private volatile boolean open;
    private volatile boolean trusted;
    private volatile int consecutiveFailures;
    private volatile int exchangeBaseline;
    private volatile AttemptContext attempt;

    public boolean isOpen() {
        return open;
    }

    public boolean isTrusted() {
        return trusted;
    }

    /**
     * Is connected over a trusted channel.
     *
     * @return Boolean.
     */
    public boolean isConnected() {
        return trusted && open;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    /**
     * Gets failures counted since the last certificate exchange.
     *
     * @return Failure count.
     */
    public int getFailuresSinceExchange() {
        return consecutiveFailures - exchangeBaseline;
    }

    /**
     * Gets current attempt.
     *
     * @return AttemptContext or null before the first attempt.
     */
    public AttemptContext getAttempt() {
        return attempt;
    }

    void setAttempt(AttemptContext attempt) {
        this.attempt = attempt;
    }

    void markOpen() {
        open = true;
    }

    void markTrusted() {
        if (!open) {
            throw new IllegalStateException("Trusted flag requires an open transport");
        }
        trusted = true;
    }

    /**
     * Clears open and trusted flags.
     *
     * @return True if the connection was trusted.
     */
    boolean markClosed() {
        boolean wasTrusted = trusted;
        trusted = false;
        open = false;
        return wasTrusted;
    }

    void recordFailure() {
        consecutiveFailures++;
    }

    void resetFailures() {
        consecutiveFailures = 0;
        exchangeBaseline = 0;
    }

    void markExchanged() {
        exchangeBaseline = consecutiveFailures;
    }

    @Override
    public String toString() {
        return "ConnectionState{open=" + open + ", trusted=" + trusted
                + ", consecutiveFailures=" + consecutiveFailures + ", attempt=" + attempt + "}";
    }
}
