package com.mimecast.tether.transport;

/**
 * Connection lifecycle callbacks.
 */
public interface ConnectionEvents {

    /**
     * Connection established and setup payload sent.
     */
    void onConnected();

    /**
     * Connection lost.
     *
     * @param cause Cause or null.
     */
    void onDisconnected(Throwable cause);

    /**
     * Connection closed locally.
     *
     * @param cause Cause or null.
     */
    default void onClosed(Throwable cause) {
        onDisconnected(cause);
    }
}
