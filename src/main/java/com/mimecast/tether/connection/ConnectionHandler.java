package com.mimecast.tether.connection;

/**
 * Application callbacks for trusted connection transitions.
 *
 * <p>Invoked on the connection thread. Bootstrap connections are never reported.
 */
public interface ConnectionHandler {

    /**
     * Trusted connection established.
     */
    void onConnected();

    /**
     * Trusted connection lost.
     */
    void onDisconnected();
}
