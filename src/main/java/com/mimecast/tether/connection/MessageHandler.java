package com.mimecast.tether.connection;

import com.google.gson.JsonObject;

/**
 * Application callback for messages pushed by the desktop.
 *
 * <p>Invoked on the connection thread.
 */
@FunctionalInterface
public interface MessageHandler {

    /**
     * Handles inbound message.
     *
     * @param message JsonObject instance.
     */
    void onMessageReceived(JsonObject message);
}
