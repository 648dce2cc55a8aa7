package com.mimecast.tether.transport;

/**
 * Handler for messages pushed by the desktop.
 */
@FunctionalInterface
public interface Responder {

    /**
     * Handles a fire-and-forget message.
     *
     * @param payload Payload string.
     */
    void handleFireAndForget(String payload);
}
