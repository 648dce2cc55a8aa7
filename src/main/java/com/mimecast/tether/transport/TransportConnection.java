package com.mimecast.tether.transport;

import java.util.concurrent.CompletableFuture;

/**
 * Handle of one live transport connection.
 */
public interface TransportConnection {

    /**
     * Sends a message without expecting a response.
     *
     * @param payload Payload string.
     * @return Future completed once the message is written.
     */
    CompletableFuture<Void> fireAndForget(String payload);

    /**
     * Sends a request expecting a single response.
     * <p>An error response completes the future with {@link ErrorResponseException}.
     *
     * @param payload Payload string.
     * @return Future of the response payload.
     */
    CompletableFuture<String> requestResponse(String payload);

    /**
     * Closes the connection.
     * <p>Delivers {@link ConnectionEvents#onClosed(Throwable)} once.
     */
    void disconnect();

    /**
     * Is connection open.
     *
     * @return Boolean.
     */
    boolean isOpen();
}
