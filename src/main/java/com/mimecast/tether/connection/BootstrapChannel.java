package com.mimecast.tether.connection;

import com.mimecast.tether.transport.TransportException;

import java.util.concurrent.CompletableFuture;

/**
 * Unauthenticated channel used by the certificate exchange.
 *
 * <p>Implemented by {@link ConnectionStateMachine} over the transport connection it owns.
 * <br>Futures complete on the connection thread.
 */
public interface BootstrapChannel {

    /**
     * Opens the unauthenticated connection.
     *
     * @param setupPayload Setup payload.
     * @throws TransportException Unable to connect.
     */
    void open(String setupPayload) throws TransportException;

    /**
     * Sends request expecting a single response.
     *
     * @param payload Payload string.
     * @return Future of the response payload.
     */
    CompletableFuture<String> requestResponse(String payload);

    /**
     * Sends message without response.
     *
     * @param payload Payload string.
     * @return Future completed once written.
     */
    CompletableFuture<Void> fireAndForget(String payload);
}
