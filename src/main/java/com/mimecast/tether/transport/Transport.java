package com.mimecast.tether.transport;

import java.io.Closeable;

/**
 * Reliable bidirectional message transport to the desktop.
 *
 * <p>Connecting is synchronous: it returns once the connection is established and the setup payload sent.
 * <br>Connection events are delivered on transport owned threads.
 */
public interface Transport extends Closeable {

    /**
     * Connects to the desktop.
     *
     * @param parameters SetupParameters instance.
     * @return Connected TransportConnection.
     * @throws TransportException Unable to connect, classified by {@link TransportException.Type}.
     */
    TransportConnection connect(SetupParameters parameters) throws TransportException;

    /**
     * Releases transport threads.
     */
    @Override
    void close();
}
