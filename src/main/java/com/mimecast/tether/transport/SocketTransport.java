package com.mimecast.tether.transport;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.net.ssl.SSLSocket;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * TCP socket transport with optional mutual TLS.
 *
 * <p>Owns the I/O threads: one reader per connection and a shared keepalive scheduler.
 * <br>These are independent of the caller's thread so callbacks arrive concurrently with it.
 */
public class SocketTransport implements Transport {
    private static final Logger log = LogManager.getLogger(SocketTransport.class);

    private final ExecutorService readers;
    private final ScheduledExecutorService scheduler;

    /**
     * Constructs a new SocketTransport instance.
     */
    public SocketTransport() {
        AtomicInteger counter = new AtomicInteger();
        this.readers = Executors.newCachedThreadPool(daemon(r -> new Thread(r, "tether-io-" + counter.incrementAndGet())));
        this.scheduler = Executors.newSingleThreadScheduledExecutor(daemon(r -> new Thread(r, "tether-keepalive")));
    }

    private static ThreadFactory daemon(ThreadFactory factory) {
        return r -> {
            Thread thread = factory.newThread(r);
            thread.setDaemon(true);
            return thread;
        };
    }

    @Override
    public TransportConnection connect(SetupParameters parameters) throws TransportException {
        Socket socket = null;
        try {
            socket = parameters.isSecure()
                    ? parameters.getSslContext().getSocketFactory().createSocket()
                    : new Socket();
            int timeout = Math.toIntExact(parameters.getConnectTimeout().toMillis());
            socket.setTcpNoDelay(true);
            socket.connect(new InetSocketAddress(parameters.getHost(), parameters.getPort()), timeout);

            if (socket instanceof SSLSocket) {
                SSLSocket sslSocket = (SSLSocket) socket;
                sslSocket.setUseClientMode(true);

                // A peer that accepts but never answers fails the handshake with a SocketTimeoutException.
                sslSocket.setSoTimeout(timeout);
                sslSocket.startHandshake();
                sslSocket.setSoTimeout(0);
                log.debug("TLS negotiated with {} using {}", parameters.getAddress(), sslSocket.getSession().getProtocol());
            }

            SocketConnection connection = new SocketConnection(socket, parameters);
            connection.start(parameters.getPayload(), parameters.getKeepalive(), readers, scheduler);
            return connection;
        } catch (IOException e) {
            closeQuietly(socket);
            throw TransportException.classify(e, parameters.getAddress());
        }
    }

    private static void closeQuietly(Socket socket) {
        if (socket != null) {
            try {
                socket.close();
            } catch (IOException e) {
                log.debug("Error closing socket: {}", e.getMessage());
            }
        }
    }

    @Override
    public void close() {
        readers.shutdownNow();
        scheduler.shutdownNow();
    }
}
