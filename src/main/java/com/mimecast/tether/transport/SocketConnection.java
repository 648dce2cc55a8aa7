package com.mimecast.tether.transport;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.net.Socket;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Socket backed transport connection.
 *
 * <p>One reader thread per connection dispatches inbound frames.
 * <br>Writes are serialized on the output stream and happen on the calling thread.
 * <br>Client initiated streams use odd ids.
 * <p>Keepalive frames ask the peer to echo them.
 * <br>A peer that sends nothing for {@value #MISSED_KEEPALIVES} intervals is treated as lost.
 */
public class SocketConnection implements TransportConnection {
    private static final Logger log = LogManager.getLogger(SocketConnection.class);

    /**
     * Keepalive data asking the receiver to answer with a keepalive.
     */
    public static final String KEEPALIVE_RESPOND = "respond";

    /**
     * Keepalive intervals without any inbound frame before the connection is dropped.
     */
    public static final int MISSED_KEEPALIVES = 3;

    private final Socket socket;
    private final DataInputStream in;
    private final DataOutputStream out;
    private final ConnectionEvents events;
    private final Responder responder;
    private final String address;

    private final Object writeLock = new Object();
    private final AtomicInteger nextStream = new AtomicInteger(1);
    private final Map<Integer, CompletableFuture<String>> pending = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile ScheduledFuture<?> keepalive;
    private volatile long lastReceived = System.nanoTime();

    /**
     * Constructs a new SocketConnection instance.
     *
     * @param socket     Connected socket.
     * @param parameters SetupParameters instance.
     * @throws IOException Unable to open streams.
     */
    SocketConnection(Socket socket, SetupParameters parameters) throws IOException {
        this.socket = socket;
        this.in = new DataInputStream(new BufferedInputStream(socket.getInputStream()));
        this.out = new DataOutputStream(new BufferedOutputStream(socket.getOutputStream()));
        this.events = parameters.getEvents();
        this.responder = parameters.getResponder();
        this.address = parameters.getAddress();
    }

    /**
     * Sends setup frame, signals connected, then starts reading and keepalive.
     *
     * @param payload   Setup payload.
     * @param interval  Keepalive interval.
     * @param readers   Reader thread pool.
     * @param scheduler Keepalive scheduler.
     * @throws IOException Unable to send setup frame.
     */
    void start(String payload, Duration interval, ExecutorService readers, ScheduledExecutorService scheduler) throws IOException {
        write(new Frame(Frame.Type.SETUP, 0, payload));

        // Signalled before reading starts so a disconnect is never reported ahead of it.
        log.debug("Connected to {}", address);
        if (events != null) {
            events.onConnected();
        }

        lastReceived = System.nanoTime();
        readers.execute(this::readLoop);

        long millis = interval != null ? interval.toMillis() : 0L;
        if (millis > 0) {
            long maxSilence = TimeUnit.MILLISECONDS.toNanos(millis * MISSED_KEEPALIVES);
            keepalive = scheduler.scheduleAtFixedRate(() -> sendKeepalive(maxSilence), millis, millis, TimeUnit.MILLISECONDS);
        }
    }

    @Override
    public CompletableFuture<Void> fireAndForget(String payload) {
        CompletableFuture<Void> future = new CompletableFuture<>();
        try {
            write(new Frame(Frame.Type.FIRE_AND_FORGET, nextStream.getAndAdd(2), payload));
            future.complete(null);
        } catch (IOException e) {
            future.completeExceptionally(e);
            terminate(e, false);
        }
        return future;
    }

    @Override
    public CompletableFuture<String> requestResponse(String payload) {
        CompletableFuture<String> future = new CompletableFuture<>();
        int stream = nextStream.getAndAdd(2);
        pending.put(stream, future);
        try {
            write(new Frame(Frame.Type.REQUEST, stream, payload));
        } catch (IOException e) {
            pending.remove(stream);
            future.completeExceptionally(e);
            terminate(e, false);
        }
        return future;
    }

    @Override
    public void disconnect() {
        terminate(null, true);
    }

    @Override
    public boolean isOpen() {
        return !closed.get();
    }

    /**
     * Reads and dispatches frames until the connection ends.
     */
    private void readLoop() {
        try {
            while (!closed.get()) {
                Frame frame = FrameCodec.read(in);
                lastReceived = System.nanoTime();
                dispatch(frame);
            }
        } catch (IOException e) {
            if (!closed.get()) {
                log.debug("Connection to {} lost: {}", address, e.getMessage());
                terminate(e, false);
            }
        }
    }

    /**
     * Dispatches inbound frame.
     *
     * @param frame Frame instance.
     * @throws IOException Unable to answer.
     */
    private void dispatch(Frame frame) throws IOException {
        switch (frame.getType()) {
            case RESPONSE:
                complete(frame.getStream()).ifPresent(f -> f.complete(frame.getData()));
                break;

            case ERROR:
                if (frame.getStream() == 0) {
                    terminate(new TransportException(TransportException.Type.IO, "Connection error from " + address + ": " + frame.getData()), false);
                } else {
                    complete(frame.getStream()).ifPresent(f -> f.completeExceptionally(new ErrorResponseException(frame.getData())));
                }
                break;

            case FIRE_AND_FORGET:
                if (responder != null) {
                    try {
                        responder.handleFireAndForget(frame.getData());
                    } catch (RuntimeException e) {
                        log.error("Responder failed on message from {}: {}", address, e.getMessage(), e);
                    }
                }
                break;

            case REQUEST:
                // Requests from the desktop are not served by this client.
                write(new Frame(Frame.Type.ERROR, frame.getStream(), ErrorResponseException.NOT_IMPLEMENTED));
                break;

            case KEEPALIVE:
                log.trace("Keepalive from {}", address);
                if (KEEPALIVE_RESPOND.equals(frame.getData())) {
                    write(new Frame(Frame.Type.KEEPALIVE, 0, null));
                }
                break;

            default:
                log.warn("Unexpected frame from {}: {}", address, frame);
        }
    }

    private Optional<CompletableFuture<String>> complete(int stream) {
        CompletableFuture<String> future = pending.remove(stream);
        if (future == null) {
            log.debug("Response for unknown stream {} from {}", stream, address);
        }
        return Optional.ofNullable(future);
    }

    /**
     * Drops a silent peer, otherwise sends a keepalive it should echo.
     *
     * @param maxSilence Nanoseconds allowed without an inbound frame.
     */
    private void sendKeepalive(long maxSilence) {
        long silence = System.nanoTime() - lastReceived;
        if (silence > maxSilence) {
            log.warn("Nothing received from {} for {} ms", address, TimeUnit.NANOSECONDS.toMillis(silence));
            terminate(new TransportException(TransportException.Type.TIMED_OUT,
                    "Keepalive timeout on connection to " + address), false);
            return;
        }

        try {
            write(new Frame(Frame.Type.KEEPALIVE, 0, KEEPALIVE_RESPOND));
        } catch (IOException e) {
            log.debug("Keepalive to {} failed: {}", address, e.getMessage());
            terminate(e, false);
        }
    }

    private void write(Frame frame) throws IOException {
        if (closed.get()) {
            throw new TransportException(TransportException.Type.IO, "Connection to " + address + " is closed");
        }
        synchronized (writeLock) {
            FrameCodec.write(out, frame);
            out.flush();
        }
    }

    /**
     * Closes socket, fails pending requests and signals the event once.
     *
     * @param cause Cause or null.
     * @param local True if closed by this side.
     */
    private void terminate(Throwable cause, boolean local) {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        ScheduledFuture<?> task = keepalive;
        if (task != null) {
            task.cancel(false);
        }
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("Error closing socket to {}: {}", address, e.getMessage());
        }

        TransportException failure = new TransportException(TransportException.Type.IO, "Connection to " + address + " closed", cause);
        pending.values().forEach(f -> f.completeExceptionally(failure));
        pending.clear();

        if (events != null) {
            if (local) {
                events.onClosed(cause);
            } else {
                events.onDisconnected(cause);
            }
        }
    }
}
