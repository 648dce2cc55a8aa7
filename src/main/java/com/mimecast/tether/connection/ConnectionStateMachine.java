package com.mimecast.tether.connection;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.mimecast.tether.config.ClientConfig;
import com.mimecast.tether.device.DeviceIdentity;
import com.mimecast.tether.metrics.ConnectionMetrics;
import com.mimecast.tether.state.StateTracker;
import com.mimecast.tether.state.Step;
import com.mimecast.tether.transport.ConnectionEvents;
import com.mimecast.tether.transport.SetupParameters;
import com.mimecast.tether.transport.Transport;
import com.mimecast.tether.transport.TransportConnection;
import com.mimecast.tether.transport.TransportException;
import com.mimecast.tether.trust.CertificateRequestGenerator;
import com.mimecast.tether.trust.CredentialStore;
import com.mimecast.tether.trust.SecurityContextFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.net.ssl.SSLContext;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Desktop connection state machine.
 *
 * <p>Keeps one connection to the desktop alive for as long as the client runs.
 * <p>Each attempt either:
 * <ul>
 *     <li>Bootstraps: connects insecurely and exchanges a CSR for a signed certificate, then disconnects.</li>
 *     <li>Connects trusted: mutual TLS with the stored credentials.</li>
 * </ul>
 * <p>Every disconnect and failed attempt schedules a retry through the same entry point.
 * <br>Failures other than a desktop that is not listening are counted.
 * <br>Enough counted failures force a new certificate exchange.
 *
 * <p>All state is owned by a single {@link EventLoop} thread.
 * <br>Transport callbacks arrive on transport threads and are posted onto it.
 * <br>Public methods may be called from any thread.
 *
 * @see ReconnectPolicy
 * @see CertificateBootstrapProtocol
 */
public class ConnectionStateMachine implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(ConnectionStateMachine.class);

    private static final Gson gson = new Gson();
    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

    private final ClientConfig config;
    private final DeviceIdentity identity;
    private final Transport transport;
    private final ConnectionMetrics metrics;

    private final EventLoop eventLoop;
    private final ThreadAffinityGuard guard;
    private final CredentialStore store;
    private final ReconnectPolicy policy;
    private final CertificateBootstrapProtocol bootstrap;
    private final SecurityContextFactory securityContextFactory = new SecurityContextFactory();
    private final StateTracker tracker = new StateTracker();

    private final ConnectionState state = new ConnectionState();
    private final AtomicReference<Lifecycle> lifecycle = new AtomicReference<>(Lifecycle.STOPPED);
    private final AtomicLong attemptIds = new AtomicLong();

    // Owned by the event loop thread.
    private TransportConnection connection;
    private volatile ScheduledFuture<?> pendingRetry;

    private volatile MessageHandler messageHandler = message -> log.debug("No message handler set, dropping message");
    private volatile ConnectionHandler connectionHandler = new ConnectionHandler() {
        @Override
        public void onConnected() {
        }

        @Override
        public void onDisconnected() {
        }
    };

    /**
     * Constructs a new ConnectionStateMachine instance.
     *
     * @param config    Client configuration.
     * @param transport Transport implementation.
     * @param generator CSR generator.
     */
    public ConnectionStateMachine(ClientConfig config, Transport transport, CertificateRequestGenerator generator) {
        this(config, config.getDevice(), transport, generator, new ConnectionMetrics());
    }

    /**
     * Constructs a new ConnectionStateMachine instance.
     *
     * @param config    Client configuration.
     * @param identity  Device identity.
     * @param transport Transport implementation.
     * @param generator CSR generator.
     * @param metrics   Connection metrics.
     */
    public ConnectionStateMachine(ClientConfig config, DeviceIdentity identity, Transport transport,
                                  CertificateRequestGenerator generator, ConnectionMetrics metrics) {
        this.config = config;
        this.identity = identity;
        this.transport = transport;
        this.metrics = metrics;

        this.eventLoop = new EventLoop("tether-connection");
        this.guard = new ThreadAffinityGuard(eventLoop);
        this.store = new CredentialStore(config.getPrivateAppDirectory(), config.getProduct());
        this.policy = new ReconnectPolicy(eventLoop, config.getReconnectInterval(), config.getBootstrapThreshold());
        this.bootstrap = new CertificateBootstrapProtocol(identity, store, generator, tracker);
    }

    /**
     * Starts connecting.
     * <p>No-op if already connected.
     */
    public void start() {
        lifecycle.set(Lifecycle.RUNNING);
        Step step = tracker.start("Start connection thread");
        eventLoop.execute(() -> {
            step.complete();
            attempt();
        });
    }

    /**
     * Stops the client.
     * <p>Disables reconnection immediately and releases the connection on the connection thread.
     */
    public void stop() {
        lifecycle.set(Lifecycle.STOPPING);
        ScheduledFuture<?> retry = pendingRetry;
        if (retry != null) {
            retry.cancel(false);
        }

        eventLoop.execute(() -> {
            ScheduledFuture<?> pending = pendingRetry;
            if (pending != null) {
                pending.cancel(false);
                pendingRetry = null;
            }
            teardown();
            if (lifecycle.compareAndSet(Lifecycle.STOPPING, Lifecycle.STOPPED)) {
                log.info("Connection stopped");
            }
        });
    }

    /**
     * Stops the client and shuts down the connection thread.
     */
    @Override
    public void close() {
        stop();
        eventLoop.shutdown(SHUTDOWN_TIMEOUT);
    }

    /**
     * Sends message to the desktop.
     * <p>Best effort, dropped unless a trusted connection is live.
     *
     * @param message JsonObject instance.
     */
    public void sendMessage(JsonObject message) {
        String payload = gson.toJson(message);
        eventLoop.execute(() -> {
            if (!guard.check("send message")) {
                return;
            }
            if (connection == null || !state.isTrusted()) {
                log.debug("Not connected, dropping message");
                return;
            }
            connection.fireAndForget(payload).whenComplete((ignored, error) -> {
                if (error != null) {
                    log.warn("Failed to send message: {}", error.getMessage());
                }
            });
        });
    }

    /**
     * Is connected over a trusted channel.
     *
     * @return Boolean.
     */
    public boolean isConnected() {
        return state.isConnected();
    }

    /**
     * Sets inbound message handler.
     *
     * @param messageHandler MessageHandler instance.
     */
    public void setMessageHandler(MessageHandler messageHandler) {
        this.messageHandler = messageHandler;
    }

    /**
     * Sets connection transitions handler.
     *
     * @param connectionHandler ConnectionHandler instance.
     */
    public void setConnectionHandler(ConnectionHandler connectionHandler) {
        this.connectionHandler = connectionHandler;
    }

    public ConnectionState getState() {
        return state;
    }

    public Lifecycle getLifecycle() {
        return lifecycle.get();
    }

    public StateTracker getStateTracker() {
        return tracker;
    }

    public CredentialStore getCredentialStore() {
        return store;
    }

    EventLoop getEventLoop() {
        return eventLoop;
    }

    /**
     * Connection attempt.
     * <p>Must run on the connection thread.
     */
    void attempt() {
        if (!guard.check("connection attempt")) {
            return;
        }
        if (lifecycle.get() != Lifecycle.RUNNING) {
            log.debug("Connection attempt skipped, client is {}", lifecycle.get());
            return;
        }
        if (state.isOpen() || connection != null) {
            log.info("Already connected");
            return;
        }

        AttemptMode mode = policy.shouldBootstrap(store, state.getFailuresSinceExchange())
                ? AttemptMode.BOOTSTRAP
                : AttemptMode.TRUSTED;
        AttemptContext attempt = new AttemptContext(attemptIds.incrementAndGet(), identity, mode);
        state.setAttempt(attempt);
        metrics.incrementAttempt(mode);

        Step connect = tracker.start("Connect to desktop");
        try {
            if (attempt.isBootstrap()) {
                doCertificateExchange(attempt, connect);
                return;
            }

            connectSecurely(attempt);
            connect.complete();
        } catch (TransportException e) {
            // Expected when the desktop is not running, not counted.
            onAttemptFailed(attempt, connect, e, !e.isNotOpen());
        } catch (Exception e) {
            onAttemptFailed(attempt, connect, e, true);
        }
    }

    private void doCertificateExchange(AttemptContext attempt, Step connect) throws TransportException, BootstrapException {
        bootstrap.exchange(new InsecureChannel(attempt))
                .whenComplete((result, error) -> onExchangeComplete(attempt, connect, result, error));
    }

    private void onExchangeComplete(AttemptContext attempt, Step connect, BootstrapResult result, Throwable error) {
        if (!guard.check("certificate exchange completion")) {
            return;
        }
        if (state.getAttempt() != attempt) {
            log.debug("Ignoring certificate exchange outcome of stale {}", attempt);
            return;
        }
        if (error != null) {
            onAttemptFailed(attempt, connect, CertificateBootstrapProtocol.unwrap(error), true);
            metrics.incrementExchange("failed");
            return;
        }

        metrics.incrementExchange(result.name());
        if (result == BootstrapResult.REJECTED) {
            state.recordFailure();
            connect.fail("Desktop rejected certificate request");
            metrics.incrementFailure(attempt.getMode(), true);
        } else {
            state.markExchanged();
            connect.complete();
        }

        // Disconnect, the reconnect then uses the secure channel.
        teardown();
        scheduleReconnect();
    }

    private void connectSecurely(AttemptContext attempt) throws Exception {
        SSLContext sslContext = securityContextFactory.create(store);

        Step connecting = tracker.start("Connect securely");
        try {
            connection = transport.connect(new SetupParameters()
                    .setHost(config.getHost())
                    .setPort(config.getSecurePort())
                    .setSslContext(sslContext)
                    .setPayload(gson.toJson(identity.toSecureSetup()))
                    .setResponder(payload -> eventLoop.execute(() -> dispatchMessage(payload)))
                    .setKeepalive(config.getKeepalive())
                    .setConnectTimeout(config.getConnectTimeout())
                    .setEvents(new AttemptEvents(attempt)));
        } catch (TransportException e) {
            connecting.fail(e.getMessage());
            throw e;
        }
        connecting.complete();
    }

    private void onAttemptFailed(AttemptContext attempt, Step connect, Throwable e, boolean counted) {
        if (counted) {
            log.error("Connection attempt {} failed: {}", attempt, e.getMessage());
            state.recordFailure();
            connect.fail(e.getMessage());
        } else {
            log.info("Desktop not reachable: {}", e.getMessage());
            connect.fail("Port not open");
        }
        metrics.incrementFailure(attempt.getMode(), counted);

        teardown();
        scheduleReconnect();
    }

    private void handleConnected(AttemptContext attempt) {
        if (!guard.check("connected event")) {
            return;
        }
        if (state.getAttempt() != attempt) {
            log.debug("Ignoring connected event of stale {}", attempt);
            return;
        }
        if (lifecycle.get() != Lifecycle.RUNNING) {
            log.debug("Ignoring connected event, client is {}", lifecycle.get());
            return;
        }

        state.markOpen();
        if (attempt.isTrusted()) {
            state.resetFailures();
            state.markTrusted();
            metrics.incrementConnected();
            log.info("Connected to desktop at {}:{}", config.getHost(), config.getSecurePort());
            notifyHandler(connectionHandler::onConnected);
        } else {
            log.info("Connected insecurely to {}:{} for certificate exchange", config.getHost(), config.getInsecurePort());
        }
    }

    private void handleDisconnected(AttemptContext attempt, Throwable cause) {
        if (!guard.check("disconnected event")) {
            return;
        }
        if (state.getAttempt() != attempt || !state.isOpen()) {
            log.debug("Ignoring disconnect of {}, not open", attempt);
            return;
        }

        boolean wasTrusted = state.markClosed();
        connection = null;
        log.info("Disconnected from desktop{}", cause != null ? ": " + cause.getMessage() : "");
        if (wasTrusted) {
            notifyHandler(connectionHandler::onDisconnected);
        }
        scheduleReconnect();
    }

    private void dispatchMessage(String payload) {
        if (!guard.check("message dispatch")) {
            return;
        }
        try {
            JsonElement element = JsonParser.parseString(payload);
            if (!element.isJsonObject()) {
                log.warn("Ignoring non object message from desktop");
                return;
            }
            JsonObject message = element.getAsJsonObject();
            notifyHandler(() -> messageHandler.onMessageReceived(message));
        } catch (JsonParseException e) {
            log.warn("Ignoring malformed message from desktop: {}", e.getMessage());
        }
    }

    private void notifyHandler(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.error("Application handler failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Schedules the next attempt unless one is pending or the client is stopping.
     */
    private void scheduleReconnect() {
        if (lifecycle.get() != Lifecycle.RUNNING) {
            log.debug("Reconnect suppressed, client is {}", lifecycle.get());
            return;
        }
        ScheduledFuture<?> retry = pendingRetry;
        if (retry != null && !retry.isDone()) {
            log.debug("Reconnect already pending");
            return;
        }
        pendingRetry = policy.scheduleRetry(() -> {
            pendingRetry = null;
            attempt();
        });
    }

    /**
     * Releases the connection and clears the open and trusted flags.
     * <p>The close event the transport reports afterwards is ignored.
     */
    private void teardown() {
        TransportConnection current = connection;
        connection = null;
        if (current != null) {
            current.disconnect();
        }
        if (state.markClosed()) {
            notifyHandler(connectionHandler::onDisconnected);
        }
    }

    /**
     * Posts transport callbacks of one attempt onto the connection thread.
     */
    private class AttemptEvents implements ConnectionEvents {
        private final AttemptContext attempt;

        AttemptEvents(AttemptContext attempt) {
            this.attempt = attempt;
        }

        @Override
        public void onConnected() {
            eventLoop.execute(() -> handleConnected(attempt));
        }

        @Override
        public void onDisconnected(Throwable cause) {
            eventLoop.execute(() -> handleDisconnected(attempt, cause));
        }

        @Override
        public void onClosed(Throwable cause) {
            eventLoop.execute(() -> handleDisconnected(attempt, cause));
        }
    }

    /**
     * Certificate exchange view of the owned connection.
     */
    private class InsecureChannel implements BootstrapChannel {
        private final AttemptContext attempt;

        InsecureChannel(AttemptContext attempt) {
            this.attempt = attempt;
        }

        @Override
        public void open(String setupPayload) throws TransportException {
            connection = transport.connect(new SetupParameters()
                    .setHost(config.getHost())
                    .setPort(config.getInsecurePort())
                    .setPayload(setupPayload)
                    .setKeepalive(config.getKeepalive())
                    .setConnectTimeout(config.getConnectTimeout())
                    .setEvents(new AttemptEvents(attempt)));
        }

        @Override
        public CompletableFuture<String> requestResponse(String payload) {
            if (connection == null) {
                return CompletableFuture.failedFuture(notConnected());
            }
            long timeout = config.getRequestTimeout().toMillis();
            CompletableFuture<String> response = new CompletableFuture<>();
            connection.requestResponse(payload)
                    .orTimeout(timeout, TimeUnit.MILLISECONDS)
                    .whenCompleteAsync((result, error) -> {
                        if (error == null) {
                            response.complete(result);
                        } else if (CertificateBootstrapProtocol.unwrap(error) instanceof TimeoutException) {
                            response.completeExceptionally(new TransportException(TransportException.Type.TIMED_OUT,
                                    "No answer from desktop within " + timeout + " ms", error));
                        } else {
                            response.completeExceptionally(error);
                        }
                    }, eventLoop);
            return response;
        }

        @Override
        public CompletableFuture<Void> fireAndForget(String payload) {
            if (connection == null) {
                return CompletableFuture.failedFuture(notConnected());
            }
            return onEventLoop(connection.fireAndForget(payload));
        }

        private TransportException notConnected() {
            return new TransportException(TransportException.Type.IO, "Connection for " + attempt + " is closed");
        }

        private <T> CompletableFuture<T> onEventLoop(CompletableFuture<T> future) {
            return future.whenCompleteAsync((result, error) -> {
            }, eventLoop);
        }
    }
}
