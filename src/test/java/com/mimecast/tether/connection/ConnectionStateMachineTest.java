package com.mimecast.tether.connection;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.mimecast.tether.config.ClientConfig;
import com.mimecast.tether.device.DeviceIdentity;
import com.mimecast.tether.metrics.ConnectionMetrics;
import com.mimecast.tether.state.Step;
import com.mimecast.tether.transport.ErrorResponseException;
import com.mimecast.tether.transport.SetupParameters;
import com.mimecast.tether.trust.BouncyCastleRequestGenerator;
import com.mimecast.tether.trust.CredentialStore;
import com.mimecast.tether.trust.TestCertificateAuthority;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ConnectionStateMachineTest {

    private static final int SECURE_PORT = 8088;
    private static final int INSECURE_PORT = 8089;
    private static final long TIMEOUT = 10_000L;

    private static TestCertificateAuthority ca;

    @TempDir
    Path tempDir;

    @Mock
    private ConnectionHandler connectionHandler;

    @Mock
    private MessageHandler messageHandler;

    private AutoCloseable closeable;
    private final Map<String, Object> settings = new HashMap<>();
    private TransportMock transport;
    private SimpleMeterRegistry registry;
    private ConnectionStateMachine machine;
    private CredentialStore store;

    private final DeviceIdentity identity = new DeviceIdentity("Android", "Pixel", "SN1", "Example", "com.example.app");

    @BeforeAll
    static void before() throws Exception {
        ca = new TestCertificateAuthority("Desktop CA");
    }

    @BeforeEach
    void setUp() {
        closeable = MockitoAnnotations.openMocks(this);

        settings.put("privateAppDirectory", tempDir.toString());
        settings.put("reconnectIntervalMillis", 50);
        settings.put("securePort", SECURE_PORT);
        settings.put("insecurePort", INSECURE_PORT);

        transport = new TransportMock();
        registry = new SimpleMeterRegistry();
        createMachine();
    }

    private void createMachine() {
        machine = new ConnectionStateMachine(new ClientConfig(settings), identity, transport,
                new BouncyCastleRequestGenerator(), new ConnectionMetrics(registry));
        machine.setConnectionHandler(connectionHandler);
        machine.setMessageHandler(messageHandler);
        store = machine.getCredentialStore();
    }

    @AfterEach
    void tearDown() throws Exception {
        machine.close();
        transport.close();
        closeable.close();
    }

    /**
     * Desktop that signs every CSR it is sent.
     */
    private CompletableFuture<String> signing(JsonObject request) {
        try {
            assertEquals("signCertificate", request.get("method").getAsString());
            assertEquals(store.getDestination(), request.get("destination").getAsString());
            ca.deliver(request.get("csr").getAsString(), store);
            return CompletableFuture.completedFuture("{}");
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Credentials from an earlier exchange.
     */
    private void provision() throws Exception {
        assertTrue(store.ensureDirectory());
        new BouncyCastleRequestGenerator().generate(identity.getAppId(), store.getCsrFile(), store.getPrivateKeyFile());
        ca.deliver(store.readString(CredentialStore.CSR_FILE_NAME), store);
        assertTrue(store.isUsable());
    }

    private static void await(BooleanSupplier condition, String description) throws InterruptedException {
        long deadline = System.currentTimeMillis() + TIMEOUT;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Timed out waiting for: " + description);
            }
            Thread.sleep(10);
        }
    }

    private void assertTrustedImpliesOpen() {
        ConnectionState state = machine.getState();
        assertTrue(!state.isTrusted() || state.isOpen(), "Trusted without open transport: " + state);
    }

    @Test
    void freshInstallBootstrapsSilently() throws Exception {
        // Desktop never answers.
        machine.start();

        await(() -> !transport.getConnections().isEmpty() && !transport.lastConnection().getRequests().isEmpty(), "certificate request");

        SetupParameters setup = transport.getConnects().get(0);
        assertEquals(INSECURE_PORT, setup.getPort());
        assertNull(setup.getSslContext());
        JsonObject payload = JsonParser.parseString(setup.getPayload()).getAsJsonObject();
        assertEquals("Android", payload.get("os").getAsString());
        assertEquals("Pixel", payload.get("device").getAsString());
        assertEquals("Example", payload.get("app").getAsString());
        assertFalse(payload.has("device_id"));

        JsonObject request = JsonParser.parseString(transport.lastConnection().getRequests().get(0)).getAsJsonObject();
        assertEquals("signCertificate", request.get("method").getAsString());
        assertTrue(request.get("csr").getAsString().contains("CERTIFICATE REQUEST"));
        assertTrue(request.get("destination").getAsString().endsWith(File.separator));

        Thread.sleep(100);
        verify(connectionHandler, never()).onConnected();
        assertFalse(machine.isConnected());
        assertTrue(machine.getState().isOpen());
        assertFalse(machine.getState().isTrusted());
        assertEquals(AttemptMode.BOOTSTRAP, machine.getState().getAttempt().getMode());
    }

    @Test
    void exchangeThenTrustedConnection() throws Exception {
        transport.setRequestHandler(this::signing);

        machine.start();
        await(machine::isConnected, "trusted connection");

        assertEquals(2, transport.getConnects().size());
        assertEquals(INSECURE_PORT, transport.getConnects().get(0).getPort());

        SetupParameters secure = transport.getConnects().get(1);
        assertEquals(SECURE_PORT, secure.getPort());
        assertNotNull(secure.getSslContext());
        JsonObject payload = JsonParser.parseString(secure.getPayload()).getAsJsonObject();
        assertEquals("SN1", payload.get("device_id").getAsString());

        // Bootstrap connection released before the trusted attempt.
        assertFalse(transport.getConnections().get(0).isOpen());
        assertTrue(transport.getConnections().get(1).isOpen());

        verify(connectionHandler, timeout(TIMEOUT).times(1)).onConnected();
        verify(connectionHandler, never()).onDisconnected();
        assertEquals(0, machine.getState().getConsecutiveFailures());
        assertTrustedImpliesOpen();

        assertEquals(1.0, registry.get("tether.connection.connected").counter().count());
        assertEquals(1.0, registry.get("tether.bootstrap.exchanges").tag("outcome", "exchanged").counter().count());
    }

    @Test
    void allTransportCallsOnConnectionThread() throws Exception {
        transport.setRequestHandler(this::signing);

        machine.start();
        await(machine::isConnected, "trusted connection");

        assertFalse(transport.getConnectThreads().isEmpty());
        transport.getConnectThreads().forEach(name -> assertEquals("tether-connection", name));
    }

    @Test
    void legacyDesktopGetsFireAndForgetResend() throws Exception {
        transport.setRequestHandler(request -> CompletableFuture.failedFuture(new ErrorResponseException("not implemented")));

        machine.start();
        await(() -> transport.connectCount(INSECURE_PORT) >= 2, "second bootstrap");

        TransportMock.MockConnection first = transport.getConnections().get(0);
        assertEquals(1, first.getRequests().size());
        assertEquals(1, first.getMessages().size());
        assertEquals(first.getRequests().get(0), first.getMessages().get(0));
        assertFalse(first.isOpen());

        // Unsupported request is not a failure.
        assertEquals(0, machine.getState().getConsecutiveFailures());
        assertEquals(0, transport.connectCount(SECURE_PORT));
        assertTrue(machine.getStateTracker().getSteps().stream()
                .anyMatch(s -> s.getName().equals("Sending fallback certificate request") && s.getStatus() == Step.Status.COMPLETED));
        verify(connectionHandler, never()).onConnected();
    }

    @Test
    void legacyDesktopDeliversAsynchronously() throws Exception {
        transport.setRequestHandler(request -> CompletableFuture.failedFuture(new ErrorResponseException("not implemented")));
        transport.setFireAndForgetHandler(this::signing);

        machine.start();
        await(machine::isConnected, "trusted connection");

        // Delivery is unconfirmed so a retry may bootstrap again before the files land.
        assertTrue(transport.connectCount(INSECURE_PORT) >= 1);
        assertEquals(1, transport.connectCount(SECURE_PORT));
        verify(connectionHandler, timeout(TIMEOUT)).onConnected();
    }

    @Test
    void rejectedRequestIsCounted() throws Exception {
        transport.setRequestHandler(request -> CompletableFuture.failedFuture(new ErrorResponseException("Unable to sign")));

        machine.start();
        await(() -> machine.getState().getConsecutiveFailures() >= 1, "counted failure");

        assertFalse(transport.getConnections().get(0).isOpen());
        assertEquals(0, transport.connectCount(SECURE_PORT));
    }

    @Test
    void unansweredCertificateRequestIsCounted() throws Exception {
        machine.close();
        settings.put("requestTimeoutMillis", 200);
        createMachine();

        // Desktop keeps the insecure connection open but never answers.
        machine.start();
        await(() -> machine.getState().getConsecutiveFailures() >= 1, "counted failure");
        await(() -> transport.connectCount(INSECURE_PORT) >= 2, "retry after timeout");

        assertFalse(transport.getConnections().get(0).isOpen());
        assertTrue(machine.getStateTracker().getSteps().stream()
                .anyMatch(step -> step.getName().equals("Getting cert from desktop") && step.getStatus() == Step.Status.FAILED));
        assertEquals(0, transport.connectCount(SECURE_PORT));
        verify(connectionHandler, never()).onConnected();
    }

    @Test
    void desktopNotRunningIsNotCounted() throws Exception {
        provision();
        transport.setBehaviour(SECURE_PORT, TransportMock.Behaviour.REFUSE);

        machine.start();
        await(() -> transport.connectCount(SECURE_PORT) >= 4, "repeated attempts");

        assertEquals(0, machine.getState().getConsecutiveFailures());
        assertEquals(0, transport.connectCount(INSECURE_PORT));
        assertFalse(machine.isConnected());
        assertTrue(machine.getStateTracker().getSteps().stream()
                .anyMatch(step -> step.getName().equals("Connect to desktop") && "Port not open".equals(step.getReason())));
    }

    @Test
    void repeatedTrustedFailuresBootstrapAgain() throws Exception {
        provision();
        transport.setBehaviour(SECURE_PORT, TransportMock.Behaviour.TLS_FAILURE);

        machine.start();
        await(() -> transport.connectCount(INSECURE_PORT) >= 1, "bootstrap");

        assertEquals(2, transport.connectCount(SECURE_PORT));
        assertEquals(INSECURE_PORT, transport.getConnects().get(2).getPort());
        assertEquals(2, machine.getState().getConsecutiveFailures());
        assertEquals(AttemptMode.BOOTSTRAP, machine.getState().getAttempt().getMode());
    }

    @Test
    void bootstrapAfterFailuresHeals() throws Exception {
        provision();
        transport.setBehaviour(SECURE_PORT, TransportMock.Behaviour.TLS_FAILURE);
        transport.setRequestHandler(request -> {
            transport.setBehaviour(SECURE_PORT, TransportMock.Behaviour.ACCEPT);
            return signing(request);
        });

        machine.start();
        await(machine::isConnected, "trusted connection");

        assertEquals(3, transport.connectCount(SECURE_PORT));
        assertEquals(1, transport.connectCount(INSECURE_PORT));
        assertEquals(0, machine.getState().getConsecutiveFailures());
    }

    @Test
    void failuresAfterExchangeTryTrustedFirst() throws Exception {
        provision();
        transport.setBehaviour(SECURE_PORT, TransportMock.Behaviour.TLS_FAILURE);
        transport.setRequestHandler(this::signing);

        machine.start();
        await(() -> transport.connectCount(INSECURE_PORT) >= 2, "second bootstrap");

        // Two failures, exchange, two more failures, exchange.
        assertEquals(4, transport.connectCount(SECURE_PORT));
        assertEquals(4, machine.getState().getConsecutiveFailures());
    }

    @Test
    void stopDuringReconnectDelay() throws Exception {
        provision();
        transport.setBehaviour(SECURE_PORT, TransportMock.Behaviour.REFUSE);

        machine.start();
        await(() -> transport.connectCount(SECURE_PORT) >= 1, "first attempt");

        machine.stop();
        await(() -> machine.getLifecycle() == Lifecycle.STOPPED, "stopped");
        int connects = transport.getConnects().size();

        Thread.sleep(300);
        assertEquals(connects, transport.getConnects().size());
        assertFalse(machine.isConnected());
    }

    @Test
    void stopWhileConnected() throws Exception {
        provision();

        machine.start();
        await(machine::isConnected, "trusted connection");

        machine.stop();
        await(() -> machine.getLifecycle() == Lifecycle.STOPPED, "stopped");

        assertFalse(machine.isConnected());
        assertFalse(machine.getState().isOpen());
        assertFalse(transport.lastConnection().isOpen());
        verify(connectionHandler, timeout(TIMEOUT).times(1)).onDisconnected();

        Thread.sleep(200);
        assertEquals(1, transport.getConnects().size());
    }

    @Test
    void restartAfterStop() throws Exception {
        provision();

        machine.start();
        await(machine::isConnected, "trusted connection");
        machine.stop();
        await(() -> machine.getLifecycle() == Lifecycle.STOPPED, "stopped");

        machine.start();
        await(machine::isConnected, "second trusted connection");
        assertEquals(2, transport.getConnects().size());
        verify(connectionHandler, timeout(TIMEOUT).times(2)).onConnected();
    }

    @Test
    void startWhileConnectedIsIgnored() throws Exception {
        provision();

        machine.start();
        await(machine::isConnected, "trusted connection");

        machine.start();
        machine.start();
        Thread.sleep(200);

        assertEquals(1, transport.getConnects().size());
        verify(connectionHandler, times(1)).onConnected();
    }

    @Test
    void peerDisconnectReconnects() throws Exception {
        provision();

        machine.start();
        await(machine::isConnected, "trusted connection");
        TransportMock.MockConnection first = transport.lastConnection();

        first.drop();
        await(() -> transport.getConnects().size() == 2 && machine.isConnected(), "reconnect");

        verify(connectionHandler, timeout(TIMEOUT).times(1)).onDisconnected();
        verify(connectionHandler, timeout(TIMEOUT).times(2)).onConnected();
        assertEquals(0, machine.getState().getConsecutiveFailures());
    }

    @Test
    void staleDisconnectIsIgnored() throws Exception {
        provision();

        machine.start();
        await(machine::isConnected, "trusted connection");
        TransportMock.MockConnection first = transport.lastConnection();
        first.drop();
        await(() -> transport.getConnects().size() == 2 && machine.isConnected(), "reconnect");

        first.replayDisconnect();
        first.replayDisconnect();
        Thread.sleep(200);

        assertTrue(machine.isConnected());
        assertTrue(transport.lastConnection().isOpen());
        verify(connectionHandler, times(1)).onDisconnected();
        assertEquals(0, machine.getState().getConsecutiveFailures());
        assertEquals(2, transport.getConnects().size());
    }

    @Test
    void attemptOffConnectionThreadAborts() throws Exception {
        provision();

        machine.attempt();

        assertTrue(transport.getConnects().isEmpty());
        assertNull(machine.getState().getAttempt());
    }

    @Test
    void sendMessageDroppedWhileBootstrapping() throws Exception {
        machine.start();
        await(() -> !transport.getConnections().isEmpty() && !transport.lastConnection().getRequests().isEmpty(), "certificate request");

        JsonObject message = new JsonObject();
        message.addProperty("event", "ping");
        machine.sendMessage(message);
        Thread.sleep(100);

        assertTrue(transport.lastConnection().getMessages().isEmpty());
    }

    @Test
    void sendMessageWhenConnected() throws Exception {
        provision();
        machine.start();
        await(machine::isConnected, "trusted connection");

        JsonObject message = new JsonObject();
        message.addProperty("event", "ping");
        machine.sendMessage(message);

        await(() -> !transport.lastConnection().getMessages().isEmpty(), "message sent");
        assertEquals("{\"event\":\"ping\"}", transport.lastConnection().getMessages().get(0));
    }

    @Test
    void sendMessageWhileStoppedIsDropped() {
        JsonObject message = new JsonObject();
        message.addProperty("event", "ping");

        assertDoesNotThrow(() -> machine.sendMessage(message));
        assertTrue(transport.getConnections().isEmpty());
    }

    @Test
    void inboundMessages() throws Exception {
        provision();
        machine.start();
        await(machine::isConnected, "trusted connection");

        transport.lastConnection().deliver("not json {");
        transport.lastConnection().deliver("[1, 2]");
        transport.lastConnection().deliver("{\"event\":\"sync\",\"count\":2}");

        JsonObject expected = new JsonObject();
        expected.addProperty("event", "sync");
        expected.addProperty("count", 2);
        verify(messageHandler, timeout(TIMEOUT)).onMessageReceived(expected);
        verify(messageHandler, times(1)).onMessageReceived(any());
    }

    @Test
    void failingHandlerDoesNotBreakConnection() throws Exception {
        provision();
        doThrow(new IllegalStateException("application bug")).when(connectionHandler).onConnected();

        machine.start();
        await(machine::isConnected, "trusted connection");

        Thread.sleep(100);
        assertTrue(machine.isConnected());
        assertEquals(1, transport.getConnects().size());
    }

    @Test
    void corruptCredentialsAreCounted() throws Exception {
        provision();
        Files.writeString(store.getRootCertificateFile(), "garbage");
        transport.setRequestHandler(this::signing);

        machine.start();
        await(machine::isConnected, "trusted connection after re-exchange");

        // Security context failures never reach the secure port.
        assertEquals(1, transport.connectCount(SECURE_PORT));
        assertEquals(1, transport.connectCount(INSECURE_PORT));
        assertEquals(0, machine.getState().getConsecutiveFailures());
    }

    @Test
    void closeShutsDownConnectionThread() throws Exception {
        provision();
        machine.start();
        await(machine::isConnected, "trusted connection");

        machine.close();

        assertTrue(machine.getEventLoop().isShutdown());
        assertFalse(machine.isConnected());
        assertEquals(Lifecycle.STOPPED, machine.getLifecycle());
    }
}
