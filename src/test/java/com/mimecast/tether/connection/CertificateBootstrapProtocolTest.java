package com.mimecast.tether.connection;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.mimecast.tether.device.DeviceIdentity;
import com.mimecast.tether.state.StateTracker;
import com.mimecast.tether.state.Step;
import com.mimecast.tether.transport.ErrorResponseException;
import com.mimecast.tether.transport.TransportException;
import com.mimecast.tether.trust.CertificateRequestException;
import com.mimecast.tether.trust.CertificateRequestGenerator;
import com.mimecast.tether.trust.CredentialStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class CertificateBootstrapProtocolTest {

    private static final String CSR = "-----BEGIN CERTIFICATE REQUEST-----\nMIIB\n-----END CERTIFICATE REQUEST-----\n";

    @TempDir
    Path tempDir;

    private final DeviceIdentity identity = new DeviceIdentity("Android", "Pixel", "SN1", "Example", "com.example.app");
    private final StateTracker tracker = new StateTracker();
    private final FakeChannel channel = new FakeChannel();

    private CredentialStore store;
    private String csrContent = CSR;
    private CertificateRequestException generatorFailure;
    private final List<String> generatedFor = new ArrayList<>();

    private final CertificateRequestGenerator generator = (name, csrPath, keyPath) -> {
        if (generatorFailure != null) {
            throw generatorFailure;
        }
        generatedFor.add(name);
        try {
            Files.writeString(csrPath, csrContent);
            Files.writeString(keyPath, "key");
        } catch (IOException e) {
            throw new CertificateRequestException("write failed", e);
        }
    };

    private CertificateBootstrapProtocol protocol;

    @BeforeEach
    void setUp() {
        store = new CredentialStore(tempDir.toString(), "sonar");
        protocol = new CertificateBootstrapProtocol(identity, store, generator, tracker);
    }

    @Test
    void exchanged() throws Exception {
        channel.response = CompletableFuture.completedFuture("{}");

        BootstrapResult result = protocol.exchange(channel).get(5, TimeUnit.SECONDS);

        assertEquals(BootstrapResult.EXCHANGED, result);
        assertEquals(List.of("com.example.app"), generatedFor);
        assertTrue(Files.isDirectory(store.getDirectory()));

        JsonObject setup = JsonParser.parseString(channel.setupPayload).getAsJsonObject();
        assertEquals("Android", setup.get("os").getAsString());
        assertEquals("Pixel", setup.get("device").getAsString());
        assertEquals("Example", setup.get("app").getAsString());
        assertFalse(setup.has("device_id"));

        JsonObject request = JsonParser.parseString(channel.requests.get(0)).getAsJsonObject();
        assertEquals("signCertificate", request.get("method").getAsString());
        assertEquals(CSR, request.get("csr").getAsString());
        assertEquals(store.getDestination(), request.get("destination").getAsString());
        assertTrue(request.get("destination").getAsString().endsWith(File.separator));
        assertTrue(channel.messages.isEmpty());

        assertEquals(List.of("Connect insecurely", "Generate CSR", "Load CSR", "Getting cert from desktop"), stepNames());
        assertTrue(tracker.getLastFailure().isEmpty());
    }

    @Test
    void legacyFallback() throws Exception {
        channel.response = CompletableFuture.failedFuture(new ErrorResponseException("not implemented"));

        BootstrapResult result = protocol.exchange(channel).get(5, TimeUnit.SECONDS);

        assertEquals(BootstrapResult.LEGACY_REQUESTED, result);
        assertEquals(1, channel.messages.size());
        assertEquals(channel.requests.get(0), channel.messages.get(0));

        List<Step> steps = tracker.getSteps();
        Step last = steps.get(steps.size() - 1);
        assertEquals("Sending fallback certificate request", last.getName());
        assertEquals(Step.Status.COMPLETED, last.getStatus());
    }

    @Test
    void legacyFallbackSendFailure() {
        channel.response = CompletableFuture.failedFuture(new ErrorResponseException("not implemented"));
        channel.fireAndForgetResult = CompletableFuture.failedFuture(new TransportException(TransportException.Type.IO, "closed"));

        ExecutionException e = assertThrows(ExecutionException.class, () -> protocol.exchange(channel).get(5, TimeUnit.SECONDS));
        assertInstanceOf(TransportException.class, e.getCause());
    }

    @Test
    void rejected() throws Exception {
        channel.response = CompletableFuture.failedFuture(new ErrorResponseException("Failed to sign"));

        BootstrapResult result = protocol.exchange(channel).get(5, TimeUnit.SECONDS);

        assertEquals(BootstrapResult.REJECTED, result);
        assertTrue(channel.messages.isEmpty());
        assertEquals("Getting cert from desktop", tracker.getLastFailure().orElseThrow().getName());
    }

    @Test
    void sentinelIsExactMatch() throws Exception {
        channel.response = CompletableFuture.failedFuture(new ErrorResponseException("Not Implemented"));

        assertEquals(BootstrapResult.REJECTED, protocol.exchange(channel).get(5, TimeUnit.SECONDS));
        assertTrue(channel.messages.isEmpty());
    }

    @Test
    void requestTransportFailure() {
        channel.response = CompletableFuture.failedFuture(new CompletionException(new TransportException(TransportException.Type.IO, "reset")));

        ExecutionException e = assertThrows(ExecutionException.class, () -> protocol.exchange(channel).get(5, TimeUnit.SECONDS));
        assertInstanceOf(TransportException.class, e.getCause());
    }

    @Test
    void openFailurePropagates() {
        channel.openFailure = new TransportException(TransportException.Type.NOT_OPEN, "refused");

        TransportException e = assertThrows(TransportException.class, () -> protocol.exchange(channel));
        assertTrue(e.isNotOpen());
        assertEquals("Connect insecurely", tracker.getLastFailure().orElseThrow().getName());
        assertTrue(generatedFor.isEmpty());
    }

    @Test
    void generatorFailure() {
        generatorFailure = new CertificateRequestException("no entropy", new IllegalStateException());

        BootstrapException e = assertThrows(BootstrapException.class, () -> protocol.exchange(channel));
        assertSame(generatorFailure, e.getCause());
        assertTrue(channel.requests.isEmpty());
        assertEquals("Generate CSR", tracker.getLastFailure().orElseThrow().getName());
    }

    @Test
    void emptyCsr() {
        csrContent = "";

        assertThrows(BootstrapException.class, () -> protocol.exchange(channel));
        assertTrue(channel.requests.isEmpty());
        assertEquals("Load CSR", tracker.getLastFailure().orElseThrow().getName());
    }

    @Test
    void credentialPathIsFile() throws IOException {
        Files.writeString(store.getDirectory(), "file");

        assertThrows(BootstrapException.class, () -> protocol.exchange(channel));
        assertTrue(generatedFor.isEmpty());
    }

    @Test
    void isUnsupported() {
        assertTrue(CertificateBootstrapProtocol.isUnsupported(new ErrorResponseException("not implemented")));
        assertFalse(CertificateBootstrapProtocol.isUnsupported(new ErrorResponseException("not implemented yet")));
        assertFalse(CertificateBootstrapProtocol.isUnsupported(new IOException("not implemented")));
        assertFalse(CertificateBootstrapProtocol.isUnsupported(null));
    }

    @Test
    void unwrap() {
        ErrorResponseException cause = new ErrorResponseException("x");

        assertSame(cause, CertificateBootstrapProtocol.unwrap(new CompletionException(new CompletionException(cause))));
        assertSame(cause, CertificateBootstrapProtocol.unwrap(cause));
    }

    private List<String> stepNames() {
        return tracker.getSteps().stream().map(Step::getName).collect(Collectors.toList());
    }

    /**
     * Records what the protocol sends and answers with preset futures.
     */
    private static class FakeChannel implements BootstrapChannel {
        private String setupPayload;
        private TransportException openFailure;
        private CompletableFuture<String> response = new CompletableFuture<>();
        private CompletableFuture<Void> fireAndForgetResult = CompletableFuture.completedFuture(null);
        private final List<String> requests = new ArrayList<>();
        private final List<String> messages = new ArrayList<>();

        @Override
        public void open(String setupPayload) throws TransportException {
            if (openFailure != null) {
                throw openFailure;
            }
            this.setupPayload = setupPayload;
        }

        @Override
        public CompletableFuture<String> requestResponse(String payload) {
            requests.add(payload);
            return response;
        }

        @Override
        public CompletableFuture<Void> fireAndForget(String payload) {
            messages.add(payload);
            return fireAndForgetResult;
        }
    }
}
