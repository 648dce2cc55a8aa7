package com.mimecast.tether.connection;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import com.mimecast.tether.device.DeviceIdentity;
import com.mimecast.tether.state.StateTracker;
import com.mimecast.tether.state.Step;
import com.mimecast.tether.transport.ErrorResponseException;
import com.mimecast.tether.transport.TransportException;
import com.mimecast.tether.trust.CertificateRequestException;
import com.mimecast.tether.trust.CertificateRequestGenerator;
import com.mimecast.tether.trust.CredentialStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Certificate exchange over an unauthenticated connection.
 *
 * <p>Sequence:
 * <ol>
 *     <li>Connect insecurely with the device identity as setup payload.</li>
 *     <li>Ensure the credential directory exists.</li>
 *     <li>Generate a key pair and CSR into the credential directory.</li>
 *     <li>Send <i>signCertificate</i> with the CSR and the directory as destination.</li>
 * </ol>
 * <p>The desktop writes the signed certificate and its root certificate straight into the destination.
 * <br>File presence is what the next attempt relies on, the response only acknowledges.
 * <p>A desktop too old for request-response answers <i>not implemented</i>.
 * <br>The same payload is then resent as fire-and-forget and delivery is left unconfirmed.
 */
public class CertificateBootstrapProtocol {
    private static final Logger log = LogManager.getLogger(CertificateBootstrapProtocol.class);

    /**
     * Certificate signing method name.
     */
    public static final String SIGN_CERTIFICATE = "signCertificate";

    private static final Gson gson = new Gson();

    private final DeviceIdentity identity;
    private final CredentialStore store;
    private final CertificateRequestGenerator generator;
    private final StateTracker tracker;

    /**
     * Constructs a new CertificateBootstrapProtocol instance.
     *
     * @param identity  Device identity.
     * @param store     Credential store.
     * @param generator CSR generator.
     * @param tracker   Step tracker.
     */
    public CertificateBootstrapProtocol(DeviceIdentity identity, CredentialStore store,
                                        CertificateRequestGenerator generator, StateTracker tracker) {
        this.identity = identity;
        this.store = store;
        this.generator = generator;
        this.tracker = tracker;
    }

    /**
     * Runs the exchange.
     * <p>Local failures are thrown, the desktop's answer completes the returned future.
     *
     * @param channel BootstrapChannel instance.
     * @return Future of the exchange outcome.
     * @throws TransportException Unable to connect.
     * @throws BootstrapException Unable to prepare the request.
     */
    public CompletableFuture<BootstrapResult> exchange(BootstrapChannel channel) throws TransportException, BootstrapException {
        Step connecting = tracker.start("Connect insecurely");
        try {
            channel.open(gson.toJson(identity.toInsecureSetup()));
        } catch (TransportException e) {
            connecting.fail(e.getMessage());
            throw e;
        }
        connecting.complete();

        if (!store.ensureDirectory()) {
            throw new BootstrapException("Credential directory unavailable: " + store.getDirectory());
        }

        String payload = gson.toJson(signCertificateRequest(generateCsr()));
        return requestSignedCertificate(channel, payload);
    }

    /**
     * Builds the signing request message.
     *
     * @param csr CSR PEM string.
     * @return JsonObject instance.
     */
    JsonObject signCertificateRequest(String csr) {
        JsonObject message = new JsonObject();
        message.addProperty("method", SIGN_CERTIFICATE);
        message.addProperty("csr", csr);
        message.addProperty("destination", store.getDestination());
        return message;
    }

    private String generateCsr() throws BootstrapException {
        Step generating = tracker.start("Generate CSR");
        try {
            generator.generate(identity.getAppId(), store.getCsrFile(), store.getPrivateKeyFile());
        } catch (CertificateRequestException e) {
            generating.fail(e.getMessage());
            throw new BootstrapException("Unable to generate CSR", e);
        }
        generating.complete();

        Step loading = tracker.start("Load CSR");
        String csr = store.readString(CredentialStore.CSR_FILE_NAME);
        if (csr.isEmpty()) {
            loading.fail("Empty CSR");
            throw new BootstrapException("CSR missing after generation: " + store.getCsrFile());
        }
        loading.complete();
        return csr;
    }

    private CompletableFuture<BootstrapResult> requestSignedCertificate(BootstrapChannel channel, String payload) {
        CompletableFuture<BootstrapResult> result = new CompletableFuture<>();
        Step gettingCert = tracker.start("Getting cert from desktop");

        channel.requestResponse(payload).whenComplete((response, error) -> {
            if (error == null) {
                gettingCert.complete();
                log.info("Certificate exchange complete");
                result.complete(BootstrapResult.EXCHANGED);
                return;
            }

            Throwable cause = unwrap(error);
            if (isUnsupported(cause)) {
                gettingCert.fail(ErrorResponseException.NOT_IMPLEMENTED);
                sendLegacyCertificateRequest(channel, payload, result);
            } else if (cause instanceof ErrorResponseException) {
                log.error("Desktop failed to provide certificates. Error from desktop: {}", ((ErrorResponseException) cause).getPayload());
                gettingCert.fail(cause.getMessage());
                result.complete(BootstrapResult.REJECTED);
            } else {
                log.error("Error during certificate exchange: {}", cause.getMessage());
                gettingCert.fail(cause.getMessage());
                result.completeExceptionally(cause);
            }
        });

        return result;
    }

    /**
     * Desktop is using an old version.
     * <p>Falls back to fire-and-forget instead of request-response.
     */
    private void sendLegacyCertificateRequest(BootstrapChannel channel, String payload, CompletableFuture<BootstrapResult> result) {
        Step sending = tracker.start("Sending fallback certificate request");
        channel.fireAndForget(payload).whenComplete((ignored, error) -> {
            if (error == null) {
                sending.complete();
                log.info("Fallback certificate request sent");
                result.complete(BootstrapResult.LEGACY_REQUESTED);
            } else {
                Throwable cause = unwrap(error);
                sending.fail(cause.getMessage());
                result.completeExceptionally(cause);
            }
        });
    }

    /**
     * Is the error the desktop's unsupported method answer.
     *
     * @param error Throwable.
     * @return Boolean.
     */
    public static boolean isUnsupported(Throwable error) {
        return error instanceof ErrorResponseException && ((ErrorResponseException) error).isNotImplemented();
    }

    static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }
}
