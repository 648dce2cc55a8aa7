package com.mimecast.tether.trust;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509TrustManager;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.Certificate;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.util.Collection;

/**
 * X509TrustManager pinned to the desktop root of trust.
 *
 * <p>Only certificates issued by the root certificate delivered during bootstrap are accepted.
 * <br>The system trust store is never consulted.
 */
public class TrustManager implements X509TrustManager {
    private static final Logger log = LogManager.getLogger(TrustManager.class);

    private final X509TrustManager defaultTrustManager;

    /**
     * Constructs a new TrustManager instance from a PEM or DER root certificate file.
     *
     * @param rootCertificate Root certificate file.
     * @throws IOException              Unable to read file.
     * @throws GeneralSecurityException No certificate found or trust store initialization failed.
     */
    public TrustManager(Path rootCertificate) throws IOException, GeneralSecurityException {
        Collection<? extends Certificate> certificates;
        try (InputStream is = Files.newInputStream(rootCertificate)) {
            certificates = CertificateFactory.getInstance("X.509").generateCertificates(is);
        }
        if (certificates.isEmpty()) {
            throw new CertificateException("No certificate found in " + rootCertificate);
        }

        // Build an in memory trust store holding only the root of trust.
        KeyStore trustStore = KeyStore.getInstance(KeyStore.getDefaultType());
        trustStore.load(null, null);
        int index = 0;
        for (Certificate certificate : certificates) {
            trustStore.setCertificateEntry("root-" + index++, certificate);
        }

        TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
        tmf.init(trustStore);

        X509TrustManager x509Tm = null;
        for (javax.net.ssl.TrustManager tm : tmf.getTrustManagers()) {
            if (tm instanceof X509TrustManager) {
                x509Tm = (X509TrustManager) tm;
                break;
            }
        }
        if (x509Tm == null) {
            throw new GeneralSecurityException("No X509TrustManager found");
        }
        this.defaultTrustManager = x509Tm;
        log.debug("Loaded {} trusted root certificate(s) from {}", index, rootCertificate);
    }

    /**
     * Validates the client's certificate chain.
     *
     * @param chain    The certificate chain to validate.
     * @param authType The authentication type (e.g., "RSA").
     * @throws CertificateException If the certificate chain is not trusted.
     */
    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType) throws CertificateException {
        defaultTrustManager.checkClientTrusted(chain, authType);
    }

    /**
     * Validates the desktop's certificate chain against the pinned root.
     *
     * @param chain    The certificate chain to validate.
     * @param authType The authentication type (e.g., "RSA").
     * @throws CertificateException If the certificate chain is not trusted.
     */
    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType) throws CertificateException {
        try {
            defaultTrustManager.checkServerTrusted(chain, authType);
        } catch (CertificateException e) {
            log.warn("Desktop certificate rejected: {}", e.getMessage());
            throw e;
        }
    }

    /**
     * Returns the pinned root certificates.
     *
     * @return Array of X509Certificate representing the accepted issuers.
     */
    @Override
    public X509Certificate[] getAcceptedIssuers() {
        return defaultTrustManager.getAcceptedIssuers();
    }
}
