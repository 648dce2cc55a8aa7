package com.mimecast.tether.trust;

import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;

import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.file.Files;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.PrivateKey;
import java.security.SecureRandom;
import java.security.cert.Certificate;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.util.Collection;

/**
 * Builds the mutual TLS context from the stored credential set.
 *
 * <p>The key manager presents <i>device.crt</i> with <i>privateKey.pem</i>.
 * <br>The trust manager accepts only the root certificate delivered by the desktop.
 *
 * @see TrustManager
 */
public class SecurityContextFactory {

    private static final String KEY_ALIAS = "client";
    private static final char[] KEY_PASSWORD = "tether".toCharArray();
    private static final SecureRandom RANDOM = new SecureRandom();

    /**
     * Creates SSLContext for a trusted connection.
     *
     * @param store Credential store.
     * @return SSLContext instance.
     * @throws IOException              Unable to read a credential file.
     * @throws GeneralSecurityException Credentials are malformed or rejected by the JSSE provider.
     */
    public SSLContext create(CredentialStore store) throws IOException, GeneralSecurityException {
        TrustManager trustManager = new TrustManager(store.getRootCertificateFile());

        Collection<? extends Certificate> chain;
        try (InputStream is = Files.newInputStream(store.getClientCertificateFile())) {
            chain = CertificateFactory.getInstance("X.509").generateCertificates(is);
        }
        if (chain.isEmpty()) {
            throw new CertificateException("No client certificate found in " + store.getClientCertificateFile());
        }

        PrivateKey privateKey = readPrivateKey(store.readString(CredentialStore.PRIVATE_KEY_FILE_NAME));

        KeyStore keyStore = KeyStore.getInstance("PKCS12");
        keyStore.load(null, null);
        keyStore.setKeyEntry(KEY_ALIAS, privateKey, KEY_PASSWORD, chain.toArray(new Certificate[0]));

        KeyManagerFactory kmf = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
        kmf.init(keyStore, KEY_PASSWORD);

        SSLContext sslContext = SSLContext.getInstance("TLS");
        sslContext.init(kmf.getKeyManagers(), new javax.net.ssl.TrustManager[]{trustManager}, RANDOM);
        return sslContext;
    }

    /**
     * Reads PEM private key in PKCS#8 or traditional OpenSSL format.
     *
     * @param pem PEM string.
     * @return PrivateKey instance.
     * @throws IOException              Unable to parse PEM.
     * @throws GeneralSecurityException Unsupported key content.
     */
    static PrivateKey readPrivateKey(String pem) throws IOException, GeneralSecurityException {
        Object object;
        try (PEMParser parser = new PEMParser(new StringReader(pem))) {
            object = parser.readObject();
        }

        JcaPEMKeyConverter converter = new JcaPEMKeyConverter();
        if (object instanceof PEMKeyPair) {
            return converter.getKeyPair((PEMKeyPair) object).getPrivate();
        } else if (object instanceof PrivateKeyInfo) {
            return converter.getPrivateKey((PrivateKeyInfo) object);
        }

        throw new GeneralSecurityException("Unsupported private key content: " + (object == null ? "empty" : object.getClass().getSimpleName()));
    }
}
