package com.mimecast.tether.trust;

import java.nio.file.Path;

/**
 * Generates a fresh key pair and a certificate signing request for it.
 */
public interface CertificateRequestGenerator {

    /**
     * Generates key pair and CSR and writes both as PEM.
     *
     * @param identity Subject common name.
     * @param csrPath  CSR output file.
     * @param keyPath  Private key output file.
     * @throws CertificateRequestException Unable to generate or write.
     */
    void generate(String identity, Path csrPath, Path keyPath) throws CertificateRequestException;
}
