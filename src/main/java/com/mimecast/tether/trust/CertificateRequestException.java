package com.mimecast.tether.trust;

/**
 * Key pair or certificate signing request generation failure.
 */
public class CertificateRequestException extends Exception {

    /**
     * Constructs a new CertificateRequestException instance.
     *
     * @param message Message.
     * @param cause   Cause.
     */
    public CertificateRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
