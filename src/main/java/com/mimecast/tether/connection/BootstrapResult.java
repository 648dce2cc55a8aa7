package com.mimecast.tether.connection;

/**
 * Outcome of a certificate exchange.
 */
public enum BootstrapResult {

    /**
     * Desktop acknowledged the request and wrote the certificates.
     */
    EXCHANGED,

    /**
     * Request sent with the legacy fire-and-forget method, delivery unconfirmed.
     */
    LEGACY_REQUESTED,

    /**
     * Desktop answered with an error.
     */
    REJECTED
}
