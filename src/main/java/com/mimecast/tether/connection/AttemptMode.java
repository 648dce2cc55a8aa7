package com.mimecast.tether.connection;

/**
 * Connection attempt mode.
 */
public enum AttemptMode {

    /**
     * Unauthenticated connection used only to obtain a signed client certificate.
     */
    BOOTSTRAP,

    /**
     * Mutually authenticated connection.
     */
    TRUSTED
}
