package com.mimecast.tether.connection;

/**
 * Local certificate bootstrap failure.
 *
 * <p>Credential directory, key generation or CSR loading problems.
 */
public class BootstrapException extends Exception {

    /**
     * Constructs a new BootstrapException instance.
     *
     * @param message Message.
     */
    public BootstrapException(String message) {
        super(message);
    }

    /**
     * Constructs a new BootstrapException instance.
     *
     * @param message Message.
     * @param cause   Cause.
     */
    public BootstrapException(String message, Throwable cause) {
        super(message, cause);
    }
}
