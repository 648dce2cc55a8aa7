package com.mimecast.tether.transport;

import javax.net.ssl.SSLException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.PortUnreachableException;
import java.net.SocketTimeoutException;

/**
 * Transport failure.
 *
 * <p>The type distinguishes a desktop that is simply not listening from real faults.
 */
public class TransportException extends IOException {

    /**
     * Failure classification.
     */
    public enum Type {
        /**
         * Connection refused or peer unreachable.
         */
        NOT_OPEN,

        /**
         * Connect or handshake timed out.
         */
        TIMED_OUT,

        /**
         * TLS negotiation failed.
         */
        TLS,

        /**
         * Any other I/O failure.
         */
        IO
    }

    private final Type type;

    /**
     * Constructs a new TransportException instance.
     *
     * @param type    Type.
     * @param message Message.
     */
    public TransportException(Type type, String message) {
        super(message);
        this.type = type;
    }

    /**
     * Constructs a new TransportException instance.
     *
     * @param type    Type.
     * @param message Message.
     * @param cause   Cause.
     */
    public TransportException(Type type, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
    }

    /**
     * Classifies a connect failure.
     *
     * @param e       IOException instance.
     * @param address Address description.
     * @return TransportException instance.
     */
    public static TransportException classify(IOException e, String address) {
        if (e instanceof TransportException) {
            return (TransportException) e;
        }

        Type type = Type.IO;
        if (e instanceof ConnectException || e instanceof NoRouteToHostException || e instanceof PortUnreachableException) {
            type = Type.NOT_OPEN;
        } else if (e instanceof SocketTimeoutException) {
            type = Type.TIMED_OUT;
        } else if (e instanceof SSLException) {
            type = Type.TLS;
        }

        return new TransportException(type, address + ": " + e.getMessage(), e);
    }

    public Type getType() {
        return type;
    }

    /**
     * Is this the expected failure of a desktop that is not running.
     *
     * @return Boolean.
     */
    public boolean isNotOpen() {
        return type == Type.NOT_OPEN;
    }
}
