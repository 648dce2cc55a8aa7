package com.mimecast.tether.transport;

/**
 * Error response to a request.
 *
 * <p>Carries the error payload sent by the desktop.
 */
public class ErrorResponseException extends Exception {

    /**
     * Error payload of a desktop that does not know the requested method.
     */
    public static final String NOT_IMPLEMENTED = "not implemented";

    private final String payload;

    /**
     * Constructs a new ErrorResponseException instance.
     *
     * @param payload Error payload.
     */
    public ErrorResponseException(String payload) {
        super("Error response: " + payload);
        this.payload = payload;
    }

    public String getPayload() {
        return payload;
    }

    /**
     * Is this the unsupported method response.
     * <p>Exact match, the payload is a wire contract constant.
     *
     * @return Boolean.
     */
    public boolean isNotImplemented() {
        return isNotImplemented(payload);
    }

    /**
     * Is payload the unsupported method response.
     *
     * @param payload Error payload.
     * @return Boolean.
     */
    public static boolean isNotImplemented(String payload) {
        return NOT_IMPLEMENTED.equals(payload);
    }
}
