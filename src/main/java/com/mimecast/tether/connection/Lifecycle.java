package com.mimecast.tether.connection;

/**
 * Client lifecycle.
 *
 * <p>Scheduled reconnects only proceed while {@link #RUNNING}.
 */
public enum Lifecycle {
    RUNNING,
    STOPPING,
    STOPPED
}
