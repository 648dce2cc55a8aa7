package com.mimecast.tether.connection;

import com.mimecast.tether.device.DeviceIdentity;

/**
 * One connection attempt.
 *
 * <p>The mode is decided once when the attempt starts and never changes.
 * <br>Transport events carry their attempt so events of earlier attempts can be told apart.
 */
public final class AttemptContext {

    private final long id;
    private final DeviceIdentity identity;
    private final AttemptMode mode;

    /**
     * Constructs a new AttemptContext instance.
     *
     * @param id       Attempt sequence number.
     * @param identity Device identity.
     * @param mode     Attempt mode.
     */
    public AttemptContext(long id, DeviceIdentity identity, AttemptMode mode) {
        this.id = id;
        this.identity = identity;
        this.mode = mode;
    }

    public long getId() {
        return id;
    }

    public DeviceIdentity getIdentity() {
        return identity;
    }

    public AttemptMode getMode() {
        return mode;
    }

    public boolean isBootstrap() {
        return mode == AttemptMode.BOOTSTRAP;
    }

    public boolean isTrusted() {
        return mode == AttemptMode.TRUSTED;
    }

    @Override
    public String toString() {
        return "Attempt#" + id + "[" + mode + "]";
    }
}
