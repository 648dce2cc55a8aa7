package com.mimecast.tether.transport;

/**
 * Wire frame.
 *
 * <p>Serialized as JSON <i>{type, stream, data}</i> behind a 4 byte length prefix.
 * <br>Stream 0 addresses the connection itself.
 *
 * @see FrameCodec
 */
public class Frame {

    /**
     * Frame types.
     */
    public enum Type {
        SETUP,
        KEEPALIVE,
        FIRE_AND_FORGET,
        REQUEST,
        RESPONSE,
        ERROR
    }

    private Type type;
    private int stream;
    private String data;

    /**
     * Constructs a new Frame instance.
     *
     * @param type   Type.
     * @param stream Stream id.
     * @param data   Payload.
     */
    public Frame(Type type, int stream, String data) {
        this.type = type;
        this.stream = stream;
        this.data = data;
    }

    public Type getType() {
        return type;
    }

    public int getStream() {
        return stream;
    }

    public String getData() {
        return data;
    }

    @Override
    public String toString() {
        return "Frame{type=" + type + ", stream=" + stream + "}";
    }
}
