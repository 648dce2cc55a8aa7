package com.mimecast.tether.transport;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Length prefixed JSON frame codec.
 */
public final class FrameCodec {

    /**
     * Largest accepted frame body.
     */
    public static final int MAX_FRAME_SIZE = 16 * 1024 * 1024;

    private static final Gson gson = new Gson();

    /**
     * Private constructor for utility class.
     */
    private FrameCodec() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Writes frame.
     * <p>Does not flush.
     *
     * @param out   DataOutputStream instance.
     * @param frame Frame instance.
     * @throws IOException Unable to write.
     */
    public static void write(DataOutputStream out, Frame frame) throws IOException {
        byte[] body = gson.toJson(frame).getBytes(StandardCharsets.UTF_8);
        if (body.length > MAX_FRAME_SIZE) {
            throw new IOException("Frame too large: " + body.length);
        }
        out.writeInt(body.length);
        out.write(body);
    }

    /**
     * Reads frame.
     * <p>Blocks until a full frame is available.
     *
     * @param in DataInputStream instance.
     * @return Frame instance.
     * @throws IOException Unable to read, end of stream or malformed frame.
     */
    public static Frame read(DataInputStream in) throws IOException {
        int length = in.readInt();
        if (length <= 0 || length > MAX_FRAME_SIZE) {
            throw new IOException("Invalid frame length: " + length);
        }

        byte[] body = new byte[length];
        in.readFully(body);

        Frame frame;
        try {
            frame = gson.fromJson(new String(body, StandardCharsets.UTF_8), Frame.class);
        } catch (JsonParseException e) {
            throw new IOException("Malformed frame: " + e.getMessage(), e);
        }
        if (frame == null || frame.getType() == null) {
            throw new IOException("Frame without type");
        }
        return frame;
    }
}
