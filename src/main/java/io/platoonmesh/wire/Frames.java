package io.platoonmesh.wire;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;

/**
 * Length-prefixed framing: a 4-byte big-endian length followed by the body.
 */
public final class Frames {
    private Frames() {
    }

    public static void write(DataOutputStream out, byte[] body) throws IOException {
        out.writeInt(body.length);
        out.write(body);
        out.flush();
    }

    /**
     * Reads one frame, or returns {@code null} on a clean end of stream between frames.
     */
    public static byte[] read(DataInputStream in, int maxFrameBytes) throws IOException {
        int length;
        try {
            length = in.readInt();
        } catch (EOFException e) {
            return null;
        }
        if (length < 0 || length > maxFrameBytes) {
            throw new MessageFormatException("Frame length out of bounds: " + length + ", max=" + maxFrameBytes);
        }
        byte[] body = new byte[length];
        in.readFully(body);
        return body;
    }
}
