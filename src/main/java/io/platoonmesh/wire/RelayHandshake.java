package io.platoonmesh.wire;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;

/**
 * Greeting the relay writes on every accepted connection; it is never forwarded to other peers.
 */
public final class RelayHandshake {
    public static final int MAGIC = 0x504C544E; // "PLTN"
    public static final int PROTOCOL_VERSION = 1;

    private RelayHandshake() {
    }

    public static void writeGreeting(DataOutputStream out) throws IOException {
        out.writeInt(MAGIC);
        out.writeInt(PROTOCOL_VERSION);
        out.flush();
    }

    public static void readGreeting(DataInputStream in) throws IOException {
        int magic = in.readInt();
        if (magic != MAGIC) {
            throw new MessageFormatException("Unexpected relay greeting: 0x" + Integer.toHexString(magic));
        }
        int version = in.readInt();
        if (version != PROTOCOL_VERSION) {
            throw new MessageFormatException("Unsupported relay protocol version: " + version);
        }
    }
}
