package io.platoonmesh.client;

import java.io.IOException;

/**
 * The relay could not be reached or did not complete the handshake.
 */
public class ConnectionException extends IOException {
    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
