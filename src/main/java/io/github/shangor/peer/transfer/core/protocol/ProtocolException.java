package io.github.shangor.peer.transfer.core.protocol;

import java.io.IOException;

/**
 * A frame that cannot be decoded into a {@link ProtocolMessage}.
 */
public class ProtocolException extends IOException {
    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
