package io.github.shangor.peer.transfer.core.protocol;

import java.io.DataOutputStream;
import java.io.IOException;

public interface ProtocolMessage {
    ProtocolMessageType type();

    /**
     * Id of the transfer this message belongs to.
     */
    String transferId();

    void write(DataOutputStream out) throws IOException;
}
