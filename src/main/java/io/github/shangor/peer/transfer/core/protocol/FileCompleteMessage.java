package io.github.shangor.peer.transfer.core.protocol;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;

/**
 * Sent once after the last chunk of a transfer; carries the sender's whole-file checksum.
 */
public record FileCompleteMessage(String transferId, String checksum) implements ProtocolMessage {
    @Override
    public ProtocolMessageType type() {
        return ProtocolMessageType.FILE_COMPLETE;
    }

    @Override
    public void write(DataOutputStream out) throws IOException {
        ProtocolIO.writeString(out, transferId);
        ProtocolIO.writeString(out, checksum);
    }

    public static FileCompleteMessage read(DataInputStream in) throws IOException {
        String transferId = ProtocolIO.readString(in);
        String checksum = ProtocolIO.readString(in);
        return new FileCompleteMessage(transferId, checksum);
    }
}
