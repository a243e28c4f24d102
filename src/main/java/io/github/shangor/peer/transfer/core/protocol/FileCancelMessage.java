package io.github.shangor.peer.transfer.core.protocol;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;

public record FileCancelMessage(String transferId) implements ProtocolMessage {
    @Override
    public ProtocolMessageType type() {
        return ProtocolMessageType.FILE_CANCEL;
    }

    @Override
    public void write(DataOutputStream out) throws IOException {
        ProtocolIO.writeString(out, transferId);
    }

    public static FileCancelMessage read(DataInputStream in) throws IOException {
        return new FileCancelMessage(ProtocolIO.readString(in));
    }
}
