package io.github.shangor.peer.transfer.core.protocol;

import io.github.shangor.peer.transfer.core.model.FileMetadata;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;

public record FileRejectMessage(FileMetadata metadata) implements ProtocolMessage {
    @Override
    public ProtocolMessageType type() {
        return ProtocolMessageType.FILE_REJECT;
    }

    @Override
    public String transferId() {
        return metadata.getId();
    }

    @Override
    public void write(DataOutputStream out) throws IOException {
        ProtocolIO.writeMetadata(out, metadata);
    }

    public static FileRejectMessage read(DataInputStream in) throws IOException {
        return new FileRejectMessage(ProtocolIO.readMetadata(in));
    }
}
