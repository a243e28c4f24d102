package io.github.shangor.peer.transfer.core.protocol;

import io.github.shangor.peer.transfer.core.model.FileMetadata;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;

public record FileAcceptMessage(FileMetadata metadata) implements ProtocolMessage {
    @Override
    public ProtocolMessageType type() {
        return ProtocolMessageType.FILE_ACCEPT;
    }

    @Override
    public String transferId() {
        return metadata.getId();
    }

    @Override
    public void write(DataOutputStream out) throws IOException {
        ProtocolIO.writeMetadata(out, metadata);
    }

    public static FileAcceptMessage read(DataInputStream in) throws IOException {
        return new FileAcceptMessage(ProtocolIO.readMetadata(in));
    }
}
