package io.github.shangor.peer.transfer.core.protocol;

import io.github.shangor.peer.transfer.core.model.FileMetadata;
import io.github.shangor.peer.transfer.core.model.PeerInfo;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;

public record FileRequestMessage(FileMetadata metadata, PeerInfo from) implements ProtocolMessage {
    @Override
    public ProtocolMessageType type() {
        return ProtocolMessageType.FILE_REQUEST;
    }

    @Override
    public String transferId() {
        return metadata.getId();
    }

    @Override
    public void write(DataOutputStream out) throws IOException {
        ProtocolIO.writeMetadata(out, metadata);
        ProtocolIO.writeString(out, from.id());
        ProtocolIO.writeNullableString(out, from.name());
    }

    public static FileRequestMessage read(DataInputStream in) throws IOException {
        FileMetadata metadata = ProtocolIO.readMetadata(in);
        String fromId = ProtocolIO.readString(in);
        String fromName = ProtocolIO.readNullableString(in);
        return new FileRequestMessage(metadata, new PeerInfo(fromId, fromName));
    }
}
