package io.github.shangor.peer.transfer.core.protocol;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.BitSet;

/**
 * One data or parity chunk on the wire.
 *
 * <p>For data chunks {@code index} is the global data-chunk index and {@code chunkMap} marks the
 * chunk's own slot inside its block. For parity chunks {@code index} is the block's first data
 * index and {@code chunkMap} lists the block-relative data slots the parity was computed over.
 * {@code totalChunks} is the sender's estimate at the time the chunk was produced; it is exact
 * when the chunk size does not change during the transfer.
 */
public record FileChunkMessage(String transferId,
                               int index,
                               int totalChunks,
                               byte[] payload,
                               boolean parity,
                               int parityIndex,
                               int totalParityChunks,
                               int blockIndex,
                               int blockStartIndex,
                               long blockOffset,
                               int blockSize,
                               int blockChunkSize,
                               BitSet chunkMap,
                               long crc32,
                               boolean compressed,
                               int originalLength) implements ProtocolMessage {

    /**
     * Upper bound for a single payload, matching the transport frame limit.
     */
    public static final int MAX_PAYLOAD_SIZE = 32 * 1024 * 1024;

    @Override
    public ProtocolMessageType type() {
        return ProtocolMessageType.FILE_CHUNK;
    }

    @Override
    public void write(DataOutputStream out) throws IOException {
        ProtocolIO.writeString(out, transferId);
        out.writeInt(index);
        out.writeInt(totalChunks);
        out.writeBoolean(parity);
        out.writeInt(parityIndex);
        out.writeInt(totalParityChunks);
        out.writeInt(blockIndex);
        out.writeInt(blockStartIndex);
        out.writeLong(blockOffset);
        out.writeInt(blockSize);
        out.writeInt(blockChunkSize);
        ProtocolIO.writeBitSet(out, chunkMap);
        out.writeLong(crc32);
        out.writeBoolean(compressed);
        out.writeInt(originalLength);
        out.writeInt(payload.length);
        out.write(payload);
    }

    public static FileChunkMessage read(DataInputStream in) throws IOException {
        String transferId = ProtocolIO.readString(in);
        int index = in.readInt();
        int totalChunks = in.readInt();
        boolean parity = in.readBoolean();
        int parityIndex = in.readInt();
        int totalParityChunks = in.readInt();
        int blockIndex = in.readInt();
        int blockStartIndex = in.readInt();
        long blockOffset = in.readLong();
        int blockSize = in.readInt();
        int blockChunkSize = in.readInt();
        BitSet chunkMap = ProtocolIO.readBitSet(in);
        long crc32 = in.readLong();
        boolean compressed = in.readBoolean();
        int originalLength = in.readInt();
        int len = in.readInt();
        if (len < 0 || len > MAX_PAYLOAD_SIZE) {
            throw new ProtocolException("Invalid chunk payload length: " + len);
        }
        byte[] payload = in.readNBytes(len);
        if (payload.length != len) {
            throw new ProtocolException("Truncated chunk payload: expected " + len + " bytes, got " + payload.length);
        }
        if (index < 0 || blockOffset < 0 || blockSize < 0 || blockChunkSize <= 0) {
            throw new ProtocolException("Invalid chunk layout for transfer " + transferId + " index " + index);
        }
        return new FileChunkMessage(transferId, index, totalChunks, payload, parity, parityIndex,
                totalParityChunks, blockIndex, blockStartIndex, blockOffset, blockSize, blockChunkSize, chunkMap,
                crc32, compressed, originalLength);
    }

    @Override
    public String toString() {
        return "FileChunkMessage{" +
                "transferId='" + transferId + '\'' +
                ", index=" + index +
                ", totalChunks=" + totalChunks +
                ", parity=" + parity +
                ", parityIndex=" + parityIndex +
                ", blockIndex=" + blockIndex +
                ", blockOffset=" + blockOffset +
                ", blockSize=" + blockSize +
                ", payloadLength=" + payload.length +
                ", compressed=" + compressed +
                '}';
    }
}
