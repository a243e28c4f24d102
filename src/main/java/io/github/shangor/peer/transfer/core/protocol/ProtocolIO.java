package io.github.shangor.peer.transfer.core.protocol;

import io.github.shangor.peer.transfer.core.model.FileMetadata;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.BitSet;

public final class ProtocolIO {

    private static final int MAX_BITSET_BYTES = 1024;

    private ProtocolIO() {
    }

    public static void writeString(DataOutputStream out, String value) throws IOException {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        if (bytes.length > 0xFFFF) {
            throw new IOException("String too long");
        }
        out.writeShort(bytes.length);
        out.write(bytes);
    }

    public static String readString(DataInputStream in) throws IOException {
        int len = in.readUnsignedShort();
        byte[] bytes = in.readNBytes(len);
        if (bytes.length != len) {
            throw new EOFException("Truncated string");
        }
        return new String(bytes, StandardCharsets.UTF_8);
    }

    public static void writeNullableString(DataOutputStream out, String value) throws IOException {
        out.writeBoolean(value != null);
        if (value != null) {
            writeString(out, value);
        }
    }

    public static String readNullableString(DataInputStream in) throws IOException {
        return in.readBoolean() ? readString(in) : null;
    }

    public static void writeBitSet(DataOutputStream out, BitSet bits) throws IOException {
        byte[] bytes = bits == null ? new byte[0] : bits.toByteArray();
        out.writeShort(bytes.length);
        out.write(bytes);
    }

    public static BitSet readBitSet(DataInputStream in) throws IOException {
        int len = in.readUnsignedShort();
        if (len > MAX_BITSET_BYTES) {
            throw new ProtocolException("Chunk map too large: " + len + " bytes");
        }
        byte[] bytes = in.readNBytes(len);
        if (bytes.length != len) {
            throw new EOFException("Truncated chunk map");
        }
        return BitSet.valueOf(bytes);
    }

    public static void writeMetadata(DataOutputStream out, FileMetadata metadata) throws IOException {
        writeString(out, metadata.getId());
        writeString(out, metadata.getName());
        out.writeLong(metadata.getSize());
        writeString(out, metadata.getMimeType());
        writeNullableString(out, metadata.getChecksum());
        out.writeBoolean(metadata.isUseFec());
        out.writeDouble(metadata.getFecParityRatio());
        out.writeBoolean(metadata.isCompressed());
    }

    public static FileMetadata readMetadata(DataInputStream in) throws IOException {
        String id = readString(in);
        String name = readString(in);
        long size = in.readLong();
        String mimeType = readString(in);
        String checksum = readNullableString(in);
        boolean useFec = in.readBoolean();
        double ratio = in.readDouble();
        boolean compressed = in.readBoolean();
        try {
            return new FileMetadata(id, name, size, mimeType, checksum, useFec, ratio, compressed);
        } catch (IllegalArgumentException e) {
            throw new ProtocolException("Invalid file metadata for " + id, e);
        }
    }

    public static byte[] toByteArray(ProtocolMessage message) throws IOException {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(baos)) {
            out.writeByte(message.type().ordinal());
            message.write(out);
        }
        return baos.toByteArray();
    }

    public static ProtocolMessage fromByteArray(byte[] data) throws ProtocolException {
        if (data == null || data.length == 0) {
            throw new ProtocolException("Empty frame");
        }
        try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(data))) {
            int typeOrdinal = in.readUnsignedByte();
            ProtocolMessageType[] types = ProtocolMessageType.values();
            if (typeOrdinal >= types.length) {
                throw new ProtocolException("Unknown message kind: " + typeOrdinal);
            }
            ProtocolMessageType type = types[typeOrdinal];
            return switch (type) {
                case FILE_REQUEST -> FileRequestMessage.read(in);
                case FILE_ACCEPT -> FileAcceptMessage.read(in);
                case FILE_REJECT -> FileRejectMessage.read(in);
                case FILE_CHUNK -> FileChunkMessage.read(in);
                case FILE_COMPLETE -> FileCompleteMessage.read(in);
                case FILE_CANCEL -> FileCancelMessage.read(in);
            };
        } catch (ProtocolException e) {
            throw e;
        } catch (IOException e) {
            throw new ProtocolException("Malformed frame: " + e.getMessage(), e);
        }
    }
}
