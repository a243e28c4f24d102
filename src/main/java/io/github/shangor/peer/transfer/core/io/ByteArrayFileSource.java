package io.github.shangor.peer.transfer.core.io;

import java.io.IOException;
import java.util.Arrays;
import java.util.Objects;

public class ByteArrayFileSource implements FileSource {
    private final String name;
    private final String mimeType;
    private final byte[] data;

    public ByteArrayFileSource(String name, String mimeType, byte[] data) {
        this.name = Objects.requireNonNull(name, "name");
        this.mimeType = mimeType == null ? "application/octet-stream" : mimeType;
        this.data = Objects.requireNonNull(data, "data");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public long size() {
        return data.length;
    }

    @Override
    public String mimeType() {
        return mimeType;
    }

    @Override
    public byte[] readSlice(long offset, int length) throws IOException {
        if (offset < 0 || length < 0) {
            throw new IOException("Invalid slice [" + offset + ", +" + length + ")");
        }
        if (offset >= data.length) {
            return new byte[0];
        }
        int end = (int) Math.min(data.length, offset + length);
        return Arrays.copyOfRange(data, (int) offset, end);
    }
}
