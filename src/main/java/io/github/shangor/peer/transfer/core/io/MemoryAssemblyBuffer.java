package io.github.shangor.peer.transfer.core.io;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;

public class MemoryAssemblyBuffer implements AssemblyBuffer {
    private static final int MAX_SIZE = Integer.MAX_VALUE - 8;

    private final long size;
    private volatile byte[] data;

    public MemoryAssemblyBuffer(long size) {
        if (size < 0 || size > MAX_SIZE) {
            throw new IllegalArgumentException("Size not supported in memory: " + size);
        }
        this.size = size;
        this.data = new byte[(int) size];
    }

    @Override
    public long size() {
        return size;
    }

    @Override
    public synchronized void write(long offset, byte[] bytes) throws IOException {
        byte[] target = requireData();
        if (offset < 0 || offset + bytes.length > size) {
            throw new IOException("Write [" + offset + ", +" + bytes.length + ") outside buffer of " + size);
        }
        System.arraycopy(bytes, 0, target, (int) offset, bytes.length);
    }

    @Override
    public synchronized byte[] read(long offset, int length) throws IOException {
        byte[] source = requireData();
        if (offset < 0 || offset > size) {
            throw new IOException("Read offset " + offset + " outside buffer of " + size);
        }
        int end = (int) Math.min(size, offset + length);
        return Arrays.copyOfRange(source, (int) offset, end);
    }

    @Override
    public InputStream openStream() throws IOException {
        return new ByteArrayInputStream(requireData());
    }

    @Override
    public synchronized void release() {
        data = null;
    }

    @Override
    public boolean isReleased() {
        return data == null;
    }

    private byte[] requireData() throws IOException {
        byte[] current = data;
        if (current == null) {
            throw new IOException("Buffer released");
        }
        return current;
    }
}
