package io.github.shangor.peer.transfer.core.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Assembles an incoming file in a temporary {@code .part} file using positional writes.
 */
public class TempFileAssemblyBuffer implements AssemblyBuffer {
    private static final Logger log = LoggerFactory.getLogger(TempFileAssemblyBuffer.class);

    private final Path tempFile;
    private final long size;
    private final Object writeLock = new Object();
    private final FileChannel channel;
    private volatile boolean closed = false;

    public TempFileAssemblyBuffer(Path directory, String prefix, long size) throws IOException {
        Files.createDirectories(directory);
        this.tempFile = Files.createTempFile(directory, prefix, ".part");
        this.size = size;
        this.channel = FileChannel.open(tempFile, StandardOpenOption.WRITE, StandardOpenOption.READ);
    }

    public Path path() {
        return tempFile;
    }

    @Override
    public long size() {
        return size;
    }

    @Override
    public void write(long offset, byte[] data) throws IOException {
        if (offset < 0 || offset + data.length > size) {
            throw new IOException("Write [" + offset + ", +" + data.length + ") outside file of " + size);
        }
        synchronized (writeLock) {
            if (closed) {
                throw new ClosedChannelException();
            }
            ByteBuffer buffer = ByteBuffer.wrap(data);
            long position = offset;
            while (buffer.hasRemaining()) {
                position += channel.write(buffer, position);
            }
        }
    }

    @Override
    public byte[] read(long offset, int length) throws IOException {
        synchronized (writeLock) {
            if (closed) {
                throw new ClosedChannelException();
            }
            int toRead = (int) Math.max(0, Math.min(length, size - offset));
            ByteBuffer buffer = ByteBuffer.allocate(toRead);
            long position = offset;
            while (buffer.hasRemaining()) {
                int read = channel.read(buffer, position);
                if (read < 0) {
                    // sparse tail that was never written reads as zeros
                    break;
                }
                position += read;
            }
            return buffer.array();
        }
    }

    @Override
    public InputStream openStream() throws IOException {
        synchronized (writeLock) {
            if (closed) {
                throw new ClosedChannelException();
            }
            channel.force(false);
        }
        return Files.newInputStream(tempFile);
    }

    @Override
    public void release() {
        synchronized (writeLock) {
            if (closed) {
                return;
            }
            closed = true;
        }
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("Failed to close assembly channel for {}", tempFile, e);
        }
        try {
            Files.deleteIfExists(tempFile);
        } catch (IOException e) {
            log.warn("Failed to delete temporary file {}", tempFile, e);
        }
    }

    @Override
    public boolean isReleased() {
        return closed;
    }
}
