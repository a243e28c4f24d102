package io.github.shangor.peer.transfer.core.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * {@link FileSource} backed by a file on the local file system.
 */
public class PathFileSource implements FileSource {
    private static final Logger log = LoggerFactory.getLogger(PathFileSource.class);

    private final Path path;
    private final long size;
    private final String mimeType;
    private FileChannel channel;
    private boolean closed = false;

    public PathFileSource(Path path) throws IOException {
        this.path = Objects.requireNonNull(path, "path");
        if (!Files.isRegularFile(path)) {
            throw new IOException("Not a regular file: " + path);
        }
        this.size = Files.size(path);
        this.mimeType = probeMimeType(path);
    }

    @Override
    public String name() {
        Path fileName = path.getFileName();
        return fileName == null ? path.toString() : fileName.toString();
    }

    @Override
    public long size() {
        return size;
    }

    @Override
    public String mimeType() {
        return mimeType;
    }

    public Path path() {
        return path;
    }

    @Override
    public synchronized byte[] readSlice(long offset, int length) throws IOException {
        if (closed) {
            throw new IOException("Source closed: " + path);
        }
        if (channel == null) {
            channel = FileChannel.open(path, StandardOpenOption.READ);
        }
        ByteBuffer buffer = ByteBuffer.allocate(length);
        long position = offset;
        while (buffer.hasRemaining()) {
            int read = channel.read(buffer, position);
            if (read <= 0) {
                break;
            }
            position += read;
        }
        byte[] out = new byte[buffer.position()];
        buffer.flip();
        buffer.get(out);
        return out;
    }

    @Override
    public synchronized void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        if (channel != null) {
            channel.close();
        }
    }

    private static String probeMimeType(Path path) {
        try {
            String probed = Files.probeContentType(path);
            if (probed != null) {
                return probed;
            }
        } catch (IOException e) {
            log.debug("Could not probe content type of {}", path, e);
        }
        return "application/octet-stream";
    }
}
