package io.github.shangor.peer.transfer.core.io;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Hands slice reads of a {@link FileSource} to a background worker. Each request is answered
 * with a future that completes with the slice or with the read error.
 */
public class SliceReader {
    private final FileSource source;
    private final Executor worker;

    public SliceReader(FileSource source, Executor worker) {
        this.source = Objects.requireNonNull(source, "source");
        this.worker = Objects.requireNonNull(worker, "worker");
    }

    public CompletableFuture<byte[]> read(long offset, int length) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return source.readSlice(offset, length);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read " + source.name() + " at " + offset, e);
            }
        }, worker);
    }

    public FileSource source() {
        return source;
    }
}
