package io.github.shangor.peer.transfer.core.io;

import java.io.Closeable;
import java.io.IOException;

/**
 * Read access to a local file being sent. Implementations only need to support positional
 * slice reads; the engine never reads the whole file at once.
 */
public interface FileSource extends Closeable {

    String name();

    long size();

    String mimeType();

    /**
     * Reads up to {@code length} bytes starting at {@code offset}. Fewer bytes are returned
     * only at the end of the file.
     */
    byte[] readSlice(long offset, int length) throws IOException;

    @Override
    default void close() throws IOException {
    }
}
