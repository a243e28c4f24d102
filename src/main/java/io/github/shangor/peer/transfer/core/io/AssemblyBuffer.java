package io.github.shangor.peer.transfer.core.io;

import java.io.IOException;
import java.io.InputStream;

/**
 * Random-access destination for the bytes of an incoming file.
 */
public interface AssemblyBuffer {

    long size();

    void write(long offset, byte[] data) throws IOException;

    byte[] read(long offset, int length) throws IOException;

    /**
     * Streams the assembled file from the start.
     */
    InputStream openStream() throws IOException;

    /**
     * Drops the buffered bytes. Further access fails.
     */
    void release();

    boolean isReleased();
}
