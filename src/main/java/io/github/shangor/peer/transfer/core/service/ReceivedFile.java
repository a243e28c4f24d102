package io.github.shangor.peer.transfer.core.service;

import io.github.shangor.peer.transfer.core.io.AssemblyBuffer;
import io.github.shangor.peer.transfer.core.model.FileMetadata;
import io.github.shangor.peer.transfer.core.model.TransferStatus;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Read-only view of an assembled incoming file. A file with status {@code INTEGRITY_ERROR} is
 * exposed for inspection only; its content does not match the sender's checksum.
 * The view stops working once the transfer is cleared.
 */
public final class ReceivedFile {
    private final FileMetadata metadata;
    private final TransferStatus status;
    private final String checksum;
    private final AssemblyBuffer buffer;

    ReceivedFile(FileMetadata metadata, TransferStatus status, String checksum, AssemblyBuffer buffer) {
        this.metadata = metadata;
        this.status = status;
        this.checksum = checksum;
        this.buffer = buffer;
    }

    public FileMetadata getMetadata() {
        return metadata;
    }

    public TransferStatus getStatus() {
        return status;
    }

    public boolean isVerified() {
        return status == TransferStatus.COMPLETED;
    }

    /**
     * Checksum computed over the assembled bytes.
     */
    public String getChecksum() {
        return checksum;
    }

    public long size() {
        return buffer.size();
    }

    public InputStream openStream() throws IOException {
        return buffer.openStream();
    }

    public byte[] readAllBytes() throws IOException {
        try (InputStream in = buffer.openStream()) {
            return in.readAllBytes();
        }
    }

    public Path saveTo(Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (InputStream in = buffer.openStream()) {
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        }
        return target;
    }
}
