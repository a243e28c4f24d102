package io.github.shangor.peer.transfer.core.io;

import io.github.shangor.peer.transfer.core.util.PathUtil;

import java.io.IOException;
import java.nio.file.Path;

public final class AssemblyBuffers {

    private AssemblyBuffers() {
    }

    /**
     * Memory for files up to {@code memoryThreshold} bytes, a temporary file in
     * {@code tempDir} otherwise.
     */
    public static AssemblyBuffer create(String transferId, long size, long memoryThreshold, Path tempDir)
            throws IOException {
        if (size <= memoryThreshold) {
            return new MemoryAssemblyBuffer(size);
        }
        return new TempFileAssemblyBuffer(tempDir, "transfer-" + PathUtil.sanitizeFileName(transferId) + "-", size);
    }
}
