package io.github.shangor.peer.transfer.core.codec;

import java.util.BitSet;

/**
 * Layout of one block: a run of consecutive data chunks of {@code chunkSize} bytes (the last
 * one may be shorter) sharing {@code parityChunks} parity chunks.
 *
 * @param blockIndex  position of the block in the transfer
 * @param startIndex  global index of the block's first data chunk
 * @param offset      byte offset of the block in the file
 * @param size        number of data bytes in the block
 * @param chunkSize   nominal data chunk size inside the block
 * @param dataChunks  number of data chunks
 * @param parityChunks number of parity chunks
 */
public record BlockPlan(int blockIndex, int startIndex, long offset, int size, int chunkSize, int dataChunks,
                        int parityChunks) {

    public BlockPlan {
        if (chunkSize <= 0 || size <= 0 || dataChunks <= 0) {
            throw new IllegalArgumentException("Empty block " + blockIndex);
        }
        if (dataChunks != (int) ((size + (long) chunkSize - 1) / chunkSize)) {
            throw new IllegalArgumentException("Block " + blockIndex + " size " + size
                    + " does not split into " + dataChunks + " chunks of " + chunkSize);
        }
        if (parityChunks < 0 || parityChunks > dataChunks) {
            throw new IllegalArgumentException("Invalid parity count " + parityChunks + " for block " + blockIndex);
        }
    }

    public long chunkOffset(int slot) {
        return offset + (long) slot * chunkSize;
    }

    public int chunkLength(int slot) {
        if (slot < 0 || slot >= dataChunks) {
            throw new IndexOutOfBoundsException("Slot " + slot + " outside block of " + dataChunks);
        }
        return (int) Math.min(chunkSize, size - (long) slot * chunkSize);
    }

    public long end() {
        return offset + size;
    }

    /**
     * Data slots covered by parity chunk {@code parityIndex}: {@code p, p + P, p + 2P, ...}.
     */
    public BitSet parityCoverage(int parityIndex) {
        if (parityIndex < 0 || parityIndex >= parityChunks) {
            throw new IndexOutOfBoundsException("Parity " + parityIndex + " outside block of " + parityChunks);
        }
        BitSet coverage = new BitSet(dataChunks);
        for (int slot = parityIndex; slot < dataChunks; slot += parityChunks) {
            coverage.set(slot);
        }
        return coverage;
    }
}
