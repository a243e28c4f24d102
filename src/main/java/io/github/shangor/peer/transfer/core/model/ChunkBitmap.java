package io.github.shangor.peer.transfer.core.model;

import java.util.BitSet;

/**
 * Tracks which slots of a fixed-size chunk range have been received.
 */
public class ChunkBitmap {
    private final int chunkCount;
    private final BitSet bits;

    public ChunkBitmap(int chunkCount) {
        if (chunkCount < 0) {
            throw new IllegalArgumentException("Negative chunk count: " + chunkCount);
        }
        this.chunkCount = chunkCount;
        this.bits = new BitSet(chunkCount);
    }

    /**
     * @return false if the slot was already marked
     */
    public synchronized boolean markReceived(int index) {
        checkIndex(index);
        if (bits.get(index)) {
            return false;
        }
        bits.set(index);
        return true;
    }

    public synchronized boolean isReceived(int index) {
        checkIndex(index);
        return bits.get(index);
    }

    public synchronized boolean allReceived() {
        return bits.cardinality() >= chunkCount;
    }

    public synchronized int receivedCount() {
        return bits.cardinality();
    }

    public int chunkCount() {
        return chunkCount;
    }

    public synchronized BitSet missingChunks() {
        BitSet missing = new BitSet(chunkCount);
        missing.set(0, chunkCount);
        missing.andNot(bits);
        return missing;
    }

    public synchronized int firstMissingChunk() {
        int idx = bits.nextClearBit(0);
        return Math.min(idx, chunkCount);
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= chunkCount) {
            throw new IndexOutOfBoundsException("Chunk " + index + " outside [0, " + chunkCount + ")");
        }
    }
}
