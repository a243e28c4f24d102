package io.github.shangor.peer.transfer.core.codec;

import io.github.shangor.peer.transfer.core.model.ChunkBitmap;

import java.util.BitSet;
import java.util.Map;
import java.util.TreeMap;

/**
 * Receive-side state of one block: which data slots are in the assembly buffer and which
 * parity chunks are held for it. Guarded by the owning {@link ChunkAssembler}.
 */
public class BlockAssembly {
    private final BlockPlan plan;
    private final ChunkBitmap present;
    private final Map<Integer, ParityChunk> parity = new TreeMap<>();
    private final BitSet paritySeen = new BitSet();
    private BlockStatus status = BlockStatus.INCOMPLETE;
    private int corruptChunks;

    BlockAssembly(BlockPlan plan) {
        this.plan = plan;
        this.present = new ChunkBitmap(plan.dataChunks());
    }

    public BlockPlan plan() {
        return plan;
    }

    public BlockStatus status() {
        return status;
    }

    public int corruptChunks() {
        return corruptChunks;
    }

    public int presentChunks() {
        return present.receivedCount();
    }

    public BitSet missingSlots() {
        return present.missingChunks();
    }

    public boolean isDataComplete() {
        return present.allReceived();
    }

    /**
     * Parity chunks trail the data chunks of their block, so once every parity chunk has been
     * seen nothing more will arrive for this block.
     */
    public boolean isReadyToFinalize() {
        if (status.isDone()) {
            return false;
        }
        return isDataComplete()
                || (plan.parityChunks() > 0 && paritySeen.cardinality() >= plan.parityChunks());
    }

    ChunkBitmap present() {
        return present;
    }

    Map<Integer, ParityChunk> parity() {
        return parity;
    }

    void markParitySeen(int parityIndex) {
        paritySeen.set(parityIndex);
    }

    boolean isParitySeen(int parityIndex) {
        return paritySeen.get(parityIndex);
    }

    void markCorrupt() {
        corruptChunks++;
    }

    void setStatus(BlockStatus status) {
        this.status = status;
    }
}
