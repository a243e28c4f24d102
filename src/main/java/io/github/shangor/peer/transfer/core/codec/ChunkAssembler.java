package io.github.shangor.peer.transfer.core.codec;

import io.github.shangor.peer.transfer.core.io.AssemblyBuffer;
import io.github.shangor.peer.transfer.core.protocol.FileChunkMessage;
import io.github.shangor.peer.transfer.core.protocol.ProtocolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Reassembles the chunks of one incoming file into an {@link AssemblyBuffer}, block by block.
 *
 * <p>Data chunks are written straight into the buffer. Parity chunks are held per block until
 * the block is finalized; a missing or corrupt data chunk is rebuilt by XOR-ing a parity chunk
 * with the other data chunks it covers, provided it is the only gap under that parity chunk.
 */
public class ChunkAssembler {
    private static final Logger log = LoggerFactory.getLogger(ChunkAssembler.class);

    private final String transferId;
    private final long fileSize;
    private final AssemblyBuffer buffer;
    private final ChunkCompressor compressor;
    private final Map<Integer, BlockAssembly> blocks = new TreeMap<>();
    private long confirmedBytes;
    private long reconstructedBytes;

    public ChunkAssembler(String transferId, long fileSize, AssemblyBuffer buffer, ChunkCompressor compressor) {
        this.transferId = Objects.requireNonNull(transferId, "transferId");
        this.fileSize = fileSize;
        this.buffer = Objects.requireNonNull(buffer, "buffer");
        this.compressor = Objects.requireNonNull(compressor, "compressor");
    }

    /**
     * Folds one chunk into its block. Corrupt data chunks are dropped and left to parity.
     *
     * @return the updated block
     * @throws ProtocolException if the chunk's layout contradicts the file or its block
     * @throws IOException       if the assembly buffer cannot be written
     */
    public synchronized BlockAssembly decodeChunk(FileChunkMessage chunk) throws IOException {
        BlockAssembly block = blockFor(chunk);
        if (block.status().isDone()) {
            return block;
        }
        BlockPlan plan = block.plan();
        if (chunk.parity()) {
            acceptParity(block, chunk);
            return block;
        }

        int slot = chunk.index() - plan.startIndex();
        if (slot < 0 || slot >= plan.dataChunks()) {
            throw new ProtocolException("Chunk " + chunk.index() + " outside block " + plan.blockIndex()
                    + " of transfer " + transferId);
        }
        if (block.present().isReceived(slot)) {
            log.debug("Duplicate chunk {} for transfer {}", chunk.index(), transferId);
            return block;
        }
        byte[] data = decodePayload(chunk, plan.chunkLength(slot));
        if (data == null || data.length != plan.chunkLength(slot) || ChunkCodec.crc32(data) != chunk.crc32()) {
            block.markCorrupt();
            log.debug("Corrupt chunk {} in block {} of transfer {}, left for parity", chunk.index(),
                    plan.blockIndex(), transferId);
            return block;
        }
        buffer.write(plan.chunkOffset(slot), data);
        block.present().markReceived(slot);
        confirmedBytes += data.length;
        return block;
    }

    /**
     * Tries to complete a block, rebuilding missing slots from parity where possible.
     *
     * @param endOfStream true when no more chunks will arrive for the block
     */
    public synchronized BlockResult finalizeBlock(BlockAssembly block, boolean endOfStream) throws IOException {
        BlockPlan plan = block.plan();
        if (block.status().isDone()) {
            return new BlockResult(plan.blockIndex(), block.status(), 0, 0);
        }
        if (block.isDataComplete()) {
            block.setStatus(BlockStatus.COMPLETE);
            block.parity().clear();
            return new BlockResult(plan.blockIndex(), BlockStatus.COMPLETE, 0, 0);
        }

        long rebuilt = 0;
        boolean progress = true;
        while (progress && !block.isDataComplete()) {
            progress = false;
            for (ParityChunk parity : new ArrayList<>(block.parity().values())) {
                BitSet gaps = (BitSet) parity.coverage().clone();
                gaps.and(block.missingSlots());
                if (gaps.cardinality() != 1) {
                    continue;
                }
                int slot = gaps.nextSetBit(0);
                byte[] restored = rebuild(plan, parity, slot);
                buffer.write(plan.chunkOffset(slot), restored);
                block.present().markReceived(slot);
                block.parity().remove(parity.parityIndex());
                rebuilt += restored.length;
                progress = true;
                log.debug("Rebuilt chunk {} of block {} in transfer {} from parity {}",
                        plan.startIndex() + slot, plan.blockIndex(), transferId, parity.parityIndex());
            }
        }
        confirmedBytes += rebuilt;
        reconstructedBytes += rebuilt;

        int missing = block.missingSlots().cardinality();
        BlockStatus status;
        if (missing == 0) {
            status = BlockStatus.RECONSTRUCTED;
            block.parity().clear();
        } else if (endOfStream || block.isReadyToFinalize()) {
            status = BlockStatus.UNRECOVERABLE;
        } else {
            status = BlockStatus.INCOMPLETE;
        }
        block.setStatus(status);
        return new BlockResult(plan.blockIndex(), status, rebuilt, missing);
    }

    /**
     * Finalizes every block once the sender has finished.
     *
     * @return true if the blocks cover the whole file without gaps
     */
    public synchronized boolean finalizeAll() throws IOException {
        boolean complete = true;
        long expectedOffset = 0;
        for (BlockAssembly block : blocks.values()) {
            BlockResult result = finalizeBlock(block, true);
            if (!result.status().isDone()) {
                log.warn("Block {} of transfer {} has {} unrecoverable chunk(s)", result.blockIndex(), transferId,
                        result.missingSlots());
                complete = false;
            }
            if (block.plan().offset() != expectedOffset) {
                log.warn("Transfer {} has a gap at byte {} (next block starts at {})", transferId, expectedOffset,
                        block.plan().offset());
                complete = false;
            }
            expectedOffset = block.plan().end();
        }
        if (expectedOffset != fileSize) {
            log.warn("Transfer {} covers {} of {} bytes", transferId, expectedOffset, fileSize);
            complete = false;
        }
        return complete;
    }

    public synchronized long confirmedBytes() {
        return confirmedBytes;
    }

    public synchronized long reconstructedBytes() {
        return reconstructedBytes;
    }

    public synchronized List<BlockAssembly> blocks() {
        return new ArrayList<>(blocks.values());
    }

    public AssemblyBuffer buffer() {
        return buffer;
    }

    public synchronized void release() {
        blocks.clear();
        buffer.release();
    }

    private BlockAssembly blockFor(FileChunkMessage chunk) throws ProtocolException {
        BlockPlan plan;
        try {
            int dataChunks = (int) ((chunk.blockSize() + (long) chunk.blockChunkSize() - 1) / chunk.blockChunkSize());
            plan = new BlockPlan(chunk.blockIndex(), chunk.blockStartIndex(), chunk.blockOffset(), chunk.blockSize(),
                    chunk.blockChunkSize(), dataChunks, chunk.totalParityChunks());
        } catch (IllegalArgumentException e) {
            throw new ProtocolException("Invalid block layout in transfer " + transferId + ": " + e.getMessage(), e);
        }
        if (plan.end() > fileSize) {
            throw new ProtocolException("Block " + plan.blockIndex() + " ends at " + plan.end()
                    + " beyond file size " + fileSize);
        }
        BlockAssembly existing = blocks.get(plan.blockIndex());
        if (existing == null) {
            BlockAssembly created = new BlockAssembly(plan);
            blocks.put(plan.blockIndex(), created);
            return created;
        }
        if (!existing.plan().equals(plan)) {
            throw new ProtocolException("Inconsistent layout for block " + plan.blockIndex() + " of transfer "
                    + transferId);
        }
        return existing;
    }

    private void acceptParity(BlockAssembly block, FileChunkMessage chunk) throws ProtocolException {
        BlockPlan plan = block.plan();
        int parityIndex = chunk.parityIndex();
        if (parityIndex < 0 || parityIndex >= plan.parityChunks()) {
            throw new ProtocolException("Parity " + parityIndex + " outside block " + plan.blockIndex()
                    + " of transfer " + transferId);
        }
        if (block.isParitySeen(parityIndex)) {
            return;
        }
        block.markParitySeen(parityIndex);
        BitSet coverage = chunk.chunkMap() == null ? new BitSet() : chunk.chunkMap();
        if (coverage.isEmpty() || coverage.length() > plan.dataChunks()) {
            log.warn("Discarding parity {} of block {} in transfer {}: coverage {} does not fit {} data chunks",
                    parityIndex, plan.blockIndex(), transferId, coverage, plan.dataChunks());
            return;
        }
        if (ChunkCodec.crc32(chunk.payload()) != chunk.crc32()) {
            block.markCorrupt();
            log.debug("Corrupt parity {} of block {} in transfer {}", parityIndex, plan.blockIndex(), transferId);
            return;
        }
        block.parity().put(parityIndex, new ParityChunk(parityIndex, chunk.payload(), coverage));
    }

    private byte[] decodePayload(FileChunkMessage chunk, int expectedLength) {
        if (!chunk.compressed()) {
            return chunk.payload();
        }
        if (chunk.originalLength() != expectedLength) {
            log.debug("Chunk {} of transfer {} claims {} inflated bytes, slot holds {}", chunk.index(), transferId,
                    chunk.originalLength(), expectedLength);
            return null;
        }
        try {
            return compressor.decompress(chunk.payload(), chunk.originalLength());
        } catch (IOException e) {
            log.debug("Failed to inflate chunk {} of transfer {}", chunk.index(), transferId, e);
            return null;
        }
    }

    private byte[] rebuild(BlockPlan plan, ParityChunk parity, int missingSlot) throws IOException {
        int length = plan.chunkLength(missingSlot);
        byte[] restored = new byte[Math.max(length, parity.payload().length)];
        System.arraycopy(parity.payload(), 0, restored, 0, parity.payload().length);
        BitSet coverage = parity.coverage();
        for (int slot = coverage.nextSetBit(0); slot >= 0; slot = coverage.nextSetBit(slot + 1)) {
            if (slot != missingSlot) {
                ChunkCodec.xorInto(restored, buffer.read(plan.chunkOffset(slot), plan.chunkLength(slot)));
            }
        }
        if (restored.length == length) {
            return restored;
        }
        byte[] trimmed = new byte[length];
        System.arraycopy(restored, 0, trimmed, 0, length);
        return trimmed;
    }
}
