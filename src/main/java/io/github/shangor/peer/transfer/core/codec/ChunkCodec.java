package io.github.shangor.peer.transfer.core.codec;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.zip.CRC32;

/**
 * Splits a byte range into blocks of data chunks and computes XOR parity for them.
 *
 * <p>A block holds up to {@code blockChunks} data chunks. With a parity ratio {@code r > 0} a
 * block of {@code n} data chunks gets {@code ceil(r * n)} parity chunks (never more than
 * {@code n}). Parity chunk {@code p} of {@code P} is the byte-wise XOR of data slots
 * {@code p, p + P, p + 2P, ...}, shorter chunks being zero padded. A single parity chunk is
 * therefore the XOR of every data chunk in the block.
 */
public final class ChunkCodec {
    public static final int DEFAULT_BLOCK_CHUNKS = 8;
    private static final double RATIO_EPSILON = 1e-9;

    private final int blockChunks;

    public ChunkCodec() {
        this(DEFAULT_BLOCK_CHUNKS);
    }

    public ChunkCodec(int blockChunks) {
        if (blockChunks <= 0) {
            throw new IllegalArgumentException("Block must hold at least one chunk: " + blockChunks);
        }
        this.blockChunks = blockChunks;
    }

    public int blockChunks() {
        return blockChunks;
    }

    public static int parityCount(int dataChunks, double parityRatio) {
        if (parityRatio <= 0 || dataChunks <= 0) {
            return 0;
        }
        int count = (int) Math.ceil(parityRatio * dataChunks - RATIO_EPSILON);
        return Math.max(1, Math.min(dataChunks, count));
    }

    /**
     * Plans the block starting at {@code offset}. The chunk size may differ from the previous
     * block; it is fixed inside a block.
     */
    public BlockPlan planBlock(int blockIndex, int startIndex, long offset, long sourceLength, int chunkSize,
                               double parityRatio) {
        if (offset < 0 || offset >= sourceLength) {
            throw new IllegalArgumentException("Offset " + offset + " outside source of " + sourceLength);
        }
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive: " + chunkSize);
        }
        long remaining = sourceLength - offset;
        int dataChunks = (int) Math.min(blockChunks, (remaining + chunkSize - 1) / chunkSize);
        int size = (int) Math.min(remaining, (long) dataChunks * chunkSize);
        return new BlockPlan(blockIndex, startIndex, offset, size, chunkSize, dataChunks,
                parityCount(dataChunks, parityRatio));
    }

    /**
     * Partitions {@code [0, sourceLength)} into blocks of fixed-size chunks.
     */
    public List<BlockPlan> plan(long sourceLength, int chunkSize, double parityRatio) {
        List<BlockPlan> blocks = new ArrayList<>();
        long offset = 0;
        int startIndex = 0;
        while (offset < sourceLength) {
            BlockPlan block = planBlock(blocks.size(), startIndex, offset, sourceLength, chunkSize, parityRatio);
            blocks.add(block);
            offset = block.end();
            startIndex += block.dataChunks();
        }
        return blocks;
    }

    /**
     * Chunk layout of a whole source with a fixed chunk size: each block's data chunks in index
     * order followed by its parity chunks.
     */
    public List<ChunkDescriptor> encode(long sourceLength, int chunkSize, double parityRatio) {
        List<ChunkDescriptor> chunks = new ArrayList<>();
        for (BlockPlan block : plan(sourceLength, chunkSize, parityRatio)) {
            for (int slot = 0; slot < block.dataChunks(); slot++) {
                chunks.add(new ChunkDescriptor(false, block.startIndex() + slot, slot, block.blockIndex(),
                        block.chunkOffset(slot), block.chunkLength(slot)));
            }
            for (int p = 0; p < block.parityChunks(); p++) {
                chunks.add(new ChunkDescriptor(true, block.startIndex(), p, block.blockIndex(), block.offset(),
                        parityLength(block, block.parityCoverage(p))));
            }
        }
        return chunks;
    }

    /**
     * Computes the parity chunks of a block from its data chunks, given in slot order.
     */
    public List<ParityChunk> computeParity(BlockPlan block, List<byte[]> dataChunks) {
        if (dataChunks.size() != block.dataChunks()) {
            throw new IllegalArgumentException("Block " + block.blockIndex() + " expects " + block.dataChunks()
                    + " data chunks, got " + dataChunks.size());
        }
        List<ParityChunk> parity = new ArrayList<>(block.parityChunks());
        for (int p = 0; p < block.parityChunks(); p++) {
            BitSet coverage = block.parityCoverage(p);
            byte[] payload = new byte[parityLength(block, coverage)];
            for (int slot = coverage.nextSetBit(0); slot >= 0; slot = coverage.nextSetBit(slot + 1)) {
                xorInto(payload, dataChunks.get(slot));
            }
            parity.add(new ParityChunk(p, payload, coverage));
        }
        return parity;
    }

    public static long crc32(byte[] data) {
        CRC32 crc = new CRC32();
        crc.update(data, 0, data.length);
        return crc.getValue();
    }

    /**
     * Total data chunks expected when {@code emitted} chunks are already out and the rest of
     * the source is sent with {@code chunkSize}.
     */
    public static int estimateTotalChunks(int emitted, long remainingBytes, int chunkSize) {
        if (remainingBytes <= 0) {
            return emitted;
        }
        return (int) Math.min(Integer.MAX_VALUE, emitted + (remainingBytes + chunkSize - 1) / chunkSize);
    }

    static void xorInto(byte[] target, byte[] source) {
        int len = Math.min(target.length, source.length);
        for (int i = 0; i < len; i++) {
            target[i] ^= source[i];
        }
    }

    private static int parityLength(BlockPlan block, BitSet coverage) {
        int max = 0;
        for (int slot = coverage.nextSetBit(0); slot >= 0; slot = coverage.nextSetBit(slot + 1)) {
            max = Math.max(max, block.chunkLength(slot));
        }
        return max;
    }
}
