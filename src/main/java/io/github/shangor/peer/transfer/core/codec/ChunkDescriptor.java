package io.github.shangor.peer.transfer.core.codec;

/**
 * Position of one data or parity chunk within a planned transfer.
 *
 * @param index  global data index, or the block's first data index for parity chunks
 * @param slot   block-relative data slot, or the parity index for parity chunks
 * @param offset file offset of the data bytes; for parity the block offset
 * @param length payload length in bytes
 */
public record ChunkDescriptor(boolean parity, int index, int slot, int blockIndex, long offset, int length) {
}
