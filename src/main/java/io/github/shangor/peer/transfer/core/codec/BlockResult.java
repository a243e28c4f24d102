package io.github.shangor.peer.transfer.core.codec;

/**
 * Outcome of {@link ChunkAssembler#finalizeBlock}.
 *
 * @param reconstructedBytes bytes rebuilt from parity during this call
 * @param missingSlots       data slots still missing afterwards
 */
public record BlockResult(int blockIndex, BlockStatus status, long reconstructedBytes, int missingSlots) {
}
