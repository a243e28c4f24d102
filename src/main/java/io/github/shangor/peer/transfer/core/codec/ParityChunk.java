package io.github.shangor.peer.transfer.core.codec;

import java.util.BitSet;

/**
 * XOR parity over the data slots listed in {@code coverage}.
 */
public record ParityChunk(int parityIndex, byte[] payload, BitSet coverage) {
}
