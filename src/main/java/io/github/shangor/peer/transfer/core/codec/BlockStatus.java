package io.github.shangor.peer.transfer.core.codec;

public enum BlockStatus {
    /** every data chunk arrived intact */
    COMPLETE,
    /** missing or corrupt chunks were rebuilt from parity */
    RECONSTRUCTED,
    /** chunks are still missing but more may arrive */
    INCOMPLETE,
    /** chunks are missing and the available parity cannot rebuild them */
    UNRECOVERABLE;

    public boolean isDone() {
        return this == COMPLETE || this == RECONSTRUCTED;
    }
}
