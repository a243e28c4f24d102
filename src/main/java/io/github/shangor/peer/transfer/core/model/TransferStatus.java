package io.github.shangor.peer.transfer.core.model;

public enum TransferStatus {
    PENDING,
    TRANSFERRING,
    VERIFYING,
    COMPLETED,
    FAILED,
    REJECTED,
    INTEGRITY_ERROR;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == REJECTED || this == INTEGRITY_ERROR;
    }
}
