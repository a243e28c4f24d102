package io.github.shangor.peer.transfer.core.model;

public enum TransferDirection {
    OUTGOING,
    INCOMING
}
