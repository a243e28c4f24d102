package io.github.shangor.peer.transfer.core.flow;

public enum ConnectionQuality {
    SLOW,
    MEDIUM,
    FAST
}
