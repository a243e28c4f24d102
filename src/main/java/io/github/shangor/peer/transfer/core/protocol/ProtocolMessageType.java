package io.github.shangor.peer.transfer.core.protocol;

public enum ProtocolMessageType {
    FILE_REQUEST,
    FILE_ACCEPT,
    FILE_REJECT,
    FILE_CHUNK,
    FILE_COMPLETE,
    FILE_CANCEL
}
