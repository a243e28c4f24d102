package io.github.shangor.peer.transfer.core.service;

public enum TransferErrorKind {
    /** peer unreachable or disconnected mid-transfer */
    TRANSPORT,
    /** peer sent a message that breaks the protocol */
    PROTOCOL,
    /** checksum mismatch or a block that parity cannot rebuild */
    INTEGRITY,
    /** duplicate transfer id or a request above the size ceiling */
    CAPACITY,
    /** cancelled locally or by the peer */
    CANCELLED,
    /** local file or buffer I/O failed */
    LOCAL_IO
}
