package io.github.shangor.peer.transfer.core.service;

/**
 * A request was refused before any session was created for it.
 */
public class CapacityException extends TransferException {

    public CapacityException(String message) {
        super(TransferErrorKind.CAPACITY, message);
    }
}
