package io.github.shangor.peer.transfer.core.service;

/**
 * Reason a transfer ended without completing.
 */
public class TransferException extends Exception {
    private final TransferErrorKind kind;

    public TransferException(TransferErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public TransferException(TransferErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public TransferErrorKind getKind() {
        return kind;
    }

    @Override
    public String toString() {
        return kind + ": " + getMessage();
    }
}
