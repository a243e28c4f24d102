package io.github.shangor.peer.transfer.core.service;

import io.github.shangor.peer.transfer.core.model.FileMetadata;
import io.github.shangor.peer.transfer.core.model.TransferDirection;
import io.github.shangor.peer.transfer.core.model.TransferRecord;
import io.github.shangor.peer.transfer.core.model.TransferStatus;
import io.github.shangor.peer.transfer.core.protocol.FileCancelMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * State machine of one transfer on one endpoint.
 *
 * <p>{@code PENDING -> TRANSFERRING -> VERIFYING -> COMPLETED}; {@code FAILED}, {@code REJECTED}
 * and {@code INTEGRITY_ERROR} end the transfer early. Terminal states are final. The session owns
 * its {@link TransferRecord}; callers only ever see snapshots.
 */
public abstract class TransferSession {
    private static final Logger log = LoggerFactory.getLogger(TransferSession.class);

    protected final TransferRecord record;
    protected final FileMetadata metadata;
    protected final String peerId;
    protected final ConnectionRegistry connections;
    protected final TransferListener events;
    protected volatile boolean cancelled = false;
    private boolean released = false;

    protected TransferSession(TransferRecord record, FileMetadata metadata, String peerId,
                              ConnectionRegistry connections, TransferListener events) {
        this.record = record;
        this.metadata = metadata;
        this.peerId = peerId;
        this.connections = connections;
        this.events = events;
    }

    public String id() {
        return record.getId();
    }

    public String peerId() {
        return peerId;
    }

    public FileMetadata metadata() {
        return metadata;
    }

    public abstract TransferDirection direction();

    public TransferStatus status() {
        return record.getStatus();
    }

    public boolean isTerminal() {
        return record.getStatus().isTerminal();
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public TransferRecord snapshot() {
        return record.snapshot();
    }

    /**
     * Cancels the transfer locally and tells the peer.
     *
     * @return false if the transfer had already ended
     */
    public boolean cancel() {
        synchronized (this) {
            if (isTerminal()) {
                return false;
            }
            cancelled = true;
        }
        if (!connections.send(peerId, new FileCancelMessage(id()))) {
            log.debug("Could not notify peer {} of cancelled transfer {}", peerId, id());
        }
        fail(new TransferException(TransferErrorKind.CANCELLED, "Transfer cancelled"));
        return true;
    }

    /**
     * The peer cancelled the transfer.
     */
    void onRemoteCancel() {
        cancelled = true;
        fail(new TransferException(TransferErrorKind.CANCELLED, "Transfer cancelled by peer " + peerId));
    }

    void onPeerDisconnected() {
        fail(new TransferException(TransferErrorKind.TRANSPORT, "Peer " + peerId + " disconnected"));
    }

    /**
     * Moves the session to {@code next} unless it already ended.
     *
     * @return false if the session was terminal
     */
    protected boolean transition(TransferStatus next) {
        TransferStatus previous;
        synchronized (this) {
            previous = record.getStatus();
            if (previous.isTerminal() || previous == next) {
                return false;
            }
            record.setStatus(next);
        }
        log.info("Transfer {} ({} {}) {} -> {}", id(), direction(), metadata.getName(), previous, next);
        TransferRecord snapshot = record.snapshot();
        events.onStatusChanged(snapshot, previous);
        switch (next) {
            case COMPLETED -> events.onTransferCompleted(snapshot);
            case REJECTED -> events.onTransferRejected(snapshot);
            default -> {
            }
        }
        if (next.isTerminal() && !retainsDataIn(next)) {
            releaseOnce();
        }
        return true;
    }

    /**
     * Ends the session with {@code FAILED}, or {@code INTEGRITY_ERROR} for integrity problems.
     */
    protected void fail(TransferException cause) {
        TransferStatus target = cause.getKind() == TransferErrorKind.INTEGRITY
                ? TransferStatus.INTEGRITY_ERROR : TransferStatus.FAILED;
        if (!transition(target)) {
            return;
        }
        if (cause.getKind() == TransferErrorKind.CANCELLED) {
            log.info("Transfer {} cancelled: {}", id(), cause.getMessage());
        } else {
            log.warn("Transfer {} failed: {}", id(), cause.toString(), cause.getCause());
        }
        events.onTransferFailed(record.snapshot(), cause);
    }

    protected void publishProgress(long confirmedBytes) {
        if (record.confirmBytes(confirmedBytes)) {
            events.onProgress(record.snapshot());
        }
    }

    /**
     * @return true if the session keeps its buffers after reaching terminal {@code status}
     */
    protected boolean retainsDataIn(TransferStatus status) {
        return false;
    }

    /**
     * Frees buffers and open files. Called once, either on reaching a terminal state that keeps
     * no data or when a finished transfer is cleared.
     */
    protected abstract void release();

    final void releaseOnce() {
        synchronized (this) {
            if (released) {
                return;
            }
            released = true;
        }
        release();
    }
}
