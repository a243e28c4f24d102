package io.github.shangor.peer.transfer.core.service;

import io.github.shangor.peer.transfer.core.model.FileMetadata;
import io.github.shangor.peer.transfer.core.model.PeerInfo;
import io.github.shangor.peer.transfer.core.model.TransferRecord;
import io.github.shangor.peer.transfer.core.model.TransferStatus;

/**
 * Events raised by {@link FileTransferService}. Records handed to listeners are snapshots.
 * Callbacks run on engine threads and must not block.
 */
public interface TransferListener {

    default void onPeerConnected(String peerId) {
    }

    default void onPeerDisconnected(String peerId) {
    }

    /**
     * A peer offers a file. Answer with {@link FileTransferService#acceptFileTransfer} or
     * {@link FileTransferService#rejectFileTransfer}.
     */
    default void onFileRequest(String peerId, FileMetadata metadata, PeerInfo from) {
    }

    default void onTransferAccepted(TransferRecord record) {
    }

    default void onTransferRejected(TransferRecord record) {
    }

    default void onStatusChanged(TransferRecord record, TransferStatus previous) {
    }

    default void onProgress(TransferRecord record) {
    }

    default void onTransferCompleted(TransferRecord record) {
    }

    /**
     * The transfer ended in {@code FAILED} or {@code INTEGRITY_ERROR}.
     */
    default void onTransferFailed(TransferRecord record, TransferException cause) {
    }
}
