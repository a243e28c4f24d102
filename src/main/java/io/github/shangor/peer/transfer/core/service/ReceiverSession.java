package io.github.shangor.peer.transfer.core.service;

import io.github.shangor.peer.transfer.core.codec.BlockAssembly;
import io.github.shangor.peer.transfer.core.codec.BlockResult;
import io.github.shangor.peer.transfer.core.codec.BlockStatus;
import io.github.shangor.peer.transfer.core.codec.ChunkAssembler;
import io.github.shangor.peer.transfer.core.codec.ChunkCompressor;
import io.github.shangor.peer.transfer.core.io.AssemblyBuffer;
import io.github.shangor.peer.transfer.core.io.AssemblyBuffers;
import io.github.shangor.peer.transfer.core.model.FileMetadata;
import io.github.shangor.peer.transfer.core.model.TransferDirection;
import io.github.shangor.peer.transfer.core.model.TransferRecord;
import io.github.shangor.peer.transfer.core.model.TransferStatus;
import io.github.shangor.peer.transfer.core.protocol.FileAcceptMessage;
import io.github.shangor.peer.transfer.core.protocol.FileChunkMessage;
import io.github.shangor.peer.transfer.core.protocol.FileCompleteMessage;
import io.github.shangor.peer.transfer.core.protocol.FileRejectMessage;
import io.github.shangor.peer.transfer.core.protocol.ProtocolException;
import io.github.shangor.peer.transfer.core.util.TransferSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.ExecutorService;

/**
 * Incoming side of a transfer. Chunks are folded into a {@link ChunkAssembler} on the inbound
 * thread; once the sender reports completion every block is finalized and the assembled file is
 * hashed on the verification executor.
 *
 * <p>After {@code COMPLETED} or {@code INTEGRITY_ERROR} the assembled bytes stay available through
 * {@link #receivedFile()} until the transfer is cleared.
 */
public class ReceiverSession extends TransferSession {
    private static final Logger log = LoggerFactory.getLogger(ReceiverSession.class);

    private final TransferSettings settings;
    private final ChecksumService checksumService;
    private final ExecutorService verifyExecutor;
    private ChunkAssembler assembler;
    private long acceptedAtNanos;
    private int unrecoverableBlocks;

    ReceiverSession(TransferRecord record, FileMetadata metadata, String peerId, ConnectionRegistry connections,
                    TransferListener events, TransferSettings settings, ChecksumService checksumService,
                    ExecutorService verifyExecutor) {
        super(record, metadata, peerId, connections, events);
        this.settings = settings;
        this.checksumService = checksumService;
        this.verifyExecutor = verifyExecutor;
    }

    @Override
    public TransferDirection direction() {
        return TransferDirection.INCOMING;
    }

    /**
     * Allocates the assembly buffer and tells the sender to start.
     *
     * @return false if the request is no longer pending or the accept could not be sent
     */
    synchronized boolean accept() {
        if (status() != TransferStatus.PENDING) {
            log.warn("Cannot accept transfer {} in state {}", id(), status());
            return false;
        }
        AssemblyBuffer buffer;
        try {
            buffer = AssemblyBuffers.create(id(), metadata.getSize(), settings.memoryBufferThreshold(),
                    settings.tempDir());
        } catch (IOException e) {
            fail(new TransferException(TransferErrorKind.LOCAL_IO, "Cannot allocate buffer for " + metadata.getName(), e));
            return false;
        }
        assembler = new ChunkAssembler(id(), metadata.getSize(), buffer, new ChunkCompressor());
        acceptedAtNanos = System.nanoTime();
        transition(TransferStatus.TRANSFERRING);
        events.onTransferAccepted(record.snapshot());
        if (!connections.send(peerId, new FileAcceptMessage(metadata))) {
            fail(new TransferException(TransferErrorKind.TRANSPORT, "Could not send accept to " + peerId));
            return false;
        }
        return true;
    }

    synchronized boolean reject() {
        if (status() != TransferStatus.PENDING) {
            log.warn("Cannot reject transfer {} in state {}", id(), status());
            return false;
        }
        transition(TransferStatus.REJECTED);
        if (!connections.send(peerId, new FileRejectMessage(metadata))) {
            log.debug("Could not deliver reject of transfer {} to {}", id(), peerId);
        }
        return true;
    }

    synchronized void onChunk(FileChunkMessage chunk) {
        if (cancelled || isTerminal()) {
            log.debug("Dropping chunk {} of finished transfer {}", chunk.index(), id());
            return;
        }
        if (status() != TransferStatus.TRANSFERRING) {
            log.warn("Dropping chunk {} of transfer {} in state {}", chunk.index(), id(), status());
            return;
        }
        try {
            BlockAssembly block = assembler.decodeChunk(chunk);
            record.setChunkSize(chunk.blockChunkSize());
            if (block.isReadyToFinalize()) {
                BlockResult result = assembler.finalizeBlock(block, false);
                if (result.status() == BlockStatus.RECONSTRUCTED) {
                    log.debug("Block {} of transfer {} rebuilt {} bytes from parity", result.blockIndex(), id(),
                            result.reconstructedBytes());
                } else if (result.status() == BlockStatus.UNRECOVERABLE) {
                    unrecoverableBlocks++;
                    log.warn("Block {} of transfer {} lost {} chunk(s) beyond what parity can rebuild",
                            result.blockIndex(), id(), result.missingSlots());
                }
            }
        } catch (ProtocolException e) {
            log.warn("Dropping chunk {} of transfer {}: {}", chunk.index(), id(), e.getMessage());
            return;
        } catch (IOException e) {
            fail(new TransferException(TransferErrorKind.LOCAL_IO, "Failed to store chunk " + chunk.index(), e));
            return;
        }
        long elapsedNanos = System.nanoTime() - acceptedAtNanos;
        long confirmed = assembler.confirmedBytes();
        if (elapsedNanos > 0) {
            record.setTransferSpeed(confirmed * 1_000_000_000.0 / elapsedNanos);
        }
        publishProgress(confirmed);
    }

    /**
     * The sender has handed over every chunk. Verification continues on the verification
     * executor so the inbound thread is not held up by hashing.
     */
    synchronized void onFileComplete(FileCompleteMessage complete) {
        if (cancelled || isTerminal()) {
            return;
        }
        if (status() != TransferStatus.TRANSFERRING) {
            log.warn("Ignoring completion of transfer {} in state {}", id(), status());
            return;
        }
        if (complete.checksum() == null || complete.checksum().isBlank()) {
            fail(new TransferException(TransferErrorKind.PROTOCOL, "Completion of " + id() + " carries no checksum"));
            return;
        }
        transition(TransferStatus.VERIFYING);
        verifyExecutor.submit(() -> verify(complete.checksum()));
    }

    private void verify(String expected) {
        try {
            if (!assembler.finalizeAll()) {
                fail(new TransferException(TransferErrorKind.INTEGRITY, "Transfer " + id() + " has "
                        + Math.max(1, unrecoverableBlocks) + " block(s) parity cannot rebuild"));
                return;
            }
            publishProgress(assembler.confirmedBytes());
            String actual;
            try (InputStream in = assembler.buffer().openStream()) {
                actual = checksumService.sha256(in);
            }
            record.setChecksum(actual);
            if (!actual.equalsIgnoreCase(expected)) {
                fail(new TransferException(TransferErrorKind.INTEGRITY, "Checksum mismatch for " + metadata.getName()
                        + ": expected " + expected + ", got " + actual));
                return;
            }
            try {
                metadata.setChecksum(actual);
            } catch (IllegalStateException e) {
                fail(new TransferException(TransferErrorKind.INTEGRITY, "Checksum differs from the one announced for "
                        + metadata.getName(), e));
                return;
            }
            if (assembler.reconstructedBytes() > 0) {
                log.info("Transfer {} recovered {} bytes from parity", id(), assembler.reconstructedBytes());
            }
            transition(TransferStatus.COMPLETED);
        } catch (IOException e) {
            if (cancelled || isTerminal()) {
                log.debug("Verification of transfer {} stopped: {}", id(), e.getMessage());
                return;
            }
            fail(new TransferException(TransferErrorKind.LOCAL_IO, "Failed to verify " + metadata.getName(), e));
        }
    }

    /**
     * @return the assembled file, or null unless the transfer completed or was flagged
     */
    public synchronized ReceivedFile receivedFile() {
        TransferStatus status = status();
        if (status != TransferStatus.COMPLETED && status != TransferStatus.INTEGRITY_ERROR) {
            return null;
        }
        if (assembler == null || assembler.buffer().isReleased()) {
            return null;
        }
        return new ReceivedFile(metadata, status, record.getChecksum(), assembler.buffer());
    }

    @Override
    protected boolean retainsDataIn(TransferStatus status) {
        return status == TransferStatus.COMPLETED || status == TransferStatus.INTEGRITY_ERROR;
    }

    @Override
    protected synchronized void release() {
        if (assembler != null) {
            assembler.release();
        }
    }
}
