package io.github.shangor.peer.transfer.core.service;

import io.github.shangor.peer.transfer.core.codec.BlockPlan;
import io.github.shangor.peer.transfer.core.codec.ChunkCodec;
import io.github.shangor.peer.transfer.core.codec.ChunkCompressor;
import io.github.shangor.peer.transfer.core.codec.ParityChunk;
import io.github.shangor.peer.transfer.core.flow.AdaptiveRateController;
import io.github.shangor.peer.transfer.core.io.FileSource;
import io.github.shangor.peer.transfer.core.io.SliceReader;
import io.github.shangor.peer.transfer.core.model.FileMetadata;
import io.github.shangor.peer.transfer.core.model.TransferDirection;
import io.github.shangor.peer.transfer.core.model.TransferRecord;
import io.github.shangor.peer.transfer.core.model.TransferStatus;
import io.github.shangor.peer.transfer.core.protocol.FileChunkMessage;
import io.github.shangor.peer.transfer.core.protocol.FileCompleteMessage;
import io.github.shangor.peer.transfer.core.util.TransferSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Outgoing side of a transfer: waits for the peer's accept, then streams the file block by block
 * from a pump thread.
 *
 * <p>Slices are read through a {@link SliceReader} on a separate worker and hashed into a running
 * SHA-256 as they arrive. Each block's data chunks go out in index order followed by its parity
 * chunks. The chunk size is re-evaluated by the {@link AdaptiveRateController} between blocks.
 * After the last block the checksum is fixed in the metadata and sent with {@code FILE_COMPLETE}.
 */
public class SenderSession extends TransferSession {
    private static final Logger log = LoggerFactory.getLogger(SenderSession.class);

    private final FileSource source;
    private final SliceReader reader;
    private final TransferSettings settings;
    private final ChunkCodec codec;
    private final ChunkCompressor compressor;
    private final AdaptiveRateController rateController;
    private final ExecutorService pumpExecutor;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile boolean accepted = false;
    private volatile long lastTelemetryLogNanos = System.nanoTime();

    SenderSession(TransferRecord record, FileMetadata metadata, String peerId, ConnectionRegistry connections,
                  TransferListener events, FileSource source, SliceReader reader, TransferSettings settings,
                  ExecutorService pumpExecutor) {
        super(record, metadata, peerId, connections, events);
        this.source = source;
        this.reader = reader;
        this.settings = settings;
        this.codec = new ChunkCodec(settings.fecBlockChunks());
        this.compressor = new ChunkCompressor();
        this.rateController = new AdaptiveRateController(settings.minChunkSize(), settings.maxChunkSize(),
                settings.defaultChunkSize());
        this.pumpExecutor = pumpExecutor;
    }

    @Override
    public TransferDirection direction() {
        return TransferDirection.OUTGOING;
    }

    void onAccepted() {
        if (status() != TransferStatus.PENDING) {
            log.debug("Ignoring accept for transfer {} in state {}", id(), status());
            return;
        }
        accepted = true;
        events.onTransferAccepted(record.snapshot());
        start();
    }

    FileSource source() {
        return source;
    }

    /**
     * @return true if the peer accepted and the stream is running or already done
     */
    boolean ensureStarted() {
        if (!accepted) {
            log.warn("Transfer {} has not been accepted by {}", id(), peerId);
            return false;
        }
        start();
        return started.get() && status() != TransferStatus.FAILED;
    }

    /**
     * A reject only counts while the request is still open; a transfer already under way is not
     * touched by it.
     */
    void onRejected() {
        if (status() != TransferStatus.PENDING) {
            log.warn("Ignoring reject for transfer {} in state {}", id(), status());
            return;
        }
        transition(TransferStatus.REJECTED);
    }

    /**
     * Starts the chunk stream. Only the first call has an effect.
     *
     * @return false if the stream was already started or the session ended
     */
    boolean start() {
        if (isTerminal() || !started.compareAndSet(false, true)) {
            return false;
        }
        if (!transition(TransferStatus.TRANSFERRING)) {
            return false;
        }
        pumpExecutor.submit(this::pump);
        return true;
    }

    private void pump() {
        try {
            stream();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail(new TransferException(TransferErrorKind.CANCELLED, "Sender interrupted", e));
        } catch (IOException e) {
            fail(new TransferException(TransferErrorKind.LOCAL_IO, "Failed to read " + source.name(), e));
        } catch (RuntimeException e) {
            log.error("Unexpected error streaming transfer {}", id(), e);
            fail(new TransferException(TransferErrorKind.LOCAL_IO, "Unexpected error: " + e.getMessage(), e));
        }
    }

    private void stream() throws IOException, InterruptedException {
        long size = metadata.getSize();
        double ratio = metadata.isUseFec() ? metadata.getFecParityRatio() : 0.0;
        boolean adaptive = settings.adaptiveChunking();
        int chunkSize = adaptive ? rateController.initialChunkSize(size) : settings.defaultChunkSize();
        MessageDigest digest = ChecksumService.newDigest();
        log.info("Streaming {} ({} bytes) to {} as transfer {}, chunk size {}, parity ratio {}",
                metadata.getName(), size, peerId, id(), chunkSize, ratio);

        long offset = 0;
        long sent = 0;
        int blockIndex = 0;
        int startIndex = 0;
        while (offset < size) {
            BlockPlan plan = codec.planBlock(blockIndex, startIndex, offset, size, chunkSize, ratio);
            record.setChunkSize(plan.chunkSize());
            List<byte[]> data = new ArrayList<>(plan.dataChunks());
            int nextChunkSize = chunkSize;
            for (int slot = 0; slot < plan.dataChunks(); slot++) {
                long chunkStart = System.nanoTime();
                byte[] slice = readSlice(plan.chunkOffset(slot), plan.chunkLength(slot));
                digest.update(slice);
                data.add(slice);

                int index = plan.startIndex() + slot;
                int total = ChunkCodec.estimateTotalChunks(index, size - plan.chunkOffset(slot), plan.chunkSize());
                if (!sendChunk(dataChunk(plan, slot, index, total, slice))) {
                    return;
                }
                sent += slice.length;
                publishProgress(sent);

                long elapsedMs = (System.nanoTime() - chunkStart) / 1_000_000L;
                if (adaptive) {
                    nextChunkSize = rateController.nextChunkSize(chunkSize, slice.length, elapsedMs);
                    record.setTransferSpeed(rateController.smoothedBytesPerSecond());
                } else if (elapsedMs > 0) {
                    record.setTransferSpeed(slice.length * 1000.0 / elapsedMs);
                }
                maybeLogTelemetry();
                pace(size);
            }
            if (plan.parityChunks() > 0) {
                int total = ChunkCodec.estimateTotalChunks(plan.startIndex() + plan.dataChunks(),
                        size - plan.end(), nextChunkSize);
                for (ParityChunk parity : codec.computeParity(plan, data)) {
                    if (!sendChunk(parityChunk(plan, parity, total))) {
                        return;
                    }
                }
            }
            offset = plan.end();
            startIndex += plan.dataChunks();
            blockIndex++;
            chunkSize = nextChunkSize;
        }

        String checksum = ChecksumService.bytesToHex(digest.digest());
        metadata.setChecksum(checksum);
        record.setChecksum(checksum);
        if (cancelled) {
            return;
        }
        if (!connections.send(peerId, new FileCompleteMessage(id(), checksum))) {
            fail(new TransferException(TransferErrorKind.TRANSPORT, "Could not send completion to " + peerId));
            return;
        }
        log.info("Transfer {} handed {} bytes in {} chunks to the transport, checksum {}", id(), sent, startIndex,
                checksum);
        transition(TransferStatus.COMPLETED);
    }

    private byte[] readSlice(long offset, int length) throws IOException, InterruptedException {
        byte[] slice;
        try {
            slice = reader.read(offset, length).get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof UncheckedIOException) {
                throw ((UncheckedIOException) cause).getCause();
            }
            throw new IOException("Slice read failed at " + offset, cause);
        }
        if (slice.length != length) {
            throw new IOException("Short read at " + offset + ": expected " + length + " bytes, got " + slice.length);
        }
        return slice;
    }

    private FileChunkMessage dataChunk(BlockPlan plan, int slot, int index, int total, byte[] slice) {
        byte[] payload = slice;
        boolean compressed = false;
        if (metadata.isCompressed()) {
            ChunkCompressor.CompressedChunk c = compressor.compress(slice, rateController.connectionQuality());
            payload = c.data();
            compressed = c.compressed();
        }
        BitSet own = new BitSet();
        own.set(slot);
        return new FileChunkMessage(id(), index, total, payload, false, -1, plan.parityChunks(), plan.blockIndex(),
                plan.startIndex(), plan.offset(), plan.size(), plan.chunkSize(), own, ChunkCodec.crc32(slice),
                compressed, slice.length);
    }

    private FileChunkMessage parityChunk(BlockPlan plan, ParityChunk parity, int total) {
        byte[] payload = parity.payload();
        return new FileChunkMessage(id(), plan.startIndex(), total, payload, true, parity.parityIndex(),
                plan.parityChunks(), plan.blockIndex(), plan.startIndex(), plan.offset(), plan.size(),
                plan.chunkSize(), parity.coverage(), ChunkCodec.crc32(payload), false, payload.length);
    }

    /**
     * Waits for the transport to drain, then hands over one chunk. The cancellation flag is
     * checked right before sending.
     *
     * @return false if the stream must stop
     */
    private boolean sendChunk(FileChunkMessage chunk) throws InterruptedException {
        while (!connections.isWritable(peerId)) {
            if (cancelled || isTerminal() || !connections.isConnected(peerId)) {
                break;
            }
            Thread.sleep(5);
        }
        if (cancelled || isTerminal()) {
            log.debug("Transfer {} stopped before chunk {}", id(), chunk.index());
            return false;
        }
        if (!connections.send(peerId, chunk)) {
            fail(new TransferException(TransferErrorKind.TRANSPORT, "Peer " + peerId + " refused chunk "
                    + chunk.index()));
            return false;
        }
        return true;
    }

    private void pace(long fileSize) throws InterruptedException {
        if (!settings.pacingEnabled()) {
            return;
        }
        long delay = rateController.pacingDelayMillis(fileSize);
        if (delay > 0) {
            Thread.sleep(delay);
        }
    }

    private void maybeLogTelemetry() {
        long now = System.nanoTime();
        if (now - lastTelemetryLogNanos < 1_000_000_000L) {
            return;
        }
        lastTelemetryLogNanos = now;
        log.info(String.format("Transfer %s telemetry: %d%% sent, throughput=%.2f MB/s, chunk=%d KiB", id(),
                record.getProgress(), record.getTransferSpeed() / 1_048_576.0, record.getChunkSize() / 1024));
    }

    @Override
    protected void release() {
        try {
            source.close();
        } catch (IOException e) {
            log.debug("Failed to close source of transfer {}", id(), e);
        }
    }
}
