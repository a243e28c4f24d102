package io.github.shangor.peer.transfer.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bookkeeping for one transfer. A record is mutated only by the session that owns it;
 * everyone else works with {@link #snapshot()} copies.
 */
public class TransferRecord {
    private final String id;
    private final String fileName;
    private final long fileSize;
    private final String fileType;
    private final String sender;
    private final String receiver;
    private final TransferDirection direction;
    private final boolean useFec;
    private final Instant createdAt;
    private final AtomicLong bytesTransferred = new AtomicLong(0);
    private volatile TransferStatus status;
    private volatile int progress;
    private volatile String checksum;
    private volatile double transferSpeed;
    private volatile int chunkSize;
    private volatile Instant updatedAt;
    private volatile Instant finishedAt;

    public TransferRecord(FileMetadata metadata, String sender, String receiver, TransferDirection direction) {
        this(metadata.getId(), metadata.getName(), metadata.getSize(), metadata.getMimeType(), sender, receiver,
                direction, metadata.isUseFec(), Instant.now());
        this.checksum = metadata.getChecksum();
    }

    private TransferRecord(String id, String fileName, long fileSize, String fileType, String sender,
                           String receiver, TransferDirection direction, boolean useFec, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.fileName = fileName;
        this.fileSize = fileSize;
        this.fileType = fileType;
        this.sender = sender;
        this.receiver = receiver;
        this.direction = direction;
        this.useFec = useFec;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
        this.status = TransferStatus.PENDING;
    }

    public String getId() {
        return id;
    }

    public String getFileName() {
        return fileName;
    }

    public long getFileSize() {
        return fileSize;
    }

    public String getFileType() {
        return fileType;
    }

    public String getSender() {
        return sender;
    }

    public String getReceiver() {
        return receiver;
    }

    public TransferDirection getDirection() {
        return direction;
    }

    public boolean isUseFec() {
        return useFec;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public TransferStatus getStatus() {
        return status;
    }

    public void setStatus(TransferStatus status) {
        this.status = status;
        Instant now = Instant.now();
        this.updatedAt = now;
        if (status.isTerminal() && finishedAt == null) {
            finishedAt = now;
        }
    }

    public int getProgress() {
        return progress;
    }

    public long getBytesTransferred() {
        return bytesTransferred.get();
    }

    /**
     * Records the total number of confirmed bytes. The count never goes backwards, and
     * progress reaches 100 only once every byte of the file is confirmed.
     *
     * @return true if the visible progress percentage changed
     */
    public boolean confirmBytes(long confirmedTotal) {
        if (status.isTerminal()) {
            return false;
        }
        long bytes = bytesTransferred.accumulateAndGet(Math.min(confirmedTotal, fileSize), Math::max);
        int next = bytes >= fileSize ? 100 : (int) Math.min(99, bytes * 100 / fileSize);
        this.updatedAt = Instant.now();
        if (next > progress) {
            progress = next;
            return true;
        }
        return false;
    }

    public String getChecksum() {
        return checksum;
    }

    public void setChecksum(String checksum) {
        this.checksum = checksum;
    }

    public double getTransferSpeed() {
        return transferSpeed;
    }

    public void setTransferSpeed(double bytesPerSecond) {
        this.transferSpeed = bytesPerSecond;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public void setChunkSize(int chunkSize) {
        this.chunkSize = chunkSize;
    }

    public Duration getDuration() {
        Instant end = finishedAt;
        if (end == null) {
            end = status.isTerminal() ? updatedAt : Instant.now();
        }
        return Duration.between(createdAt, end);
    }

    public TransferRecord snapshot() {
        TransferRecord copy = new TransferRecord(id, fileName, fileSize, fileType, sender, receiver, direction,
                useFec, createdAt);
        copy.bytesTransferred.set(bytesTransferred.get());
        copy.status = status;
        copy.progress = progress;
        copy.checksum = checksum;
        copy.transferSpeed = transferSpeed;
        copy.chunkSize = chunkSize;
        copy.updatedAt = updatedAt;
        copy.finishedAt = finishedAt;
        return copy;
    }

    @Override
    public String toString() {
        return "TransferRecord{" +
                "id='" + id + '\'' +
                ", fileName='" + fileName + '\'' +
                ", direction=" + direction +
                ", status=" + status +
                ", progress=" + progress +
                '}';
    }
}
