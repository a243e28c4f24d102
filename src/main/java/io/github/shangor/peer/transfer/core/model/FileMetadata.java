package io.github.shangor.peer.transfer.core.model;

import java.util.Objects;

/**
 * Describes one file offered for transfer. Everything except the checksum is fixed at
 * construction; the checksum is filled in once by the sender after the whole file has been
 * hashed.
 */
public class FileMetadata {
    private final String id;
    private final String name;
    private final long size;
    private final String mimeType;
    private final boolean useFec;
    private final double fecParityRatio;
    private final boolean compressed;
    private volatile String checksum;

    public FileMetadata(String id, String name, long size, String mimeType, String checksum,
                        boolean useFec, double fecParityRatio, boolean compressed) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = Objects.requireNonNull(name, "name");
        if (size <= 0) {
            throw new IllegalArgumentException("File size must be positive: " + size);
        }
        if (fecParityRatio < 0.0 || fecParityRatio > 1.0 || Double.isNaN(fecParityRatio)) {
            throw new IllegalArgumentException("FEC parity ratio out of range: " + fecParityRatio);
        }
        this.size = size;
        this.mimeType = mimeType == null ? "" : mimeType;
        this.checksum = checksum == null || checksum.isEmpty() ? null : checksum;
        this.useFec = useFec;
        this.fecParityRatio = useFec ? fecParityRatio : 0.0;
        this.compressed = compressed;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public long getSize() {
        return size;
    }

    public String getMimeType() {
        return mimeType;
    }

    public String getChecksum() {
        return checksum;
    }

    public boolean hasChecksum() {
        return checksum != null;
    }

    /**
     * Sets the whole-file checksum. It can be set only once; repeating the same value is
     * accepted.
     */
    public synchronized void setChecksum(String value) {
        Objects.requireNonNull(value, "checksum");
        if (checksum != null && !checksum.equalsIgnoreCase(value)) {
            throw new IllegalStateException("Checksum already set for " + id);
        }
        checksum = value;
    }

    public boolean isUseFec() {
        return useFec;
    }

    public double getFecParityRatio() {
        return fecParityRatio;
    }

    public boolean isCompressed() {
        return compressed;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FileMetadata)) return false;
        return id.equals(((FileMetadata) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "FileMetadata{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", size=" + size +
                ", mimeType='" + mimeType + '\'' +
                ", useFec=" + useFec +
                ", fecParityRatio=" + fecParityRatio +
                ", compressed=" + compressed +
                '}';
    }
}
