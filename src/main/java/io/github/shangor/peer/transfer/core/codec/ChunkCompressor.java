package io.github.shangor.peer.transfer.core.codec;

import io.github.shangor.peer.transfer.core.flow.ConnectionQuality;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Locale;
import java.util.Set;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

/**
 * Optional deflate encoding of data chunk payloads. A chunk is only sent compressed when that
 * saves at least 5% of its size.
 */
public class ChunkCompressor {
    public static final int MIN_SIZE_THRESHOLD = 1024;
    public static final double MAX_COMPRESSION_RATIO = 0.95;
    /** Upper bound on a single inflated chunk; no valid chunk comes close. */
    public static final int MAX_INFLATED_LENGTH = 64 * 1024 * 1024;

    private static final Set<String> COMPRESSIBLE_MIME_TYPES = Set.of(
            "text/plain", "text/html", "text/css", "text/javascript", "text/xml",
            "application/json", "application/xml", "application/javascript", "application/x-javascript",
            "application/svg+xml", "application/x-httpd-php", "application/x-sh");

    private static final Set<String> INCOMPRESSIBLE_EXTENSIONS = Set.of(
            ".zip", ".rar", ".7z", ".gz", ".bz2", ".tar", ".jpg", ".jpeg", ".png", ".gif", ".webp",
            ".mp3", ".mp4", ".avi", ".mov", ".mkv", ".webm", ".pdf", ".doc", ".docx", ".xls", ".xlsx");

    public record CompressedChunk(byte[] data, boolean compressed) {
    }

    public static boolean shouldCompress(String fileName, String mimeType, long fileSize) {
        if (fileSize < MIN_SIZE_THRESHOLD) {
            return false;
        }
        String lower = fileName == null ? "" : fileName.toLowerCase(Locale.ROOT);
        int dot = lower.lastIndexOf('.');
        if (dot >= 0 && INCOMPRESSIBLE_EXTENSIONS.contains(lower.substring(dot))) {
            return false;
        }
        String type = mimeType == null ? "" : mimeType.toLowerCase(Locale.ROOT);
        return COMPRESSIBLE_MIME_TYPES.contains(type) || type.startsWith("text/");
    }

    public static int levelFor(ConnectionQuality quality) {
        return switch (quality) {
            case FAST -> 9;
            case MEDIUM -> 6;
            case SLOW -> 3;
        };
    }

    public CompressedChunk compress(byte[] data, ConnectionQuality quality) {
        if (data.length < MIN_SIZE_THRESHOLD) {
            return new CompressedChunk(data, false);
        }
        Deflater deflater = new Deflater(levelFor(quality));
        try {
            deflater.setInput(data);
            deflater.finish();
            ByteArrayOutputStream out = new ByteArrayOutputStream(data.length / 2);
            byte[] buffer = new byte[8192];
            while (!deflater.finished()) {
                int n = deflater.deflate(buffer);
                out.write(buffer, 0, n);
                if (out.size() >= data.length * MAX_COMPRESSION_RATIO) {
                    return new CompressedChunk(data, false);
                }
            }
            return new CompressedChunk(out.toByteArray(), true);
        } finally {
            deflater.end();
        }
    }

    public byte[] decompress(byte[] data, int originalLength) throws IOException {
        if (originalLength < 0 || originalLength > MAX_INFLATED_LENGTH) {
            throw new IOException("Original length " + originalLength + " outside [0, " + MAX_INFLATED_LENGTH + "]");
        }
        Inflater inflater = new Inflater();
        try {
            inflater.setInput(data);
            byte[] out = new byte[originalLength];
            int total = 0;
            while (total < originalLength && !inflater.finished()) {
                int n = inflater.inflate(out, total, originalLength - total);
                if (n == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    break;
                }
                total += n;
            }
            if (total != originalLength || !inflater.finished()) {
                throw new IOException("Inflated " + total + " bytes, expected " + originalLength);
            }
            return out;
        } catch (DataFormatException e) {
            throw new IOException("Corrupt compressed chunk", e);
        } finally {
            inflater.end();
        }
    }
}
