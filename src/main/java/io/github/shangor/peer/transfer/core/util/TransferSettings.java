package io.github.shangor.peer.transfer.core.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Tunables of the transfer engine.
 *
 * <p>{@link #load()} reads the bundled {@code peer-transfer.properties}, then
 * {@code ~/.peer-transfer/settings.properties}, then {@code peer.transfer.*} system properties;
 * later sources win. Unparseable values fall back to the defaults.
 */
public record TransferSettings(int defaultChunkSize,
                               int minChunkSize,
                               int maxChunkSize,
                               boolean adaptiveChunking,
                               boolean fecEnabled,
                               double fecParityRatio,
                               int fecBlockChunks,
                               boolean compressionEnabled,
                               long maxFileSize,
                               long memoryBufferThreshold,
                               Path tempDir,
                               boolean pacingEnabled) {
    private static final Logger log = LoggerFactory.getLogger(TransferSettings.class);

    public static final String CLASSPATH_RESOURCE = "peer-transfer.properties";
    public static final String SYSTEM_PREFIX = "peer.transfer.";
    private static final Path USER_FILE = Path.of(System.getProperty("user.home"), ".peer-transfer",
            "settings.properties");

    public static final int DEFAULT_CHUNK_SIZE = 1024 * 1024;
    public static final int MIN_CHUNK_SIZE = 256 * 1024;
    public static final int MAX_CHUNK_SIZE = 4 * 1024 * 1024;
    public static final double DEFAULT_PARITY_RATIO = 0.2;
    public static final int DEFAULT_BLOCK_CHUNKS = 8;
    public static final long DEFAULT_MAX_FILE_SIZE = 4L * 1024 * 1024 * 1024;
    public static final long DEFAULT_MEMORY_THRESHOLD = 64L * 1024 * 1024;

    public TransferSettings {
        if (minChunkSize <= 0 || maxChunkSize < minChunkSize) {
            throw new IllegalArgumentException("Invalid chunk size bounds [" + minChunkSize + ", " + maxChunkSize + "]");
        }
        if (defaultChunkSize < minChunkSize || defaultChunkSize > maxChunkSize) {
            throw new IllegalArgumentException("Default chunk size " + defaultChunkSize + " outside ["
                    + minChunkSize + ", " + maxChunkSize + "]");
        }
        if (fecParityRatio < 0.0 || fecParityRatio > 1.0 || Double.isNaN(fecParityRatio)) {
            throw new IllegalArgumentException("FEC parity ratio out of range: " + fecParityRatio);
        }
        if (fecBlockChunks <= 0) {
            throw new IllegalArgumentException("FEC block must hold at least one chunk: " + fecBlockChunks);
        }
        if (maxFileSize <= 0) {
            throw new IllegalArgumentException("Max file size must be positive: " + maxFileSize);
        }
    }

    public static TransferSettings defaults() {
        return fromProperties(new Properties());
    }

    public static TransferSettings load() {
        Properties props = new Properties();
        try (InputStream in = TransferSettings.class.getClassLoader().getResourceAsStream(CLASSPATH_RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            log.warn("Failed to load bundled settings {}", CLASSPATH_RESOURCE, e);
        }
        props.putAll(loadProps(USER_FILE));
        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith(SYSTEM_PREFIX)) {
                props.setProperty(key.substring(SYSTEM_PREFIX.length()), System.getProperty(key));
            }
        }
        return fromProperties(props);
    }

    public static TransferSettings fromProperties(Properties props) {
        int min = (int) parseLong(props, "chunk.size.min", MIN_CHUNK_SIZE);
        int max = (int) parseLong(props, "chunk.size.max", MAX_CHUNK_SIZE);
        if (max < min) {
            log.warn("chunk.size.max {} below chunk.size.min {}, using defaults", max, min);
            min = MIN_CHUNK_SIZE;
            max = MAX_CHUNK_SIZE;
        }
        int chunk = (int) Math.max(min, Math.min(max, parseLong(props, "chunk.size.default", DEFAULT_CHUNK_SIZE)));
        double ratio = parseDouble(props, "fec.parity.ratio", DEFAULT_PARITY_RATIO);
        if (ratio < 0.0 || ratio > 1.0) {
            log.warn("fec.parity.ratio {} out of range, using {}", ratio, DEFAULT_PARITY_RATIO);
            ratio = DEFAULT_PARITY_RATIO;
        }
        String tempDir = props.getProperty("temp.dir", "");
        return new TransferSettings(
                chunk,
                min,
                max,
                parseBoolean(props, "chunk.adaptive", true),
                parseBoolean(props, "fec.enabled", true),
                ratio,
                (int) Math.max(1, parseLong(props, "fec.block.chunks", DEFAULT_BLOCK_CHUNKS)),
                parseBoolean(props, "compression.enabled", true),
                Math.max(1, parseLong(props, "max.file.size", DEFAULT_MAX_FILE_SIZE)),
                parseLong(props, "memory.buffer.threshold", DEFAULT_MEMORY_THRESHOLD),
                tempDir.isBlank() ? Path.of(System.getProperty("java.io.tmpdir")) : Path.of(tempDir.trim()),
                parseBoolean(props, "pacing.enabled", true));
    }

    private static Properties loadProps(Path file) {
        Properties props = new Properties();
        if (Files.exists(file)) {
            try (InputStream in = Files.newInputStream(file)) {
                props.load(in);
            } catch (IOException e) {
                log.warn("Failed to load settings from {}", file, e);
            }
        }
        return props;
    }

    private static long parseLong(Properties props, String key, long defaultValue) {
        String text = props.getProperty(key);
        if (text == null || text.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(text.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring invalid value '{}' for {}", text, key);
            return defaultValue;
        }
    }

    private static double parseDouble(Properties props, String key, double defaultValue) {
        String text = props.getProperty(key);
        if (text == null || text.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(text.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring invalid value '{}' for {}", text, key);
            return defaultValue;
        }
    }

    private static boolean parseBoolean(Properties props, String key, boolean defaultValue) {
        String text = props.getProperty(key);
        if (text == null || text.isBlank()) {
            return defaultValue;
        }
        return Boolean.parseBoolean(text.trim());
    }
}
