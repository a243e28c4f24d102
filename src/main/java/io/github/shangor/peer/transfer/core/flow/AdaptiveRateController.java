package io.github.shangor.peer.transfer.core.flow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Picks the size of the next chunk from recently observed throughput.
 *
 * <p>Throughput samples (MB/s) are kept in a sliding window of {@value #WINDOW_SIZE}. When the
 * window average is above {@value #FAST_THRESHOLD_MBPS} MB/s the chunk grows by
 * {@value #GROWTH_FACTOR}x, below {@value #SLOW_THRESHOLD_MBPS} MB/s it shrinks by the same
 * factor, otherwise it is left alone. The result is always within {@code [min, max]}.
 * One controller serves one transfer.
 */
public class AdaptiveRateController {
    private static final Logger log = LoggerFactory.getLogger(AdaptiveRateController.class);

    public static final int WINDOW_SIZE = 5;
    public static final double FAST_THRESHOLD_MBPS = 8.0;
    public static final double SLOW_THRESHOLD_MBPS = 1.0;
    public static final double GROWTH_FACTOR = 1.5;
    private static final double BYTES_PER_MB = 1024.0 * 1024.0;
    private static final long LARGE_FILE_THRESHOLD = 100L * 1024 * 1024;

    private final int minChunkSize;
    private final int maxChunkSize;
    private final int defaultChunkSize;
    private final Deque<Double> samples = new ArrayDeque<>(WINDOW_SIZE);
    private ConnectionQuality quality = ConnectionQuality.MEDIUM;

    public AdaptiveRateController(int minChunkSize, int maxChunkSize, int defaultChunkSize) {
        if (minChunkSize <= 0 || maxChunkSize < minChunkSize) {
            throw new IllegalArgumentException("Invalid chunk size bounds [" + minChunkSize + ", " + maxChunkSize + "]");
        }
        this.minChunkSize = minChunkSize;
        this.maxChunkSize = maxChunkSize;
        this.defaultChunkSize = clamp(defaultChunkSize);
    }

    /**
     * Chunk size to start a transfer with. Files below 1 MiB use the minimum size.
     */
    public int initialChunkSize(long fileSize) {
        if (fileSize < 1024 * 1024) {
            return minChunkSize;
        }
        return defaultChunkSize;
    }

    public synchronized int nextChunkSize(int current, long lastChunkBytes, long lastChunkElapsedMs) {
        if (lastChunkElapsedMs <= 0 || lastChunkBytes <= 0) {
            return clamp(current);
        }
        double mbps = (lastChunkBytes * 1000.0 / lastChunkElapsedMs) / BYTES_PER_MB;
        samples.addLast(mbps);
        while (samples.size() > WINDOW_SIZE) {
            samples.removeFirst();
        }
        double average = averageMbps();

        long next;
        if (average > FAST_THRESHOLD_MBPS) {
            next = Math.round(current * GROWTH_FACTOR);
            quality = ConnectionQuality.FAST;
        } else if (average < SLOW_THRESHOLD_MBPS) {
            next = Math.round(current / GROWTH_FACTOR);
            quality = ConnectionQuality.SLOW;
        } else {
            next = current;
            quality = ConnectionQuality.MEDIUM;
        }
        int adjusted = clamp(next);
        if (adjusted != current) {
            log.debug("Chunk size {} -> {} (avg {} MB/s, quality {})", current, adjusted,
                    String.format("%.2f", average), quality);
        }
        return adjusted;
    }

    public synchronized ConnectionQuality connectionQuality() {
        return quality;
    }

    public synchronized double smoothedBytesPerSecond() {
        return averageMbps() * BYTES_PER_MB;
    }

    public synchronized List<Double> recentRates() {
        return new ArrayList<>(samples);
    }

    /**
     * Delay to insert between chunks so that slow links are not flooded.
     */
    public synchronized long pacingDelayMillis(long fileSize) {
        boolean slow = quality == ConnectionQuality.SLOW;
        if (fileSize > LARGE_FILE_THRESHOLD) {
            return slow ? 50 : 10;
        }
        return slow ? 25 : 0;
    }

    public synchronized void reset() {
        samples.clear();
        quality = ConnectionQuality.MEDIUM;
    }

    public int minChunkSize() {
        return minChunkSize;
    }

    public int maxChunkSize() {
        return maxChunkSize;
    }

    private double averageMbps() {
        if (samples.isEmpty()) {
            return 0.0;
        }
        double sum = 0;
        for (double s : samples) {
            sum += s;
        }
        return sum / samples.size();
    }

    private int clamp(long size) {
        return (int) Math.max(minChunkSize, Math.min(maxChunkSize, size));
    }
}
