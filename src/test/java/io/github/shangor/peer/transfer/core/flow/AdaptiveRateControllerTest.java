package io.github.shangor.peer.transfer.core.flow;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AdaptiveRateControllerTest {

    private static final int KIB = 1024;
    private static final int MIB = 1024 * KIB;

    private final AdaptiveRateController controller = new AdaptiveRateController(256 * KIB, 4 * MIB, MIB);

    @Test
    void fastLinkGrowsChunk() {
        // 10 MiB in 100 ms is 100 MB/s
        int next = controller.nextChunkSize(MIB, 10L * MIB, 100);
        assertEquals(Math.round(MIB * AdaptiveRateController.GROWTH_FACTOR), next);
        assertEquals(ConnectionQuality.FAST, controller.connectionQuality());
    }

    @Test
    void slowLinkShrinksChunk() {
        int next = controller.nextChunkSize(MIB, MIB, 2000);
        assertEquals(Math.round(MIB / AdaptiveRateController.GROWTH_FACTOR), next);
        assertEquals(ConnectionQuality.SLOW, controller.connectionQuality());
    }

    @Test
    void mediumLinkKeepsChunk() {
        // 4 MiB in 1 s
        assertEquals(MIB, controller.nextChunkSize(MIB, 4L * MIB, 1000));
        assertEquals(ConnectionQuality.MEDIUM, controller.connectionQuality());
    }

    @Test
    void sizeStaysWithinBounds() {
        int size = MIB;
        for (int i = 0; i < 20; i++) {
            size = controller.nextChunkSize(size, 100L * MIB, 10);
        }
        assertEquals(4 * MIB, size);

        controller.reset();
        for (int i = 0; i < 20; i++) {
            size = controller.nextChunkSize(size, KIB, 5000);
        }
        assertEquals(256 * KIB, size);
    }

    @Test
    void windowKeepsLastFiveSamples() {
        for (int i = 0; i < 8; i++) {
            controller.nextChunkSize(MIB, MIB, 1000);
        }
        assertEquals(AdaptiveRateController.WINDOW_SIZE, controller.recentRates().size());
        assertEquals(MIB, controller.smoothedBytesPerSecond(), 1.0);
    }

    @Test
    void windowAverageSmoothsSingleSpike() {
        for (int i = 0; i < 4; i++) {
            controller.nextChunkSize(MIB, 2L * MIB, 1000);
        }
        // one 30 MB/s sample among four at 2 MB/s averages 7.6 MB/s, below the fast threshold
        assertEquals(MIB, controller.nextChunkSize(MIB, 30L * MIB, 1000));
    }

    @Test
    void zeroElapsedIsIgnored() {
        assertEquals(MIB, controller.nextChunkSize(MIB, MIB, 0));
        assertEquals(MIB, controller.nextChunkSize(MIB, 0, 100));
        assertTrue(controller.recentRates().isEmpty());
    }

    @Test
    void initialChunkSizeDependsOnFileSize() {
        assertEquals(256 * KIB, controller.initialChunkSize(100 * KIB));
        assertEquals(MIB, controller.initialChunkSize(50L * MIB));
    }

    @Test
    void pacingDelayDependsOnQualityAndSize() {
        assertEquals(0, controller.pacingDelayMillis(MIB));
        assertEquals(10, controller.pacingDelayMillis(200L * MIB));
        controller.nextChunkSize(MIB, KIB, 5000);
        assertEquals(25, controller.pacingDelayMillis(MIB));
        assertEquals(50, controller.pacingDelayMillis(200L * MIB));
    }

    @Test
    void invalidBoundsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new AdaptiveRateController(0, MIB, MIB));
        assertThrows(IllegalArgumentException.class, () -> new AdaptiveRateController(MIB, KIB, MIB));
    }
}
