package io.github.shangor.peer.transfer.core.io;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class SliceReaderTest {

    @TempDir
    Path tempDir;

    private final ExecutorService worker = Executors.newSingleThreadExecutor();

    @AfterEach
    void tearDown() {
        worker.shutdownNow();
    }

    @Test
    void readsSlicesOfFile() throws Exception {
        Path file = tempDir.resolve("data.bin");
        Files.write(file, new byte[]{0, 1, 2, 3, 4, 5, 6, 7, 8, 9});
        try (PathFileSource source = new PathFileSource(file)) {
            SliceReader reader = new SliceReader(source, worker);

            assertEquals("data.bin", source.name());
            assertEquals(10, source.size());
            assertArrayEquals(new byte[]{3, 4, 5}, reader.read(3, 3).get());
            assertArrayEquals(new byte[]{8, 9}, reader.read(8, 5).get());
        }
    }

    @Test
    void readErrorCompletesFutureExceptionally() throws Exception {
        Path file = tempDir.resolve("gone.bin");
        Files.write(file, new byte[4]);
        PathFileSource source = new PathFileSource(file);
        source.close();

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> new SliceReader(source, worker).read(0, 4).get());
        assertTrue(e.getCause() instanceof UncheckedIOException);
    }

    @Test
    void directoryIsNotASource() {
        assertThrows(IOException.class, () -> new PathFileSource(tempDir));
    }

    @Test
    void byteArraySourceReturnsShortTail() throws IOException {
        ByteArrayFileSource source = new ByteArrayFileSource("a.bin", null, new byte[]{1, 2, 3});
        assertArrayEquals(new byte[]{2, 3}, source.readSlice(1, 10));
        assertEquals(0, source.readSlice(5, 1).length);
        assertEquals("application/octet-stream", source.mimeType());
    }
}
