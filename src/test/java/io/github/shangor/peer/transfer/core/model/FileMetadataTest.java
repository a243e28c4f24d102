package io.github.shangor.peer.transfer.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FileMetadataTest {

    @Test
    void checksumIsSetOnce() {
        FileMetadata metadata = new FileMetadata("id", "a.txt", 10, "text/plain", null, true, 0.2, false);
        assertFalse(metadata.hasChecksum());

        metadata.setChecksum("ABCD");
        metadata.setChecksum("abcd");

        assertEquals("ABCD", metadata.getChecksum());
        assertThrows(IllegalStateException.class, () -> metadata.setChecksum("ef01"));
    }

    @Test
    void ratioIgnoredWithoutFec() {
        FileMetadata metadata = new FileMetadata("id", "a.bin", 10, null, "", false, 0.5, false);
        assertEquals(0.0, metadata.getFecParityRatio());
        assertEquals("", metadata.getMimeType());
        assertNull(metadata.getChecksum());
    }

    @Test
    void invalidValuesRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new FileMetadata("id", "a", 0, null, null, false, 0, false));
        assertThrows(IllegalArgumentException.class,
                () -> new FileMetadata("id", "a", 10, null, null, true, 1.5, false));
        assertThrows(NullPointerException.class,
                () -> new FileMetadata(null, "a", 10, null, null, false, 0, false));
    }
}
