package io.github.shangor.peer.transfer.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class PathUtilTest {

    @TempDir
    Path tempDir;

    @Test
    void normalizesSeparators() {
        assertEquals("a/b/c.txt", PathUtil.normalizePathSeparators("\\\\a\\b//c.txt"));
        assertNull(PathUtil.normalizePathSeparators(null));
    }

    @Test
    void sanitizeKeepsOnlyLastElement() {
        assertEquals("passwd", PathUtil.sanitizeFileName("../../etc/passwd"));
        assertEquals("evil.txt", PathUtil.sanitizeFileName("C:\\Windows\\evil.txt"));
        assertEquals("a_b_.txt", PathUtil.sanitizeFileName("a<b>.txt"));
    }

    @Test
    void sanitizeFallsBackForEmptyNames() {
        assertEquals("file", PathUtil.sanitizeFileName(""));
        assertEquals("file", PathUtil.sanitizeFileName(".."));
        assertEquals("file", PathUtil.sanitizeFileName("dir/"));
        assertEquals("hidden", PathUtil.sanitizeFileName(".hidden"));
    }

    @Test
    void sanitizeLimitsLength() {
        assertEquals(200, PathUtil.sanitizeFileName("x".repeat(500)).length());
    }

    @Test
    void uniqueTargetAvoidsExistingFiles() throws IOException {
        assertEquals(tempDir.resolve("report.pdf"), PathUtil.uniqueTarget(tempDir, "report.pdf"));

        Files.createFile(tempDir.resolve("report.pdf"));
        Files.createFile(tempDir.resolve("report (1).pdf"));

        assertEquals(tempDir.resolve("report (2).pdf"), PathUtil.uniqueTarget(tempDir, "report.pdf"));
        assertEquals(tempDir, PathUtil.uniqueTarget(tempDir, "../report.pdf").getParent());
    }
}
