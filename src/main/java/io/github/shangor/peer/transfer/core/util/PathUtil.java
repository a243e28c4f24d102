package io.github.shangor.peer.transfer.core.util;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility class for turning names received from a peer into safe local file names.
 */
public final class PathUtil {
    private static final String FALLBACK_NAME = "file";
    private static final int MAX_NAME_LENGTH = 200;

    private PathUtil() {
    }

    /**
     * Normalizes path separators to forward slashes and drops leading slashes, so the
     * result is a relative path regardless of the sender's platform.
     */
    public static String normalizePathSeparators(String path) {
        if (path == null || path.isEmpty()) {
            return path;
        }
        String normalized = path.replace('\\', '/');
        normalized = normalized.replaceAll("/+", "/");
        while (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        return normalized;
    }

    /**
     * Reduces a remote file name to a single path element: directories are stripped, control
     * and reserved characters become underscores and leading dots are removed.
     *
     * @return a non-empty name that cannot escape the directory it is resolved against
     */
    public static String sanitizeFileName(String name) {
        String normalized = normalizePathSeparators(name);
        if (normalized == null || normalized.isEmpty()) {
            return FALLBACK_NAME;
        }
        int slash = normalized.lastIndexOf('/');
        String base = slash >= 0 ? normalized.substring(slash + 1) : normalized;
        StringBuilder sb = new StringBuilder(base.length());
        for (int i = 0; i < base.length(); i++) {
            char c = base.charAt(i);
            if (c < 0x20 || c == 0x7F || "<>:\"|?*".indexOf(c) >= 0) {
                sb.append('_');
            } else {
                sb.append(c);
            }
        }
        String cleaned = sb.toString().trim();
        while (cleaned.startsWith(".")) {
            cleaned = cleaned.substring(1);
        }
        if (cleaned.isEmpty()) {
            return FALLBACK_NAME;
        }
        return cleaned.length() > MAX_NAME_LENGTH ? cleaned.substring(0, MAX_NAME_LENGTH) : cleaned;
    }

    /**
     * Resolves {@code name} inside {@code directory}, appending {@code (1)}, {@code (2)}, ...
     * before the extension while the target already exists.
     */
    public static Path uniqueTarget(Path directory, String name) {
        String safe = sanitizeFileName(name);
        Path candidate = directory.resolve(safe);
        if (!Files.exists(candidate)) {
            return candidate;
        }
        int dot = safe.lastIndexOf('.');
        String stem = dot > 0 ? safe.substring(0, dot) : safe;
        String ext = dot > 0 ? safe.substring(dot) : "";
        for (int i = 1; ; i++) {
            candidate = directory.resolve(stem + " (" + i + ")" + ext);
            if (!Files.exists(candidate)) {
                return candidate;
            }
        }
    }
}
