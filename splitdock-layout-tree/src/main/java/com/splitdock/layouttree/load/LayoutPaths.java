package com.splitdock.layouttree.load;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/** Locates the default layout directory. */
public final class LayoutPaths {

    private static final Logger log = LoggerFactory.getLogger(LayoutPaths.class);

    private LayoutPaths() {
    }

    /**
     * Walks up from {@code start} (inclusive) for at most {@code maxLevels} directories looking for a directory
     * that contains {@code marker}. Returns {@code start} (absolute) when no such directory is found.
     */
    public static Path findProjectRoot(Path start, String marker, int maxLevels) {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(marker, "marker");
        Path absoluteStart = start.toAbsolutePath().normalize();
        Path dir = absoluteStart;
        for (int i = 0; i < maxLevels && dir != null; i++) {
            if (Files.exists(dir.resolve(marker))) {
                return dir;
            }
            dir = dir.getParent();
        }
        return absoluteStart;
    }

    /** Creates {@code dir} and missing parents. Returns false (and logs) when it cannot be created. */
    public static boolean ensureDirectoryExists(Path dir) {
        Objects.requireNonNull(dir, "dir");
        if (Files.isDirectory(dir)) return true;
        try {
            Files.createDirectories(dir);
            return true;
        } catch (IOException e) {
            log.warn("Failed to create layout directory {}: {}", dir, e.getMessage());
            return false;
        }
    }
}
