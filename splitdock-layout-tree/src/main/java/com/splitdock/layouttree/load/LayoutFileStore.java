package com.splitdock.layouttree.load;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads and writes layout JSON files (UTF-8). Reads never throw: a missing or unreadable file is logged
 * and reported as empty. Writes create missing parent directories and fail when nothing was written.
 */
public final class LayoutFileStore {

    private static final Logger log = LoggerFactory.getLogger(LayoutFileStore.class);

    private LayoutFileStore() {
    }

    /**
     * @return file contents, or empty if the file does not exist, is not a regular file or cannot be read
     */
    public static Optional<String> read(Path file) {
        Objects.requireNonNull(file, "file");
        if (!Files.exists(file)) {
            log.warn("Layout file does not exist: {}", file);
            return Optional.empty();
        }
        if (!Files.isRegularFile(file)) {
            log.warn("Layout path is not a regular file: {}", file);
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.warn("Failed to read layout file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Writes {@code json} to {@code file}, replacing existing content.
     *
     * @throws IOException if the file cannot be opened or written, or ends up empty
     */
    public static void write(Path file, String json) throws IOException {
        Objects.requireNonNull(file, "file");
        byte[] bytes = (json != null ? json : "").getBytes(StandardCharsets.UTF_8);
        if (bytes.length == 0) {
            throw new IOException("Refusing to write empty layout to " + file);
        }
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(file, bytes);
        if (Files.size(file) == 0) {
            throw new IOException("Zero bytes written to " + file);
        }
        if (log.isDebugEnabled()) {
            log.debug("Layout file written | path={} | bytes={}", file, bytes.length);
        }
    }
}
