package com.phillippitts.geminibridge.service.cli;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Request-scoped temporary directory used as the CLI's working directory.
 *
 * <p>Use with try-with-resources; {@link #close()} deletes the directory tree and only logs
 * failures, since a leftover directory does not affect the result already obtained.
 */
public final class WorkingDirectory implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(WorkingDirectory.class);

    private final Path path;

    private WorkingDirectory(Path path) {
        this.path = path;
    }

    /**
     * Creates a uniquely named directory under the system temp directory.
     *
     * @param prefix configured directory prefix
     * @param requestId request id; characters outside {@code [A-Za-z0-9._-]} are replaced
     * @return the created directory
     * @throws IOException if the directory cannot be created
     */
    public static WorkingDirectory create(String prefix, String requestId) throws IOException {
        return create(Path.of(System.getProperty("java.io.tmpdir")), prefix, requestId);
    }

    static WorkingDirectory create(Path parent, String prefix, String requestId) throws IOException {
        String safeId = sanitize(requestId);
        Path dir = Files.createTempDirectory(parent, prefix + safeId + "-");
        return new WorkingDirectory(dir);
    }

    static String sanitize(String requestId) {
        if (requestId == null || requestId.isBlank()) {
            return "anon";
        }
        String cleaned = requestId.replaceAll("[^A-Za-z0-9._-]", "_");
        return cleaned.length() > 64 ? cleaned.substring(0, 64) : cleaned;
    }

    public Path path() {
        return path;
    }

    @Override
    public void close() {
        if (!Files.exists(path)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(path)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (IOException | UncheckedIOException e) {
            LOG.warn("Failed to cleanup temp directory {}: {}", path, e.toString());
        }
    }
}
