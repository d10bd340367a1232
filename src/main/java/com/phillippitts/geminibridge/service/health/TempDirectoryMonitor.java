package com.phillippitts.geminibridge.service.health;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Periodically checks free space on the volume that holds per-request working directories.
 */
@Component
public class TempDirectoryMonitor {

    private static final Logger LOG = LogManager.getLogger(TempDirectoryMonitor.class);

    static final long WARN_BELOW_BYTES = 5L * 1024 * 1024 * 1024;
    static final long ERROR_BELOW_BYTES = 1L * 1024 * 1024 * 1024;

    enum Level { OK, LOW, CRITICAL }

    private final Path tempDir;

    @Autowired
    public TempDirectoryMonitor() {
        this(Path.of(System.getProperty("java.io.tmpdir")));
    }

    TempDirectoryMonitor(Path tempDir) {
        this.tempDir = tempDir;
    }

    @Scheduled(initialDelay = 60_000, fixedRate = 300_000)
    public void checkFreeSpace() {
        try {
            FileStore store = Files.getFileStore(tempDir);
            long usable = store.getUsableSpace();
            switch (classify(usable)) {
                case CRITICAL -> LOG.error("Temp directory {} critically low on space: {} MB free",
                        tempDir, usable / (1024 * 1024));
                case LOW -> LOG.warn("Temp directory {} low on space: {} MB free",
                        tempDir, usable / (1024 * 1024));
                default -> LOG.debug("Temp directory {} free space: {} MB", tempDir, usable / (1024 * 1024));
            }
        } catch (IOException e) {
            LOG.warn("Could not read free space for {}: {}", tempDir, e.getMessage());
        }
    }

    static Level classify(long usableBytes) {
        if (usableBytes < ERROR_BELOW_BYTES) {
            return Level.CRITICAL;
        }
        if (usableBytes < WARN_BELOW_BYTES) {
            return Level.LOW;
        }
        return Level.OK;
    }
}
