package com.phillippitts.geminibridge.service.health;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class TempDirectoryMonitorTest {

    @Test
    void classifiesFreeSpace() {
        assertThat(TempDirectoryMonitor.classify(10L * 1024 * 1024 * 1024)).isEqualTo(TempDirectoryMonitor.Level.OK);
        assertThat(TempDirectoryMonitor.classify(TempDirectoryMonitor.WARN_BELOW_BYTES - 1))
                .isEqualTo(TempDirectoryMonitor.Level.LOW);
        assertThat(TempDirectoryMonitor.classify(TempDirectoryMonitor.ERROR_BELOW_BYTES - 1))
                .isEqualTo(TempDirectoryMonitor.Level.CRITICAL);
        assertThat(TempDirectoryMonitor.classify(TempDirectoryMonitor.WARN_BELOW_BYTES))
                .isEqualTo(TempDirectoryMonitor.Level.OK);
    }

    @Test
    void checkRunsAgainstRealDirectory(@TempDir Path dir) {
        assertThatCode(() -> new TempDirectoryMonitor(dir).checkFreeSpace()).doesNotThrowAnyException();
    }

    @Test
    void missingDirectoryIsLoggedNotThrown(@TempDir Path dir) {
        assertThatCode(() -> new TempDirectoryMonitor(dir.resolve("missing")).checkFreeSpace())
                .doesNotThrowAnyException();
    }
}
