package com.marketsim.emulator.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LogCleanupConfigTest {

    @TempDir
    Path logDir;

    private Path sessionLog(int index) throws Exception {
        Path file = Files.createFile(logDir.resolve("marketsim_" + index + ".log"));
        Files.setLastModifiedTime(file, FileTime.fromMillis(1_700_000_000_000L + index * 1000L));
        return file;
    }

    @Test
    void testKeepsNewestSessionLogs() throws Exception {
        Path oldest = sessionLog(0);
        Path secondOldest = sessionLog(1);
        for (int i = 2; i < LogCleanupConfig.MAX_LOG_FILES + 2; i++) {
            sessionLog(i);
        }
        Path unrelated = Files.createFile(logDir.resolve("other.log"));

        int deleted = new LogCleanupConfig(logDir).cleanup();

        assertEquals(2, deleted);
        assertFalse(Files.exists(oldest));
        assertFalse(Files.exists(secondOldest));
        assertTrue(Files.exists(unrelated));
        try (Stream<Path> files = Files.list(logDir)) {
            assertEquals(LogCleanupConfig.MAX_LOG_FILES + 1, files.count());
        }
    }

    @Test
    void testNothingToDoWithinLimit() throws Exception {
        sessionLog(0);

        assertEquals(0, new LogCleanupConfig(logDir).cleanup());
    }

    @Test
    void testMissingDirectoryIgnored() {
        assertEquals(0, new LogCleanupConfig(logDir.resolve("absent")).cleanup());
    }
}
