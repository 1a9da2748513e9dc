package com.marketsim.emulator.config;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Removes old per-session log files at startup, keeping the newest ones.
 */
@Slf4j
@Configuration
public class LogCleanupConfig {

    static final int MAX_LOG_FILES = 50;
    private static final String LOG_FILE_PREFIX = "marketsim_";
    private static final String LOG_FILE_SUFFIX = ".log";

    private final Path logDir;

    public LogCleanupConfig() {
        this(Paths.get("logs"));
    }

    LogCleanupConfig(Path logDir) {
        this.logDir = logDir;
    }

    @PostConstruct
    public void cleanupOldLogs() {
        cleanup();
    }

    /**
     * @return number of files deleted
     */
    int cleanup() {
        if (!Files.exists(logDir)) {
            log.debug("Logs directory does not exist yet: {}", logDir.toAbsolutePath());
            return 0;
        }

        List<Path> sessionLogs;
        try (Stream<Path> files = Files.list(logDir)) {
            sessionLogs = files
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().startsWith(LOG_FILE_PREFIX))
                    .filter(p -> p.getFileName().toString().endsWith(LOG_FILE_SUFFIX))
                    .sorted(Comparator.comparingLong(LogCleanupConfig::lastModified).reversed())
                    .toList();
        } catch (IOException e) {
            log.warn("Failed to list session logs in {}: {}", logDir, e.getMessage());
            return 0;
        }

        if (sessionLogs.size() <= MAX_LOG_FILES) {
            log.debug("Session log count ({}) within limit ({})", sessionLogs.size(), MAX_LOG_FILES);
            return 0;
        }
        log.info("Found {} session logs, removing the {} oldest", sessionLogs.size(),
                sessionLogs.size() - MAX_LOG_FILES);
        int deleted = 0;
        for (Path old : sessionLogs.subList(MAX_LOG_FILES, sessionLogs.size())) {
            try {
                Files.delete(old);
                deleted++;
            } catch (IOException e) {
                log.warn("Failed to delete old log {}: {}", old.getFileName(), e.getMessage());
            }
        }
        return deleted;
    }

    private static long lastModified(Path path) {
        try {
            return Files.getLastModifiedTime(path).toMillis();
        } catch (IOException e) {
            log.debug("Cannot read mtime of {}: {}", path, e.getMessage());
            return 0L;
        }
    }
}
