package io.cryptomm.engine.config;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
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
 * Keeps only the newest {@code engine.logging.max-session-files} per-session
 * log files written by logback-spring.xml.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class LogRetentionConfig {
    static final String SESSION_PREFIX = "engine_";
    static final String SESSION_SUFFIX = ".log";

    private final EngineProperties properties;

    @PostConstruct
    public void pruneSessionLogs() {
        Path dir = Paths.get(properties.getLogging().getDirectory());
        int keep = properties.getLogging().getMaxSessionFiles();
        if (!Files.isDirectory(dir)) {
            log.debug("No log directory at {}", dir.toAbsolutePath());
            return;
        }

        List<Path> sessions;
        try (Stream<Path> files = Files.list(dir)) {
            sessions = files
                    .filter(Files::isRegularFile)
                    .filter(LogRetentionConfig::isSessionLog)
                    .sorted(Comparator.comparingLong(LogRetentionConfig::lastModified).reversed())
                    .toList();
        } catch (IOException e) {
            log.warn("Could not list {}: {}", dir, e.getMessage());
            return;
        }

        if (sessions.size() <= keep) {
            return;
        }
        log.info("Pruning {} of {} session logs in {}", sessions.size() - keep, sessions.size(), dir);
        for (Path old : sessions.subList(keep, sessions.size())) {
            try {
                Files.delete(old);
            } catch (IOException e) {
                log.warn("Could not delete {}: {}", old.getFileName(), e.getMessage());
            }
        }
    }

    static boolean isSessionLog(Path path) {
        String name = path.getFileName().toString();
        return name.startsWith(SESSION_PREFIX) && name.endsWith(SESSION_SUFFIX);
    }

    private static long lastModified(Path path) {
        try {
            return Files.getLastModifiedTime(path).toMillis();
        } catch (IOException e) {
            return 0L;
        }
    }
}
