package io.cryptomm.engine.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LogRetentionConfigTest {

    @TempDir
    Path logDir;

    private Path sessionLog(String name, long modifiedMillis) throws IOException {
        Path file = Files.writeString(logDir.resolve(name), "x");
        Files.setLastModifiedTime(file, FileTime.fromMillis(modifiedMillis));
        return file;
    }

    private LogRetentionConfig retention(int keep) {
        EngineProperties properties = new EngineProperties();
        properties.getLogging().setDirectory(logDir.toString());
        properties.getLogging().setMaxSessionFiles(keep);
        return new LogRetentionConfig(properties);
    }

    @Test
    void testKeepNewestSessionLogs() throws IOException {
        Path oldest = sessionLog("engine_20260101_000000.log", 1_000L);
        Path middle = sessionLog("engine_20260102_000000.log", 2_000L);
        Path newest = sessionLog("engine_20260103_000000.log", 3_000L);
        Path unrelated = sessionLog("gc.log", 500L);

        retention(2).pruneSessionLogs();

        assertFalse(Files.exists(oldest));
        assertTrue(Files.exists(middle));
        assertTrue(Files.exists(newest));
        assertTrue(Files.exists(unrelated));
    }

    @Test
    void testMissingLogDirectory() {
        EngineProperties properties = new EngineProperties();
        properties.getLogging().setDirectory(logDir.resolve("absent").toString());

        new LogRetentionConfig(properties).pruneSessionLogs();

        assertFalse(Files.exists(logDir.resolve("absent")));
    }

    @Test
    void testSessionLogNamePattern() {
        assertTrue(LogRetentionConfig.isSessionLog(Path.of("engine_1.log")));
        assertFalse(LogRetentionConfig.isSessionLog(Path.of("engine_1.log.gz")));
        assertFalse(LogRetentionConfig.isSessionLog(Path.of("other_1.log")));
    }
}
