package org.netpreserve.archivescope;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ArchiveScopeTest {
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String... args) {
        return ArchiveScope.run(args, new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private Path config(Path dir) throws IOException {
        Path file = dir.resolve("archivescope.yaml");
        Files.writeString(file, "cache:\n  directory: " + dir.resolve("cache") + "\n");
        return file;
    }

    @Test
    public void helpAndUsageErrors() {
        assertEquals(0, run("--help"));
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("Usage: archivescope"));

        assertEquals(1, run("--bogus"));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Unknown option: --bogus"));

        assertEquals(1, run("--sample-size"));
        assertEquals(1, run("--match", "fuzzy", "search", "x"));
        assertEquals(1, run());
    }

    @Test
    public void dumpsTheEffectiveConfig(@TempDir Path dir) throws IOException {
        assertEquals(0, run("-c", config(dir).toString(), "--dump-config"));
        String yaml = out.toString(StandardCharsets.UTF_8);
        assertTrue(yaml.contains(dir.resolve("cache").toString()), yaml);
        assertTrue(yaml.contains("commoncrawl"), yaml);
    }

    @Test
    public void rejectsBadConfig(@TempDir Path dir) {
        assertEquals(1, run("-c", dir.resolve("nope.yaml").toString(), "snapshots"));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Config file not found"));
    }

    @Test
    public void cacheCommandsWorkOffline(@TempDir Path dir) throws IOException {
        Path config = config(dir);
        assertEquals(0, run("-c", config.toString(), "cache-stats"));
        String json = out.toString(StandardCharsets.UTF_8);
        assertTrue(json.contains("\"entryCount\" : 0"), json);
        assertTrue(Files.exists(dir.resolve("cache").resolve("cache_metadata.sqlite3")));

        assertEquals(0, run("-c", config.toString(), "cache-clear"));
        assertEquals(1, run("-c", config.toString(), "frobnicate"));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Unknown command: frobnicate"));
        assertEquals(1, run("-c", config.toString(), "compare", "example.com"));
    }
}
