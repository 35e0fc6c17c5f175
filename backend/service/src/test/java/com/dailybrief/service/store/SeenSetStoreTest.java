package com.dailybrief.service.store;

import com.dailybrief.core.util.JsonUtils;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class SeenSetStoreTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-19T01:00:00Z"), ZoneOffset.UTC);

    @Test
    void missingFileLoadsAsEmpty() throws Exception {
        Path dir = Files.createTempDirectory("seen-missing-");

        SeenSet seen = new SeenSetStore(dir.resolve("sent_urls.json"), CLOCK).load();

        assertEquals(0, seen.size());
    }

    @Test
    void corruptOrIncompleteFileLoadsAsEmpty() throws Exception {
        Path dir = Files.createTempDirectory("seen-corrupt-");
        Path corrupt = dir.resolve("corrupt.json");
        Files.writeString(corrupt, "{\"sent_urls\": [\"abc\",", StandardCharsets.UTF_8);
        Path wrongShape = dir.resolve("wrong-shape.json");
        Files.writeString(wrongShape, "{\"something_else\": true}", StandardCharsets.UTF_8);
        Path literalNull = dir.resolve("null.json");
        Files.writeString(literalNull, "null", StandardCharsets.UTF_8);

        assertEquals(0, new SeenSetStore(corrupt, CLOCK).load().size());
        assertEquals(0, new SeenSetStore(wrongShape, CLOCK).load().size());
        assertEquals(0, new SeenSetStore(literalNull, CLOCK).load().size());
    }

    @Test
    void readsFilesWrittenByEarlierVersions() throws Exception {
        Path file = Files.createTempDirectory("seen-legacy-").resolve("sent_urls.json");
        Files.writeString(file, """
                {
                  "sent_urls": ["5d41402abc4b2a76b9719d911017c592", "", "7d793037a0760186574b0282f2f435e7"],
                  "updated_at": "2026-10-18T09:30:12.345678"
                }
                """, StandardCharsets.UTF_8);

        SeenSet seen = new SeenSetStore(file, CLOCK).load();

        assertEquals(2, seen.size());
        assertTrue(seen.contains("5d41402abc4b2a76b9719d911017c592"));
    }

    @Test
    void flushWritesSortedFingerprintsAndReloads() throws Exception {
        Path file = Files.createTempDirectory("seen-flush-").resolve("state/sent_urls.json");
        SeenSetStore store = new SeenSetStore(file, CLOCK);
        SeenSet seen = SeenSet.empty();
        seen.add("ffff");
        seen.add("0000");
        seen.add("aaaa");

        store.flush(seen);

        JsonNode written = JsonUtils.objectMapper().readTree(file.toFile());
        List<String> urls = List.of(
                written.path("sent_urls").path(0).asText(),
                written.path("sent_urls").path(1).asText(),
                written.path("sent_urls").path(2).asText()
        );
        assertEquals(List.of("0000", "aaaa", "ffff"), urls);
        assertEquals("2026-10-19T01:00:00Z", written.path("updated_at").asText());
        assertEquals(Set.of("0000", "aaaa", "ffff"), store.load().snapshot());
    }

    @Test
    void flushReplacesPreviousContentAndLeavesNoTempFiles() throws Exception {
        Path dir = Files.createTempDirectory("seen-replace-");
        Path file = dir.resolve("sent_urls.json");
        SeenSetStore store = new SeenSetStore(file, CLOCK);

        SeenSet first = store.load();
        first.add("one");
        store.flush(first);
        SeenSet second = store.load();
        second.add("two");
        store.flush(second);

        assertEquals(Set.of("one", "two"), store.load().snapshot());
        try (Stream<Path> files = Files.list(dir)) {
            assertEquals(List.of(file.getFileName().toString()),
                    files.map(path -> path.getFileName().toString()).toList());
        }
    }

    @Test
    void flushKeepsExistingFilePermissions() throws Exception {
        Path dir = Files.createTempDirectory("seen-perms-");
        assumeTrue(Files.getFileStore(dir).supportsFileAttributeView(PosixFileAttributeView.class));
        Path file = dir.resolve("sent_urls.json");
        Files.writeString(file, "{\"sent_urls\": []}", StandardCharsets.UTF_8);
        Set<PosixFilePermission> shared = PosixFilePermissions.fromString("rw-rw-r--");
        Files.setPosixFilePermissions(file, shared);
        SeenSet seen = SeenSet.empty();
        seen.add("abcd");

        new SeenSetStore(file, CLOCK).flush(seen);

        assertEquals(shared, Files.getPosixFilePermissions(file));
        assertEquals(Set.of("abcd"), new SeenSetStore(file, CLOCK).load().snapshot());
    }

    @Test
    void flushFailureNamesTheFile() throws Exception {
        Path dir = Files.createTempDirectory("seen-blocked-");
        Path target = dir.resolve("sent_urls.json");
        Files.createDirectories(target.resolve("occupied"));

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> new SeenSetStore(target, CLOCK).flush(SeenSet.empty()));

        assertTrue(ex.getMessage().contains("Failed writing dedup state to"));
        assertTrue(ex.getMessage().contains("sent_urls.json"));
        assertTrue(Files.isDirectory(target));
    }

    @Test
    void snapshotIsDetachedFromLaterAdds() {
        SeenSet seen = new SeenSet(Set.of("a"));
        Set<String> snapshot = seen.snapshot();

        assertTrue(seen.add("b"));
        assertFalse(seen.add("a"));

        assertEquals(Set.of("a"), snapshot);
        assertEquals(2, seen.size());
    }
}
