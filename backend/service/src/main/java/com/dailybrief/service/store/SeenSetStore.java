package com.dailybrief.service.store;

import com.dailybrief.core.util.JsonUtils;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON file holding delivered fingerprints: {@code {"sent_urls": [...], "updated_at": "..."}}.
 *
 * <p>Loading never fails: a missing, unreadable or malformed file reads as an empty set, because a broken
 * dedup file must not stop the digest from going out. Flushing rewrites the whole file through a temp file
 * in the same directory and a rename, so a reader sees either the old or the new content.
 */
public class SeenSetStore {
    private static final Logger LOGGER = Logger.getLogger(SeenSetStore.class.getName());
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final Path file;
    private final Clock clock;

    public SeenSetStore(Path file, Clock clock) {
        this.file = file;
        this.clock = clock;
    }

    public SeenSet load() {
        if (!Files.exists(file)) {
            LOGGER.info(() -> "No dedup state at " + file + ", starting empty");
            return SeenSet.empty();
        }
        try (InputStream in = Files.newInputStream(file)) {
            SeenFile loaded = MAPPER.readValue(in, SeenFile.class);
            if (loaded == null || loaded.sentUrls() == null) {
                LOGGER.warning(() -> "Dedup state " + file + " has no sent_urls, starting empty");
                return SeenSet.empty();
            }
            Set<String> fingerprints = new LinkedHashSet<>();
            for (String fingerprint : loaded.sentUrls()) {
                if (fingerprint != null && !fingerprint.isBlank()) {
                    fingerprints.add(fingerprint);
                }
            }
            LOGGER.info(() -> "Loaded " + fingerprints.size() + " delivered fingerprints from " + file);
            return new SeenSet(fingerprints);
        } catch (IOException | RuntimeException e) {
            LOGGER.log(Level.WARNING, "Unreadable dedup state " + file + ", starting empty", e);
            return SeenSet.empty();
        }
    }

    public void flush(SeenSet seen) {
        Path target = file.toAbsolutePath();
        Path dir = target.getParent();
        Path temp = null;
        try {
            Files.createDirectories(dir);
            temp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
            List<String> sorted = seen.snapshot().stream().sorted().toList();
            try (OutputStream out = Files.newOutputStream(temp)) {
                JsonUtils.prettyWriter().writeValue(out, new SeenFile(sorted, clock.instant().toString()));
            }
            copyPermissions(target, temp);
            moveIntoPlace(temp, target);
            LOGGER.info(() -> "Saved " + sorted.size() + " delivered fingerprints to " + file);
        } catch (IOException e) {
            throw new IllegalStateException("Failed writing dedup state to " + file, e);
        } finally {
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException e) {
                    LOGGER.log(Level.FINE, "Could not remove temp file " + temp, e);
                }
            }
        }
    }

    // createTempFile makes the file owner-only; the rewritten file keeps the permissions it had before.
    private static void copyPermissions(Path existing, Path temp) throws IOException {
        if (!Files.exists(existing)
                || !Files.getFileStore(temp).supportsFileAttributeView(PosixFileAttributeView.class)) {
            return;
        }
        Files.setPosixFilePermissions(temp, Files.getPosixFilePermissions(existing));
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    // updated_at stays a string: older files carry a zone-less local timestamp.
    record SeenFile(
            @JsonProperty("sent_urls") List<String> sentUrls,
            @JsonProperty("updated_at") String updatedAt
    ) {
    }
}
