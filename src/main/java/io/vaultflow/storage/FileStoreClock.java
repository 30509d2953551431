package io.vaultflow.storage;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.UUID;

/**
 * Reads time as the shared filesystem stamps it: touches a per-process stamp file and returns
 * its modification time. Workers on different hosts that share the vault therefore agree on
 * "now" up to the file server's own clock.
 */
public final class FileStoreClock implements StoreClock {
    private final Path stamp;

    public FileStoreClock(Path clockDir) {
        this.stamp = clockDir.resolve("stamp-" + UUID.randomUUID() + ".tick");
    }

    @Override
    public Instant now() throws IOException {
        Files.createDirectories(stamp.getParent());
        synchronized (this) {
            Files.writeString(
                    stamp,
                    Long.toString(System.nanoTime()),
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE
            );
            return Files.getLastModifiedTime(stamp).toInstant();
        }
    }
}
