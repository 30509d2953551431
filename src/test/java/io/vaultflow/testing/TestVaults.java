package io.vaultflow.testing;

import io.vaultflow.config.VaultFlowSettings;
import io.vaultflow.model.ItemKind;
import io.vaultflow.model.Priority;
import io.vaultflow.model.WorkItem;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import java.util.stream.Stream;

public final class TestVaults {
    public static final Instant T0 = Instant.parse("2026-03-02T09:00:00Z");

    private TestVaults() {
    }

    public static VaultFlowSettings liveSettings() {
        return VaultFlowSettings.defaults().withEnvironment(Map.of(VaultFlowSettings.DRY_RUN_ENV, "false"));
    }

    public static WorkItem email(String id, Instant createdAt) {
        return WorkItem.intake(
                id,
                ItemKind.EMAIL,
                Priority.HIGH,
                createdAt,
                "gmail_watcher",
                Map.of("from", "client@example.com", "subject", "Invoice request"),
                "## Email Content\n\nPlease send the January invoice.\n"
        );
    }

    public static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
