package io.vaultflow.config;

import io.vaultflow.model.CollectionRef;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Resolves every on-disk location from a single vault root.
 */
public final class VaultFlowConfig {
    public static final String DEFAULT_ROOT = "vault";
    public static final String ROOT_ENV = "VAULT_PATH";

    private final Path rootDir;

    public VaultFlowConfig(Path rootDir) {
        this.rootDir = rootDir.toAbsolutePath().normalize();
    }

    public static VaultFlowConfig fromRoot(String root) {
        return fromRoot(root, System.getenv());
    }

    public static VaultFlowConfig fromRoot(String root, Map<String, String> env) {
        String effective = root;
        if (effective == null || effective.isBlank()) {
            effective = env == null ? null : env.get(ROOT_ENV);
        }
        Path resolved = effective == null || effective.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(effective.trim());
        return new VaultFlowConfig(resolved);
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path collectionDir(CollectionRef collection) {
        Path dir = rootDir;
        for (String segment : collection.name().split("/")) {
            dir = dir.resolve(segment);
        }
        return dir;
    }

    public Path inProgressRoot() {
        return rootDir.resolve(CollectionRef.IN_PROGRESS_DIR);
    }

    public Path heartbeatsDir() {
        return inProgressRoot().resolve(".heartbeats");
    }

    public Path logsDir() {
        return rootDir.resolve("Logs");
    }

    public Path updatesDir() {
        return rootDir.resolve("Updates");
    }

    public Path appliedUpdatesDir() {
        return updatesDir().resolve("applied");
    }

    public Path rejectedUpdatesDir() {
        return updatesDir().resolve("rejected");
    }

    public Path dashboardFile() {
        return rootDir.resolve("Dashboard.md");
    }

    public Path dashboardJsonFile() {
        return internalDir().resolve("dashboard.json");
    }

    public Path dashboardLockFile() {
        return internalDir().resolve("dashboard.lock");
    }

    public Path settingsFile() {
        return rootDir.resolve("vaultflow-settings.json");
    }

    public Path internalDir() {
        return rootDir.resolve(".vaultflow");
    }

    public Path tmpDir() {
        return internalDir().resolve("tmp");
    }

    public Path clockDir() {
        return internalDir().resolve("clock");
    }

    public Path dbFile() {
        return internalDir().resolve("vaultflow.db");
    }
}
