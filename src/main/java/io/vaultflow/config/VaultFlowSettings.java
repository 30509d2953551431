package io.vaultflow.config;

import io.vaultflow.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Effective runtime settings: {@code vaultflow-settings.json} merged over defaults, then the
 * environment overrides the vault scripts have always honoured ({@code DRY_RUN},
 * {@code ORCHESTRATOR_INTERVAL}).
 */
public record VaultFlowSettings(
        long approvalWindowMs,
        long clockSkewAllowanceMs,
        long claimTtlMs,
        boolean dryRun,
        long dispatchIntervalMs,
        String dashboardWriter,
        int dashboardRecentEntries,
        int ledgerMaxParameterEntries,
        int ledgerMaxParameterChars,
        String auditSigningSecret,
        String backend,
        Map<String, ScriptExecutorSpec> scriptExecutors
) {
    public static final long DEFAULT_APPROVAL_WINDOW_MS = Duration.ofHours(24).toMillis();
    public static final long DEFAULT_CLOCK_SKEW_ALLOWANCE_MS = 2_000L;
    public static final long DEFAULT_CLAIM_TTL_MS = Duration.ofMinutes(15).toMillis();
    public static final long DEFAULT_DISPATCH_INTERVAL_MS = 10_000L;
    public static final String DEFAULT_DASHBOARD_WRITER = "local";
    public static final int DEFAULT_DASHBOARD_RECENT_ENTRIES = 20;
    public static final int DEFAULT_LEDGER_MAX_PARAMETER_ENTRIES = 32;
    public static final int DEFAULT_LEDGER_MAX_PARAMETER_CHARS = 512;
    public static final String BACKEND_FILE = "file";
    public static final String BACKEND_SQLITE = "sqlite";

    public static final String DRY_RUN_ENV = "DRY_RUN";
    public static final String INTERVAL_ENV = "ORCHESTRATOR_INTERVAL";

    public VaultFlowSettings {
        dashboardWriter = dashboardWriter == null || dashboardWriter.isBlank()
                ? DEFAULT_DASHBOARD_WRITER
                : dashboardWriter.trim();
        auditSigningSecret = auditSigningSecret == null ? "" : auditSigningSecret.trim();
        backend = normalizeBackend(backend);
        scriptExecutors = scriptExecutors == null ? Map.of() : Map.copyOf(scriptExecutors);
    }

    public static VaultFlowSettings defaults() {
        return new VaultFlowSettings(
                DEFAULT_APPROVAL_WINDOW_MS,
                DEFAULT_CLOCK_SKEW_ALLOWANCE_MS,
                DEFAULT_CLAIM_TTL_MS,
                true,
                DEFAULT_DISPATCH_INTERVAL_MS,
                DEFAULT_DASHBOARD_WRITER,
                DEFAULT_DASHBOARD_RECENT_ENTRIES,
                DEFAULT_LEDGER_MAX_PARAMETER_ENTRIES,
                DEFAULT_LEDGER_MAX_PARAMETER_CHARS,
                "",
                BACKEND_FILE,
                Map.of()
        );
    }

    /**
     * Loads the settings file when present and applies environment overrides on top.
     */
    public static VaultFlowSettings load(Path settingsFile, Map<String, String> env) {
        VaultFlowSettings base = defaults();
        if (settingsFile != null && Files.exists(settingsFile)) {
            try {
                SettingsFile file = Jsons.mapper().readValue(settingsFile.toFile(), SettingsFile.class);
                base = fromFile(file, base);
            } catch (IOException e) {
                throw new IllegalStateException("Failed to load settings: " + settingsFile, e);
            }
        }
        return base.withEnvironment(env);
    }

    public static VaultFlowSettings fromFile(SettingsFile file, VaultFlowSettings defaults) {
        if (file == null) {
            return defaults;
        }
        Map<String, ScriptExecutorSpec> scripts = new LinkedHashMap<>(defaults.scriptExecutors());
        if (file.scriptExecutors() != null) {
            file.scriptExecutors().forEach((action, script) -> {
                if (action != null && script != null && script.command() != null && !script.command().isEmpty()) {
                    scripts.put(action.trim().toLowerCase(Locale.ROOT), script);
                }
            });
        }
        return new VaultFlowSettings(
                positiveOr(file.approvalWindowMs(), defaults.approvalWindowMs()),
                nonNegativeOr(file.clockSkewAllowanceMs(), defaults.clockSkewAllowanceMs()),
                positiveOr(file.claimTtlMs(), defaults.claimTtlMs()),
                file.dryRun() == null ? defaults.dryRun() : file.dryRun(),
                positiveOr(file.dispatchIntervalMs(), defaults.dispatchIntervalMs()),
                file.dashboardWriter() == null ? defaults.dashboardWriter() : file.dashboardWriter(),
                file.dashboardRecentEntries() == null || file.dashboardRecentEntries() <= 0
                        ? defaults.dashboardRecentEntries()
                        : file.dashboardRecentEntries(),
                file.ledgerMaxParameterEntries() == null || file.ledgerMaxParameterEntries() <= 0
                        ? defaults.ledgerMaxParameterEntries()
                        : file.ledgerMaxParameterEntries(),
                file.ledgerMaxParameterChars() == null || file.ledgerMaxParameterChars() <= 0
                        ? defaults.ledgerMaxParameterChars()
                        : file.ledgerMaxParameterChars(),
                file.auditSigningSecret() == null ? defaults.auditSigningSecret() : file.auditSigningSecret(),
                file.backend() == null ? defaults.backend() : file.backend(),
                scripts
        );
    }

    public VaultFlowSettings withEnvironment(Map<String, String> env) {
        if (env == null || env.isEmpty()) {
            return this;
        }
        boolean effectiveDryRun = dryRun;
        String rawDryRun = env.get(DRY_RUN_ENV);
        if (rawDryRun != null && !rawDryRun.isBlank()) {
            effectiveDryRun = "true".equalsIgnoreCase(rawDryRun.trim());
        }
        long effectiveInterval = dispatchIntervalMs;
        String rawInterval = env.get(INTERVAL_ENV);
        if (rawInterval != null && !rawInterval.isBlank()) {
            try {
                long seconds = Long.parseLong(rawInterval.trim());
                if (seconds > 0) {
                    effectiveInterval = seconds * 1_000L;
                }
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(INTERVAL_ENV + " must be a number of seconds: " + rawInterval, e);
            }
        }
        return new VaultFlowSettings(
                approvalWindowMs,
                clockSkewAllowanceMs,
                claimTtlMs,
                effectiveDryRun,
                effectiveInterval,
                dashboardWriter,
                dashboardRecentEntries,
                ledgerMaxParameterEntries,
                ledgerMaxParameterChars,
                auditSigningSecret,
                backend,
                scriptExecutors
        );
    }

    public Duration approvalWindow() {
        return Duration.ofMillis(approvalWindowMs);
    }

    public Duration clockSkewAllowance() {
        return Duration.ofMillis(clockSkewAllowanceMs);
    }

    public Duration claimTtl() {
        return Duration.ofMillis(claimTtlMs);
    }

    public Duration dispatchInterval() {
        return Duration.ofMillis(dispatchIntervalMs);
    }

    /** Names of the settings whose values differ between two loads. Secrets are compared, never printed. */
    public List<String> diff(VaultFlowSettings other) {
        List<String> changed = new ArrayList<>();
        if (other == null) {
            return changed;
        }
        addIfChanged(changed, "approvalWindowMs", approvalWindowMs, other.approvalWindowMs);
        addIfChanged(changed, "clockSkewAllowanceMs", clockSkewAllowanceMs, other.clockSkewAllowanceMs);
        addIfChanged(changed, "claimTtlMs", claimTtlMs, other.claimTtlMs);
        addIfChanged(changed, "dryRun", dryRun, other.dryRun);
        addIfChanged(changed, "dispatchIntervalMs", dispatchIntervalMs, other.dispatchIntervalMs);
        addIfChanged(changed, "dashboardWriter", dashboardWriter, other.dashboardWriter);
        addIfChanged(changed, "dashboardRecentEntries", dashboardRecentEntries, other.dashboardRecentEntries);
        addIfChanged(changed, "ledgerMaxParameterEntries", ledgerMaxParameterEntries, other.ledgerMaxParameterEntries);
        addIfChanged(changed, "ledgerMaxParameterChars", ledgerMaxParameterChars, other.ledgerMaxParameterChars);
        addIfChanged(changed, "auditSigningSecret", auditSigningSecret, other.auditSigningSecret);
        addIfChanged(changed, "backend", backend, other.backend);
        addIfChanged(changed, "scriptExecutors", scriptExecutors, other.scriptExecutors);
        return changed;
    }

    private static void addIfChanged(List<String> out, String name, Object before, Object after) {
        if (!Objects.equals(before, after)) {
            out.add(name);
        }
    }

    private static long positiveOr(Long value, long fallback) {
        return value == null || value <= 0L ? fallback : value;
    }

    private static long nonNegativeOr(Long value, long fallback) {
        return value == null || value < 0L ? fallback : value;
    }

    private static String normalizeBackend(String raw) {
        if (raw == null || raw.isBlank()) {
            return BACKEND_FILE;
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        if (!BACKEND_FILE.equals(value) && !BACKEND_SQLITE.equals(value)) {
            throw new IllegalArgumentException("Unknown store backend: " + raw);
        }
        return value;
    }

    public record SettingsFile(
            Long approvalWindowMs,
            Long clockSkewAllowanceMs,
            Long claimTtlMs,
            Boolean dryRun,
            Long dispatchIntervalMs,
            String dashboardWriter,
            Integer dashboardRecentEntries,
            Integer ledgerMaxParameterEntries,
            Integer ledgerMaxParameterChars,
            String auditSigningSecret,
            String backend,
            Map<String, ScriptExecutorSpec> scriptExecutors
    ) {
    }

    public record ScriptExecutorSpec(List<String> command, Long timeoutMs) {
    }
}
