package io.vaultflow.runtime;

import io.vaultflow.approval.ApprovalGate;
import io.vaultflow.approval.ApprovalVerdict;
import io.vaultflow.claim.ClaimController;
import io.vaultflow.config.VaultFlowConfig;
import io.vaultflow.config.VaultFlowSettings;
import io.vaultflow.dashboard.DashboardAggregator;
import io.vaultflow.engine.TransitionEngine;
import io.vaultflow.executor.ExecutorRegistry;
import io.vaultflow.ledger.AuditLedger;
import io.vaultflow.model.ApprovalRequest;
import io.vaultflow.model.AuditLogEntry;
import io.vaultflow.model.AuditResult;
import io.vaultflow.model.Claim;
import io.vaultflow.model.CollectionRef;
import io.vaultflow.model.ItemKind;
import io.vaultflow.model.Priority;
import io.vaultflow.model.WorkItem;
import io.vaultflow.model.WorkflowState;
import io.vaultflow.storage.Database;
import io.vaultflow.storage.FileRecordStore;
import io.vaultflow.storage.FileStoreClock;
import io.vaultflow.storage.RecordNotFoundException;
import io.vaultflow.storage.RecordStore;
import io.vaultflow.storage.SqliteRecordStore;
import io.vaultflow.storage.StoreClock;
import io.vaultflow.storage.VaultStoreException;
import io.vaultflow.util.Ids;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Wires the store, ledger and controllers of one vault together and exposes every operation the
 * CLI offers.
 */
public final class VaultFlowRuntime {
    public static final String ACTION_SETTINGS_LOAD = "runtime.settings.load";
    public static final String ACTION_RESUBMIT = "resubmit";
    public static final String RESUBMITTED_FROM_KEY = "resubmitted_from";
    public static final String SOURCE_ITEM_KEY = "source_item";

    private static final Logger LOG = LoggerFactory.getLogger(VaultFlowRuntime.class);
    private static final DateTimeFormatter ID_STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);
    private static final List<String> NON_CARRIED_KEYS = List.of(
            ApprovalRequest.ACTION_KEY,
            ApprovalRequest.EXPIRES_KEY,
            ApprovalRequest.LINKED_ITEM_KEY,
            ApprovalRequest.TARGET_KEY,
            Claim.CLAIMED_BY_KEY,
            Claim.CLAIMED_AT_KEY,
            Claim.CLAIMED_FROM_KEY,
            RESUBMITTED_FROM_KEY
    );

    private final VaultFlowConfig config;
    private final Map<String, String> env;
    private final RecordStore store;
    private final AuditLedger ledger;
    private final TransitionEngine engine;
    private final ClaimController claims;
    private final ApprovalGate gate;
    private final DashboardAggregator dashboard;
    private final ApprovalDispatcher dispatcher;
    private volatile VaultFlowSettings settings;
    private volatile ExecutorRegistry executors;
    private volatile long settingsFileMtimeMs;
    private volatile long lastSettingsCheckMs;

    public VaultFlowRuntime(VaultFlowConfig config) {
        this(config, System.getenv(), null);
    }

    /**
     * @param clock store clock override; {@code null} selects the backend's own clock
     */
    public VaultFlowRuntime(VaultFlowConfig config, Map<String, String> env, StoreClock clock) {
        this.config = config;
        this.env = env == null ? Map.of() : Map.copyOf(env);
        this.settings = VaultFlowSettings.load(config.settingsFile(), this.env);
        this.settingsFileMtimeMs = resolveFileMtimeMs(config.settingsFile());
        this.lastSettingsCheckMs = 0L;
        this.store = openStore(config, settings.backend(), clock);
        this.ledger = new AuditLedger(
                config.logsDir(),
                settings.auditSigningSecret(),
                settings.ledgerMaxParameterEntries(),
                settings.ledgerMaxParameterChars()
        );
        this.engine = new TransitionEngine(store, ledger);
        this.claims = new ClaimController(store, engine, ledger);
        this.gate = new ApprovalGate(store, engine, this::settings);
        this.dashboard = new DashboardAggregator(config, store, claims, ledger, this::settings);
        this.executors = ExecutorRegistry.fromSettings(settings);
        this.dispatcher = new ApprovalDispatcher(store, engine, claims, gate, ledger, this::executors, this::settings);
    }

    private static RecordStore openStore(VaultFlowConfig config, String backend, StoreClock clock) {
        if (VaultFlowSettings.BACKEND_SQLITE.equals(backend)) {
            return clock == null
                    ? new SqliteRecordStore(config)
                    : new SqliteRecordStore(new Database(config), clock);
        }
        return clock == null
                ? new FileRecordStore(config, new FileStoreClock(config.clockDir()))
                : new FileRecordStore(config, clock);
    }

    public void init() {
        store.init();
        try {
            Files.createDirectories(config.logsDir());
            Files.createDirectories(config.updatesDir());
            Files.createDirectories(config.internalDir());
        } catch (IOException e) {
            throw new VaultStoreException("Failed to initialize vault: " + config.rootDir(), e);
        }
        loadSettings(true);
    }

    public VaultFlowConfig config() {
        return config;
    }

    public VaultFlowSettings settings() {
        return settings;
    }

    public SettingsView currentSettings() {
        return SettingsView.of(settings);
    }

    public RecordStore store() {
        return store;
    }

    public AuditLedger ledger() {
        return ledger;
    }

    public ApprovalGate gate() {
        return gate;
    }

    public ClaimController claims() {
        return claims;
    }

    public ApprovalDispatcher dispatcher() {
        return dispatcher;
    }

    public ExecutorRegistry executors() {
        return executors;
    }

    public SettingsReloadOutcome reloadSettings() {
        return loadSettings(true);
    }

    public SettingsReloadOutcome maybeReloadSettings(long minIntervalMs) {
        long nowMs = Instant.now().toEpochMilli();
        long interval = Math.max(1_000L, minIntervalMs);
        if ((nowMs - lastSettingsCheckMs) < interval) {
            return new SettingsReloadOutcome(
                    false,
                    settingsFileMtimeMs >= 0L,
                    config.settingsFile().toString(),
                    currentSettings(),
                    "skip_interval",
                    nowMs,
                    List.of()
            );
        }
        lastSettingsCheckMs = nowMs;
        return loadSettings(false);
    }

    // ---- items ----

    public TransitionEngine.AdmitOutcome admit(AdmitRequest request, String actor) {
        Instant now = store.now();
        String id = request.id() == null || request.id().isBlank()
                ? newItemId(request.kind().type(), now)
                : Ids.sanitize(request.id());
        WorkItem item = WorkItem.intake(
                id,
                request.kind(),
                request.priority(),
                now,
                request.source(),
                request.metadata(),
                request.body()
        );
        return engine.admit(item, actor);
    }

    public TransitionEngine.TransitionOutcome triage(String id, String actor) {
        return engine.transition(id, WorkflowState.INTAKE, WorkflowState.TRIAGED, actor, Map.of());
    }

    public TransitionEngine.TransitionOutcome transition(String id, WorkflowState from, WorkflowState to,
                                                         String actor, String reason) {
        Map<String, Object> params = new LinkedHashMap<>();
        if (reason != null && !reason.isBlank()) {
            params.put("reason", reason);
        }
        return engine.transition(id, from, to, actor, params);
    }

    /**
     * Moves a triaged item to {@code Plans}. With a plan body, a derived {@code PLAN_<id>} record
     * is admitted next to it.
     */
    public PlanOutcome plan(String id, String planBody, String actor) {
        TransitionEngine.TransitionOutcome moved =
                engine.transition(id, WorkflowState.TRIAGED, WorkflowState.PLANNED, actor, Map.of());
        if (planBody == null || planBody.isBlank()) {
            return new PlanOutcome(moved, null);
        }
        WorkItem source = store.read(CollectionRef.of(WorkflowState.PLANNED), id).orElse(null);
        Priority priority = source == null ? Priority.NORMAL : source.priority();
        WorkItem plan = new WorkItem(
                Ids.sanitize("PLAN_" + id),
                ItemKind.PLAN,
                WorkflowState.PLANNED,
                priority,
                store.now(),
                actor,
                Map.of(SOURCE_ITEM_KEY, id),
                planBody
        );
        return new PlanOutcome(moved, engine.admit(plan, actor));
    }

    public List<String> list(CollectionRef collection) {
        return store.list(collection);
    }

    public Optional<RecordView> show(String id) {
        Optional<CollectionRef> located = store.locate(id);
        if (located.isEmpty()) {
            return Optional.empty();
        }
        return store.read(located.get(), id).map(item -> RecordView.of(located.get(), item));
    }

    public Optional<CollectionRef> locate(String id) {
        return store.locate(id);
    }

    // ---- approvals ----

    public ApprovalGate.RequestOutcome requestApproval(ApprovalGate.Draft draft, String actor) {
        return gate.request(draft, actor);
    }

    public TransitionEngine.TransitionOutcome approve(String id, String actor) {
        return gate.approve(id, actor);
    }

    public TransitionEngine.TransitionOutcome reject(String id, String actor, String reason) {
        return gate.reject(id, actor, reason);
    }

    public ApprovalVerdict checkExecutable(String id, String actor) {
        return gate.checkExecutable(id, actor);
    }

    /**
     * Re-enters a rejected or expired item as a new record. Approval requests come back to
     * {@code Pending_Approval} with a fresh deadline; other kinds come back to {@code Intake}.
     * The original stays where it is.
     */
    public ResubmitOutcome resubmit(String id, String actor) {
        CollectionRef holder = store.locate(id).orElseThrow(
                () -> new RecordNotFoundException(CollectionRef.of(WorkflowState.REJECTED), id));
        WorkflowState state = holder.state().orElse(null);
        if (state != WorkflowState.REJECTED && state != WorkflowState.EXPIRED) {
            throw new IllegalArgumentException("Only rejected or expired items can be resubmitted; "
                    + id + " is in " + holder);
        }
        WorkItem original = engine.readOrQuarantine(holder, id, actor)
                .orElseThrow(() -> new RecordNotFoundException(holder, id));
        Instant now = store.now();
        String newId = Ids.sanitize(id + "_resub_" + ID_STAMP.format(now));
        Map<String, String> carried = new LinkedHashMap<>(original.metadata());
        NON_CARRIED_KEYS.forEach(carried::remove);
        carried.put(RESUBMITTED_FROM_KEY, id);

        String collection;
        boolean duplicate;
        if (original.kind() == ItemKind.APPROVAL_REQUEST) {
            ApprovalRequest previous = ApprovalRequest.from(original);
            ApprovalGate.RequestOutcome requested = gate.request(new ApprovalGate.Draft(
                    newId,
                    previous.action(),
                    original.priority(),
                    original.source(),
                    previous.linkedItemId(),
                    previous.target(),
                    carried,
                    original.body()
            ), actor);
            collection = requested.collection();
            duplicate = requested.duplicate();
        } else {
            WorkItem copy = WorkItem.intake(newId, original.kind(), original.priority(), now, original.source(),
                    carried, original.body());
            TransitionEngine.AdmitOutcome admitted = engine.admit(copy, actor);
            collection = admitted.collection();
            duplicate = admitted.duplicate();
        }
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("from_state", state.status());
        params.put("new_id", newId);
        params.put("collection", collection);
        ledger.append(AuditLogEntry.success(now, ACTION_RESUBMIT, actor, id, params));
        return new ResubmitOutcome(id, newId, collection, duplicate);
    }

    // ---- claims ----

    public Optional<Claim> claim(String id, WorkflowState from, String ownerId) {
        Ids.require(ownerId, "owner id");
        return claims.tryClaim(from, id, ownerId);
    }

    public Claim release(String ownerId, String id, String actor, String reason) {
        Claim claim = claims.claimOf(ownerId, id)
                .orElseThrow(() -> new RecordNotFoundException(CollectionRef.ownerScoped(ownerId), id));
        claims.release(claim, actor, reason);
        return claim;
    }

    public Instant heartbeat(String ownerId) {
        Ids.require(ownerId, "owner id");
        return claims.heartbeat(ownerId);
    }

    public ClaimController.ReclaimSummary reclaim(Duration ttl, String actor) {
        Duration effective = ttl == null ? settings.claimTtl() : ttl;
        return claims.reclaimStale(effective, actor);
    }

    public List<Claim> listClaims() {
        return claims.listClaims();
    }

    // ---- dispatch ----

    /**
     * Runs one approved request now. An expired request fails with
     * {@link io.vaultflow.approval.ApprovalExpiredException} after being moved to {@code Expired}.
     */
    public ApprovalDispatcher.DispatchResult execute(String id, String dispatcherId) {
        gate.requireExecutable(id, dispatcherId);
        return dispatcher.dispatch(id, dispatcherId);
    }

    public ApprovalDispatcher.TickOutcome orchestrateOnce(String dispatcherId) {
        maybeReloadSettings(0L);
        claims.heartbeat(dispatcherId);
        claims.reclaimStale(settings.claimTtl(), dispatcherId);
        return dispatcher.tick(dispatcherId);
    }

    public void orchestrate(String dispatcherId, AtomicBoolean running,
                            Consumer<ApprovalDispatcher.TickOutcome> listener) throws InterruptedException {
        dispatcher.run(dispatcherId, running, outcome -> {
            maybeReloadSettings(settings.dispatchIntervalMs());
            if (listener != null) {
                listener.accept(outcome);
            }
        });
    }

    // ---- dashboard & ledger ----

    public DashboardAggregator.RebuildOutcome dashboard(String role) {
        return dashboard.rebuild(role);
    }

    public DashboardAggregator.DeltaSubmission dashboardDelta(String role, String field, String value) {
        return dashboard.submitDelta(role, field, value);
    }

    public List<AuditLogEntry> auditTail(int limit) {
        return ledger.recent(Math.max(1, limit));
    }

    public List<AuditLedger.VerifyOutcome> auditVerify(String partitionKey) {
        if (partitionKey != null && !partitionKey.isBlank()) {
            return List.of(ledger.verify(partitionKey.trim()));
        }
        List<AuditLedger.VerifyOutcome> out = new ArrayList<>();
        for (String partition : ledger.partitions()) {
            out.add(ledger.verify(partition));
        }
        return out;
    }

    public Stats stats() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (WorkflowState state : WorkflowState.values()) {
            counts.put(state.dirName(), store.list(CollectionRef.of(state)).size());
        }
        counts.put(CollectionRef.QUARANTINE.name(), store.list(CollectionRef.QUARANTINE).size());
        int claimed = 0;
        for (CollectionRef scope : store.ownerScopes()) {
            claimed += store.list(scope).size();
        }
        return new Stats(
                config.rootDir().toString(),
                settings.backend(),
                settings.dryRun(),
                counts,
                claimed,
                store.heartbeats().size(),
                ledger.partitions().size(),
                executors.supportedActions()
        );
    }

    // ---- settings ----

    private SettingsReloadOutcome loadSettings(boolean force) {
        Path cfg = config.settingsFile();
        long checkedAtMs = Instant.now().toEpochMilli();
        long mtime = resolveFileMtimeMs(cfg);
        if (!force && mtime == settingsFileMtimeMs) {
            return new SettingsReloadOutcome(
                    false,
                    mtime >= 0L,
                    cfg.toString(),
                    currentSettings(),
                    "unchanged",
                    checkedAtMs,
                    List.of()
            );
        }
        VaultFlowSettings previous = settings;
        VaultFlowSettings resolved;
        try {
            resolved = VaultFlowSettings.load(cfg, env);
        } catch (RuntimeException e) {
            ledger.append(AuditLogEntry.failure(store.now(), ACTION_SETTINGS_LOAD, "system", "runtime/settings",
                    Map.of("config", cfg.toString()), e.getMessage()));
            LOG.warn("Keeping previous settings, {} could not be loaded: {}", cfg, e.getMessage());
            settingsFileMtimeMs = mtime;
            return new SettingsReloadOutcome(false, mtime >= 0L, cfg.toString(), currentSettings(),
                    "invalid_kept_previous", checkedAtMs, List.of());
        }
        if (!resolved.backend().equals(previous.backend())) {
            LOG.warn("Store backend change to '{}' takes effect on restart", resolved.backend());
        }
        settings = resolved;
        settingsFileMtimeMs = mtime;
        executors = ExecutorRegistry.fromSettings(resolved);
        List<String> changedFields = previous.diff(resolved);
        boolean changed = !changedFields.isEmpty();
        String message = mtime < 0L ? "defaults" : changed ? "reloaded" : "unchanged_content";
        if (changed || mtime >= 0L) {
            Map<String, Object> params = new LinkedHashMap<>();
            params.put("config", cfg.toString());
            params.put("source", mtime < 0L ? "defaults" : "file");
            params.put("changed", changed);
            params.put("changed_count", changedFields.size());
            params.put("changed_fields", changedFields);
            if (mtime >= 0L) {
                params.put("config_mtime_ms", mtime);
            }
            ledger.append(new AuditLogEntry(store.now(), ACTION_SETTINGS_LOAD, "system", "runtime/settings",
                    params, AuditResult.SUCCESS, null));
        }
        if (changed) {
            LOG.info("Settings {}: {}", message, changedFields);
        }
        return new SettingsReloadOutcome(changed, mtime >= 0L, cfg.toString(), SettingsView.of(resolved),
                message, checkedAtMs, changedFields);
    }

    private static long resolveFileMtimeMs(Path path) {
        if (!Files.exists(path)) {
            return -1L;
        }
        try {
            return Files.getLastModifiedTime(path).toMillis();
        } catch (IOException e) {
            throw new VaultStoreException("Failed to read settings mtime: " + path, e);
        }
    }

    private static String newItemId(String type, Instant now) {
        return type.toUpperCase(Locale.ROOT) + "_" + ID_STAMP.format(now) + "_"
                + Integer.toHexString(ThreadLocalRandom.current().nextInt(0x1000, 0x10000));
    }

    public record AdmitRequest(
            String id,
            ItemKind kind,
            Priority priority,
            String source,
            Map<String, String> metadata,
            String body
    ) {
    }

    public record PlanOutcome(TransitionEngine.TransitionOutcome moved, TransitionEngine.AdmitOutcome plan) {
    }

    public record ResubmitOutcome(String originalId, String newId, String collection, boolean duplicate) {
    }

    public record RecordView(
            String id,
            String collection,
            String type,
            String state,
            String priority,
            Instant created,
            String source,
            Map<String, String> metadata,
            String body
    ) {
        static RecordView of(CollectionRef collection, WorkItem item) {
            return new RecordView(
                    item.id(),
                    collection.name(),
                    item.kind().type(),
                    item.state().status(),
                    item.priority().label(),
                    item.createdAt(),
                    item.source(),
                    item.metadata(),
                    item.body()
            );
        }
    }

    public record Stats(
            String root,
            String backend,
            boolean dryRun,
            Map<String, Integer> collections,
            int claimedItems,
            int heartbeatOwners,
            int ledgerPartitions,
            Set<String> supportedActions
    ) {
    }

    /** Effective settings as printed by the CLI; the signing secret is reduced to a flag. */
    public record SettingsView(
            long approvalWindowMs,
            long clockSkewAllowanceMs,
            long claimTtlMs,
            boolean dryRun,
            long dispatchIntervalMs,
            String dashboardWriter,
            int dashboardRecentEntries,
            int ledgerMaxParameterEntries,
            int ledgerMaxParameterChars,
            boolean auditSigning,
            String backend,
            List<String> scriptActions
    ) {
        static SettingsView of(VaultFlowSettings s) {
            return new SettingsView(
                    s.approvalWindowMs(),
                    s.clockSkewAllowanceMs(),
                    s.claimTtlMs(),
                    s.dryRun(),
                    s.dispatchIntervalMs(),
                    s.dashboardWriter(),
                    s.dashboardRecentEntries(),
                    s.ledgerMaxParameterEntries(),
                    s.ledgerMaxParameterChars(),
                    !s.auditSigningSecret().isEmpty(),
                    s.backend(),
                    List.copyOf(new TreeSet<>(s.scriptExecutors().keySet()))
            );
        }
    }

    public record SettingsReloadOutcome(
            boolean changed,
            boolean configExists,
            String sourcePath,
            SettingsView settings,
            String message,
            long checkedAtMs,
            List<String> changedFields
    ) {
    }
}
