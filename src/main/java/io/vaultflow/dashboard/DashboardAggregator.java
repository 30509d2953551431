package io.vaultflow.dashboard;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import io.vaultflow.claim.ClaimController;
import io.vaultflow.config.VaultFlowConfig;
import io.vaultflow.config.VaultFlowSettings;
import io.vaultflow.engine.TransitionEngine;
import io.vaultflow.ledger.AuditLedger;
import io.vaultflow.model.ApprovalRequest;
import io.vaultflow.model.AuditLogEntry;
import io.vaultflow.model.AuditResult;
import io.vaultflow.model.Claim;
import io.vaultflow.model.CollectionRef;
import io.vaultflow.model.DashboardDelta;
import io.vaultflow.model.DashboardSnapshot;
import io.vaultflow.model.WorkItem;
import io.vaultflow.model.WorkflowState;
import io.vaultflow.storage.MalformedRecordException;
import io.vaultflow.storage.RecordStore;
import io.vaultflow.storage.VaultStoreException;
import io.vaultflow.util.Ids;
import io.vaultflow.util.Jsons;
import io.vaultflow.util.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Single-writer dashboard. Non-writer roles only drop delta files into {@code Updates/}; the
 * writer role merges them with a full scan of the vault into {@code Dashboard.md} and
 * {@code dashboard.json}.
 *
 * <p>A rebuild starts from the fields of the previous {@code dashboard.json} and applies only the
 * deltas still waiting in {@code Updates/}, last write wins per field in
 * {@link DashboardDelta#MERGE_ORDER}. Deltas are archived only after both files are written, so a
 * crashed rebuild re-applies them and merging the same delta twice changes nothing. Without a
 * readable {@code dashboard.json} the archive in {@code Updates/applied} is replayed instead.
 */
public final class DashboardAggregator {
    private static final Logger LOG = LoggerFactory.getLogger(DashboardAggregator.class);
    private static final Object REBUILD_MONITOR = new Object();
    private static final Set<String> ALERT_ACTIONS = Set.of(
            TransitionEngine.ACTION_ILLEGAL_TRANSITION,
            TransitionEngine.ACTION_MALFORMED_RECORD
    );
    private static final String DELTA_EXTENSION = ".json";
    private static final TypeReference<Map<String, DashboardSnapshot.FieldView>> FIELD_MAP = new TypeReference<>() {
    };

    private final VaultFlowConfig config;
    private final RecordStore store;
    private final ClaimController claims;
    private final AuditLedger ledger;
    private final Supplier<VaultFlowSettings> settings;

    public DashboardAggregator(VaultFlowConfig config, RecordStore store, ClaimController claims, AuditLedger ledger,
                               Supplier<VaultFlowSettings> settings) {
        this.config = config;
        this.store = store;
        this.claims = claims;
        this.ledger = ledger;
        this.settings = settings;
    }

    /**
     * Publishes one field update from a non-writer role. Each delta is a new file; nothing is
     * ever overwritten.
     */
    public DeltaSubmission submitDelta(String role, String field, String value) {
        Ids.require(role, "role");
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("Delta field cannot be empty");
        }
        Instant at = store.now();
        String deltaId = at.toEpochMilli() + "-" + role + "-" + UUID.randomUUID().toString().substring(0, 8);
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("delta_id", deltaId);
        row.put("role", role);
        row.put("submitted_at", at.toString());
        row.put("field", field.trim());
        row.put("value", value == null ? "" : value);
        Path target = config.updatesDir().resolve(deltaId + DELTA_EXTENSION);
        Path tmp = config.updatesDir().resolve("." + deltaId + ".tmp");
        try {
            Files.createDirectories(config.updatesDir());
            Files.writeString(tmp, Jsons.toJson(row), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            if (Files.exists(target)) {
                throw new FileAlreadyExistsException(target.toString());
            }
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new VaultStoreException("Failed to submit dashboard delta " + target, e);
        } finally {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException e) {
                LOG.debug("Could not remove {}: {}", tmp, e.getMessage());
            }
        }
        LOG.debug("Role {} submitted delta {} for field {}", role, deltaId, field);
        return new DeltaSubmission(deltaId, target.toString());
    }

    /**
     * Merges pending deltas and regenerates both dashboard files.
     *
     * @throws NotDashboardWriterException if {@code role} is not the configured writer
     */
    public RebuildOutcome rebuild(String role) {
        String writer = settings.get().dashboardWriter();
        if (role == null || !writer.equals(role.trim())) {
            throw new NotDashboardWriterException(role, writer);
        }
        synchronized (REBUILD_MONITOR) {
            try {
                Files.createDirectories(config.internalDir());
                try (FileChannel channel = FileChannel.open(config.dashboardLockFile(),
                        StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                     FileLock ignored = channel.lock()) {
                    return rebuildLocked(writer);
                }
            } catch (IOException e) {
                throw new VaultStoreException("Failed to rebuild dashboard under " + config.rootDir(), e);
            }
        }
    }

    private RebuildOutcome rebuildLocked(String writer) throws IOException {
        List<String> warnings = new ArrayList<>();
        MergeResult merge = mergeDeltas(warnings);
        Instant now = store.now();
        VaultFlowSettings current = settings.get();

        Map<String, Integer> counts = new LinkedHashMap<>();
        for (CollectionRef collection : store.collections()) {
            counts.put(collection.name(), store.list(collection).size());
        }

        List<DashboardSnapshot.ClaimView> claimViews = new ArrayList<>();
        for (Claim claim : claims.listClaims()) {
            claimViews.add(new DashboardSnapshot.ClaimView(
                    claim.itemId(),
                    claim.ownerId(),
                    claim.claimedAt() == null ? null : claim.claimedAt().toString(),
                    claim.origin().status()
            ));
        }

        List<String> alerts = new ArrayList<>();
        List<DashboardSnapshot.ApprovalView> approvals = new ArrayList<>();
        for (WorkflowState state : List.of(WorkflowState.PENDING_APPROVAL, WorkflowState.APPROVED)) {
            CollectionRef collection = CollectionRef.of(state);
            for (String id : store.list(collection)) {
                try {
                    Optional<WorkItem> item = store.read(collection, id);
                    if (item.isEmpty()) {
                        continue;
                    }
                    ApprovalRequest request = ApprovalRequest.from(item.get());
                    boolean expired = request.isExpiredAt(now, current.clockSkewAllowance());
                    approvals.add(new DashboardSnapshot.ApprovalView(
                            id, state.status(), request.action().code(), request.target(), request.expiresAt(), expired));
                    if (expired) {
                        alerts.add("Approval " + id + " is past its expiry and will be expired on the next check");
                    }
                } catch (MalformedRecordException | IllegalArgumentException e) {
                    alerts.add("Unreadable record " + id + " in " + collection + ": " + e.getMessage());
                }
            }
        }

        int quarantined = counts.getOrDefault(CollectionRef.QUARANTINE.name(), 0);
        if (quarantined > 0) {
            alerts.add(quarantined + " record(s) in " + CollectionRef.QUARANTINE + " awaiting review");
        }
        List<AuditLogEntry> recent = ledger.recent(current.dashboardRecentEntries());
        for (AuditLogEntry entry : recent) {
            if (entry.result() == AuditResult.FAILURE && ALERT_ACTIONS.contains(entry.actionType())) {
                alerts.add(entry.timestamp() + " " + entry.actionType() + " " + entry.target()
                        + (entry.errorDetail() == null ? "" : ": " + entry.errorDetail()));
            }
        }
        warnings.forEach(w -> LOG.warn("Dashboard merge: {}", w));

        DashboardSnapshot snapshot = new DashboardSnapshot(
                now, writer, counts, claimViews, approvals, alerts, merge.fields(), recent, warnings);
        writeAtomically(config.dashboardJsonFile(), Jsons.toJson(snapshot));
        writeAtomically(config.dashboardFile(), DashboardRenderer.render(snapshot));
        archive(merge);
        LOG.info("Dashboard rebuilt: {} new delta(s), {} rejected, {} alert(s)",
                merge.applied(), merge.rejected(), alerts.size());
        return new RebuildOutcome(now, merge.applied(), merge.rejected(), merge.fields().size(), alerts.size(),
                warnings, config.dashboardFile().toString());
    }

    private MergeResult mergeDeltas(List<String> warnings) throws IOException {
        Files.createDirectories(config.appliedUpdatesDir());
        Files.createDirectories(config.rejectedUpdatesDir());

        Map<String, DashboardSnapshot.FieldView> fields = new TreeMap<>();
        Optional<Map<String, DashboardSnapshot.FieldView>> previous = previousFields(warnings);
        if (previous.isPresent()) {
            fields.putAll(previous.get());
        } else {
            for (Path file : deltaFiles(config.appliedUpdatesDir())) {
                try {
                    parseDelta(file).ifPresent(delta -> applyDelta(fields, delta));
                } catch (IOException e) {
                    warnings.add("Ignored unreadable applied delta " + file.getFileName());
                }
            }
        }
        List<Path> merged = new ArrayList<>();
        List<Path> dropped = new ArrayList<>();
        List<DashboardDelta> pending = new ArrayList<>();
        for (Path file : deltaFiles(config.updatesDir())) {
            Optional<DashboardDelta> delta;
            String reason;
            try {
                delta = parseDelta(file);
                reason = delta.isPresent() ? null : "missing required fields";
            } catch (IOException e) {
                delta = Optional.empty();
                reason = "unreadable: " + e.getMessage();
            }
            if (delta.isEmpty()) {
                warnings.add("Dropped delta " + file.getFileName() + " (" + reason + ")");
                dropped.add(file);
                continue;
            }
            pending.add(delta.get());
            merged.add(file);
        }
        pending.sort(DashboardDelta.MERGE_ORDER);
        pending.forEach(delta -> applyDelta(fields, delta));
        return new MergeResult(fields, merged, dropped);
    }

    /** Last write wins per field; a delta never replaces a later one, so replaying it is a no-op. */
    private static void applyDelta(Map<String, DashboardSnapshot.FieldView> fields, DashboardDelta delta) {
        DashboardSnapshot.FieldView current = fields.get(delta.field());
        if (current != null && current.submittedAt() != null && current.deltaId() != null) {
            int order = delta.submittedAt().compareTo(current.submittedAt());
            if (order < 0 || (order == 0 && delta.deltaId().compareTo(current.deltaId()) <= 0)) {
                return;
            }
        }
        fields.put(delta.field(), new DashboardSnapshot.FieldView(
                delta.value(), delta.role(), delta.submittedAt(), delta.deltaId()));
    }

    private Optional<Map<String, DashboardSnapshot.FieldView>> previousFields(List<String> warnings) {
        Path file = config.dashboardJsonFile();
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            JsonNode fields = Jsons.mapper().readTree(Files.readString(file, StandardCharsets.UTF_8)).get("fields");
            if (fields == null || !fields.isObject()) {
                warnings.add("Previous dashboard.json has no fields, replaying applied deltas");
                return Optional.empty();
            }
            return Optional.of(Jsons.mapper().convertValue(fields, FIELD_MAP));
        } catch (IOException | IllegalArgumentException e) {
            warnings.add("Previous dashboard.json unreadable, replaying applied deltas");
            return Optional.empty();
        }
    }

    private void archive(MergeResult merge) throws IOException {
        for (Path file : merge.merged()) {
            moveReplacing(file, config.appliedUpdatesDir().resolve(file.getFileName()));
        }
        for (Path file : merge.dropped()) {
            moveReplacing(file, config.rejectedUpdatesDir().resolve(file.getFileName()));
        }
    }

    private static Optional<DashboardDelta> parseDelta(Path file) throws IOException {
        JsonNode node;
        try {
            node = Jsons.mapper().readTree(Files.readString(file, StandardCharsets.UTF_8));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (JsonProcessingException e) {
            throw new IOException("not JSON", e);
        }
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        String deltaId = text(node, "delta_id");
        String role = text(node, "role");
        String field = text(node, "field");
        Optional<Instant> submittedAt = Timestamps.parse(text(node, "submitted_at"));
        JsonNode value = node.get("value");
        if (deltaId == null || role == null || field == null || submittedAt.isEmpty()
                || value == null || value.isNull()) {
            return Optional.empty();
        }
        return Optional.of(new DashboardDelta(deltaId, role, submittedAt.get(), field,
                value.isValueNode() ? value.asText() : value.toString()));
    }

    private static String text(JsonNode node, String key) {
        JsonNode value = node.get(key);
        if (value == null || value.isNull() || !value.isValueNode() || value.asText().isBlank()) {
            return null;
        }
        return value.asText().trim();
    }

    private static List<Path> deltaFiles(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(DELTA_EXTENSION))
                    .filter(p -> !p.getFileName().toString().startsWith("."))
                    .sorted()
                    .toList();
        }
    }

    private static void moveReplacing(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (NoSuchFileException e) {
            LOG.debug("Delta {} already moved", source);
        }
    }

    private void writeAtomically(Path target, String content) throws IOException {
        Files.createDirectories(target.getParent());
        Path tmp = target.resolveSibling("." + target.getFileName() + "." + UUID.randomUUID() + ".tmp");
        try {
            Files.writeString(tmp, content, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private record MergeResult(Map<String, DashboardSnapshot.FieldView> fields, List<Path> merged, List<Path> dropped) {
        int applied() {
            return merged.size();
        }

        int rejected() {
            return dropped.size();
        }
    }

    public record DeltaSubmission(String deltaId, String path) {
    }

    public record RebuildOutcome(
            Instant generatedAt,
            int appliedDeltas,
            int rejectedDeltas,
            int fields,
            int alerts,
            List<String> warnings,
            String dashboardPath
    ) {
    }
}
