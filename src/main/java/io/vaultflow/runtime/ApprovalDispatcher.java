package io.vaultflow.runtime;

import io.vaultflow.approval.ApprovalExpiredException;
import io.vaultflow.approval.ApprovalGate;
import io.vaultflow.approval.ApprovalVerdict;
import io.vaultflow.claim.ClaimController;
import io.vaultflow.config.VaultFlowSettings;
import io.vaultflow.engine.TransitionEngine;
import io.vaultflow.executor.ActionExecutor;
import io.vaultflow.executor.ExecutionContext;
import io.vaultflow.executor.ExecutionResult;
import io.vaultflow.executor.ExecutorRegistry;
import io.vaultflow.ledger.AuditLedger;
import io.vaultflow.model.ApprovalRequest;
import io.vaultflow.model.AuditLogEntry;
import io.vaultflow.model.AuditResult;
import io.vaultflow.model.Claim;
import io.vaultflow.model.CollectionRef;
import io.vaultflow.model.WorkItem;
import io.vaultflow.model.WorkflowState;
import io.vaultflow.storage.MalformedRecordException;
import io.vaultflow.storage.RecordNotFoundException;
import io.vaultflow.storage.RecordStore;
import io.vaultflow.storage.VaultStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * The executor-facing loop: claims approved requests, re-checks them under custody, runs the
 * registered executor and archives the request to {@code Done}.
 */
public final class ApprovalDispatcher {
    public static final String STATUS_EXECUTED = "executed";
    public static final String STATUS_MANUAL = "manual_required";
    public static final String STATUS_SKIPPED_EXPIRED = "skipped_expired";
    public static final String STATUS_FAILED = "failed";
    public static final String STATUS_LOST_RACE = "lost_race";
    public static final String STATUS_QUARANTINED = "quarantined";
    public static final String STATUS_DRY_RUN = "dry_run";
    public static final String STATUS_UNSUPPORTED = "unsupported_action";
    public static final String STATUS_NOT_APPROVED = "not_approved";

    private static final Logger LOG = LoggerFactory.getLogger(ApprovalDispatcher.class);

    private final RecordStore store;
    private final TransitionEngine engine;
    private final ClaimController claims;
    private final ApprovalGate gate;
    private final AuditLedger ledger;
    private final Supplier<ExecutorRegistry> executors;
    private final Supplier<VaultFlowSettings> settings;
    private final Set<String> dryRunAnnounced = ConcurrentHashMap.newKeySet();

    public ApprovalDispatcher(RecordStore store, TransitionEngine engine, ClaimController claims, ApprovalGate gate,
                              AuditLedger ledger, Supplier<ExecutorRegistry> executors,
                              Supplier<VaultFlowSettings> settings) {
        this.store = store;
        this.engine = engine;
        this.claims = claims;
        this.gate = gate;
        this.ledger = ledger;
        this.executors = executors;
        this.settings = settings;
    }

    /**
     * One pass over {@code Approved}, most urgent first.
     */
    public TickOutcome tick(String dispatcherId) {
        CollectionRef approved = CollectionRef.of(WorkflowState.APPROVED);
        List<Candidate> candidates = new ArrayList<>();
        List<DispatchResult> results = new ArrayList<>();
        for (String id : store.list(approved)) {
            try {
                store.read(approved, id).ifPresent(item -> candidates.add(new Candidate(item)));
            } catch (MalformedRecordException e) {
                engine.quarantine(approved, id, dispatcherId, e.reason());
                results.add(new DispatchResult(id, STATUS_QUARANTINED, null, null, e.reason()));
            }
        }
        candidates.sort(Candidate.DISPATCH_ORDER);
        for (Candidate candidate : candidates) {
            try {
                results.add(dispatch(candidate.item().id(), dispatcherId));
            } catch (ApprovalExpiredException e) {
                results.add(new DispatchResult(candidate.item().id(), STATUS_SKIPPED_EXPIRED, null, null, e.getMessage()));
            } catch (VaultStoreException e) {
                LOG.error("Dispatch of {} failed", candidate.item().id(), e);
                results.add(new DispatchResult(candidate.item().id(), STATUS_FAILED, null, null, e.getMessage()));
            }
        }
        return TickOutcome.of(results);
    }

    /**
     * Dispatches one approved request. Expired requests are skipped and moved to {@code Expired}.
     */
    public DispatchResult dispatch(String id, String dispatcherId) {
        if (settings.get().dryRun()) {
            return dryRun(id, dispatcherId);
        }
        claims.heartbeat(dispatcherId);
        Optional<Claim> claimed;
        try {
            claimed = claims.tryClaim(WorkflowState.APPROVED, id, dispatcherId);
        } catch (MalformedRecordException e) {
            return new DispatchResult(id, STATUS_QUARANTINED, null, null, e.reason());
        }
        if (claimed.isEmpty()) {
            return new DispatchResult(id, STATUS_LOST_RACE, null, null, "claimed elsewhere or no longer approved");
        }
        Claim claim = claimed.get();
        WorkItem item;
        try {
            item = engine.readOrQuarantine(claim.collection(), id, dispatcherId)
                    .orElseThrow(() -> new RecordNotFoundException(claim.collection(), id));
        } catch (MalformedRecordException e) {
            return new DispatchResult(id, STATUS_QUARANTINED, null, null, e.reason());
        }
        ApprovalRequest request;
        try {
            request = ApprovalRequest.from(item);
        } catch (IllegalArgumentException e) {
            engine.quarantine(claim.collection(), id, dispatcherId, e.getMessage());
            return new DispatchResult(id, STATUS_QUARANTINED, null, null, e.getMessage());
        }
        String action = request.action().code();
        String target = request.target();

        ApprovalVerdict verdict = gate.checkClaimed(claim, request, dispatcherId);
        if (verdict.outcome() == ApprovalVerdict.Outcome.EXPIRED) {
            Map<String, Object> params = new LinkedHashMap<>();
            params.put("action", action);
            params.put("approved_file", id);
            params.put("result", STATUS_SKIPPED_EXPIRED);
            ledger.append(new AuditLogEntry(store.now(), action + "_skipped", dispatcherId, targetOr(target, id),
                    params, AuditResult.FAILURE, verdict.detail()));
            LOG.warn("Approval expired: {} -- skipping", id);
            return new DispatchResult(id, STATUS_SKIPPED_EXPIRED, action, target, verdict.detail());
        }
        if (!verdict.executable()) {
            claims.release(claim, dispatcherId, verdict.detail());
            return new DispatchResult(id, STATUS_NOT_APPROVED, action, target, verdict.detail());
        }

        Optional<ActionExecutor> executor = executors.get().find(request.action());
        if (executor.isEmpty()) {
            claims.release(claim, dispatcherId, "no executor for " + action);
            Map<String, Object> params = new LinkedHashMap<>();
            params.put("action", action);
            ledger.append(AuditLogEntry.failure(store.now(), action + "_unsupported", dispatcherId, id, params,
                    "No executor registered for action " + action));
            LOG.warn("Unknown action {} in {} -- released", action, id);
            return new DispatchResult(id, STATUS_UNSUPPORTED, action, target, "no executor registered");
        }

        ExecutionResult result;
        try {
            String recordText = store.readRaw(claim.collection(), id).orElse("");
            result = executor.get().execute(new ExecutionContext(request, dispatcherId, recordText));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result = ExecutionResult.fail("interrupted");
        } catch (Exception e) {
            LOG.error("Error executing action {} for {}", action, id, e);
            result = ExecutionResult.fail(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        if (result == null) {
            result = ExecutionResult.fail("executor " + executor.get().id() + " returned no result");
        }
        claims.heartbeat(dispatcherId);

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("action", action);
        params.put("approved_file", id);
        params.put("executor", executor.get().id());
        params.put("result", result.outcome().code());
        if (result.failed()) {
            ledger.append(AuditLogEntry.failure(store.now(), action + "_executed", dispatcherId,
                    targetOr(target, id), params, result.error()));
            claims.release(claim, dispatcherId, result.error());
            return new DispatchResult(id, STATUS_FAILED, action, target, result.error());
        }
        AuditResult auditResult = result.outcome() == ExecutionResult.Outcome.SUCCESS
                ? AuditResult.SUCCESS
                : AuditResult.PARTIAL;
        ledger.append(new AuditLogEntry(store.now(), action + "_executed", dispatcherId, targetOr(target, id),
                params, auditResult, null));
        claims.complete(claim, WorkflowState.DONE, dispatcherId, Map.of("action", action));
        completeLinkedItem(request, dispatcherId);
        String status = result.outcome() == ExecutionResult.Outcome.SUCCESS ? STATUS_EXECUTED : STATUS_MANUAL;
        return new DispatchResult(id, status, action, target, result.output());
    }

    /**
     * Repeats {@link #tick} until {@code running} is cleared, heartbeating and reclaiming stale
     * claims between passes. Failures of a single pass are logged and the loop continues.
     */
    public void run(String dispatcherId, AtomicBoolean running, Consumer<TickOutcome> listener)
            throws InterruptedException {
        LOG.info("Dispatcher {} started -- interval={}ms dry_run={}",
                dispatcherId, settings.get().dispatchIntervalMs(), settings.get().dryRun());
        while (running.get()) {
            try {
                store.heartbeat(dispatcherId);
                ClaimController.ReclaimSummary reclaimed = claims.reclaimStale(settings.get().claimTtl(), dispatcherId);
                if (reclaimed.reclaimed() > 0) {
                    LOG.info("Reclaimed {} stale claim(s)", reclaimed.reclaimed());
                }
                TickOutcome outcome = tick(dispatcherId);
                if (outcome.scanned() > 0 && listener != null) {
                    listener.accept(outcome);
                }
            } catch (RuntimeException e) {
                LOG.error("Error during Approved/ scan", e);
            }
            Thread.sleep(settings.get().dispatchIntervalMs());
        }
        LOG.info("Dispatcher {} stopped", dispatcherId);
    }

    private DispatchResult dryRun(String id, String dispatcherId) {
        ApprovalVerdict verdict = gate.checkExecutable(id, dispatcherId);
        switch (verdict.outcome()) {
            case EXPIRED:
                return new DispatchResult(id, STATUS_SKIPPED_EXPIRED, null, null, verdict.detail());
            case NOT_FOUND:
                return new DispatchResult(id, STATUS_LOST_RACE, null, null, verdict.detail());
            case NOT_APPROVED:
                return new DispatchResult(id, STATUS_NOT_APPROVED, null, null, verdict.detail());
            default:
                break;
        }
        CollectionRef approved = CollectionRef.of(WorkflowState.APPROVED);
        Optional<WorkItem> item = store.read(approved, id);
        if (item.isEmpty()) {
            return new DispatchResult(id, STATUS_LOST_RACE, null, null, "no longer approved");
        }
        ApprovalRequest request = ApprovalRequest.from(item.get());
        String action = request.action().code();
        if (dryRunAnnounced.add(id)) {
            LOG.info("[DRY_RUN] Would run {} for {} (target={})", action, id, request.target());
            Map<String, Object> params = new LinkedHashMap<>();
            params.put("action", action);
            params.put("approved_file", id);
            params.put("result", STATUS_DRY_RUN);
            ledger.append(new AuditLogEntry(store.now(), action + "_executed", dispatcherId,
                    targetOr(request.target(), id), params, AuditResult.PARTIAL, null));
        }
        return new DispatchResult(id, STATUS_DRY_RUN, action, request.target(), "record left in Approved");
    }

    private void completeLinkedItem(ApprovalRequest request, String dispatcherId) {
        String linked = request.linkedItemId();
        if (linked == null || linked.isBlank()) {
            return;
        }
        try {
            engine.transition(linked, WorkflowState.PLANNED, WorkflowState.DONE, dispatcherId,
                    Map.of("approval", request.id()));
        } catch (RecordNotFoundException e) {
            LOG.debug("Linked item {} of {} is not in Plans; leaving it", linked, request.id());
        } catch (VaultStoreException e) {
            LOG.warn("Could not archive linked item {} of {}: {}", linked, request.id(), e.getMessage());
        }
    }

    private static String targetOr(String target, String fallback) {
        return target == null || target.isBlank() ? fallback : target;
    }

    private record Candidate(WorkItem item) {
        static final Comparator<Candidate> DISPATCH_ORDER = Comparator
                .comparing((Candidate c) -> c.item().priority()).reversed()
                .thenComparing(c -> c.item().createdAt())
                .thenComparing(c -> c.item().id());
    }

    public record DispatchResult(String requestId, String status, String action, String target, String detail) {
    }

    public record TickOutcome(
            int scanned,
            int executed,
            int manual,
            int skippedExpired,
            int failed,
            int lostRaces,
            int dryRun,
            List<DispatchResult> results
    ) {
        static TickOutcome of(List<DispatchResult> results) {
            int executed = 0;
            int manual = 0;
            int expired = 0;
            int failed = 0;
            int lost = 0;
            int dry = 0;
            for (DispatchResult result : results) {
                switch (result.status()) {
                    case STATUS_EXECUTED -> executed++;
                    case STATUS_MANUAL -> manual++;
                    case STATUS_SKIPPED_EXPIRED -> expired++;
                    case STATUS_LOST_RACE -> lost++;
                    case STATUS_DRY_RUN -> dry++;
                    case STATUS_FAILED, STATUS_QUARANTINED, STATUS_UNSUPPORTED -> failed++;
                    default -> {
                    }
                }
            }
            return new TickOutcome(results.size(), executed, manual, expired, failed, lost, dry, List.copyOf(results));
        }
    }
}
