package io.vaultflow.approval;

import io.vaultflow.config.VaultFlowSettings;
import io.vaultflow.engine.IllegalTransitionException;
import io.vaultflow.engine.TransitionEngine;
import io.vaultflow.engine.TransitionRules;
import io.vaultflow.model.ActionType;
import io.vaultflow.model.ApprovalRequest;
import io.vaultflow.model.Claim;
import io.vaultflow.model.CollectionRef;
import io.vaultflow.model.Priority;
import io.vaultflow.model.WorkItem;
import io.vaultflow.model.WorkflowState;
import io.vaultflow.storage.MalformedRecordException;
import io.vaultflow.storage.RecordNotFoundException;
import io.vaultflow.storage.RecordStore;
import io.vaultflow.util.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Time-bounded human sign-off for side-effecting actions.
 *
 * <p>Expiry is judged against the store clock with the configured skew allowance taken off the
 * deadline, so a doubtful reading resolves to expired. An expired request is moved to
 * {@code Expired} the first time anyone notices, which makes every later check answer
 * {@link ApprovalVerdict.Outcome#EXPIRED} as well.
 */
public final class ApprovalGate {
    private static final Logger LOG = LoggerFactory.getLogger(ApprovalGate.class);
    private static final DateTimeFormatter ID_STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);
    private static final int MAX_RELOCATE_ATTEMPTS = 4;

    private final RecordStore store;
    private final TransitionEngine engine;
    private final Supplier<VaultFlowSettings> settings;

    public ApprovalGate(RecordStore store, TransitionEngine engine, Supplier<VaultFlowSettings> settings) {
        this.store = store;
        this.engine = engine;
        this.settings = settings;
    }

    /**
     * Creates a request in {@code Pending_Approval} whose expiry is fixed at store-now plus the
     * configured approval window.
     */
    public RequestOutcome request(Draft draft, String actor) {
        Instant now = store.now();
        String id = draft.id() == null || draft.id().isBlank() ? newRequestId(draft.action(), now) : draft.id().trim();
        ApprovalRequest request = ApprovalRequest.create(
                id,
                draft.action(),
                draft.priority(),
                now,
                settings.get().approvalWindow(),
                draft.source(),
                draft.linkedItemId(),
                draft.target(),
                draft.metadata(),
                draft.body()
        );
        TransitionEngine.AdmitOutcome admitted = engine.admit(request.item(), actor);
        return new RequestOutcome(id, request.action(), request.expiresAt(), admitted.collection(), admitted.duplicate());
    }

    /**
     * Human approval. A request that is already past its deadline is expired instead.
     *
     * @throws ApprovalExpiredException if the request ran out of time before the decision
     */
    public TransitionEngine.TransitionOutcome approve(String id, String actor) {
        CollectionRef pending = CollectionRef.of(WorkflowState.PENDING_APPROVAL);
        WorkItem item = engine.readOrQuarantine(pending, id, actor)
                .orElseThrow(() -> new RecordNotFoundException(pending, id));
        ApprovalRequest request = asRequest(pending, item);
        Instant now = store.now();
        if (request.isExpiredAt(now, settings.get().clockSkewAllowance())) {
            try {
                engine.expire(pending, id, WorkflowState.PENDING_APPROVAL, actor, expiryParams(request, now, "approve"));
            } catch (RecordNotFoundException e) {
                LOG.debug("Expired request {} left {} before it could be expired", id, pending);
            }
            throw new ApprovalExpiredException(id, request.expiresAt(), now);
        }
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("decision", "approved");
        params.put("action", request.action().code());
        params.put("expires", request.expiresAt().toString());
        return engine.transition(id, WorkflowState.PENDING_APPROVAL, WorkflowState.APPROVED, actor, params);
    }

    /** Human rejection; also the way to cancel a request any time before it is approved. */
    public TransitionEngine.TransitionOutcome reject(String id, String actor, String reason) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("decision", "rejected");
        if (reason != null && !reason.isBlank()) {
            params.put("reason", reason);
        }
        return engine.transition(id, WorkflowState.PENDING_APPROVAL, WorkflowState.REJECTED, actor, params);
    }

    /**
     * Decides whether {@code id} may execute now, wherever it currently sits. Finding it past its
     * deadline in {@code Pending_Approval} or {@code Approved} moves it to {@code Expired}. A request
     * held in an owner scope is only reported on; expiring it is left to its owner or to reclaim.
     */
    public ApprovalVerdict checkExecutable(String id, String actor) {
        for (int attempt = 1; attempt <= MAX_RELOCATE_ATTEMPTS; attempt++) {
            Optional<CollectionRef> located = store.locate(id);
            if (located.isEmpty()) {
                return new ApprovalVerdict(id, ApprovalVerdict.Outcome.NOT_FOUND, null, store.now(), null, "no such request");
            }
            CollectionRef holder = located.get();
            if (CollectionRef.QUARANTINE.equals(holder)) {
                return new ApprovalVerdict(id, ApprovalVerdict.Outcome.NOT_APPROVED, null, store.now(), null, "quarantined");
            }
            if (holder.isOwnerScoped()) {
                Optional<ApprovalVerdict> held = custodyVerdict(holder, id);
                if (held.isEmpty()) {
                    continue;
                }
                return held.get();
            }
            Optional<WorkItem> read;
            try {
                read = engine.readOrQuarantine(holder, id, actor);
            } catch (MalformedRecordException e) {
                return new ApprovalVerdict(id, ApprovalVerdict.Outcome.NOT_APPROVED, null, store.now(), null,
                        "malformed: " + e.reason());
            }
            if (read.isEmpty()) {
                continue;
            }
            WorkItem item = read.get();
            WorkflowState logical = logicalState(holder, item);
            if (logical == WorkflowState.EXPIRED) {
                return new ApprovalVerdict(id, ApprovalVerdict.Outcome.EXPIRED, logical, store.now(),
                        item.metadata(ApprovalRequest.EXPIRES_KEY).flatMap(Timestamps::parse).orElse(null),
                        "already expired");
            }
            ApprovalRequest request;
            try {
                request = ApprovalRequest.from(item);
            } catch (IllegalArgumentException e) {
                return new ApprovalVerdict(id, ApprovalVerdict.Outcome.NOT_APPROVED, logical, store.now(), null,
                        e.getMessage());
            }
            Instant now = store.now();
            if (request.isExpiredAt(now, settings.get().clockSkewAllowance())) {
                if (TransitionRules.allowed(logical, WorkflowState.EXPIRED)) {
                    try {
                        engine.expire(holder, id, logical, actor, expiryParams(request, now, "check"));
                    } catch (RecordNotFoundException e) {
                        LOG.debug("{} moved while being expired, relocating", id);
                        continue;
                    }
                }
                return new ApprovalVerdict(id, ApprovalVerdict.Outcome.EXPIRED, logical, now, request.expiresAt(),
                        "expired at " + request.expiresAt());
            }
            if (logical == WorkflowState.APPROVED) {
                return new ApprovalVerdict(id, ApprovalVerdict.Outcome.EXECUTABLE, logical, now, request.expiresAt(), "");
            }
            return new ApprovalVerdict(id, ApprovalVerdict.Outcome.NOT_APPROVED, logical, now, request.expiresAt(),
                    "request is " + logical.status());
        }
        return new ApprovalVerdict(id, ApprovalVerdict.Outcome.NOT_APPROVED, null, store.now(), null,
                "request kept moving while being checked");
    }

    /**
     * The executor-side check, made while holding custody of the request.
     */
    public ApprovalVerdict checkClaimed(Claim claim, ApprovalRequest request, String actor) {
        Instant now = store.now();
        if (request.isExpiredAt(now, settings.get().clockSkewAllowance())) {
            engine.expire(claim.collection(), claim.itemId(), claim.origin(), actor, expiryParams(request, now, "dispatch"));
            return new ApprovalVerdict(claim.itemId(), ApprovalVerdict.Outcome.EXPIRED, claim.origin(), now,
                    request.expiresAt(), "expired at " + request.expiresAt());
        }
        if (claim.origin() != WorkflowState.APPROVED) {
            return new ApprovalVerdict(claim.itemId(), ApprovalVerdict.Outcome.NOT_APPROVED, claim.origin(), now,
                    request.expiresAt(), "request is " + claim.origin().status());
        }
        return new ApprovalVerdict(claim.itemId(), ApprovalVerdict.Outcome.EXECUTABLE, claim.origin(), now,
                request.expiresAt(), "");
    }

    /**
     * Like {@link #checkExecutable} but throws for every outcome except executable.
     */
    public ApprovalVerdict requireExecutable(String id, String actor) {
        ApprovalVerdict verdict = checkExecutable(id, actor);
        switch (verdict.outcome()) {
            case EXECUTABLE:
                return verdict;
            case EXPIRED:
                throw new ApprovalExpiredException(id, verdict.expiresAt(), verdict.checkedAt());
            case NOT_FOUND:
                throw new RecordNotFoundException(CollectionRef.of(WorkflowState.APPROVED), id);
            default:
                throw new IllegalTransitionException(id, verdict.state(), WorkflowState.DONE);
        }
    }

    public static String newRequestId(ActionType action, Instant now) {
        return "APPROVAL_" + action.code() + "_" + ID_STAMP.format(now) + "_"
                + Integer.toHexString(ThreadLocalRandom.current().nextInt(0x1000, 0x10000));
    }

    private ApprovalRequest asRequest(CollectionRef collection, WorkItem item) {
        try {
            return ApprovalRequest.from(item);
        } catch (IllegalArgumentException e) {
            throw new MalformedRecordException(collection, item.id(), e.getMessage(), e);
        }
    }

    private Optional<ApprovalVerdict> custodyVerdict(CollectionRef holder, String id) {
        String owner = holder.ownerId().orElseThrow();
        Optional<WorkItem> read;
        try {
            read = store.read(holder, id);
        } catch (MalformedRecordException e) {
            return Optional.of(new ApprovalVerdict(id, ApprovalVerdict.Outcome.NOT_APPROVED, null, store.now(), null,
                    "in custody of " + owner));
        }
        if (read.isEmpty()) {
            return Optional.empty();
        }
        WorkItem item = read.get();
        WorkflowState logical = logicalState(holder, item);
        Instant now = store.now();
        Instant expiresAt = item.metadata(ApprovalRequest.EXPIRES_KEY).flatMap(Timestamps::parse).orElse(null);
        if (expiresAt == null || !now.isBefore(expiresAt.minus(skewAllowance()))) {
            return Optional.of(new ApprovalVerdict(id, ApprovalVerdict.Outcome.EXPIRED, logical, now, expiresAt,
                    expiresAt == null ? "no valid expiry, in custody of " + owner : "expired at " + expiresAt));
        }
        return Optional.of(new ApprovalVerdict(id, ApprovalVerdict.Outcome.NOT_APPROVED, logical, now, expiresAt,
                "in custody of " + owner));
    }

    private Duration skewAllowance() {
        Duration skew = settings.get().clockSkewAllowance();
        return skew == null || skew.isNegative() ? Duration.ZERO : skew;
    }

    private static WorkflowState logicalState(CollectionRef holder, WorkItem item) {
        if (holder.state().isPresent()) {
            return holder.state().get();
        }
        return item.metadata(Claim.CLAIMED_FROM_KEY)
                .map(raw -> {
                    try {
                        return WorkflowState.fromString(raw);
                    } catch (IllegalArgumentException e) {
                        return item.state();
                    }
                })
                .orElse(item.state());
    }

    private static Map<String, Object> expiryParams(ApprovalRequest request, Instant now, String detectedBy) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("action", request.action().code());
        params.put("expires", request.expiresAt().toString());
        params.put("checked_at", now.toString());
        params.put("detected_by", detectedBy);
        return params;
    }

    public record Draft(
            String id,
            ActionType action,
            Priority priority,
            String source,
            String linkedItemId,
            String target,
            Map<String, String> metadata,
            String body
    ) {
    }

    public record RequestOutcome(
            String requestId,
            ActionType action,
            Instant expiresAt,
            String collection,
            boolean duplicate
    ) {
    }
}
