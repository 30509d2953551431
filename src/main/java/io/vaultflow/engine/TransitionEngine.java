package io.vaultflow.engine;

import io.vaultflow.ledger.AuditLedger;
import io.vaultflow.model.AuditLogEntry;
import io.vaultflow.model.Claim;
import io.vaultflow.model.CollectionRef;
import io.vaultflow.model.WorkItem;
import io.vaultflow.model.WorkflowState;
import io.vaultflow.storage.MalformedRecordException;
import io.vaultflow.storage.RecordAlreadyExistsException;
import io.vaultflow.storage.RecordNotFoundException;
import io.vaultflow.storage.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Validates every state change against {@link TransitionRules} and performs it as one atomic
 * move, writing one ledger entry per outcome.
 *
 * <p>The {@code status} field inside a record is only rewritten while the record sits in an
 * owner scope (see {@link #completeClaim}); a plain transition moves the file and leaves the
 * mirror for readers to reconcile against the collection.
 */
public final class TransitionEngine {
    public static final String ACTION_ADMIT = "admit";
    public static final String ACTION_TRANSITION = "transition";
    public static final String ACTION_EXPIRE = "expire";
    public static final String ACTION_ILLEGAL_TRANSITION = "illegal_transition";
    public static final String ACTION_MALFORMED_RECORD = "malformed_record";

    private static final Logger LOG = LoggerFactory.getLogger(TransitionEngine.class);

    private final RecordStore store;
    private final AuditLedger ledger;

    public TransitionEngine(RecordStore store, AuditLedger ledger) {
        this.store = store;
        this.ledger = ledger;
    }

    /**
     * Creates a new record in its admission collection. A record that already exists anywhere in
     * the vault is reported as a duplicate and left untouched.
     */
    public AdmitOutcome admit(WorkItem item, String actor) {
        if (!TransitionRules.admissible(item.kind(), item.state())) {
            throw illegal(item.id(), null, item.state(), actor, Map.of("type", item.kind().type()));
        }
        CollectionRef target = CollectionRef.of(item.state());
        Optional<CollectionRef> existing = store.locate(item.id());
        if (existing.isPresent()) {
            LOG.debug("Admission of {} skipped, already in {}", item.id(), existing.get());
            return new AdmitOutcome(item.id(), existing.get().name(), true);
        }
        try {
            store.createExclusive(target, item);
        } catch (RecordAlreadyExistsException e) {
            LOG.debug("Admission of {} lost to a concurrent creator", item.id());
            return new AdmitOutcome(item.id(), target.name(), true);
        }
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("state", item.state().status());
        params.put("type", item.kind().type());
        params.put("priority", item.priority().label());
        params.put("source", item.source());
        ledger.append(AuditLogEntry.success(store.now(), ACTION_ADMIT, actor, item.id(), params));
        return new AdmitOutcome(item.id(), target.name(), false);
    }

    /**
     * Moves {@code id} from the collection of {@code from} to the collection of {@code to}.
     *
     * @throws IllegalTransitionException if the graph has no such edge
     * @throws RecordNotFoundException    if the record is not (or no longer) in {@code from}
     * @throws MalformedRecordException   if the record fails validation; it is quarantined first
     */
    public TransitionOutcome transition(String id, WorkflowState from, WorkflowState to, String actor,
                                        Map<String, Object> parameters) {
        if (!TransitionRules.allowed(from, to)) {
            throw illegal(id, from, to, actor, parameters);
        }
        CollectionRef source = CollectionRef.of(from);
        readOrQuarantine(source, id, actor).orElseThrow(() -> new RecordNotFoundException(source, id));
        store.moveAtomic(source, CollectionRef.of(to), id);
        return recordTransition(id, from, to, actor, parameters);
    }

    /**
     * Finishes a claim by moving the item out of its owner scope. The status mirror is rewritten
     * and the claim fields removed while the owner still has custody.
     */
    public TransitionOutcome completeClaim(Claim claim, WorkflowState to, String actor, Map<String, Object> parameters) {
        if (!TransitionRules.allowed(claim.origin(), to)) {
            throw illegal(claim.itemId(), claim.origin(), to, actor, parameters);
        }
        store.update(claim.collection(), claim.itemId(),
                item -> item.withoutMetadata(Claim.METADATA_KEYS).withState(to));
        store.moveAtomic(claim.collection(), CollectionRef.of(to), claim.itemId());
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("owner", claim.ownerId());
        if (parameters != null) {
            params.putAll(parameters);
        }
        return recordTransition(claim.itemId(), claim.origin(), to, actor, params);
    }

    /**
     * Moves a request that has run out of time to {@code Expired}, from its state collection or
     * from an owner scope.
     *
     * @param logicalFrom the state the request is in (for an owner scope, the state it was claimed from)
     */
    public TransitionOutcome expire(CollectionRef holder, String id, WorkflowState logicalFrom, String actor,
                                    Map<String, Object> parameters) {
        if (!TransitionRules.allowed(logicalFrom, WorkflowState.EXPIRED)) {
            throw illegal(id, logicalFrom, WorkflowState.EXPIRED, actor, parameters);
        }
        if (holder.isOwnerScoped()) {
            store.update(holder, id, item -> item.withoutMetadata(Claim.METADATA_KEYS).withState(WorkflowState.EXPIRED));
        }
        store.moveAtomic(holder, CollectionRef.of(WorkflowState.EXPIRED), id);
        Instant at = store.now();
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("from", logicalFrom.status());
        params.put("collection", holder.name());
        if (parameters != null) {
            params.putAll(parameters);
        }
        ledger.append(AuditLogEntry.success(at, ACTION_EXPIRE, actor, id, params));
        LOG.warn("Approval {} expired (was {})", id, logicalFrom.status());
        return new TransitionOutcome(id, logicalFrom, WorkflowState.EXPIRED, at);
    }

    /**
     * Reads a record, quarantining it when it fails validation.
     *
     * @throws MalformedRecordException after the record has been moved to the quarantine
     */
    public Optional<WorkItem> readOrQuarantine(CollectionRef collection, String id, String actor) {
        try {
            return store.read(collection, id);
        } catch (MalformedRecordException e) {
            quarantine(collection, id, actor, e.reason());
            throw e;
        }
    }

    public void quarantine(CollectionRef collection, String id, String actor, String reason) {
        try {
            store.quarantine(collection, id);
        } catch (RecordNotFoundException e) {
            LOG.debug("Record {} left {} before it could be quarantined", id, collection);
            return;
        } catch (RecordAlreadyExistsException e) {
            LOG.warn("Quarantine already holds a record named {}; leaving it in {}", id, collection);
        }
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("collection", collection.name());
        ledger.append(AuditLogEntry.failure(store.now(), ACTION_MALFORMED_RECORD, actor, id, params, reason));
    }

    private TransitionOutcome recordTransition(String id, WorkflowState from, WorkflowState to, String actor,
                                               Map<String, Object> parameters) {
        Instant at = store.now();
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("from", from.status());
        params.put("to", to.status());
        if (parameters != null) {
            params.putAll(parameters);
        }
        ledger.append(AuditLogEntry.success(at, ACTION_TRANSITION, actor, id, params));
        LOG.info("{}: {} -> {} by {}", id, from.status(), to.status(), actor);
        return new TransitionOutcome(id, from, to, at);
    }

    private IllegalTransitionException illegal(String id, WorkflowState from, WorkflowState to, String actor,
                                               Map<String, Object> parameters) {
        IllegalTransitionException e = new IllegalTransitionException(id, from, to);
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("from", from == null ? "" : from.status());
        params.put("to", to.status());
        if (parameters != null) {
            params.putAll(parameters);
        }
        ledger.append(AuditLogEntry.failure(store.now(), ACTION_ILLEGAL_TRANSITION, actor, id, params, e.getMessage()));
        LOG.warn(e.getMessage());
        return e;
    }

    public record AdmitOutcome(String itemId, String collection, boolean duplicate) {
    }

    public record TransitionOutcome(String itemId, WorkflowState from, WorkflowState to, Instant at) {
    }
}
