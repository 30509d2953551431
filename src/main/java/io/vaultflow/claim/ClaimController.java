package io.vaultflow.claim;

import io.vaultflow.engine.TransitionEngine;
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
import io.vaultflow.util.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * At-most-one-owner custody. Claiming is a single atomic move into {@code In_Progress/<owner>};
 * when two workers race, the store's rename decides and the loser sees "not found".
 */
public final class ClaimController {
    public static final String ACTION_CLAIM = "claim";
    public static final String ACTION_RELEASE = "release";
    public static final String ACTION_RECLAIM = "reclaim";

    private static final Logger LOG = LoggerFactory.getLogger(ClaimController.class);

    private final RecordStore store;
    private final TransitionEngine engine;
    private final AuditLedger ledger;

    public ClaimController(RecordStore store, TransitionEngine engine, AuditLedger ledger) {
        this.store = store;
        this.engine = engine;
        this.ledger = ledger;
    }

    /**
     * Tries to take custody of {@code id} from the collection of {@code from}.
     *
     * @return the claim, or empty when another owner got there first (or the item is gone)
     * @throws MalformedRecordException if the claimed record fails validation; it is quarantined
     */
    public Optional<Claim> tryClaim(WorkflowState from, String id, String ownerId) {
        CollectionRef source = CollectionRef.of(from);
        CollectionRef scope = CollectionRef.ownerScoped(ownerId);
        try {
            store.moveAtomic(source, scope, id);
        } catch (RecordNotFoundException e) {
            LOG.debug("{} not claimed by {}: no longer in {}", id, ownerId, source);
            return Optional.empty();
        } catch (RecordAlreadyExistsException e) {
            LOG.debug("{} not claimed by {}: already in {}", id, ownerId, scope);
            return Optional.empty();
        }
        Instant at = store.now();
        try {
            store.update(scope, id, item -> item
                    .withMetadata(Claim.CLAIMED_BY_KEY, ownerId)
                    .withMetadata(Claim.CLAIMED_AT_KEY, at.toString())
                    .withMetadata(Claim.CLAIMED_FROM_KEY, from.status()));
        } catch (MalformedRecordException e) {
            engine.quarantine(scope, id, ownerId, e.reason());
            throw e;
        }
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("owner", ownerId);
        params.put("from", from.status());
        ledger.append(AuditLogEntry.success(at, ACTION_CLAIM, ownerId, id, params));
        return Optional.of(new Claim(id, ownerId, at, from));
    }

    /**
     * Gives an item back to the collection it was claimed from, after a failure or timeout.
     */
    public void release(Claim claim, String actor, String reason) {
        try {
            store.update(claim.collection(), claim.itemId(),
                    item -> item.withoutMetadata(Claim.METADATA_KEYS).withState(claim.origin()));
        } catch (MalformedRecordException e) {
            LOG.warn("Releasing unreadable record {} without clearing its claim: {}", claim.itemId(), e.reason());
        }
        store.moveAtomic(claim.collection(), CollectionRef.of(claim.origin()), claim.itemId());
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("owner", claim.ownerId());
        params.put("to", claim.origin().status());
        if (reason != null && !reason.isBlank()) {
            params.put("reason", reason);
        }
        ledger.append(AuditLogEntry.success(store.now(), ACTION_RELEASE, actor, claim.itemId(), params));
        LOG.info("Released {} back to {}", claim.itemId(), claim.origin().status());
    }

    public TransitionEngine.TransitionOutcome complete(Claim claim, WorkflowState to, String actor,
                                                       Map<String, Object> parameters) {
        return engine.completeClaim(claim, to, actor, parameters);
    }

    public Instant heartbeat(String ownerId) {
        return store.heartbeat(ownerId);
    }

    /** The claim held by {@code ownerId} on {@code id}, rebuilt from the record in the owner scope. */
    public Optional<Claim> claimOf(String ownerId, String id) {
        CollectionRef scope = CollectionRef.ownerScoped(ownerId);
        return store.read(scope, id).map(item -> toClaim(ownerId, item));
    }

    /** Every item currently held in an owner scope. Unreadable records are skipped. */
    public List<Claim> listClaims() {
        List<Claim> out = new ArrayList<>();
        for (CollectionRef scope : store.ownerScopes()) {
            String owner = scope.ownerId().orElseThrow();
            for (String id : store.list(scope)) {
                try {
                    store.read(scope, id).ifPresent(item -> out.add(toClaim(owner, item)));
                } catch (MalformedRecordException e) {
                    LOG.debug("Skipping unreadable claimed record {}: {}", id, e.reason());
                }
            }
        }
        return out;
    }

    /**
     * Returns claimed items to the collections they were claimed from once both the owner's last
     * heartbeat and the item's own {@code claimed_at} are older than {@code ttl}.
     */
    public ReclaimSummary reclaimStale(Duration ttl, String actor) {
        Instant now = store.now();
        Instant cutoff = now.minus(ttl);
        Map<String, Instant> heartbeats = store.heartbeats();
        int scanned = 0;
        int quarantined = 0;
        List<String> reclaimed = new ArrayList<>();
        for (CollectionRef scope : store.ownerScopes()) {
            String owner = scope.ownerId().orElseThrow();
            Instant heartbeat = heartbeats.get(owner);
            for (String id : store.list(scope)) {
                scanned++;
                WorkItem item;
                try {
                    Optional<WorkItem> read = store.read(scope, id);
                    if (read.isEmpty()) {
                        continue;
                    }
                    item = read.get();
                } catch (MalformedRecordException e) {
                    engine.quarantine(scope, id, actor, e.reason());
                    quarantined++;
                    continue;
                }
                Claim claim = toClaim(owner, item);
                Instant lastSign = latest(heartbeat, claim.claimedAt());
                if (lastSign != null && !lastSign.isBefore(cutoff)) {
                    continue;
                }
                try {
                    store.moveAtomic(scope, CollectionRef.of(claim.origin()), id);
                } catch (RecordNotFoundException e) {
                    LOG.debug("{} left {} while being reclaimed", id, scope);
                    continue;
                } catch (RecordAlreadyExistsException e) {
                    LOG.warn("Cannot reclaim {}: {} already holds a record with that id", id, claim.origin().dirName());
                    continue;
                }
                Map<String, Object> params = new LinkedHashMap<>();
                params.put("owner", owner);
                params.put("to", claim.origin().status());
                params.put("last_heartbeat", heartbeat == null ? "" : heartbeat.toString());
                params.put("ttl_ms", ttl.toMillis());
                ledger.append(AuditLogEntry.success(now, ACTION_RECLAIM, actor, id, params));
                LOG.warn("Reclaimed {} from stale owner {} back to {}", id, owner, claim.origin().status());
                reclaimed.add(id);
            }
        }
        return new ReclaimSummary(scanned, reclaimed.size(), quarantined, reclaimed);
    }

    private static Instant latest(Instant a, Instant b) {
        if (a == null) {
            return b;
        }
        return b == null || a.isAfter(b) ? a : b;
    }

    private static Claim toClaim(String ownerId, WorkItem item) {
        Instant claimedAt = item.metadata(Claim.CLAIMED_AT_KEY).flatMap(Timestamps::parse).orElse(null);
        WorkflowState origin = item.state();
        Optional<String> from = item.metadata(Claim.CLAIMED_FROM_KEY);
        if (from.isPresent()) {
            try {
                origin = WorkflowState.fromString(from.get());
            } catch (IllegalArgumentException e) {
                LOG.debug("Unknown claimed_from '{}' on {}, using status {}", from.get(), item.id(), origin.status());
            }
        }
        return new Claim(item.id(), ownerId, claimedAt, origin);
    }

    public record ReclaimSummary(int scanned, int reclaimed, int quarantined, List<String> reclaimedIds) {
    }
}
