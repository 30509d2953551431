package io.vaultflow.storage;

import io.vaultflow.model.CollectionRef;
import io.vaultflow.model.WorkItem;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Durable, flat-named persistence for work items. All cross-process coordination in the vault
 * rests on two guarantees of this contract: {@link #createExclusive} never lets two creators
 * both succeed, and {@link #moveAtomic} leaves a record in exactly one of the two collections.
 */
public interface RecordStore {

    /** Creates the backing collections. Idempotent. */
    void init();

    /**
     * Writes {@code item} into {@code collection}; fails with {@link RecordAlreadyExistsException}
     * when a record with the same id is already there.
     */
    void createExclusive(CollectionRef collection, WorkItem item);

    /**
     * Moves one record between collections in a single indivisible step.
     *
     * @throws RecordNotFoundException      if {@code id} is not in {@code from}
     * @throws RecordAlreadyExistsException if {@code id} is already in {@code to}
     */
    void moveAtomic(CollectionRef from, CollectionRef to, String id);

    /** Ids currently in {@code collection}, sorted. A snapshot; it may be stale by the time it is used. */
    List<String> list(CollectionRef collection);

    /**
     * @throws MalformedRecordException if the stored record fails schema validation
     */
    Optional<WorkItem> read(CollectionRef collection, String id);

    /**
     * Replaces the record with {@code mutator}'s result. Last writer wins; readers observe the
     * old or the new record, never a mix. The mutator must not change the id.
     */
    WorkItem update(CollectionRef collection, String id, UnaryOperator<WorkItem> mutator);

    /** Raw stored text of a record, for executors that hand the record to external tools. */
    Optional<String> readRaw(CollectionRef collection, String id);

    /** Best-effort lookup of the collection currently holding {@code id}. */
    Optional<CollectionRef> locate(String id);

    /** Moves a record into the review quarantine without parsing it. */
    void quarantine(CollectionRef collection, String id);

    /** State collections, the quarantine and every owner scope currently present. */
    List<CollectionRef> collections();

    List<CollectionRef> ownerScopes();

    /** Stamps a liveness heartbeat for {@code ownerId} with the store clock. */
    Instant heartbeat(String ownerId);

    Map<String, Instant> heartbeats();

    /** The store's authoritative clock. */
    Instant now();
}
