package io.vaultflow.storage;

import io.vaultflow.model.CollectionRef;

/**
 * The record is not in the named collection. For a claim this is the normal "someone else got
 * there first" outcome.
 */
public final class RecordNotFoundException extends VaultStoreException {
    private final CollectionRef collection;
    private final String recordId;

    public RecordNotFoundException(CollectionRef collection, String recordId) {
        super("Record " + recordId + " not found in " + collection);
        this.collection = collection;
        this.recordId = recordId;
    }

    public CollectionRef collection() {
        return collection;
    }

    public String recordId() {
        return recordId;
    }
}
