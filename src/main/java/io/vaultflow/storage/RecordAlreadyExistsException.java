package io.vaultflow.storage;

import io.vaultflow.model.CollectionRef;

public final class RecordAlreadyExistsException extends VaultStoreException {
    private final CollectionRef collection;
    private final String recordId;

    public RecordAlreadyExistsException(CollectionRef collection, String recordId) {
        super("Record " + recordId + " already exists in " + collection);
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
