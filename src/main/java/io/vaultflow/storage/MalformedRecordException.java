package io.vaultflow.storage;

import io.vaultflow.model.CollectionRef;

public final class MalformedRecordException extends VaultStoreException {
    private final CollectionRef collection;
    private final String recordId;
    private final String reason;

    public MalformedRecordException(CollectionRef collection, String recordId, String reason) {
        this(collection, recordId, reason, null);
    }

    public MalformedRecordException(CollectionRef collection, String recordId, String reason, Throwable cause) {
        super("Malformed record " + recordId + " in " + collection + ": " + reason, cause);
        this.collection = collection;
        this.recordId = recordId;
        this.reason = reason;
    }

    public CollectionRef collection() {
        return collection;
    }

    public String recordId() {
        return recordId;
    }

    public String reason() {
        return reason;
    }
}
