package io.vaultflow.approval;

import io.vaultflow.storage.VaultStoreException;

import java.time.Instant;

public final class ApprovalExpiredException extends VaultStoreException {
    private final String requestId;
    private final Instant expiresAt;

    public ApprovalExpiredException(String requestId, Instant expiresAt, Instant checkedAt) {
        super("Approval " + requestId + " expired at " + expiresAt
                + (checkedAt == null ? "" : " (checked at " + checkedAt + ")"));
        this.requestId = requestId;
        this.expiresAt = expiresAt;
    }

    public String requestId() {
        return requestId;
    }

    public Instant expiresAt() {
        return expiresAt;
    }
}
