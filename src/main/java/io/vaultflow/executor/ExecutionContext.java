package io.vaultflow.executor;

import io.vaultflow.model.ApprovalRequest;

/**
 * @param recordText the stored record as written in the vault, handed verbatim to external tools
 */
public record ExecutionContext(
        ApprovalRequest request,
        String dispatcherId,
        String recordText
) {
}
