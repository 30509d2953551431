package io.vaultflow.approval;

import io.vaultflow.model.WorkflowState;

import java.time.Instant;

/**
 * Result of an executability check.
 *
 * @param state     where the request was found ({@code null} when not found)
 * @param expiresAt the request's expiry, when it could be read
 */
public record ApprovalVerdict(
        String requestId,
        Outcome outcome,
        WorkflowState state,
        Instant checkedAt,
        Instant expiresAt,
        String detail
) {
    public enum Outcome {
        EXECUTABLE,
        EXPIRED,
        NOT_APPROVED,
        NOT_FOUND
    }

    public boolean executable() {
        return outcome == Outcome.EXECUTABLE;
    }
}
