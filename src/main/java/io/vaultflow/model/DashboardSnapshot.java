package io.vaultflow.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record DashboardSnapshot(
        Instant generatedAt,
        String writerRole,
        Map<String, Integer> collectionCounts,
        List<ClaimView> activeClaims,
        List<ApprovalView> openApprovals,
        List<String> alerts,
        Map<String, FieldView> fields,
        List<AuditLogEntry> recentActivity,
        List<String> warnings
) {
    public record ClaimView(String itemId, String ownerId, String claimedAt, String origin) {
    }

    public record ApprovalView(
            String requestId,
            String state,
            String action,
            String target,
            Instant expiresAt,
            boolean expired
    ) {
    }

    public record FieldView(String value, String role, Instant submittedAt, String deltaId) {
    }
}
