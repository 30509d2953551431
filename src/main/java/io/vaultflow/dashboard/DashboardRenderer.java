package io.vaultflow.dashboard;

import io.vaultflow.model.AuditLogEntry;
import io.vaultflow.model.DashboardSnapshot;

import java.util.Map;

/**
 * Renders a {@link DashboardSnapshot} as the human-facing {@code Dashboard.md}.
 */
public final class DashboardRenderer {
    private DashboardRenderer() {
    }

    public static String render(DashboardSnapshot snapshot) {
        StringBuilder sb = new StringBuilder();
        sb.append("# Dashboard\n\n");
        sb.append("_Last updated: ").append(snapshot.generatedAt()).append(" by ")
                .append(snapshot.writerRole()).append("_\n\n");

        sb.append("## Status\n\n");
        sb.append("| Collection | Items |\n");
        sb.append("|---|---|\n");
        for (Map.Entry<String, Integer> entry : snapshot.collectionCounts().entrySet()) {
            sb.append("| ").append(entry.getKey()).append(" | ").append(entry.getValue()).append(" |\n");
        }
        sb.append('\n');

        sb.append("## Alerts\n\n");
        if (snapshot.alerts().isEmpty()) {
            sb.append("None.\n");
        }
        for (String alert : snapshot.alerts()) {
            sb.append("- ").append(cell(alert)).append('\n');
        }
        sb.append('\n');

        sb.append("## Open Approvals\n\n");
        if (snapshot.openApprovals().isEmpty()) {
            sb.append("None.\n");
        } else {
            sb.append("| Request | State | Action | Target | Expires |\n");
            sb.append("|---|---|---|---|---|\n");
            for (DashboardSnapshot.ApprovalView view : snapshot.openApprovals()) {
                sb.append("| ").append(cell(view.requestId()))
                        .append(" | ").append(view.state())
                        .append(" | ").append(view.action())
                        .append(" | ").append(cell(view.target()))
                        .append(" | ").append(view.expiresAt()).append(view.expired() ? " (past due)" : "")
                        .append(" |\n");
            }
        }
        sb.append('\n');

        sb.append("## Active Claims\n\n");
        if (snapshot.activeClaims().isEmpty()) {
            sb.append("None.\n");
        }
        for (DashboardSnapshot.ClaimView claim : snapshot.activeClaims()) {
            sb.append("- ").append(claim.itemId()).append(" held by ").append(claim.ownerId())
                    .append(" since ").append(claim.claimedAt() == null ? "?" : claim.claimedAt())
                    .append(" (from ").append(claim.origin()).append(")\n");
        }
        sb.append('\n');

        if (!snapshot.fields().isEmpty()) {
            sb.append("## Updates\n\n");
            for (Map.Entry<String, DashboardSnapshot.FieldView> entry : snapshot.fields().entrySet()) {
                DashboardSnapshot.FieldView field = entry.getValue();
                sb.append("- **").append(cell(entry.getKey())).append("**: ").append(cell(field.value()))
                        .append(" _(").append(field.role()).append(", ").append(field.submittedAt()).append(")_\n");
            }
            sb.append('\n');
        }

        sb.append("## Recent Activity\n\n");
        if (snapshot.recentActivity().isEmpty()) {
            sb.append("None.\n");
        }
        for (int i = snapshot.recentActivity().size() - 1; i >= 0; i--) {
            AuditLogEntry entry = snapshot.recentActivity().get(i);
            sb.append("- ").append(entry.timestamp()).append(' ')
                    .append(entry.actionType()).append(' ')
                    .append(cell(entry.target())).append(" (").append(entry.actor()).append(", ")
                    .append(entry.result().code()).append(")\n");
        }

        if (!snapshot.warnings().isEmpty()) {
            sb.append("\n## Merge Warnings\n\n");
            for (String warning : snapshot.warnings()) {
                sb.append("- ").append(cell(warning)).append('\n');
            }
        }
        return sb.toString();
    }

    private static String cell(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.replace("\r", " ").replace("\n", " ").replace("|", "\\|");
    }
}
