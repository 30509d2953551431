package io.vaultflow.model;

import java.util.Locale;

/**
 * Named lifecycle states. Each state is backed by one vault collection (directory).
 */
public enum WorkflowState {
    INTAKE("intake", "Needs_Action", false),
    TRIAGED("triaged", "Triaged", false),
    PLANNED("planned", "Plans", false),
    PENDING_APPROVAL("pending_approval", "Pending_Approval", false),
    APPROVED("approved", "Approved", false),
    REJECTED("rejected", "Rejected", true),
    EXPIRED("expired", "Expired", true),
    DONE("done", "Done", true);

    private final String status;
    private final String dirName;
    private final boolean terminal;

    WorkflowState(String status, String dirName, boolean terminal) {
        this.status = status;
        this.dirName = dirName;
        this.terminal = terminal;
    }

    public String status() {
        return status;
    }

    public String dirName() {
        return dirName;
    }

    public boolean terminal() {
        return terminal;
    }

    public static WorkflowState fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("State cannot be empty");
        }
        String value = raw.trim();
        // watchers of the original vault wrote "pending" for freshly dropped items
        if ("pending".equalsIgnoreCase(value) || "needs_action".equalsIgnoreCase(value)) {
            return INTAKE;
        }
        String normalized = value.toLowerCase(Locale.ROOT).replace('-', '_');
        for (WorkflowState state : values()) {
            if (state.name().equalsIgnoreCase(normalized)
                    || state.status.equals(normalized)
                    || state.dirName.equalsIgnoreCase(value)
                    || state.status.replace("_", "").equals(normalized)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown state: " + raw);
    }
}
