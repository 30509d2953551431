package io.vaultflow.engine;

import io.vaultflow.model.WorkflowState;
import io.vaultflow.storage.VaultStoreException;

/**
 * A requested move that is not in the transition graph. The record is left where it is.
 */
public final class IllegalTransitionException extends VaultStoreException {
    private final String itemId;
    private final WorkflowState from;
    private final WorkflowState to;

    public IllegalTransitionException(String itemId, WorkflowState from, WorkflowState to) {
        super("Illegal transition for " + itemId + ": "
                + (from == null ? "(new)" : from.status()) + " -> " + to.status());
        this.itemId = itemId;
        this.from = from;
        this.to = to;
    }

    public String itemId() {
        return itemId;
    }

    /** Source state, or {@code null} for an admission. */
    public WorkflowState from() {
        return from;
    }

    public WorkflowState to() {
        return to;
    }
}
