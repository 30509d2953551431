package io.vaultflow.engine;

import io.vaultflow.model.ItemKind;
import io.vaultflow.model.WorkflowState;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * The one authoritative transition graph.
 */
public final class TransitionRules {
    private static final Map<WorkflowState, Set<WorkflowState>> ALLOWED = new EnumMap<>(WorkflowState.class);

    static {
        ALLOWED.put(WorkflowState.INTAKE, EnumSet.of(WorkflowState.TRIAGED));
        ALLOWED.put(WorkflowState.TRIAGED, EnumSet.of(WorkflowState.PLANNED, WorkflowState.DONE));
        ALLOWED.put(WorkflowState.PLANNED, EnumSet.of(WorkflowState.PENDING_APPROVAL, WorkflowState.DONE));
        ALLOWED.put(WorkflowState.PENDING_APPROVAL,
                EnumSet.of(WorkflowState.APPROVED, WorkflowState.REJECTED, WorkflowState.EXPIRED));
        ALLOWED.put(WorkflowState.APPROVED, EnumSet.of(WorkflowState.DONE, WorkflowState.EXPIRED));
        ALLOWED.put(WorkflowState.REJECTED, EnumSet.noneOf(WorkflowState.class));
        ALLOWED.put(WorkflowState.EXPIRED, EnumSet.noneOf(WorkflowState.class));
        ALLOWED.put(WorkflowState.DONE, EnumSet.noneOf(WorkflowState.class));
    }

    private TransitionRules() {
    }

    public static boolean allowed(WorkflowState from, WorkflowState to) {
        return from != null && to != null && ALLOWED.get(from).contains(to);
    }

    public static Set<WorkflowState> targets(WorkflowState from) {
        return Collections.unmodifiableSet(ALLOWED.get(from));
    }

    /** States a brand-new record of {@code kind} may be created in. */
    public static Set<WorkflowState> admissionStates(ItemKind kind) {
        return switch (kind) {
            case PLAN -> EnumSet.of(WorkflowState.INTAKE, WorkflowState.PLANNED);
            case APPROVAL_REQUEST -> EnumSet.of(WorkflowState.INTAKE, WorkflowState.PENDING_APPROVAL);
            default -> EnumSet.of(WorkflowState.INTAKE);
        };
    }

    public static boolean admissible(ItemKind kind, WorkflowState state) {
        return admissionStates(kind).contains(state);
    }
}
