package io.vaultflow.model;

import io.vaultflow.util.Ids;

import java.util.Optional;

/**
 * Name of a flat record namespace inside the vault: a state collection, an owner's custody
 * collection ({@code In_Progress/<owner>}) or the review quarantine.
 */
public record CollectionRef(String name) {
    public static final String IN_PROGRESS_DIR = "In_Progress";
    public static final String QUARANTINE_DIR = "Quarantine";
    public static final CollectionRef QUARANTINE = new CollectionRef(QUARANTINE_DIR);

    public CollectionRef {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Collection name cannot be empty");
        }
    }

    public static CollectionRef of(WorkflowState state) {
        return new CollectionRef(state.dirName());
    }

    public static CollectionRef ownerScoped(String ownerId) {
        return new CollectionRef(IN_PROGRESS_DIR + "/" + Ids.require(ownerId, "owner id"));
    }

    public static CollectionRef parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Collection name cannot be empty");
        }
        String value = raw.trim();
        if (value.startsWith(IN_PROGRESS_DIR + "/")) {
            return ownerScoped(value.substring(IN_PROGRESS_DIR.length() + 1));
        }
        if (QUARANTINE_DIR.equalsIgnoreCase(value)) {
            return QUARANTINE;
        }
        return of(WorkflowState.fromString(value));
    }

    public boolean isOwnerScoped() {
        return name.startsWith(IN_PROGRESS_DIR + "/");
    }

    public Optional<String> ownerId() {
        return isOwnerScoped() ? Optional.of(name.substring(IN_PROGRESS_DIR.length() + 1)) : Optional.empty();
    }

    /** The state this collection stands for; empty for custody and quarantine collections. */
    public Optional<WorkflowState> state() {
        for (WorkflowState state : WorkflowState.values()) {
            if (state.dirName().equals(name)) {
                return Optional.of(state);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return name;
    }
}
