package io.vaultflow.model;

import io.vaultflow.util.Ids;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A unit of work tracked through the state machine.
 *
 * <p>The payload is the Markdown body plus a flat metadata map. Header fields ({@code id},
 * {@code type}, {@code status}, {@code priority}, {@code created}, {@code source}) are never
 * stored in the metadata map.
 */
public record WorkItem(
        String id,
        ItemKind kind,
        WorkflowState state,
        Priority priority,
        Instant createdAt,
        String source,
        Map<String, String> metadata,
        String body
) {
    public static final Set<String> HEADER_KEYS = Set.of("id", "type", "status", "priority", "created", "source");

    public WorkItem {
        Ids.require(id, "record id");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(state, "state");
        priority = priority == null ? Priority.NORMAL : priority;
        Objects.requireNonNull(createdAt, "createdAt");
        source = source == null || source.isBlank() ? "unknown" : source.trim();
        LinkedHashMap<String, String> copy = new LinkedHashMap<>();
        if (metadata != null) {
            metadata.forEach((key, value) -> {
                if (key != null && !key.isBlank() && !HEADER_KEYS.contains(key)) {
                    copy.put(key, value == null ? "" : value);
                }
            });
        }
        metadata = Collections.unmodifiableMap(copy);
        body = body == null ? "" : body;
    }

    public static WorkItem intake(String id, ItemKind kind, Priority priority, Instant createdAt, String source,
                                  Map<String, String> metadata, String body) {
        return new WorkItem(id, kind, WorkflowState.INTAKE, priority, createdAt, source, metadata, body);
    }

    public Optional<String> metadata(String key) {
        String value = metadata.get(key);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
    }

    public WorkItem withState(WorkflowState next) {
        if (next == state) {
            return this;
        }
        return new WorkItem(id, kind, next, priority, createdAt, source, metadata, body);
    }

    public WorkItem withMetadata(String key, String value) {
        LinkedHashMap<String, String> next = new LinkedHashMap<>(metadata);
        next.put(key, value);
        return new WorkItem(id, kind, state, priority, createdAt, source, next, body);
    }

    public WorkItem withoutMetadata(Collection<String> keys) {
        if (keys.stream().noneMatch(metadata::containsKey)) {
            return this;
        }
        LinkedHashMap<String, String> next = new LinkedHashMap<>(metadata);
        keys.forEach(next::remove);
        return new WorkItem(id, kind, state, priority, createdAt, source, next, body);
    }
}
