package io.vaultflow.model;

import io.vaultflow.util.Timestamps;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A work item that asks for time-bounded human sign-off before a side-effecting action runs.
 *
 * <p>The approval terms live in the record's metadata ({@code action}, {@code expires},
 * {@code linked_item}, {@code to}) so that the file stays readable and editable by hand.
 */
public record ApprovalRequest(
        WorkItem item,
        ActionType action,
        Instant expiresAt,
        String linkedItemId,
        String target
) {
    public static final String ACTION_KEY = "action";
    public static final String EXPIRES_KEY = "expires";
    public static final String LINKED_ITEM_KEY = "linked_item";
    public static final String TARGET_KEY = "to";
    public static final Duration DEFAULT_WINDOW = Duration.ofHours(24);

    private static final List<String> TARGET_FALLBACK_KEYS = List.of(TARGET_KEY, "channel", "contact", "target");

    public ApprovalRequest {
        Objects.requireNonNull(item, "item");
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(expiresAt, "expiresAt");
        if (!expiresAt.isAfter(item.createdAt())) {
            throw new IllegalArgumentException("expires must be after created for " + item.id());
        }
    }

    /**
     * Reads the approval terms of a record; fails with {@link IllegalArgumentException} when they are
     * missing or unreadable.
     */
    public static ApprovalRequest from(WorkItem item) {
        if (item.kind() != ItemKind.APPROVAL_REQUEST) {
            throw new IllegalArgumentException("Record " + item.id() + " is not an approval request");
        }
        String rawAction = item.metadata(ACTION_KEY)
                .orElseThrow(() -> new IllegalArgumentException("missing 'action'"));
        ActionType action = ActionType.fromString(rawAction);
        String rawExpires = item.metadata(EXPIRES_KEY)
                .orElseThrow(() -> new IllegalArgumentException("missing 'expires'"));
        Instant expiresAt = Timestamps.parse(rawExpires)
                .orElseThrow(() -> new IllegalArgumentException("unreadable 'expires': " + rawExpires));
        String linked = item.metadata(LINKED_ITEM_KEY).orElse(null);
        String target = null;
        for (String key : TARGET_FALLBACK_KEYS) {
            Optional<String> value = item.metadata(key);
            if (value.isPresent()) {
                target = value.get();
                break;
            }
        }
        return new ApprovalRequest(item, action, expiresAt, linked, target);
    }

    /**
     * Builds a new request in {@code Pending_Approval} whose expiry is fixed at {@code createdAt + window}.
     */
    public static ApprovalRequest create(
            String id,
            ActionType action,
            Priority priority,
            Instant createdAt,
            Duration window,
            String source,
            String linkedItemId,
            String target,
            Map<String, String> extraMetadata,
            String body
    ) {
        Duration effective = window == null || window.isZero() || window.isNegative() ? DEFAULT_WINDOW : window;
        Instant expiresAt = createdAt.plus(effective);
        LinkedHashMap<String, String> metadata = new LinkedHashMap<>();
        metadata.put(ACTION_KEY, action.code());
        metadata.put(EXPIRES_KEY, expiresAt.toString());
        if (linkedItemId != null && !linkedItemId.isBlank()) {
            metadata.put(LINKED_ITEM_KEY, linkedItemId.trim());
        }
        if (target != null && !target.isBlank()) {
            metadata.put(TARGET_KEY, target.trim());
        }
        if (extraMetadata != null) {
            extraMetadata.forEach(metadata::putIfAbsent);
        }
        WorkItem item = new WorkItem(
                id,
                ItemKind.APPROVAL_REQUEST,
                WorkflowState.PENDING_APPROVAL,
                priority,
                createdAt,
                source,
                metadata,
                body
        );
        return new ApprovalRequest(item, action, expiresAt, linkedItemId, target);
    }

    public String id() {
        return item.id();
    }

    public WorkflowState state() {
        return item.state();
    }

    /**
     * True once {@code now} reaches the expiry, brought forward by {@code skewAllowance} so that a
     * doubtful clock reading resolves to expired.
     */
    public boolean isExpiredAt(Instant now, Duration skewAllowance) {
        Duration skew = skewAllowance == null || skewAllowance.isNegative() ? Duration.ZERO : skewAllowance;
        return !now.isBefore(expiresAt.minus(skew));
    }
}
