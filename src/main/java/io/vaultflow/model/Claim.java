package io.vaultflow.model;

import java.time.Instant;
import java.util.List;

/**
 * Exclusive custody of one item by one owner, backed by the item sitting in {@code In_Progress/<owner>}.
 *
 * @param origin state collection the item was claimed from; a released or reclaimed item returns there
 */
public record Claim(
        String itemId,
        String ownerId,
        Instant claimedAt,
        WorkflowState origin
) {
    public static final String CLAIMED_BY_KEY = "claimed_by";
    public static final String CLAIMED_AT_KEY = "claimed_at";
    public static final String CLAIMED_FROM_KEY = "claimed_from";
    public static final List<String> METADATA_KEYS = List.of(CLAIMED_BY_KEY, CLAIMED_AT_KEY, CLAIMED_FROM_KEY);

    public CollectionRef collection() {
        return CollectionRef.ownerScoped(ownerId);
    }
}
