package io.vaultflow.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.vaultflow.model.ApprovalRequest;
import io.vaultflow.model.Claim;
import io.vaultflow.model.CollectionRef;
import io.vaultflow.model.ItemKind;
import io.vaultflow.model.Priority;
import io.vaultflow.model.WorkItem;
import io.vaultflow.model.WorkflowState;
import io.vaultflow.util.Ids;
import io.vaultflow.util.Jsons;
import io.vaultflow.util.Timestamps;

import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Markdown-with-frontmatter encoding of a {@link WorkItem}, shared by both store backends.
 *
 * <p>Decoding is also schema validation: any record that cannot be turned back into a valid
 * item (or, for approval requests, into valid approval terms) is reported as malformed.
 */
public final class RecordCodec {
    public static final String EXTENSION = ".md";

    private static final Pattern FRONTMATTER_PATTERN = Pattern.compile(
            "^---[ \\t]*\\r?\\n(.*?)\\r?\\n---[ \\t]*(?:\\r?\\n|$)(.*)$",
            Pattern.DOTALL
    );

    private RecordCodec() {
    }

    public static String encode(WorkItem item) {
        LinkedHashMap<String, Object> header = new LinkedHashMap<>();
        header.put("id", item.id());
        header.put("type", item.kind().type());
        header.put("status", item.state().status());
        header.put("priority", item.priority().label());
        header.put("created", item.createdAt().toString());
        header.put("source", item.source());
        header.putAll(item.metadata());
        String yaml;
        try {
            yaml = Jsons.yaml().writeValueAsString(header);
        } catch (JsonProcessingException e) {
            throw new VaultStoreException("Failed to encode record " + item.id(), e);
        }
        if (!yaml.endsWith("\n")) {
            yaml = yaml + "\n";
        }
        return "---\n" + yaml + "---\n" + item.body();
    }

    /**
     * Parses and validates a stored record.
     *
     * @param collection where the record was read from; a state collection overrides the
     *                   {@code status} mirror
     * @param expectedId the id implied by the record's name
     */
    public static WorkItem decode(CollectionRef collection, String expectedId, String text) {
        if (text == null) {
            throw new MalformedRecordException(collection, expectedId, "empty record");
        }
        Matcher matcher = FRONTMATTER_PATTERN.matcher(text);
        if (!matcher.matches()) {
            throw new MalformedRecordException(collection, expectedId, "missing frontmatter block");
        }
        JsonNode header;
        try {
            header = Jsons.yaml().readTree(matcher.group(1));
        } catch (JsonProcessingException e) {
            throw new MalformedRecordException(collection, expectedId, "unreadable frontmatter", e);
        }
        if (header == null || !header.isObject()) {
            throw new MalformedRecordException(collection, expectedId, "frontmatter is not a mapping");
        }
        String body = matcher.group(2);

        String id = scalar(header, "id").orElse(expectedId);
        if (!Ids.isValid(id)) {
            throw new MalformedRecordException(collection, expectedId, "invalid id '" + id + "'");
        }
        if (expectedId != null && !expectedId.equals(id)) {
            throw new MalformedRecordException(collection, expectedId, "id '" + id + "' does not match record name");
        }

        ItemKind kind;
        Priority priority;
        Instant createdAt;
        WorkflowState state;
        try {
            kind = ItemKind.fromString(scalar(header, "type")
                    .orElseThrow(() -> new IllegalArgumentException("missing 'type'")));
            priority = Priority.fromString(scalar(header, "priority").orElse(null));
            String rawCreated = scalar(header, "created")
                    .orElseThrow(() -> new IllegalArgumentException("missing 'created'"));
            createdAt = Timestamps.parse(rawCreated)
                    .orElseThrow(() -> new IllegalArgumentException("unreadable 'created': " + rawCreated));
            state = resolveState(collection, header);
        } catch (IllegalArgumentException e) {
            throw new MalformedRecordException(collection, id, e.getMessage(), e);
        }

        LinkedHashMap<String, String> metadata = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = header.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (WorkItem.HEADER_KEYS.contains(field.getKey())) {
                continue;
            }
            JsonNode value = field.getValue();
            if (value == null || value.isNull()) {
                metadata.put(field.getKey(), "");
            } else if (value.isValueNode()) {
                metadata.put(field.getKey(), value.asText());
            } else {
                metadata.put(field.getKey(), value.toString());
            }
        }

        WorkItem item = new WorkItem(
                id,
                kind,
                state,
                priority,
                createdAt,
                scalar(header, "source").orElse(null),
                metadata,
                body
        );
        if (kind == ItemKind.APPROVAL_REQUEST) {
            try {
                ApprovalRequest.from(item);
            } catch (IllegalArgumentException e) {
                throw new MalformedRecordException(collection, id, e.getMessage(), e);
            }
        }
        return item;
    }

    public static String fileName(String id) {
        return id + EXTENSION;
    }

    /** Record id for a stored file name, or empty when the name is not a record. */
    public static Optional<String> idOf(String fileName) {
        if (fileName == null || !fileName.endsWith(EXTENSION)) {
            return Optional.empty();
        }
        String id = fileName.substring(0, fileName.length() - EXTENSION.length());
        return Ids.isValid(id) ? Optional.of(id) : Optional.empty();
    }

    private static WorkflowState resolveState(CollectionRef collection, JsonNode header) {
        Optional<WorkflowState> fromCollection = collection.state();
        Optional<String> status = scalar(header, "status");
        if (fromCollection.isPresent()) {
            // the directory is authoritative; a stale mirror must still be a known state
            status.ifPresent(WorkflowState::fromString);
            return fromCollection.get();
        }
        if (status.isPresent()) {
            return WorkflowState.fromString(status.get());
        }
        return WorkflowState.fromString(scalar(header, Claim.CLAIMED_FROM_KEY)
                .orElseThrow(() -> new IllegalArgumentException("missing 'status'")));
    }

    private static Optional<String> scalar(JsonNode header, String key) {
        JsonNode node = header.get(key);
        if (node == null || node.isNull() || !node.isValueNode()) {
            return Optional.empty();
        }
        String value = node.asText();
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }
}
