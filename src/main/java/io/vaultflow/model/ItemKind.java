package io.vaultflow.model;

import java.util.List;
import java.util.Locale;

/**
 * Category of a work item. Aliases cover the source-specific type names perception adapters write.
 */
public enum ItemKind {
    MESSAGE("message", List.of()),
    EMAIL("email", List.of("gmail")),
    CHAT("chat", List.of("discord", "whatsapp")),
    SOCIAL("social", List.of("linkedin")),
    FILE_DROP("file_drop", List.of("file")),
    TRIGGER("trigger", List.of("linkedin_trigger")),
    PLAN("plan", List.of()),
    APPROVAL_REQUEST("approval_request", List.of("approval"));

    private final String type;
    private final List<String> aliases;

    ItemKind(String type, List<String> aliases) {
        this.type = type;
        this.aliases = aliases;
    }

    public String type() {
        return type;
    }

    public static ItemKind fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Item type cannot be empty");
        }
        String value = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (ItemKind kind : values()) {
            if (kind.type.equals(value) || kind.name().equalsIgnoreCase(value) || kind.aliases.contains(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown item type: " + raw);
    }
}
