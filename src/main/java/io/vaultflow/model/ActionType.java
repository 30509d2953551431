package io.vaultflow.model;

import java.util.Locale;

/**
 * Side-effecting operations that need a human sign-off before they run.
 */
public enum ActionType {
    SEND_EMAIL("send_email"),
    DRAFT_EMAIL("draft_email"),
    SEND_REPLY("send_reply"),
    POST_LINKEDIN("post_linkedin"),
    DISCORD_REPLY("discord_reply"),
    WHATSAPP_REPLY("whatsapp_reply"),
    PAYMENT("payment");

    private final String code;

    ActionType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static ActionType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Action cannot be empty");
        }
        String value = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (ActionType action : values()) {
            if (action.code.equals(value) || action.name().equalsIgnoreCase(value)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown action: " + raw);
    }
}
