package io.vaultflow.model;

public enum Priority {
    LOW("low"),
    NORMAL("normal"),
    HIGH("high"),
    URGENT("urgent");

    private final String label;

    Priority(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean outranks(Priority other) {
        return other == null || ordinal() > other.ordinal();
    }

    public static Priority fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return NORMAL;
        }
        for (Priority value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim()) || value.label.equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown priority: " + raw);
    }
}
