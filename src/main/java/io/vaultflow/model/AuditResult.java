package io.vaultflow.model;

public enum AuditResult {
    SUCCESS("success"),
    FAILURE("failure"),
    PARTIAL("partial");

    private final String code;

    AuditResult(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static AuditResult fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return SUCCESS;
        }
        for (AuditResult value : values()) {
            if (value.code.equalsIgnoreCase(raw.trim()) || value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown audit result: " + raw);
    }
}
