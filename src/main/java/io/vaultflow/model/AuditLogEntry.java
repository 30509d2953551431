package io.vaultflow.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record AuditLogEntry(
        Instant timestamp,
        String actionType,
        String actor,
        String target,
        Map<String, Object> parameters,
        AuditResult result,
        String errorDetail
) {
    public AuditLogEntry {
        Objects.requireNonNull(timestamp, "timestamp");
        if (actionType == null || actionType.isBlank()) {
            throw new IllegalArgumentException("actionType cannot be empty");
        }
        actor = actor == null || actor.isBlank() ? "system" : actor;
        target = target == null ? "" : target;
        parameters = parameters == null || parameters.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        result = result == null ? AuditResult.SUCCESS : result;
        errorDetail = errorDetail == null || errorDetail.isBlank() ? null : errorDetail;
    }

    public static AuditLogEntry success(Instant at, String actionType, String actor, String target,
                                        Map<String, Object> parameters) {
        return new AuditLogEntry(at, actionType, actor, target, parameters, AuditResult.SUCCESS, null);
    }

    public static AuditLogEntry failure(Instant at, String actionType, String actor, String target,
                                        Map<String, Object> parameters, String errorDetail) {
        return new AuditLogEntry(at, actionType, actor, target, parameters, AuditResult.FAILURE, errorDetail);
    }
}
