package io.vaultflow.executor;

import io.vaultflow.model.ActionType;

import java.util.Set;

/**
 * Performs the side effect an approval request authorizes. Implementations are only invoked
 * for a request that is claimed and was found executable.
 */
public interface ActionExecutor {
    String id();

    Set<ActionType> actions();

    ExecutionResult execute(ExecutionContext context) throws Exception;
}
