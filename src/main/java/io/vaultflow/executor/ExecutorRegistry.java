package io.vaultflow.executor;

import io.vaultflow.config.VaultFlowSettings;
import io.vaultflow.model.ActionType;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

public final class ExecutorRegistry {
    public static final long DEFAULT_SCRIPT_TIMEOUT_MS = 30_000L;

    private final Map<ActionType, ActionExecutor> executors = new ConcurrentHashMap<>();

    /**
     * The built-in hand-off executors plus one script executor per configured action. A script
     * configured for an action replaces the built-in one.
     */
    public static ExecutorRegistry fromSettings(VaultFlowSettings settings) {
        ExecutorRegistry registry = new ExecutorRegistry();
        registry.register(new ManualReplyExecutor());
        registry.register(new DraftHandoffExecutor());
        settings.scriptExecutors().forEach((rawAction, script) -> {
            ActionType action = ActionType.fromString(rawAction);
            long timeoutMs = script.timeoutMs() == null ? DEFAULT_SCRIPT_TIMEOUT_MS : script.timeoutMs();
            registry.register(new ScriptExecutor("script:" + action.code(), Set.of(action), script.command(), timeoutMs));
        });
        return registry;
    }

    public void register(ActionExecutor executor) {
        for (ActionType action : executor.actions()) {
            executors.put(action, executor);
        }
    }

    public Optional<ActionExecutor> find(ActionType action) {
        return Optional.ofNullable(executors.get(action));
    }

    public Set<String> supportedActions() {
        Set<String> out = new TreeSet<>();
        executors.keySet().forEach(action -> out.add(action.code()));
        return out;
    }
}
