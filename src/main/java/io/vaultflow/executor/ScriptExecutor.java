package io.vaultflow.executor;

import io.vaultflow.model.ActionType;
import io.vaultflow.model.ApprovalRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external command for an approved action: the record is written to the command's
 * stdin and the approval terms are exported as {@code VAULTFLOW_*} environment variables. Exit
 * code 0 is success; anything else, or a timeout, is a failure.
 */
public final class ScriptExecutor implements ActionExecutor {
    private static final Logger LOG = LoggerFactory.getLogger(ScriptExecutor.class);
    private static final int MAX_ERROR_CHARS = 512;

    private final String id;
    private final Set<ActionType> actions;
    private final List<String> command;
    private final long timeoutMs;

    public ScriptExecutor(String id, Set<ActionType> actions, List<String> command, long timeoutMs) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("script executor id cannot be empty");
        }
        if (actions == null || actions.isEmpty()) {
            throw new IllegalArgumentException("script executor must handle at least one action: " + id);
        }
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("script executor command cannot be empty: " + id);
        }
        this.id = id;
        this.actions = Set.copyOf(actions);
        this.command = List.copyOf(command);
        this.timeoutMs = Math.max(1_000L, timeoutMs);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public Set<ActionType> actions() {
        return actions;
    }

    @Override
    public ExecutionResult execute(ExecutionContext context) throws IOException {
        ApprovalRequest request = context.request();
        Path output = Files.createTempFile("vaultflow-exec-", ".out");
        try {
            ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
            pb.redirectErrorStream(true);
            pb.redirectOutput(output.toFile());
            Map<String, String> env = pb.environment();
            env.put("VAULTFLOW_ACTION", request.action().code());
            env.put("VAULTFLOW_REQUEST_ID", request.id());
            env.put("VAULTFLOW_TARGET", request.target() == null ? "" : request.target());
            env.put("VAULTFLOW_LINKED_ITEM", request.linkedItemId() == null ? "" : request.linkedItemId());
            env.put("VAULTFLOW_EXPIRES", request.expiresAt().toString());
            env.put("VAULTFLOW_DISPATCHER", context.dispatcherId() == null ? "" : context.dispatcherId());

            Process process;
            try {
                process = pb.start();
            } catch (IOException e) {
                return ExecutionResult.fail("script spawn failed: " + e.getMessage());
            }
            try {
                byte[] input = context.recordText() == null
                        ? new byte[0]
                        : context.recordText().getBytes(StandardCharsets.UTF_8);
                try (OutputStream stdin = process.getOutputStream()) {
                    stdin.write(input);
                    stdin.flush();
                } catch (IOException e) {
                    LOG.debug("{} closed stdin early: {}", id, e.getMessage());
                }

                boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
                if (!finished) {
                    process.destroyForcibly();
                    process.waitFor(1, TimeUnit.SECONDS);
                    return ExecutionResult.fail("script timeout after " + Duration.ofMillis(timeoutMs));
                }
                String combined = Files.readString(output, StandardCharsets.UTF_8);
                if (process.exitValue() == 0) {
                    return ExecutionResult.ok(combined.strip());
                }
                return ExecutionResult.fail("script exit=" + process.exitValue() + " output=" + truncate(combined));
            } catch (InterruptedException e) {
                process.destroyForcibly();
                Thread.currentThread().interrupt();
                return ExecutionResult.fail("script interrupted");
            }
        } finally {
            Files.deleteIfExists(output);
        }
    }

    private static String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }
}
