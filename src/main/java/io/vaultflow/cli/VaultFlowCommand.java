package io.vaultflow.cli;

import io.vaultflow.approval.ApprovalExpiredException;
import io.vaultflow.approval.ApprovalGate;
import io.vaultflow.approval.ApprovalVerdict;
import io.vaultflow.config.VaultFlowConfig;
import io.vaultflow.dashboard.NotDashboardWriterException;
import io.vaultflow.engine.IllegalTransitionException;
import io.vaultflow.model.ActionType;
import io.vaultflow.model.Claim;
import io.vaultflow.model.CollectionRef;
import io.vaultflow.model.ItemKind;
import io.vaultflow.model.Priority;
import io.vaultflow.model.WorkflowState;
import io.vaultflow.runtime.ApprovalDispatcher;
import io.vaultflow.runtime.VaultFlowRuntime;
import io.vaultflow.storage.MalformedRecordException;
import io.vaultflow.storage.RecordAlreadyExistsException;
import io.vaultflow.storage.RecordNotFoundException;
import io.vaultflow.util.Jsons;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;

@Command(
        name = "vaultflow",
        mixinStandardHelpOptions = true,
        description = "Vault workflow state store and approval controller",
        subcommands = {
                VaultFlowCommand.InitCommand.class,
                VaultFlowCommand.AdmitCommand.class,
                VaultFlowCommand.ListCommand.class,
                VaultFlowCommand.ShowCommand.class,
                VaultFlowCommand.LocateCommand.class,
                VaultFlowCommand.TransitionCommand.class,
                VaultFlowCommand.TriageCommand.class,
                VaultFlowCommand.PlanCommand.class,
                VaultFlowCommand.RequestApprovalCommand.class,
                VaultFlowCommand.ApproveCommand.class,
                VaultFlowCommand.RejectCommand.class,
                VaultFlowCommand.ResubmitCommand.class,
                VaultFlowCommand.ClaimCommand.class,
                VaultFlowCommand.ReleaseCommand.class,
                VaultFlowCommand.HeartbeatCommand.class,
                VaultFlowCommand.ReclaimCommand.class,
                VaultFlowCommand.CheckCommand.class,
                VaultFlowCommand.ExecuteCommand.class,
                VaultFlowCommand.OrchestrateCommand.class,
                VaultFlowCommand.AuditTailCommand.class,
                VaultFlowCommand.AuditVerifyCommand.class,
                VaultFlowCommand.DashboardCommand.class,
                VaultFlowCommand.DashboardDeltaCommand.class,
                VaultFlowCommand.StatsCommand.class,
                VaultFlowCommand.ReloadSettingsCommand.class
        }
)
public final class VaultFlowCommand implements Runnable {
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_NOT_FOUND = 2;
    public static final int EXIT_ALREADY_EXISTS = 3;
    public static final int EXIT_ILLEGAL_TRANSITION = 4;
    public static final int EXIT_EXPIRED = 5;
    public static final int EXIT_MALFORMED = 6;
    public static final int EXIT_NOT_WRITER = 7;

    @Option(names = {"--root"}, description = "Vault root directory (default: $VAULT_PATH, else ./vault)")
    String root;

    @Option(names = {"--actor"}, defaultValue = "cli", description = "Actor recorded in the audit ledger")
    String actor;

    private Map<String, String> env = System.getenv();

    /**
     * A command line whose failures are printed as a JSON error object with an exit code per
     * error kind.
     */
    public static CommandLine commandLine() {
        return commandLine(new VaultFlowCommand());
    }

    public static CommandLine commandLine(VaultFlowCommand command) {
        CommandLine cmd = new CommandLine(command);
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            Map<String, Object> error = new LinkedHashMap<>();
            error.put("ok", false);
            error.put("error", errorKind(ex));
            error.put("message", ex.getMessage());
            commandLine.getErr().println(Jsons.toJson(error));
            commandLine.getErr().flush();
            return exitCode(ex);
        });
        return cmd;
    }

    /** Environment used for settings overrides; replaced by tests. */
    public VaultFlowCommand withEnvironment(Map<String, String> env) {
        this.env = env == null ? Map.of() : env;
        return this;
    }

    static String errorKind(Exception ex) {
        if (ex instanceof ApprovalExpiredException) {
            return "Expired";
        }
        if (ex instanceof RecordNotFoundException) {
            return "NotFound";
        }
        if (ex instanceof RecordAlreadyExistsException) {
            return "AlreadyExists";
        }
        if (ex instanceof IllegalTransitionException) {
            return "IllegalTransition";
        }
        if (ex instanceof MalformedRecordException) {
            return "MalformedRecord";
        }
        if (ex instanceof NotDashboardWriterException) {
            return "NotDashboardWriter";
        }
        if (ex instanceof IllegalArgumentException) {
            return "InvalidArgument";
        }
        return ex.getClass().getSimpleName();
    }

    static int exitCode(Exception ex) {
        if (ex instanceof ApprovalExpiredException) {
            return EXIT_EXPIRED;
        }
        if (ex instanceof RecordNotFoundException) {
            return EXIT_NOT_FOUND;
        }
        if (ex instanceof RecordAlreadyExistsException) {
            return EXIT_ALREADY_EXISTS;
        }
        if (ex instanceof IllegalTransitionException) {
            return EXIT_ILLEGAL_TRANSITION;
        }
        if (ex instanceof MalformedRecordException) {
            return EXIT_MALFORMED;
        }
        if (ex instanceof NotDashboardWriterException) {
            return EXIT_NOT_WRITER;
        }
        return EXIT_FAILURE;
    }

    @Override
    public void run() {
        System.out.println("Use subcommands: init | admit | list | show | locate | transition | triage | plan | "
                + "request-approval | approve | reject | resubmit | claim | release | heartbeat | reclaim | check | "
                + "execute | orchestrate | audit-tail | audit-verify | dashboard | dashboard-delta | stats | "
                + "reload-settings");
    }

    VaultFlowRuntime runtime() {
        VaultFlowConfig config = VaultFlowConfig.fromRoot(root, env);
        VaultFlowRuntime runtime = new VaultFlowRuntime(config, env, null);
        runtime.init();
        return runtime;
    }

    static void print(Object value) {
        System.out.println(Jsons.toJson(value));
    }

    static String readBody(String inline, Path file) {
        if (file == null) {
            return inline == null ? "" : inline;
        }
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read body file: " + file, e);
        }
    }

    @Command(name = "init", description = "Create the vault collections, ledger and internal directories")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        VaultFlowCommand parent;

        @Override
        public Integer call() {
            VaultFlowRuntime runtime = parent.runtime();
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("initialized", runtime.config().rootDir().toString());
            out.put("backend", runtime.settings().backend());
            out.put("settings", runtime.currentSettings());
            print(out);
            return 0;
        }
    }

    @Command(name = "admit", description = "Admit a new item into Needs_Action; a duplicate id is reported, not overwritten")
    static final class AdmitCommand implements Callable<Integer> {
        @ParentCommand
        VaultFlowCommand parent;

        @Option(names = {"--id"}, description = "Record id (default: generated from type and time)")
        String id;

        @Option(names = {"--type"}, required = true, description = "Item type, e.g. email, chat, file_drop")
        String type;

        @Option(names = {"--priority"}, defaultValue = "normal", description = "low | normal | high | urgent")
        String priority;

        @Option(names = {"--source"}, defaultValue = "cli", description = "Producing adapter")
        String source;

        @Option(names = {"--meta"}, description = "Extra metadata key=value (repeatable)")
        Map<String, String> metadata = new LinkedHashMap<>();

        @Option(names = {"--body"}, description = "Markdown body")
        String body;

        @Option(names = {"--body-file"}, description = "Read the Markdown body from a file")
        Path bodyFile;

        @Override
        public Integer call() {
            VaultFlowRuntime runtime = parent.runtime();
            print(runtime.admit(new VaultFlowRuntime.AdmitRequest(
                    id,
                    ItemKind.fromString(type),
                    Priority.fromString(priority),
                    source,
                    metadata,
                    readBody(body, bodyFile)
            ), parent.actor));
            return 0;
        }
    }

    @Command(name = "list", description = "List record ids in a collection")
    static final class ListCommand implements Callable<Integer> {
        @ParentCommand
        VaultFlowCommand parent;

        @Parameters(index = "0", description = "State or collection name, e.g. approved, Pending_Approval, In_Progress/w1")
        String collection;

        @Override
        public Integer call() {
            VaultFlowRuntime runtime = parent.runtime();
            CollectionRef ref = CollectionRef.parse(collection);
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("collection", ref.name());
            out.put("ids", runtime.list(ref));
            print(out);
            return 0;
        }
    }

    @Command(name = "show", description = "Print a record wherever it currently is")
    static final class ShowCommand implements Callable<Integer> {
        @ParentCommand
        VaultFlowCommand parent;

        @Parameters(index = "0")
        String id;

        @Override
        public Integer call() {
            VaultFlowRuntime runtime = parent.runtime();
            Optional<VaultFlowRuntime.RecordView> view = runtime.show(id);
            if (view.isEmpty()) {
                print(Map.of("id", id, "found", false));
                return EXIT_NOT_FOUND;
            }
            print(view.get());
            return 0;
        }
    }

    @Command(name = "locate", description = "Print the collection currently holding a record")
    static final class LocateCommand implements Callable<Integer> {
        @ParentCommand
        VaultFlowCommand parent;

        @Parameters(index = "0")
        String id;

        @Override
        public Integer call() {
            VaultFlowRuntime runtime = parent.runtime();
            Optional<CollectionRef> located = runtime.locate(id);
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("id", id);
            out.put("found", located.isPresent());
            out.put("collection", located.map(CollectionRef::name).orElse(null));
            print(out);
            return located.isPresent() ? 0 : EXIT_NOT_FOUND;
        }
    }

    @Command(name = "transition", description = "Move a record along one edge of the state machine")
    static final class TransitionCommand implements Callable<Integer> {
        @ParentCommand
        VaultFlowCommand parent;

        @Parameters(index = "0")
        String id;

        @Option(names = {"--from"}, required = true)
        String from;

        @Option(names = {"--to"}, required = true)
        String to;

        @Option(names = {"--reason"})
        String reason;

        @Override
        public Integer call() {
            VaultFlowRuntime runtime = parent.runtime();
            print(runtime.transition(id, WorkflowState.fromString(from), WorkflowState.fromString(to),
                    parent.actor, reason));
            return 0;
        }
    }

    @Command(name = "triage", description = "Needs_Action -> Triaged")
    static final class TriageCommand implements Callable<Integer> {
        @ParentCommand
        VaultFlowCommand parent;

        @Parameters(index = "0")
        String id;

        @Override
        public Integer call() {
            print(parent.runtime().triage(id, parent.actor));
            return 0;
        }
    }

    @Command(name = "plan", description = "Triaged -> Plans, optionally writing a PLAN_<id> record")
    static final class PlanCommand implements Callable<Integer> {
        @ParentCommand
        VaultFlowCommand parent;

        @Parameters(index = "0")
        String id;

        @Option(names = {"--body"}, description = "Plan text")
        String body;

        @Option(names = {"--body-file"})
        Path bodyFile;

        @Override
        public Integer call() {
            String planBody = body == null && bodyFile == null ? null : readBody(body, bodyFile);
            print(parent.runtime().plan(id, planBody, parent.actor));
            return 0;
        }
    }

    @Command(name = "request-approval", description = "Create an approval request in Pending_Approval")
    static final class RequestApprovalCommand implements Callable<Integer> {
        @ParentCommand
        VaultFlowCommand parent;

        @Option(names = {"--id"}, description = "Request id (default: APPROVAL_<action>_<time>_<hex>)")
        String id;

        @Option(names = {"--action"}, required = true, description = "send_email | draft_email | discord_reply | ...")
        String action;

        @Option(names = {"--to"}, description = "Recipient, channel or contact")
        String target;

        @Option(names = {"--linked-item"}, description = "Planned item archived when the action runs")
        String linkedItem;

        @Option(names = {"--priority"}, defaultValue = "normal")
        String priority;

        @Option(names = {"--source"}, defaultValue = "cli")
        String source;

        @Option(names = {"--meta"}, description = "Extra metadata key=value (repeatable)")
        Map<String, String> metadata = new LinkedHashMap<>();

        @Option(names = {"--body"})
        String body;

        @Option(names = {"--body-file"})
        Path bodyFile;

        @Override
        public Integer call() {
            VaultFlowRuntime runtime = parent.runtime();
            print(runtime.requestApproval(new ApprovalGate.Draft(
                    id,
                    ActionType.fromString(action),
                    Priority.fromString(priority),
                    source,
                    linkedItem,
                    target,
                    metadata,
                    readBody(body, bodyFile)
            ), parent.actor));
            return 0;
        }
    }

    @Command(name = "approve", description = "Pending_Approval -> Approved; fails with Expired past the deadline")
    static final class ApproveCommand implements Callable<Integer> {
        @ParentCommand
        VaultFlowCommand parent;

        @Parameters(index = "0")
        String id;

        @Override
        public Integer call() {
            print(parent.runtime().approve(id, parent.actor));
            return 0;
        }
    }

    @Command(name = "reject", description = "Pending_Approval -> Rejected")
    static final class RejectCommand implements Callable<Integer> {
        @ParentCommand
        VaultFlowCommand parent;

        @Parameters(index = "0")
        String id;

        @Option(names = {"--reason"})
        String reason;

        @Override
        public Integer call() {
            print(parent.runtime().reject(id, parent.actor, reason));
            return 0;
        }
    }

    @Command(name = "resubmit", description = "Re-enter a rejected or expired item as a new record")
    static final class ResubmitCommand implements Callable<Integer> {
        @ParentCommand
        VaultFlowCommand parent;

        @Parameters(index = "0")
        String id;

        @Override
        public Integer call() {
            print(parent.runtime().resubmit(id, parent.actor));
            return 0;
        }
    }

    @Command(name = "claim", description = "Take exclusive custody of an item")
    static final class ClaimCommand implements Callable<Integer> {
        @ParentCommand
        VaultFlowCommand parent;

        @Parameters(index = "0")
        String id;

        @Option(names = {"--from"}, required = true, description = "State the item is claimed from")
        String from;

        @Option(names = {"--owner"}, required = true)
        String owner;

        @Override
        public Integer call() {
            Optional<Claim> claim = parent.runtime().claim(id, WorkflowState.fromString(from), owner);
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("id", id);
            out.put("claimed", claim.isPresent());
            out.put("claim", claim.orElse(null));
            print(out);
            return claim.isPresent() ? 0 : EXIT_NOT_FOUND;
        }
    }

    @Command(name = "release", description = "Give a claimed item back to the state it was claimed from")
    static final class ReleaseCommand implements Callable<Integer> {
        @ParentCommand
        VaultFlowCommand parent;

        @Parameters(index = "0")
        String id;

        @Option(names = {"--owner"}, required = true)
        String owner;

        @Option(names = {"--reason"})
        String reason;

        @Override
        public Integer call() {
            print(parent.runtime().release(owner, id, parent.actor, reason));
            return 0;
        }
    }

    @Command(name = "heartbeat", description = "Publish an owner heartbeat")
    static final class HeartbeatCommand implements Callable<Integer> {
        @ParentCommand
        VaultFlowCommand parent;

        @Option(names = {"--owner"}, required = true)
        String owner;

        @Override
        public Integer call() {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("owner", owner);
            out.put("at", parent.runtime().heartbeat(owner));
            print(out);
            return 0;
        }
    }

    @Command(name = "reclaim", description = "Return items held by stale owners to their origin collections")
    static final class ReclaimCommand implements Callable<Integer> {
        @ParentCommand
        VaultFlowCommand parent;

        @Option(names = {"--ttl-ms"}, description = "Staleness threshold (default: claimTtlMs setting)")
        Long ttlMs;

        @Override
        public Integer call() {
            Duration ttl = ttlMs == null ? null : Duration.ofMillis(ttlMs);
            print(parent.runtime().reclaim(ttl, parent.actor));
            return 0;
        }
    }

    @Command(name = "check", description = "Decide whether an approval request may execute now")
    static final class CheckCommand implements Callable<Integer> {
        @ParentCommand
        VaultFlowCommand parent;

        @Parameters(index = "0")
        String id;

        @Override
        public Integer call() {
            ApprovalVerdict verdict = parent.runtime().checkExecutable(id, parent.actor);
            print(verdict);
            return verdict.executable() ? 0 : EXIT_FAILURE;
        }
    }

    @Command(name = "execute", description = "Run one approved request now")
    static final class ExecuteCommand implements Callable<Integer> {
        @ParentCommand
        VaultFlowCommand parent;

        @Parameters(index = "0")
        String id;

        @Option(names = {"--dispatcher-id"}, defaultValue = "orchestrator")
        String dispatcherId;

        @Override
        public Integer call() {
            ApprovalDispatcher.DispatchResult result = parent.runtime().execute(id, dispatcherId);
            print(result);
            return exitCodeOf(result);
        }
    }

    static int exitCodeOf(ApprovalDispatcher.DispatchResult result) {
        switch (result.status()) {
            case ApprovalDispatcher.STATUS_EXECUTED:
            case ApprovalDispatcher.STATUS_MANUAL:
            case ApprovalDispatcher.STATUS_DRY_RUN:
                return 0;
            case ApprovalDispatcher.STATUS_SKIPPED_EXPIRED:
                return EXIT_EXPIRED;
            case ApprovalDispatcher.STATUS_LOST_RACE:
                return EXIT_NOT_FOUND;
            case ApprovalDispatcher.STATUS_QUARANTINED:
                return EXIT_MALFORMED;
            default:
                return EXIT_FAILURE;
        }
    }

    @Command(name = "orchestrate", description = "Dispatch approved requests in a loop (or once)")
    static final class OrchestrateCommand implements Callable<Integer> {
        @ParentCommand
        VaultFlowCommand parent;

        @Option(names = {"--once"}, defaultValue = "false", description = "Run only one pass")
        boolean once;

        @Option(names = {"--dispatcher-id"}, defaultValue = "orchestrator")
        String dispatcherId;

        @Override
        public Integer call() throws Exception {
            VaultFlowRuntime runtime = parent.runtime();
            if (once) {
                print(runtime.orchestrateOnce(dispatcherId));
                return 0;
            }
            AtomicBoolean running = new AtomicBoolean(true);
            Thread main = Thread.currentThread();
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                running.set(false);
                main.interrupt();
            }, "vaultflow-shutdown-hook"));
            try {
                runtime.orchestrate(dispatcherId, running, VaultFlowCommand::print);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return 0;
        }
    }

    @Command(name = "audit-tail", description = "Print the latest ledger entries, oldest first")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        VaultFlowCommand parent;

        @Option(names = {"--lines"}, defaultValue = "50", description = "Number of latest entries")
        int lines;

        @Override
        public Integer call() {
            parent.runtime().auditTail(lines).forEach(entry -> System.out.println(Jsons.toCompactJson(entry)));
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the hash chain (and signatures) of ledger partitions")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        VaultFlowCommand parent;

        @Option(names = {"--date"}, description = "Partition yyyy-MM-dd (default: all)")
        String date;

        @Override
        public Integer call() {
            var outcomes = parent.runtime().auditVerify(date);
            print(outcomes);
            return outcomes.stream().allMatch(o -> o.ok()) ? 0 : EXIT_FAILURE;
        }
    }

    @Command(name = "dashboard", description = "Rebuild Dashboard.md (writer role only)")
    static final class DashboardCommand implements Callable<Integer> {
        @ParentCommand
        VaultFlowCommand parent;

        @Option(names = {"--role"}, defaultValue = "local")
        String role;

        @Override
        public Integer call() {
            print(parent.runtime().dashboard(role));
            return 0;
        }
    }

    @Command(name = "dashboard-delta", description = "Submit one dashboard field update for the writer to merge")
    static final class DashboardDeltaCommand implements Callable<Integer> {
        @ParentCommand
        VaultFlowCommand parent;

        @Option(names = {"--role"}, required = true)
        String role;

        @Option(names = {"--field"}, required = true)
        String field;

        @Option(names = {"--value"}, required = true)
        String value;

        @Override
        public Integer call() {
            print(parent.runtime().dashboardDelta(role, field, value));
            return 0;
        }
    }

    @Command(name = "stats", description = "Collection counts and runtime summary")
    static final class StatsCommand implements Callable<Integer> {
        @ParentCommand
        VaultFlowCommand parent;

        @Override
        public Integer call() {
            print(parent.runtime().stats());
            return 0;
        }
    }

    @Command(name = "reload-settings", description = "Reload vaultflow-settings.json")
    static final class ReloadSettingsCommand implements Callable<Integer> {
        @ParentCommand
        VaultFlowCommand parent;

        @Override
        public Integer call() {
            print(parent.runtime().reloadSettings());
            return 0;
        }
    }
}
