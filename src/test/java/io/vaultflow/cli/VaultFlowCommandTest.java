package io.vaultflow.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.vaultflow.runtime.ApprovalDispatcher;
import io.vaultflow.testing.TestVaults;
import io.vaultflow.util.Jsons;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

final class VaultFlowCommandTest {
    private Path root;
    private PrintStream originalOut;
    private ByteArrayOutputStream out;
    private StringWriter err;

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createTempDirectory("vaultflow-cli-");
        originalOut = System.out;
        out = new ByteArrayOutputStream();
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        err = new StringWriter();
    }

    @AfterEach
    void tearDown() throws Exception {
        System.setOut(originalOut);
        TestVaults.deleteRecursively(root);
    }

    @Test
    void initAdmitAndShowPrintJson() throws Exception {
        Assertions.assertEquals(0, run("init"));
        Assertions.assertTrue(Files.isDirectory(root.resolve("Needs_Action")));
        Assertions.assertTrue(Files.isDirectory(root.resolve("Pending_Approval")));
        out.reset();

        Assertions.assertEquals(0, run("admit", "--id", "EMAIL_CLI_1", "--type", "email", "--priority", "high",
                "--meta", "from=client@example.com", "--body", "Hello there"));
        JsonNode admitted = Jsons.mapper().readTree(out.toString(StandardCharsets.UTF_8));
        Assertions.assertEquals("EMAIL_CLI_1", admitted.path("itemId").asText());
        Assertions.assertFalse(admitted.path("duplicate").asBoolean());
        out.reset();

        Assertions.assertEquals(0, run("show", "EMAIL_CLI_1"));
        JsonNode shown = Jsons.mapper().readTree(out.toString(StandardCharsets.UTF_8));
        Assertions.assertEquals("Needs_Action", shown.path("collection").asText());
        Assertions.assertEquals("high", shown.path("priority").asText());
        Assertions.assertEquals("client@example.com", shown.path("metadata").path("from").asText());
    }

    @Test
    void executingUnknownRequestExitsNotFound() throws Exception {
        run("init");

        int code = run("execute", "APPROVAL_MISSING");

        Assertions.assertEquals(VaultFlowCommand.EXIT_NOT_FOUND, code);
        JsonNode error = Jsons.mapper().readTree(err.toString());
        Assertions.assertFalse(error.path("ok").asBoolean(true));
        Assertions.assertEquals("NotFound", error.path("error").asText());
    }

    @Test
    void illegalTransitionExitsWithItsOwnCode() throws Exception {
        run("admit", "--id", "EMAIL_CLI_2", "--type", "email", "--body", "x");

        int code = run("transition", "EMAIL_CLI_2", "--from", "intake", "--to", "approved");

        Assertions.assertEquals(VaultFlowCommand.EXIT_ILLEGAL_TRANSITION, code);
        Assertions.assertEquals("IllegalTransition",
                Jsons.mapper().readTree(err.toString()).path("error").asText());
    }

    @Test
    void nonWriterRoleCannotRebuildDashboard() {
        int code = run("dashboard", "--role", "cloud");

        Assertions.assertEquals(VaultFlowCommand.EXIT_NOT_WRITER, code);
        Assertions.assertFalse(Files.exists(root.resolve("Dashboard.md")));
    }

    @Test
    void executeExitCodeReflectsWhetherTheActionRan() {
        Assertions.assertEquals(0, VaultFlowCommand.exitCodeOf(result(ApprovalDispatcher.STATUS_EXECUTED)));
        Assertions.assertEquals(0, VaultFlowCommand.exitCodeOf(result(ApprovalDispatcher.STATUS_MANUAL)));
        Assertions.assertEquals(VaultFlowCommand.EXIT_EXPIRED,
                VaultFlowCommand.exitCodeOf(result(ApprovalDispatcher.STATUS_SKIPPED_EXPIRED)));
        Assertions.assertEquals(VaultFlowCommand.EXIT_NOT_FOUND,
                VaultFlowCommand.exitCodeOf(result(ApprovalDispatcher.STATUS_LOST_RACE)));
        Assertions.assertEquals(VaultFlowCommand.EXIT_MALFORMED,
                VaultFlowCommand.exitCodeOf(result(ApprovalDispatcher.STATUS_QUARANTINED)));
        Assertions.assertEquals(VaultFlowCommand.EXIT_FAILURE,
                VaultFlowCommand.exitCodeOf(result(ApprovalDispatcher.STATUS_NOT_APPROVED)));
        Assertions.assertEquals(VaultFlowCommand.EXIT_FAILURE,
                VaultFlowCommand.exitCodeOf(result(ApprovalDispatcher.STATUS_UNSUPPORTED)));
    }

    private static ApprovalDispatcher.DispatchResult result(String status) {
        return new ApprovalDispatcher.DispatchResult("APPROVAL_1", status, "send_email", "client@example.com", "");
    }

    private int run(String... args) {
        String[] full = new String[args.length + 2];
        full[0] = "--root";
        full[1] = root.toString();
        System.arraycopy(args, 0, full, 2, args.length);
        CommandLine cmd = VaultFlowCommand.commandLine(new VaultFlowCommand().withEnvironment(Map.of()));
        cmd.setErr(new PrintWriter(err, true));
        return cmd.execute(full);
    }
}
