package io.vaultflow.runtime;

import io.vaultflow.approval.ApprovalExpiredException;
import io.vaultflow.approval.ApprovalGate;
import io.vaultflow.approval.ApprovalVerdict;
import io.vaultflow.config.VaultFlowConfig;
import io.vaultflow.config.VaultFlowSettings;
import io.vaultflow.model.ActionType;
import io.vaultflow.model.AuditLogEntry;
import io.vaultflow.model.AuditResult;
import io.vaultflow.model.CollectionRef;
import io.vaultflow.model.ItemKind;
import io.vaultflow.model.Priority;
import io.vaultflow.model.WorkflowState;
import io.vaultflow.testing.MutableStoreClock;
import io.vaultflow.testing.TestVaults;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

final class VaultFlowRuntimeTest {
    private Path root;
    private MutableStoreClock clock;
    private VaultFlowRuntime runtime;

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createTempDirectory("vaultflow-runtime-");
        clock = new MutableStoreClock(TestVaults.T0);
        runtime = new VaultFlowRuntime(new VaultFlowConfig(root), Map.of(VaultFlowSettings.DRY_RUN_ENV, "false"), clock);
        runtime.init();
    }

    @AfterEach
    void tearDown() throws Exception {
        TestVaults.deleteRecursively(root);
    }

    @Test
    void emailTravelsFromIntakeToDone() {
        runtime.admit(new VaultFlowRuntime.AdmitRequest("EMAIL_42", ItemKind.EMAIL, Priority.HIGH, "gmail_watcher",
                Map.of("from", "client@example.com"), "## Email Content\n\nInvoice please.\n"), "gmail_watcher");
        runtime.triage("EMAIL_42", "reasoner");
        VaultFlowRuntime.PlanOutcome plan = runtime.plan("EMAIL_42", "## Steps\n\n- draft reply\n", "reasoner");
        Assertions.assertEquals("PLAN_EMAIL_42", plan.plan().itemId());

        runtime.requestApproval(new ApprovalGate.Draft("APPROVAL_REPLY_42", ActionType.DRAFT_EMAIL, Priority.HIGH,
                "reasoner", "EMAIL_42", "client@example.com", Map.of(), "Draft the invoice reply.\n"), "reasoner");
        clock.advance(Duration.ofHours(1));
        runtime.approve("APPROVAL_REPLY_42", "human");

        ApprovalDispatcher.DispatchResult result = runtime.execute("APPROVAL_REPLY_42", "orchestrator");

        Assertions.assertEquals(ApprovalDispatcher.STATUS_MANUAL, result.status());
        Assertions.assertEquals(CollectionRef.of(WorkflowState.DONE), runtime.locate("APPROVAL_REPLY_42").orElseThrow());
        Assertions.assertEquals(CollectionRef.of(WorkflowState.DONE), runtime.locate("EMAIL_42").orElseThrow());
        VaultFlowRuntime.RecordView shown = runtime.show("EMAIL_42").orElseThrow();
        Assertions.assertEquals("Invoice please.", shown.body().lines().reduce((a, b) -> b).orElse(""));
        Assertions.assertEquals("client@example.com", shown.metadata().get("from"));
        Assertions.assertEquals(List.of("PLAN_EMAIL_42"), runtime.list(CollectionRef.of(WorkflowState.PLANNED)));
        Assertions.assertTrue(runtime.auditVerify(null).stream().allMatch(v -> v.ok()));
    }

    @Test
    void executingAfterDeadlineFailsAsExpired() {
        runtime.requestApproval(new ApprovalGate.Draft("APPROVAL_PAY_1", ActionType.PAYMENT, Priority.URGENT,
                "reasoner", null, "ACME Ltd", Map.of("amount", "120.00"), "Pay invoice 17.\n"), "reasoner");
        clock.advance(Duration.ofHours(1));
        runtime.approve("APPROVAL_PAY_1", "human");
        clock.set(TestVaults.T0.plus(Duration.ofHours(25)));

        Assertions.assertThrows(ApprovalExpiredException.class, () -> runtime.execute("APPROVAL_PAY_1", "orchestrator"));
        Assertions.assertEquals(ApprovalVerdict.Outcome.EXPIRED,
                runtime.checkExecutable("APPROVAL_PAY_1", "orchestrator").outcome());
    }

    @Test
    void resubmittedApprovalGetsFreshDeadline() {
        runtime.requestApproval(new ApprovalGate.Draft("APPROVAL_POST_7", ActionType.POST_LINKEDIN, Priority.NORMAL,
                "reasoner", null, "company-page", Map.of("topic", "launch"), "Launch post.\n"), "reasoner");
        clock.set(TestVaults.T0.plus(Duration.ofHours(30)));
        runtime.checkExecutable("APPROVAL_POST_7", "orchestrator");
        Assertions.assertEquals(CollectionRef.of(WorkflowState.EXPIRED), runtime.locate("APPROVAL_POST_7").orElseThrow());

        VaultFlowRuntime.ResubmitOutcome outcome = runtime.resubmit("APPROVAL_POST_7", "human");

        Assertions.assertEquals("Pending_Approval", outcome.collection());
        Assertions.assertTrue(outcome.newId().startsWith("APPROVAL_POST_7_resub_"), outcome.newId());
        VaultFlowRuntime.RecordView copy = runtime.show(outcome.newId()).orElseThrow();
        Assertions.assertEquals("APPROVAL_POST_7", copy.metadata().get(VaultFlowRuntime.RESUBMITTED_FROM_KEY));
        Assertions.assertEquals("launch", copy.metadata().get("topic"));
        Assertions.assertEquals(TestVaults.T0.plus(Duration.ofHours(54)).toString(), copy.metadata().get("expires"));
        Assertions.assertEquals(CollectionRef.of(WorkflowState.EXPIRED), runtime.locate("APPROVAL_POST_7").orElseThrow());
    }

    @Test
    void onlyClosedItemsCanBeResubmitted() {
        runtime.admit(new VaultFlowRuntime.AdmitRequest("FILE_1", ItemKind.FILE_DROP, Priority.LOW, "file_watcher",
                Map.of(), "notes\n"), "file_watcher");

        Assertions.assertThrows(IllegalArgumentException.class, () -> runtime.resubmit("FILE_1", "human"));
    }

    @Test
    void settingsReloadIsAuditedAndApplied() throws Exception {
        Files.writeString(root.resolve("vaultflow-settings.json"),
                "{\"approvalWindowMs\": 7200000, \"auditSigningSecret\": \"not-printed\"}", StandardCharsets.UTF_8);

        VaultFlowRuntime.SettingsReloadOutcome outcome = runtime.reloadSettings();

        Assertions.assertTrue(outcome.changed());
        Assertions.assertEquals(List.of("approvalWindowMs", "auditSigningSecret"), outcome.changedFields());
        Assertions.assertTrue(outcome.settings().auditSigning());
        Assertions.assertFalse(outcome.settings().dryRun());
        AuditLogEntry audit = runtime.auditTail(1).get(0);
        Assertions.assertEquals(VaultFlowRuntime.ACTION_SETTINGS_LOAD, audit.actionType());
        Assertions.assertFalse(audit.parameters().toString().contains("not-printed"));

        ApprovalGate.RequestOutcome request = runtime.requestApproval(new ApprovalGate.Draft(null, ActionType.SEND_EMAIL,
                Priority.NORMAL, "reasoner", null, "a@example.com", Map.of(), ""), "reasoner");
        Assertions.assertEquals(TestVaults.T0.plus(Duration.ofHours(2)), request.expiresAt());
    }

    @Test
    void unreadableSettingsKeepPreviousValues() throws Exception {
        Files.writeString(root.resolve("vaultflow-settings.json"), "{\"approvalWindowMs\": ", StandardCharsets.UTF_8);

        VaultFlowRuntime.SettingsReloadOutcome outcome = runtime.reloadSettings();

        Assertions.assertFalse(outcome.changed());
        Assertions.assertEquals("invalid_kept_previous", outcome.message());
        Assertions.assertEquals(VaultFlowSettings.DEFAULT_APPROVAL_WINDOW_MS, runtime.settings().approvalWindowMs());
        Assertions.assertEquals(AuditResult.FAILURE, runtime.auditTail(1).get(0).result());
    }

    @Test
    void statsSummarizeTheVault() {
        runtime.admit(new VaultFlowRuntime.AdmitRequest(null, ItemKind.CHAT, Priority.NORMAL, "discord_watcher",
                Map.of("channel", "#support"), "help\n"), "discord_watcher");
        String id = runtime.list(CollectionRef.of(WorkflowState.INTAKE)).get(0);
        Assertions.assertTrue(id.startsWith("CHAT_20260302_090000_"), id);
        runtime.triage(id, "reasoner");
        runtime.claim(id, WorkflowState.TRIAGED, "worker-a").orElseThrow();
        runtime.heartbeat("worker-a");

        VaultFlowRuntime.Stats stats = runtime.stats();

        Assertions.assertEquals("file", stats.backend());
        Assertions.assertFalse(stats.dryRun());
        Assertions.assertEquals(1, stats.claimedItems());
        Assertions.assertEquals(1, stats.heartbeatOwners());
        Assertions.assertEquals(0, stats.collections().get("Triaged"));
        Assertions.assertEquals(1, stats.ledgerPartitions());
        Assertions.assertTrue(stats.supportedActions().contains("discord_reply"));

        runtime.release("worker-a", id, "worker-a", "shift over");
        Assertions.assertEquals(List.of(id), runtime.list(CollectionRef.of(WorkflowState.TRIAGED)));
    }
}
