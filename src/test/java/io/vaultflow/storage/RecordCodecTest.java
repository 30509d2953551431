package io.vaultflow.storage;

import io.vaultflow.model.ActionType;
import io.vaultflow.model.ApprovalRequest;
import io.vaultflow.model.CollectionRef;
import io.vaultflow.model.ItemKind;
import io.vaultflow.model.Priority;
import io.vaultflow.model.WorkItem;
import io.vaultflow.model.WorkflowState;
import io.vaultflow.testing.TestVaults;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

final class RecordCodecTest {
    private static final CollectionRef INTAKE = CollectionRef.of(WorkflowState.INTAKE);
    private static final CollectionRef APPROVED = CollectionRef.of(WorkflowState.APPROVED);

    @Test
    void bodyMayContainFrontmatterLikeSeparators() {
        WorkItem item = WorkItem.intake("FILE_1", ItemKind.FILE_DROP, Priority.LOW, TestVaults.T0, "filesystem",
                Map.of("original_name", "notes.md"), "intro\n---\nnot a header\n---\n");

        WorkItem decoded = RecordCodec.decode(INTAKE, "FILE_1", RecordCodec.encode(item));

        Assertions.assertEquals(item.body(), decoded.body());
        Assertions.assertEquals("notes.md", decoded.metadata("original_name").orElseThrow());
    }

    @Test
    void collectionOverridesStaleStatusMirror() {
        String text = RecordCodec.encode(TestVaults.email("EMAIL_1", TestVaults.T0));

        WorkItem decoded = RecordCodec.decode(CollectionRef.of(WorkflowState.TRIAGED), "EMAIL_1", text);

        Assertions.assertEquals(WorkflowState.TRIAGED, decoded.state());
    }

    @Test
    void legacyPendingStatusIsAccepted() {
        String text = "---\ntype: email\nstatus: pending\npriority: high\ncreated: 2026-03-02T09:00:00\n---\nbody\n";

        WorkItem decoded = RecordCodec.decode(INTAKE, "EMAIL_LEGACY", text);

        Assertions.assertEquals("EMAIL_LEGACY", decoded.id());
        Assertions.assertEquals(Priority.HIGH, decoded.priority());
        Assertions.assertEquals(Instant.parse("2026-03-02T09:00:00Z"), decoded.createdAt());
    }

    @Test
    void ownerScopeFallsBackToClaimedFrom() {
        String text = "---\nid: EMAIL_2\ntype: email\ncreated: 2026-03-02T09:00:00Z\nclaimed_from: triaged\n---\n";

        WorkItem decoded = RecordCodec.decode(CollectionRef.ownerScoped("w1"), "EMAIL_2", text);

        Assertions.assertEquals(WorkflowState.TRIAGED, decoded.state());
    }

    @Test
    void mismatchedIdIsMalformed() {
        String text = RecordCodec.encode(TestVaults.email("EMAIL_3", TestVaults.T0));

        MalformedRecordException e = Assertions.assertThrows(MalformedRecordException.class,
                () -> RecordCodec.decode(INTAKE, "EMAIL_OTHER", text));
        Assertions.assertTrue(e.reason().contains("does not match"));
    }

    @Test
    void unknownStatusMirrorIsMalformedEvenInsideAStateCollection() {
        String text = "---\nid: EMAIL_4\ntype: email\nstatus: sleeping\ncreated: 2026-03-02T09:00:00Z\n---\n";

        Assertions.assertThrows(MalformedRecordException.class, () -> RecordCodec.decode(INTAKE, "EMAIL_4", text));
    }

    @Test
    void missingTypeOrCreatedIsMalformed() {
        Assertions.assertThrows(MalformedRecordException.class, () -> RecordCodec.decode(INTAKE, "X",
                "---\nid: X\ncreated: 2026-03-02T09:00:00Z\n---\n"));
        Assertions.assertThrows(MalformedRecordException.class, () -> RecordCodec.decode(INTAKE, "X",
                "---\nid: X\ntype: email\n---\n"));
        Assertions.assertThrows(MalformedRecordException.class, () -> RecordCodec.decode(INTAKE, "X",
                "---\nid: X\ntype: email\ncreated: yesterday\n---\n"));
    }

    @Test
    void approvalRequestTermsSurviveEncoding() {
        ApprovalRequest request = ApprovalRequest.create("APPROVAL_1", ActionType.SEND_EMAIL, Priority.HIGH,
                TestVaults.T0, Duration.ofHours(24), "reasoner", "EMAIL_1", "client@example.com", Map.of(), "draft");

        WorkItem decoded = RecordCodec.decode(CollectionRef.of(WorkflowState.PENDING_APPROVAL), "APPROVAL_1",
                RecordCodec.encode(request.item()));
        ApprovalRequest terms = ApprovalRequest.from(decoded);

        Assertions.assertEquals(ActionType.SEND_EMAIL, terms.action());
        Assertions.assertEquals(TestVaults.T0.plus(Duration.ofHours(24)), terms.expiresAt());
        Assertions.assertEquals("EMAIL_1", terms.linkedItemId());
        Assertions.assertEquals("client@example.com", terms.target());
    }

    @Test
    void approvalRequestWithUnreadableExpiryIsMalformed() {
        String text = "---\nid: APPROVAL_2\ntype: approval_request\ncreated: 2026-03-02T09:00:00Z\n"
                + "action: send_email\nexpires: next week\n---\n";

        MalformedRecordException e = Assertions.assertThrows(MalformedRecordException.class,
                () -> RecordCodec.decode(APPROVED, "APPROVAL_2", text));
        Assertions.assertTrue(e.reason().contains("expires"));
    }

    @Test
    void onlyMarkdownFilesWithValidIdsAreRecords() {
        Assertions.assertEquals(Optional.of("EMAIL_1"), RecordCodec.idOf("EMAIL_1.md"));
        Assertions.assertEquals(Optional.empty(), RecordCodec.idOf("EMAIL_1.txt"));
        Assertions.assertEquals(Optional.empty(), RecordCodec.idOf(".EMAIL_1.md"));
        Assertions.assertEquals(Optional.empty(), RecordCodec.idOf("bad name.md"));
    }
}
