package io.vaultflow.ledger;

import io.vaultflow.model.AuditLogEntry;
import io.vaultflow.model.AuditResult;
import io.vaultflow.security.SensitiveDataMasker;
import io.vaultflow.testing.TestVaults;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

final class AuditLedgerTest {

    @Test
    void concurrentWritersLoseNoEntries() throws Exception {
        Path root = Files.createTempDirectory("vaultflow-ledger-concurrent-");
        try {
            int writers = 8;
            int perWriter = 50;
            ExecutorService pool = Executors.newFixedThreadPool(writers);
            CountDownLatch start = new CountDownLatch(1);
            try {
                List<Future<?>> futures = new ArrayList<>();
                for (int w = 0; w < writers; w++) {
                    String actor = "writer-" + w;
                    // a ledger instance per writer, as separate processes would have
                    AuditLedger ledger = new AuditLedger(root.resolve("Logs"), "", 32, 512);
                    futures.add(pool.submit(() -> {
                        start.await();
                        for (int i = 0; i < perWriter; i++) {
                            ledger.append(AuditLogEntry.success(TestVaults.T0, "transition", actor, "ITEM_" + i,
                                    Map.of("seq", i)));
                        }
                        return null;
                    }));
                }
                start.countDown();
                for (Future<?> future : futures) {
                    future.get(60, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }

            AuditLedger reader = new AuditLedger(root.resolve("Logs"), "", 32, 512);
            String partition = AuditLedger.partitionKey(TestVaults.T0);
            List<AuditLogEntry> entries = reader.read(partition);
            Assertions.assertEquals(writers * perWriter, entries.size());
            Set<String> distinct = new HashSet<>();
            for (AuditLogEntry entry : entries) {
                distinct.add(entry.actor() + "/" + entry.target());
            }
            Assertions.assertEquals(writers * perWriter, distinct.size());

            AuditLedger.VerifyOutcome verify = reader.verify(partition);
            Assertions.assertTrue(verify.ok(), verify.problems().toString());
            Assertions.assertEquals(writers * perWriter, verify.checkedEntries());
        } finally {
            TestVaults.deleteRecursively(root);
        }
    }

    @Test
    void entriesArePartitionedByUtcDate() throws Exception {
        Path root = Files.createTempDirectory("vaultflow-ledger-partition-");
        try {
            AuditLedger ledger = new AuditLedger(root, "", 32, 512);
            Instant lateEvening = Instant.parse("2026-03-02T23:59:59Z");
            ledger.append(AuditLogEntry.success(lateEvening, "admit", "watcher", "EMAIL_1", Map.of()));
            ledger.append(AuditLogEntry.success(lateEvening.plusSeconds(2), "triage", "reasoner", "EMAIL_1", Map.of()));

            Assertions.assertEquals(List.of("2026-03-02", "2026-03-03"), ledger.partitions());
            Assertions.assertTrue(Files.isRegularFile(root.resolve("2026-03-02.jsonl")));

            List<AuditLogEntry> recent = ledger.recent(10);
            Assertions.assertEquals(List.of("admit", "triage"), recent.stream().map(AuditLogEntry::actionType).toList());
            Assertions.assertEquals(List.of("triage"),
                    ledger.recent(1).stream().map(AuditLogEntry::actionType).toList());
        } finally {
            TestVaults.deleteRecursively(root);
        }
    }

    @Test
    void tornTrailingLineIsSkippedAndChainContinues() throws Exception {
        Path root = Files.createTempDirectory("vaultflow-ledger-torn-");
        try {
            AuditLedger ledger = new AuditLedger(root, "", 32, 512);
            String partition = AuditLedger.partitionKey(TestVaults.T0);
            ledger.append(AuditLogEntry.success(TestVaults.T0, "admit", "watcher", "EMAIL_1", Map.of()));
            Files.writeString(ledger.partitionFile(partition), "{\"timestamp\":\"2026-03-0",
                    StandardCharsets.UTF_8, StandardOpenOption.APPEND);

            Assertions.assertEquals(1, ledger.read(partition).size());

            ledger.append(AuditLogEntry.failure(TestVaults.T0.plusSeconds(1), "send_email_executed", "orchestrator",
                    "client@example.com", Map.of(), "smtp refused"));

            List<AuditLogEntry> entries = ledger.read(partition);
            Assertions.assertEquals(2, entries.size());
            Assertions.assertEquals(AuditResult.FAILURE, entries.get(1).result());
            Assertions.assertEquals("smtp refused", entries.get(1).errorDetail());

            AuditLedger.VerifyOutcome verify = ledger.verify(partition);
            Assertions.assertTrue(verify.ok(), verify.problems().toString());
            Assertions.assertEquals(1, verify.skippedLines());
        } finally {
            TestVaults.deleteRecursively(root);
        }
    }

    @Test
    void verifyDetectsEditedEntry() throws Exception {
        Path root = Files.createTempDirectory("vaultflow-ledger-tamper-");
        try {
            AuditLedger ledger = new AuditLedger(root, "", 32, 512);
            String partition = AuditLedger.partitionKey(TestVaults.T0);
            ledger.append(AuditLogEntry.success(TestVaults.T0, "approve", "human", "APPROVAL_1", Map.of()));
            ledger.append(AuditLogEntry.success(TestVaults.T0.plusSeconds(1), "transition", "human", "APPROVAL_1",
                    Map.of()));

            Path file = ledger.partitionFile(partition);
            String text = Files.readString(file, StandardCharsets.UTF_8);
            Files.writeString(file, text.replaceFirst("\"actor\":\"human\"", "\"actor\":\"mallory\""),
                    StandardCharsets.UTF_8);

            AuditLedger.VerifyOutcome verify = ledger.verify(partition);
            Assertions.assertFalse(verify.ok());
            Assertions.assertTrue(verify.problems().contains("line 1: hash_mismatch"), verify.problems().toString());
        } finally {
            TestVaults.deleteRecursively(root);
        }
    }

    @Test
    void signedLedgerRejectsWrongSecret() throws Exception {
        Path root = Files.createTempDirectory("vaultflow-ledger-signed-");
        try {
            String partition = AuditLedger.partitionKey(TestVaults.T0);
            new AuditLedger(root, "s3cret", 32, 512)
                    .append(AuditLogEntry.success(TestVaults.T0, "admit", "watcher", "EMAIL_1", Map.of()));

            Assertions.assertTrue(new AuditLedger(root, "s3cret", 32, 512).verify(partition).ok());
            AuditLedger.VerifyOutcome wrong = new AuditLedger(root, "other", 32, 512).verify(partition);
            Assertions.assertFalse(wrong.ok());
            Assertions.assertTrue(wrong.problems().contains("line 1: signature_mismatch"));
        } finally {
            TestVaults.deleteRecursively(root);
        }
    }

    @Test
    void parametersAreMaskedAndBoundedBeforeWriting() throws Exception {
        Path root = Files.createTempDirectory("vaultflow-ledger-mask-");
        try {
            AuditLedger ledger = new AuditLedger(root, "", 2, 8);
            Map<String, Object> params = new LinkedHashMap<>();
            params.put("api_key", "supersecretvalue");
            params.put("subject", "A very long subject line");
            params.put("extra", "dropped");
            ledger.append(AuditLogEntry.success(TestVaults.T0, "send_email_executed", "orchestrator", "x", params));

            String raw = Files.readString(ledger.partitionFile(AuditLedger.partitionKey(TestVaults.T0)));
            Assertions.assertFalse(raw.contains("supersecretvalue"));
            Assertions.assertFalse(raw.contains("dropped"));

            Map<String, Object> stored = ledger.read(AuditLedger.partitionKey(TestVaults.T0)).get(0).parameters();
            Assertions.assertEquals(SensitiveDataMasker.MASK, stored.get("api_key"));
            Assertions.assertEquals("A very l...", stored.get("subject"));
            Assertions.assertEquals(1, stored.get(SensitiveDataMasker.TRUNCATED_KEY));
        } finally {
            TestVaults.deleteRecursively(root);
        }
    }

    @Test
    void invalidPartitionKeysAreRejected() {
        AuditLedger ledger = new AuditLedger(Path.of("Logs"), "", 32, 512);
        Assertions.assertThrows(IllegalArgumentException.class, () -> ledger.partitionFile("../etc/passwd"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> ledger.partitionFile("2026-3-2"));
        Assertions.assertEquals(Path.of("Logs", "2026-03-02.jsonl"),
                ledger.partitionFile(AuditLedger.partitionKey(TestVaults.T0.plus(Duration.ofHours(1)))));
    }
}
