package io.vaultflow.claim;

import io.vaultflow.config.VaultFlowConfig;
import io.vaultflow.engine.TransitionEngine;
import io.vaultflow.ledger.AuditLedger;
import io.vaultflow.model.AuditLogEntry;
import io.vaultflow.model.Claim;
import io.vaultflow.model.CollectionRef;
import io.vaultflow.model.WorkItem;
import io.vaultflow.model.WorkflowState;
import io.vaultflow.storage.FileRecordStore;
import io.vaultflow.testing.MutableStoreClock;
import io.vaultflow.testing.TestVaults;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

final class ClaimControllerTest {
    private static final CollectionRef TRIAGED = CollectionRef.of(WorkflowState.TRIAGED);

    private Path root;
    private MutableStoreClock clock;
    private FileRecordStore store;
    private AuditLedger ledger;
    private ClaimController claims;

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createTempDirectory("vaultflow-claims-");
        VaultFlowConfig config = new VaultFlowConfig(root);
        clock = new MutableStoreClock(TestVaults.T0);
        store = new FileRecordStore(config, clock);
        store.init();
        ledger = new AuditLedger(config.logsDir(), "", 32, 512);
        claims = new ClaimController(store, new TransitionEngine(store, ledger), ledger);
    }

    @AfterEach
    void tearDown() throws Exception {
        TestVaults.deleteRecursively(root);
    }

    @Test
    void twoWorkersRacingForOneItemProduceOneWinner() throws Exception {
        store.createExclusive(TRIAGED, TestVaults.email("EMAIL_RACE", TestVaults.T0).withState(WorkflowState.TRIAGED));

        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<Optional<Claim>> w1 = pool.submit(() -> {
                start.await();
                return claims.tryClaim(WorkflowState.TRIAGED, "EMAIL_RACE", "W1");
            });
            Future<Optional<Claim>> w2 = pool.submit(() -> {
                start.await();
                return claims.tryClaim(WorkflowState.TRIAGED, "EMAIL_RACE", "W2");
            });
            start.countDown();
            Optional<Claim> first = w1.get(30, TimeUnit.SECONDS);
            Optional<Claim> second = w2.get(30, TimeUnit.SECONDS);

            Assertions.assertTrue(first.isPresent() ^ second.isPresent());
            Claim winner = first.isPresent() ? first.get() : second.orElseThrow();
            String loser = "W1".equals(winner.ownerId()) ? "W2" : "W1";

            Assertions.assertEquals(List.of("EMAIL_RACE"), store.list(winner.collection()));
            Assertions.assertTrue(store.list(CollectionRef.ownerScoped(loser)).isEmpty());
            Assertions.assertTrue(store.list(TRIAGED).isEmpty());
        } finally {
            pool.shutdownNow();
        }

        long claimEntries = ledger.read(AuditLedger.partitionKey(TestVaults.T0)).stream()
                .filter(e -> ClaimController.ACTION_CLAIM.equals(e.actionType()))
                .count();
        Assertions.assertEquals(1, claimEntries);
    }

    @Test
    void claimStampsOwnershipMetadata() {
        store.createExclusive(TRIAGED, TestVaults.email("EMAIL_1", TestVaults.T0).withState(WorkflowState.TRIAGED));
        clock.advance(Duration.ofMinutes(3));

        Claim claim = claims.tryClaim(WorkflowState.TRIAGED, "EMAIL_1", "worker-a").orElseThrow();

        Assertions.assertEquals(TestVaults.T0.plus(Duration.ofMinutes(3)), claim.claimedAt());
        Assertions.assertEquals(WorkflowState.TRIAGED, claim.origin());
        WorkItem held = store.read(claim.collection(), "EMAIL_1").orElseThrow();
        Assertions.assertEquals("worker-a", held.metadata().get(Claim.CLAIMED_BY_KEY));
        Assertions.assertEquals("triaged", held.metadata().get(Claim.CLAIMED_FROM_KEY));
        Assertions.assertEquals(claim, claims.claimOf("worker-a", "EMAIL_1").orElseThrow());
        Assertions.assertEquals(List.of(claim), claims.listClaims());
    }

    @Test
    void claimOfMissingItemIsEmpty() {
        Assertions.assertTrue(claims.tryClaim(WorkflowState.TRIAGED, "NOPE", "worker-a").isEmpty());
    }

    @Test
    void releaseReturnsItemWithoutClaimFields() {
        store.createExclusive(TRIAGED, TestVaults.email("EMAIL_2", TestVaults.T0).withState(WorkflowState.TRIAGED));
        Claim claim = claims.tryClaim(WorkflowState.TRIAGED, "EMAIL_2", "worker-a").orElseThrow();

        claims.release(claim, "worker-a", "executor unavailable");

        WorkItem back = store.read(TRIAGED, "EMAIL_2").orElseThrow();
        Assertions.assertTrue(Claim.METADATA_KEYS.stream().noneMatch(back.metadata()::containsKey));
        Assertions.assertEquals("client@example.com", back.metadata().get("from"));
        Assertions.assertTrue(store.list(claim.collection()).isEmpty());

        List<AuditLogEntry> entries = ledger.recent(1);
        Assertions.assertEquals(ClaimController.ACTION_RELEASE, entries.get(0).actionType());
        Assertions.assertEquals("executor unavailable", entries.get(0).parameters().get("reason"));
    }

    @Test
    void reclaimReturnsOnlyItemsOfStaleOwners() {
        store.createExclusive(TRIAGED, TestVaults.email("EMAIL_STALE", TestVaults.T0).withState(WorkflowState.TRIAGED));
        store.createExclusive(TRIAGED, TestVaults.email("EMAIL_FRESH", TestVaults.T0).withState(WorkflowState.TRIAGED));
        claims.heartbeat("dead-worker");
        claims.tryClaim(WorkflowState.TRIAGED, "EMAIL_STALE", "dead-worker").orElseThrow();
        claims.tryClaim(WorkflowState.TRIAGED, "EMAIL_FRESH", "live-worker").orElseThrow();

        clock.advance(Duration.ofMinutes(20));
        claims.heartbeat("live-worker");

        ClaimController.ReclaimSummary summary = claims.reclaimStale(Duration.ofMinutes(10), "orchestrator");

        Assertions.assertEquals(List.of("EMAIL_STALE"), summary.reclaimedIds());
        Assertions.assertEquals(List.of("EMAIL_STALE"), store.list(TRIAGED));
        Assertions.assertEquals(List.of("EMAIL_FRESH"), store.list(CollectionRef.ownerScoped("live-worker")));
        Assertions.assertTrue(store.list(CollectionRef.ownerScoped("dead-worker")).isEmpty());
    }

    @Test
    void ownerWithoutHeartbeatIsJudgedByClaimTime() {
        store.createExclusive(TRIAGED, TestVaults.email("EMAIL_3", TestVaults.T0).withState(WorkflowState.TRIAGED));
        claims.tryClaim(WorkflowState.TRIAGED, "EMAIL_3", "quiet-worker").orElseThrow();

        clock.advance(Duration.ofMinutes(5));
        Assertions.assertEquals(0, claims.reclaimStale(Duration.ofMinutes(10), "orchestrator").reclaimed());

        clock.advance(Duration.ofMinutes(10));
        Assertions.assertEquals(1, claims.reclaimStale(Duration.ofMinutes(10), "orchestrator").reclaimed());
        Assertions.assertEquals(List.of("EMAIL_3"), store.list(TRIAGED));
    }

    @Test
    void freshClaimSurvivesAnOldHeartbeat() {
        store.createExclusive(TRIAGED, TestVaults.email("EMAIL_LATE", TestVaults.T0).withState(WorkflowState.TRIAGED));
        claims.heartbeat("slow-worker");
        clock.advance(Duration.ofMinutes(16));
        claims.tryClaim(WorkflowState.TRIAGED, "EMAIL_LATE", "slow-worker").orElseThrow();

        ClaimController.ReclaimSummary summary = claims.reclaimStale(Duration.ofMinutes(15), "peer");

        Assertions.assertEquals(0, summary.reclaimed());
        Assertions.assertEquals(List.of("EMAIL_LATE"), store.list(CollectionRef.ownerScoped("slow-worker")));

        clock.advance(Duration.ofMinutes(16));
        Assertions.assertEquals(List.of("EMAIL_LATE"), claims.reclaimStale(Duration.ofMinutes(15), "peer").reclaimedIds());
        Assertions.assertEquals(List.of("EMAIL_LATE"), store.list(TRIAGED));
    }
}
