package io.vaultflow.storage;

import io.vaultflow.config.VaultFlowConfig;
import io.vaultflow.model.CollectionRef;
import io.vaultflow.model.WorkItem;
import io.vaultflow.model.WorkflowState;
import io.vaultflow.testing.MutableStoreClock;
import io.vaultflow.testing.TestVaults;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Behaviour every {@link RecordStore} backend must share.
 */
abstract class RecordStoreContract {
    private static final CollectionRef INTAKE = CollectionRef.of(WorkflowState.INTAKE);
    private static final CollectionRef TRIAGED = CollectionRef.of(WorkflowState.TRIAGED);

    Path root;
    VaultFlowConfig config;
    MutableStoreClock clock;
    RecordStore store;

    abstract RecordStore newStore(VaultFlowConfig config, StoreClock clock);

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createTempDirectory("vaultflow-store-contract-");
        config = new VaultFlowConfig(root);
        clock = new MutableStoreClock(TestVaults.T0);
        store = newStore(config, clock);
        store.init();
    }

    @AfterEach
    void tearDown() throws Exception {
        TestVaults.deleteRecursively(root);
    }

    @Test
    void createExclusiveRejectsSecondCreatorOfSameId() {
        store.createExclusive(INTAKE, TestVaults.email("EMAIL_1", TestVaults.T0));

        RecordAlreadyExistsException e = Assertions.assertThrows(RecordAlreadyExistsException.class,
                () -> store.createExclusive(INTAKE, TestVaults.email("EMAIL_1", TestVaults.T0.plusSeconds(5))));
        Assertions.assertEquals("EMAIL_1", e.recordId());
        Assertions.assertEquals(TestVaults.T0, store.read(INTAKE, "EMAIL_1").orElseThrow().createdAt());
    }

    @Test
    void readReturnsWhatWasWritten() {
        WorkItem written = TestVaults.email("EMAIL_2", TestVaults.T0);
        store.createExclusive(INTAKE, written);

        WorkItem read = store.read(INTAKE, "EMAIL_2").orElseThrow();
        Assertions.assertEquals(written.id(), read.id());
        Assertions.assertEquals(written.kind(), read.kind());
        Assertions.assertEquals(written.priority(), read.priority());
        Assertions.assertEquals(written.metadata(), read.metadata());
        Assertions.assertEquals(written.body(), read.body());
        Assertions.assertEquals(WorkflowState.INTAKE, read.state());
        Assertions.assertTrue(store.read(TRIAGED, "EMAIL_2").isEmpty());
    }

    @Test
    void moveLeavesRecordInExactlyOneCollection() {
        store.createExclusive(INTAKE, TestVaults.email("EMAIL_3", TestVaults.T0));

        store.moveAtomic(INTAKE, TRIAGED, "EMAIL_3");

        Assertions.assertEquals(List.of(), store.list(INTAKE));
        Assertions.assertEquals(List.of("EMAIL_3"), store.list(TRIAGED));
        Assertions.assertEquals(Optional.of(TRIAGED), store.locate("EMAIL_3"));
        Assertions.assertEquals(WorkflowState.TRIAGED, store.read(TRIAGED, "EMAIL_3").orElseThrow().state());
    }

    @Test
    void moveOfMissingRecordIsNotFound() {
        Assertions.assertThrows(RecordNotFoundException.class, () -> store.moveAtomic(INTAKE, TRIAGED, "NOPE"));
    }

    @Test
    void moveOntoExistingRecordIsAlreadyExistsAndChangesNothing() {
        store.createExclusive(INTAKE, TestVaults.email("EMAIL_4", TestVaults.T0));
        store.createExclusive(TRIAGED, TestVaults.email("EMAIL_4", TestVaults.T0).withState(WorkflowState.TRIAGED));

        Assertions.assertThrows(RecordAlreadyExistsException.class, () -> store.moveAtomic(INTAKE, TRIAGED, "EMAIL_4"));
        Assertions.assertEquals(List.of("EMAIL_4"), store.list(INTAKE));
        Assertions.assertEquals(List.of("EMAIL_4"), store.list(TRIAGED));
    }

    @Test
    void updateRewritesRecordInPlace() {
        store.createExclusive(INTAKE, TestVaults.email("EMAIL_5", TestVaults.T0));

        store.update(INTAKE, "EMAIL_5", item -> item.withMetadata("labels", "billing"));

        Assertions.assertEquals("billing", store.read(INTAKE, "EMAIL_5").orElseThrow().metadata("labels").orElseThrow());
        Assertions.assertThrows(RecordNotFoundException.class,
                () -> store.update(TRIAGED, "EMAIL_5", item -> item.withMetadata("labels", "x")));
        Assertions.assertTrue(store.read(TRIAGED, "EMAIL_5").isEmpty());
    }

    @Test
    void updateMustKeepRecordId() {
        store.createExclusive(INTAKE, TestVaults.email("EMAIL_6", TestVaults.T0));

        Assertions.assertThrows(IllegalArgumentException.class,
                () -> store.update(INTAKE, "EMAIL_6", item -> TestVaults.email("OTHER", TestVaults.T0)));
    }

    @Test
    void concurrentMovesIntoOwnerScopesHaveExactlyOneWinner() throws Exception {
        store.createExclusive(INTAKE, TestVaults.email("EMAIL_RACE", TestVaults.T0));
        int workers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> attempts = new ArrayList<>();
            for (int i = 0; i < workers; i++) {
                String owner = "w" + i;
                attempts.add(pool.submit(() -> {
                    start.await();
                    try {
                        store.moveAtomic(INTAKE, CollectionRef.ownerScoped(owner), "EMAIL_RACE");
                        return true;
                    } catch (RecordNotFoundException e) {
                        return false;
                    }
                }));
            }
            start.countDown();
            int winners = 0;
            for (Future<Boolean> attempt : attempts) {
                if (attempt.get(30, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            Assertions.assertEquals(1, winners);
        } finally {
            pool.shutdownNow();
        }

        int holders = 0;
        for (CollectionRef collection : store.collections()) {
            if (store.list(collection).contains("EMAIL_RACE")) {
                holders++;
            }
        }
        Assertions.assertEquals(1, holders);
        Assertions.assertTrue(store.locate("EMAIL_RACE").orElseThrow().isOwnerScoped());
    }

    @Test
    void ownerScopesAndHeartbeatsAreListed() {
        store.createExclusive(INTAKE, TestVaults.email("EMAIL_7", TestVaults.T0));
        store.moveAtomic(INTAKE, CollectionRef.ownerScoped("worker-a"), "EMAIL_7");

        Instant beat = store.heartbeat("worker-a");
        clock.advance(Duration.ofMinutes(1));
        store.heartbeat("worker-b");

        Assertions.assertEquals(List.of(CollectionRef.ownerScoped("worker-a")),
                store.ownerScopes().stream().filter(scope -> !store.list(scope).isEmpty()).toList());
        Assertions.assertEquals(beat, store.heartbeats().get("worker-a"));
        Assertions.assertEquals(TestVaults.T0.plus(Duration.ofMinutes(1)), store.heartbeats().get("worker-b"));
    }

    @Test
    void quarantineMovesRecordAside() {
        store.createExclusive(INTAKE, TestVaults.email("EMAIL_8", TestVaults.T0));

        store.quarantine(INTAKE, "EMAIL_8");

        Assertions.assertEquals(Optional.of(CollectionRef.QUARANTINE), store.locate("EMAIL_8"));
    }

    @Test
    void nowComesFromTheStoreClock() {
        Assertions.assertEquals(TestVaults.T0, store.now());
        clock.advance(Duration.ofHours(25));
        Assertions.assertEquals(TestVaults.T0.plus(Duration.ofHours(25)), store.now());
    }
}
