package com.gpufleet.governor.service;

import com.gpufleet.governor.MutableClock;
import com.gpufleet.governor.model.CostLedgerEntry;
import com.gpufleet.governor.model.DiskSample;
import com.gpufleet.governor.model.LedgerScope;
import com.gpufleet.governor.model.Machine;
import com.gpufleet.governor.model.UtilizationSample;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class StateStoreServiceTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private EmbeddedDatabase database;
    private MutableClock clock;
    private StateStoreService store;

    @BeforeEach
    void setUp() {
        database = TestStateStores.newDatabase();
        clock = new MutableClock(T0);
        store = TestStateStores.newStore(database, clock);
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    private Machine machine(String id, String account) {
        return Machine.builder()
            .id(id)
            .name("train-" + id)
            .ip("10.0.0.1")
            .status(Machine.STATUS_ACTIVE)
            .gpuCount(2)
            .hourlyCostCents(120)
            .sshKeyNames(List.of("alice", "bob"))
            .account(account)
            .build();
    }

    @Test
    void shouldPreserveFirstSeenAndFlagsOnUpsert() {
        store.upsertMachine(machine("m1", "acct"));
        store.markInitialized("m1");
        store.setAllowlisted("m1", true);

        clock.advance(Duration.ofHours(3));
        Machine refreshed = machine("m1", "acct");
        refreshed.setName("renamed");
        refreshed.setHourlyCostCents(200);
        store.upsertMachine(refreshed);

        Machine stored = store.findMachine("m1").orElseThrow();
        assertEquals(T0, stored.getFirstSeen());
        assertEquals(T0.plus(Duration.ofHours(3)), stored.getLastSeen());
        assertTrue(stored.isInitialized());
        assertTrue(stored.isAllowlisted());
        assertEquals("renamed", stored.getName());
        assertEquals(200, stored.getHourlyCostCents());
        assertEquals(List.of("alice", "bob"), stored.getSshKeyNames());
    }

    @Test
    void shouldListActiveAndUninitializedMachinesByAccount() {
        store.upsertMachine(machine("m1", "a"));
        store.upsertMachine(machine("m2", "b"));
        Machine booting = machine("m3", "a");
        booting.setStatus("booting");
        store.upsertMachine(booting);
        store.markInitialized("m2");

        assertEquals(2, store.listActiveMachines().size());
        assertEquals(List.of("m1"), store.listActiveMachines("a").stream().map(Machine::getId).toList());
        assertEquals(List.of("m1"), store.listUninitializedMachines().stream().map(Machine::getId).toList());
        assertTrue(store.listUninitializedMachines("b").isEmpty());
    }

    @Test
    void shouldMarkMachinesMissingFromProviderAsTerminated() {
        store.upsertMachine(machine("m1", "a"));
        store.upsertMachine(machine("m2", "a"));
        store.upsertMachine(machine("m3", "b"));

        int marked = store.markMissingAsTerminated("a", List.of("m1"));

        assertEquals(1, marked);
        assertEquals(Machine.STATUS_TERMINATED, store.findMachine("m2").orElseThrow().getStatus());
        assertTrue(store.findMachine("m3").orElseThrow().isActive());
    }

    @Test
    void shouldReturnGpuSamplesAfterSinceInOrder() {
        store.addGpuSamples("m1", List.of(0, 40), T0);
        store.addGpuSamples("m1", List.of(10, 20), T0.plusSeconds(60));
        store.addGpuSamples("m2", List.of(99), T0.plusSeconds(60));

        List<UtilizationSample> samples = store.gpuSamplesSince("m1", T0);

        assertEquals(2, samples.size());
        assertEquals(0, samples.get(0).getGpuIndex());
        assertEquals(10, samples.get(0).getUtilization());
        assertEquals(20, samples.get(1).getUtilization());
        assertEquals(T0.plusSeconds(60), samples.get(1).getSampledAt());
    }

    @Test
    void shouldPruneOnlySamplesStrictlyOlderThanCutoff() {
        store.addGpuSamples("m1", List.of(5), T0.minusSeconds(1));
        store.addGpuSamples("m1", List.of(5), T0);
        store.addDiskSample(new DiskSample("m1", 100, 50, T0.minusSeconds(10)));
        store.addDiskSample(new DiskSample("m1", 100, 60, T0.plusSeconds(10)));

        int pruned = store.pruneSamplesOlderThan(T0);

        assertEquals(2, pruned);
        assertEquals(1, store.gpuSamplesSince("m1", T0.minusSeconds(60)).size());
        Optional<DiskSample> latest = store.latestDiskSample("m1");
        assertTrue(latest.isPresent());
        assertEquals(60, latest.get().getUsedBytes());
    }

    @Test
    void shouldAccumulateLedgerIncrementsPerScope() {
        store.addCost(LedgerScope.KEY, "alice", 90);
        store.addCost(LedgerScope.KEY, "alice", 90);
        store.addCost(LedgerScope.ACCOUNT, "alice", 60);

        CostLedgerEntry entry = store.findLedgerEntry(LedgerScope.KEY, "alice").orElseThrow();
        assertEquals(180, entry.getCentMinutes());
        assertEquals(3, entry.getTotalCents());
        assertEquals(1, store.totalCents(LedgerScope.ACCOUNT, "alice"));
        assertEquals(0, store.totalCents(LedgerScope.KEY, "nobody"));
    }

    @Test
    void shouldRejectNegativeCost() {
        assertThrows(IllegalArgumentException.class, () -> store.addCost(LedgerScope.KEY, "alice", -1));
    }

    @Test
    void shouldKeepNotificationStatePerScope() {
        store.saveNotificationState(LedgerScope.KEY, "alice", 2000);
        store.saveNotificationState(LedgerScope.KEY, "alice", 4000);

        assertEquals(4000, store.findNotificationState(LedgerScope.KEY, "alice").orElseThrow().getLastNotifiedCents());
        assertTrue(store.findNotificationState(LedgerScope.ACCOUNT, "alice").isEmpty());
    }

    @Test
    void shouldCreateNotificationRowAtZeroWhenLocking() {
        long first = store.inTransaction(() -> store.lockNotificationState(LedgerScope.ACCOUNT, "lab"));

        assertEquals(0, first);
        assertEquals(0, store.findNotificationState(LedgerScope.ACCOUNT, "lab").orElseThrow().getLastNotifiedCents());

        store.saveNotificationState(LedgerScope.ACCOUNT, "lab", 3000);
        assertEquals(3000L, store.inTransaction(() -> store.lockNotificationState(LedgerScope.ACCOUNT, "lab")));
    }

    @Test
    void shouldReturnFalseWhenAllowlistingUnknownMachine() {
        assertFalse(store.setAllowlisted("missing", true));
    }
}
