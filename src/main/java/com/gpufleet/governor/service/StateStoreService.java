package com.gpufleet.governor.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gpufleet.governor.model.AvailabilityRecord;
import com.gpufleet.governor.model.CostLedgerEntry;
import com.gpufleet.governor.model.DiskSample;
import com.gpufleet.governor.model.LedgerScope;
import com.gpufleet.governor.model.Machine;
import com.gpufleet.governor.model.NotificationState;
import com.gpufleet.governor.model.UtilizationSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Durable state: machines, GPU and disk samples, cost ledgers, notification state and capacity
 * observations.
 * <p>
 * Every write commits immediately. Logical operations that must not interleave (ledger increments
 * for one machine, the milestone read-decide-write) go through {@link #inTransaction(Supplier)}.
 */
@Service
public class StateStoreService {

    private static final Logger log = LoggerFactory.getLogger(StateStoreService.class);

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private static final String MACHINE_COLUMNS =
        "id, name, hostname, ip, private_ip, status, region, instance_type, gpu_count, hourly_cost_cents, "
            + "ssh_key_names, account, first_seen, last_seen, initialized, allowlisted";

    private final JdbcTemplate jdbc;
    private final TransactionTemplate transactions;
    private final Clock clock;
    private final ObjectMapper mapper = new ObjectMapper();

    private final RowMapper<Machine> machineRowMapper = this::mapMachine;

    public StateStoreService(JdbcTemplate jdbc, PlatformTransactionManager transactionManager, Clock clock) {
        this.jdbc = jdbc;
        this.transactions = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    public <T> T inTransaction(Supplier<T> work) {
        return transactions.execute(status -> work.get());
    }

    // ---- machines

    public void upsertMachine(Machine machine) {
        long now = clock.millis();
        String keys = writeKeys(machine.getSshKeyNames());
        inTransaction(() -> {
            int updated = jdbc.update(
                "UPDATE machines SET name = ?, hostname = ?, ip = ?, private_ip = ?, status = ?, region = ?, "
                    + "instance_type = ?, gpu_count = ?, hourly_cost_cents = ?, ssh_key_names = ?, account = ?, "
                    + "last_seen = ? WHERE id = ?",
                machine.getName(), machine.getHostname(), machine.getIp(), machine.getPrivateIp(),
                machine.getStatus(), machine.getRegion(), machine.getInstanceType(), machine.getGpuCount(),
                machine.getHourlyCostCents(), keys, machine.getAccount(), now, machine.getId());
            if (updated == 0) {
                jdbc.update("INSERT INTO machines (" + MACHINE_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                    machine.getId(), machine.getName(), machine.getHostname(), machine.getIp(), machine.getPrivateIp(),
                    machine.getStatus(), machine.getRegion(), machine.getInstanceType(), machine.getGpuCount(),
                    machine.getHourlyCostCents(), keys, machine.getAccount(), now, now, false, machine.isAllowlisted());
                log.info("New machine {} ({}) in account {}", machine.getId(), machine.label(), machine.getAccount());
            }
            return null;
        });
    }

    public Optional<Machine> findMachine(String machineId) {
        return jdbc.query("SELECT " + MACHINE_COLUMNS + " FROM machines WHERE id = ?", machineRowMapper, machineId)
            .stream().findFirst();
    }

    public List<Machine> listAllMachines() {
        return jdbc.query("SELECT " + MACHINE_COLUMNS + " FROM machines ORDER BY first_seen", machineRowMapper);
    }

    public List<Machine> listActiveMachines() {
        return jdbc.query("SELECT " + MACHINE_COLUMNS + " FROM machines WHERE status = ? ORDER BY first_seen",
            machineRowMapper, Machine.STATUS_ACTIVE);
    }

    public List<Machine> listActiveMachines(String account) {
        return jdbc.query("SELECT " + MACHINE_COLUMNS + " FROM machines WHERE status = ? AND account = ? ORDER BY first_seen",
            machineRowMapper, Machine.STATUS_ACTIVE, account);
    }

    public List<Machine> listUninitializedMachines() {
        return jdbc.query("SELECT " + MACHINE_COLUMNS + " FROM machines WHERE status = ? AND initialized = FALSE",
            machineRowMapper, Machine.STATUS_ACTIVE);
    }

    public List<Machine> listUninitializedMachines(String account) {
        return jdbc.query("SELECT " + MACHINE_COLUMNS + " FROM machines WHERE status = ? AND initialized = FALSE AND account = ?",
            machineRowMapper, Machine.STATUS_ACTIVE, account);
    }

    public void markInitialized(String machineId) {
        jdbc.update("UPDATE machines SET initialized = TRUE WHERE id = ?", machineId);
    }

    public boolean setAllowlisted(String machineId, boolean allowlisted) {
        return jdbc.update("UPDATE machines SET allowlisted = ? WHERE id = ?", allowlisted, machineId) > 0;
    }

    public void updateStatus(String machineId, String status) {
        jdbc.update("UPDATE machines SET status = ? WHERE id = ?", status, machineId);
    }

    /**
     * Machines of {@code account} still recorded as active that the provider no longer lists.
     */
    public int markMissingAsTerminated(String account, Collection<String> listedIds) {
        int marked = 0;
        for (Machine machine : listActiveMachines(account)) {
            if (!listedIds.contains(machine.getId())) {
                updateStatus(machine.getId(), Machine.STATUS_TERMINATED);
                log.info("Machine {} ({}) no longer listed by provider, marked {}",
                    machine.getId(), machine.label(), Machine.STATUS_TERMINATED);
                marked++;
            }
        }
        return marked;
    }

    // ---- samples

    /** One reading per accelerator, all stamped with the same instant. */
    public void addGpuSamples(String machineId, List<Integer> utilizations, Instant sampledAt) {
        List<Object[]> rows = new ArrayList<>();
        for (int i = 0; i < utilizations.size(); i++) {
            rows.add(new Object[]{machineId, i, utilizations.get(i), sampledAt.toEpochMilli()});
        }
        jdbc.batchUpdate("INSERT INTO gpu_samples (machine_id, gpu_index, utilization, sampled_at) VALUES (?, ?, ?, ?)", rows);
    }

    public List<UtilizationSample> gpuSamplesSince(String machineId, Instant since) {
        return jdbc.query(
            "SELECT machine_id, gpu_index, utilization, sampled_at FROM gpu_samples "
                + "WHERE machine_id = ? AND sampled_at > ? ORDER BY sampled_at, gpu_index",
            this::mapGpuSample, machineId, since.toEpochMilli());
    }

    public List<UtilizationSample> gpuSamplesBetween(String machineId, Instant since, Instant until) {
        return jdbc.query(
            "SELECT machine_id, gpu_index, utilization, sampled_at FROM gpu_samples "
                + "WHERE machine_id = ? AND sampled_at > ? AND sampled_at <= ? ORDER BY sampled_at, gpu_index",
            this::mapGpuSample, machineId, since.toEpochMilli(), until.toEpochMilli());
    }

    public void addDiskSample(DiskSample sample) {
        jdbc.update("INSERT INTO disk_samples (machine_id, total_bytes, used_bytes, sampled_at) VALUES (?, ?, ?, ?)",
            sample.getMachineId(), sample.getTotalBytes(), sample.getUsedBytes(), sample.getSampledAt().toEpochMilli());
    }

    public Optional<DiskSample> latestDiskSample(String machineId) {
        return jdbc.query(
            "SELECT machine_id, total_bytes, used_bytes, sampled_at FROM disk_samples "
                + "WHERE machine_id = ? ORDER BY sampled_at DESC LIMIT 1",
            this::mapDiskSample, machineId).stream().findFirst();
    }

    /**
     * Deletes samples strictly older than {@code cutoff}; a sample stamped after the cutoff is
     * never touched, however late its write lands.
     */
    public int pruneSamplesOlderThan(Instant cutoff) {
        int gpu = jdbc.update("DELETE FROM gpu_samples WHERE sampled_at < ?", cutoff.toEpochMilli());
        int disk = jdbc.update("DELETE FROM disk_samples WHERE sampled_at < ?", cutoff.toEpochMilli());
        return gpu + disk;
    }

    // ---- availability

    public void recordAvailability(String instanceType, List<String> regions, Instant recordedAt) {
        List<Object[]> rows = new ArrayList<>();
        for (String region : regions) {
            rows.add(new Object[]{instanceType, region, recordedAt.toEpochMilli()});
        }
        jdbc.batchUpdate("INSERT INTO availability (instance_type, region, recorded_at) VALUES (?, ?, ?)", rows);
    }

    public List<AvailabilityRecord> availabilitySince(Instant since) {
        return jdbc.query(
            "SELECT instance_type, region, recorded_at FROM availability WHERE recorded_at > ? ORDER BY recorded_at",
            (rs, i) -> AvailabilityRecord.builder()
                .instanceType(rs.getString("instance_type"))
                .region(rs.getString("region"))
                .recordedAt(Instant.ofEpochMilli(rs.getLong("recorded_at")))
                .build(),
            since.toEpochMilli());
    }

    public int pruneAvailabilityOlderThan(Instant cutoff) {
        return jdbc.update("DELETE FROM availability WHERE recorded_at < ?", cutoff.toEpochMilli());
    }

    // ---- cost ledger

    public void addCost(LedgerScope scope, String identity, long centMinutes) {
        if (centMinutes < 0) {
            throw new IllegalArgumentException("Cost increments must be non-negative: " + centMinutes);
        }
        long now = clock.millis();
        inTransaction(() -> {
            int updated = jdbc.update(
                "UPDATE " + scope.ledgerTable() + " SET cent_minutes = cent_minutes + ?, last_updated = ? WHERE "
                    + scope.identityColumn() + " = ?",
                centMinutes, now, identity);
            if (updated == 0) {
                jdbc.update("INSERT INTO " + scope.ledgerTable() + " (" + scope.identityColumn()
                    + ", cent_minutes, last_updated) VALUES (?, ?, ?)", identity, centMinutes, now);
            }
            return null;
        });
    }

    public Optional<CostLedgerEntry> findLedgerEntry(LedgerScope scope, String identity) {
        return jdbc.query(
            "SELECT " + scope.identityColumn() + ", cent_minutes, last_updated FROM " + scope.ledgerTable()
                + " WHERE " + scope.identityColumn() + " = ?",
            (rs, i) -> mapLedger(scope, rs), identity).stream().findFirst();
    }

    public long totalCents(LedgerScope scope, String identity) {
        return findLedgerEntry(scope, identity).map(CostLedgerEntry::getTotalCents).orElse(0L);
    }

    public List<CostLedgerEntry> listLedger(LedgerScope scope) {
        return jdbc.query(
            "SELECT " + scope.identityColumn() + ", cent_minutes, last_updated FROM " + scope.ledgerTable()
                + " ORDER BY cent_minutes DESC",
            (rs, i) -> mapLedger(scope, rs));
    }

    // ---- notification state

    public Optional<NotificationState> findNotificationState(LedgerScope scope, String identity) {
        return jdbc.query(
            "SELECT last_notified_cents, updated_at FROM notification_state WHERE scope = ? AND attribution_id = ?",
            (rs, i) -> NotificationState.builder()
                .scope(scope)
                .identity(identity)
                .lastNotifiedCents(rs.getLong("last_notified_cents"))
                .updatedAt(toInstant(rs, "updated_at"))
                .build(),
            scope.name(), identity).stream().findFirst();
    }

    /**
     * Reads {@code last_notified} and keeps the row locked until the surrounding transaction ends.
     * The row is created at zero when missing. Call it inside {@link #inTransaction(Supplier)}.
     */
    public long lockNotificationState(LedgerScope scope, String identity) {
        Optional<Long> current = selectNotifiedForUpdate(scope, identity);
        if (current.isPresent()) {
            return current.get();
        }
        try {
            jdbc.update("INSERT INTO notification_state (scope, attribution_id, last_notified_cents, updated_at) VALUES (?, ?, 0, ?)",
                scope.name(), identity, clock.millis());
            return 0L;
        } catch (DuplicateKeyException e) {
            // created by a concurrent pass; its row lock is released on commit
            return selectNotifiedForUpdate(scope, identity).orElse(0L);
        }
    }

    private Optional<Long> selectNotifiedForUpdate(LedgerScope scope, String identity) {
        return jdbc.queryForList(
            "SELECT last_notified_cents FROM notification_state WHERE scope = ? AND attribution_id = ? FOR UPDATE",
            Long.class, scope.name(), identity).stream().findFirst();
    }

    public void saveNotificationState(LedgerScope scope, String identity, long lastNotifiedCents) {
        long now = clock.millis();
        inTransaction(() -> {
            int updated = jdbc.update(
                "UPDATE notification_state SET last_notified_cents = ?, updated_at = ? WHERE scope = ? AND attribution_id = ?",
                lastNotifiedCents, now, scope.name(), identity);
            if (updated == 0) {
                jdbc.update("INSERT INTO notification_state (scope, attribution_id, last_notified_cents, updated_at) VALUES (?, ?, ?, ?)",
                    scope.name(), identity, lastNotifiedCents, now);
            }
            return null;
        });
    }

    // ---- mapping

    private Machine mapMachine(ResultSet rs, int rowNum) throws SQLException {
        return Machine.builder()
            .id(rs.getString("id"))
            .name(rs.getString("name"))
            .hostname(rs.getString("hostname"))
            .ip(rs.getString("ip"))
            .privateIp(rs.getString("private_ip"))
            .status(rs.getString("status"))
            .region(rs.getString("region"))
            .instanceType(rs.getString("instance_type"))
            .gpuCount(rs.getInt("gpu_count"))
            .hourlyCostCents(rs.getInt("hourly_cost_cents"))
            .sshKeyNames(readKeys(rs.getString("ssh_key_names")))
            .account(rs.getString("account"))
            .firstSeen(toInstant(rs, "first_seen"))
            .lastSeen(toInstant(rs, "last_seen"))
            .initialized(rs.getBoolean("initialized"))
            .allowlisted(rs.getBoolean("allowlisted"))
            .build();
    }

    private UtilizationSample mapGpuSample(ResultSet rs, int rowNum) throws SQLException {
        return UtilizationSample.builder()
            .machineId(rs.getString("machine_id"))
            .gpuIndex(rs.getInt("gpu_index"))
            .utilization(rs.getInt("utilization"))
            .sampledAt(Instant.ofEpochMilli(rs.getLong("sampled_at")))
            .build();
    }

    private DiskSample mapDiskSample(ResultSet rs, int rowNum) throws SQLException {
        return DiskSample.builder()
            .machineId(rs.getString("machine_id"))
            .totalBytes(rs.getLong("total_bytes"))
            .usedBytes(rs.getLong("used_bytes"))
            .sampledAt(Instant.ofEpochMilli(rs.getLong("sampled_at")))
            .build();
    }

    private CostLedgerEntry mapLedger(LedgerScope scope, ResultSet rs) throws SQLException {
        return CostLedgerEntry.builder()
            .scope(scope)
            .identity(rs.getString(scope.identityColumn()))
            .centMinutes(rs.getLong("cent_minutes"))
            .lastUpdated(toInstant(rs, "last_updated"))
            .build();
    }

    private static Instant toInstant(ResultSet rs, String column) throws SQLException {
        long millis = rs.getLong(column);
        return rs.wasNull() ? null : Instant.ofEpochMilli(millis);
    }

    private String writeKeys(List<String> keys) {
        try {
            return mapper.writeValueAsString(keys == null ? List.of() : keys);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize ssh key names", e);
        }
    }

    private List<String> readKeys(String json) {
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }
        try {
            return new ArrayList<>(mapper.readValue(json, STRING_LIST));
        } catch (JsonProcessingException e) {
            log.warn("Unreadable ssh key list {}: {}", json, e.getMessage());
            return new ArrayList<>();
        }
    }
}
