package com.gpufleet.governor.service;

import com.gpufleet.governor.model.CostLedgerEntry;
import com.gpufleet.governor.model.LedgerScope;
import com.gpufleet.governor.model.Machine;
import com.gpufleet.governor.model.TimePoint;
import com.gpufleet.governor.model.UsagePeriods;
import com.gpufleet.governor.model.UsageReport;
import com.gpufleet.governor.model.UsageSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Accrues running cost per ownership key and per account, and answers advisory "usage since T"
 * questions from recorded samples.
 * <p>
 * The ledger is the only source of truth for budgets. Usage views are recomputed from samples on
 * every call and never written back.
 */
@Service
public class CostLedgerService {

    private static final Logger log = LoggerFactory.getLogger(CostLedgerService.class);

    private static final String UNATTRIBUTED = "unknown";

    private final StateStoreService stateStore;
    private final IdleEvaluatorService idleEvaluator;
    private final Clock clock;

    public CostLedgerService(StateStoreService stateStore, IdleEvaluatorService idleEvaluator, Clock clock) {
        this.stateStore = stateStore;
        this.idleEvaluator = idleEvaluator;
        this.clock = clock;
    }

    /**
     * Charges one minute of list price for every active machine, whether or not it could be sampled.
     *
     * @return number of machines charged
     */
    public int accrue(List<Machine> machines) {
        int charged = 0;
        for (Machine machine : machines) {
            if (!machine.isActive() || machine.getHourlyCostCents() <= 0) {
                continue;
            }
            long centMinutes = machine.getHourlyCostCents();
            Optional<String> key = machine.primaryKey();
            stateStore.inTransaction(() -> {
                key.ifPresent(k -> stateStore.addCost(LedgerScope.KEY, k, centMinutes));
                if (machine.getAccount() != null) {
                    stateStore.addCost(LedgerScope.ACCOUNT, machine.getAccount(), centMinutes);
                }
                return null;
            });
            if (key.isEmpty()) {
                log.debug("Machine {} has no ownership key, charged to account {} only", machine.label(), machine.getAccount());
            }
            charged++;
        }
        return charged;
    }

    public long totalCents(LedgerScope scope, String identity) {
        return stateStore.totalCents(scope, identity);
    }

    public List<CostLedgerEntry> ledger(LedgerScope scope) {
        return stateStore.listLedger(scope);
    }

    /**
     * Usage per identity over {@code (since, until]}: one minute of list price per observed time point.
     */
    public Map<String, UsageSummary> usage(LedgerScope scope, Instant since, Instant until) {
        Map<String, UsageSummary> usage = new TreeMap<>();
        Map<String, TreeSet<String>> machineNames = new TreeMap<>();

        for (Machine machine : stateStore.listAllMachines()) {
            List<TimePoint> points = IdleEvaluatorService.groupTimePoints(
                stateStore.gpuSamplesBetween(machine.getId(), since, until), idleEvaluator.groupingTolerance());
            if (points.isEmpty()) {
                continue;
            }
            String identity = identityOf(scope, machine);
            UsageSummary summary = usage.computeIfAbsent(identity, id -> UsageSummary.builder().identity(id).build());
            summary.setMinutes(summary.getMinutes() + points.size());
            summary.setCentMinutes(summary.getCentMinutes() + (long) points.size() * machine.getHourlyCostCents());
            machineNames.computeIfAbsent(identity, id -> new TreeSet<>()).add(machine.label());
        }
        machineNames.forEach((identity, names) -> usage.get(identity).setMachines(List.copyOf(names)));
        return usage;
    }

    public Map<String, UsageSummary> usageByKey(Instant since, Instant until) {
        return usage(LedgerScope.KEY, since, until);
    }

    public Map<String, UsageSummary> usageByAccount(Instant since, Instant until) {
        return usage(LedgerScope.ACCOUNT, since, until);
    }

    public UsageReport usageReport() {
        return usageReport(clock.instant());
    }

    public UsageReport usageReport(Instant now) {
        return UsageReport.builder()
            .generatedAt(now)
            .byKey(periods(LedgerScope.KEY, now))
            .byAccount(periods(LedgerScope.ACCOUNT, now))
            .build();
    }

    private Map<String, UsagePeriods> periods(LedgerScope scope, Instant now) {
        Map<String, UsageSummary> hour = usage(scope, now.minus(Duration.ofHours(1)), now);
        Map<String, UsageSummary> day = usage(scope, now.minus(Duration.ofDays(1)), now);
        Map<String, UsageSummary> week = usage(scope, now.minus(Duration.ofDays(7)), now);

        Map<String, UsagePeriods> periods = new TreeMap<>();
        for (CostLedgerEntry entry : stateStore.listLedger(scope)) {
            periods.computeIfAbsent(entry.getIdentity(), id -> new UsagePeriods()).setTotalCents(entry.getTotalCents());
        }
        hour.forEach((id, u) -> periods.computeIfAbsent(id, k -> new UsagePeriods()).setLastHourCents(u.getCostCents()));
        day.forEach((id, u) -> periods.computeIfAbsent(id, k -> new UsagePeriods()).setLast24HoursCents(u.getCostCents()));
        week.forEach((id, u) -> periods.computeIfAbsent(id, k -> new UsagePeriods()).setLast7DaysCents(u.getCostCents()));
        return periods;
    }

    private static String identityOf(LedgerScope scope, Machine machine) {
        if (scope == LedgerScope.ACCOUNT) {
            return machine.getAccount() == null ? UNATTRIBUTED : machine.getAccount();
        }
        return machine.primaryKey().orElse(UNATTRIBUTED);
    }
}
