package com.gpufleet.governor.service;

import com.gpufleet.governor.model.AccountCheck;
import com.gpufleet.governor.model.BudgetOutcome;
import com.gpufleet.governor.model.FleetAccount;
import com.gpufleet.governor.model.IdleOutcome;
import com.gpufleet.governor.model.Machine;
import com.gpufleet.governor.model.ProviderInstance;
import com.gpufleet.governor.model.ReconcileReport;
import com.gpufleet.governor.model.SamplingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One reconciliation pass over every configured account: refresh machines, accrue cost,
 * initialize new machines, sample, then run the idle and budget policies. Each account runs in
 * isolation; a failure in one is recorded and the pass moves on.
 * <p>
 * Invoked repeatedly by an external scheduler. Passes may overlap with the separately triggered
 * idle and budget checks; the budget enforcer serializes alert decisions per identity.
 */
@Service
public class ReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationService.class);

    @Value("${fleet.reconcile.enforce-idle:true}")
    private boolean enforceIdle = true;

    @Value("${fleet.reconcile.enforce-budgets:true}")
    private boolean enforceBudgets = true;

    @Value("${fleet.samples.retention-hours:24}")
    private long retentionHours = 24;

    private final AccountConfigService accountConfig;
    private final LambdaCloudService cloud;
    private final StateStoreService stateStore;
    private final CostLedgerService costLedger;
    private final MachineInitializerService initializer;
    private final MetricsSamplerService sampler;
    private final IdleTerminationService idleTermination;
    private final BudgetEnforcerService budgetEnforcer;
    private final AvailabilityService availability;
    private final Clock clock;

    public ReconciliationService(AccountConfigService accountConfig, LambdaCloudService cloud,
                                 StateStoreService stateStore, CostLedgerService costLedger,
                                 MachineInitializerService initializer, MetricsSamplerService sampler,
                                 IdleTerminationService idleTermination, BudgetEnforcerService budgetEnforcer,
                                 AvailabilityService availability, Clock clock) {
        this.accountConfig = accountConfig;
        this.cloud = cloud;
        this.stateStore = stateStore;
        this.costLedger = costLedger;
        this.initializer = initializer;
        this.sampler = sampler;
        this.idleTermination = idleTermination;
        this.budgetEnforcer = budgetEnforcer;
        this.availability = availability;
        this.clock = clock;
    }

    public void setEnforceIdle(boolean enforceIdle) {
        this.enforceIdle = enforceIdle;
    }

    public void setEnforceBudgets(boolean enforceBudgets) {
        this.enforceBudgets = enforceBudgets;
    }

    public void setRetentionHours(long retentionHours) {
        this.retentionHours = retentionHours;
    }

    public ReconcileReport reconcile() {
        ReconcileReport report = new ReconcileReport();
        report.setStartedAt(clock.instant());

        List<FleetAccount> accounts = accountConfig.getAccounts();
        if (accounts.isEmpty()) {
            log.warn("No accounts configured, nothing to reconcile");
        }
        for (FleetAccount account : accounts) {
            try {
                reconcileAccount(account, report);
                report.getAccountsProcessed().add(account.getName());
            } catch (RuntimeException e) {
                report.getFailedAccounts().put(account.getName(), String.valueOf(e.getMessage()));
                log.error("Reconciliation failed for account '{}': {}", account.getName(), e.getMessage(), e);
            }
        }

        if (enforceBudgets) {
            try {
                report.getBudgetOutcomes().addAll(budgetEnforcer.enforceKeys());
            } catch (RuntimeException e) {
                log.error("Key budget check failed: {}", e.getMessage(), e);
            }
        }

        if (availability.isEnabled() && !report.getAccountsProcessed().isEmpty()) {
            String via = report.getAccountsProcessed().get(0);
            try {
                accounts.stream().filter(a -> a.getName().equals(via)).findFirst()
                    .ifPresent(account -> report.setAvailabilityRecorded(availability.record(account)));
            } catch (RuntimeException e) {
                log.warn("Availability recording failed: {}", e.getMessage());
            }
        }

        Instant cutoff = clock.instant().minus(Duration.ofHours(retentionHours));
        report.setSamplesPruned(stateStore.pruneSamplesOlderThan(cutoff));
        report.setFinishedAt(clock.instant());
        log.info("Reconciliation finished: {} account(s) ok, {} failed, {} machine(s) seen, {} charged, {} sample(s) pruned",
            report.getAccountsProcessed().size(), report.getFailedAccounts().size(), report.getMachinesSeen(),
            report.getMachinesCharged(), report.getSamplesPruned());
        return report;
    }

    private void reconcileAccount(FleetAccount account, ReconcileReport report) {
        String name = account.getName();
        List<ProviderInstance> instances = cloud.listInstances(account.getApiKey());
        List<String> listed = new ArrayList<>();
        for (ProviderInstance instance : instances) {
            stateStore.upsertMachine(instance.toMachine(name));
            listed.add(instance.getId());
        }
        int gone = stateStore.markMissingAsTerminated(name, listed);
        if (gone > 0) {
            log.info("Account '{}': {} machine(s) no longer listed, marked terminated", name, gone);
        }
        report.setMachinesSeen(report.getMachinesSeen() + instances.size());

        List<Machine> active = stateStore.listActiveMachines(name);
        report.setMachinesCharged(report.getMachinesCharged() + costLedger.accrue(active));

        report.setMachinesInitialized(report.getMachinesInitialized()
            + initializer.initializePending(stateStore.listUninitializedMachines(name)));

        SamplingResult sampling = sampler.sampleAll(active);
        report.setGpuSamples(report.getGpuSamples() + sampling.getGpuSamples());
        report.setDiskSamples(report.getDiskSamples() + sampling.getDiskSamples());

        if (enforceIdle) {
            report.getIdleOutcomes().add(idleTermination.enforce(account));
        }
        if (enforceBudgets) {
            report.getBudgetOutcomes().add(budgetEnforcer.enforceAccount(account));
        }
    }

    /**
     * Checks every account's credential: instance count and registered SSH key names. A failing
     * account is reported, not thrown.
     */
    public List<AccountCheck> checkAccounts() {
        List<AccountCheck> checks = new ArrayList<>();
        for (FleetAccount account : accountConfig.getAccounts()) {
            AccountCheck check = AccountCheck.builder().account(account.getName()).build();
            try {
                check.setInstances(cloud.listInstances(account.getApiKey()).size());
                cloud.listSshKeys(account.getApiKey()).forEach(key -> check.getSshKeys().add(key.getName()));
                check.setReachable(true);
            } catch (RuntimeException e) {
                check.setError(String.valueOf(e.getMessage()));
                log.warn("Account '{}' check failed: {}", account.getName(), e.getMessage());
            }
            checks.add(check);
        }
        return checks;
    }

    /** Runs only the idle policy, for every account. */
    public List<IdleOutcome> idleCheck() {
        List<IdleOutcome> outcomes = new ArrayList<>();
        for (FleetAccount account : accountConfig.getAccounts()) {
            try {
                outcomes.add(idleTermination.enforce(account));
            } catch (RuntimeException e) {
                log.error("Idle check failed for account '{}': {}", account.getName(), e.getMessage(), e);
            }
        }
        return outcomes;
    }

    /** Runs only the budget policy: every account, then every budgeted key. */
    public List<BudgetOutcome> budgetCheck() {
        List<BudgetOutcome> outcomes = new ArrayList<>();
        for (FleetAccount account : accountConfig.getAccounts()) {
            try {
                outcomes.add(budgetEnforcer.enforceAccount(account));
            } catch (RuntimeException e) {
                log.error("Budget check failed for account '{}': {}", account.getName(), e.getMessage(), e);
            }
        }
        outcomes.addAll(budgetEnforcer.enforceKeys());
        return outcomes;
    }
}
