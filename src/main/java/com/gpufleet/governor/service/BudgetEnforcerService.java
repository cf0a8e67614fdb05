package com.gpufleet.governor.service;

import com.gpufleet.governor.model.AlertKind;
import com.gpufleet.governor.model.BudgetAlert;
import com.gpufleet.governor.model.BudgetOutcome;
import com.gpufleet.governor.model.BudgetPolicy;
import com.gpufleet.governor.model.BudgetStatus;
import com.gpufleet.governor.model.FleetAccount;
import com.gpufleet.governor.model.LedgerScope;
import com.gpufleet.governor.model.Machine;
import com.gpufleet.governor.model.NotificationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

/**
 * Compares running totals against budget limits, raises deduplicated milestone and over-budget
 * alerts, and reclaims the machines of identities that are over budget.
 * <p>
 * Alert decisions read {@code last_notified} under a row lock and write it back in the same
 * transaction. Passes in this process are also serialized per identity, so overlapping
 * reconcile and budget-check requests never announce the same bucket twice. Delivery happens
 * after the commit and never affects the stored state.
 */
@Service
public class BudgetEnforcerService {

    private static final Logger log = LoggerFactory.getLogger(BudgetEnforcerService.class);

    private static final double LOW_REMAINING_RATIO = 0.2;

    @Value("${fleet.budget.allowlist-markers:overbudget,allowlist,whitelist}")
    private List<String> allowlistMarkers = List.of("overbudget", "allowlist", "whitelist");

    @Value("${fleet.dry-run:false}")
    private boolean dryRun;

    private final StateStoreService stateStore;
    private final AccountConfigService accountConfig;
    private final LambdaCloudService cloud;
    private final AlertService alerts;
    private final Clock clock;
    private final ConcurrentMap<String, Object> identityLocks = new ConcurrentHashMap<>();

    public BudgetEnforcerService(StateStoreService stateStore, AccountConfigService accountConfig,
                                 LambdaCloudService cloud, AlertService alerts, Clock clock) {
        this.stateStore = stateStore;
        this.accountConfig = accountConfig;
        this.cloud = cloud;
        this.alerts = alerts;
        this.clock = clock;
    }

    public void setAllowlistMarkers(List<String> allowlistMarkers) {
        this.allowlistMarkers = allowlistMarkers;
    }

    public void setDryRun(boolean dryRun) {
        this.dryRun = dryRun;
    }

    public BudgetOutcome enforceAccount(FleetAccount account) {
        BudgetPolicy policy = accountConfig.resolveBudget(LedgerScope.ACCOUNT, account.getName());
        return enforce(policy, stateStore.listActiveMachines(account.getName()));
    }

    /**
     * Runs the budget policy for every key listed in the configuration. A key whose budget cannot
     * be resolved is logged and skipped.
     */
    public List<BudgetOutcome> enforceKeys() {
        List<BudgetOutcome> outcomes = new ArrayList<>();
        List<String> keys = accountConfig.getBudgetedKeys();
        if (keys.isEmpty()) {
            return outcomes;
        }
        List<Machine> active = stateStore.listActiveMachines();
        for (String key : keys) {
            try {
                BudgetPolicy policy = accountConfig.resolveBudget(LedgerScope.KEY, key);
                List<Machine> attributed = active.stream()
                    .filter(m -> m.primaryKey().map(key::equals).orElse(false))
                    .collect(Collectors.toList());
                outcomes.add(enforce(policy, attributed));
            } catch (IllegalArgumentException e) {
                log.error("Skipping budget for key '{}': {}", key, e.getMessage());
            }
        }
        return outcomes;
    }

    public BudgetOutcome enforce(BudgetPolicy policy, List<Machine> attributed) {
        LedgerScope scope = policy.getScope();
        String identity = policy.getIdentity();
        long limit = policy.getLimitCents();

        BudgetOutcome outcome = BudgetOutcome.builder()
            .scope(scope)
            .identity(identity)
            .limitCents(limit)
            .build();

        List<BudgetAlert> raised;
        synchronized (identityLocks.computeIfAbsent(scope.name() + ":" + identity, k -> new Object())) {
            raised = stateStore.inTransaction(() -> {
                long lastNotified = stateStore.lockNotificationState(scope, identity);
                long spent = stateStore.totalCents(scope, identity);
                outcome.setSpentCents(spent);
                List<BudgetAlert> pending = decideAlerts(policy, spent, lastNotified);
                if (!pending.isEmpty()) {
                    stateStore.saveNotificationState(scope, identity, spent);
                }
                return pending;
            });
        }
        outcome.setAlerts(raised);

        long spent = outcome.getSpentCents();
        outcome.setOverBudget(spent > limit);

        for (BudgetAlert alert : raised) {
            if (alert.getKind() == AlertKind.BUDGET_EXCEEDED) {
                log.warn("{} '{}' is over budget: spent {} of {}", scope, identity,
                    AlertService.formatMoney(spent), AlertService.formatMoney(limit));
            } else {
                log.info("{} '{}' crossed the {} milestone (spent {}, limit {})", scope, identity,
                    AlertService.formatMoney(alert.getMilestoneCents()), AlertService.formatMoney(spent),
                    AlertService.formatMoney(limit));
            }
            if (!policy.hasAlertWebhook()) {
                log.info("No alert webhook configured for {} '{}', alert only logged", scope, identity);
            } else if (alerts.postAlert(policy.getAlertWebhook(), alert)) {
                outcome.setAlertsDelivered(outcome.getAlertsDelivered() + 1);
            }
        }

        if (outcome.isOverBudget()) {
            reclaim(outcome, attributed);
        } else if (limit > 0 && limit - spent < limit * LOW_REMAINING_RATIO) {
            log.warn("{} '{}' has less than 20% of its budget left: {} remaining of {}", scope, identity,
                AlertService.formatMoney(limit - spent), AlertService.formatMoney(limit));
        }
        return outcome;
    }

    /**
     * The milestone alert fires when the total enters a higher bucket than the last notified
     * level. The over-budget alert fires once, on the pass that first sees the total above the
     * limit while the last notified level was still below it.
     */
    List<BudgetAlert> decideAlerts(BudgetPolicy policy, long spent, long lastNotified) {
        long interval = policy.getMilestoneInterval();
        long currentMilestone = (spent / interval) * interval;
        long lastMilestone = (lastNotified / interval) * interval;
        Instant now = clock.instant();

        List<BudgetAlert> pending = new ArrayList<>();
        if (currentMilestone > lastMilestone && currentMilestone > 0) {
            pending.add(alert(policy, AlertKind.MILESTONE, spent, currentMilestone, now));
        }
        if (spent > policy.getLimitCents() && lastNotified < policy.getLimitCents()) {
            pending.add(alert(policy, AlertKind.BUDGET_EXCEEDED, spent, currentMilestone, now));
        }
        return pending;
    }

    private static BudgetAlert alert(BudgetPolicy policy, AlertKind kind, long spent, long milestone, Instant now) {
        return BudgetAlert.builder()
            .kind(kind)
            .scope(policy.getScope())
            .identity(policy.getIdentity())
            .spentCents(spent)
            .limitCents(policy.getLimitCents())
            .milestoneCents(milestone)
            .raisedAt(now)
            .build();
    }

    private void reclaim(BudgetOutcome outcome, List<Machine> attributed) {
        for (Machine machine : attributed) {
            if (!machine.isActive()) continue;
            if (machine.isReclaimExempt(allowlistMarkers)) {
                outcome.setSkippedAllowlisted(outcome.getSkippedAllowlisted() + 1);
                log.info("{} '{}' over budget, machine {} ({}) is allowlisted, skipping", outcome.getScope(),
                    outcome.getIdentity(), machine.label(), machine.getId());
                continue;
            }
            if (dryRun) {
                log.info("[dry-run] Would terminate {} ({}) for over-budget {} '{}'", machine.label(), machine.getId(),
                    outcome.getScope(), outcome.getIdentity());
                continue;
            }
            Optional<FleetAccount> account = accountConfig.findAccount(machine.getAccount());
            if (account.isEmpty()) {
                outcome.setFailed(outcome.getFailed() + 1);
                log.error("No credential for account '{}' of machine {} ({}), cannot terminate it",
                    machine.getAccount(), machine.label(), machine.getId());
                continue;
            }
            log.info("Terminating {} ({}) for over-budget {} '{}'", machine.label(), machine.getId(),
                outcome.getScope(), outcome.getIdentity());
            try {
                List<String> terminated = cloud.terminateInstances(account.get().getApiKey(), List.of(machine.getId()));
                if (terminated.contains(machine.getId())) {
                    stateStore.updateStatus(machine.getId(), Machine.STATUS_TERMINATED);
                    outcome.setTerminated(outcome.getTerminated() + 1);
                } else {
                    outcome.setFailed(outcome.getFailed() + 1);
                    log.warn("Provider did not confirm termination of {} ({})", machine.label(), machine.getId());
                }
            } catch (RestClientException e) {
                outcome.setFailed(outcome.getFailed() + 1);
                log.warn("Failed to terminate {} ({}): {}", machine.label(), machine.getId(), e.getMessage());
            }
        }
    }

    /** Current budget position of every configured account and key, for reporting. */
    public List<BudgetStatus> budgetStatus() {
        List<BudgetStatus> statuses = new ArrayList<>();
        for (String account : accountConfig.getConfig().getAccounts().keySet()) {
            statuses.add(status(LedgerScope.ACCOUNT, account));
        }
        for (String key : accountConfig.getBudgetedKeys()) {
            statuses.add(status(LedgerScope.KEY, key));
        }
        return statuses;
    }

    private BudgetStatus status(LedgerScope scope, String identity) {
        long spent = stateStore.totalCents(scope, identity);
        long lastNotified = stateStore.findNotificationState(scope, identity)
            .map(NotificationState::getLastNotifiedCents)
            .orElse(0L);
        BudgetStatus.BudgetStatusBuilder status = BudgetStatus.builder()
            .scope(scope)
            .identity(identity)
            .spentCents(spent)
            .lastNotifiedCents(lastNotified);
        try {
            BudgetPolicy policy = accountConfig.resolveBudget(scope, identity);
            status.limitCents(policy.getLimitCents())
                .defaultLimit(policy.isDefaultLimit())
                .remainingCents(policy.getLimitCents() - spent)
                .alertWebhookConfigured(policy.hasAlertWebhook())
                .overBudget(spent > policy.getLimitCents());
        } catch (IllegalArgumentException e) {
            status.error(e.getMessage());
        }
        return status.build();
    }
}
