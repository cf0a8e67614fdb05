package com.gpufleet.governor.controller;

import com.gpufleet.governor.model.AccountCheck;
import com.gpufleet.governor.model.AvailabilityHistory;
import com.gpufleet.governor.model.BudgetOutcome;
import com.gpufleet.governor.model.BudgetPolicy;
import com.gpufleet.governor.model.BudgetStatus;
import com.gpufleet.governor.model.BudgetUpdateRequest;
import com.gpufleet.governor.model.FleetAccount;
import com.gpufleet.governor.model.IdleOutcome;
import com.gpufleet.governor.model.LedgerScope;
import com.gpufleet.governor.model.Machine;
import com.gpufleet.governor.model.MachineStatus;
import com.gpufleet.governor.model.ReconcileReport;
import com.gpufleet.governor.model.UsageReport;
import com.gpufleet.governor.service.AccountConfigService;
import com.gpufleet.governor.service.AvailabilityService;
import com.gpufleet.governor.service.BudgetEnforcerService;
import com.gpufleet.governor.service.CostLedgerService;
import com.gpufleet.governor.service.IdleEvaluatorService;
import com.gpufleet.governor.service.ReconciliationService;
import com.gpufleet.governor.service.StateStoreService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping("/fleet")
public class FleetController {

    @Autowired
    private ReconciliationService reconciliation;

    @Autowired
    private StateStoreService stateStore;

    @Autowired
    private IdleEvaluatorService idleEvaluator;

    @Autowired
    private CostLedgerService costLedger;

    @Autowired
    private BudgetEnforcerService budgetEnforcer;

    @Autowired
    private AccountConfigService accountConfig;

    @Autowired
    private AvailabilityService availability;

    @PostMapping("/reconcile")
    public ResponseEntity<ReconcileReport> reconcile() {
        return ResponseEntity.ok(reconciliation.reconcile());
    }

    @PostMapping("/idle-check")
    public ResponseEntity<List<IdleOutcome>> idleCheck() {
        return ResponseEntity.ok(reconciliation.idleCheck());
    }

    @PostMapping("/budget-check")
    public ResponseEntity<List<BudgetOutcome>> budgetCheck() {
        return ResponseEntity.ok(reconciliation.budgetCheck());
    }

    @GetMapping("/machines")
    public ResponseEntity<List<MachineStatus>> machines() {
        List<MachineStatus> statuses = new ArrayList<>();
        for (Machine machine : stateStore.listActiveMachines()) {
            statuses.add(MachineStatus.builder()
                .machine(machine)
                .idle(idleEvaluator.evaluate(machine))
                .disk(stateStore.latestDiskSample(machine.getId()).orElse(null))
                .keyCostCents(machine.primaryKey().map(k -> costLedger.totalCents(LedgerScope.KEY, k)).orElse(0L))
                .build());
        }
        return ResponseEntity.ok(statuses);
    }

    @GetMapping("/usage")
    public ResponseEntity<UsageReport> usage() {
        return ResponseEntity.ok(costLedger.usageReport());
    }

    @GetMapping("/budgets")
    public ResponseEntity<List<BudgetStatus>> budgets() {
        return ResponseEntity.ok(budgetEnforcer.budgetStatus());
    }

    @PutMapping("/budgets/{scope}/{name}")
    public ResponseEntity<?> updateBudget(@PathVariable String scope, @PathVariable String name,
                                          @RequestBody BudgetUpdateRequest request) {
        try {
            BudgetPolicy policy = accountConfig.updateBudget(parseScope(scope), name,
                request.getLimitCents(), request.getAlertWebhook());
            return ResponseEntity.ok(policy);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @PutMapping("/machines/{id}/allowlist")
    public ResponseEntity<?> allowlist(@PathVariable String id,
                                       @RequestParam(defaultValue = "true") boolean allowlisted) {
        if (!stateStore.setAllowlisted(id, allowlisted)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of("id", id, "allowlisted", allowlisted));
    }

    @GetMapping("/availability")
    public ResponseEntity<AvailabilityHistory> availabilityHistory(@RequestParam(defaultValue = "24") long hours) {
        return ResponseEntity.ok(availability.history(Duration.ofHours(hours)));
    }

    @GetMapping("/availability/current")
    public ResponseEntity<?> currentAvailability() {
        List<FleetAccount> accounts = accountConfig.getAccounts();
        if (accounts.isEmpty()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", "No accounts configured"));
        }
        return ResponseEntity.ok(availability.current(accounts.get(0)));
    }

    @GetMapping("/accounts")
    public ResponseEntity<List<AccountCheck>> accounts() {
        return ResponseEntity.ok(reconciliation.checkAccounts());
    }

    @GetMapping("/health")
    public ResponseEntity<?> health() {
        return ResponseEntity.ok(Map.of(
            "status", "healthy",
            "accounts", accountConfig.getAccounts().size()
        ));
    }

    private static LedgerScope parseScope(String scope) {
        return switch (scope.toLowerCase(Locale.ROOT)) {
            case "key", "keys" -> LedgerScope.KEY;
            case "account", "accounts" -> LedgerScope.ACCOUNT;
            default -> throw new IllegalArgumentException("Unknown budget scope: " + scope);
        };
    }
}
