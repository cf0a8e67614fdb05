package com.gpufleet.governor.controller;

import com.gpufleet.governor.model.AccountCheck;
import com.gpufleet.governor.model.AvailabilityHistory;
import com.gpufleet.governor.model.AvailabilityStat;
import com.gpufleet.governor.model.BudgetPolicy;
import com.gpufleet.governor.model.BudgetStatus;
import com.gpufleet.governor.model.IdleDecision;
import com.gpufleet.governor.model.IdleStatus;
import com.gpufleet.governor.model.LedgerScope;
import com.gpufleet.governor.model.Machine;
import com.gpufleet.governor.model.ReconcileReport;
import com.gpufleet.governor.service.AccountConfigService;
import com.gpufleet.governor.service.AvailabilityService;
import com.gpufleet.governor.service.BudgetEnforcerService;
import com.gpufleet.governor.service.CostLedgerService;
import com.gpufleet.governor.service.IdleEvaluatorService;
import com.gpufleet.governor.service.ReconciliationService;
import com.gpufleet.governor.service.StateStoreService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(FleetController.class)
class FleetControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ReconciliationService reconciliation;

    @MockBean
    private StateStoreService stateStore;

    @MockBean
    private IdleEvaluatorService idleEvaluator;

    @MockBean
    private CostLedgerService costLedger;

    @MockBean
    private BudgetEnforcerService budgetEnforcer;

    @MockBean
    private AccountConfigService accountConfig;

    @MockBean
    private AvailabilityService availability;

    @Test
    void shouldReturnAvailabilityHistoryForRequestedWindow() throws Exception {
        AvailabilityHistory history = AvailabilityHistory.builder().checks(6).build();
        history.getByType().put("gpu_1x_a10", Map.of("us-east-1",
            AvailabilityStat.builder().count(3).checks(6).percent(50.0).build()));
        when(availability.history(Duration.ofHours(6))).thenReturn(history);

        mockMvc.perform(get("/fleet/availability").param("hours", "6"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.checks").value(6))
            .andExpect(jsonPath("$.byType.gpu_1x_a10.us-east-1.percent").value(50.0));
    }

    @Test
    void shouldRejectCurrentAvailabilityWithoutAccounts() throws Exception {
        when(accountConfig.getAccounts()).thenReturn(List.of());

        mockMvc.perform(get("/fleet/availability/current"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.error").value("No accounts configured"));
        verifyNoInteractions(availability);
    }

    @Test
    void shouldReportAccountChecks() throws Exception {
        when(reconciliation.checkAccounts()).thenReturn(List.of(
            AccountCheck.builder().account("lab").reachable(true).instances(2).sshKeys(List.of("alice")).build()));

        mockMvc.perform(get("/fleet/accounts"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].account").value("lab"))
            .andExpect(jsonPath("$[0].sshKeys[0]").value("alice"));
    }

    @Test
    void shouldRunReconciliation() throws Exception {
        ReconcileReport report = new ReconcileReport();
        report.getAccountsProcessed().add("lab");
        report.setMachinesSeen(3);
        when(reconciliation.reconcile()).thenReturn(report);

        mockMvc.perform(post("/fleet/reconcile"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.accountsProcessed[0]").value("lab"))
            .andExpect(jsonPath("$.machinesSeen").value(3));
    }

    @Test
    void shouldListMachinesWithIdleStatusAndKeyCost() throws Exception {
        Machine machine = Machine.builder()
            .id("i-1").name("train-1").status(Machine.STATUS_ACTIVE).sshKeyNames(List.of("alice")).build();
        when(stateStore.listActiveMachines()).thenReturn(List.of(machine));
        when(stateStore.latestDiskSample("i-1")).thenReturn(Optional.empty());
        when(idleEvaluator.evaluate(machine)).thenReturn(IdleStatus.builder().decision(IdleDecision.ACTIVE).build());
        when(costLedger.totalCents(LedgerScope.KEY, "alice")).thenReturn(1234L);

        mockMvc.perform(get("/fleet/machines"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].machine.id").value("i-1"))
            .andExpect(jsonPath("$[0].idle.decision").value("ACTIVE"))
            .andExpect(jsonPath("$[0].keyCostCents").value(1234));
    }

    @Test
    void shouldListBudgets() throws Exception {
        when(budgetEnforcer.budgetStatus()).thenReturn(List.of(BudgetStatus.builder()
            .scope(LedgerScope.KEY).identity("alice").limitCents(10000).spentCents(11500).overBudget(true).build()));

        mockMvc.perform(get("/fleet/budgets"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].identity").value("alice"))
            .andExpect(jsonPath("$[0].overBudget").value(true));
    }

    @Test
    void shouldUpdateBudget() throws Exception {
        when(accountConfig.updateBudget(LedgerScope.KEY, "alice", "20000", "none")).thenReturn(BudgetPolicy.builder()
            .scope(LedgerScope.KEY).identity("alice").limitCents(20000).milestoneInterval(100000).build());

        mockMvc.perform(put("/fleet/budgets/key/alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"limitCents\": \"20000\", \"alertWebhook\": \"none\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.limitCents").value(20000));
    }

    @Test
    void shouldRejectUnknownBudgetScope() throws Exception {
        mockMvc.perform(put("/fleet/budgets/team/alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"limitCents\": \"100\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Unknown budget scope: team"));
        verifyNoInteractions(accountConfig);
    }

    @Test
    void shouldRejectMalformedLimit() throws Exception {
        when(accountConfig.updateBudget(eq(LedgerScope.ACCOUNT), eq("lab"), eq("lots"), isNull()))
            .thenThrow(new IllegalArgumentException("Malformed limit_cents for ACCOUNT 'lab': lots"));

        mockMvc.perform(put("/fleet/budgets/account/lab")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"limitCents\": \"lots\"}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void shouldAllowlistMachine() throws Exception {
        when(stateStore.setAllowlisted("i-1", true)).thenReturn(true);

        mockMvc.perform(put("/fleet/machines/i-1/allowlist"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.allowlisted").value(true));
    }

    @Test
    void shouldReturnNotFoundForUnknownMachine() throws Exception {
        when(stateStore.setAllowlisted("ghost", false)).thenReturn(false);

        mockMvc.perform(put("/fleet/machines/ghost/allowlist").param("allowlisted", "false"))
            .andExpect(status().isNotFound());
    }

    @Test
    void shouldReportHealth() throws Exception {
        when(accountConfig.getAccounts()).thenReturn(List.of());

        mockMvc.perform(get("/fleet/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("healthy"));
    }
}
