package com.gpufleet.governor.service;

import com.gpufleet.governor.model.FleetAccount;
import com.gpufleet.governor.model.IdleDecision;
import com.gpufleet.governor.model.IdleOutcome;
import com.gpufleet.governor.model.IdleStatus;
import com.gpufleet.governor.model.Machine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.client.ResourceAccessException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IdleTerminationServiceTest {

    private static final FleetAccount ACCOUNT = FleetAccount.builder().name("acct").apiKey("secret").build();

    @Mock
    private IdleEvaluatorService evaluator;

    @Mock
    private StateStoreService stateStore;

    @Mock
    private LambdaCloudService cloud;

    private IdleTerminationService idleTermination;

    @BeforeEach
    void setUp() {
        idleTermination = new IdleTerminationService(evaluator, stateStore, cloud);
    }

    private static Machine machine(String id) {
        return Machine.builder().id(id).name("train-" + id).status(Machine.STATUS_ACTIVE).account("acct").build();
    }

    private static IdleStatus status(IdleDecision decision) {
        return IdleStatus.builder().decision(decision).terminateEligible(decision == IdleDecision.TERMINATE).build();
    }

    @Test
    void shouldTerminateEligibleMachinesOnly() {
        Machine idle = machine("m1");
        Machine busy = machine("m2");
        Machine protectedMachine = machine("m3");
        Machine unknown = machine("m4");
        when(stateStore.listActiveMachines("acct")).thenReturn(List.of(idle, busy, protectedMachine, unknown));
        when(evaluator.evaluate(idle)).thenReturn(status(IdleDecision.TERMINATE));
        when(evaluator.evaluate(busy)).thenReturn(status(IdleDecision.ACTIVE));
        when(evaluator.evaluate(protectedMachine)).thenReturn(status(IdleDecision.ALLOWLISTED));
        when(evaluator.evaluate(unknown)).thenReturn(status(IdleDecision.INSUFFICIENT_DATA));
        when(cloud.terminateInstances("secret", List.of("m1"))).thenReturn(List.of("m1"));

        IdleOutcome outcome = idleTermination.enforce(ACCOUNT);

        assertEquals(4, outcome.getEvaluated());
        assertEquals(1, outcome.getTerminated());
        assertEquals(1, outcome.getSkippedAllowlisted());
        assertEquals(1, outcome.getSkippedInsufficientData());
        verify(stateStore).updateStatus("m1", Machine.STATUS_TERMINATED);
        verify(cloud, times(1)).terminateInstances(anyString(), anyList());
    }

    @Test
    void shouldCountFailedTerminationAndContinue() {
        Machine first = machine("m1");
        Machine second = machine("m2");
        when(stateStore.listActiveMachines("acct")).thenReturn(List.of(first, second));
        when(evaluator.evaluate(any(Machine.class))).thenReturn(status(IdleDecision.TERMINATE));
        when(cloud.terminateInstances("secret", List.of("m1"))).thenThrow(new ResourceAccessException("timeout"));
        when(cloud.terminateInstances("secret", List.of("m2"))).thenReturn(List.of("m2"));

        IdleOutcome outcome = idleTermination.enforce(ACCOUNT);

        assertEquals(1, outcome.getFailed());
        assertEquals(1, outcome.getTerminated());
        verify(stateStore, never()).updateStatus("m1", Machine.STATUS_TERMINATED);
    }

    @Test
    void shouldNotCallProviderInDryRun() {
        idleTermination.setDryRun(true);
        Machine idle = machine("m1");
        when(stateStore.listActiveMachines("acct")).thenReturn(List.of(idle));
        when(evaluator.evaluate(idle)).thenReturn(status(IdleDecision.TERMINATE));

        IdleOutcome outcome = idleTermination.enforce(ACCOUNT);

        assertEquals(0, outcome.getTerminated());
        assertEquals(0, outcome.getFailed());
        verifyNoInteractions(cloud);
    }
}
