package com.gpufleet.governor.service;

import com.gpufleet.governor.model.CommandResult;
import com.gpufleet.governor.model.Machine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MachineInitializerServiceTest {

    @Mock
    private RemoteShellService remoteShell;

    @Mock
    private StateStoreService stateStore;

    private MachineInitializerService initializer;

    @BeforeEach
    void setUp() {
        initializer = new MachineInitializerService(remoteShell, stateStore);
        initializer.setScriptPath("/opt/fleet/init.sh");
    }

    private static Machine machine(String id, String ip) {
        return Machine.builder().id(id).name("train-" + id).ip(ip).status(Machine.STATUS_ACTIVE).build();
    }

    @Test
    void shouldTreatMissingScriptAsSuccess() {
        initializer.setScriptPath("");

        assertTrue(initializer.initialize(machine("m1", "1.2.3.4"), null));
        verifyNoInteractions(remoteShell);
    }

    @Test
    void shouldCopyThenRunScript() {
        when(remoteShell.copyFile("/opt/fleet/init.sh", "1.2.3.4", MachineInitializerService.REMOTE_SCRIPT, "/k",
            MachineInitializerService.COPY_TIMEOUT)).thenReturn(new CommandResult(0, "", ""));
        when(remoteShell.runCommand(eq("1.2.3.4"), contains(MachineInitializerService.REMOTE_SCRIPT), eq("/k"),
            eq(MachineInitializerService.RUN_TIMEOUT))).thenReturn(new CommandResult(0, "done", ""));

        assertTrue(initializer.initialize(machine("m1", "1.2.3.4"), "/k"));
    }

    @Test
    void shouldNotRunScriptWhenCopyFails() {
        when(remoteShell.copyFile(anyString(), anyString(), anyString(), any(), any()))
            .thenReturn(CommandResult.failure("Timed out"));

        assertFalse(initializer.initialize(machine("m1", "1.2.3.4"), null));
        verify(remoteShell, never()).runCommand(anyString(), anyString(), any(), any());
    }

    @Test
    void shouldMarkOnlySuccessfulMachinesInitialized() {
        when(remoteShell.resolveKeyFor(any())).thenReturn(Optional.empty());
        when(remoteShell.copyFile(anyString(), anyString(), anyString(), any(), any()))
            .thenReturn(new CommandResult(0, "", ""));
        when(remoteShell.runCommand(eq("10.0.0.1"), anyString(), any(), any())).thenReturn(new CommandResult(0, "", ""));
        when(remoteShell.runCommand(eq("10.0.0.2"), anyString(), any(), any())).thenReturn(new CommandResult(1, "", "apt failed"));

        int initialized = initializer.initializePending(List.of(
            machine("m1", "10.0.0.1"), machine("m2", "10.0.0.2"), machine("m3", null)));

        assertEquals(1, initialized);
        verify(stateStore).markInitialized("m1");
        verify(stateStore, never()).markInitialized("m2");
        verify(stateStore, never()).markInitialized("m3");
    }
}
