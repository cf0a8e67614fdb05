package com.gpufleet.governor.service;

import com.gpufleet.governor.model.CommandResult;
import com.gpufleet.governor.model.Machine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

/**
 * Runs the operator's init script once on each newly seen machine. Best-effort: a machine that
 * fails stays uninitialized and is retried on the next pass.
 */
@Service
public class MachineInitializerService {

    private static final Logger log = LoggerFactory.getLogger(MachineInitializerService.class);

    static final String REMOTE_SCRIPT = "/tmp/init_machine.sh";
    static final Duration COPY_TIMEOUT = Duration.ofSeconds(60);
    static final Duration RUN_TIMEOUT = Duration.ofSeconds(300);

    @Value("${fleet.init.script-path:}")
    private String scriptPath = "";

    private final RemoteShellService remoteShell;
    private final StateStoreService stateStore;

    public MachineInitializerService(RemoteShellService remoteShell, StateStoreService stateStore) {
        this.remoteShell = remoteShell;
        this.stateStore = stateStore;
    }

    public void setScriptPath(String scriptPath) {
        this.scriptPath = scriptPath;
    }

    /** No script configured counts as success. */
    public boolean initialize(Machine machine, String keyPath) {
        if (scriptPath == null || scriptPath.isBlank()) {
            return true;
        }
        CommandResult copy = remoteShell.copyFile(scriptPath, machine.getIp(), REMOTE_SCRIPT, keyPath, COPY_TIMEOUT);
        if (!copy.isSuccess()) {
            log.warn("Failed to copy init script to {}: {}", machine.label(), copy.getError());
            return false;
        }
        CommandResult run = remoteShell.runCommand(machine.getIp(),
            "chmod +x " + REMOTE_SCRIPT + " && " + REMOTE_SCRIPT, keyPath, RUN_TIMEOUT);
        if (!run.isSuccess()) {
            log.warn("Init script failed on {} (exit {}): {}", machine.label(), run.getExitCode(), run.getError());
            return false;
        }
        return true;
    }

    /**
     * @return number of machines initialized
     */
    public int initializePending(List<Machine> machines) {
        int initialized = 0;
        for (Machine machine : machines) {
            if (machine.isInitialized() || !machine.isActive()) continue;
            if (!machine.hasAddress()) {
                log.debug("Machine {} has no address yet, initializing later", machine.label());
                continue;
            }
            if (initialize(machine, remoteShell.resolveKeyFor(machine).orElse(null))) {
                stateStore.markInitialized(machine.getId());
                machine.setInitialized(true);
                initialized++;
                log.info("Initialized machine {}", machine.label());
            }
        }
        return initialized;
    }
}
