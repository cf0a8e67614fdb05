package com.gpufleet.governor.service;

import com.gpufleet.governor.model.FleetAccount;
import com.gpufleet.governor.model.IdleDecision;
import com.gpufleet.governor.model.IdleOutcome;
import com.gpufleet.governor.model.IdleStatus;
import com.gpufleet.governor.model.Machine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;

import java.util.List;

/**
 * Reclaims machines of one account that the evaluator marks terminate-eligible.
 */
@Service
public class IdleTerminationService {

    private static final Logger log = LoggerFactory.getLogger(IdleTerminationService.class);

    @Value("${fleet.dry-run:false}")
    private boolean dryRun;

    private final IdleEvaluatorService evaluator;
    private final StateStoreService stateStore;
    private final LambdaCloudService cloud;

    public IdleTerminationService(IdleEvaluatorService evaluator, StateStoreService stateStore, LambdaCloudService cloud) {
        this.evaluator = evaluator;
        this.stateStore = stateStore;
        this.cloud = cloud;
    }

    public void setDryRun(boolean dryRun) {
        this.dryRun = dryRun;
    }

    public IdleOutcome enforce(FleetAccount account) {
        IdleOutcome outcome = IdleOutcome.builder().account(account.getName()).build();
        for (Machine machine : stateStore.listActiveMachines(account.getName())) {
            IdleStatus status = evaluator.evaluate(machine);
            outcome.setEvaluated(outcome.getEvaluated() + 1);
            IdleDecision decision = status.getDecision();

            switch (decision) {
                case TERMINATE:
                    if (terminate(account, machine, status)) {
                        outcome.setTerminated(outcome.getTerminated() + 1);
                    } else if (!dryRun) {
                        outcome.setFailed(outcome.getFailed() + 1);
                    }
                    break;
                case ALLOWLISTED:
                    outcome.setSkippedAllowlisted(outcome.getSkippedAllowlisted() + 1);
                    log.info("Machine {} ({}) idle {} but allowlisted, skipping", machine.label(), machine.getId(),
                        status.getIdleDuration());
                    break;
                case INSUFFICIENT_DATA:
                    outcome.setSkippedInsufficientData(outcome.getSkippedInsufficientData() + 1);
                    log.info("Machine {} ({}) has {}/{} time points in the idle window, not deciding",
                        machine.label(), machine.getId(), status.getTimePointsInWindow(), status.getRequiredTimePoints());
                    break;
                case MIN_RUNTIME_NOT_MET:
                    log.info("Machine {} ({}) idle but runtime {} is below the minimum, skipping",
                        machine.label(), machine.getId(), status.getRuntime());
                    break;
                case IDLE_WARNING:
                    log.warn("Machine {} ({}) idle for {}, termination in {}", machine.label(), machine.getId(),
                        status.getIdleDuration(), status.getTimeUntilTermination());
                    break;
                default:
                    log.debug("Machine {} ({}): {}", machine.label(), machine.getId(), decision);
            }
        }
        log.info("Idle check for account {}: {} evaluated, {} terminated, {} allowlisted, {} without enough data, {} failed",
            account.getName(), outcome.getEvaluated(), outcome.getTerminated(), outcome.getSkippedAllowlisted(),
            outcome.getSkippedInsufficientData(), outcome.getFailed());
        return outcome;
    }

    private boolean terminate(FleetAccount account, Machine machine, IdleStatus status) {
        if (dryRun) {
            log.info("[dry-run] Would terminate idle machine {} ({}), idle for {}", machine.label(), machine.getId(),
                status.getIdleDuration());
            return false;
        }
        log.info("Terminating idle machine {} ({}), idle for {}, runtime {}", machine.label(), machine.getId(),
            status.getIdleDuration(), status.getRuntime());
        try {
            List<String> terminated = cloud.terminateInstances(account.getApiKey(), List.of(machine.getId()));
            if (terminated.contains(machine.getId())) {
                stateStore.updateStatus(machine.getId(), Machine.STATUS_TERMINATED);
                return true;
            }
            log.warn("Provider did not confirm termination of {} ({})", machine.label(), machine.getId());
        } catch (RestClientException e) {
            log.warn("Failed to terminate idle machine {} ({}): {}", machine.label(), machine.getId(), e.getMessage());
        }
        return false;
    }
}
