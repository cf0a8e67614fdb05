package com.gpufleet.governor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Idle/runtime evaluation of one machine at one instant. Null fields mean "unknown".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IdleStatus {
    private String machineId;
    private String machineLabel;
    private int acceleratorCount;
    private int timePointsLookback;
    private int timePointsInWindow;
    private int requiredTimePoints;
    private Double currentUtilization;
    private Double averageUtilizationLastHour;
    private Duration idleDuration;
    private Duration timeUntilTermination;
    private Duration runtime;
    private boolean active;
    private boolean minRuntimeMet;
    private boolean coverageSufficient;
    private boolean sustainedIdle;
    private boolean allowlisted;
    private boolean terminateEligible;
    private IdleDecision decision;
}
