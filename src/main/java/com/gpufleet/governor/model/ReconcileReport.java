package com.gpufleet.governor.model;

import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
public class ReconcileReport {
    private Instant startedAt;
    private Instant finishedAt;
    private List<String> accountsProcessed = new ArrayList<>();
    private Map<String, String> failedAccounts = new LinkedHashMap<>();
    private int machinesSeen;
    private int machinesCharged;
    private int machinesInitialized;
    private int gpuSamples;
    private int diskSamples;
    private List<IdleOutcome> idleOutcomes = new ArrayList<>();
    private List<BudgetOutcome> budgetOutcomes = new ArrayList<>();
    private int samplesPruned;
    private int availabilityRecorded;
}
