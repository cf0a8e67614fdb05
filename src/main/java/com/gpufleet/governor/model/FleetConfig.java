package com.gpufleet.governor.model;

import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root of {@code accounts.yaml}.
 */
@Data
public class FleetConfig {
    private BudgetDefaults defaults = new BudgetDefaults();
    private Map<String, AccountConfig> accounts = new LinkedHashMap<>();

    // Budgets for ownership keys are opt-in
    private Map<String, KeyBudgetConfig> keys = new LinkedHashMap<>();
}
