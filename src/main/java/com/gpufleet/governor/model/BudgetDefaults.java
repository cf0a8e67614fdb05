package com.gpufleet.governor.model;

import lombok.Data;

@Data
public class BudgetDefaults {
    private long limitCents = 500_000;
    private long milestoneInterval = 100_000;
}
