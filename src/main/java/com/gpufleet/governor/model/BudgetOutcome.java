package com.gpufleet.governor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * What one budget pass did for one identity.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BudgetOutcome {
    private LedgerScope scope;
    private String identity;
    private long spentCents;
    private long limitCents;
    private boolean overBudget;
    @Builder.Default
    private List<BudgetAlert> alerts = new ArrayList<>();
    private int alertsDelivered;
    private int terminated;
    private int skippedAllowlisted;
    private int failed;
}
