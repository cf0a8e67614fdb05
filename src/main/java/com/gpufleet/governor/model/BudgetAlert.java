package com.gpufleet.governor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BudgetAlert {
    private AlertKind kind;
    private LedgerScope scope;
    private String identity;
    private long spentCents;
    private long limitCents;
    private long milestoneCents;
    private Instant raisedAt;

    public boolean isOverBudget() {
        return spentCents > limitCents;
    }
}
