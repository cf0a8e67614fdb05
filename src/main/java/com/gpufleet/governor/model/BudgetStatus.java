package com.gpufleet.governor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BudgetStatus {
    private LedgerScope scope;
    private String identity;
    private long limitCents;
    private boolean defaultLimit;
    private long spentCents;
    private long remainingCents;
    private long lastNotifiedCents;
    private boolean alertWebhookConfigured;
    private boolean overBudget;
    private String error;
}
