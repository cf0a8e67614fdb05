package com.gpufleet.governor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Effective budget for one attribution identity, with "default" already resolved.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BudgetPolicy {

    public static final String DEFAULT_LIMIT = "default";

    private LedgerScope scope;
    private String identity;
    private long limitCents;
    private boolean defaultLimit;
    private long milestoneInterval;
    private String alertWebhook;

    public boolean hasAlertWebhook() {
        return alertWebhook != null && !alertWebhook.isBlank();
    }
}
