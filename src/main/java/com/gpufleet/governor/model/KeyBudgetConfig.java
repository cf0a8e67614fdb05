package com.gpufleet.governor.model;

import lombok.Data;

@Data
public class KeyBudgetConfig {
    private String limitCents = BudgetPolicy.DEFAULT_LIMIT;
    private String alertWebhook;
}
