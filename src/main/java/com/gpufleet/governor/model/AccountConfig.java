package com.gpufleet.governor.model;

import lombok.Data;

@Data
public class AccountConfig {
    private String apiKey;

    // "default" or an integer number of cents
    private String limitCents = BudgetPolicy.DEFAULT_LIMIT;
    private String alertWebhook;
}
