package com.gpufleet.governor.model;

import lombok.Data;

@Data
public class BudgetUpdateRequest {
    // "default", an integer number of cents, or null to leave unchanged
    private String limitCents;
    // "none" clears the webhook, null leaves it unchanged
    private String alertWebhook;
}
