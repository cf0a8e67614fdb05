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
public class NotificationState {
    private LedgerScope scope;
    private String identity;
    private long lastNotifiedCents;
    private Instant updatedAt;
}
