package com.gpufleet.governor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Running total for one attribution identity.
 * <p>
 * Kept in cent-minutes (hourly price in cents times minutes active) so per-minute accruals of
 * prices that are not a multiple of 60 never lose their fraction.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CostLedgerEntry {
    private LedgerScope scope;
    private String identity;
    private long centMinutes;
    private Instant lastUpdated;

    public long getTotalCents() {
        return centMinutes / 60;
    }
}
