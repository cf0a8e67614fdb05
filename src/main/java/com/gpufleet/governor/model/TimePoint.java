package com.gpufleet.governor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Per-accelerator samples taken in the same pass, folded into one reading.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimePoint {
    private Instant timestamp;
    private double averageUtilization;
    private boolean allIdle;
    private int acceleratorCount;
}
