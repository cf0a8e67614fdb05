package com.gpufleet.governor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One observation of capacity for an instance type in a region.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AvailabilityRecord {
    private String instanceType;
    private String region;
    private Instant recordedAt;
}
