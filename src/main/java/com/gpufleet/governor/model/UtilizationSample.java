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
public class UtilizationSample {
    private String machineId;
    private int gpuIndex;
    private int utilization;
    private Instant sampledAt;
}
