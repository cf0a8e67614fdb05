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
public class DiskSample {
    private String machineId;
    private long totalBytes;
    private long usedBytes;
    private Instant sampledAt;

    public double getUsedPercent() {
        return totalBytes <= 0 ? 0.0 : (usedBytes * 100.0) / totalBytes;
    }
}
