package com.gpufleet.governor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UsageReport {
    private Instant generatedAt;
    @Builder.Default
    private Map<String, UsagePeriods> byKey = new TreeMap<>();
    @Builder.Default
    private Map<String, UsagePeriods> byAccount = new TreeMap<>();
}
