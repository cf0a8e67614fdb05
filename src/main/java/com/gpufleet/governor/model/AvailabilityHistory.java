package com.gpufleet.governor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/**
 * How often each instance type had capacity per region over a window. {@code checks} counts the
 * distinct recording slots seen in the window.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AvailabilityHistory {
    private Instant since;
    private int checks;
    @Builder.Default
    private Map<String, Map<String, AvailabilityStat>> byType = new TreeMap<>();
}
