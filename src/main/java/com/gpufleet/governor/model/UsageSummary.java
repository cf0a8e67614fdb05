package com.gpufleet.governor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Advisory usage for one identity over a window, derived from observed time points.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UsageSummary {
    private String identity;
    private long centMinutes;
    private long minutes;
    @Builder.Default
    private List<String> machines = new ArrayList<>();

    public long getCostCents() {
        return centMinutes / 60;
    }

    public double getHours() {
        return minutes / 60.0;
    }
}
