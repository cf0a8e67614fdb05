package com.gpufleet.governor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UsagePeriods {
    private long lastHourCents;
    private long last24HoursCents;
    private long last7DaysCents;
    private long totalCents;
}
