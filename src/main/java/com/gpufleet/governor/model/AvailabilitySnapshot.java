package com.gpufleet.governor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AvailabilitySnapshot {
    private Instant checkedAt;
    @Builder.Default
    private List<InstanceTypeOffer> available = new ArrayList<>();
    @Builder.Default
    private List<String> unavailable = new ArrayList<>();
}
