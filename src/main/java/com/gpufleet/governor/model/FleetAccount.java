package com.gpufleet.governor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * A billing account with its credential.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FleetAccount {
    private String name;
    @ToString.Exclude
    private String apiKey;
}
