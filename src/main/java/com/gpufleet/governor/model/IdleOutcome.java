package com.gpufleet.governor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IdleOutcome {
    private String account;
    private int evaluated;
    private int terminated;
    private int skippedAllowlisted;
    private int skippedInsufficientData;
    private int failed;
}
