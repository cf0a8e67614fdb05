package com.gpufleet.governor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MachineStatus {
    private Machine machine;
    private IdleStatus idle;
    private DiskSample disk;
    private long keyCostCents;
}
