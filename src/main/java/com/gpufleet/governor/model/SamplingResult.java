package com.gpufleet.governor.model;

import lombok.Data;

@Data
public class SamplingResult {
    private int machinesSampled;
    private int gpuSamples;
    private int diskSamples;
    private int failures;
}
