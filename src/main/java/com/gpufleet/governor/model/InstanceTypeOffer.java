package com.gpufleet.governor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InstanceTypeOffer {
    private String name;
    private String description;
    private int priceCentsPerHour;
    private int gpus;
    @Builder.Default
    private List<String> regionsWithCapacity = new ArrayList<>();
}
