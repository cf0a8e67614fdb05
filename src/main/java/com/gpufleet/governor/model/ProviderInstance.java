package com.gpufleet.governor.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Instance as returned by the provider's {@code /instances} endpoint. Every nested block is
 * optional on the wire and defaulted here.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ProviderInstance {
    private String id;
    private String name;
    private String ip;
    private String privateIp;
    private String status;
    private String hostname;
    @Builder.Default
    private Region region = new Region();
    @Builder.Default
    private InstanceType instanceType = new InstanceType();
    @Builder.Default
    private List<String> sshKeyNames = new ArrayList<>();

    public Machine toMachine(String account) {
        InstanceType type = instanceType == null ? new InstanceType() : instanceType;
        InstanceSpecs specs = type.getSpecs() == null ? new InstanceSpecs() : type.getSpecs();
        return Machine.builder()
            .id(id)
            .name(name)
            .hostname(hostname)
            .ip(ip)
            .privateIp(privateIp)
            .status(status)
            .region(region == null ? null : region.getName())
            .instanceType(type.getName())
            .gpuCount(specs.getGpus())
            .hourlyCostCents(type.getPriceCentsPerHour())
            .sshKeyNames(sshKeyNames == null ? new ArrayList<>() : new ArrayList<>(sshKeyNames))
            .account(account)
            .build();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Region {
        private String name;
        private String description;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class InstanceType {
        private String name;
        private String description;
        private int priceCentsPerHour;
        @Builder.Default
        private InstanceSpecs specs = new InstanceSpecs();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class InstanceSpecs {
        private int gpus;
        private int vcpus;
        private int memoryGib;
        private int storageGib;
    }
}
