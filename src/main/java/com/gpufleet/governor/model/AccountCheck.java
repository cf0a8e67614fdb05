package com.gpufleet.governor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of checking one account's credential against the provider.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccountCheck {
    private String account;
    private boolean reachable;
    private int instances;
    @Builder.Default
    private List<String> sshKeys = new ArrayList<>();
    private String error;
}
