package com.gpufleet.governor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * One rented instance as last observed from the provider.
 * <p>
 * {@code firstSeen}, {@code initialized} and {@code allowlisted} belong to this system and survive
 * provider refreshes; every other field mirrors the latest provider observation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Machine {

    public static final String STATUS_ACTIVE = "active";
    public static final String STATUS_TERMINATED = "terminated";

    private String id;
    private String name;
    private String hostname;
    private String ip;
    private String privateIp;
    private String status;
    private String region;
    private String instanceType;
    private int gpuCount;
    private int hourlyCostCents;
    @Builder.Default
    private List<String> sshKeyNames = new ArrayList<>();
    private String account;
    private Instant firstSeen;
    private Instant lastSeen;
    private boolean initialized;
    private boolean allowlisted;

    public boolean isActive() {
        return STATUS_ACTIVE.equals(status);
    }

    public boolean hasAddress() {
        return ip != null && !ip.isBlank();
    }

    /** The ownership key that running cost is attributed to. */
    public Optional<String> primaryKey() {
        if (sshKeyNames == null || sshKeyNames.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(sshKeyNames.get(0));
    }

    public String label() {
        if (hostname != null && !hostname.isBlank()) return hostname;
        if (name != null && !name.isBlank()) return name;
        return id == null ? "?" : id.substring(0, Math.min(8, id.length()));
    }

    public boolean nameContainsAny(Collection<String> markers) {
        if (name == null || markers == null) {
            return false;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        return markers.stream()
            .filter(marker -> marker != null && !marker.isBlank())
            .anyMatch(marker -> lower.contains(marker.toLowerCase(Locale.ROOT)));
    }

    /**
     * Explicit allowlist flag first; the name markers are the older convention and still honoured.
     */
    public boolean isReclaimExempt(Collection<String> nameMarkers) {
        return allowlisted || nameContainsAny(nameMarkers);
    }
}
