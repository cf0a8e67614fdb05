package com.gpufleet.governor.service;

import com.gpufleet.governor.model.CommandResult;
import com.gpufleet.governor.model.DiskSample;
import com.gpufleet.governor.model.Machine;
import com.gpufleet.governor.model.SamplingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads accelerator utilization and root disk usage from machines over the remote channel.
 * A failed or unparseable reading records nothing.
 */
@Service
public class MetricsSamplerService {

    private static final Logger log = LoggerFactory.getLogger(MetricsSamplerService.class);

    static final String GPU_QUERY = "nvidia-smi --query-gpu=utilization.gpu --format=csv,noheader,nounits";
    static final String DISK_QUERY = "df -B1 --output=size,used / | tail -n 1";

    @Value("${fleet.ssh.command-timeout-seconds:30}")
    private long commandTimeoutSeconds = 30;

    private final RemoteShellService remoteShell;
    private final StateStoreService stateStore;
    private final Clock clock;

    public MetricsSamplerService(RemoteShellService remoteShell, StateStoreService stateStore, Clock clock) {
        this.remoteShell = remoteShell;
        this.stateStore = stateStore;
        this.clock = clock;
    }

    /**
     * One utilization value per accelerator, in index order. Empty when any line is not an
     * integer in 0..100.
     */
    public static Optional<List<Integer>> parseGpuUtilization(String output) {
        if (output == null || output.isBlank()) {
            return Optional.empty();
        }
        List<Integer> values = new ArrayList<>();
        for (String line : output.strip().split("\\R")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) continue;
            try {
                int value = Integer.parseInt(trimmed);
                if (value < 0 || value > 100) {
                    return Optional.empty();
                }
                values.add(value);
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return values.isEmpty() ? Optional.empty() : Optional.of(values);
    }

    /** Parses a {@code df} line of "size used" in bytes. */
    public static Optional<long[]> parseDiskUsage(String output) {
        if (output == null || output.isBlank()) {
            return Optional.empty();
        }
        String[] parts = output.trim().split("\\s+");
        if (parts.length < 2) {
            return Optional.empty();
        }
        try {
            long total = Long.parseLong(parts[0]);
            long used = Long.parseLong(parts[1]);
            if (total <= 0 || used < 0) {
                return Optional.empty();
            }
            return Optional.of(new long[] {total, used});
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * @return number of accelerator readings recorded
     */
    public int sampleGpu(Machine machine, String keyPath) {
        if (!machine.hasAddress()) {
            return 0;
        }
        CommandResult result = remoteShell.runCommand(machine.getIp(), GPU_QUERY, keyPath, commandTimeout());
        if (!result.isSuccess()) {
            log.debug("GPU query failed on {}: {}", machine.label(), result.getError());
            return 0;
        }
        Optional<List<Integer>> values = parseGpuUtilization(result.getOutput());
        if (values.isEmpty()) {
            log.warn("Unparseable GPU reading from {}, discarding it", machine.label());
            return 0;
        }
        stateStore.addGpuSamples(machine.getId(), values.get(), clock.instant());
        return values.get().size();
    }

    public boolean sampleDisk(Machine machine, String keyPath) {
        if (!machine.hasAddress()) {
            return false;
        }
        CommandResult result = remoteShell.runCommand(machine.getIp(), DISK_QUERY, keyPath, commandTimeout());
        if (!result.isSuccess()) {
            log.debug("Disk query failed on {}: {}", machine.label(), result.getError());
            return false;
        }
        Optional<long[]> usage = parseDiskUsage(result.getOutput());
        if (usage.isEmpty()) {
            log.warn("Unparseable disk reading from {}, discarding it", machine.label());
            return false;
        }
        Instant now = clock.instant();
        stateStore.addDiskSample(DiskSample.builder()
            .machineId(machine.getId())
            .totalBytes(usage.get()[0])
            .usedBytes(usage.get()[1])
            .sampledAt(now)
            .build());
        return true;
    }

    public SamplingResult sampleAll(List<Machine> machines) {
        SamplingResult result = new SamplingResult();
        for (Machine machine : machines) {
            if (!machine.isActive() || !machine.hasAddress()) {
                continue;
            }
            String keyPath = remoteShell.resolveKeyFor(machine).orElse(null);
            int gpu = sampleGpu(machine, keyPath);
            boolean disk = sampleDisk(machine, keyPath);
            result.setMachinesSampled(result.getMachinesSampled() + 1);
            result.setGpuSamples(result.getGpuSamples() + gpu);
            if (disk) {
                result.setDiskSamples(result.getDiskSamples() + 1);
            }
            if (gpu == 0) {
                result.setFailures(result.getFailures() + 1);
            }
        }
        log.info("Sampled {} machine(s): {} GPU reading(s), {} disk reading(s), {} failure(s)",
            result.getMachinesSampled(), result.getGpuSamples(), result.getDiskSamples(), result.getFailures());
        return result;
    }

    private Duration commandTimeout() {
        return Duration.ofSeconds(commandTimeoutSeconds);
    }
}
