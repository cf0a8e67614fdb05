package com.gpufleet.governor.service;

import com.gpufleet.governor.model.IdleDecision;
import com.gpufleet.governor.model.IdleStatus;
import com.gpufleet.governor.model.Machine;
import com.gpufleet.governor.model.TimePoint;
import com.gpufleet.governor.model.UtilizationSample;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Decides whether a machine has earned idle status and whether it may be reclaimed.
 * <p>
 * A machine is terminate-eligible only when it has run for the minimum runtime, every time point
 * in the idle window shows all accelerators at 0%, the window holds enough time points to trust
 * that, and the machine is not allowlisted.
 */
@Service
public class IdleEvaluatorService {

    private static final Duration LOOKBACK = Duration.ofHours(24);
    private static final Duration ROLLING_AVERAGE_WINDOW = Duration.ofHours(1);

    @Value("${fleet.idle.threshold-hours:2}")
    private double idleThresholdHours = 2;

    @Value("${fleet.idle.min-runtime-hours:4}")
    private double minRuntimeHours = 4;

    @Value("${fleet.idle.coverage-ratio:0.8}")
    private double coverageRatio = 0.8;

    @Value("${fleet.idle.grouping-tolerance-seconds:30}")
    private long groupingToleranceSeconds = 30;

    @Value("${fleet.idle.allowlist-markers:allowlist,whitelist}")
    private List<String> allowlistMarkers = List.of("allowlist", "whitelist");

    private final StateStoreService stateStore;
    private final Clock clock;

    public IdleEvaluatorService(StateStoreService stateStore, Clock clock) {
        this.stateStore = stateStore;
        this.clock = clock;
    }

    public void setIdleThresholdHours(double idleThresholdHours) {
        this.idleThresholdHours = idleThresholdHours;
    }

    public void setMinRuntimeHours(double minRuntimeHours) {
        this.minRuntimeHours = minRuntimeHours;
    }

    public void setCoverageRatio(double coverageRatio) {
        this.coverageRatio = coverageRatio;
    }

    public void setAllowlistMarkers(List<String> allowlistMarkers) {
        this.allowlistMarkers = allowlistMarkers;
    }

    public double getIdleThresholdHours() {
        return idleThresholdHours;
    }

    public Duration idleThreshold() {
        return Duration.ofSeconds(Math.round(idleThresholdHours * 3600));
    }

    public Duration minRuntime() {
        return Duration.ofSeconds(Math.round(minRuntimeHours * 3600));
    }

    public Duration groupingTolerance() {
        return Duration.ofSeconds(groupingToleranceSeconds);
    }

    /** Time points expected in the idle window at one sample per minute, scaled by the coverage ratio. */
    public int requiredTimePoints() {
        return (int) (idleThresholdHours * 60 * coverageRatio);
    }

    public IdleStatus evaluate(Machine machine) {
        Instant now = clock.instant();
        return evaluate(machine, stateStore.gpuSamplesSince(machine.getId(), now.minus(LOOKBACK)), now);
    }

    public IdleStatus evaluate(Machine machine, List<UtilizationSample> samples, Instant now) {
        Instant windowStart = now.minus(idleThreshold());
        List<TimePoint> lookback = groupTimePoints(samples, groupingTolerance());
        List<TimePoint> window = groupTimePoints(
            samples.stream().filter(s -> s.getSampledAt().isAfter(windowStart)).collect(Collectors.toList()),
            groupingTolerance());

        Duration runtime = runtimeOf(machine, now);
        boolean minRuntimeMet = runtime != null && runtime.compareTo(minRuntime()) >= 0;
        boolean allowlisted = machine.isReclaimExempt(allowlistMarkers);

        IdleStatus.IdleStatusBuilder status = IdleStatus.builder()
            .machineId(machine.getId())
            .machineLabel(machine.label())
            .acceleratorCount(machine.getGpuCount())
            .timePointsLookback(lookback.size())
            .timePointsInWindow(window.size())
            .requiredTimePoints(requiredTimePoints())
            .runtime(runtime)
            .minRuntimeMet(minRuntimeMet)
            .allowlisted(allowlisted);

        if (lookback.isEmpty()) {
            return status.decision(IdleDecision.NO_DATA).build();
        }

        // newest first
        List<TimePoint> recent = new ArrayList<>(lookback);
        recent.sort(Comparator.comparing(TimePoint::getTimestamp).reversed());

        double current = recent.get(0).getAverageUtilization();
        status.currentUtilization(current).active(current > 0);

        Instant hourAgo = now.minus(ROLLING_AVERAGE_WINDOW);
        recent.stream()
            .filter(p -> p.getTimestamp().isAfter(hourAgo))
            .mapToDouble(TimePoint::getAverageUtilization)
            .average()
            .ifPresent(status::averageUtilizationLastHour);

        Instant idleStart = null;
        for (TimePoint point : recent) {
            if (!point.isAllIdle()) break;
            idleStart = point.getTimestamp();
        }
        Duration idleDuration = null;
        if (idleStart != null) {
            idleDuration = Duration.between(idleStart, now);
            Duration remaining = idleThreshold().minus(idleDuration);
            status.idleDuration(idleDuration)
                .timeUntilTermination(remaining.isNegative() ? Duration.ZERO : remaining);
        }

        boolean coverageSufficient = window.size() >= requiredTimePoints();
        boolean sustainedIdle = coverageSufficient && !window.isEmpty() && window.stream().allMatch(TimePoint::isAllIdle);
        boolean terminateEligible = minRuntimeMet && sustainedIdle && !allowlisted;

        status.coverageSufficient(coverageSufficient)
            .sustainedIdle(sustainedIdle)
            .terminateEligible(terminateEligible);

        IdleDecision decision;
        if (!coverageSufficient) {
            decision = IdleDecision.INSUFFICIENT_DATA;
        } else if (terminateEligible) {
            decision = IdleDecision.TERMINATE;
        } else if (sustainedIdle && allowlisted) {
            decision = IdleDecision.ALLOWLISTED;
        } else if (sustainedIdle) {
            decision = IdleDecision.MIN_RUNTIME_NOT_MET;
        } else if (current > 0) {
            decision = IdleDecision.ACTIVE;
        } else if (idleDuration != null && idleDuration.compareTo(idleThreshold().dividedBy(2)) > 0) {
            decision = IdleDecision.IDLE_WARNING;
        } else {
            decision = IdleDecision.IDLE;
        }
        return status.decision(decision).build();
    }

    /**
     * Groups per-accelerator samples into time points. A sample joins the current group while it
     * lies within {@code tolerance} of the group's first sample.
     */
    public static List<TimePoint> groupTimePoints(List<UtilizationSample> samples, Duration tolerance) {
        List<TimePoint> points = new ArrayList<>();
        if (samples == null || samples.isEmpty()) {
            return points;
        }
        List<UtilizationSample> sorted = new ArrayList<>(samples);
        sorted.sort(Comparator.comparing(UtilizationSample::getSampledAt));

        List<UtilizationSample> group = new ArrayList<>();
        for (UtilizationSample sample : sorted) {
            if (!group.isEmpty()
                && Duration.between(group.get(0).getSampledAt(), sample.getSampledAt()).compareTo(tolerance) > 0) {
                points.add(toTimePoint(group));
                group = new ArrayList<>();
            }
            group.add(sample);
        }
        points.add(toTimePoint(group));
        return points;
    }

    private static TimePoint toTimePoint(List<UtilizationSample> group) {
        double average = group.stream().mapToInt(UtilizationSample::getUtilization).average().orElse(0);
        boolean allIdle = group.stream().allMatch(s -> s.getUtilization() == 0);
        return TimePoint.builder()
            .timestamp(group.get(0).getSampledAt())
            .averageUtilization(average)
            .allIdle(allIdle)
            .acceleratorCount(group.size())
            .build();
    }

    private static Duration runtimeOf(Machine machine, Instant now) {
        Instant firstSeen = machine.getFirstSeen();
        if (firstSeen == null || firstSeen.toEpochMilli() <= 0) {
            // unknown start never counts as having run long enough
            return null;
        }
        return Duration.between(firstSeen, now);
    }
}
