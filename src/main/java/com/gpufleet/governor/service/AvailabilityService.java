package com.gpufleet.governor.service;

import com.gpufleet.governor.model.AvailabilityHistory;
import com.gpufleet.governor.model.AvailabilityRecord;
import com.gpufleet.governor.model.AvailabilitySnapshot;
import com.gpufleet.governor.model.AvailabilityStat;
import com.gpufleet.governor.model.FleetAccount;
import com.gpufleet.governor.model.InstanceTypeOffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Tracks which instance types have capacity in which regions, so operators can see when a type
 * is usually obtainable.
 * <p>
 * Each recording pass stores one row per (type, region) with capacity. History groups passes into
 * ten-minute slots; a type's percentage for a region is the share of slots in which it was seen.
 */
@Service
public class AvailabilityService {

    private static final Logger log = LoggerFactory.getLogger(AvailabilityService.class);

    static final Duration SLOT = Duration.ofMinutes(10);

    @Value("${fleet.availability.enabled:true}")
    private boolean enabled = true;

    @Value("${fleet.availability.retention-hours:168}")
    private long retentionHours = 168;

    private final LambdaCloudService cloud;
    private final StateStoreService stateStore;
    private final Clock clock;

    public AvailabilityService(LambdaCloudService cloud, StateStoreService stateStore, Clock clock) {
        this.cloud = cloud;
        this.stateStore = stateStore;
        this.clock = clock;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public void setRetentionHours(long retentionHours) {
        this.retentionHours = retentionHours;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Records current capacity as seen through {@code account} and drops observations past the
     * retention window.
     *
     * @return number of (type, region) rows recorded
     */
    public int record(FleetAccount account) {
        Instant now = clock.instant();
        int recorded = 0;
        for (InstanceTypeOffer offer : cloud.listInstanceTypes(account.getApiKey())) {
            if (offer.getRegionsWithCapacity().isEmpty()) {
                continue;
            }
            stateStore.recordAvailability(offer.getName(), offer.getRegionsWithCapacity(), now);
            recorded += offer.getRegionsWithCapacity().size();
        }
        int pruned = stateStore.pruneAvailabilityOlderThan(now.minus(Duration.ofHours(retentionHours)));
        log.info("Recorded {} availability entries via account '{}', pruned {}", recorded, account.getName(), pruned);
        return recorded;
    }

    /** Live view, straight from the provider; nothing is stored. */
    public AvailabilitySnapshot current(FleetAccount account) {
        List<InstanceTypeOffer> available = new ArrayList<>();
        List<InstanceTypeOffer> unavailable = new ArrayList<>();
        for (InstanceTypeOffer offer : cloud.listInstanceTypes(account.getApiKey())) {
            (offer.getRegionsWithCapacity().isEmpty() ? unavailable : available).add(offer);
        }
        Comparator<InstanceTypeOffer> byGpusThenName = Comparator.comparingInt(InstanceTypeOffer::getGpus)
            .thenComparing(InstanceTypeOffer::getName, Comparator.nullsLast(Comparator.naturalOrder()));
        available.sort(byGpusThenName);
        unavailable.sort(byGpusThenName);

        AvailabilitySnapshot snapshot = AvailabilitySnapshot.builder()
            .checkedAt(clock.instant())
            .available(available)
            .build();
        unavailable.forEach(offer -> snapshot.getUnavailable().add(offer.getName()));
        return snapshot;
    }

    public AvailabilityHistory history(Duration window) {
        Instant since = clock.instant().minus(window);
        List<AvailabilityRecord> records = stateStore.availabilitySince(since);

        Set<Long> slots = new HashSet<>();
        Map<String, Map<String, Integer>> counts = new TreeMap<>();
        for (AvailabilityRecord record : records) {
            slots.add(record.getRecordedAt().getEpochSecond() / SLOT.getSeconds());
            counts.computeIfAbsent(record.getInstanceType(), t -> new TreeMap<>())
                .merge(record.getRegion(), 1, Integer::sum);
        }

        int checks = slots.size();
        AvailabilityHistory history = AvailabilityHistory.builder().since(since).checks(checks).build();
        counts.forEach((type, regions) -> {
            Map<String, AvailabilityStat> stats = new TreeMap<>();
            regions.forEach((region, count) -> stats.put(region, AvailabilityStat.builder()
                .count(count)
                .checks(checks)
                .percent(checks == 0 ? 0 : Math.round(1000.0 * count / checks) / 10.0)
                .build()));
            history.getByType().put(type, stats);
        });
        return history;
    }
}
