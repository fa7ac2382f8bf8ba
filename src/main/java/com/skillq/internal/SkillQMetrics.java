package com.skillq.internal;

import com.skillq.JobRepository;
import com.skillq.JobStatus;
import com.skillq.config.SkillQProperties;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.EnumMap;
import java.util.Map;

/**
 * Queue gauges. Counts are read through a one-second snapshot so a scrape touching every gauge
 * costs two queries.
 */
public class SkillQMetrics {

    private static final Logger log = LoggerFactory.getLogger(SkillQMetrics.class);
    private static final long SNAPSHOT_TTL_NANOS = Duration.ofSeconds(1).toNanos();

    private final JobRepository jobRepository;
    private final MeterRegistry meterRegistry;
    private final SkillQProperties properties;
    private final Object snapshotMonitor = new Object();

    private volatile Snapshot cachedSnapshot = Snapshot.empty();
    private volatile long snapshotCapturedAtNanos = 0L;
    private volatile boolean captured;

    public SkillQMetrics(JobRepository jobRepository, MeterRegistry meterRegistry, SkillQProperties properties) {
        this.jobRepository = jobRepository;
        this.meterRegistry = meterRegistry;
        this.properties = properties;
    }

    @PostConstruct
    public void registerMetrics() {
        log.info("Registering SkillQ queue gauges");
        for (JobStatus status : JobStatus.values()) {
            Gauge.builder("skillq.jobs.count", this, metrics -> metrics.countFor(status))
                    .description("Number of SkillQ jobs")
                    .tag("status", status.name())
                    .register(meterRegistry);
        }

        Gauge.builder("skillq.jobs.total", this, SkillQMetrics::totalCount)
                .description("Total number of SkillQ jobs in the database")
                .register(meterRegistry);

        Gauge.builder("skillq.jobs.stuck", this, metrics -> metrics.getSnapshot().stuck())
                .description("Processing jobs without progress beyond the stuck threshold")
                .register(meterRegistry);
    }

    private double countFor(JobStatus status) {
        return getSnapshot().counts().getOrDefault(status, 0L);
    }

    private double totalCount() {
        return getSnapshot().counts().values().stream().mapToLong(Long::longValue).sum();
    }

    private Snapshot getSnapshot() {
        long now = System.nanoTime();
        if (captured && now - snapshotCapturedAtNanos <= SNAPSHOT_TTL_NANOS) {
            return cachedSnapshot;
        }

        synchronized (snapshotMonitor) {
            now = System.nanoTime();
            if (captured && now - snapshotCapturedAtNanos <= SNAPSHOT_TTL_NANOS) {
                return cachedSnapshot;
            }
            cachedSnapshot = loadSnapshot();
            snapshotCapturedAtNanos = now;
            captured = true;
            return cachedSnapshot;
        }
    }

    private Snapshot loadSnapshot() {
        try {
            Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
            for (JobRepository.StatusCount count : jobRepository.countByStatus()) {
                counts.put(count.getStatus(), count.getJobCount() == null ? 0L : count.getJobCount());
            }
            OffsetDateTime threshold = OffsetDateTime.now().minus(properties.getReaper().getStuckThreshold());
            long stuck = jobRepository.countStuck(JobStatus.PROCESSING, threshold);
            return new Snapshot(counts, stuck);
        } catch (Exception e) {
            log.trace("Failed to query job counts for metrics: {}", e.getMessage());
            return Snapshot.empty();
        }
    }

    private record Snapshot(Map<JobStatus, Long> counts, long stuck) {
        private static Snapshot empty() {
            return new Snapshot(Map.of(), 0L);
        }
    }
}
