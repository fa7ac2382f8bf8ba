package com.skillq.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Point-in-time view of the queue. Error rates are percentages of the jobs created in the window.
 * {@code byPriority} keeps the order it was built in, most urgent first.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record QueueMetrics(
        long totalPending,
        long totalProcessing,
        long totalFailedToday,
        long totalCompletedToday,
        Map<Integer, Long> byPriority,
        double avgDurationSeconds,
        @JsonProperty("error_rate_1h") double errorRate1h,
        @JsonProperty("error_rate_24h") double errorRate24h,
        long stuckJobs) {

    public QueueMetrics {
        byPriority = Collections.unmodifiableMap(new LinkedHashMap<>(byPriority));
    }
}
