package org.carball.materializer.model.query;

import lombok.Data;

/**
 * Aggregated usage of one property path over the scanned query log window.
 */
@Data
public class PropertyUsage {
    private final PropertyKey key;
    private long usageCount = 0;
    private double totalDurationMs = 0.0;
    private long totalReadBytes = 0;

    public PropertyUsage(PropertyKey key) {
        this.key = key;
    }

    public PropertyUsage(PropertyKey key, long usageCount, double totalDurationMs, long totalReadBytes) {
        this.key = key;
        this.usageCount = usageCount;
        this.totalDurationMs = totalDurationMs;
        this.totalReadBytes = totalReadBytes;
    }

    public void record(QueryRecord query) {
        usageCount++;
        totalDurationMs += query.durationMs();
        totalReadBytes += query.readBytes();
    }

    public double getAverageDurationMs() {
        return usageCount == 0 ? 0.0 : totalDurationMs / usageCount;
    }

    public double getAverageReadBytes() {
        return usageCount == 0 ? 0.0 : (double) totalReadBytes / usageCount;
    }
}
