package org.carball.materializer.config;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

@Data
@Builder(toBuilder = true)
@Slf4j
public class MaterializerConfig {

    // Query log scanning
    @Builder.Default
    private int trailingWindowDays = 7;

    // Candidate selection
    @Builder.Default
    private int topN = 10;

    @Builder.Default
    private long minUsageThreshold = 100;

    @Builder.Default
    private double savingsRatio = 0.5;

    // Read bytes that cost one millisecond of query time; 0 ignores read bytes
    @Builder.Default
    private double bytesPerMs = 0.0;

    // Backfill
    @Builder.Default
    private int chunkSize = 1;

    @Builder.Default
    private int maxRetries = 5;

    @Builder.Default
    private long backoffInitialMs = 1_000;

    @Builder.Default
    private long backoffMaxMs = 60_000;

    @Builder.Default
    private int backfillParallelism = 2;

    // Database
    @Builder.Default
    private int statementTimeoutSeconds = 300;

    @Builder.Default
    private String rawColumn = "properties";

    @Builder.Default
    private String columnPrefix = "mat_";

    // Single-flight lease
    @Builder.Default
    private int leaseTtlMinutes = 360;

    // Profile information
    @Builder.Default
    private String profileName = "default";

    @Builder.Default
    private String profileDescription = "Default balanced settings";

    public static MaterializerConfig defaults() {
        return MaterializerConfig.builder().build();
    }

    public Duration getTrailingWindow() {
        return Duration.ofDays(trailingWindowDays);
    }

    public Duration getStatementTimeout() {
        return Duration.ofSeconds(statementTimeoutSeconds);
    }

    public Duration getLeaseTtl() {
        return Duration.ofMinutes(leaseTtlMinutes);
    }

    /**
     * Rejects settings the pipeline cannot run with and logs warnings for questionable ones.
     */
    public void validate() {
        if (topN < 1) {
            throw new IllegalArgumentException("top_n must be at least 1, got: " + topN);
        }
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunk_size must be at least 1, got: " + chunkSize);
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("max_retries must not be negative, got: " + maxRetries);
        }
        if (trailingWindowDays < 1) {
            throw new IllegalArgumentException("trailing_window_days must be at least 1, got: " + trailingWindowDays);
        }
        if (backfillParallelism < 1) {
            throw new IllegalArgumentException("backfill_parallelism must be at least 1, got: " + backfillParallelism);
        }
        if (rawColumn == null || rawColumn.isBlank()) {
            throw new IllegalArgumentException("raw_column must be set");
        }

        if (savingsRatio <= 0.0 || savingsRatio > 1.0) {
            log.warn("Savings ratio ({}) should be in (0, 1]", savingsRatio);
        }
        if (minUsageThreshold <= 0) {
            log.warn("Minimum usage threshold ({}) lets every property through", minUsageThreshold);
        }
        if (backoffMaxMs < backoffInitialMs) {
            log.warn("Maximum backoff ({}ms) is below initial backoff ({}ms)", backoffMaxMs, backoffInitialMs);
        }
        if (leaseTtlMinutes < 60) {
            log.warn("Lease TTL ({} min) is short; a long backfill may outlive its lease", leaseTtlMinutes);
        }

        log.debug("Using settings - Window: {}d, Top N: {}, Min usage: {}, Chunk: {}, Profile: {}",
                trailingWindowDays, topN, minUsageThreshold, chunkSize, profileName);
    }

    public String getConfigurationSummary() {
        return String.format("Profile: %s | Window: %dd | Top N: %d | Min usage: %d | Chunk: %d | Retries: %d",
                profileName, trailingWindowDays, topN, minUsageThreshold, chunkSize, maxRetries);
    }
}
