package org.carball.materializer.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.materializer.model.candidate.CandidateState;
import org.carball.materializer.model.candidate.MaterializationCandidate;
import org.carball.materializer.model.query.PropertyKey;
import org.carball.materializer.model.query.PropertyUsage;
import org.carball.materializer.schema.ColumnNamer;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Picks the properties most worth materializing.
 * <p>
 * Score is {@code usageCount x averageCostSaved}. Ties go to the higher usage count, then to the
 * lexicographically smaller property path and table, so the same input always yields the same list.
 */
@Slf4j
public class CandidateRanker {

    static final Comparator<MaterializationCandidate> RANKING = Comparator
            .comparingDouble(MaterializationCandidate::getBenefitScore).reversed()
            .thenComparing(Comparator.comparingLong(MaterializationCandidate::getUsageCount).reversed())
            .thenComparing(MaterializationCandidate::getKey);

    private final BenefitEstimator estimator;
    private final ColumnNamer columnNamer;
    private final long minUsageThreshold;
    private final int topN;

    public CandidateRanker(BenefitEstimator estimator, ColumnNamer columnNamer, long minUsageThreshold, int topN) {
        this.estimator = estimator;
        this.columnNamer = columnNamer;
        this.minUsageThreshold = minUsageThreshold;
        this.topN = topN;
    }

    /**
     * @param excluded keys already materialized or pending; never selected again
     */
    public List<MaterializationCandidate> rank(List<PropertyUsage> usages, Set<PropertyKey> excluded) {
        Instant now = Instant.now();

        List<MaterializationCandidate> ranked = usages.stream()
                .filter(usage -> usage.getUsageCount() >= minUsageThreshold)
                .filter(usage -> !excluded.contains(usage.getKey()))
                .map(usage -> MaterializationCandidate.builder()
                        .key(usage.getKey())
                        .columnName(columnNamer.columnName(usage.getKey().propertyPath()))
                        .usageCount(usage.getUsageCount())
                        .benefitScore(usage.getUsageCount() * estimator.averageCostSaved(usage))
                        .state(CandidateState.NOT_MATERIALIZED)
                        .updatedAt(now)
                        .build())
                .sorted(RANKING)
                .limit(topN)
                .collect(Collectors.toList());

        log.info("Selected {} candidates from {} properties (min usage {}, top {}, {} excluded, score = usage x {})",
                ranked.size(), usages.size(), minUsageThreshold, topN, excluded.size(), estimator.describe());
        for (MaterializationCandidate candidate : ranked) {
            log.debug("Candidate {} -> {} (score {}, used {} times)",
                    candidate.getKey(), candidate.getColumnName(),
                    String.format("%.1f", candidate.getBenefitScore()), candidate.getUsageCount());
        }
        return ranked;
    }
}
