package org.carball.materializer.pipeline;

import org.carball.materializer.model.backfill.BackfillJob;
import org.carball.materializer.model.candidate.MaterializationCandidate;
import org.carball.materializer.model.query.UsageSummary;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one materialization cycle.
 *
 * @param schemaFailures reason per candidate column that could not be added, keyed by column name
 * @param jobs           final state of every backfill job run during the cycle, resumed ones included
 */
public record CycleResult(
        Status status,
        Instant startedAt,
        Instant finishedAt,
        UsageSummary summary,
        List<MaterializationCandidate> candidates,
        Map<String, String> schemaFailures,
        List<BackfillJob> jobs,
        String message
) {

    public enum Status {
        COMPLETED,
        PLANNED,
        SKIPPED,
        FAILED
    }

    static CycleResult skipped(Instant startedAt, String message) {
        return new CycleResult(Status.SKIPPED, startedAt, Instant.now(), null,
                List.of(), Map.of(), List.of(), message);
    }

    static CycleResult failed(Instant startedAt, String message) {
        return new CycleResult(Status.FAILED, startedAt, Instant.now(), null,
                List.of(), Map.of(), List.of(), message);
    }
}
