package org.carball.materializer.state;

import org.carball.materializer.model.backfill.BackfillJob;
import org.carball.materializer.model.candidate.MaterializationCandidate;
import org.carball.materializer.model.query.PropertyKey;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Durable candidate and backfill job records, keyed by (table, property path).
 * Implementations must be safe for concurrent use by backfill workers.
 */
public interface StateStore {

    Optional<MaterializationCandidate> findCandidate(PropertyKey key);

    List<MaterializationCandidate> candidates();

    void saveCandidate(MaterializationCandidate candidate);

    Optional<BackfillJob> findJob(PropertyKey key);

    List<BackfillJob> jobs();

    void saveJob(BackfillJob job);

    /**
     * Keys whose candidates are pending or materialized.
     */
    Set<PropertyKey> blockedKeys();
}
