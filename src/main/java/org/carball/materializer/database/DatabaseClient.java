package org.carball.materializer.database;

import org.carball.materializer.backfill.BackfillChunkException;
import org.carball.materializer.model.candidate.MaterializedColumnSpec;
import org.carball.materializer.model.query.QueryRecord;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * The analytical database, as seen by the materializer. Every call is blocking and
 * bounded by the given timeout.
 */
public interface DatabaseClient {

    /**
     * Finished read queries logged in {@code [since, until)}.
     */
    List<QueryRecord> readQueryLog(Instant since, Instant until, Duration timeout) throws DatabaseException;

    Optional<ExistingColumn> findColumn(String table, String column, Duration timeout) throws DatabaseException;

    /**
     * Adds the column if it does not exist yet. New rows get the value at insert time.
     */
    void addMaterializedColumn(MaterializedColumnSpec spec, Duration timeout) throws DatabaseException;

    /**
     * Partition ids holding rows older than {@code before}, in ascending order.
     */
    List<String> listPartitions(String table, Instant before, Duration timeout) throws DatabaseException;

    /**
     * Recomputes the column for rows of the given partitions older than {@code upperBound}.
     * Returns only once the rewrite is applied; applying it again yields the same values.
     */
    void backfillChunk(MaterializedColumnSpec spec, List<String> partitions, Instant upperBound, Duration timeout)
            throws BackfillChunkException;
}
