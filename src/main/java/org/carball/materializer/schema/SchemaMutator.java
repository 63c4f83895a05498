package org.carball.materializer.schema;

import lombok.extern.slf4j.Slf4j;
import org.carball.materializer.backfill.BackfillCoordinator;
import org.carball.materializer.database.DatabaseClient;
import org.carball.materializer.database.DatabaseException;
import org.carball.materializer.database.ExistingColumn;
import org.carball.materializer.model.backfill.BackfillJob;
import org.carball.materializer.model.candidate.CandidateState;
import org.carball.materializer.model.candidate.MaterializationCandidate;
import org.carball.materializer.model.candidate.MaterializedColumnSpec;
import org.carball.materializer.state.StateStore;

import java.time.Duration;
import java.util.Optional;

/**
 * Adds the materialized column for a candidate and hands it to the backfill coordinator.
 */
@Slf4j
public class SchemaMutator {

    private final DatabaseClient databaseClient;
    private final StateStore stateStore;
    private final BackfillCoordinator coordinator;
    private final String rawColumn;
    private final Duration timeout;

    public SchemaMutator(DatabaseClient databaseClient, StateStore stateStore, BackfillCoordinator coordinator,
                         String rawColumn, Duration timeout) {
        this.databaseClient = databaseClient;
        this.stateStore = stateStore;
        this.coordinator = coordinator;
        this.rawColumn = rawColumn;
        this.timeout = timeout;
    }

    /**
     * Moves the candidate to PENDING and returns its backfill job. Re-running for a column that
     * already exists with the same definition issues no schema change.
     *
     * @throws SchemaConflictException if the column name is taken by a different definition;
     *                                 the candidate is marked FAILED
     * @throws DatabaseException       if the database could not be reached; the candidate is marked FAILED
     */
    public BackfillJob apply(MaterializationCandidate candidate) throws SchemaConflictException, DatabaseException {
        MaterializedColumnSpec spec = MaterializedColumnSpec.of(candidate, rawColumn);

        try {
            Optional<ExistingColumn> existing = databaseClient.findColumn(spec.table(), spec.columnName(), timeout);
            if (existing.isPresent()) {
                checkCompatible(candidate, spec, existing.get());
                log.info("Column {}.{} already materializes {}, skipping schema change",
                        spec.table(), spec.columnName(), spec.propertyPath());
            } else {
                databaseClient.addMaterializedColumn(spec, timeout);
            }
        } catch (SchemaConflictException e) {
            log.error("Schema conflict for {}: {}. Needs manual review", candidate.getKey(), e.getMessage());
            markFailed(candidate, e.getMessage());
            throw e;
        } catch (DatabaseException e) {
            log.error("Could not materialize {}: {}", candidate.getKey(), e.getMessage());
            markFailed(candidate, e.getMessage());
            throw e;
        }

        candidate.transitionTo(CandidateState.PENDING, null);
        stateStore.saveCandidate(candidate);

        return coordinator.enqueue(candidate);
    }

    private void checkCompatible(MaterializationCandidate candidate, MaterializedColumnSpec spec, ExistingColumn existing)
            throws SchemaConflictException {
        boolean computed = existing.isMaterialized() || "DEFAULT".equalsIgnoreCase(existing.defaultKind());
        if (!computed || !sameExpression(spec.expression(), existing.defaultExpression())) {
            throw new SchemaConflictException(candidate.getKey(), String.format(
                    "column %s.%s exists as %s %s %s, expected MATERIALIZED %s",
                    spec.table(), spec.columnName(), existing.type(),
                    emptyToDash(existing.defaultKind()), emptyToDash(existing.defaultExpression()),
                    spec.expression()));
        }
    }

    static boolean sameExpression(String expected, String actual) {
        if (actual == null) {
            return false;
        }
        return expected.replaceAll("\\s+", "").equals(actual.replaceAll("\\s+", ""));
    }

    private static String emptyToDash(String value) {
        return value == null || value.isEmpty() ? "-" : value;
    }

    private void markFailed(MaterializationCandidate candidate, String reason) {
        candidate.transitionTo(CandidateState.FAILED, reason);
        stateStore.saveCandidate(candidate);
    }
}
