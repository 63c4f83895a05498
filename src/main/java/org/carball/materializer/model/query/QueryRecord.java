package org.carball.materializer.model.query;

import java.time.Instant;

/**
 * A finished query captured from the database's query log with its observed cost.
 */
public record QueryRecord(
        String queryId,
        String queryText,
        double durationMs,
        long readBytes,
        Instant timestamp,
        String tableName
) {}
