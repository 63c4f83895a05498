package org.carball.materializer.querylog;

import org.carball.materializer.model.query.QueryRecord;

import java.time.Instant;
import java.util.List;

/**
 * Source of finished queries for one cycle.
 */
public interface QueryLogReader {

    List<QueryRecord> readQueries(Instant since, Instant until) throws QueryLogException;

    /**
     * Human-readable description for logs and reports.
     */
    String describe();
}
