package org.carball.materializer.querylog;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.carball.materializer.database.DatabaseClient;
import org.carball.materializer.database.DatabaseException;
import org.carball.materializer.model.query.QueryRecord;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Reads the live query log through the database client.
 */
@Slf4j
@RequiredArgsConstructor
public class DatabaseQueryLogReader implements QueryLogReader {

    private final DatabaseClient databaseClient;
    private final Duration timeout;

    @Override
    public List<QueryRecord> readQueries(Instant since, Instant until) throws QueryLogException {
        try {
            List<QueryRecord> records = databaseClient.readQueryLog(since, until, timeout);
            log.info("Read {} queries from the database query log", records.size());
            return records;
        } catch (DatabaseException e) {
            throw new QueryLogException("Could not read the query log", e);
        }
    }

    @Override
    public String describe() {
        return "database query log";
    }
}
