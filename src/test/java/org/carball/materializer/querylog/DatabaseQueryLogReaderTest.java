package org.carball.materializer.querylog;

import org.carball.materializer.database.InMemoryDatabaseClient;
import org.carball.materializer.model.query.QueryRecord;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class DatabaseQueryLogReaderTest {

    private static final Instant NOW = Instant.parse("2026-10-15T03:00:00Z");

    @Test
    void shouldReadWindowFromDatabase() throws QueryLogException {
        // Given
        InMemoryDatabaseClient database = new InMemoryDatabaseClient();
        database.addQuery(new QueryRecord("q-1", "SELECT 1", 5, 0, NOW.minusSeconds(60), "events"));
        database.addQuery(new QueryRecord("q-2", "SELECT 2", 5, 0, NOW.minus(Duration.ofDays(9)), "events"));
        DatabaseQueryLogReader reader = new DatabaseQueryLogReader(database, Duration.ofSeconds(30));

        // When/Then
        assertThat(reader.readQueries(NOW.minus(Duration.ofDays(7)), NOW))
                .extracting(QueryRecord::queryId).containsExactly("q-1");
        assertThat(reader.describe()).isEqualTo("database query log");
    }

    @Test
    void shouldWrapDatabaseFailures() {
        // Given
        InMemoryDatabaseClient database = new InMemoryDatabaseClient();
        database.failQueryLog("connection refused");
        DatabaseQueryLogReader reader = new DatabaseQueryLogReader(database, Duration.ofSeconds(30));

        // When/Then
        assertThatThrownBy(() -> reader.readQueries(NOW.minus(Duration.ofDays(7)), NOW))
                .isInstanceOf(QueryLogException.class)
                .hasMessage("Could not read the query log")
                .hasRootCauseMessage("connection refused");
    }
}
