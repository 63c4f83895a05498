package org.carball.materializer.database;

import lombok.extern.slf4j.Slf4j;
import org.carball.materializer.backfill.BackfillChunkException;
import org.carball.materializer.model.candidate.MaterializedColumnSpec;
import org.carball.materializer.model.query.QueryRecord;

import java.sql.*;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * ClickHouse over JDBC. Reads {@code system.query_log}, {@code system.columns} and
 * {@code system.parts}, and issues column mutations.
 */
@Slf4j
public class JdbcDatabaseClient implements DatabaseClient {

    // Marks our own statements so they never show up as candidates
    static final String LOG_MARKER = "/* column-materializer */";

    private static final String QUERY_LOG = LOG_MARKER + """
         SELECT
            toString(query_id) AS query_id,
            query,
            query_duration_ms,
            read_bytes,
            event_time,
            if(empty(tables), '', tables[1]) AS table_name
        FROM system.query_log
        WHERE type = 'QueryFinish'
          AND query_kind = 'Select'
          AND is_initial_query
          AND event_time >= ?
          AND event_time < ?
          AND query NOT LIKE '%column-materializer%'
        """;

    private static final String FIND_COLUMN = LOG_MARKER + """
         SELECT name, type, default_kind, default_expression
        FROM system.columns
        WHERE database = currentDatabase()
          AND table = ?
          AND name = ?
        """;

    private static final String LIST_PARTITIONS = LOG_MARKER + """
         SELECT DISTINCT partition_id
        FROM system.parts
        WHERE database = currentDatabase()
          AND table = ?
          AND active
          AND min_time < ?
        ORDER BY partition_id
        """;

    private final String jdbcUrl;

    public JdbcDatabaseClient(String jdbcUrl) {
        this.jdbcUrl = jdbcUrl;
    }

    @Override
    public List<QueryRecord> readQueryLog(Instant since, Instant until, Duration timeout) throws DatabaseException {
        List<QueryRecord> results = new ArrayList<>();

        try (Connection conn = DriverManager.getConnection(jdbcUrl);
             PreparedStatement stmt = conn.prepareStatement(QUERY_LOG)) {
            stmt.setQueryTimeout(toSeconds(timeout));
            stmt.setTimestamp(1, Timestamp.from(since));
            stmt.setTimestamp(2, Timestamp.from(until));

            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    results.add(new QueryRecord(
                            rs.getString("query_id"),
                            rs.getString("query"),
                            rs.getDouble("query_duration_ms"),
                            rs.getLong("read_bytes"),
                            rs.getTimestamp("event_time").toInstant(),
                            stripDatabase(rs.getString("table_name"))
                    ));
                }
            }
        } catch (SQLException e) {
            throw new DatabaseException("Failed to read query log: " + e.getMessage(), e);
        }

        log.debug("Read {} query log records between {} and {}", results.size(), since, until);
        return results;
    }

    @Override
    public Optional<ExistingColumn> findColumn(String table, String column, Duration timeout) throws DatabaseException {
        try (Connection conn = DriverManager.getConnection(jdbcUrl);
             PreparedStatement stmt = conn.prepareStatement(FIND_COLUMN)) {
            stmt.setQueryTimeout(toSeconds(timeout));
            stmt.setString(1, table);
            stmt.setString(2, column);

            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new ExistingColumn(
                        rs.getString("name"),
                        rs.getString("type"),
                        rs.getString("default_kind"),
                        rs.getString("default_expression")
                ));
            }
        } catch (SQLException e) {
            throw new DatabaseException("Failed to look up column " + table + "." + column + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void addMaterializedColumn(MaterializedColumnSpec spec, Duration timeout) throws DatabaseException {
        String sql = renderAddColumn(spec);
        try {
            execute(sql, timeout);
        } catch (SQLException e) {
            throw new DatabaseException("Failed to add column " + spec.columnName() + " to " + spec.table()
                    + ": " + e.getMessage(), e);
        }
        log.info("Added materialized column {}.{}", spec.table(), spec.columnName());
    }

    @Override
    public List<String> listPartitions(String table, Instant before, Duration timeout) throws DatabaseException {
        List<String> partitions = new ArrayList<>();

        try (Connection conn = DriverManager.getConnection(jdbcUrl);
             PreparedStatement stmt = conn.prepareStatement(LIST_PARTITIONS)) {
            stmt.setQueryTimeout(toSeconds(timeout));
            stmt.setString(1, table);
            stmt.setTimestamp(2, Timestamp.from(before));

            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    partitions.add(rs.getString("partition_id"));
                }
            }
        } catch (SQLException e) {
            throw new DatabaseException("Failed to list partitions of " + table + ": " + e.getMessage(), e);
        }

        return partitions;
    }

    @Override
    public void backfillChunk(MaterializedColumnSpec spec, List<String> partitions, Instant upperBound, Duration timeout)
            throws BackfillChunkException {
        for (String partition : partitions) {
            String sql = renderMaterializePartition(spec, partition);
            try {
                execute(sql, timeout);
            } catch (SQLTimeoutException e) {
                throw new BackfillChunkException("Timed out materializing " + spec.columnName()
                        + " in partition " + partition, e);
            } catch (SQLException e) {
                throw new BackfillChunkException("Failed materializing " + spec.columnName()
                        + " in partition " + partition + ": " + e.getMessage(), e);
            }
        }
    }

    private void execute(String sql, Duration timeout) throws SQLException {
        try (Connection conn = DriverManager.getConnection(jdbcUrl);
             Statement stmt = conn.createStatement()) {
            stmt.setQueryTimeout(toSeconds(timeout));
            stmt.execute(sql);
        }
    }

    static String renderAddColumn(MaterializedColumnSpec spec) {
        return LOG_MARKER + " ALTER TABLE " + quoteIdentifier(spec.table())
                + " ADD COLUMN IF NOT EXISTS " + quoteIdentifier(spec.columnName())
                + " VARCHAR MATERIALIZED " + spec.expression()
                + " COMMENT " + MaterializedColumnSpec.quoteLiteral("column_materializer::" + spec.propertyPath());
    }

    // Rewrites the whole partition; rows added after the column already hold the same value
    static String renderMaterializePartition(MaterializedColumnSpec spec, String partitionId) {
        return LOG_MARKER + " ALTER TABLE " + quoteIdentifier(spec.table())
                + " MATERIALIZE COLUMN " + quoteIdentifier(spec.columnName())
                + " IN PARTITION ID " + MaterializedColumnSpec.quoteLiteral(partitionId)
                + " SETTINGS mutations_sync = 2";
    }

    static String quoteIdentifier(String identifier) {
        return "`" + identifier.replace("\\", "\\\\").replace("`", "\\`") + "`";
    }

    private static String stripDatabase(String qualifiedTable) {
        if (qualifiedTable == null || qualifiedTable.isEmpty()) {
            return null;
        }
        int dot = qualifiedTable.indexOf('.');
        return dot < 0 ? qualifiedTable : qualifiedTable.substring(dot + 1);
    }

    private static int toSeconds(Duration timeout) {
        return (int) Math.max(1, Math.min(Integer.MAX_VALUE, timeout.toSeconds()));
    }

    /**
     * Connection string for a local ClickHouse started with the default user.
     */
    public static String createLocalConnectionString() {
        return "jdbc:clickhouse://localhost:8123/default?user=default&password=";
    }
}
