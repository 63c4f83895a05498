package org.carball.materializer.querylog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.materializer.model.query.QueryRecord;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Reads query log records from an exported JSON file instead of connecting to the database.
 */
@Slf4j
public class QueryLogFileReader implements QueryLogReader {

    private final Path path;
    private final JsonNode exportData;

    public QueryLogFileReader(Path path) throws IOException {
        this.path = path;
        if (!Files.exists(path)) {
            throw new IOException("Query log export file not found: " + path);
        }

        ObjectMapper objectMapper = new ObjectMapper();
        exportData = objectMapper.readTree(Files.readString(path));

        validateExportFormat();
    }

    /**
     * All records in the file, regardless of time.
     */
    public List<QueryRecord> getAllQueries() {
        List<QueryRecord> results = new ArrayList<>();
        for (JsonNode queryNode : exportData.get("queries")) {
            results.add(parseQueryFromJson(queryNode));
        }
        return results;
    }

    @Override
    public List<QueryRecord> readQueries(Instant since, Instant until) throws QueryLogException {
        List<QueryRecord> all;
        try {
            all = getAllQueries();
        } catch (IllegalStateException e) {
            throw new QueryLogException("Could not read " + path.getFileName() + ": " + e.getMessage(), e);
        }
        List<QueryRecord> results = all.stream()
                .filter(q -> !q.timestamp().isBefore(since) && q.timestamp().isBefore(until))
                .collect(Collectors.toList());
        log.info("Loaded {} of {} queries from {} inside the window",
                results.size(), exportData.get("queries").size(), path.getFileName());
        return results;
    }

    @Override
    public String describe() {
        return "export file " + path.getFileName();
    }

    public ExportMetadata getExportMetadata() {
        JsonNode metadata = exportData.get("export_metadata");
        return new ExportMetadata(
                metadata.get("database_name").asText(),
                metadata.get("export_timestamp").asText(),
                metadata.path("total_queries").asInt(exportData.get("queries").size())
        );
    }

    private void validateExportFormat() {
        if (exportData == null || !exportData.isObject()) {
            throw new IllegalStateException("Invalid JSON format in export file");
        }

        JsonNode metadata = exportData.get("export_metadata");
        if (metadata == null) {
            throw new IllegalStateException("Missing export_metadata section in export file");
        }

        JsonNode queries = exportData.get("queries");
        if (queries == null || !queries.isArray()) {
            throw new IllegalStateException("Missing or invalid queries section in export file");
        }

        String[] requiredFields = {"database_name", "export_timestamp"};
        for (String field : requiredFields) {
            if (!metadata.has(field)) {
                throw new IllegalStateException("Missing required metadata field: " + field);
            }
        }

        String[] requiredQueryFields = {"query_id", "query", "query_duration_ms", "event_time"};
        int index = 0;
        for (JsonNode query : queries) {
            for (String field : requiredQueryFields) {
                if (!query.has(field)) {
                    throw new IllegalStateException("Query #" + index + " is missing required field: " + field);
                }
            }
            index++;
        }
    }

    private QueryRecord parseQueryFromJson(JsonNode queryNode) {
        String eventTime = queryNode.get("event_time").asText();
        Instant timestamp;
        try {
            timestamp = Instant.parse(eventTime);
        } catch (DateTimeParseException e) {
            throw new IllegalStateException("Invalid event_time '" + eventTime + "' for query "
                    + queryNode.get("query_id").asText(), e);
        }

        JsonNode table = queryNode.get("table");
        return new QueryRecord(
                queryNode.get("query_id").asText(),
                queryNode.get("query").asText(),
                queryNode.get("query_duration_ms").asDouble(),
                queryNode.path("read_bytes").asLong(0),
                timestamp,
                table == null || table.isNull() || table.asText().isBlank() ? null : table.asText()
        );
    }

    /**
     * Metadata about the query log export.
     */
    public record ExportMetadata(String databaseName, String exportTimestamp, int totalQueries) {}
}
