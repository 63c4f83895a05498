package org.carball.materializer.parser;

import org.carball.materializer.model.query.QueryRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class PropertyExtractorTest {

    private PropertyExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new PropertyExtractor("properties");
    }

    private static QueryRecord query(String sql) {
        return new QueryRecord("q-1", sql, 120.0, 4096, Instant.parse("2026-10-01T12:00:00Z"), "events");
    }

    private static List<String> paths(List<PropertyReference> references) {
        return references.stream().map(PropertyReference::propertyPath).toList();
    }

    @Test
    void shouldExtractPropertyFromProjection() throws QueryParseException {
        // When
        List<PropertyReference> refs = extractor.extract(query(
                "SELECT JSONExtractString(properties, '$current_url') AS url, count(*) FROM events GROUP BY url"));

        // Then
        assertThat(refs).containsExactly(new PropertyReference("events", "$current_url"));
    }

    @Test
    void shouldFindCallsInWhereGroupByHavingAndOrderBy() throws QueryParseException {
        // Given
        String sql = """
            SELECT count(*) FROM events
            WHERE JSONExtractString(properties, 'plan') = 'pro'
            GROUP BY JSONExtractString(properties, '$browser')
            HAVING max(JSONExtractInt(properties, 'seats')) > 3
            ORDER BY JSONExtractFloat(properties, 'revenue') DESC
            """;

        // When
        List<PropertyReference> refs = extractor.extract(query(sql));

        // Then
        assertThat(paths(refs)).containsExactlyInAnyOrder("plan", "$browser", "seats", "revenue");
        assertThat(refs).allSatisfy(ref -> assertThat(ref.table()).isEqualTo("events"));
    }

    @Test
    void shouldReturnDistinctReferences() throws QueryParseException {
        // When
        List<PropertyReference> refs = extractor.extract(query(
                "SELECT JSONExtractString(properties, 'a') FROM events WHERE JSONExtractString(properties, 'a') != ''"));

        // Then
        assertThat(refs).hasSize(1);
    }

    @Test
    void shouldResolveTableAliases() throws QueryParseException {
        // Given
        String sql = """
            SELECT JSONExtractString(p.properties, 'email')
            FROM events e
            JOIN persons p ON e.person_id = p.id
            WHERE JSONExtractString(e.properties, '$os') = 'Mac OS X'
            """;

        // When
        List<PropertyReference> refs = extractor.extract(query(sql));

        // Then
        assertThat(refs).extracting(PropertyReference::table, PropertyReference::propertyPath)
                .containsExactlyInAnyOrder(tuple("persons", "email"), tuple("events", "$os"));
    }

    @Test
    void shouldFindCallsInJoinConditions() throws QueryParseException {
        // Given
        String sql = """
            SELECT count(*) FROM events e
            JOIN sessions s ON JSONExtractString(e.properties, '$session_id') = s.id
            """;

        // When
        List<PropertyReference> refs = extractor.extract(query(sql));

        // Then
        assertThat(refs).extracting(PropertyReference::table, PropertyReference::propertyPath)
                .containsExactly(tuple("events", "$session_id"));
    }

    @Test
    void shouldDescendIntoSubqueriesAndUnions() throws QueryParseException {
        // Given
        String sql = """
            SELECT url FROM (
                SELECT JSONExtractString(properties, '$current_url') AS url FROM events
            ) AS t
            UNION ALL
            SELECT JSONExtractString(properties, '$pathname') FROM pageviews
            """;

        // When
        List<PropertyReference> refs = extractor.extract(query(sql));

        // Then
        assertThat(refs).extracting(PropertyReference::table, PropertyReference::propertyPath)
                .containsExactlyInAnyOrder(tuple("events", "$current_url"), tuple("pageviews", "$pathname"));
    }

    @Test
    void shouldFindNestedCalls() throws QueryParseException {
        // When
        List<PropertyReference> refs = extractor.extract(query(
                "SELECT replaceRegexpAll(JSONExtractRaw(properties, 'utm_source'), '\"', '') FROM events"));

        // Then
        assertThat(refs).containsExactly(new PropertyReference("events", "utm_source"));
    }

    @Test
    void shouldIgnoreExtractionFromOtherColumns() throws QueryParseException {
        // When
        List<PropertyReference> refs = extractor.extract(query(
                "SELECT JSONExtractString(person_properties, 'email') FROM events"));

        // Then
        assertThat(refs).isEmpty();
    }

    @Test
    void shouldIgnoreNonLiteralPaths() throws QueryParseException {
        // When
        List<PropertyReference> refs = extractor.extract(query(
                "SELECT JSONExtractString(properties, key_column) FROM events"));

        // Then
        assertThat(refs).isEmpty();
    }

    @Test
    void shouldMatchFunctionNamesCaseInsensitively() throws QueryParseException {
        // When
        List<PropertyReference> refs = extractor.extract(query(
                "SELECT jsonextractstring(properties, 'a'), JSONHas(properties, 'b') FROM events"));

        // Then
        assertThat(paths(refs)).containsExactly("a", "b");
    }

    @Test
    void shouldFallBackToRecordTableWhenSqlNamesNone() throws QueryParseException {
        // Given
        QueryRecord record = new QueryRecord("q-2", "SELECT JSONExtractString(properties, 'x')",
                5.0, 0, Instant.parse("2026-10-01T12:00:00Z"), "events");

        // When
        List<PropertyReference> refs = extractor.extract(record);

        // Then
        assertThat(refs).containsExactly(new PropertyReference("events", "x"));
    }

    @Test
    void shouldStripClickHouseTrailers() throws QueryParseException {
        // When
        List<PropertyReference> refs = extractor.extract(query(
                "SELECT JSONExtractString(properties, 'plan') FROM events LIMIT 10 SETTINGS max_threads = 4 FORMAT JSONEachRow;"));

        // Then
        assertThat(paths(refs)).containsExactly("plan");
    }

    @Test
    void preprocessShouldRemoveSettingsAndFormat() {
        assertThat(PropertyExtractor.preprocessSql("SELECT 1 FORMAT TabSeparated")).isEqualTo("SELECT 1");
        assertThat(PropertyExtractor.preprocessSql("SELECT 1 SETTINGS max_threads = 2;")).isEqualTo("SELECT 1");
        assertThat(PropertyExtractor.preprocessSql("  SELECT 1  ")).isEqualTo("SELECT 1");
    }

    @Test
    void shouldSkipQueriesWithoutExtractionCalls() throws QueryParseException {
        // Unparseable, but never parsed
        assertThat(extractor.extract(query("SELECT ((( broken"))).isEmpty();
        assertThat(extractor.extract(query(null))).isEmpty();
    }

    @Test
    void shouldReturnEmptyForNonSelectStatements() throws QueryParseException {
        // When
        List<PropertyReference> refs = extractor.extract(query(
                "INSERT INTO summary SELECT JSONExtractString(properties, 'a') FROM events"));

        // Then
        assertThat(refs).isEmpty();
    }

    @Test
    void shouldThrowParseExceptionForMalformedSql() {
        // When/Then
        assertThatThrownBy(() -> extractor.extract(query("SELECT JSONExtractString(properties, 'a' FROM WHERE")))
                .isInstanceOf(QueryParseException.class)
                .hasMessageContaining("q-1")
                .satisfies(e -> assertThat(((QueryParseException) e).getQueryId()).isEqualTo("q-1"));
    }

    @Test
    void shouldHonorConfiguredRawColumn() throws QueryParseException {
        // Given
        PropertyExtractor custom = new PropertyExtractor("attributes");

        // When
        List<PropertyReference> refs = custom.extract(query(
                "SELECT JSONExtractString(attributes, 'region'), JSONExtractString(properties, 'plan') FROM events"));

        // Then
        assertThat(paths(refs)).containsExactly("region");
    }

    @Test
    void shouldReportPathOnceWhenSeveralFunctionsReadIt() throws QueryParseException {
        // When
        List<PropertyReference> refs = extractor.extract(query(
                "SELECT count(*) FROM events WHERE JSONHas(properties, '$x') AND JSONExtractString(properties, '$x') = 'a'"));

        // Then
        assertThat(refs).containsExactly(new PropertyReference("events", "$x"));
    }

    @Test
    void shouldIgnoreEmptyPropertyPath() throws QueryParseException {
        // When
        List<PropertyReference> refs = extractor.extract(query(
                "SELECT JSONExtractString(properties, ''), JSONExtractString(properties, 'a') FROM events"));

        // Then
        assertThat(refs).containsExactly(new PropertyReference("events", "a"));
    }

    @Test
    void shouldIgnoreCallsWithoutAnyTable() throws QueryParseException {
        // Given
        QueryRecord blankTable = new QueryRecord("q-3", "SELECT JSONExtractString(properties, 'x')",
                5.0, 0, Instant.parse("2026-10-01T12:00:00Z"), " ");
        QueryRecord noTable = new QueryRecord("q-4", "SELECT JSONExtractString(properties, 'x')",
                5.0, 0, Instant.parse("2026-10-01T12:00:00Z"), null);

        // When/Then
        assertThat(extractor.extract(blankTable)).isEmpty();
        assertThat(extractor.extract(noTable)).isEmpty();
    }
}
