package org.carball.materializer.analyzer;

import org.carball.materializer.model.query.PropertyKey;
import org.carball.materializer.model.query.PropertyUsage;
import org.carball.materializer.model.query.QueryRecord;
import org.carball.materializer.model.query.UsageSummary;
import org.carball.materializer.parser.PropertyExtractor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class UsageAggregatorTest {

    private static final Instant NOW = Instant.parse("2026-10-15T00:00:00Z");
    private static final Instant WINDOW_START = NOW.minus(Duration.ofDays(7));

    private UsageAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = new UsageAggregator(new PropertyExtractor("properties"));
    }

    private static QueryRecord record(String id, String sql, double durationMs, long readBytes, Instant at) {
        return new QueryRecord(id, sql, durationMs, readBytes, at, "events");
    }

    @Test
    void shouldChargeFullCostToEveryReferencedProperty() {
        // Given
        List<QueryRecord> records = List.of(
                record("1", "SELECT JSONExtractString(properties, 'a'), JSONExtractString(properties, 'b') FROM events",
                        100.0, 1000, NOW.minusSeconds(60)),
                record("2", "SELECT JSONExtractString(properties, 'a') FROM events",
                        50.0, 500, NOW.minusSeconds(30)));

        // When
        UsageSummary summary = aggregator.aggregate(records, WINDOW_START);

        // Then
        assertThat(summary.usages()).hasSize(2);
        PropertyUsage a = summary.usages().stream()
                .filter(u -> u.getKey().equals(new PropertyKey("events", "a"))).findFirst().orElseThrow();
        PropertyUsage b = summary.usages().stream()
                .filter(u -> u.getKey().equals(new PropertyKey("events", "b"))).findFirst().orElseThrow();

        assertThat(a.getUsageCount()).isEqualTo(2);
        assertThat(a.getTotalDurationMs()).isEqualTo(150.0);
        assertThat(a.getTotalReadBytes()).isEqualTo(1500);
        assertThat(a.getAverageDurationMs()).isEqualTo(75.0);

        assertThat(b.getUsageCount()).isEqualTo(1);
        assertThat(b.getTotalDurationMs()).isEqualTo(100.0);
    }

    @Test
    void shouldSkipRecordsOutsideTheWindow() {
        // Given
        List<QueryRecord> records = List.of(
                record("old", "SELECT JSONExtractString(properties, 'a') FROM events", 10.0, 0,
                        WINDOW_START.minusSeconds(1)),
                record("new", "SELECT JSONExtractString(properties, 'a') FROM events", 10.0, 0,
                        WINDOW_START));

        // When
        UsageSummary summary = aggregator.aggregate(records, WINDOW_START);

        // Then
        assertThat(summary.recordsOutsideWindow()).isEqualTo(1);
        assertThat(summary.usages()).singleElement()
                .satisfies(u -> assertThat(u.getUsageCount()).isEqualTo(1));
    }

    @Test
    void shouldCountAndSkipUnparseableQueries() {
        // Given
        List<QueryRecord> records = List.of(
                record("bad", "SELECT JSONExtractString(properties, 'a' FROM WHERE", 10.0, 0, NOW),
                record("good", "SELECT JSONExtractString(properties, 'a') FROM events", 10.0, 0, NOW),
                record("plain", "SELECT count(*) FROM events", 10.0, 0, NOW));

        // When
        UsageSummary summary = aggregator.aggregate(records, WINDOW_START);

        // Then
        assertThat(summary.parseErrors()).isEqualTo(1);
        assertThat(summary.recordsScanned()).isEqualTo(3);
        assertThat(summary.recordsAnalyzed()).isEqualTo(2);
        assertThat(summary.usages()).hasSize(1);
    }

    @Test
    void shouldKeepTablesApartForTheSamePath() {
        // Given
        List<QueryRecord> records = List.of(
                new QueryRecord("1", "SELECT JSONExtractString(properties, 'id') FROM events", 1.0, 0, NOW, null),
                new QueryRecord("2", "SELECT JSONExtractString(properties, 'id') FROM persons", 1.0, 0, NOW, null));

        // When
        UsageSummary summary = aggregator.aggregate(records, WINDOW_START);

        // Then
        assertThat(summary.usages()).extracting(PropertyUsage::getKey)
                .containsExactly(new PropertyKey("events", "id"), new PropertyKey("persons", "id"));
    }

    @Test
    void shouldReturnEmptySummaryForEmptyLog() {
        // When
        UsageSummary summary = aggregator.aggregate(List.of(), WINDOW_START);

        // Then
        assertThat(summary.usages()).isEmpty();
        assertThat(summary.recordsAnalyzed()).isZero();
    }

    @Test
    void shouldCountQueryOnceWhenSeveralFunctionsReadTheSameProperty() {
        // Given
        List<QueryRecord> records = List.of(record("1",
                "SELECT count(*) FROM events WHERE JSONHas(properties, '$x') AND JSONExtractString(properties, '$x') = 'a'",
                1000.0, 0, NOW.minusSeconds(60)));

        // When
        UsageSummary summary = aggregator.aggregate(records, WINDOW_START);

        // Then
        assertThat(summary.usages()).singleElement().satisfies(usage -> {
            assertThat(usage.getUsageCount()).isEqualTo(1);
            assertThat(usage.getTotalDurationMs()).isEqualTo(1000.0);
        });
    }

    @Test
    void shouldNotFailOnEmptyPathOrBlankTable() {
        // Given
        List<QueryRecord> records = List.of(
                record("1", "SELECT JSONExtractString(properties, '') FROM events", 10.0, 0, NOW.minusSeconds(60)),
                new QueryRecord("2", "SELECT JSONExtractString(properties, 'b')", 10.0, 0, NOW.minusSeconds(50), ""),
                record("3", "SELECT JSONExtractString(properties, 'a') FROM events", 10.0, 0, NOW.minusSeconds(40)));

        // When
        UsageSummary summary = aggregator.aggregate(records, WINDOW_START);

        // Then
        assertThat(summary.usages()).extracting(PropertyUsage::getKey)
                .containsExactly(new PropertyKey("events", "a"));
        assertThat(summary.recordsScanned()).isEqualTo(3);
        assertThat(summary.parseErrors()).isZero();
    }
}
