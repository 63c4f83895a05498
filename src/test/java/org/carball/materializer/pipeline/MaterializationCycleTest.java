package org.carball.materializer.pipeline;

import org.carball.materializer.config.MaterializerConfig;
import org.carball.materializer.database.ExistingColumn;
import org.carball.materializer.database.InMemoryDatabaseClient;
import org.carball.materializer.model.backfill.BackfillJob;
import org.carball.materializer.model.backfill.BackfillState;
import org.carball.materializer.model.candidate.CandidateState;
import org.carball.materializer.model.candidate.MaterializationCandidate;
import org.carball.materializer.model.query.PropertyKey;
import org.carball.materializer.model.query.QueryRecord;
import org.carball.materializer.querylog.DatabaseQueryLogReader;
import org.carball.materializer.querylog.QueryLogFileReader;
import org.carball.materializer.state.FileCycleLease;
import org.carball.materializer.state.JsonFileStateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class MaterializationCycleTest {

    private static final List<String> PROPERTIES = List.of("plan", "browser", "country", "device", "os");

    @TempDir
    Path stateDir;

    private InMemoryDatabaseClient database;
    private JsonFileStateStore store;
    private MaterializerConfig config;

    @BeforeEach
    void setUp() throws Exception {
        database = new InMemoryDatabaseClient();
        store = new JsonFileStateStore(stateDir);
        config = MaterializerConfig.builder()
                .topN(5)
                .minUsageThreshold(10)
                .maxRetries(1)
                .backoffInitialMs(1)
                .backoffMaxMs(2)
                .backfillParallelism(2)
                .build();

        Instant now = Instant.now();
        Instant old = now.minus(Duration.ofDays(40));
        for (int i = 0; i < 6; i++) {
            String partition = i < 3 ? "202609" : "202610";
            database.insert("events", partition, old.plus(Duration.ofDays(i * 6L)), Map.of(
                    "plan", "plan-" + i,
                    "browser", "browser-" + i,
                    "country", "country-" + i,
                    "device", "device-" + i,
                    "os", "os-" + i));
        }

        // plan is the hottest property, os the coldest
        for (int p = 0; p < PROPERTIES.size(); p++) {
            String property = PROPERTIES.get(p);
            for (int i = 0; i < 50 - p * 8; i++) {
                database.addQuery(new QueryRecord(property + "-" + i,
                        "SELECT count(*) FROM events WHERE JSONExtractString(properties, '" + property + "') = 'x'",
                        250.0, 0, now.minus(Duration.ofHours(1 + i)), "events"));
            }
        }
    }

    private MaterializationCycle cycle() {
        return new MaterializationCycle(config,
                new DatabaseQueryLogReader(database, config.getStatementTimeout()),
                database, store, new FileCycleLease(stateDir, config.getLeaseTtl()));
    }

    private static PropertyKey key(String property) {
        return new PropertyKey("events", property);
    }

    @Test
    void shouldMaterializeEveryCandidateExceptTheConflictingOne() {
        // Given - mat_country already exists as a plain column
        database.defineColumn("events", new ExistingColumn("mat_country", "Int64", "", ""));

        // When
        CycleResult result = cycle().run();

        // Then
        assertThat(result.status()).isEqualTo(CycleResult.Status.COMPLETED);
        assertThat(result.candidates()).extracting(MaterializationCandidate::getColumnName)
                .containsExactly("mat_plan", "mat_browser", "mat_country", "mat_device", "mat_os");
        assertThat(result.schemaFailures()).containsOnlyKeys("mat_country");
        assertThat(result.jobs()).hasSize(4).allMatch(job -> job.getState() == BackfillState.COMPLETED);

        assertThat(store.findCandidate(key("country"))).get()
                .extracting(MaterializationCandidate::getState).isEqualTo(CandidateState.FAILED);
        for (String property : List.of("plan", "browser", "device", "os")) {
            assertThat(store.findCandidate(key(property))).get()
                    .extracting(MaterializationCandidate::getState).isEqualTo(CandidateState.MATERIALIZED);
        }

        assertThat(database.getAddedColumns()).doesNotContain("events.mat_country");
        assertThat(database.rows("events")).allSatisfy(row -> {
            assertThat(row.value("mat_plan")).startsWith("plan-");
            assertThat(row.value("mat_os")).startsWith("os-");
            assertThat(row.value("mat_country")).isNull();
        });
    }

    @Test
    void shouldNotReselectMaterializedProperties() {
        // Given
        cycle().run();
        int columnsAfterFirstCycle = database.getAddedColumns().size();

        // When
        CycleResult second = cycle().run();

        // Then
        assertThat(second.status()).isEqualTo(CycleResult.Status.COMPLETED);
        assertThat(second.candidates()).isEmpty();
        assertThat(second.jobs()).isEmpty();
        assertThat(database.getAddedColumns()).hasSize(columnsAfterFirstCycle);
    }

    @Test
    void shouldSkipWhenAnotherCycleHoldsTheLease() throws Exception {
        // Given
        FileCycleLease other = new FileCycleLease(stateDir, "other-host", Duration.ofHours(1),
                Clock.systemUTC());
        other.acquire();

        // When
        CycleResult result = cycle().run();

        // Then
        assertThat(result.status()).isEqualTo(CycleResult.Status.SKIPPED);
        assertThat(result.message()).contains("other-host");
        assertThat(database.getAddedColumns()).isEmpty();
        assertThat(store.candidates()).isEmpty();
    }

    @Test
    void planShouldRankWithoutChangingAnything() {
        // When
        CycleResult result = cycle().plan();

        // Then
        assertThat(result.status()).isEqualTo(CycleResult.Status.PLANNED);
        assertThat(result.candidates()).hasSize(5)
                .allMatch(c -> c.getState() == CandidateState.NOT_MATERIALIZED);
        assertThat(result.summary().recordsScanned()).isEqualTo(50 + 42 + 34 + 26 + 18);
        assertThat(database.getAddedColumns()).isEmpty();
        assertThat(store.candidates()).isEmpty();
    }

    @Test
    void shouldResumeUnfinishedBackfillsEvenWhenTheQueryLogIsUnavailable() {
        // Given - every chunk of the first cycle fails past its retries
        database.failNextChunks(1_000);
        CycleResult first = cycle().run();
        assertThat(first.jobs()).hasSize(5).allMatch(job -> job.getState() == BackfillState.FAILED);
        assertThat(store.findCandidate(key("plan"))).get()
                .extracting(MaterializationCandidate::getState).isEqualTo(CandidateState.PENDING);

        database.failNextChunks(0);
        database.failQueryLog("query log unavailable");

        // When
        CycleResult second = cycle().run();

        // Then
        assertThat(second.status()).isEqualTo(CycleResult.Status.FAILED);
        assertThat(second.message()).contains("Could not read query log");
        assertThat(second.jobs()).hasSize(5)
                .extracting(BackfillJob::getState).containsOnly(BackfillState.COMPLETED);
        assertThat(store.candidates()).extracting(MaterializationCandidate::getState)
                .containsOnly(CandidateState.MATERIALIZED);
    }

    @Test
    void shouldMaterializeOnlyTheHottestPropertyWithTopNOne() {
        // Given - $current_url is read by 1000 slow queries
        config = config.toBuilder().topN(1).build();
        Instant now = Instant.now();
        database.insert("events", "202610", now.minus(Duration.ofDays(2)), Map.of("$current_url", "/pricing"));
        for (int i = 0; i < 1000; i++) {
            database.addQuery(new QueryRecord("url-" + i,
                    "SELECT count(*) FROM events WHERE JSONExtractString(properties, '$current_url') LIKE '%pricing%'",
                    3000.0, 0, now.minus(Duration.ofMinutes(5 + i)), "events"));
        }

        // When
        CycleResult result = cycle().run();

        // Then
        assertThat(result.status()).isEqualTo(CycleResult.Status.COMPLETED);
        assertThat(result.candidates()).singleElement().satisfies(c -> {
            assertThat(c.getKey()).isEqualTo(key("$current_url"));
            assertThat(c.getColumnName()).isEqualTo("mat_$current_url");
            assertThat(c.getUsageCount()).isEqualTo(1000);
            assertThat(c.getState()).isEqualTo(CandidateState.MATERIALIZED);
        });
        assertThat(database.getAddedColumns()).containsExactly("events.mat_$current_url");
        assertThat(database.rows("events")).anySatisfy(row ->
                assertThat(row.value("mat_$current_url")).isEqualTo("/pricing"));
    }

    @Test
    void shouldResumeBackfillsWhenTheExportedLogHasBadTimestamps() throws Exception {
        // Given - the first cycle leaves every job failed
        database.failNextChunks(1_000);
        cycle().run();
        database.failNextChunks(0);

        Path export = stateDir.resolve("query-log.json");
        Files.writeString(export, """
            {
              "export_metadata": { "database_name": "analytics", "export_timestamp": "2026-10-15T03:00:00Z" },
              "queries": [
                { "query_id": "q-1", "query": "SELECT 1", "query_duration_ms": 1, "event_time": "2026-10-14 10:00:00" }
              ]
            }
            """);
        MaterializationCycle fromFile = new MaterializationCycle(config, new QueryLogFileReader(export),
                database, store, new FileCycleLease(stateDir, config.getLeaseTtl()));

        // When
        CycleResult result = fromFile.run();

        // Then
        assertThat(result.status()).isEqualTo(CycleResult.Status.FAILED);
        assertThat(result.message()).contains("Could not read query log");
        assertThat(result.jobs()).hasSize(5)
                .extracting(BackfillJob::getState).containsOnly(BackfillState.COMPLETED);
    }
}
