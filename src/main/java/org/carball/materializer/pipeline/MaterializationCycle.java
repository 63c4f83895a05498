package org.carball.materializer.pipeline;

import lombok.extern.slf4j.Slf4j;
import org.carball.materializer.analyzer.CandidateRanker;
import org.carball.materializer.analyzer.DurationBenefitEstimator;
import org.carball.materializer.analyzer.UsageAggregator;
import org.carball.materializer.backfill.BackfillCoordinator;
import org.carball.materializer.config.MaterializerConfig;
import org.carball.materializer.database.DatabaseClient;
import org.carball.materializer.database.DatabaseException;
import org.carball.materializer.model.backfill.BackfillJob;
import org.carball.materializer.model.backfill.BackfillState;
import org.carball.materializer.model.candidate.MaterializationCandidate;
import org.carball.materializer.model.query.PropertyKey;
import org.carball.materializer.model.query.QueryRecord;
import org.carball.materializer.model.query.UsageSummary;
import org.carball.materializer.parser.PropertyExtractor;
import org.carball.materializer.querylog.QueryLogException;
import org.carball.materializer.querylog.QueryLogReader;
import org.carball.materializer.schema.ColumnNamer;
import org.carball.materializer.schema.SchemaConflictException;
import org.carball.materializer.schema.SchemaMutator;
import org.carball.materializer.state.CycleLease;
import org.carball.materializer.state.LockContentionException;
import org.carball.materializer.state.StateStore;

import java.io.IOException;
import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * One pass of the pipeline: read the trailing query log, pick the hottest properties, add their
 * columns and backfill them. Only one cycle runs at a time, guarded by the {@link CycleLease}.
 */
@Slf4j
public class MaterializationCycle {

    private final MaterializerConfig config;
    private final QueryLogReader queryLogReader;
    private final StateStore stateStore;
    private final CycleLease lease;
    private final UsageAggregator aggregator;
    private final CandidateRanker ranker;
    private final BackfillCoordinator coordinator;
    private final SchemaMutator mutator;

    public MaterializationCycle(MaterializerConfig config, QueryLogReader queryLogReader,
                                DatabaseClient databaseClient, StateStore stateStore, CycleLease lease) {
        this.config = config;
        this.queryLogReader = queryLogReader;
        this.stateStore = stateStore;
        this.lease = lease;

        this.aggregator = new UsageAggregator(new PropertyExtractor(config.getRawColumn()));
        this.ranker = new CandidateRanker(
                new DurationBenefitEstimator(config.getSavingsRatio(), config.getBytesPerMs()),
                new ColumnNamer(config.getColumnPrefix()),
                config.getMinUsageThreshold(),
                config.getTopN());
        this.coordinator = new BackfillCoordinator(databaseClient, stateStore, config);
        this.mutator = new SchemaMutator(databaseClient, stateStore, coordinator,
                config.getRawColumn(), config.getStatementTimeout());

        log.info("Initialized materialization cycle with {} reading {}", config.getProfileName(),
                queryLogReader.describe());
    }

    public CycleResult run() {
        Instant startedAt = Instant.now();

        try {
            lease.acquire();
        } catch (LockContentionException e) {
            log.info("Skipping cycle: {}", e.getMessage());
            return CycleResult.skipped(startedAt, e.getMessage());
        } catch (IOException e) {
            log.error("Could not acquire cycle lease", e);
            return CycleResult.failed(startedAt, "Could not acquire cycle lease: " + e.getMessage());
        }

        try {
            return runLeased(startedAt);
        } catch (IOException e) {
            coordinator.abort();
            log.error("Cycle aborted: {}", e.getMessage(), e);
            return CycleResult.failed(startedAt, "Cycle aborted: " + e.getMessage());
        } finally {
            lease.release();
        }
    }

    private CycleResult runLeased(Instant startedAt) throws IOException {
        List<BackfillJob> resumed = coordinator.resumableJobs();

        UsageSummary summary = null;
        List<MaterializationCandidate> candidates = List.of();
        Map<String, String> schemaFailures = new LinkedHashMap<>();
        Map<PropertyKey, BackfillJob> jobs = new LinkedHashMap<>();
        resumed.forEach(job -> jobs.put(job.getKey(), job));
        String failure = null;

        try {
            List<QueryRecord> records = readWindow(startedAt);
            lease.renew();

            summary = aggregator.aggregate(records, startedAt.minus(config.getTrailingWindow()));
            candidates = ranker.rank(summary.usages(), stateStore.blockedKeys());

            for (MaterializationCandidate candidate : candidates) {
                stateStore.saveCandidate(candidate);
                try {
                    BackfillJob job = mutator.apply(candidate);
                    jobs.putIfAbsent(job.getKey(), job);
                } catch (SchemaConflictException | DatabaseException e) {
                    schemaFailures.put(candidate.getColumnName(), e.getMessage());
                }
            }
            lease.renew();
        } catch (QueryLogException e) {
            failure = "Could not read query log: " + e.getMessage();
            log.error(failure, e);
        }

        List<BackfillJob> finished = coordinator.runAll(jobs.values(), job -> renewQuietly());
        candidates = candidates.stream()
                .map(candidate -> stateStore.findCandidate(candidate.getKey()).orElse(candidate))
                .collect(Collectors.toList());

        long completed = finished.stream().filter(job -> job.getState() == BackfillState.COMPLETED).count();
        log.info("Cycle finished: {} candidates selected, {} schema failures, {}/{} backfills completed",
                candidates.size(), schemaFailures.size(), completed, finished.size());

        return new CycleResult(
                failure == null ? CycleResult.Status.COMPLETED : CycleResult.Status.FAILED,
                startedAt,
                Instant.now(),
                summary,
                candidates,
                schemaFailures,
                finished,
                failure);
    }

    /**
     * Ranks the current window without touching the schema or the lease.
     */
    public CycleResult plan() {
        Instant startedAt = Instant.now();
        try {
            List<QueryRecord> records = readWindow(startedAt);
            UsageSummary summary = aggregator.aggregate(records, startedAt.minus(config.getTrailingWindow()));
            List<MaterializationCandidate> candidates = ranker.rank(summary.usages(), stateStore.blockedKeys());
            return new CycleResult(CycleResult.Status.PLANNED, startedAt, Instant.now(), summary,
                    candidates, Map.of(), List.of(), null);
        } catch (QueryLogException e) {
            log.error("Could not read query log", e);
            return CycleResult.failed(startedAt, "Could not read query log: " + e.getMessage());
        }
    }

    private List<QueryRecord> readWindow(Instant until) throws QueryLogException {
        Instant since = until.minus(config.getTrailingWindow());
        List<QueryRecord> records = queryLogReader.readQueries(since, until);
        log.info("Read {} queries from {} between {} and {}", records.size(), queryLogReader.describe(), since, until);
        return records;
    }

    private void renewQuietly() {
        try {
            lease.renew();
        } catch (IOException | IllegalStateException e) {
            log.warn("Could not renew cycle lease between backfills: {}", e.getMessage());
        }
    }

    public BackfillCoordinator getCoordinator() {
        return coordinator;
    }
}
