package org.carball.materializer.backfill;

import lombok.extern.slf4j.Slf4j;
import org.carball.materializer.config.MaterializerConfig;
import org.carball.materializer.database.DatabaseClient;
import org.carball.materializer.database.DatabaseException;
import org.carball.materializer.model.backfill.BackfillJob;
import org.carball.materializer.model.backfill.BackfillState;
import org.carball.materializer.model.candidate.CandidateState;
import org.carball.materializer.model.candidate.MaterializationCandidate;
import org.carball.materializer.model.candidate.MaterializedColumnSpec;
import org.carball.materializer.model.query.PropertyKey;
import org.carball.materializer.state.StateStore;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Populates newly materialized columns for rows written before the column existed.
 * <p>
 * Jobs for different properties run in parallel; the chunks of one job run strictly in order.
 * After each chunk the cursor is persisted, so a restart replays at most the chunk that was in
 * flight. Replaying is harmless because a chunk only recomputes the column from the raw JSON.
 */
@Slf4j
public class BackfillCoordinator {

    private final DatabaseClient databaseClient;
    private final StateStore stateStore;
    private final BackoffPolicy backoffPolicy;
    private final String rawColumn;
    private final int chunkSize;
    private final int maxRetries;
    private final int parallelism;
    private final Duration timeout;

    private final Set<PropertyKey> activeKeys = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean aborted = new AtomicBoolean(false);
    private final AtomicInteger runningJobs = new AtomicInteger();
    private final Object idleMonitor = new Object();

    public BackfillCoordinator(DatabaseClient databaseClient, StateStore stateStore, MaterializerConfig config) {
        this.databaseClient = databaseClient;
        this.stateStore = stateStore;
        this.backoffPolicy = new BackoffPolicy(config.getBackoffInitialMs(), config.getBackoffMaxMs());
        this.rawColumn = config.getRawColumn();
        this.chunkSize = config.getChunkSize();
        this.maxRetries = config.getMaxRetries();
        this.parallelism = config.getBackfillParallelism();
        this.timeout = config.getStatementTimeout();
    }

    /**
     * Creates and persists the job for a candidate whose column was just added. An unfinished job
     * for the same property is returned as is, so a property never has two active jobs.
     */
    public BackfillJob enqueue(MaterializationCandidate candidate) throws DatabaseException {
        Optional<BackfillJob> existing = stateStore.findJob(candidate.getKey());
        if (existing.isPresent() && existing.get().getState() != BackfillState.COMPLETED) {
            log.info("Backfill job for {} already exists at {}%, reusing it",
                    candidate.getKey(), existing.get().getProgressPercent());
            return existing.get();
        }

        Instant upperBound = Instant.now();
        List<String> partitions = databaseClient.listPartitions(candidate.getKey().table(), upperBound, timeout);

        BackfillJob job = BackfillJob.builder()
                .key(candidate.getKey())
                .columnName(candidate.getColumnName())
                .partitions(new ArrayList<>(partitions))
                .nextPartitionIndex(0)
                .upperBound(upperBound)
                .state(BackfillState.RUNNING)
                .createdAt(upperBound)
                .updatedAt(upperBound)
                .build();
        stateStore.saveJob(job);

        log.info("Enqueued backfill of {} over {} partitions", job.getColumnName(), partitions.size());
        return job;
    }

    /**
     * Jobs left unfinished by earlier cycles: interrupted (RUNNING or PAUSED) and FAILED ones, plus
     * jobs for PENDING candidates that never got one because the process stopped in between.
     */
    public List<BackfillJob> resumableJobs() {
        Map<PropertyKey, BackfillJob> jobs = new TreeMap<>();
        for (BackfillJob job : stateStore.jobs()) {
            if (job.getState() != BackfillState.COMPLETED) {
                jobs.put(job.getKey(), job);
            }
        }

        for (MaterializationCandidate candidate : stateStore.candidates()) {
            if (candidate.getState() != CandidateState.PENDING || jobs.containsKey(candidate.getKey())) {
                continue;
            }
            Optional<BackfillJob> completed = stateStore.findJob(candidate.getKey());
            if (completed.isPresent()) {
                // Completed backfill whose candidate update was lost
                markMaterialized(completed.get());
                continue;
            }
            try {
                BackfillJob job = enqueue(candidate);
                jobs.put(job.getKey(), job);
            } catch (DatabaseException e) {
                log.error("Could not create backfill job for pending {}: {}", candidate.getKey(), e.getMessage());
            }
        }

        if (!jobs.isEmpty()) {
            log.info("Resuming {} unfinished backfill jobs", jobs.size());
        }
        return new ArrayList<>(jobs.values());
    }

    /**
     * Runs the jobs on a bounded pool and returns their final states in input order.
     *
     * @param onFinished called from the worker thread after each job stops
     */
    public List<BackfillJob> runAll(Collection<BackfillJob> jobs, Consumer<BackfillJob> onFinished) {
        if (jobs.isEmpty()) {
            return List.of();
        }

        ExecutorService executor = Executors.newFixedThreadPool(
                Math.min(parallelism, jobs.size()),
                new ThreadFactory() {
                    private final AtomicInteger counter = new AtomicInteger();

                    @Override
                    public Thread newThread(Runnable r) {
                        Thread t = new Thread(r);
                        t.setName("backfill-" + counter.incrementAndGet());
                        t.setDaemon(true);
                        return t;
                    }
                });

        Map<BackfillJob, Future<BackfillJob>> futures = new LinkedHashMap<>();
        try {
            for (BackfillJob job : jobs) {
                futures.put(job, executor.submit(() -> {
                    BackfillJob result = run(job);
                    onFinished.accept(result);
                    return result;
                }));
            }

            List<BackfillJob> results = new ArrayList<>();
            for (Map.Entry<BackfillJob, Future<BackfillJob>> entry : futures.entrySet()) {
                results.add(awaitResult(entry.getKey(), entry.getValue()));
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    public List<BackfillJob> runAll(Collection<BackfillJob> jobs) {
        return runAll(jobs, job -> { });
    }

    private BackfillJob awaitResult(BackfillJob job, Future<BackfillJob> future) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            log.error("Backfill of {} stopped unexpectedly", job.getKey(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abort();
            log.warn("Interrupted while waiting for backfill of {}", job.getKey());
        }
        return stateStore.findJob(job.getKey()).orElse(job);
    }

    /**
     * Runs one job's remaining chunks in order until it completes, fails, or is aborted.
     */
    public BackfillJob run(BackfillJob job) {
        if (!activeKeys.add(job.getKey())) {
            log.warn("Backfill of {} is already running, not starting a second one", job.getKey());
            return job;
        }
        runningJobs.incrementAndGet();
        try {
            return runChunks(job);
        } finally {
            activeKeys.remove(job.getKey());
            if (runningJobs.decrementAndGet() == 0) {
                synchronized (idleMonitor) {
                    idleMonitor.notifyAll();
                }
            }
        }
    }

    private BackfillJob runChunks(BackfillJob job) {
        MaterializedColumnSpec spec = new MaterializedColumnSpec(
                job.getKey().table(), job.getColumnName(), rawColumn, job.getKey().propertyPath());

        if (job.getState() != BackfillState.RUNNING) {
            log.info("Resuming backfill of {} from partition {} of {} (was {})",
                    job.getColumnName(), job.getNextPartitionIndex(), job.getPartitions().size(), job.getState());
        }
        job.setAttempts(0);
        job.transitionTo(BackfillState.RUNNING);
        stateStore.saveJob(job);

        while (job.hasRemainingChunks()) {
            if (aborted.get()) {
                return pause(job, "aborted by operator");
            }

            List<String> chunk = job.nextChunk(chunkSize);
            try {
                databaseClient.backfillChunk(spec, chunk, job.getUpperBound(), timeout);
            } catch (BackfillChunkException e) {
                job.setAttempts(job.getAttempts() + 1);
                job.setLastError(e.getMessage());

                if (job.getAttempts() > maxRetries) {
                    job.transitionTo(BackfillState.FAILED);
                    stateStore.saveJob(job);
                    log.error("ALERT: backfill of {} failed after {} attempts at partition {}: {}. "
                                    + "Column stays in place; job resumes next cycle",
                            job.getColumnName(), job.getAttempts(), chunk.get(0), e.getMessage());
                    return job;
                }

                job.transitionTo(BackfillState.PAUSED);
                stateStore.saveJob(job);
                log.warn("Backfill chunk {} of {} failed (attempt {}/{}), retrying in {}ms: {}",
                        chunk, job.getColumnName(), job.getAttempts(), maxRetries + 1,
                        backoffPolicy.delay(job.getAttempts()).toMillis(), e.getMessage());
                try {
                    backoffPolicy.sleep(job.getAttempts());
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    return pause(job, "interrupted during backoff");
                }
                job.transitionTo(BackfillState.RUNNING);
                continue;
            }

            job.setNextPartitionIndex(job.getNextPartitionIndex() + chunk.size());
            job.setAttempts(0);
            job.setLastError(null);
            job.transitionTo(BackfillState.RUNNING);
            stateStore.saveJob(job);
            log.debug("Backfilled {} partitions {} ({}%)", job.getColumnName(), chunk, job.getProgressPercent());
        }

        job.transitionTo(BackfillState.COMPLETED);
        stateStore.saveJob(job);
        markMaterialized(job);
        log.info("Backfill of {}.{} completed over {} partitions",
                job.getKey().table(), job.getColumnName(), job.getPartitions().size());
        return job;
    }

    private BackfillJob pause(BackfillJob job, String reason) {
        job.transitionTo(BackfillState.PAUSED);
        job.setLastError(reason);
        stateStore.saveJob(job);
        log.warn("Backfill of {} paused at partition {} of {}: {}",
                job.getColumnName(), job.getNextPartitionIndex(), job.getPartitions().size(), reason);
        return job;
    }

    private void markMaterialized(BackfillJob job) {
        Optional<MaterializationCandidate> candidate = stateStore.findCandidate(job.getKey());
        if (candidate.isEmpty()) {
            log.warn("Backfill of {} completed but no candidate is recorded for it", job.getKey());
            return;
        }
        candidate.get().transitionTo(CandidateState.MATERIALIZED, null);
        stateStore.saveCandidate(candidate.get());
    }

    /**
     * Stops issuing chunks. Jobs finish the chunk in flight and are left PAUSED.
     */
    public void abort() {
        if (aborted.compareAndSet(false, true)) {
            log.warn("Backfill abort requested; {} jobs will pause after their current chunk", runningJobs.get());
        }
    }

    public boolean isAborted() {
        return aborted.get();
    }

    /**
     * Waits until no job is running.
     *
     * @return false if jobs were still running when the timeout elapsed
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (idleMonitor) {
            while (runningJobs.get() > 0) {
                long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remainingMs <= 0) {
                    return false;
                }
                idleMonitor.wait(remainingMs);
            }
        }
        return true;
    }
}
