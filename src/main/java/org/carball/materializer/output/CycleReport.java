package org.carball.materializer.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.materializer.config.MaterializerConfig;
import org.carball.materializer.model.backfill.BackfillJob;
import org.carball.materializer.model.backfill.BackfillState;
import org.carball.materializer.model.candidate.CandidateState;
import org.carball.materializer.model.candidate.MaterializationCandidate;
import org.carball.materializer.model.query.UsageSummary;
import org.carball.materializer.pipeline.CycleResult;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
public class CycleReport {

    private final CycleResult result;
    private final MaterializerConfig config;
    private final ObjectMapper objectMapper;

    public CycleReport(CycleResult result, MaterializerConfig config) {
        this.result = result;
        this.config = config;

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(buildReportData());
        } catch (Exception e) {
            log.error("Error generating JSON report", e);
            throw new RuntimeException("Failed to generate JSON report", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();

        md.append("# Column Materialization Report\n\n");
        md.append("**Status:** ").append(result.status()).append("  \n");
        md.append("**Started:** ").append(result.startedAt()).append("  \n");
        md.append("**Finished:** ").append(result.finishedAt()).append("  \n");
        md.append("**Profile:** ").append(config.getProfileName()).append("  \n\n");

        if (result.message() != null) {
            md.append("> ").append(result.message()).append("\n\n");
        }

        UsageSummary summary = result.summary();
        if (summary != null) {
            md.append("## Query Log Window\n\n");
            md.append("| Metric | Value |\n");
            md.append("|--------|-------|\n");
            md.append("| Window | ").append(config.getTrailingWindowDays()).append(" days |\n");
            md.append("| Queries Scanned | ").append(summary.recordsScanned()).append(" |\n");
            md.append("| Queries Analyzed | ").append(summary.recordsAnalyzed()).append(" |\n");
            md.append("| Outside Window | ").append(summary.recordsOutsideWindow()).append(" |\n");
            md.append("| Parse Errors | ").append(summary.parseErrors()).append(" |\n");
            md.append("| Properties Seen | ").append(summary.usages().size()).append(" |\n\n");
        }

        md.append("## Selected Candidates\n\n");
        if (result.candidates().isEmpty()) {
            md.append("**No property met the usage threshold of ").append(config.getMinUsageThreshold())
                    .append(" queries.**\n\n");
        } else {
            md.append("| # | Table | Property | Column | Usage | Score | State |\n");
            md.append("|---|-------|----------|--------|-------|-------|-------|\n");
            int rank = 1;
            for (MaterializationCandidate candidate : result.candidates()) {
                md.append("| ").append(rank++)
                        .append(" | ").append(candidate.getKey().table())
                        .append(" | `").append(candidate.getKey().propertyPath()).append('`')
                        .append(" | `").append(candidate.getColumnName()).append('`')
                        .append(" | ").append(candidate.getUsageCount())
                        .append(" | ").append(String.format("%.1f", candidate.getBenefitScore()))
                        .append(" | ").append(candidate.getState())
                        .append(" |\n");
            }
            md.append("\n");
        }

        if (!result.schemaFailures().isEmpty()) {
            md.append("## Needs Manual Review\n\n");
            result.schemaFailures().forEach((column, reason) ->
                    md.append("- **").append(column).append(":** ").append(reason).append("\n"));
            md.append("\n");
        }

        if (!result.jobs().isEmpty()) {
            md.append("## Backfill Jobs\n\n");
            md.append("| Column | Table | State | Progress | Last Error |\n");
            md.append("|--------|-------|-------|----------|------------|\n");
            for (BackfillJob job : result.jobs()) {
                md.append("| `").append(job.getColumnName()).append('`')
                        .append(" | ").append(job.getKey().table())
                        .append(" | ").append(job.getState())
                        .append(" | ").append(job.getNextPartitionIndex()).append('/').append(job.getPartitions().size())
                        .append(" | ").append(job.getLastError() == null ? "" : job.getLastError())
                        .append(" |\n");
            }
            md.append("\n");
        }

        md.append("---\n\n");
        md.append("*Generated by Column Materializer*\n");

        return md.toString();
    }

    private ReportData buildReportData() {
        ReportData report = new ReportData();
        report.setStatus(result.status().name());
        report.setStartedAt(result.startedAt());
        report.setFinishedAt(result.finishedAt());
        report.setProfile(config.getProfileName());
        report.setMessage(result.message());

        if (result.summary() != null) {
            UsageSummary summary = result.summary();
            report.setQueryLog(new QueryLogStats(
                    config.getTrailingWindowDays(),
                    summary.recordsScanned(),
                    summary.recordsAnalyzed(),
                    summary.recordsOutsideWindow(),
                    summary.parseErrors(),
                    summary.usages().size()));
        }

        report.setCandidates(result.candidates().stream()
                .map(candidate -> {
                    CandidateEntry entry = new CandidateEntry();
                    entry.setTable(candidate.getKey().table());
                    entry.setPropertyPath(candidate.getKey().propertyPath());
                    entry.setColumnName(candidate.getColumnName());
                    entry.setUsageCount(candidate.getUsageCount());
                    entry.setBenefitScore(candidate.getBenefitScore());
                    entry.setPriority(candidate.getScoreInterpretation());
                    entry.setState(candidate.getState().name());
                    entry.setFailureReason(candidate.getFailureReason());
                    return entry;
                })
                .collect(Collectors.toList()));

        report.setBackfills(result.jobs().stream()
                .map(job -> {
                    BackfillEntry entry = new BackfillEntry();
                    entry.setTable(job.getKey().table());
                    entry.setColumnName(job.getColumnName());
                    entry.setState(job.getState().name());
                    entry.setPartitionsDone(job.getNextPartitionIndex());
                    entry.setPartitionsTotal(job.getPartitions().size());
                    entry.setLastError(job.getLastError());
                    return entry;
                })
                .collect(Collectors.toList()));

        report.setSchemaFailures(result.schemaFailures());
        report.setTotals(new Totals(
                count(result.candidates(), CandidateState.MATERIALIZED),
                count(result.candidates(), CandidateState.PENDING),
                count(result.candidates(), CandidateState.FAILED),
                result.jobs().stream().filter(job -> job.getState() == BackfillState.FAILED).count()));

        return report;
    }

    private static long count(List<MaterializationCandidate> candidates, CandidateState state) {
        return candidates.stream().filter(c -> c.getState() == state).count();
    }

    // Inner classes for JSON structure
    @lombok.Data
    private static class ReportData {
        private String status;
        private Instant startedAt;
        private Instant finishedAt;
        private String profile;
        private String message;
        private QueryLogStats queryLog;
        private List<CandidateEntry> candidates;
        private List<BackfillEntry> backfills;
        private Map<String, String> schemaFailures;
        private Totals totals;
    }

    @lombok.Data
    @lombok.AllArgsConstructor
    private static class QueryLogStats {
        private int windowDays;
        private int queriesScanned;
        private int queriesAnalyzed;
        private int outsideWindow;
        private int parseErrors;
        private int propertiesSeen;
    }

    @lombok.Data
    private static class CandidateEntry {
        private String table;
        private String propertyPath;
        private String columnName;
        private long usageCount;
        private double benefitScore;
        private String priority;
        private String state;
        private String failureReason;
    }

    @lombok.Data
    private static class BackfillEntry {
        private String table;
        private String columnName;
        private String state;
        private int partitionsDone;
        private int partitionsTotal;
        private String lastError;
    }

    @lombok.Data
    @lombok.AllArgsConstructor
    private static class Totals {
        private long materialized;
        private long pending;
        private long failed;
        private long failedBackfills;
    }
}
