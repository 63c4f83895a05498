package org.carball.materializer.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.materializer.model.query.PropertyKey;
import org.carball.materializer.model.query.PropertyUsage;
import org.carball.materializer.model.query.QueryRecord;
import org.carball.materializer.model.query.UsageSummary;
import org.carball.materializer.parser.PropertyExtractor;
import org.carball.materializer.parser.PropertyReference;
import org.carball.materializer.parser.QueryParseException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Folds query log records into per-property usage for one trailing window.
 */
@Slf4j
public class UsageAggregator {

    private final PropertyExtractor extractor;

    public UsageAggregator(PropertyExtractor extractor) {
        this.extractor = extractor;
    }

    /**
     * Each property referenced by a query is charged the query's full duration and read bytes.
     * Records before {@code windowStart} are ignored; unparseable ones are counted and skipped.
     */
    public UsageSummary aggregate(List<QueryRecord> records, Instant windowStart) {
        Map<PropertyKey, PropertyUsage> usages = new TreeMap<>();
        int outsideWindow = 0;
        int parseErrors = 0;

        for (QueryRecord record : records) {
            if (record.timestamp() != null && record.timestamp().isBefore(windowStart)) {
                outsideWindow++;
                continue;
            }

            List<PropertyReference> references;
            try {
                references = extractor.extract(record);
            } catch (QueryParseException e) {
                parseErrors++;
                log.debug("Skipping query: {}", e.getMessage());
                continue;
            }

            for (PropertyReference reference : references) {
                usages.computeIfAbsent(reference.toKey(), PropertyUsage::new).record(record);
            }
        }

        if (parseErrors > 0) {
            log.warn("Skipped {} of {} queries that could not be parsed", parseErrors, records.size());
        }
        log.info("Aggregated {} properties from {} queries", usages.size(), records.size() - outsideWindow - parseErrors);

        return new UsageSummary(new ArrayList<>(usages.values()), records.size(), outsideWindow, parseErrors);
    }
}
