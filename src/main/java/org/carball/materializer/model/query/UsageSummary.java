package org.carball.materializer.model.query;

import java.util.List;

/**
 * Result of aggregating a query log window into per-property usage.
 */
public record UsageSummary(
        List<PropertyUsage> usages,
        int recordsScanned,
        int recordsOutsideWindow,
        int parseErrors
) {

    public int recordsAnalyzed() {
        return recordsScanned - recordsOutsideWindow - parseErrors;
    }
}
