package org.carball.materializer.model.candidate;

import org.carball.materializer.model.query.PropertyKey;

/**
 * Definition of a materialized column computed from one JSON property of a raw column.
 */
public record MaterializedColumnSpec(String table, String columnName, String sourceColumn, String propertyPath) {

    public static MaterializedColumnSpec of(MaterializationCandidate candidate, String sourceColumn) {
        PropertyKey key = candidate.getKey();
        return new MaterializedColumnSpec(key.table(), candidate.getColumnName(), sourceColumn, key.propertyPath());
    }

    /**
     * The extraction expression the column is materialized from. Pure over the raw column.
     */
    public String expression() {
        return "JSONExtractString(" + sourceColumn + ", " + quoteLiteral(propertyPath) + ")";
    }

    public static String quoteLiteral(String value) {
        return "'" + value.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }
}
