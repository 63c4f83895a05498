package org.carball.materializer.state;

import java.util.Optional;

/**
 * What a query rewriter asks before replacing a JSON extraction with a column reference.
 */
public interface MaterializedColumnLookup {

    /**
     * The materialized column for the property, present only once its backfill completed.
     */
    Optional<String> lookup(String table, String propertyPath);
}
