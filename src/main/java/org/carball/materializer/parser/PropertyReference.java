package org.carball.materializer.parser;

import org.carball.materializer.model.query.PropertyKey;

/**
 * A property path read from the raw JSON column by one query.
 */
public record PropertyReference(String table, String propertyPath) {

    public PropertyKey toKey() {
        return new PropertyKey(table, propertyPath);
    }
}
